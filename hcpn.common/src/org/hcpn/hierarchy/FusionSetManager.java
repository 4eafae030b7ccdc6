package org.hcpn.hierarchy;

import java.util.*;

import org.apache.log4j.Logger;
import org.hcpn.exceptions.DomainMismatchException;
import org.hcpn.exceptions.HierarchyException;
import org.hcpn.exceptions.PlaceAlreadyFusedException;
import org.hcpn.exceptions.UnknownPlaceException;
import org.hcpn.net.Multiset;
import org.hcpn.net.NetModule;
import org.hcpn.net.TokenDomain;

/**
 * Fusion Set Manager
 * 
 * Groups (module, place) references into fusion classes. Classes partition
 * the fused places: a place joins at most one class. When a class is formed
 * its shared multiset is seeded with the tokens the members held at that
 * moment (in reference order) and every member place becomes a view on it.
 */
public class FusionSetManager {
    private static final Logger logger = Logger.getLogger(FusionSetManager.class);
    
    private final ModuleRegistry registry;
    private final List<FusionClass> fusionClasses = new ArrayList<>();
    private final Map<PlaceRef, FusionClass> placeIndex = new HashMap<>();
    
    public FusionSetManager(ModuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }
    
    /**
     * @throws HierarchyException UnknownModule, UnknownPlace, PlaceAlreadyFused
     *         or DomainMismatch; nothing is changed when it is thrown
     */
    public FusionClass fuse(List<PlaceRef> refs) throws HierarchyException {
        Objects.requireNonNull(refs, "refs cannot be null");
        
        Set<PlaceRef> seen = new HashSet<>();
        TokenDomain domain = null;
        PlaceRef first = null;
        for (PlaceRef ref : refs) {
            NetModule module = registry.lookup(ref.module);
            if (!module.hasPlace(ref.place)) {
                throw new UnknownPlaceException(ref.module, ref.place);
            }
            if (placeIndex.containsKey(ref) || !seen.add(ref)) {
                throw new PlaceAlreadyFusedException(ref.module, ref.place);
            }
            TokenDomain placeDomain = module.getDomain(ref.place);
            if (domain == null) {
                domain = placeDomain;
                first = ref;
            } else if (!domain.isCompatibleWith(placeDomain) || !placeDomain.isCompatibleWith(domain)) {
                logger.warn("Domain mismatch fusing " + ref + " with " + first);
                throw new DomainMismatchException(ref.module, ref.place, 
                        String.valueOf(domain), String.valueOf(placeDomain));
            }
        }
        if (seen.size() < 2) {
            throw new IllegalArgumentException("A fusion class needs at least two places, got " + refs);
        }
        
        Multiset shared = new Multiset();
        for (PlaceRef ref : refs) {
            shared.addAll(registry.lookup(ref.module).getMarking().getTokens(ref.place).getTokens());
        }
        
        FusionClass fusionClass = new FusionClass("F" + (fusionClasses.size() + 1), refs, domain, shared);
        for (PlaceRef ref : refs) {
            registry.lookup(ref.module).getMarking().attach(ref.place, shared);
            placeIndex.put(ref, fusionClass);
        }
        fusionClasses.add(fusionClass);
        logger.info("Fusion class " + fusionClass.id + " created for " + refs);
        return fusionClass;
    }
    
    public Optional<FusionClass> classOf(String module, String place) {
        return Optional.ofNullable(placeIndex.get(new PlaceRef(module, place)));
    }
    
    /**
     * The one multiset all members of the class share. This is the live
     * instance, not a copy.
     */
    public Multiset mergedMarking(FusionClass fusionClass) {
        if (!fusionClasses.contains(fusionClass)) {
            throw new IllegalArgumentException("Fusion class " + fusionClass.id + " is not managed here");
        }
        return fusionClass.getSharedTokens();
    }
    
    public List<FusionClass> getFusionClasses() {
        return Collections.unmodifiableList(fusionClasses);
    }
}
