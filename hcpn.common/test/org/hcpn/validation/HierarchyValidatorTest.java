package org.hcpn.validation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.hcpn.hierarchy.FusionClass;
import org.hcpn.hierarchy.HierarchicalModel;
import org.hcpn.hierarchy.ModuleRegistry;
import org.hcpn.hierarchy.Nets;
import org.hcpn.hierarchy.PlaceRef;
import org.hcpn.hierarchy.SubstitutionLink;
import org.hcpn.net.Arc;
import org.hcpn.net.Binding;
import org.hcpn.net.ColouredNet;
import org.hcpn.net.Marking;
import org.hcpn.net.NetModule;
import org.hcpn.net.TokenDomain;
import org.hcpn.net.ValueDomain;
import org.junit.Before;
import org.junit.Test;

/**
 * JUnit test for whole-hierarchy validation.
 */
public class HierarchyValidatorTest {

    /**
     * Module whose places can change domain or disappear after registration.
     */
    private static class ReshapedModule implements NetModule {
        private final ColouredNet net;
        private final Map<String, TokenDomain> domains = new HashMap<>();
        private final Set<String> dropped = new HashSet<>();

        ReshapedModule(ColouredNet net) {
            this.net = net;
        }

        void changeDomain(String place, TokenDomain domain) {
            domains.put(place, domain);
        }

        void drop(String place) {
            dropped.add(place);
        }

        @Override
        public List<String> getPlaceNames() {
            List<String> names = new ArrayList<>(net.getPlaceNames());
            names.removeAll(dropped);
            return names;
        }

        @Override
        public List<String> getTransitionNames() {
            return net.getTransitionNames();
        }

        @Override
        public List<Arc> getArcs() {
            return net.getArcs();
        }

        @Override
        public TokenDomain getDomain(String placeName) {
            return domains.containsKey(placeName) ? domains.get(placeName) : net.getDomain(placeName);
        }

        @Override
        public Marking getMarking() {
            return net.getMarking();
        }

        @Override
        public Optional<Binding> findBinding(String transitionName) {
            return net.findBinding(transitionName);
        }

        @Override
        public void fire(String transitionName, Binding binding) {
            net.fire(transitionName, binding);
        }
    }

    private HierarchyValidator validator;
    private ModuleRegistry registry;

    @Before
    public void setUp() throws Exception {
        validator = new HierarchyValidator();
        registry = new ModuleRegistry();
        registry.register("A", Nets.pipe());
        registry.register("B", Nets.pipe());
    }

    private static SubstitutionLink link(String parent, String transition, String child) {
        return new SubstitutionLink(parent, transition, child, Collections.emptyList());
    }

    @Test
    public void testWellFormedModel() throws Exception {
        HierarchicalModel model = new HierarchicalModel();
        model.addModule("Main", Nets.pipe());
        model.addModule("Sub", Nets.pipe());
        model.addSubstitution("Main", "T", "Sub");
        model.fuse(PlaceRef.of("Main", "out"), PlaceRef.of("Sub", "out"));

        ValidationResult result = validator.validate(model);
        assertTrue(result.isValid());
        assertEquals("valid", result.toString());
    }

    @Test
    public void testReportsEveryViolation() {
        List<SubstitutionLink> links = Arrays.asList(
                link("A", "T", "B"),
                link("B", "T", "A"),
                link("A", "Z", "Ghost"));

        ValidationResult result = validator.validateLinks(registry, links);
        assertEquals(3, result.getErrorCount());
        assertEquals(ErrorType.UNKNOWN_MODULE, result.getErrors().get(0).type);
        assertEquals("Ghost", result.getErrors().get(0).nodeId);
        assertEquals(ErrorType.UNKNOWN_TRANSITION, result.getErrors().get(1).type);
        assertEquals("A.Z", result.getErrors().get(1).nodeId);

        List<ValidationError> cycles = result.getErrors(ErrorType.CYCLIC_HIERARCHY);
        assertEquals(1, cycles.size());
        assertEquals("Substitution cycle A -> B -> A", cycles.get(0).message);
    }

    @Test
    public void testSelfSubstitution() {
        ValidationResult result = validator.validateLinks(registry, Arrays.asList(link("A", "T", "A")));
        assertEquals(1, result.getErrors(ErrorType.CYCLIC_HIERARCHY).size());
    }

    @Test
    public void testDuplicateSubstitution() {
        ValidationResult result = validator.validateLinks(registry,
                Arrays.asList(link("A", "T", "B"), link("A", "T", "B")));
        assertEquals(1, result.getErrorCount());
        assertEquals(ErrorType.DUPLICATE_SUBSTITUTION, result.getErrors().get(0).type);
    }

    @Test
    public void testMissingConventionalPort() throws Exception {
        HierarchicalModel model = new HierarchicalModel();
        model.addModule("Main", Nets.pipe());
        model.addModule("Half", new ColouredNet().addPlace("in", ValueDomain.INT));
        model.addSubstitution("Main", "T", "Half");

        ValidationResult result = validator.validate(model);
        assertFalse(result.isValid());
        assertEquals(1, result.getErrorCount());
        ValidationError error = result.getErrors().get(0);
        assertEquals(ErrorType.UNKNOWN_PLACE, error.type);
        assertEquals("Half.out", error.nodeId);
    }

    @Test
    public void testSameInputSameResult() {
        List<SubstitutionLink> links = Arrays.asList(link("A", "T", "B"), link("B", "T", "A"));
        assertEquals(validator.validateLinks(registry, links).getErrors(),
                validator.validateLinks(registry, links).getErrors());
    }

    @Test
    public void testFusionViolationsAfterModulesChange() throws Exception {
        HierarchicalModel model = new HierarchicalModel();
        ReshapedModule sub = new ReshapedModule(Nets.pipe());
        ReshapedModule other = new ReshapedModule(Nets.pipe());
        model.addModule("Main", Nets.pipe());
        model.addModule("Sub", sub);
        model.addModule("Other", other);
        model.addModule("Half", new ColouredNet().addPlace("in", ValueDomain.INT));
        model.addSubstitution("Main", "T", "Half");
        model.fuse(PlaceRef.of("Main", "out"), PlaceRef.of("Sub", "out"));
        model.fuse(PlaceRef.of("Main", "in"), PlaceRef.of("Other", "in"));

        sub.changeDomain("out", ValueDomain.STRING);
        other.drop("in");

        List<ValidationError> errors = validator.validate(model).getErrors();
        assertEquals(3, errors.size());
        assertEquals(ErrorType.UNKNOWN_PLACE, errors.get(0).type);
        assertEquals("Half.out", errors.get(0).nodeId);
        assertEquals(ErrorType.DOMAIN_MISMATCH, errors.get(1).type);
        assertEquals("Sub.out", errors.get(1).nodeId);
        assertEquals(ErrorType.UNKNOWN_PLACE, errors.get(2).type);
        assertEquals("Other.in", errors.get(2).nodeId);
    }

    @Test
    public void testOverlappingAndUndersizedFusionClasses() {
        List<FusionClass> classes = Arrays.asList(
                Nets.fusionClass("F1", ValueDomain.INT, PlaceRef.of("A", "in"), PlaceRef.of("B", "in")),
                Nets.fusionClass("F2", ValueDomain.INT, PlaceRef.of("B", "in")));

        ValidationResult result = validator.validateFusions(registry, classes);
        assertEquals(2, result.getErrorCount());
        assertEquals(ErrorType.UNDERSIZED_FUSION, result.getErrors().get(0).type);
        assertEquals("F2", result.getErrors().get(0).nodeId);
        assertEquals(ErrorType.PLACE_ALREADY_FUSED, result.getErrors().get(1).type);
        assertEquals("B.in", result.getErrors().get(1).nodeId);
    }

    @Test
    public void testFusionOfUnknownModule() {
        ValidationResult result = validator.validateFusions(registry, Arrays.asList(
                Nets.fusionClass("F1", ValueDomain.INT, PlaceRef.of("A", "in"), PlaceRef.of("Ghost", "in"))));
        assertEquals(1, result.getErrorCount());
        assertEquals(ErrorType.UNKNOWN_MODULE, result.getErrors().get(0).type);
    }
}
