package org.hcpn.execution;

import java.util.*;

import org.apache.log4j.Logger;
import org.hcpn.constants.HierarchyConstants;
import org.hcpn.exceptions.HierarchyException;
import org.hcpn.exceptions.UnknownTransitionException;
import org.hcpn.hierarchy.HierarchicalModel;
import org.hcpn.hierarchy.SubstitutionLink;
import org.hcpn.logger.HierarchyEventLogger;
import org.hcpn.net.Arc;
import org.hcpn.net.Binding;
import org.hcpn.net.NetModule;
import org.hcpn.validation.HierarchyValidator;

/**
 * HierarchicalExecutor - substitution firing protocol
 *
 * Ordinary transitions are fired by the module's own engine. A substitution
 * transition t of parent P, linked to child C, fires as one atomic step of P:
 *
 * 1. t is enabled iff the engine finds a binding for t against P's marking.
 * 2. The tokens the binding consumes are taken from P's input sockets and
 *    put on the entry ports of C they are bound to.
 * 3. C is stepped (nested substitution transitions recurse the same way)
 *    until every exit port holds one token per output arc of t bound to it.
 * 4. One token per output arc is withdrawn from its exit port, oldest first,
 *    and put on the output socket in P.
 *
 * If C becomes quiescent first, or exceeds the descent step limit, the
 * attempt is a SubstitutionStall: every marking of the model, fused
 * multisets included, is restored and t counts as not fired. A runtime
 * exception thrown by an engine during the descent restores the markings the
 * same way before it propagates. Observers of P see either nothing or the
 * whole effect.
 *
 * Execution is synchronous; a descent is an ordinary call chain. Transitions
 * of one module are tried in declaration order, so runs are reproducible.
 */
public class HierarchicalExecutor {
    private static final Logger logger = Logger.getLogger(HierarchicalExecutor.class);

    private final HierarchicalModel model;
    private final HierarchyValidator validator = new HierarchyValidator();
    private final HierarchyEventLogger events = new HierarchyEventLogger();
    private final int maxDescentSteps;
    private final boolean validateBeforeRun;

    private long validatedVersion = -1;

    public HierarchicalExecutor(HierarchicalModel model) {
        this(model, HierarchyConstants.maxDescentSteps(), HierarchyConstants.validateBeforeRun());
    }

    public HierarchicalExecutor(HierarchicalModel model, int maxDescentSteps, boolean validateBeforeRun) {
        this.model = Objects.requireNonNull(model, "model cannot be null");
        if (maxDescentSteps <= 0) {
            throw new IllegalArgumentException("maxDescentSteps must be positive: " + maxDescentSteps);
        }
        this.maxDescentSteps = maxDescentSteps;
        this.validateBeforeRun = validateBeforeRun;
    }

    // ========== Entry Points ==========

    /**
     * Attempt to fire one transition of a module.
     *
     * @throws HierarchyException if the module or transition is unknown, or the
     *         hierarchy changed since the last validation and is not well-formed
     */
    public FiringResult fire(String moduleName, String transitionName) throws HierarchyException {
        ensureValid();
        NetModule module = model.getRegistry().lookup(moduleName);
        if (!module.hasTransition(transitionName)) {
            throw new UnknownTransitionException(moduleName, transitionName);
        }
        return fireAt(moduleName, module, transitionName, 0);
    }

    /**
     * Fire the first transition of the module, in declaration order, whose
     * firing succeeds. Stalled substitution transitions are skipped. Returns a
     * NOT_ENABLED result when the module is quiescent.
     */
    public FiringResult step(String moduleName) throws HierarchyException {
        ensureValid();
        NetModule module = model.getRegistry().lookup(moduleName);
        return stepAt(moduleName, module, 0);
    }

    /**
     * Step the module until it is quiescent or {@code maxSteps} firings happened.
     *
     * @return number of firings
     */
    public int run(String moduleName, int maxSteps) throws HierarchyException {
        int fired = 0;
        while (fired < maxSteps) {
            FiringResult result = step(moduleName);
            if (!result.isFired()) {
                break;
            }
            fired++;
        }
        logger.info("Run of " + moduleName + " finished after " + fired + " firings");
        return fired;
    }

    public HierarchyEventLogger getEventLogger() {
        return events;
    }

    // ========== Protocol ==========

    private void ensureValid() throws HierarchyException {
        if (!validateBeforeRun || validatedVersion == model.getStructureVersion()) {
            return;
        }
        validator.validateOrThrow(model);
        validatedVersion = model.getStructureVersion();
    }

    private FiringResult stepAt(String moduleName, NetModule module, int depth) {
        for (String transition : module.getTransitionNames()) {
            if (!module.isEnabled(transition)) {
                continue;
            }
            FiringResult result = fireAt(moduleName, module, transition, depth);
            if (result.isFired()) {
                return result;
            }
        }
        return FiringResult.quiescent(moduleName);
    }

    private FiringResult fireAt(String moduleName, NetModule module, String transition, int depth) {
        Optional<Binding> binding = module.findBinding(transition);
        if (!binding.isPresent()) {
            events.logNotEnabled(moduleName, transition, depth);
            return FiringResult.notEnabled(moduleName, transition);
        }

        Optional<SubstitutionLink> link = model.getSubstitutions().getLink(moduleName, transition);
        if (!link.isPresent()) {
            module.fire(transition, binding.get());
            events.logFired(moduleName, transition, depth, binding.get().getVariables());
            return FiringResult.fired(moduleName, transition);
        }
        return fireSubstitution(moduleName, module, transition, binding.get(), link.get(), depth);
    }

    private FiringResult fireSubstitution(String moduleName, NetModule parent, String transition,
                                          Binding binding, SubstitutionLink link, int depth) {
        String childName = link.childModule;
        NetModule child = model.getModule(childName)
            .orElseThrow(() -> new IllegalStateException("Child module " + childName + " not registered"));
        MarkingSnapshot snapshot = MarkingSnapshot.capture(model);

        try {
            // Input sockets -> entry ports
            Map<String, List<Object>> deposited = new LinkedHashMap<>();
            for (Map.Entry<String, List<Object>> entry : binding.getConsumed().entrySet()) {
                String socket = entry.getKey();
                String port = link.getEntryPort(socket);
                parent.getMarking().removeTokens(socket, entry.getValue());
                child.getMarking().addTokens(port, entry.getValue());
                deposited.computeIfAbsent(port, p -> new ArrayList<>()).addAll(entry.getValue());
            }
            events.logDescend(moduleName, transition, childName, depth, deposited);

            // Tokens each exit port must hold before control returns
            Map<String, Integer> demand = new LinkedHashMap<>();
            List<Arc> outputArcs = parent.getOutputArcs(transition);
            for (Arc arc : outputArcs) {
                demand.merge(link.getExitPort(arc.place), 1, Integer::sum);
            }

            int childSteps = 0;
            String stallReason = null;
            while (!exitPortsReady(child, demand)) {
                if (childSteps >= maxDescentSteps) {
                    stallReason = "descent step limit " + maxDescentSteps + " reached";
                    break;
                }
                FiringResult inner = stepAt(childName, child, depth + 1);
                if (!inner.isFired()) {
                    stallReason = "child quiescent with exit ports " + demand.keySet() + " unfilled";
                    break;
                }
                childSteps++;
            }

            if (stallReason != null) {
                events.logStall(moduleName, transition, childName, depth, stallReason);
                snapshot.restore();
                events.logRollback(moduleName, transition, depth);
                return FiringResult.stalled(moduleName, transition, childName, childSteps, stallReason);
            }

            // Exit ports -> output sockets
            Map<String, List<Object>> returned = new LinkedHashMap<>();
            for (Arc arc : outputArcs) {
                Object token = child.getMarking().getTokens(link.getExitPort(arc.place)).removeFirst();
                parent.getMarking().getTokens(arc.place).add(token);
                returned.computeIfAbsent(arc.place, p -> new ArrayList<>()).add(token);
            }
            events.logReturn(moduleName, transition, childName, depth, returned);
            events.logFired(moduleName, transition, depth, binding.getVariables());
            return FiringResult.firedSubstitution(moduleName, transition, childName, childSteps);
        } catch (RuntimeException e) {
            snapshot.restore();
            events.logRollback(moduleName, transition, depth);
            logger.error("Substitution " + moduleName + "." + transition
                    + " aborted by the engine, markings restored", e);
            throw e;
        }
    }

    private static boolean exitPortsReady(NetModule child, Map<String, Integer> demand) {
        for (Map.Entry<String, Integer> entry : demand.entrySet()) {
            if (child.getMarking().getTokens(entry.getKey()).size() < entry.getValue()) {
                return false;
            }
        }
        return true;
    }
}
