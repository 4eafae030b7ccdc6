package org.hcpn.execution;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.hcpn.exceptions.HierarchyValidationException;
import org.hcpn.exceptions.UnknownModuleException;
import org.hcpn.exceptions.UnknownTransitionException;
import org.hcpn.hierarchy.HierarchicalModel;
import org.hcpn.hierarchy.Nets;
import org.hcpn.hierarchy.PlaceRef;
import org.hcpn.hierarchy.PortBinding;
import org.hcpn.logger.HierarchyEvent;
import org.hcpn.net.ColouredNet;
import org.hcpn.net.ValueDomain;
import org.junit.Before;
import org.junit.Test;

/**
 * JUnit test for the substitution firing protocol.
 */
public class HierarchicalExecutorTest {

    private HierarchicalModel model;
    private ColouredNet main;

    @Before
    public void setUp() throws Exception {
        model = new HierarchicalModel();
        main = Nets.pipe();
        model.addModule("Main", main);
    }

    /** Child whose only transition moves entry tokens to a dead end. */
    private static ColouredNet deadEnd() {
        return new ColouredNet()
            .addPlace("in", ValueDomain.INT)
            .addPlace("out", ValueDomain.INT)
            .addPlace("sink", ValueDomain.INT)
            .addTransition("work")
            .addArc("in", "work", "x")
            .addArc("work", "sink", "x");
    }

    /** Child whose transition produces an INT into a STRING place, so its engine throws. */
    private static ColouredNet mistyped() {
        return new ColouredNet()
            .addPlace("in", ValueDomain.INT)
            .addPlace("out", ValueDomain.INT)
            .addPlace("mid", ValueDomain.STRING)
            .addTransition("work")
            .addArc("in", "work", "x")
            .addArc("work", "mid", "x");
    }

    private static List<Object> tokens(ColouredNet net, String place) {
        return net.getMarking().getTokens(place).getTokens();
    }

    @Test
    public void testOrdinaryTransition() throws Exception {
        main.addTokens("in", 4);
        HierarchicalExecutor executor = new HierarchicalExecutor(model);

        FiringResult result = executor.fire("Main", "T");
        assertTrue(result.isFired());
        assertNull(result.getChildModule());
        assertEquals(Arrays.asList(4), tokens(main, "out"));
    }

    @Test
    public void testSubstitutionMovesTokensThroughChild() throws Exception {
        ColouredNet sub = Nets.pipe("work");
        model.addModule("Sub", sub);
        model.addSubstitution("Main", "T", "Sub");
        main.addTokens("in", 4);
        HierarchicalExecutor executor = new HierarchicalExecutor(model);

        FiringResult result = executor.fire("Main", "T");

        assertTrue(result.isFired());
        assertEquals("Sub", result.getChildModule());
        assertEquals(1, result.getChildSteps());
        assertTrue(main.getMarking().getTokens("in").isEmpty());
        assertEquals(Arrays.asList(4), tokens(main, "out"));
        assertTrue(sub.getMarking().isEmpty());

        List<HierarchyEvent> events = executor.getEventLogger().getEventHistory();
        assertEquals(HierarchyEvent.Type.DESCEND, events.get(0).getType());
        assertEquals(HierarchyEvent.Type.FIRED, events.get(1).getType());
        assertEquals("Sub", events.get(1).getModule());
        assertEquals(1, events.get(1).getDepth());
        assertEquals(HierarchyEvent.Type.RETURN, events.get(2).getType());
        assertEquals(HierarchyEvent.Type.FIRED, events.get(3).getType());
        assertEquals("Main", events.get(3).getModule());
    }

    @Test
    public void testExplicitPortBindings() throws Exception {
        ColouredNet sub = new ColouredNet()
            .addPlace("start", ValueDomain.INT)
            .addPlace("finish", ValueDomain.INT)
            .addTransition("work")
            .addArc("start", "work", "x")
            .addArc("work", "finish", "x");
        model.addModule("Sub", sub);
        model.addSubstitution("Main", "T", "Sub",
                PortBinding.input("in", "start"), PortBinding.output("out", "finish"));
        main.addTokens("in", 9);

        FiringResult result = new HierarchicalExecutor(model).fire("Main", "T");
        assertTrue(result.isFired());
        assertEquals(Arrays.asList(9), tokens(main, "out"));
    }

    @Test
    public void testNestedSubstitution() throws Exception {
        ColouredNet mid = Nets.pipe();
        ColouredNet leaf = Nets.pipe("work");
        model.addModule("Mid", mid);
        model.addModule("Leaf", leaf);
        model.addSubstitution("Main", "T", "Mid");
        model.addSubstitution("Mid", "T", "Leaf");
        main.addTokens("in", 2);
        HierarchicalExecutor executor = new HierarchicalExecutor(model);

        FiringResult result = executor.fire("Main", "T");

        assertTrue(result.isFired());
        assertEquals(Arrays.asList(2), tokens(main, "out"));
        assertTrue(mid.getMarking().isEmpty());
        assertTrue(leaf.getMarking().isEmpty());
        assertEquals(2, executor.getEventLogger().getEvents(HierarchyEvent.Type.DESCEND).size());
        assertEquals(2, executor.getEventLogger().getEvents(HierarchyEvent.Type.RETURN).size());
    }

    @Test
    public void testStallRestoresEveryMarking() throws Exception {
        ColouredNet sub = deadEnd();
        model.addModule("Sub", sub);
        model.addSubstitution("Main", "T", "Sub");
        main.addTokens("in", 4);
        HierarchicalExecutor executor = new HierarchicalExecutor(model);

        FiringResult first = executor.fire("Main", "T");
        assertTrue(first.isStalled());
        assertEquals(FiringOutcome.STALLED, first.getOutcome());
        assertEquals(1, first.getChildSteps());
        assertEquals(Arrays.asList(4), tokens(main, "in"));
        assertTrue(main.getMarking().getTokens("out").isEmpty());
        assertTrue(sub.getMarking().isEmpty());

        FiringResult second = executor.fire("Main", "T");
        assertTrue(second.isStalled());
        assertEquals(first.getReason(), second.getReason());
        assertEquals(Arrays.asList(4), tokens(main, "in"));
        assertEquals(2, executor.getEventLogger().getEvents(HierarchyEvent.Type.ROLLBACK).size());
    }

    @Test
    public void testStallRestoresFusedPlaces() throws Exception {
        main.addPlace("log", ValueDomain.INT);
        ColouredNet sub = deadEnd();
        model.addModule("Sub", sub);
        model.addSubstitution("Main", "T", "Sub");
        model.fuse(PlaceRef.of("Main", "log"), PlaceRef.of("Sub", "sink"));
        main.addTokens("in", 4);

        assertTrue(new HierarchicalExecutor(model).fire("Main", "T").isStalled());
        assertTrue(main.getMarking().getTokens("log").isEmpty());

        sub.getMarking().getTokens("sink").add(1);
        assertEquals(Arrays.asList(1), tokens(main, "log"));
    }

    @Test
    public void testDescentStepLimit() throws Exception {
        ColouredNet spinner = new ColouredNet()
            .addPlace("in", ValueDomain.INT)
            .addPlace("out", ValueDomain.INT)
            .addTransition("spin")
            .addArc("in", "spin", "x")
            .addArc("spin", "in", "x");
        model.addModule("Sub", spinner);
        model.addSubstitution("Main", "T", "Sub");
        main.addTokens("in", 1);

        FiringResult result = new HierarchicalExecutor(model, 5, true).fire("Main", "T");
        assertTrue(result.isStalled());
        assertEquals(5, result.getChildSteps());
        assertTrue(result.getReason().contains("descent step limit"));
        assertEquals(Arrays.asList(1), tokens(main, "in"));
        assertTrue(spinner.getMarking().isEmpty());
    }

    @Test
    public void testStepSkipsStalledSubstitution() throws Exception {
        main.addTransition("bypass");
        main.addArc("in", "bypass", "x");
        main.addArc("bypass", "out", "x");
        model.addModule("Sub", deadEnd());
        model.addSubstitution("Main", "T", "Sub");
        main.addTokens("in", 7);

        FiringResult result = new HierarchicalExecutor(model).step("Main");
        assertTrue(result.isFired());
        assertEquals("bypass", result.getTransition());
        assertEquals(Arrays.asList(7), tokens(main, "out"));
    }

    @Test
    public void testRunUntilQuiescent() throws Exception {
        model.addModule("Sub", Nets.pipe("work"));
        model.addSubstitution("Main", "T", "Sub");
        main.addTokens("in", 1, 2, 3);
        HierarchicalExecutor executor = new HierarchicalExecutor(model);

        assertEquals(3, executor.run("Main", 10));
        assertEquals(Arrays.asList(1, 2, 3), tokens(main, "out"));

        FiringResult idle = executor.step("Main");
        assertFalse(idle.isFired());
        assertEquals(FiringOutcome.NOT_ENABLED, idle.getOutcome());
    }

    @Test
    public void testRunHonoursMaxSteps() throws Exception {
        main.addTokens("in", 1, 2, 3);
        assertEquals(2, new HierarchicalExecutor(model).run("Main", 2));
        assertEquals(Arrays.asList(3), tokens(main, "in"));
    }

    @Test
    public void testNotEnabled() throws Exception {
        FiringResult result = new HierarchicalExecutor(model).fire("Main", "T");
        assertEquals(FiringOutcome.NOT_ENABLED, result.getOutcome());
        assertEquals("T", result.getTransition());
    }

    @Test
    public void testInvalidHierarchyIsRefused() throws Exception {
        model.addModule("Half", new ColouredNet().addPlace("in", ValueDomain.INT));
        model.addSubstitution("Main", "T", "Half");
        main.addTokens("in", 1);

        HierarchyValidationException e = assertThrows(HierarchyValidationException.class,
                () -> new HierarchicalExecutor(model).fire("Main", "T"));
        assertEquals(1, e.getResult().getErrorCount());
        assertEquals(Arrays.asList(1), tokens(main, "in"));
    }

    @Test
    public void testUnknownTargets() {
        HierarchicalExecutor executor = new HierarchicalExecutor(model);
        assertThrows(UnknownModuleException.class, () -> executor.fire("Ghost", "T"));
        assertThrows(UnknownTransitionException.class, () -> executor.fire("Main", "Nope"));
    }

    @Test
    public void testDescentLimitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new HierarchicalExecutor(model, 0, true));
    }

    @Test
    public void testEngineFailureRestoresMarkings() throws Exception {
        ColouredNet sub = mistyped();
        model.addModule("Sub", sub);
        model.addSubstitution("Main", "T", "Sub");
        main.addTokens("in", 4);
        HierarchicalExecutor executor = new HierarchicalExecutor(model);

        assertThrows(IllegalStateException.class, () -> executor.fire("Main", "T"));
        assertEquals(Arrays.asList(4), tokens(main, "in"));
        assertTrue(main.getMarking().getTokens("out").isEmpty());
        assertTrue(sub.getMarking().isEmpty());
        assertEquals(1, executor.getEventLogger().getEvents(HierarchyEvent.Type.ROLLBACK).size());
    }

    @Test
    public void testEngineFailureInNestedDescent() throws Exception {
        ColouredNet mid = Nets.pipe();
        ColouredNet leaf = mistyped();
        model.addModule("Mid", mid);
        model.addModule("Leaf", leaf);
        model.addSubstitution("Main", "T", "Mid");
        model.addSubstitution("Mid", "T", "Leaf");
        main.addTokens("in", 4);
        HierarchicalExecutor executor = new HierarchicalExecutor(model);

        assertThrows(IllegalStateException.class, () -> executor.fire("Main", "T"));
        assertEquals(Arrays.asList(4), tokens(main, "in"));
        assertTrue(mid.getMarking().isEmpty());
        assertTrue(leaf.getMarking().isEmpty());
        assertEquals(2, executor.getEventLogger().getEvents(HierarchyEvent.Type.ROLLBACK).size());
    }

    @Test
    public void testReadSocketReturnsWithoutChildSteps() throws Exception {
        ColouredNet reader = new ColouredNet()
            .addPlace("p", ValueDomain.INT)
            .addTransition("T")
            .addArc("p", "T", "x")
            .addArc("T", "p", "x");
        ColouredNet sub = new ColouredNet()
            .addPlace("p", ValueDomain.INT)
            .addPlace("seen", ValueDomain.INT)
            .addTransition("work")
            .addArc("p", "work", "x")
            .addArc("work", "seen", "x");
        model.addModule("Reader", reader);
        model.addModule("Sub", sub);
        model.addSubstitution("Reader", "T", "Sub");
        reader.addTokens("p", 6);

        FiringResult result = new HierarchicalExecutor(model).fire("Reader", "T");
        assertTrue(result.isFired());
        assertEquals(0, result.getChildSteps());
        assertEquals(Arrays.asList(6), tokens(reader, "p"));
        assertTrue(sub.getMarking().isEmpty());
    }

    @Test
    public void testReadSocketRoutedThroughChild() throws Exception {
        ColouredNet reader = new ColouredNet()
            .addPlace("p", ValueDomain.INT)
            .addTransition("T")
            .addArc("p", "T", "x")
            .addArc("T", "p", "x");
        ColouredNet sub = new ColouredNet()
            .addPlace("p", ValueDomain.INT)
            .addPlace("seen", ValueDomain.INT)
            .addTransition("work")
            .addArc("p", "work", "x")
            .addArc("work", "seen", "x");
        model.addModule("Reader", reader);
        model.addModule("Sub", sub);
        model.addSubstitution("Reader", "T", "Sub",
                PortBinding.input("p", "p"), PortBinding.output("p", "seen"));
        reader.addTokens("p", 6);

        FiringResult result = new HierarchicalExecutor(model).fire("Reader", "T");
        assertTrue(result.isFired());
        assertEquals(1, result.getChildSteps());
        assertEquals(Arrays.asList(6), tokens(reader, "p"));
        assertTrue(sub.getMarking().isEmpty());
    }
}
