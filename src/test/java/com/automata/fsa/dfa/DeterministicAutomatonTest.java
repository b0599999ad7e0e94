package com.automata.fsa.dfa;

import com.automata.fsa.api.RunStatus;
import com.automata.fsa.engine.AutomatonRunner;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class DeterministicAutomatonTest {

    // Binary numbers divisible by 3, states = remainder
    private DeterministicAutomaton mod3;
    private int r0, r1, r2;

    @Before
    public void setUp() {
        DeterministicAutomaton.Builder b = DeterministicAutomaton.builder();
        r0 = b.addState("r0", true);
        r1 = b.addState("r1");
        r2 = b.addState("r2");
        b.addTransition(r0, "0", r0).addTransition(r0, "1", r1)
                .addTransition(r1, "0", r2).addTransition(r1, "1", r0)
                .addTransition(r2, "0", r1).addTransition(r2, "1", r2)
                .start(r0);
        mod3 = b.build();
    }

    @Test
    public void testErrorStateAppended() {
        assertEquals(4, mod3.stateCount());
        assertEquals(3, mod3.errorState());
        assertEquals(DeterministicAutomaton.DEFAULT_ERROR_STATE, mod3.stateName(mod3.errorState()));
        assertFalse(mod3.isAccepting(mod3.errorState()));
    }

    @Test
    public void testStepIsTotal() {
        assertEquals(r1, mod3.step(r0, "1"));
        assertEquals(mod3.errorState(), mod3.step(r0, "2"));
        assertEquals(mod3.errorState(), mod3.step(r2, "unknown"));
    }

    @Test
    public void testErrorStateAbsorbs() {
        int err = mod3.errorState();
        for (String symbol : List.of("0", "1", "x", "anything"))
            assertEquals(err, mod3.step(err, symbol));
    }

    @Test
    public void testPartialDefinitionFallsToError() {
        DeterministicAutomaton.Builder b = DeterministicAutomaton.builder();
        int s = b.addState("s");
        int t = b.addState("t", true);
        b.addTransition(s, "go", t).addSymbol("stop").start(s);
        DeterministicAutomaton d = b.build();

        assertEquals(d.errorState(), d.step(s, "stop"));
        assertEquals(d.errorState(), d.step(t, "go"));
        assertTrue(d.isError(d.step(t, "go")));
    }

    @Test
    public void testAccepts() {
        assertTrue(mod3.accepts(AutomatonRunner.symbols("0")));
        assertTrue(mod3.accepts(AutomatonRunner.symbols("11")));
        assertTrue(mod3.accepts(AutomatonRunner.symbols("1001")));
        assertFalse(mod3.accepts(AutomatonRunner.symbols("100")));
        assertFalse(mod3.accepts(AutomatonRunner.symbols("11x")));
    }

    @Test
    public void testRunnerKeepsSingleActiveState() {
        DfaRunner runner = new DfaRunner(mod3);
        Random rnd = new Random(42);
        String[] symbols = { "0", "1", "?" };
        for (int run = 0; run < 50; run++) {
            runner.reset();
            assertEquals(1, runner.activeStates().size());
            int len = rnd.nextInt(20);
            for (int i = 0; i < len; i++) {
                runner.step(symbols[rnd.nextInt(symbols.length)]);
                assertEquals(1, runner.activeStates().size());
                assertTrue(runner.activeStates().contains(runner.currentState()));
            }
        }
    }

    @Test
    public void testRunnerResult() {
        DfaRunner runner = new DfaRunner(mod3);
        assertTrue(runner.run(AutomatonRunner.symbols("110")).accepted());
        assertEquals(RunStatus.ACCEPTED, runner.status());
        assertEquals(3, runner.stepCount());

        runner.reset();
        runner.step("1");
        runner.step("#");
        assertTrue(runner.inErrorState());
        runner.step("1");
        assertTrue(runner.inErrorState());
        assertFalse(runner.finish().accepted());
    }

    @Test(expected = IllegalStateException.class)
    public void testRunnerRejectsStepAfterFinish() {
        DfaRunner runner = new DfaRunner(mod3);
        runner.finish();
        runner.step("0");
    }

    @Test
    public void testNondeterministicEdgeRejected() {
        DeterministicAutomaton.Builder b = DeterministicAutomaton.builder();
        int s = b.addState("s");
        int t = b.addState("t");
        b.addTransition(s, "a", t);
        b.addTransition(s, "a", t); // same edge again is fine
        try {
            b.addTransition(s, "a", s);
            fail("Should have rejected a second target for (s, a)");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("already moves to t"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingStart() {
        DeterministicAutomaton.Builder b = DeterministicAutomaton.builder();
        b.addState("s");
        b.build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDanglingTarget() {
        DeterministicAutomaton.Builder b = DeterministicAutomaton.builder();
        int s = b.addState("s");
        b.addTransition(s, "a", 5);
    }

    @Test
    public void testCustomErrorName() {
        DeterministicAutomaton.Builder b = DeterministicAutomaton.builder().errorStateName("sink");
        b.start(b.addState("s"));
        DeterministicAutomaton d = b.build();
        assertEquals("sink", d.stateName(d.errorState()));
        assertEquals(d.errorState(), d.stateIndex("sink"));
    }
}
