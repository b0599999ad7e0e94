package com.automata.fsa.engine;

import com.automata.fsa.Automata;
import com.automata.fsa.api.RunStatus;
import com.automata.fsa.api.TransitionListener;
import com.automata.fsa.graph.StateGraph;
import com.automata.fsa.graph.StateSet;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class AutomatonRunnerTest {

    private StateGraph admin;
    private AutomatonRunner runner;

    @Before
    public void setUp() {
        admin = Automata.literal("admin");
        runner = new AutomatonRunner(admin);
    }

    @Test
    public void testAcceptsExactLiteral() {
        RunResult result = runner.run("admin");
        assertTrue(result.accepted());
        assertEquals(RunStatus.ACCEPTED, runner.status());
        assertEquals(5, result.steps());
        assertEquals(StateSet.of(6, 5), result.finalStates());
    }

    @Test
    public void testRejectsPrefixExtensionAndEmpty() {
        for (String input : List.of("admi", "adminx", "", "Admin", "xadmin")) {
            runner.reset();
            RunResult result = runner.run(input);
            assertFalse("should reject '" + input + "'", result.accepted());
            assertEquals(RunStatus.REJECTED, runner.status());
        }
    }

    @Test
    public void testEmptyInputAcceptedWhenStartAccepts() {
        StateGraph empty = Automata.literal("");
        assertTrue(new AutomatonRunner(empty).run("").accepted());
        assertFalse(new AutomatonRunner(empty).run("a").accepted());
    }

    @Test
    public void testStatusLifecycle() {
        assertEquals(RunStatus.IDLE, runner.status());
        runner.step("a");
        assertEquals(RunStatus.RUNNING, runner.status());
        assertEquals(1, runner.cursor());
        runner.finish();
        assertEquals(RunStatus.REJECTED, runner.status());
    }

    @Test
    public void testTerminalRunRequiresReset() {
        runner.run("admin");
        try {
            runner.step("a");
            fail("Should have thrown IllegalStateException on a finished run");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("Reset required"));
        }
        try {
            runner.run("admin");
            fail("Should have thrown IllegalStateException on a finished run");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("ACCEPTED"));
        }

        runner.reset();
        assertTrue(runner.run("admin").accepted());
    }

    @Test
    public void testDeadBranchIsNotAnError() {
        StateSet after = runner.step("z");
        assertTrue(after.isEmpty());
        // once every branch is dead nothing revives it
        assertTrue(runner.step("a").isEmpty());
        assertFalse(runner.finish().accepted());
    }

    @Test
    public void testIsAcceptingDoesNotChangeStatus() {
        for (String s : AutomatonRunner.symbols("admin"))
            runner.step(s);
        assertTrue(runner.isAccepting());
        assertEquals(RunStatus.RUNNING, runner.status());
        runner.step("x");
        assertFalse(runner.isAccepting());
    }

    @Test
    public void testResetRestoresClosureOfStart() {
        // start -ε-> a, start -ε-> b ; a -x-> c ; b -y-> c
        StateGraph.Builder b = StateGraph.builder();
        int start = b.addState("start");
        int a = b.addState("a");
        int bb = b.addState("b");
        int c = b.addState("c", true);
        b.addEpsilon(start, a).addEpsilon(start, bb)
                .addTransition(a, "x", c).addTransition(bb, "y", c)
                .start(start);
        StateGraph g = b.build();
        AutomatonRunner r = new AutomatonRunner(g);
        StateSet expected = new EpsilonClosure(g).closure(g.startSet());

        assertEquals(StateSet.of(4, start, a, bb), r.activeStates());
        for (List<String> history : List.of(List.of("x"), List.of("y", "y"), List.<String>of(), List.of("q"))) {
            r.run(history);
            r.reset();
            assertEquals(expected, r.activeStates());
            assertEquals(0, r.cursor());
            assertEquals(0, r.stepCount());
            assertEquals(RunStatus.IDLE, r.status());
        }
        // reset in the middle of a run works too
        r.step("x");
        r.reset();
        assertEquals(expected, r.activeStates());
    }

    @Test
    public void testEpsilonClosedAfterEveryStep() {
        // a*b with epsilon: s0 -a-> s0, s0 -ε-> s1, s1 -b-> s2
        StateGraph.Builder b = StateGraph.builder();
        int s0 = b.addState("s0");
        int s1 = b.addState("s1");
        int s2 = b.addState("s2", true);
        b.addTransition(s0, "a", s0).addEpsilon(s0, s1).addTransition(s1, "b", s2).start(s0);
        StateGraph g = b.build();
        AutomatonRunner r = new AutomatonRunner(g);

        assertEquals(StateSet.of(3, s0, s1), r.activeStates());
        assertEquals(StateSet.of(3, s0, s1), r.step("a"));
        assertEquals(StateSet.of(3, s2), r.step("b"));
        assertTrue(r.finish().accepted());

        r.reset();
        assertTrue(r.run("b").accepted());
        r.reset();
        assertTrue(r.run("aaab").accepted());
        r.reset();
        assertFalse(r.run("aba").accepted());
    }

    @Test
    public void testListenerSeesEveryTransition() {
        List<String> events = new ArrayList<>();
        runner.setListener(new TransitionListener() {
            @Override
            public void onReset(StateSet initial) {
                events.add("reset " + initial);
            }

            @Override
            public void onTransition(long step, String symbol, StateSet before, StateSet after) {
                events.add(step + ":" + symbol + " " + before + "->" + after);
            }

            @Override
            public void onRunComplete(long steps, boolean accepted, StateSet finalStates) {
                events.add("done " + steps + " " + accepted);
            }
        });

        runner.reset();
        runner.run("adx");

        assertEquals(List.of(
                "reset {0}",
                "1:a {0}->{1}",
                "2:d {1}->{2}",
                "3:x {2}->{}",
                "done 3 false"), events);
    }

    @Test
    public void testResultIndependentOfListener() {
        AutomatonRunner silent = new AutomatonRunner(admin);
        AutomatonRunner observed = new AutomatonRunner(admin);
        observed.setListener(new com.automata.fsa.util.RunStatsListener());

        for (String input : List.of("admin", "adm", "admins", "")) {
            silent.reset();
            observed.reset();
            assertEquals(silent.run(input), observed.run(input));
        }
    }

    @Test
    public void testSharedGraphAcrossRunners() {
        AutomatonRunner other = new AutomatonRunner(admin);
        runner.step("a");
        runner.step("d");
        other.step("x");
        assertEquals(StateSet.of(6, 2), runner.activeStates());
        assertTrue(other.activeStates().isEmpty());
    }

    @Test
    public void testSymbolsSplitsByCodePoint() {
        assertEquals(List.of("a", "😀", "b"), AutomatonRunner.symbols("a😀b"));
    }
}
