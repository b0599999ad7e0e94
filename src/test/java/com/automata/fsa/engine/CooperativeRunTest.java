package com.automata.fsa.engine;

import com.automata.fsa.api.RunStatus;
import com.automata.fsa.graph.StateGraph;
import com.automata.fsa.graph.StateSet;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CooperativeRunTest {

    private StateGraph graph;

    @Before
    public void setUp() {
        // (a|b)*abb with a nondeterministic guess on 'a'
        StateGraph.Builder b = StateGraph.builder();
        int s0 = b.addState("s0");
        int s1 = b.addState("s1");
        int s2 = b.addState("s2");
        int s3 = b.addState("s3", true);
        b.addTransition(s0, "a", s0).addTransition(s0, "b", s0)
                .addTransition(s0, "a", s1)
                .addTransition(s1, "b", s2)
                .addTransition(s2, "b", s3)
                .start(s0);
        graph = b.build();
    }

    @Test
    public void testYieldsOncePerSymbol() {
        AutomatonRunner runner = new AutomatonRunner(graph);
        CooperativeRun run = runner.cooperative(AutomatonRunner.symbols("babb"));

        int suspensions = 0;
        while (run.advance()) {
            suspensions++;
            assertEquals(suspensions, runner.cursor());
            assertFalse(run.isDone());
        }
        assertEquals(4, suspensions);
        assertTrue(run.isDone());
        assertTrue(run.result().accepted());
        assertEquals(RunStatus.ACCEPTED, runner.status());
        assertFalse(run.advance());
    }

    @Test
    public void testEquivalentToSynchronousRun() {
        for (String input : List.of("abb", "aabb", "ab", "", "babab", "abba", "bbbabb")) {
            AutomatonRunner sync = new AutomatonRunner(graph);
            AutomatonRunner coop = new AutomatonRunner(graph);
            RunResult expected = sync.run(input);
            RunResult actual = coop.cooperative(AutomatonRunner.symbols(input)).complete();
            assertEquals(input, expected, actual);
        }
    }

    @Test
    public void testInterleavedRunsOnOneThread() {
        AutomatonRunner r1 = new AutomatonRunner(graph);
        AutomatonRunner r2 = new AutomatonRunner(graph);
        CooperativeRun accepting = r1.cooperative(AutomatonRunner.symbols("aabb"));
        CooperativeRun rejecting = r2.cooperative(AutomatonRunner.symbols("abab"));

        // round-robin scheduler
        List<CooperativeRun> ready = new ArrayList<>(List.of(accepting, rejecting));
        while (!ready.isEmpty()) {
            CooperativeRun next = ready.remove(0);
            if (next.advance())
                ready.add(next);
        }

        assertTrue(accepting.result().accepted());
        assertFalse(rejecting.result().accepted());
    }

    @Test
    public void testResumeFromCheckpoint() {
        List<String> input = AutomatonRunner.symbols("babb");

        AutomatonRunner first = new AutomatonRunner(graph);
        CooperativeRun run = first.cooperative(input);
        run.advance();
        run.advance();
        RunCheckpoint cp = run.checkpoint();
        assertEquals(2, cp.cursor());
        assertEquals(StateSet.of(4, 0, 1), cp.activeStates());
        assertEquals(2, run.remaining());

        // abandon 'first' and rebuild the run elsewhere from the checkpoint alone
        AutomatonRunner second = new AutomatonRunner(graph);
        CooperativeRun resumed = second.resume(cp, input);
        assertEquals(RunStatus.RUNNING, second.status());
        RunResult result = resumed.complete();

        assertTrue(result.accepted());
        assertEquals(4, result.steps());
        assertEquals(new AutomatonRunner(graph).run(input), result);
    }

    @Test
    public void testResumeAtStartIsIdle() {
        AutomatonRunner runner = new AutomatonRunner(graph);
        RunCheckpoint cp = runner.checkpoint();
        AutomatonRunner other = new AutomatonRunner(graph);
        other.resume(cp, List.of("a"));
        assertEquals(RunStatus.IDLE, other.status());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCheckpointPastEndRejected() {
        new AutomatonRunner(graph).resume(new RunCheckpoint(StateSet.of(4, 0), 5), List.of("a"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCheckpointFromOtherGraphRejected() {
        new AutomatonRunner(graph).resume(new RunCheckpoint(StateSet.of(2, 0), 0), List.of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCursorRejected() {
        new RunCheckpoint(StateSet.of(4, 0), -1);
    }

    @Test
    public void testAbandonedRunLeavesNoPartialStep() {
        AutomatonRunner runner = new AutomatonRunner(graph);
        CooperativeRun run = runner.cooperative(AutomatonRunner.symbols("ab"));
        run.advance();
        StateSet afterOne = runner.activeStates();
        // dropping the run: the runner still holds exactly the state after one full step
        assertEquals(StateSet.of(4, 0, 1), afterOne);
        assertEquals(1, runner.cursor());
    }

    @Test
    public void testCooperativeRejectedOnceSymbolsConsumed() {
        AutomatonRunner runner = new AutomatonRunner(graph);
        runner.step("a");
        try {
            runner.cooperative(AutomatonRunner.symbols("bb"));
            fail("Should have thrown IllegalStateException for a run already in progress");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("checkpoint"));
        }
        // nothing was consumed by the refused call
        assertEquals(1, runner.cursor());
        assertEquals(StateSet.of(4, 0, 1), runner.activeStates());
    }

    @Test
    public void testRunInProgressContinuesThroughResume() {
        List<String> input = AutomatonRunner.symbols("abb");
        AutomatonRunner runner = new AutomatonRunner(graph);
        runner.step(input.get(0));

        CooperativeRun rest = runner.resume(runner.checkpoint(), input);
        assertEquals(2, rest.remaining());
        RunResult result = rest.complete();

        assertTrue(result.accepted());
        assertEquals(3, result.steps());
        assertEquals(0, rest.remaining());
    }

    @Test
    public void testCooperativeAfterResetStartsAtFirstSymbol() {
        AutomatonRunner runner = new AutomatonRunner(graph);
        runner.step("b");
        runner.step("b");
        runner.reset();
        CooperativeRun run = runner.cooperative(AutomatonRunner.symbols("abb"));
        assertEquals(3, run.remaining());
        assertTrue(run.complete().accepted());
    }
}
