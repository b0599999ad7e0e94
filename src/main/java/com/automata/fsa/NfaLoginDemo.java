package com.automata.fsa;

import com.automata.fsa.engine.AutomatonRunner;
import com.automata.fsa.engine.RunResult;
import com.automata.fsa.graph.StateGraph;
import com.automata.fsa.io.DefinitionLoader;
import com.automata.fsa.login.CredentialStore;
import com.automata.fsa.util.LoggingTransitionListener;
import com.automata.fsa.wiring.SymbolEvent;
import com.automata.fsa.wiring.SymbolPublisher;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Console login through the nondeterministic login automaton, fed one symbol
 * at a time through an LMAX Disruptor ring buffer.
 * <p>
 * The main thread owns the blocking console reads. Each answer is mapped to a
 * symbol ({@code u}/{@code x} for the user name, {@code p}/{@code y} for the
 * password) and published; the consumer thread steps the automaton as soon as
 * the symbol arrives, so the run advances between prompts instead of after
 * all input has been collected.
 */
public class NfaLoginDemo {
    private static final Logger log = LogManager.getLogger(NfaLoginDemo.class);
    private static final int RING_BUFFER_SIZE = 64;

    public static void main(String[] args) throws IOException, InterruptedException, ExecutionException {
        CredentialStore users = DefinitionLoader.loginSettings("login.json").credentialStore();

        StateGraph graph = Automata.loginNfa();
        AutomatonRunner runner = new AutomatonRunner(graph);
        runner.setListener(new LoggingTransitionListener("nfa-login", graph));

        CompletableFuture<RunResult> outcome = new CompletableFuture<>();
        SymbolPublisher publisher = new SymbolPublisher(runner);
        publisher.setRunCompletionCallback((seq, result) -> outcome.complete(result));

        Disruptor<SymbolEvent> disruptor = new Disruptor<>(
                SymbolEvent::new,
                RING_BUFFER_SIZE,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(publisher);
        RingBuffer<SymbolEvent> ringBuffer = disruptor.start();

        try {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            System.out.print("Username: ");
            System.out.flush();
            String username = in.readLine();
            publish(ringBuffer, users.isKnown(username) ? "u" : "x");

            System.out.print("Password: ");
            System.out.flush();
            String password = in.readLine();
            publish(ringBuffer, users.matches(username, password) ? "p" : "y");

            long seq = ringBuffer.next();
            try {
                ringBuffer.get(seq).setEndOfInput(seq);
            } finally {
                ringBuffer.publish(seq);
            }

            RunResult result = outcome.get();
            System.out.println(result.accepted() ? "Login successful. Welcome!" : "Login failed. Try again.");
            log.info("Login run completed: {} after {} step(s)", result.status(), result.steps());
        } finally {
            disruptor.shutdown();
        }
    }

    private static void publish(RingBuffer<SymbolEvent> ringBuffer, String symbol) {
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).setSymbol(symbol, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }
}
