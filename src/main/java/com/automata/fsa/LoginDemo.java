package com.automata.fsa;

import com.automata.fsa.io.DefinitionLoader;
import com.automata.fsa.io.LoginSettings;
import com.automata.fsa.login.LoginAutomaton;
import com.automata.fsa.login.LoginState;
import com.automata.fsa.util.LoggingTransitionListener;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Console login driven by the deterministic {@link LoginAutomaton}.
 * <p>
 * Reads the user table and retry budget from {@code login.json} on the
 * classpath, or from the file given as first argument. The password is read
 * without echo when a console is attached, and as a plain line otherwise (IDE
 * run configurations, piped input).
 */
public class LoginDemo {
    private static final Logger log = LogManager.getLogger(LoginDemo.class);

    public static void main(String[] args) throws IOException {
        LoginSettings settings = args.length > 0
                ? DefinitionLoader.loginSettingsFile(Path.of(args[0]))
                : DefinitionLoader.loginSettings("login.json");

        LoginAutomaton login = new LoginAutomaton(settings.credentialStore(), settings.getMaxAttempts());
        login.setListener(new LoggingTransitionListener("login", LoginAutomaton.protocol()));
        log.info("DFA login start ({} attempts allowed)", login.maxAttempts());

        Console console = System.console();
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        String username = readLine(console, in, "Username: ");
        if (login.submitIdentifier(username) == LoginState.FAILURE) {
            System.out.println("Unknown user.");
            return;
        }

        while (!login.state().isTerminal()) {
            String password = readPassword(console, in, "Password: ");
            LoginState state = login.submitCredential(password);
            if (state == LoginState.RETRYING)
                System.out.println("Wrong password, try again (" + login.remainingAttempts() + " left).");
        }

        if (login.isAuthenticated()) {
            System.out.println("Login successful. Welcome, " + username + "!");
        } else {
            System.out.println("No attempts left. Access denied.");
        }
        log.info("Login finished in state {} after {} step(s)", login.state(), login.stepCount());
    }

    private static String readLine(Console console, BufferedReader in, String prompt) throws IOException {
        if (console != null)
            return console.readLine(prompt);
        System.out.print(prompt);
        System.out.flush();
        return requireInput(in.readLine());
    }

    private static String readPassword(Console console, BufferedReader in, String prompt) throws IOException {
        if (console != null) {
            char[] pwd = console.readPassword(prompt);
            return new String(requireInput(pwd));
        }
        System.out.print(prompt);
        System.out.flush();
        return requireInput(in.readLine());
    }

    private static <T> T requireInput(T value) throws IOException {
        if (value == null)
            throw new IOException("Input closed before login finished");
        return value;
    }
}
