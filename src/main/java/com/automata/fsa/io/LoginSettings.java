package com.automata.fsa.io;

import java.util.Map;

import com.automata.fsa.login.CredentialStore;
import com.automata.fsa.login.LoginAutomaton;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Settings of the console login: retry budget and the user table, stored as
 * hex SHA-256 digests so that no clear-text secret sits in configuration.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LoginSettings {
    private int maxAttempts = LoginAutomaton.DEFAULT_MAX_ATTEMPTS;
    private Map<String, String> users;

    public CredentialStore credentialStore() {
        if (users == null || users.isEmpty())
            throw new IllegalArgumentException("Login settings declare no users");
        return CredentialStore.ofHexDigests(users);
    }
}
