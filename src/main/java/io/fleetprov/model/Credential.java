package io.fleetprov.model;

import java.nio.file.Path;

/**
 * Login used for both the relay hop and the destination host.
 *
 * <p>At most one of {@code password} and {@code identityFile} is set; when
 * neither is, ssh falls back to the agent and default keys.
 */
public record Credential(
        String user,
        String password,
        Path identityFile
) {
    public Credential {
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("credential user cannot be empty");
        }
        if (password != null && identityFile != null) {
            throw new IllegalArgumentException("credential cannot carry both a password and an identity file");
        }
        user = user.trim();
    }

    public static Credential password(String user, String password) {
        return new Credential(user, password, null);
    }

    public static Credential identityFile(String user, Path identityFile) {
        return new Credential(user, null, identityFile);
    }

    public static Credential agent(String user) {
        return new Credential(user, null, null);
    }

    public boolean usesPassword() {
        return password != null && !password.isEmpty();
    }

    public String method() {
        if (usesPassword()) {
            return "password";
        }
        return identityFile != null ? "identity-file" : "agent";
    }

    @Override
    public String toString() {
        return "Credential[user=" + user + ", method=" + method() + "]";
    }
}
