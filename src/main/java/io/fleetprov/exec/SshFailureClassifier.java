package io.fleetprov.exec;

import io.fleetprov.model.ExecutionErrorKind;

import java.util.List;
import java.util.Locale;

/**
 * Maps a non-zero exit of {@code [sshpass] ssh} to a failure kind.
 *
 * <p>ssh reserves exit status 255 for its own errors; anything else is the
 * remote command's status (sshpass passes it through, except for 5 which means
 * the password was refused).
 */
final class SshFailureClassifier {
    static final int SSH_ERROR_EXIT = 255;
    static final int SSHPASS_BAD_PASSWORD_EXIT = 5;

    private static final List<String> AUTH_HINTS = List.of(
            "permission denied",
            "too many authentication failures",
            "authentication failed",
            "no supported authentication methods"
    );
    private static final List<String> UNREACHABLE_HINTS = List.of(
            "connection refused",
            "connection timed out",
            "operation timed out",
            "no route to host",
            "network is unreachable",
            "could not resolve hostname",
            "name or service not known",
            "stdio forwarding failed",
            "open failed",
            "kex_exchange_identification"
    );

    private SshFailureClassifier() {
    }

    static ExecutionErrorKind classify(int exitStatus, List<String> stderr, boolean passwordLogin) {
        if (passwordLogin && exitStatus == SSHPASS_BAD_PASSWORD_EXIT) {
            return ExecutionErrorKind.AUTH_REJECTED;
        }
        if (exitStatus != SSH_ERROR_EXIT) {
            return ExecutionErrorKind.NON_ZERO_EXIT;
        }
        String text = String.join("\n", stderr == null ? List.of() : stderr).toLowerCase(Locale.ROOT);
        if (containsAny(text, AUTH_HINTS)) {
            return ExecutionErrorKind.AUTH_REJECTED;
        }
        if (containsAny(text, UNREACHABLE_HINTS)) {
            return ExecutionErrorKind.RELAY_UNREACHABLE;
        }
        return ExecutionErrorKind.CONNECTION_DROPPED;
    }

    private static boolean containsAny(String text, List<String> hints) {
        for (String hint : hints) {
            if (text.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
