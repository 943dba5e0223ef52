package io.fleetprov.exec;

import io.fleetprov.config.FleetProvConfig;

import java.time.Duration;

/**
 * Local client settings for {@link SshRemoteExecutor}.
 *
 * @param sshBinary      OpenSSH client to launch
 * @param sshpassBinary  wrapper used for password logins, reads the password from {@code SSHPASS}
 * @param connectTimeout ssh {@code ConnectTimeout}, applied to the relay and destination hops
 * @param tailLines      lines of stdout/stderr kept in the attempt result
 */
public record SshOptions(
        String sshBinary,
        String sshpassBinary,
        Duration connectTimeout,
        int tailLines
) {
    public SshOptions {
        sshBinary = sshBinary == null || sshBinary.isBlank() ? "ssh" : sshBinary.trim();
        sshpassBinary = sshpassBinary == null || sshpassBinary.isBlank() ? "sshpass" : sshpassBinary.trim();
        connectTimeout = connectTimeout == null ? FleetProvConfig.DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        tailLines = tailLines <= 0 ? FleetProvConfig.DEFAULT_TAIL_LINES : tailLines;
    }

    public static SshOptions defaults() {
        return new SshOptions(null, null, null, 0);
    }
}
