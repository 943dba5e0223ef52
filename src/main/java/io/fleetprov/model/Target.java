package io.fleetprov.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One independently addressed host reached through {@code relay}.
 *
 * @param name        unique identity within an inventory, also used in log file names
 * @param host        destination address as seen from the relay
 * @param relay       jump host in {@code [user@]host[:port]} form
 * @param port        destination ssh port, 0 for the ssh default
 * @param credential  login for the destination (and the relay, unless the relay address names its own user)
 * @param metadata    free-form scalars such as an instance index
 */
public record Target(
        String name,
        String host,
        String relay,
        int port,
        Credential credential,
        Map<String, String> metadata
) {
    public Target {
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String meta(String key) {
        return metadata.get(key);
    }
}
