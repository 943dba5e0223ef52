package io.fleetprov.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fleetprov.util.Jsons;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keeps credentials out of console output, JSON listings and log files.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "sshpass", "apikey", "api_key", "credential"
    );

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(key) && !value.isNull() && !value.isBoolean()) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        return input;
    }

    /**
     * Joins an argv for display. {@code key=value} tokens with a sensitive key
     * and every occurrence of a known secret are masked.
     */
    public static String maskCommandLine(List<String> argv, Collection<String> knownSecrets) {
        StringBuilder sb = new StringBuilder();
        for (String token : argv) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(maskText(maskAssignment(token), knownSecrets));
        }
        return sb.toString();
    }

    public static String maskText(String text, Collection<String> knownSecrets) {
        if (text == null || knownSecrets == null) {
            return text;
        }
        String out = text;
        for (String secret : knownSecrets) {
            if (secret != null && !secret.isEmpty()) {
                out = out.replace(secret, MASK);
            }
        }
        return out;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static String maskAssignment(String token) {
        int eq = token.indexOf('=');
        if (eq <= 0) {
            return token;
        }
        String key = token.substring(0, eq);
        return isSensitiveKey(key) ? key + "=" + MASK : token;
    }
}
