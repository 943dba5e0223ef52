package io.fleetprov.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.retry.DelayMode;
import io.fleetprov.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Effective configuration of one orchestration run.
 */
public record RunSettings(
        int concurrency,
        int maxRetries,
        Duration retryDelay,
        DelayMode retryDelayMode,
        Duration retryDelayMax,
        Duration attemptTimeout,
        Duration stagger,
        Duration connectTimeout,
        String commandTemplate,
        Map<String, String> templateVars,
        Set<ExecutionErrorKind> nonRetryableKinds
) {
    public RunSettings {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1: " + concurrency);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("max retries must be >= 0: " + maxRetries);
        }
        requireNonNegative("retry delay", retryDelay);
        requireNonNegative("retry delay ceiling", retryDelayMax);
        requireNonNegative("stagger", stagger);
        if (attemptTimeout == null || attemptTimeout.isZero() || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("attempt timeout must be positive: " + attemptTimeout);
        }
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connect timeout must be positive: " + connectTimeout);
        }
        if (commandTemplate == null || commandTemplate.isBlank()) {
            throw new IllegalArgumentException("remote command template is required (--command or settings \"command\")");
        }
        if (retryDelayMode == null) {
            retryDelayMode = DelayMode.FIXED;
        }
        if (retryDelayMax.compareTo(retryDelay) < 0) {
            retryDelayMax = retryDelay;
        }
        templateVars = templateVars == null || templateVars.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(templateVars));
        nonRetryableKinds = nonRetryableKinds == null || nonRetryableKinds.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(nonRetryableKinds));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requireNonNegative(String label, Duration value) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(label + " must be >= 0: " + value);
        }
    }

    /**
     * Starts from the defaults in {@link FleetProvConfig}; a settings file is
     * applied first and explicit values (CLI options) afterwards. {@code null}
     * arguments leave the current value alone.
     */
    public static final class Builder {
        private int concurrency = FleetProvConfig.DEFAULT_CONCURRENCY;
        private int maxRetries = FleetProvConfig.DEFAULT_MAX_RETRIES;
        private Duration retryDelay = FleetProvConfig.DEFAULT_RETRY_DELAY;
        private DelayMode retryDelayMode = DelayMode.FIXED;
        private Duration retryDelayMax = FleetProvConfig.DEFAULT_RETRY_DELAY_MAX;
        private Duration attemptTimeout = FleetProvConfig.DEFAULT_ATTEMPT_TIMEOUT;
        private Duration stagger = FleetProvConfig.DEFAULT_STAGGER;
        private Duration connectTimeout = FleetProvConfig.DEFAULT_CONNECT_TIMEOUT;
        private String commandTemplate;
        private final Map<String, String> templateVars = new LinkedHashMap<>();
        private final Set<ExecutionErrorKind> nonRetryableKinds = EnumSet.noneOf(ExecutionErrorKind.class);

        private Builder() {
        }

        /**
         * Reads a JSON settings file such as:
         * <pre>
         * {
         *   "command": "cd /opt/lab &amp;&amp; ./provision.sh -p {var.provider} -n {meta.network_id}",
         *   "concurrency": 20,
         *   "maxRetries": 3,
         *   "retryDelayMs": 10000,
         *   "retryDelayMode": "linear",
         *   "vars": {"provider": "proxmox"},
         *   "noRetryOn": ["AUTH_REJECTED"]
         * }
         * </pre>
         */
        public Builder settingsFile(Path file) throws IOException {
            if (file == null) {
                return this;
            }
            if (!Files.isRegularFile(file)) {
                throw new IllegalArgumentException("settings file not found: " + file);
            }
            JsonNode root = Jsons.readTree(file);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("settings file must contain a JSON object: " + file);
            }
            command(text(root, "command"));
            concurrency(integer(root, "concurrency"));
            maxRetries(integer(root, "maxRetries"));
            retryDelay(millis(root, "retryDelayMs"));
            retryDelayMode(text(root, "retryDelayMode"));
            retryDelayMax(millis(root, "retryDelayMaxMs"));
            attemptTimeout(millis(root, "attemptTimeoutMs"));
            stagger(millis(root, "staggerMs"));
            Long connectSeconds = root.hasNonNull("connectTimeoutSeconds") ? root.get("connectTimeoutSeconds").asLong() : null;
            connectTimeout(connectSeconds == null ? null : Duration.ofSeconds(connectSeconds));
            JsonNode vars = root.path("vars");
            if (vars.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = vars.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    templateVars.put(entry.getKey(), entry.getValue().asText());
                }
            }
            JsonNode noRetry = root.path("noRetryOn");
            if (noRetry.isArray()) {
                for (JsonNode kind : noRetry) {
                    nonRetryableKinds.add(ExecutionErrorKind.fromString(kind.asText()));
                }
            }
            return this;
        }

        public Builder command(String value) {
            if (value != null && !value.isBlank()) {
                commandTemplate = value;
            }
            return this;
        }

        public Builder concurrency(Integer value) {
            if (value != null) {
                concurrency = value;
            }
            return this;
        }

        public Builder maxRetries(Integer value) {
            if (value != null) {
                maxRetries = value;
            }
            return this;
        }

        public Builder retryDelay(Duration value) {
            if (value != null) {
                retryDelay = value;
            }
            return this;
        }

        public Builder retryDelayMode(String value) {
            if (value != null && !value.isBlank()) {
                retryDelayMode = DelayMode.fromString(value);
            }
            return this;
        }

        public Builder retryDelayMax(Duration value) {
            if (value != null) {
                retryDelayMax = value;
            }
            return this;
        }

        public Builder attemptTimeout(Duration value) {
            if (value != null) {
                attemptTimeout = value;
            }
            return this;
        }

        public Builder stagger(Duration value) {
            if (value != null) {
                stagger = value;
            }
            return this;
        }

        public Builder connectTimeout(Duration value) {
            if (value != null) {
                connectTimeout = value;
            }
            return this;
        }

        public Builder vars(Map<String, String> values) {
            if (values != null) {
                templateVars.putAll(values);
            }
            return this;
        }

        public Builder noRetryOn(Iterable<String> kinds) {
            if (kinds != null) {
                for (String kind : kinds) {
                    nonRetryableKinds.add(ExecutionErrorKind.fromString(kind));
                }
            }
            return this;
        }

        public RunSettings build() {
            return new RunSettings(
                    concurrency,
                    maxRetries,
                    retryDelay,
                    retryDelayMode,
                    retryDelayMax,
                    attemptTimeout,
                    stagger,
                    connectTimeout,
                    commandTemplate,
                    templateVars,
                    nonRetryableKinds
            );
        }

        private static String text(JsonNode root, String field) {
            return root.hasNonNull(field) ? root.get(field).asText() : null;
        }

        private static Integer integer(JsonNode root, String field) {
            return root.hasNonNull(field) ? root.get(field).asInt() : null;
        }

        private static Duration millis(JsonNode root, String field) {
            return root.hasNonNull(field) ? Duration.ofMillis(root.get(field).asLong()) : null;
        }
    }
}
