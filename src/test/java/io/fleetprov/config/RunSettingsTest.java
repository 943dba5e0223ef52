package io.fleetprov.config;

import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.retry.DelayMode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class RunSettingsTest {

    @Test
    void defaultsApplyWhenNothingIsGiven() {
        RunSettings settings = RunSettings.builder().command("provision {name}").build();

        Assertions.assertEquals(FleetProvConfig.DEFAULT_CONCURRENCY, settings.concurrency());
        Assertions.assertEquals(FleetProvConfig.DEFAULT_MAX_RETRIES, settings.maxRetries());
        Assertions.assertEquals(FleetProvConfig.DEFAULT_MAX_RETRIES + 1, settings.maxAttempts());
        Assertions.assertEquals(FleetProvConfig.DEFAULT_RETRY_DELAY, settings.retryDelay());
        Assertions.assertEquals(DelayMode.FIXED, settings.retryDelayMode());
        Assertions.assertEquals(FleetProvConfig.DEFAULT_ATTEMPT_TIMEOUT, settings.attemptTimeout());
        Assertions.assertTrue(settings.nonRetryableKinds().isEmpty());
        Assertions.assertTrue(settings.templateVars().isEmpty());
    }

    @Test
    void explicitValuesOverrideSettingsFile() throws Exception {
        Path file = Files.createTempFile("fleetprov-settings-", ".json");
        try {
            Files.writeString(file, """
                    {
                      "command": "cd /opt/lab && ./provision.sh -p {var.provider} -n {meta.network_id}",
                      "concurrency": 20,
                      "maxRetries": 5,
                      "retryDelayMs": 2000,
                      "retryDelayMode": "linear",
                      "connectTimeoutSeconds": 30,
                      "vars": {"provider": "proxmox", "region": "east"},
                      "noRetryOn": ["AUTH_REJECTED"]
                    }
                    """, StandardCharsets.UTF_8);

            RunSettings settings = RunSettings.builder()
                    .settingsFile(file)
                    .concurrency(4)
                    .vars(Map.of("provider", "vsphere"))
                    .noRetryOn(List.of("launch-failed"))
                    .build();

            Assertions.assertEquals(4, settings.concurrency());
            Assertions.assertEquals(5, settings.maxRetries());
            Assertions.assertEquals(Duration.ofSeconds(2), settings.retryDelay());
            Assertions.assertEquals(DelayMode.LINEAR, settings.retryDelayMode());
            Assertions.assertEquals(Duration.ofSeconds(30), settings.connectTimeout());
            Assertions.assertEquals(Map.of("provider", "vsphere", "region", "east"), settings.templateVars());
            Assertions.assertEquals(Set.of(ExecutionErrorKind.AUTH_REJECTED, ExecutionErrorKind.LAUNCH_FAILED),
                    settings.nonRetryableKinds());
            Assertions.assertTrue(settings.commandTemplate().startsWith("cd /opt/lab"));
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void invalidValuesAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> RunSettings.builder().build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RunSettings.builder().command("x").concurrency(0).build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RunSettings.builder().command("x").maxRetries(-1).build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RunSettings.builder().command("x").attemptTimeout(Duration.ZERO).build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RunSettings.builder().command("x").retryDelay(Duration.ofMillis(-1)).build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RunSettings.builder().retryDelayMode("exponential"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RunSettings.builder().noRetryOn(List.of("SOMETIMES")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RunSettings.builder().settingsFile(Path.of("does-not-exist.json")));
    }

    @Test
    void retryDelayCeilingIsNeverBelowBaseDelay() {
        RunSettings settings = RunSettings.builder()
                .command("x")
                .retryDelay(Duration.ofSeconds(30))
                .retryDelayMax(Duration.ofSeconds(5))
                .build();
        Assertions.assertEquals(Duration.ofSeconds(30), settings.retryDelayMax());
    }
}
