package io.fleetprov.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fleetprov.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAtAnyDepth() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("name", "lab-1");
        root.put("password", "s3cret");
        root.putNull("apiToken");
        root.putObject("metadata").put("ansible_ssh_pass", "hunter2").put("network_id", "1");
        root.putArray("hops").addObject().put("sshpass", "x");

        JsonNode masked = SensitiveDataMasker.masked(root);

        Assertions.assertEquals("lab-1", masked.get("name").asText());
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("password").asText());
        Assertions.assertTrue(masked.get("apiToken").isNull());
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("metadata").get("ansible_ssh_pass").asText());
        Assertions.assertEquals("1", masked.get("metadata").get("network_id").asText());
        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("hops").get(0).get("sshpass").asText());
        Assertions.assertEquals("s3cret", root.get("password").asText());
    }

    @Test
    void commandLineHidesKnownSecretsAndSensitiveAssignments() {
        String line = SensitiveDataMasker.maskCommandLine(
                List.of("ssh", "-o", "Password=abc", "labadmin@10.0.0.1", "deploy --token-file /tmp/s3cret.txt"),
                List.of("s3cret"));

        Assertions.assertEquals("ssh -o Password=*** labadmin@10.0.0.1 deploy --token-file /tmp/***.txt", line);
        Assertions.assertEquals("plain", SensitiveDataMasker.maskText("plain", null));
    }

    @Test
    void recognisesSensitiveKeyNames() {
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("ansible_password"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("API_KEY"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("network_id"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(null));
    }
}
