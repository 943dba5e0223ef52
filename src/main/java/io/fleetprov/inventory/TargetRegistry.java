package io.fleetprov.inventory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.fleetprov.model.Credential;
import io.fleetprov.model.Target;
import io.fleetprov.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Loads target descriptors from an inventory file. No network access.
 *
 * <p>Two formats are accepted: a JSON document (an array of targets or an
 * object with {@code defaults} and {@code targets}) and an Ansible INI
 * inventory, of which one host group is read. The format is picked by file
 * extension, then by content.
 */
public final class TargetRegistry {
    public static final String DEFAULT_GROUP = "deployment_boxes";
    public static final String AUTH_AGENT = "agent";
    /** INI host or group variable selecting agent authentication. */
    public static final String INI_AUTH_VAR = "fleetprov_auth";

    private static final Pattern TARGET_NAME = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Pattern ADDRESS = Pattern.compile("[A-Za-z0-9._:@\\[\\]%-]+");

    private final String group;
    private final Function<String, String> environment;

    public TargetRegistry() {
        this(DEFAULT_GROUP, System::getenv);
    }

    public TargetRegistry(String group, Function<String, String> environment) {
        this.group = group == null || group.isBlank() ? DEFAULT_GROUP : group.trim();
        this.environment = environment;
    }

    public List<Target> load(Path source) {
        if (source == null || !Files.exists(source)) {
            throw new InventoryException("inventory not found: " + source);
        }
        if (!Files.isRegularFile(source)) {
            throw new InventoryException("inventory is not a regular file: " + source);
        }
        String content;
        try {
            content = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InventoryException("inventory unreadable: " + source + ": " + e.getMessage(), e);
        }
        List<Target> targets = looksLikeJson(source, content)
                ? parseJson(content)
                : parseIni(content);
        if (targets.isEmpty()) {
            throw new InventoryException("inventory contains no targets: " + source
                    + (looksLikeJson(source, content) ? "" : " (group [" + group + "])"));
        }
        return Collections.unmodifiableList(targets);
    }

    /**
     * Keeps the named targets, in inventory order.
     *
     * @throws InventoryException if a name does not exist in {@code targets}
     */
    public static List<Target> select(List<Target> targets, Collection<String> names) {
        Set<String> wanted = new LinkedHashSet<>(names);
        List<Target> out = new ArrayList<>();
        for (Target target : targets) {
            if (wanted.remove(target.name())) {
                out.add(target);
            }
        }
        if (!wanted.isEmpty()) {
            throw new InventoryException("targets not present in inventory: " + String.join(", ", wanted));
        }
        return Collections.unmodifiableList(out);
    }

    private static boolean looksLikeJson(Path source, String content) {
        String fileName = source.getFileName().toString().toLowerCase();
        if (fileName.endsWith(".json")) {
            return true;
        }
        String trimmed = content.strip();
        if (trimmed.startsWith("{")) {
            return true;
        }
        if (trimmed.startsWith("[")) {
            String rest = trimmed.substring(1).strip();
            return rest.startsWith("{") || rest.startsWith("]");
        }
        return false;
    }

    private List<Target> parseJson(String content) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(content);
        } catch (JsonProcessingException e) {
            throw new InventoryException("malformed JSON inventory: " + e.getOriginalMessage(), e);
        }
        JsonNode defaults = Jsons.mapper().createObjectNode();
        JsonNode entries = root;
        if (root != null && root.isObject()) {
            defaults = root.path("defaults");
            entries = root.path("targets");
        }
        if (entries == null || !entries.isArray()) {
            throw new InventoryException("JSON inventory must be an array of targets or an object with a \"targets\" array");
        }
        List<Target> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int position = 0;
        for (JsonNode entry : entries) {
            position++;
            String where = "target #" + position;
            if (!entry.isObject()) {
                throw new InventoryException(where + ": expected an object");
            }
            String name = text(entry, "name", null);
            String host = text(entry, "host", text(entry, "destination", null));
            String relay = text(entry, "relay", text(defaults, "relay", null));
            String user = text(entry, "user", text(defaults, "user", null));
            String password = text(entry, "password", null);
            String passwordEnv = text(entry, "passwordEnv", null);
            String identityFile = text(entry, "identityFile", null);
            String auth = text(entry, "auth", null);
            if (password == null && passwordEnv == null && identityFile == null && auth == null) {
                password = text(defaults, "password", null);
                passwordEnv = text(defaults, "passwordEnv", null);
                identityFile = text(defaults, "identityFile", null);
                auth = text(defaults, "auth", null);
            }
            int port = entry.hasNonNull("port") ? entry.get("port").asInt() : defaults.path("port").asInt(0);
            Map<String, String> metadata = new LinkedHashMap<>();
            JsonNode meta = entry.path("metadata");
            if (!meta.isMissingNode() && !meta.isNull()) {
                if (!meta.isObject()) {
                    throw new InventoryException(where + ": metadata must be an object");
                }
                Iterator<Map.Entry<String, JsonNode>> it = meta.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> field = it.next();
                    if (field.getValue().isContainerNode()) {
                        throw new InventoryException(where + ": metadata value for '" + field.getKey() + "' must be a scalar");
                    }
                    metadata.put(field.getKey(), field.getValue().asText());
                }
            }
            Target target = build(where, name, host, relay, port, user, password, passwordEnv, identityFile, auth, metadata);
            if (!seen.add(target.name())) {
                throw new InventoryException("duplicate target name: " + target.name());
            }
            out.add(target);
        }
        return out;
    }

    private List<Target> parseIni(String content) {
        IniInventoryParser.Parsed parsed = IniInventoryParser.parse(content.lines().toList(), group);
        Map<String, String> groupVars = parsed.groupVars();
        List<Target> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (IniInventoryParser.HostEntry entry : parsed.hosts()) {
            String where = "line " + entry.lineNumber();
            Map<String, String> vars = new LinkedHashMap<>(groupVars);
            vars.putAll(entry.vars());
            String host = vars.getOrDefault("ansible_host", entry.name());
            String relay = IniInventoryParser.jumpHost(vars.get("ansible_ssh_common_args"));
            if (relay == null) {
                relay = IniInventoryParser.jumpHost(vars.get("ansible_ssh_extra_args"));
            }
            int port = parsePort(where, vars.get("ansible_port"));
            Map<String, String> metadata = new LinkedHashMap<>();
            for (Map.Entry<String, String> var : entry.vars().entrySet()) {
                if (!var.getKey().startsWith("ansible_") && !var.getKey().equals(INI_AUTH_VAR)) {
                    metadata.put(var.getKey(), var.getValue());
                }
            }
            Target target = build(
                    where,
                    entry.name(),
                    host,
                    relay,
                    port,
                    vars.get("ansible_user"),
                    vars.containsKey("ansible_password") ? vars.get("ansible_password") : vars.get("ansible_ssh_pass"),
                    null,
                    vars.get("ansible_ssh_private_key_file"),
                    vars.get(INI_AUTH_VAR),
                    metadata
            );
            if (!seen.add(target.name())) {
                throw new InventoryException("duplicate target name: " + target.name());
            }
            out.add(target);
        }
        return out;
    }

    private Target build(
            String where,
            String name,
            String host,
            String relay,
            int port,
            String user,
            String password,
            String passwordEnv,
            String identityFile,
            String auth,
            Map<String, String> metadata
    ) {
        if (name == null || name.isBlank()) {
            throw new InventoryException(where + ": target name is required");
        }
        if (!TARGET_NAME.matcher(name).matches()) {
            throw new InventoryException(where + ": invalid target name '" + name + "' (allowed: letters, digits, '.', '_', '-')");
        }
        if (host == null || host.isBlank() || !ADDRESS.matcher(host).matches()) {
            throw new InventoryException(where + " (" + name + "): missing or invalid destination address: " + host);
        }
        if (relay == null || relay.isBlank() || !ADDRESS.matcher(relay).matches()) {
            throw new InventoryException(where + " (" + name + "): missing or invalid relay address: " + relay);
        }
        if (user == null || user.isBlank()) {
            throw new InventoryException(where + " (" + name + "): credential user is required");
        }
        if (port < 0 || port > 65535) {
            throw new InventoryException(where + " (" + name + "): invalid port " + port);
        }
        if (auth != null && !auth.isBlank() && !AUTH_AGENT.equalsIgnoreCase(auth.trim())) {
            throw new InventoryException(where + " (" + name + "): unknown auth '" + auth + "' (only '" + AUTH_AGENT + "' may be given explicitly)");
        }
        Credential credential;
        if (identityFile != null && !identityFile.isBlank()) {
            if (password != null || passwordEnv != null) {
                throw new InventoryException(where + " (" + name + "): specify either a password or an identity file, not both");
            }
            credential = Credential.identityFile(user, Paths.get(identityFile));
        } else if (passwordEnv != null && !passwordEnv.isBlank()) {
            String resolved = environment.apply(passwordEnv);
            if (resolved == null || resolved.isEmpty()) {
                throw new InventoryException(where + " (" + name + "): password environment variable " + passwordEnv + " is not set");
            }
            credential = Credential.password(user, resolved);
        } else if (password != null && !password.isEmpty()) {
            credential = Credential.password(user, password);
        } else if (auth != null && !auth.isBlank()) {
            credential = Credential.agent(user);
        } else {
            throw new InventoryException(where + " (" + name + "): no credential: give a password, passwordEnv or identityFile, or set auth to '"
                    + AUTH_AGENT + "' to use the ssh agent");
        }
        return new Target(name, host, relay, port, credential, metadata);
    }

    private static int parsePort(String where, String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InventoryException(where + ": invalid ansible_port: " + raw, e);
        }
    }

    private static String text(JsonNode node, String field, String fallback) {
        if (node == null || !node.hasNonNull(field)) {
            return fallback;
        }
        String value = node.get(field).asText();
        return value.isBlank() ? fallback : value.trim();
    }
}
