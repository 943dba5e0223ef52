package io.fleetprov.inventory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads hosts of one group out of an Ansible INI inventory, e.g.
 * <pre>
 * [deployment_boxes]
 * lab-1-deploy ansible_host=10.10.1.5 network_id=1
 *
 * [deployment_boxes:vars]
 * ansible_user=labadmin
 * ansible_ssh_common_args='-o StrictHostKeyChecking=no -J jump@bastion.example.edu'
 * </pre>
 * Group vars override {@code [all:vars]}; host vars override both.
 */
final class IniInventoryParser {
    private IniInventoryParser() {
    }

    record HostEntry(String name, int lineNumber, Map<String, String> vars) {
    }

    record Parsed(List<HostEntry> hosts, Map<String, String> groupVars) {
    }

    static Parsed parse(List<String> lines, String group) {
        String wanted = group.toLowerCase(Locale.ROOT);
        List<HostEntry> hosts = new ArrayList<>();
        Map<String, String> allVars = new LinkedHashMap<>();
        Map<String, String> groupVars = new LinkedHashMap<>();
        String section = null;
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]") || line.length() < 3) {
                    throw new InventoryException("line " + lineNumber + ": malformed section header: " + line);
                }
                section = line.substring(1, line.length() - 1).trim().toLowerCase(Locale.ROOT);
                continue;
            }
            if (section == null) {
                throw new InventoryException("line " + lineNumber + ": entry outside of any section: " + line);
            }
            if (section.equals(wanted)) {
                List<String> tokens = tokenize(line, lineNumber);
                Map<String, String> vars = new LinkedHashMap<>();
                for (String token : tokens.subList(1, tokens.size())) {
                    putAssignment(vars, token, lineNumber);
                }
                hosts.add(new HostEntry(tokens.get(0), lineNumber, vars));
            } else if (section.equals(wanted + ":vars")) {
                putAssignment(groupVars, line, lineNumber);
            } else if (section.equals("all:vars")) {
                putAssignment(allVars, line, lineNumber);
            }
        }
        Map<String, String> merged = new LinkedHashMap<>(allVars);
        merged.putAll(groupVars);
        return new Parsed(hosts, merged);
    }

    /**
     * Extracts the jump host from ssh arguments given as {@code -J host},
     * {@code -Jhost} or {@code -o ProxyJump=host}.
     */
    static String jumpHost(String sshArgs) {
        if (sshArgs == null || sshArgs.isBlank()) {
            return null;
        }
        List<String> tokens = tokenize(sshArgs, 0);
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if ("-J".equals(token) && i + 1 < tokens.size()) {
                return tokens.get(i + 1);
            }
            if (token.startsWith("-J") && token.length() > 2) {
                return token.substring(2);
            }
            String option = null;
            if ("-o".equals(token) && i + 1 < tokens.size()) {
                option = tokens.get(i + 1);
            } else if (token.startsWith("-o") && token.length() > 2) {
                option = token.substring(2);
            }
            if (option != null && option.toLowerCase(Locale.ROOT).startsWith("proxyjump=")) {
                return option.substring("proxyjump=".length());
            }
        }
        return null;
    }

    private static void putAssignment(Map<String, String> out, String raw, int lineNumber) {
        int eq = raw.indexOf('=');
        if (eq <= 0) {
            throw new InventoryException("line " + lineNumber + ": expected key=value, got: " + raw);
        }
        String key = raw.substring(0, eq).trim();
        String value = unquote(raw.substring(eq + 1).trim());
        out.put(key, value);
    }

    /**
     * Splits on whitespace, keeping single- or double-quoted runs together.
     */
    static List<String> tokenize(String raw, int lineNumber) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (quote != 0) {
                current.append(ch);
                if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
                current.append(ch);
            } else if (Character.isWhitespace(ch)) {
                if (current.length() > 0) {
                    out.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(ch);
            }
        }
        if (quote != 0) {
            throw new InventoryException("line " + lineNumber + ": unterminated quote: " + raw);
        }
        if (current.length() > 0) {
            out.add(current.toString());
        }
        List<String> unquoted = new ArrayList<>(out.size());
        for (String token : out) {
            unquoted.add(token.contains("=") ? token : unquote(token));
        }
        return unquoted;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
