package io.fleetprov.exec;

import io.fleetprov.inventory.InventoryException;
import io.fleetprov.model.Target;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Remote command with per-target placeholders.
 *
 * <p>Placeholders are written in braces: {@code {name}}, {@code {host}},
 * {@code {relay}}, {@code {user}}, {@code {meta.KEY}} for target metadata and
 * {@code {var.KEY}} for run-wide variables. A doubled brace produces a literal
 * brace. Substituted values are restricted to a conservative character
 * set so a target field can never inject shell syntax into the remote command;
 * literal template text is passed through unchanged.
 */
public final class CommandTemplate {
    private static final Pattern SAFE_VALUE = Pattern.compile("[A-Za-z0-9._:@/+=,-]+");
    private static final Set<String> SIMPLE_PLACEHOLDERS = Set.of("name", "host", "relay", "user");

    private final String source;
    private final List<Segment> segments;
    private final Map<String, String> vars;

    private CommandTemplate(String source, List<Segment> segments, Map<String, String> vars) {
        this.source = source;
        this.segments = segments;
        this.vars = vars;
    }

    /**
     * @throws IllegalArgumentException on unbalanced braces, an unknown
     *                                  placeholder, or a {@code var.} placeholder without a value
     */
    public static CommandTemplate parse(String source, Map<String, String> vars) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("command template cannot be empty");
        }
        Map<String, String> safeVars = vars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(vars));
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < source.length()) {
            char ch = source.charAt(i);
            if (ch == '{' && i + 1 < source.length() && source.charAt(i + 1) == '{') {
                literal.append('{');
                i += 2;
                continue;
            }
            if (ch == '}' && i + 1 < source.length() && source.charAt(i + 1) == '}') {
                literal.append('}');
                i += 2;
                continue;
            }
            if (ch == '}') {
                throw new IllegalArgumentException("unmatched '}' at offset " + i + " in command template");
            }
            if (ch == '{') {
                int close = source.indexOf('}', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("unterminated placeholder at offset " + i + " in command template");
                }
                String placeholder = source.substring(i + 1, close).trim();
                validatePlaceholder(placeholder, safeVars);
                if (literal.length() > 0) {
                    segments.add(new Segment(literal.toString(), null));
                    literal.setLength(0);
                }
                segments.add(new Segment(null, placeholder));
                i = close + 1;
                continue;
            }
            literal.append(ch);
            i++;
        }
        if (literal.length() > 0) {
            segments.add(new Segment(literal.toString(), null));
        }
        return new CommandTemplate(source, List.copyOf(segments), safeVars);
    }

    public String source() {
        return source;
    }

    public Set<String> placeholders() {
        Set<String> out = new LinkedHashSet<>();
        for (Segment segment : segments) {
            if (segment.placeholder() != null) {
                out.add(segment.placeholder());
            }
        }
        return out;
    }

    /**
     * @throws IllegalArgumentException if a value is missing or contains characters outside the safe set
     */
    public String render(Target target) {
        StringBuilder out = new StringBuilder();
        for (Segment segment : segments) {
            if (segment.literal() != null) {
                out.append(segment.literal());
                continue;
            }
            String value = resolve(segment.placeholder(), target);
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException("no value for {" + segment.placeholder() + "} on target " + target.name());
            }
            if (!SAFE_VALUE.matcher(value).matches()) {
                throw new IllegalArgumentException("unsafe value for {" + segment.placeholder() + "} on target "
                        + target.name() + ": " + value);
            }
            out.append(value);
        }
        return out.toString();
    }

    /**
     * Renders the template for every target up front, so a bad substitution fails
     * the run before any remote command starts.
     */
    public void validateAll(List<Target> targets) {
        for (Target target : targets) {
            try {
                render(target);
            } catch (IllegalArgumentException e) {
                throw new InventoryException("command template cannot be rendered: " + e.getMessage(), e);
            }
        }
    }

    private String resolve(String placeholder, Target target) {
        switch (placeholder) {
            case "name":
                return target.name();
            case "host":
                return target.host();
            case "relay":
                return target.relay();
            case "user":
                return target.credential().user();
            default:
                break;
        }
        if (placeholder.startsWith("meta.")) {
            return target.meta(placeholder.substring("meta.".length()));
        }
        return vars.get(placeholder.substring("var.".length()));
    }

    private static void validatePlaceholder(String placeholder, Map<String, String> vars) {
        if (SIMPLE_PLACEHOLDERS.contains(placeholder)) {
            return;
        }
        if (placeholder.startsWith("meta.") && placeholder.length() > "meta.".length()) {
            return;
        }
        if (placeholder.startsWith("var.") && placeholder.length() > "var.".length()) {
            String key = placeholder.substring("var.".length());
            if (!vars.containsKey(key)) {
                throw new IllegalArgumentException("command template uses {" + placeholder + "} but no value was given (--var "
                        + key + "=...)");
            }
            return;
        }
        throw new IllegalArgumentException("unknown placeholder {" + placeholder + "} in command template");
    }

    @Override
    public String toString() {
        return source;
    }

    private record Segment(String literal, String placeholder) {
    }
}
