package com.agentcollab.orchestrator.orchestration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled condition of a hierarchical delegation rule, evaluated against
 * an agent's response.
 *
 * <pre>
 *   always | *                      always matches (so does a blank condition)
 *   contains:&lt;text&gt;                 case-insensitive substring
 *   equals:&lt;text&gt;                   case-insensitive, response trimmed
 *   startsWith:&lt;text&gt;               case-insensitive, response trimmed
 *   matches:&lt;regex&gt;                 Java regex, found anywhere in the response
 *   field:&lt;path&gt; &lt;op&gt; &lt;value&gt;       JSON response field, op one of == != &gt; &gt;= &lt; &lt;=
 *   !&lt;condition&gt;                    negation
 *   anything else                   case-insensitive substring
 * </pre>
 *
 * Field paths are dot separated ({@code review.score}). Numbers compare
 * numerically, everything else as text. A response that is not JSON, or
 * lacks the field, does not match.
 */
public final class DelegationCondition {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final Pattern FIELD = Pattern.compile(
            "^field:\\s*([\\w.\\-]+)\\s*(==|!=|>=|<=|>|<)\\s*(.+)$", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final String            source;
    private final Predicate<String> predicate;

    private DelegationCondition(String source, Predicate<String> predicate) {
        this.source    = source;
        this.predicate = predicate;
    }

    /**
     * @throws InvalidTeamConfigurationException if the expression cannot be compiled
     */
    public static DelegationCondition parse(String expression) {
        String expr = expression == null ? "" : expression.strip();
        return new DelegationCondition(expr, compile(expr));
    }

    public boolean matches(String response) {
        return predicate.test(response == null ? "" : response);
    }

    @Override
    public String toString() {
        return source;
    }

    // ------------------------------------------------------------------
    // Compilation
    // ------------------------------------------------------------------

    private static Predicate<String> compile(String expr) {
        if (expr.startsWith("!")) {
            return compile(expr.substring(1).strip()).negate();
        }
        if (expr.isEmpty() || expr.equalsIgnoreCase("always") || expr.equals("*")) {
            return r -> true;
        }
        String lower = expr.toLowerCase(Locale.ROOT);
        if (lower.startsWith("contains:")) {
            String needle = lower(expr.substring("contains:".length()).strip());
            return r -> lower(r).contains(needle);
        }
        if (lower.startsWith("equals:")) {
            String expected = lower(expr.substring("equals:".length()).strip());
            return r -> lower(r.strip()).equals(expected);
        }
        if (lower.startsWith("startswith:")) {
            String prefix = lower(expr.substring("startsWith:".length()).strip());
            return r -> lower(r.strip()).startsWith(prefix);
        }
        if (lower.startsWith("matches:")) {
            String regex = expr.substring("matches:".length()).strip();
            try {
                Pattern p = Pattern.compile(regex, Pattern.DOTALL);
                return r -> p.matcher(r).find();
            } catch (PatternSyntaxException e) {
                throw new InvalidTeamConfigurationException("Invalid regex in delegation condition '" + expr + "': " + e.getDescription());
            }
        }
        if (lower.startsWith("field:")) {
            Matcher m = FIELD.matcher(expr);
            if (!m.matches()) {
                throw new InvalidTeamConfigurationException(
                        "Delegation condition '" + expr + "' must look like field:<path> <op> <value>");
            }
            return fieldPredicate(m.group(1), m.group(2), unquote(m.group(3).strip()));
        }
        String needle = lower(expr);
        return r -> lower(r).contains(needle);
    }

    private static Predicate<String> fieldPredicate(String path, String op, String expected) {
        String pointer = "/" + path.replace('.', '/');
        return response -> {
            JsonNode root = readJson(response);
            if (root == null) return false;
            JsonNode node = root.at(pointer);
            if (node.isMissingNode() || node.isNull()) return false;

            int cmp;
            BigDecimal expectedNumber = toNumber(expected);
            if (node.isNumber() && expectedNumber != null) {
                cmp = node.decimalValue().compareTo(expectedNumber);
            } else {
                cmp = node.asText().compareTo(expected);
            }
            return switch (op) {
                case "==" -> cmp == 0;
                case "!=" -> cmp != 0;
                case ">"  -> cmp > 0;
                case ">=" -> cmp >= 0;
                case "<"  -> cmp < 0;
                case "<=" -> cmp <= 0;
                default   -> false;
            };
        };
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** The response as JSON, or the outermost {...} inside it; null when neither parses. */
    private static JsonNode readJson(String response) {
        String text = response.strip();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) return null;
        try {
            return JSON.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static BigDecimal toNumber(String s) {
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && (s.startsWith("\"") && s.endsWith("\"") || s.startsWith("'") && s.endsWith("'"))) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
