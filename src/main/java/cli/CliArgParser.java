package cli;

import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 *
 * <p>Malformed numbers are parameter errors, never silently replaced by the default.</p>
 */
public final class CliArgParser {

    private CliArgParser() {
    }

    public static int parseInt(String key, String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw invalid(key, s, "an integer", e);
        }
    }

    public static double parseDouble(String key, String s, double def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            throw invalid(key, s, "a number", e);
        }
    }

    public static boolean parseBoolean(String key, String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase();
        if (v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes")) return true;
        if (v.equals("false") || v.equals("0") || v.equals("n") || v.equals("no")) return false;
        throw invalid(key, s, "true/false (or 1/0, yes/no, y/n)", null);
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--structuralZeros       => true</li>
     *   <li>--structuralZeros=true  => true</li>
     *   <li>--structuralZeros=false => false</li>
     *   <li>--structuralZeros=maybe => INVALID_PARAMETER</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(key, raw, true);
    }

    /**
     * Splits a {@code ;}-separated list; blank items are dropped, items are trimmed.
     *
     * <p>{@code ,} is not a separator: levels such as {@code "1,2"} are legal.</p>
     */
    public static List<String> parseList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String item : raw.split(";")) {
            String t = item.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return m;
    }

    private static Ancombc2Exception invalid(String key, String raw, String expected, Throwable cause) {
        return new Ancombc2Exception(ErrorCode.INVALID_PARAMETER,
                "--" + key + " must be " + expected + "; got \"" + raw + "\".", cause);
    }
}
