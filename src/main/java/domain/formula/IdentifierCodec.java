package domain.formula;

import java.util.Set;

/**
 * Translates metadata column names into identifiers the R engine accepts.
 *
 * <p>The rules are those of R's {@code make.names(unique = FALSE)}:
 * <ul>
 *   <li>prefix {@code X} when the name does not start with a letter, or starts with a dot followed by a digit</li>
 *   <li>every character that is not a letter, a digit, {@code .} or {@code _} becomes {@code .}</li>
 *   <li>reserved words get a trailing {@code .}</li>
 * </ul>
 * Already-legal names come back unchanged, so encoding is idempotent.</p>
 *
 * <p>Each instance owns the {@link RenameLedger} of one request. Every {@link #encode(String)} call is
 * recorded there, so output columns can be mapped back without re-deriving names.</p>
 */
public final class IdentifierCodec {

    private static final Set<String> RESERVED = Set.of(
            "if", "else", "repeat", "while", "function", "for", "next", "break", "in",
            "TRUE", "FALSE", "NULL", "Inf", "NaN", "NA",
            "NA_integer_", "NA_real_", "NA_character_", "NA_complex_"
    );

    private final RenameLedger ledger = new RenameLedger();

    /**
     * Encodes and records the mapping.
     *
     * @throws domain.model.Ancombc2Exception IDENTIFIER_COLLISION when another original already owns
     *                                        the resulting identifier
     */
    public String encode(String original) {
        String engineName = toEngineName(original);
        ledger.record(engineName, original);
        return engineName;
    }

    public RenameLedger getLedger() {
        return ledger;
    }

    /**
     * Pure form of the translation (nothing recorded).
     */
    public static String toEngineName(String raw) {
        String s = (raw == null) ? "" : raw;

        StringBuilder sb = new StringBuilder(s.length() + 2);
        if (needsPrefix(s)) sb.append('X');

        s.codePoints().forEach(cp -> {
            if (Character.isLetterOrDigit(cp) || cp == '.' || cp == '_') {
                sb.appendCodePoint(cp);
            } else {
                sb.append('.');
            }
        });

        String out = sb.toString();
        if (RESERVED.contains(out)) out = out + ".";
        return out;
    }

    public static boolean isEngineName(String s) {
        return s != null && !s.isEmpty() && toEngineName(s).equals(s);
    }

    private static boolean needsPrefix(String s) {
        if (s.isEmpty()) return true;
        int first = s.codePointAt(0);
        if (first == '.') {
            int next = s.length() > 1 ? s.codePointAt(1) : -1;
            return next >= 0 && Character.isDigit(next);
        }
        return !Character.isLetter(first);
    }
}
