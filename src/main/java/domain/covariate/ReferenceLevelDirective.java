package domain.covariate;

import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;

/**
 * A caller-specified reference level, written {@code column::value}.
 */
public final class ReferenceLevelDirective {

    public static final String SEPARATOR = "::";

    private final String raw;
    private final String column;
    private final String level;

    private ReferenceLevelDirective(String raw, String column, String level) {
        this.raw = raw;
        this.column = column;
        this.level = level;
    }

    /**
     * Parses {@code column::value}; exactly one {@code ::} separator is accepted.
     */
    public static ReferenceLevelDirective parse(String raw) {
        String s = (raw == null) ? "" : raw;

        int count = countSeparators(s);
        if (count == 0) {
            throw new Ancombc2Exception(ErrorCode.MALFORMED_REFERENCE_LEVEL,
                    "No reference level was detected for the \"" + s + "\" column-reference pair."
                            + " Make sure to separate the column name and reference level with \"::\".");
        }
        if (count > 1) {
            throw new Ancombc2Exception(ErrorCode.MALFORMED_REFERENCE_LEVEL,
                    "More than one reference level was detected for the \"" + s + "\" column-reference pair."
                            + " The expected format is \"column_name::reference_level\"."
                            + " Make sure that \"::\" occurs only once in each column-reference pair."
                            + "\n\nNOTE: A column name or level that itself contains \"::\" cannot be used"
                            + " as a reference level.");
        }

        int at = s.indexOf(SEPARATOR);
        return new ReferenceLevelDirective(s, s.substring(0, at), s.substring(at + SEPARATOR.length()));
    }

    private static int countSeparators(String s) {
        int n = 0;
        int from = 0;
        while (true) {
            int i = s.indexOf(SEPARATOR, from);
            if (i < 0) return n;
            n++;
            from = i + SEPARATOR.length();
        }
    }

    public String getRaw() {
        return raw;
    }

    public String getColumn() {
        return column;
    }

    public String getLevel() {
        return level;
    }

    @Override
    public String toString() {
        return raw;
    }
}
