package domain.model;

import java.util.Locale;

/**
 * Declared type of a metadata column.
 *
 * <p>Closed set: every branch on column kind is an exhaustive switch over these two constants.
 * Any other type tag is rejected when the metadata is built.</p>
 */
public enum ColumnType {

    CATEGORICAL,

    NUMERIC;

    /**
     * Parses a type tag as written in a metadata file ({@code categorical} / {@code numeric}).
     *
     * @param column column the tag belongs to (for the error message)
     */
    public static ColumnType parse(String column, String tag) {
        String t = (tag == null) ? "" : tag.trim().toLowerCase(Locale.ROOT);
        switch (t) {
            case "categorical":
                return CATEGORICAL;
            case "numeric":
                return NUMERIC;
            default:
                throw new Ancombc2Exception(ErrorCode.UNKNOWN_COLUMN_TYPE,
                        "Unexpected metadata column type \"" + tag + "\" for column \"" + column + "\"."
                                + " Expected types are either \"categorical\" or \"numeric\".");
        }
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
