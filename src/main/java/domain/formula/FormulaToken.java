package domain.formula;

/**
 * A formula token: a term name or one of the {@code +} / {@code -} operators.
 */
public final class FormulaToken {

    public enum Kind {
        NAME,
        OPERATOR
    }

    private final Kind kind;
    private final String text;

    private FormulaToken(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static FormulaToken name(String text) {
        return new FormulaToken(Kind.NAME, text);
    }

    public static FormulaToken operator(char op) {
        return new FormulaToken(Kind.OPERATOR, String.valueOf(op));
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public boolean isName() {
        return kind == Kind.NAME;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")";
    }
}
