package domain.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a flat sum-of-terms formula into NAME and OPERATOR tokens.
 *
 * <p>Grammar: terms separated by {@code +} (include) or {@code -} (exclude). Whitespace only
 * separates; everything else belongs to a name, so column names may carry punctuation such as
 * {@code /} or {@code ::}. A hyphen is always an operator here: hyphenated column names must be
 * patched before tokenizing.</p>
 */
final class FormulaTokenizer {

    private final String s;
    private int pos = 0;

    private FormulaTokenizer(String s) {
        this.s = (s == null) ? "" : s;
    }

    static List<FormulaToken> tokenize(String formula) {
        return new FormulaTokenizer(formula).readAll();
    }

    private static boolean isOperator(char c) {
        return c == '+' || c == '-';
    }

    private List<FormulaToken> readAll() {
        List<FormulaToken> out = new ArrayList<>();
        while (hasNext()) {
            readSpaces();
            if (!hasNext()) break;

            char c = peek();
            if (isOperator(c)) {
                out.add(FormulaToken.operator(read()));
            } else {
                out.add(FormulaToken.name(readName()));
            }
        }
        return out;
    }

    private boolean hasNext() {
        return pos < s.length();
    }

    private char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    private char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    private String readName() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (Character.isWhitespace(c) || isOperator(c)) break;
            pos++;
        }
        return s.substring(start, pos);
    }

    private void readSpaces() {
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
    }
}
