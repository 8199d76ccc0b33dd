package domain.formula;

import domain.model.AnalysisWarning;
import domain.model.AnalysisWarningSink;
import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;
import domain.model.SampleMetadata;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates a fixed- or random-effects formula against the metadata and rewrites it with engine
 * identifiers.
 *
 * <p>Steps:
 * <ol>
 *   <li>every hyphenated metadata column that occurs verbatim in the formula text is replaced by its
 *       period spelling (longest names first, so {@code body-site-count} is not broken by
 *       {@code body-site})</li>
 *   <li>tokenize into terms and {@code +}/{@code -} operators</li>
 *   <li>validate: non-empty, no {@code ~}, operators between terms, every term resolves to a column
 *       (directly or through the hyphen renames)</li>
 *   <li>encode every term through the request's {@link IdentifierCodec}; join with single spaces</li>
 * </ol>
 * The same codec must be used for the covariate table, so that formula terms and table columns agree.</p>
 */
public class FormulaTranslator {

    private final IdentifierCodec codec;
    private final AnalysisWarningSink warningSink;

    public FormulaTranslator(IdentifierCodec codec, AnalysisWarningSink warningSink) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.warningSink = (warningSink == null) ? AnalysisWarningSink.none() : warningSink;
    }

    public TranslatedFormula translate(String formula, SampleMetadata metadata) {
        if (metadata == null) throw new IllegalArgumentException("metadata is null");

        if (formula == null || formula.isBlank()) {
            throw new Ancombc2Exception(ErrorCode.EMPTY_FORMULA, "The formula is empty; at least one term is required.");
        }
        if (formula.indexOf('~') >= 0) {
            throw new Ancombc2Exception(ErrorCode.DEPENDENT_VARIABLE,
                    "The formula \"" + formula + "\" contains \"~\". Do not include the dependent variable;"
                            + " write only the right-hand side, e.g. \"body-site + year\".");
        }

        // 1) hyphen patch: key = period spelling, value = original column name
        Map<String, String> renamed = new LinkedHashMap<>();
        String patched = patchHyphenatedColumns(formula, metadata, renamed);

        // 2) tokens
        List<FormulaToken> tokens = FormulaTokenizer.tokenize(patched);

        // 3) validate
        validateShape(formula, tokens);

        List<String> engineTokens = new ArrayList<>(tokens.size());
        Set<String> variables = new LinkedHashSet<>();
        Set<String> renamedOriginals = new LinkedHashSet<>();

        for (FormulaToken t : tokens) {
            if (!t.isName()) {
                engineTokens.add(t.getText());
                continue;
            }
            String original = resolve(formula, t.getText(), metadata, renamed);
            variables.add(original);
            if (renamed.containsKey(t.getText()) && !metadata.hasColumn(t.getText())) {
                renamedOriginals.add(original);
            }
            // 4) encode
            engineTokens.add(codec.encode(original));
        }

        String engineFormula = String.join(" ", engineTokens);
        return new TranslatedFormula(formula, engineFormula, new ArrayList<>(variables), renamedOriginals);
    }

    private String patchHyphenatedColumns(String formula, SampleMetadata metadata, Map<String, String> renamed) {
        List<String> hyphenated = new ArrayList<>();
        for (String name : metadata.getColumnNames()) {
            if (name.indexOf('-') >= 0) hyphenated.add(name);
        }
        hyphenated.sort(Comparator.comparingInt(String::length).reversed());

        String patched = formula;
        for (String name : hyphenated) {
            if (!patched.contains(name)) continue;

            String periodName = name.replace('-', '.');
            if (metadata.hasColumn(periodName)) {
                throw new Ancombc2Exception(ErrorCode.IDENTIFIER_COLLISION,
                        "The metadata columns \"" + name + "\" and \"" + periodName
                                + "\" cannot be told apart once hyphens are replaced. Rename one of them.");
            }
            patched = patched.replace(name, periodName);
            renamed.put(periodName, name);
            warningSink.warn(new AnalysisWarning(WarningCode.FORMULA_TERM_RENAMED, name,
                    "formula term renamed for the engine", name + " -> " + periodName));
        }
        return patched;
    }

    private static void validateShape(String formula, List<FormulaToken> tokens) {
        boolean anyName = false;
        for (FormulaToken t : tokens) {
            if (t.isName()) {
                anyName = true;
                break;
            }
        }
        if (!anyName) {
            throw new Ancombc2Exception(ErrorCode.EMPTY_FORMULA,
                    "The formula \"" + formula + "\" does not contain any term.");
        }

        for (int i = 0; i < tokens.size(); i++) {
            FormulaToken t = tokens.get(i);
            if (t.isName()) continue;

            boolean termBefore = i > 0 && tokens.get(i - 1).isName();
            boolean termAfter = i + 1 < tokens.size() && tokens.get(i + 1).isName();
            if (!termBefore || !termAfter) {
                throw new Ancombc2Exception(ErrorCode.DANGLING_OPERATOR,
                        "The operator \"" + t.getText() + "\" in formula \"" + formula
                                + "\" must stand between two terms.");
            }
        }
    }

    private static String resolve(String formula, String term, SampleMetadata metadata, Map<String, String> renamed) {
        if (metadata.hasColumn(term)) return term;

        String original = renamed.get(term);
        if (original != null) return original;

        String msg = "The variable \"" + asWritten(term, renamed) + "\" of formula \"" + formula
                + "\" was not found in the metadata.";
        if (formula.indexOf('-') >= 0) {
            msg = msg + "\n\nNOTE: \"-\" excludes a term, so a hyphenated name that is not exactly a metadata"
                    + " column is split into several terms.";
        }
        throw new Ancombc2Exception(ErrorCode.VARIABLE_NOT_FOUND, msg);
    }

    /**
     * Undoes the hyphen patch inside an unresolved term, so messages show what the user typed.
     */
    static String asWritten(String term, Map<String, String> renamed) {
        List<String> periodNames = new ArrayList<>(renamed.keySet());
        periodNames.sort(Comparator.comparingInt(String::length).reversed());
        String shown = term;
        for (String periodName : periodNames) {
            shown = shown.replace(periodName, renamed.get(periodName));
        }
        return shown;
    }
}
