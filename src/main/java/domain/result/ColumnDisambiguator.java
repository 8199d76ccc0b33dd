package domain.result;

import domain.formula.RenameLedger;
import domain.model.AnalysisWarning;
import domain.model.AnalysisWarningSink;
import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;
import domain.model.MetadataColumn;
import domain.model.ResultTable;
import domain.model.SampleMetadata;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Turns engine output columns back into (variable, level) pairs named after the metadata.
 *
 * <p>Engine identifiers from the request's {@link RenameLedger} are tried as prefixes of the column
 * text, longest first, so {@code body.site.count} wins over {@code body.site}. The winner decides:
 * <ul>
 *   <li>categorical: the rest of the text is the level (one leading {@code ::} is dropped)</li>
 *   <li>numeric: the column is the variable itself, renamed back</li>
 *   <li>no winner: an engine term such as {@code (Intercept)}, kept verbatim</li>
 * </ul>
 * Each column is parsed exactly once per slice; the rest of the pipeline only sees the parsed pair.</p>
 */
public class ColumnDisambiguator {

    static final String LEVEL_SEPARATOR = "::";

    private final SampleMetadata metadata;
    private final RenameLedger ledger;
    private final List<String> sampleIds;
    private final AnalysisWarningSink warningSink;

    /**
     * @param sampleIds the samples the model actually ran on (observed levels are restricted to them)
     */
    public ColumnDisambiguator(SampleMetadata metadata, RenameLedger ledger, List<String> sampleIds,
                               AnalysisWarningSink warningSink) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.sampleIds = List.copyOf(Objects.requireNonNull(sampleIds, "sampleIds"));
        this.warningSink = (warningSink == null) ? AnalysisWarningSink.none() : warningSink;
    }

    public CovariateColumnRef parse(String engineColumn) {
        for (String engineName : ledger.engineNamesLongestFirst()) {
            if (!engineColumn.startsWith(engineName)) continue;

            String original = ledger.originalOf(engineName);
            MetadataColumn column = metadata.getColumn(original);
            if (column == null) continue;

            String rest = engineColumn.substring(engineName.length());
            switch (column.getType()) {
                case CATEGORICAL: {
                    if (rest.startsWith(LEVEL_SEPARATOR)) rest = rest.substring(LEVEL_SEPARATOR.length());
                    if (rest.isEmpty()) {
                        warningSink.warn(AnalysisWarning.of(WarningCode.UNRESOLVED_COVARIATE_COLUMN, engineColumn,
                                "categorical column without a level; kept verbatim"));
                        return CovariateColumnRef.other(engineColumn);
                    }
                    if (rest.contains(LEVEL_SEPARATOR)) {
                        warningSink.warn(new AnalysisWarning(WarningCode.AMBIGUOUS_SEPARATOR, engineColumn,
                                "level contains \"::\"; kept verbatim", original + " / " + rest));
                    }
                    return CovariateColumnRef.categorical(engineColumn, original, rest);
                }
                case NUMERIC:
                    if (!rest.isEmpty()) {
                        warningSink.warn(new AnalysisWarning(WarningCode.UNRESOLVED_COVARIATE_COLUMN, engineColumn,
                                "numeric variable followed by extra text", original + " + \"" + rest + "\""));
                    }
                    return CovariateColumnRef.numeric(engineColumn, original, rest);
                default:
                    throw new IllegalStateException("unhandled column type: " + column.getType());
            }
        }
        return CovariateColumnRef.other(engineColumn);
    }

    /**
     * Reference level per categorical variable of {@code representative}: the one observed level
     * that has no column of its own.
     *
     * @throws Ancombc2Exception REFERENCE_LEVEL_UNDETERMINED when zero or several levels qualify
     */
    public Map<String, String> deduceReferenceLevels(ResultTable representative) {
        Map<String, Set<String>> encodedByVariable = new LinkedHashMap<>();
        for (String c : representative.getColumnNames()) {
            CovariateColumnRef ref = parse(c);
            if (!ref.isCategorical()) continue;
            encodedByVariable.computeIfAbsent(ref.getVariable(), k -> new LinkedHashSet<>()).add(ref.getLevel());
        }

        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> e : encodedByVariable.entrySet()) {
            String variable = e.getKey();
            SortedSet<String> observed = metadata.getColumn(variable).observedLevels(sampleIds);

            SortedSet<String> candidates = new TreeSet<>(observed);
            candidates.removeAll(e.getValue());
            if (candidates.size() != 1) {
                throw new Ancombc2Exception(ErrorCode.REFERENCE_LEVEL_UNDETERMINED,
                        "The reference level of \"" + variable + "\" cannot be determined from the engine output:"
                                + " observed levels " + observed + ", levels with a result column " + e.getValue()
                                + ", candidates " + candidates + ". Exactly one candidate is expected.");
            }
            out.put(variable, candidates.first());
        }
        return out;
    }

    /**
     * Renames every column of {@code slice} and attaches its parsed reference.
     *
     * @param references reference level per variable, as returned by {@link #deduceReferenceLevels}
     */
    public ResultSlice disambiguate(String sliceName, boolean flagValues, ResultTable slice,
                                    Map<String, String> references) {
        Map<String, List<String>> renamed = new LinkedHashMap<>();
        List<CovariateColumnRef> refs = new ArrayList<>();

        for (String c : slice.getColumnNames()) {
            CovariateColumnRef ref = parse(c);
            if (ref.isCategorical() && references != null) {
                ref = ref.withReference(references.get(ref.getVariable()));
            }

            String outputName = ref.getOutputName();
            if (outputName.equals(slice.getIndexName()) || renamed.containsKey(outputName)) {
                throw new Ancombc2Exception(ErrorCode.IDENTIFIER_COLLISION,
                        "Slice \"" + sliceName + "\": engine column \"" + c + "\" maps to \"" + outputName
                                + "\", which is already taken.");
            }
            renamed.put(outputName, slice.getColumn(c));
            refs.add(ref);
        }

        ResultTable table = new ResultTable(slice.getIndexName(), slice.getRowIds(), renamed);
        return new ResultSlice(sliceName, flagValues, table, refs);
    }
}
