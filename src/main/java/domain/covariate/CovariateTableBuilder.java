package domain.covariate;

import domain.formula.IdentifierCodec;
import domain.model.AnalysisWarning;
import domain.model.AnalysisWarningSink;
import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;
import domain.model.MetadataColumn;
import domain.model.SampleMetadata;
import domain.model.WarningCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;

/**
 * Builds the covariate table handed to the engine.
 *
 * <ol>
 *   <li>project every metadata column onto the feature-table samples</li>
 *   <li>encode each column name through the request's {@link IdentifierCodec}</li>
 *   <li>coerce by declared type (categorical: sorted levels, numeric: doubles)</li>
 *   <li>apply the reference level directives in caller order, each validated on its own</li>
 *   <li>give every remaining categorical formula variable its smallest level as reference</li>
 * </ol>
 */
public class CovariateTableBuilder {

    private final IdentifierCodec codec;
    private final AnalysisWarningSink warningSink;

    public CovariateTableBuilder(IdentifierCodec codec, AnalysisWarningSink warningSink) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.warningSink = (warningSink == null) ? AnalysisWarningSink.none() : warningSink;
    }

    /**
     * @param sampleIds         samples of the feature table (row order of the result); all must be in the metadata
     * @param formulaVariables  original column names used by the formula(s)
     * @param referenceLevels   {@code column::value} directives, may be null
     */
    public CovariateTable build(SampleMetadata metadata,
                                List<String> sampleIds,
                                Collection<String> formulaVariables,
                                List<String> referenceLevels) {
        if (metadata == null) throw new IllegalArgumentException("metadata is null");
        if (sampleIds == null) throw new IllegalArgumentException("sampleIds is null");
        Collection<String> variables = (formulaVariables == null) ? List.of() : formulaVariables;

        // 1) ~ 3) project / encode / coerce
        Map<String, CovariateColumn> columns = new LinkedHashMap<>();
        for (MetadataColumn mc : metadata.getColumns()) {
            String engineName = codec.encode(mc.getName());
            columns.put(mc.getName(), coerce(mc, engineName, sampleIds));
        }

        // 4) explicit directives
        Map<String, String> chosen = new LinkedHashMap<>();
        if (referenceLevels != null) {
            for (String raw : referenceLevels) {
                ReferenceLevelDirective d = ReferenceLevelDirective.parse(raw);
                validate(d, metadata, sampleIds, variables, chosen.keySet());

                columns.put(d.getColumn(), columns.get(d.getColumn()).relevel(d.getLevel()));
                chosen.put(d.getColumn(), d.getLevel());
            }
        }

        // 5) defaults for the rest of the categorical formula variables
        for (String v : variables) {
            if (chosen.containsKey(v)) continue;
            CovariateColumn c = columns.get(v);
            if (c == null) continue;

            switch (c.getType()) {
                case CATEGORICAL: {
                    String ref = c.getReferenceLevel();
                    if (ref == null) break;
                    chosen.put(v, ref);
                    warningSink.warn(new AnalysisWarning(WarningCode.DEFAULT_REFERENCE_LEVEL, v,
                            "no reference level given; using the smallest level", v + "::" + ref));
                    break;
                }
                case NUMERIC:
                    break;
                default:
                    throw new IllegalStateException("unhandled column type: " + c.getType());
            }
        }

        return new CovariateTable(sampleIds, new ArrayList<>(columns.values()), chosen);
    }

    private static CovariateColumn coerce(MetadataColumn mc, String engineName, List<String> sampleIds) {
        switch (mc.getType()) {
            case CATEGORICAL: {
                List<String> labels = new ArrayList<>(sampleIds.size());
                for (String id : sampleIds) labels.add(mc.getValue(id));
                SortedSet<String> levels = mc.observedLevels(sampleIds);
                return CovariateColumn.categorical(mc.getName(), engineName, labels, new ArrayList<>(levels));
            }
            case NUMERIC: {
                double[] numbers = new double[sampleIds.size()];
                for (int i = 0; i < numbers.length; i++) numbers[i] = mc.getNumber(sampleIds.get(i));
                return CovariateColumn.numeric(mc.getName(), engineName, numbers);
            }
            default:
                throw new Ancombc2Exception(ErrorCode.UNKNOWN_COLUMN_TYPE,
                        "An unrecognized metadata column type (" + mc.getType() + ") was encountered for column \""
                                + mc.getName() + "\".");
        }
    }

    private static void validate(ReferenceLevelDirective d,
                                 SampleMetadata metadata,
                                 List<String> sampleIds,
                                 Collection<String> formulaVariables,
                                 Set<String> alreadyChosen) {
        String column = d.getColumn();
        String level = d.getLevel();

        MetadataColumn mc = metadata.getColumn(column);
        if (mc == null) {
            String msg = "The \"" + column + "\" column that was specified in the column-reference pair \""
                    + d.getRaw() + "\" was not found in the metadata.";
            if (column.indexOf(':') >= 0) {
                msg = msg + "\n\nNOTE: Your column name appears to contain a \":\", which can be a problem"
                        + " for this action.";
            }
            throw new Ancombc2Exception(ErrorCode.REFERENCE_COLUMN_NOT_FOUND, msg);
        }

        switch (mc.getType()) {
            case CATEGORICAL:
                break;
            case NUMERIC:
                throw new Ancombc2Exception(ErrorCode.REFERENCE_COLUMN_NUMERIC,
                        "One of the reference level columns is not a categorical metadata column."
                                + " Please make sure that all chosen reference level columns are categorical,"
                                + " and not numeric. Non-categorical column selected: \"" + column + "\"");
            default:
                throw new IllegalStateException("unhandled column type: " + mc.getType());
        }

        if (alreadyChosen.contains(column)) {
            throw new Ancombc2Exception(ErrorCode.DUPLICATE_REFERENCE_COLUMN,
                    "Only specify a reference level for a given categorical column once."
                            + " The \"" + column + "\" column was specified multiple times.");
        }

        SortedSet<String> inTable = mc.observedLevels(sampleIds);
        if (!inTable.contains(level)) {
            String msg;
            if (mc.observedLevels().contains(level)) {
                msg = "The level \"" + level + "\" of column \"" + column + "\" (pair \"" + d.getRaw()
                        + "\") is not associated with any sample of the feature table.";
            } else {
                msg = "The level \"" + level + "\" was not found in the \"" + column + "\" column of the metadata."
                        + " Please make sure each column::value pair is present within the metadata."
                        + " column::value pair with a value that was not found: \"" + d.getRaw() + "\"";
            }
            if (level.indexOf(':') >= 0) {
                msg = msg + "\n\nNOTE: Your level value appears to contain a \":\", which can be a problem"
                        + " for this action.";
            }
            throw new Ancombc2Exception(ErrorCode.REFERENCE_LEVEL_NOT_FOUND, msg);
        }

        if (!formulaVariables.contains(column)) {
            throw new Ancombc2Exception(ErrorCode.REFERENCE_COLUMN_NOT_IN_FORMULA,
                    "The reference level column \"" + column + "\" was not found within the formula terms.");
        }
    }
}
