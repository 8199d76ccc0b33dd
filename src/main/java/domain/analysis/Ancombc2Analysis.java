package domain.analysis;

import domain.covariate.CovariateTable;
import domain.covariate.CovariateTableBuilder;
import domain.engine.EngineParameters;
import domain.engine.ModelRequest;
import domain.engine.ModelResult;
import domain.engine.ModelRunner;
import domain.formula.FormulaTranslator;
import domain.formula.IdentifierCodec;
import domain.formula.TranslatedFormula;
import domain.model.AnalysisWarning;
import domain.model.AnalysisWarningSink;
import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;
import domain.model.FeatureTable;
import domain.model.ListAnalysisWarningSink;
import domain.model.MetadataColumn;
import domain.model.ResultTable;
import domain.model.SampleMetadata;
import domain.model.WarningCode;
import domain.result.ColumnDisambiguator;
import domain.result.ResultSlice;
import domain.result.ResultSliceSplitter;
import domain.result.Statistic;
import domain.result.StructuralZeroReformatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One differential-abundance run, from caller names to disambiguated slices.
 *
 * <ol>
 *   <li>preconditions and sample cross-validation</li>
 *   <li>formula translation (fixed and random effects share one codec)</li>
 *   <li>covariate table: coercion, releveling, default references</li>
 *   <li>one blocking engine call</li>
 *   <li>split, disambiguate, deduce references, structural zeros</li>
 * </ol>
 *
 * <p>Every call builds its own codec and ledger; instances are stateless apart from the runner.</p>
 */
public class Ancombc2Analysis {

    private static final Logger log = LoggerFactory.getLogger(Ancombc2Analysis.class);

    private final ModelRunner runner;

    public Ancombc2Analysis(ModelRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public AnalysisResult run(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");

        List<AnalysisWarning> warnings = new ArrayList<>(32);
        AnalysisWarningSink sink = new ListAnalysisWarningSink(warnings);

        SampleMetadata metadata = request.getMetadata();
        FeatureTable table = request.getFeatureTable();
        EngineParameters params = request.getParameters();

        // ------------------------------------------------------------
        // 1) preconditions / samples
        // ------------------------------------------------------------
        checkGroup(request.getGroup(), params, metadata);
        List<String> sampleIds = crossValidateSamples(table, metadata, sink);
        log.info("[STEP1] samples={}, features={}, metadataColumns={}",
                sampleIds.size(), table.featureCount(), metadata.getColumnNames().size());

        // ------------------------------------------------------------
        // 2) formulas
        // ------------------------------------------------------------
        IdentifierCodec codec = new IdentifierCodec();
        FormulaTranslator translator = new FormulaTranslator(codec, sink);

        TranslatedFormula fixed = translator.translate(request.getFixedEffects(), metadata);
        TranslatedFormula random = (request.getRandomEffects() == null)
                ? null
                : translator.translate(request.getRandomEffects(), metadata);
        log.info("[STEP2] fixed effects: \"{}\" -> \"{}\"", fixed.getOriginalFormula(), fixed.getEngineFormula());
        if (random != null) {
            log.info("[STEP2] random effects: \"{}\" -> \"{}\"", random.getOriginalFormula(), random.getEngineFormula());
        }

        // ------------------------------------------------------------
        // 3) covariates
        // ------------------------------------------------------------
        CovariateTable covariates = new CovariateTableBuilder(codec, sink)
                .build(metadata, sampleIds, fixed.getVariables(), request.getReferenceLevels());
        String engineGroup = (request.getGroup() == null) ? null : codec.getLedger().engineOf(request.getGroup());
        log.info("[STEP3] covariates={}, referenceLevels={}",
                covariates.getColumns().size(), covariates.getReferenceLevelDirectives());

        // ------------------------------------------------------------
        // 4) engine
        // ------------------------------------------------------------
        ModelRequest modelRequest = new ModelRequest(table, covariates, fixed.getEngineFormula(),
                random == null ? null : random.getEngineFormula(), engineGroup, params);
        long t0 = System.nanoTime();
        ModelResult modelResult = callEngine(modelRequest);
        log.info("[ENGINE] done. rows={}, columns={}, elapsed={}ms",
                modelResult.getStatistics().rowCount(), modelResult.getStatistics().columnCount(), ms(t0));

        // ------------------------------------------------------------
        // 5) slices
        // ------------------------------------------------------------
        Map<Statistic, ResultTable> split = new ResultSliceSplitter(sink)
                .split(modelResult.getStatistics(), Arrays.asList(Statistic.values()));

        ColumnDisambiguator disambiguator = new ColumnDisambiguator(metadata, codec.getLedger(), sampleIds, sink);
        Map<String, String> references = disambiguator.deduceReferenceLevels(split.get(Statistic.LFC));
        checkReferencesAgree(references, covariates);

        List<ResultSlice> slices = new ArrayList<>();
        for (Map.Entry<Statistic, ResultTable> e : split.entrySet()) {
            Statistic s = e.getKey();
            slices.add(disambiguator.disambiguate(s.getSliceName(), s.isFlag(), e.getValue(), references));
        }
        log.info("[STEP4] slices={}, referenceLevels={}", split.size(), references);

        if (params.isStructuralZeros()) {
            ResultTable zeros = modelResult.getStructuralZeros();
            if (zeros == null) {
                throw new Ancombc2Exception(ErrorCode.MISSING_STATISTIC,
                        "Structural zero detection was requested but the engine returned no structural zero table.");
            }
            ResultTable bare = new StructuralZeroReformatter(sink).reformat(zeros);
            slices.add(disambiguator.disambiguate(ResultSlice.STRUCTURAL_ZEROS, true, bare, references));
            log.info("[STEP5] structural zeros: columns={}", bare.columnCount());
        }

        for (AnalysisWarning w : warnings) {
            log.warn("[WARN] {}", w);
        }

        return new AnalysisResult(slices, references, fixed, random, codec.getLedger().asMap(), warnings);
    }

    private static void checkGroup(String group, EngineParameters params, SampleMetadata metadata) {
        if (group == null) {
            if (params.isStructuralZeros()) {
                throw new Ancombc2Exception(ErrorCode.GROUP_REQUIRED,
                        "The structural zeros option was enabled but no group was provided."
                                + " Please provide a group column.");
            }
            return;
        }

        MetadataColumn column = metadata.getColumn(group);
        if (column == null) {
            throw new Ancombc2Exception(ErrorCode.GROUP_NOT_FOUND,
                    "The group column \"" + group + "\" was not found in the metadata.");
        }
        switch (column.getType()) {
            case CATEGORICAL:
                return;
            case NUMERIC:
                throw new Ancombc2Exception(ErrorCode.GROUP_NOT_CATEGORICAL,
                        "The group column \"" + group + "\" must be categorical, not numeric.");
            default:
                throw new IllegalStateException("unhandled column type: " + column.getType());
        }
    }

    /**
     * @return the samples of the feature table, in table order
     */
    private static List<String> crossValidateSamples(FeatureTable table, SampleMetadata metadata,
                                                     AnalysisWarningSink sink) {
        List<String> missing = new ArrayList<>();
        for (String id : table.getSampleIds()) {
            if (!metadata.hasSample(id)) missing.add(id);
        }
        if (!missing.isEmpty()) {
            throw new Ancombc2Exception(ErrorCode.SAMPLES_MISSING_FROM_METADATA,
                    "Not all samples present within the feature table were found in the associated metadata."
                            + " Missing sample ids: " + missing);
        }

        Set<String> inTable = new HashSet<>(table.getSampleIds());
        Set<String> dropped = new LinkedHashSet<>();
        for (String id : metadata.getSampleIds()) {
            if (!inTable.contains(id)) dropped.add(id);
        }
        if (!dropped.isEmpty()) {
            sink.warn(new AnalysisWarning(WarningCode.METADATA_SAMPLES_DROPPED, String.valueOf(dropped.size()),
                    "metadata samples not in the feature table were left out", String.join(", ", dropped)));
        }
        return table.getSampleIds();
    }

    private ModelResult callEngine(ModelRequest modelRequest) {
        log.info("[ENGINE] running. fixed=\"{}\", random=\"{}\", group={}, {}",
                modelRequest.getFixedEffects(),
                modelRequest.getRandomEffects() == null ? "" : modelRequest.getRandomEffects(),
                modelRequest.getGroup() == null ? "" : modelRequest.getGroup(),
                modelRequest.getParameters());
        try {
            ModelResult result = runner.run(modelRequest);
            if (result == null) {
                throw new Ancombc2Exception(ErrorCode.ENGINE_FAILURE,
                        "An error was encountered while running ANCOM-BC2: the engine returned no result.");
            }
            return result;
        } catch (Ancombc2Exception e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Ancombc2Exception(ErrorCode.ENGINE_FAILURE,
                    "An error was encountered while running ANCOM-BC2: the engine call was interrupted.", e);
        } catch (IOException | RuntimeException e) {
            throw new Ancombc2Exception(ErrorCode.ENGINE_FAILURE,
                    "An error was encountered while running ANCOM-BC2 in R: " + e.getMessage(), e);
        }
    }

    /**
     * Variables releveled before the fit must come back with the same reference.
     */
    private static void checkReferencesAgree(Map<String, String> deduced, CovariateTable covariates) {
        for (Map.Entry<String, String> e : deduced.entrySet()) {
            String requested = covariates.getReferenceLevels().get(e.getKey());
            if (requested != null && !requested.equals(e.getValue())) {
                throw new Ancombc2Exception(ErrorCode.REFERENCE_LEVEL_UNDETERMINED,
                        "The engine output implies reference level \"" + e.getValue() + "\" for \"" + e.getKey()
                                + "\", but the covariate table was releveled to \"" + requested + "\".");
            }
        }
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
