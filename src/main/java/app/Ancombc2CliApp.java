package app;

import cli.Ancombc2Cli;
import cli.CliArgParser;
import cli.CliPathResolver;
import domain.analysis.AnalysisRequest;
import domain.analysis.AnalysisResult;
import domain.analysis.Ancombc2Analysis;
import domain.engine.EngineParameters;
import domain.engine.ModelRunner;
import domain.engine.PAdjustMethod;
import domain.model.Ancombc2Exception;
import domain.model.ErrorCategory;
import domain.model.FeatureTable;
import domain.model.SampleMetadata;
import domain.output.ResultWriter;
import domain.result.ResultSlice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link Ancombc2Cli}). */
public final class Ancombc2CliApp {

    private static final Logger log = LoggerFactory.getLogger(Ancombc2CliApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_VALIDATION = 2;
    static final int EXIT_ENGINE = 3;

    static final String DEFAULT_OUT = "output/ancombc2";

    private Ancombc2CliApp() {}

    /**
     * @return process exit status
     */
    public static int run(String[] args) {
        return run(args, new Ancombc2ComponentsFactory(), null);
    }

    /**
     * @param runner engine to use instead of the factory's, or null
     */
    static int run(String[] args, Ancombc2ComponentsFactory factory, ModelRunner runner) {
        try {
            execute(args, factory, runner);
            return EXIT_OK;
        } catch (Ancombc2Exception e) {
            log.error("[FAIL] {}/{}: {}", e.getCategory(), e.getCode(), e.getMessage());
            return e.getCategory() == ErrorCategory.EXTERNAL_ENGINE ? EXIT_ENGINE : EXIT_VALIDATION;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("[FAIL] {}", e.getMessage(), e);
            return EXIT_USAGE;
        }
    }

    private static void execute(String[] args, Ancombc2ComponentsFactory factory, ModelRunner runnerOverride) {
        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir + paths
        // ------------------------------------------------------------
        CliPathResolver paths = CliPathResolver.fromArgs(argv);
        Path baseDir = paths.getBaseDir();

        Path tablePath = paths.resolve(argv.get("table"));
        Path metadataPath = paths.resolve(argv.get("metadata"));
        Path outDir = paths.resolveOrDefault(argv.get("out"), DEFAULT_OUT);
        Path resultXlsx = paths.resolve(argv.get("xlsx"));

        String rscript = CliPathResolver.trimToNull(argv.get("rscript"));

        // ------------------------------------------------------------
        // model options
        // ------------------------------------------------------------
        String fixedEffects = argv.get("fixedEffects");
        String randomEffects = CliPathResolver.trimToNull(argv.get("randomEffects"));
        List<String> referenceLevels = CliArgParser.parseList(argv.get("referenceLevels"));
        String group = CliPathResolver.trimToNull(argv.get("group"));

        EngineParameters params = EngineParameters.builder()
                .pAdjustMethod(PAdjustMethod.parse(argv.get("pAdjustMethod")))
                .prevalenceCutoff(CliArgParser.parseDouble("prevalenceCutoff", argv.get("prevalenceCutoff"), 0.1))
                .libCut(CliArgParser.parseInt("libCut", argv.get("libCut"), 0))
                .tol(CliArgParser.parseDouble("tol", argv.get("tol"), 1e-2))
                .maxIter(CliArgParser.parseInt("maxIter", argv.get("maxIter"), 20))
                .alpha(CliArgParser.parseDouble("alpha", argv.get("alpha"), 0.05))
                .structuralZeros(CliArgParser.flag(argv, "structuralZeros"))
                .asymptoticCutoff(CliArgParser.flag(argv, "asymptoticCutoff"))
                .numProcesses(CliArgParser.parseInt("numProcesses", argv.get("numProcesses"), 1))
                .build();

        log.info("==================================================");
        log.info("[START] ANCOM-BC2");
        log.info("[CONF] baseDir         = {}", baseDir);
        log.info("[CONF] table           = {}", tablePath);
        log.info("[CONF] metadata        = {}", metadataPath);
        log.info("[CONF] fixedEffects    = {}", fixedEffects == null ? "" : fixedEffects);
        log.info("[CONF] randomEffects   = {}", randomEffects == null ? "" : randomEffects);
        log.info("[CONF] referenceLevels = {}", referenceLevels);
        log.info("[CONF] group           = {}", group == null ? "" : group);
        log.info("[CONF] parameters      = {}", params);
        log.info("[CONF] rscript         = {}", rscript == null ? "(default lookup)" : rscript);
        log.info("[CONF] out             = {}", outDir);
        log.info("[CONF] xlsx            = {} (use --xlsx=<file>)", resultXlsx == null ? "off" : resultXlsx);
        log.info("==================================================");

        paths.requireFile(argv.get("table"), "table");
        paths.requireFile(argv.get("metadata"), "metadata");

        // ------------------------------------------------------------
        // inputs
        // ------------------------------------------------------------
        long tLoad0 = System.nanoTime();
        FeatureTable table = factory.loadFeatureTable(tablePath);
        SampleMetadata metadata = factory.loadMetadata(metadataPath);
        log.info("[LOAD] features={}, samples={}, metadataSamples={}, metadataColumns={}, elapsed={}ms",
                table.featureCount(), table.sampleCount(), metadata.getSampleIds().size(),
                metadata.getColumnNames().size(), ms(tLoad0));

        AnalysisRequest request = AnalysisRequest.builder(table, metadata)
                .fixedEffects(fixedEffects)
                .randomEffects(randomEffects)
                .referenceLevels(referenceLevels)
                .group(group)
                .parameters(params)
                .build();

        // ------------------------------------------------------------
        // run
        // ------------------------------------------------------------
        ModelRunner runner = (runnerOverride != null) ? runnerOverride : factory.createModelRunner(rscript);
        Ancombc2Analysis analysis = factory.createAnalysis(runner);
        AnalysisResult result = analysis.run(request);

        // ------------------------------------------------------------
        // outputs
        // ------------------------------------------------------------
        long tOut0 = System.nanoTime();
        CliPathResolver.mkdirs(outDir);
        factory.createBundleWriter().write(outDir, result);
        for (ResultSlice s : result.getSlices()) {
            log.info("[OUT] {} rows={}, columns={}", s.getFileName(), s.getTable().rowCount(),
                    s.getTable().columnCount());
        }

        ResultWriter resultWriter = factory.createResultWriter(resultXlsx != null);
        resultWriter.write(resultXlsx, result);
        log.info("[OUT] bundle written. elapsed={}ms", ms(tOut0));

        log.info("[STAT] warnings={}", result.getWarnings().size());
        log.info("==================================================");
        log.info("[DONE] totalElapsed={}ms", ms(t0));
        log.info("==================================================");
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
