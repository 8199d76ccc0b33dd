package infra.engine;

import domain.covariate.CovariateColumn;
import domain.covariate.CovariateTable;
import domain.engine.EngineParameters;
import domain.engine.ModelRequest;
import domain.engine.ModelResult;
import domain.engine.ModelRunner;
import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;
import domain.model.FeatureTable;
import domain.model.ResultTable;
import infra.table.TsvTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link ModelRunner} that runs ANCOM-BC2 through {@code Rscript}.
 *
 * <p>Data goes through an {@link EngineWorkspace}: the runner writes the feature table, the covariates,
 * their declared types and level order, and the parameters; the driver script writes the statistics
 * (and the structural zeros when requested) next to them.</p>
 */
public class RscriptModelRunner implements ModelRunner {

    private static final Logger log = LoggerFactory.getLogger(RscriptModelRunner.class);

    private static final int LOG_TAIL_LINES = 20;

    private final EngineHandles handles;
    private final String rscript;

    public RscriptModelRunner() {
        this(null, null);
    }

    /**
     * @param handles explicit handles, or null for the process-wide ones (resolved on first run)
     */
    public RscriptModelRunner(EngineHandles handles) {
        this(handles, null);
    }

    private RscriptModelRunner(EngineHandles handles, String rscript) {
        this.handles = handles;
        this.rscript = rscript;
    }

    /**
     * Process-wide driver script, but this runner's own executable.
     */
    public static RscriptModelRunner withRscript(String rscript) {
        if (rscript == null || rscript.isBlank()) throw new IllegalArgumentException("rscript is blank");
        return new RscriptModelRunner(null, rscript.trim());
    }

    @Override
    public ModelResult run(ModelRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        EngineHandles h = (handles == null) ? EngineHandles.get() : handles;
        if (rscript != null) h = h.withRscript(rscript);

        try (EngineWorkspace ws = EngineWorkspace.create()) {
            writeFeatureTable(ws.resolve(EngineWorkspace.FEATURE_TABLE), request.getFeatureTable());
            writeCovariates(ws.resolve(EngineWorkspace.COVARIATES), request.getCovariates());
            writeCovariateTypes(ws.resolve(EngineWorkspace.COVARIATE_TYPES), request.getCovariates());
            writeParameters(ws.resolve(EngineWorkspace.PARAMETERS), request);

            List<String> command = List.of(h.getRscript(), h.getScript().toString(), ws.dir().toString());
            Path engineLog = ws.resolve(EngineWorkspace.ENGINE_LOG);
            log.info("[ENGINE] {}", String.join(" ", command));

            Process process;
            try {
                process = new ProcessBuilder(command)
                        .redirectErrorStream(true)
                        .redirectOutput(engineLog.toFile())
                        .start();
            } catch (IOException e) {
                throw new Ancombc2Exception(ErrorCode.ENGINE_FAILURE,
                        "An error was encountered while running ANCOM-BC2 in R: could not start \""
                                + h.getRscript() + "\" (" + e.getMessage() + ").", e);
            }

            int exit;
            try {
                exit = process.waitFor();
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }

            if (exit != 0) {
                throw new Ancombc2Exception(ErrorCode.ENGINE_FAILURE,
                        "An error was encountered while running ANCOM-BC2 in R (exit code " + exit + ").\n"
                                + tail(engineLog));
            }

            ResultTable statistics = readOutput(ws.resolve(EngineWorkspace.STATISTICS), exit);
            ResultTable zeros = request.getParameters().isStructuralZeros()
                    ? readOutput(ws.resolve(EngineWorkspace.STRUCTURAL_ZEROS), exit)
                    : null;
            return new ModelResult(statistics, zeros);
        }
    }

    private static ResultTable readOutput(Path p, int exit) {
        if (!Files.isRegularFile(p)) {
            throw new Ancombc2Exception(ErrorCode.ENGINE_FAILURE,
                    "ANCOM-BC2 in R finished (exit code " + exit + ") without writing " + p.getFileName() + ".");
        }
        return TsvTables.readResultTable(p);
    }

    static void writeFeatureTable(Path p, FeatureTable table) {
        List<String> header = new ArrayList<>(table.sampleCount() + 1);
        header.add("feature-id");
        header.addAll(table.getSampleIds());

        List<List<String>> rows = new ArrayList<>(table.featureCount());
        for (int f = 0; f < table.featureCount(); f++) {
            List<String> row = new ArrayList<>(table.sampleCount() + 1);
            row.add(table.getFeatureIds().get(f));
            for (int s = 0; s < table.sampleCount(); s++) {
                row.add(formatCount(table.getCount(f, s)));
            }
            rows.add(row);
        }
        TsvTables.writeRows(p, TsvTables.QUOTED, header, rows);
    }

    static void writeCovariates(Path p, CovariateTable covariates) {
        List<CovariateColumn> columns = covariates.getColumns();

        List<String> header = new ArrayList<>(columns.size() + 1);
        header.add("sample-id");
        for (CovariateColumn c : columns) header.add(c.getEngineName());

        List<List<String>> rows = new ArrayList<>(covariates.getSampleIds().size());
        for (int r = 0; r < covariates.getSampleIds().size(); r++) {
            List<String> row = new ArrayList<>(columns.size() + 1);
            row.add(covariates.getSampleIds().get(r));
            for (CovariateColumn c : columns) row.add(c.cell(r));
            rows.add(row);
        }
        TsvTables.writeRows(p, TsvTables.QUOTED, header, rows);
    }

    /**
     * One row per (column, level) for categorical columns, in level order (reference first);
     * one row with an empty level for numeric columns.
     */
    static void writeCovariateTypes(Path p, CovariateTable covariates) {
        List<List<String>> rows = new ArrayList<>();
        for (CovariateColumn c : covariates.getColumns()) {
            switch (c.getType()) {
                case CATEGORICAL:
                    for (String level : c.getLevels()) {
                        rows.add(List.of(c.getEngineName(), c.getType().tag(), level));
                    }
                    break;
                case NUMERIC:
                    rows.add(List.of(c.getEngineName(), c.getType().tag(), ""));
                    break;
                default:
                    throw new IllegalStateException("unhandled column type: " + c.getType());
            }
        }
        TsvTables.writeRows(p, TsvTables.QUOTED, List.of("name", "type", "level"), rows);
    }

    static void writeParameters(Path p, ModelRequest request) {
        EngineParameters params = request.getParameters();

        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("fix_formula", request.getFixedEffects()));
        rows.add(List.of("rand_formula", randomInterceptFormula(request.getRandomEffects())));
        rows.add(List.of("group", request.getGroup() == null ? "" : request.getGroup()));
        rows.add(List.of("p_adj_method", params.getPAdjustMethod().getEngineName()));
        rows.add(List.of("prv_cut", String.valueOf(params.getPrevalenceCutoff())));
        rows.add(List.of("lib_cut", String.valueOf(params.getLibCut())));
        rows.add(List.of("tol", String.valueOf(params.getTol())));
        rows.add(List.of("max_iter", String.valueOf(params.getMaxIter())));
        rows.add(List.of("alpha", String.valueOf(params.getAlpha())));
        rows.add(List.of("struc_zero", params.isStructuralZeros() ? "TRUE" : "FALSE"));
        rows.add(List.of("neg_lb", params.isAsymptoticCutoff() ? "TRUE" : "FALSE"));
        rows.add(List.of("n_cl", String.valueOf(params.getNumProcesses())));
        TsvTables.writeRows(p, TsvTables.QUOTED, List.of("key", "value"), rows);
    }

    /**
     * Turns an engine random-effects formula into random intercepts: {@code "a + b - a"} becomes
     * {@code "(1 | b)"}. A term after {@code -} is dropped, as in the fixed effects.
     *
     * @return the engine formula, or "" when there is none or every term was excluded
     */
    static String randomInterceptFormula(String engineFormula) {
        if (engineFormula == null || engineFormula.isBlank()) return "";

        Set<String> kept = new LinkedHashSet<>();
        boolean exclude = false;
        for (String token : engineFormula.trim().split("\\s+")) {
            if (token.equals("+")) {
                exclude = false;
            } else if (token.equals("-")) {
                exclude = true;
            } else if (exclude) {
                kept.remove(token);
            } else {
                kept.add(token);
            }
        }
        return kept.stream()
                .map(t -> "(1 | " + t + ")")
                .collect(Collectors.joining(" + "));
    }

    private static String formatCount(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return String.valueOf((long) d);
        }
        return String.valueOf(d);
    }

    private static String tail(Path engineLog) {
        if (!Files.isRegularFile(engineLog)) return "(no engine output)";
        try {
            List<String> lines = Files.readAllLines(engineLog, StandardCharsets.UTF_8);
            int from = Math.max(0, lines.size() - LOG_TAIL_LINES);
            return String.join("\n", lines.subList(from, lines.size()));
        } catch (IOException e) {
            return "(engine output unreadable: " + e.getMessage() + ")";
        }
    }
}
