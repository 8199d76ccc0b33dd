package infra.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Temporary directory for one handoff to the engine. Acquire with try-with-resources; the directory
 * and everything in it is removed on close, on success and on failure alike.
 */
final class EngineWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EngineWorkspace.class);

    static final String FEATURE_TABLE = "feature-table.tsv";
    static final String COVARIATES = "covariates.tsv";
    static final String COVARIATE_TYPES = "covariate-types.tsv";
    static final String PARAMETERS = "parameters.tsv";
    static final String STATISTICS = "model-statistics.tsv";
    static final String STRUCTURAL_ZEROS = "structural-zeros.tsv";
    static final String ENGINE_LOG = "engine.log";

    private final Path dir;

    private EngineWorkspace(Path dir) {
        this.dir = dir;
    }

    static EngineWorkspace create() throws IOException {
        return new EngineWorkspace(Files.createTempDirectory("ancombc2-"));
    }

    Path dir() {
        return dir;
    }

    Path resolve(String name) {
        return dir.resolve(name);
    }

    @Override
    public void close() {
        if (!Files.exists(dir)) return;
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("[ENGINE] workspace not removed: {} ({})", dir, e.toString());
            return;
        }
        for (Path p : paths) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                log.warn("[ENGINE] workspace file not removed: {} ({})", p, e.toString());
            }
        }
    }
}
