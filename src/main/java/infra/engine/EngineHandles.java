package infra.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Process-wide handles to the engine: the {@code Rscript} executable and the driver script.
 *
 * <p>Resolved once, on first use, and read-only afterwards. Executable lookup order:
 * system property {@value #PROP_RSCRIPT}, environment {@value #ENV_RSCRIPT}, then {@code Rscript}
 * on the PATH. The driver script is extracted from the classpath resource {@value #SCRIPT_RESOURCE}.</p>
 */
public final class EngineHandles {

    private static final Logger log = LoggerFactory.getLogger(EngineHandles.class);

    public static final String PROP_RSCRIPT = "ancombc2.rscript";
    public static final String ENV_RSCRIPT = "ANCOMBC2_RSCRIPT";
    static final String DEFAULT_RSCRIPT = "Rscript";
    static final String SCRIPT_RESOURCE = "/engine/run_ancombc2.R";

    private static volatile EngineHandles shared;

    private final String rscript;
    private final Path script;

    private EngineHandles(String rscript, Path script) {
        this.rscript = rscript;
        this.script = script;
    }

    /**
     * The process-wide instance, resolved on first call.
     */
    public static EngineHandles get() {
        EngineHandles h = shared;
        if (h == null) {
            synchronized (EngineHandles.class) {
                h = shared;
                if (h == null) {
                    h = resolve();
                    shared = h;
                }
            }
        }
        return h;
    }

    /**
     * Explicit handles (tests, embedding). Not shared.
     */
    public static EngineHandles of(String rscript, Path script) {
        if (rscript == null || rscript.isBlank()) throw new IllegalArgumentException("rscript is blank");
        if (script == null) throw new IllegalArgumentException("script is null");
        return new EngineHandles(rscript.trim(), script);
    }

    /**
     * Same driver script, another executable.
     */
    public EngineHandles withRscript(String otherRscript) {
        return of(otherRscript, script);
    }

    public String getRscript() {
        return rscript;
    }

    public Path getScript() {
        return script;
    }

    static EngineHandles resolve() {
        String rscript = resolveRscript(System.getProperty(PROP_RSCRIPT), System.getenv(ENV_RSCRIPT));
        Path script = extractScript();
        log.info("[ENGINE] handles resolved. rscript={}, script={}", rscript, script);
        return new EngineHandles(rscript, script);
    }

    static String resolveRscript(String fromProperty, String fromEnv) {
        if (fromProperty != null && !fromProperty.isBlank()) return fromProperty.trim();
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
        return DEFAULT_RSCRIPT;
    }

    private static Path extractScript() {
        try (InputStream is = EngineHandles.class.getResourceAsStream(SCRIPT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("classpath resource not found: " + SCRIPT_RESOURCE);
            }
            Path p = Files.createTempFile("run_ancombc2-", ".R");
            p.toFile().deleteOnExit();
            Files.copy(is, p, StandardCopyOption.REPLACE_EXISTING);
            return p;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to extract " + SCRIPT_RESOURCE, e);
        }
    }
}
