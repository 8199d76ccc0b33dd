package cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Resolves the CLI's input and output paths against one base directory.
 *
 * <p>The base directory comes from {@code --baseDir}, then the {@value #PROP_BASE_DIR} system property,
 * then the working directory. Relative paths are taken against it; absolute paths are kept.</p>
 */
public final class CliPathResolver {

    public static final String PROP_BASE_DIR = "baseDir";

    private final Path baseDir;

    private CliPathResolver(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static CliPathResolver fromArgs(Map<String, String> argv) {
        String raw = trimToNull(argv == null ? null : argv.get("baseDir"));
        if (raw == null) raw = trimToNull(System.getProperty(PROP_BASE_DIR));
        Path base = (raw == null) ? Paths.get(System.getProperty("user.dir")) : Paths.get(raw);
        return new CliPathResolver(base.toAbsolutePath().normalize());
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * @return the resolved path, or null when {@code raw} is blank
     */
    public Path resolve(String raw) {
        String v = trimToNull(raw);
        if (v == null) return null;
        Path p = Paths.get(v);
        return (p.isAbsolute() ? p : baseDir.resolve(p)).normalize();
    }

    public Path resolveOrDefault(String raw, String fallback) {
        Path p = resolve(raw);
        return (p != null) ? p : resolve(fallback);
    }

    /**
     * An input file that must already exist.
     *
     * @param option option name, used in the message
     */
    public Path requireFile(String raw, String option) {
        Path p = resolve(raw);
        if (p == null) throw new IllegalArgumentException("--" + option + " is required");
        if (!Files.isRegularFile(p)) throw new IllegalArgumentException("--" + option + " not found: " + p);
        return p;
    }

    public static void mkdirs(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create directory: " + dir, e);
        }
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
