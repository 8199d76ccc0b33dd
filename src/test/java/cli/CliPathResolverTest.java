package cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliPathResolverTest {

    @TempDir
    Path tmp;

    @Test
    void resolve_shouldUseBaseDirForRelativePaths() {
        CliPathResolver paths = CliPathResolver.fromArgs(Map.of("baseDir", tmp.toString()));

        assertEquals(tmp.toAbsolutePath().normalize(), paths.getBaseDir());
        assertEquals(paths.getBaseDir().resolve("in/table.tsv"), paths.resolve(" in/table.tsv "));
        assertNull(paths.resolve("  "));
        assertEquals(paths.getBaseDir().resolve("output/ancombc2"), paths.resolveOrDefault(null, "output/ancombc2"));
    }

    @Test
    void resolve_shouldKeepAbsolutePaths() {
        CliPathResolver paths = CliPathResolver.fromArgs(Map.of("baseDir", tmp.toString()));
        Path elsewhere = tmp.resolveSibling("elsewhere").toAbsolutePath().normalize();

        assertEquals(elsewhere, paths.resolve(elsewhere.toString()));
    }

    @Test
    void requireFile_shouldNameTheOption_whenFileIsMissing() throws Exception {
        CliPathResolver paths = CliPathResolver.fromArgs(Map.of("baseDir", tmp.toString()));
        Files.writeString(tmp.resolve("metadata.tsv"), "id\tx\n");

        assertEquals(tmp.resolve("metadata.tsv").toAbsolutePath().normalize(),
                paths.requireFile("metadata.tsv", "metadata"));

        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> paths.requireFile("table.tsv", "table"));
        assertTrue(missing.getMessage().startsWith("--table not found"));

        IllegalArgumentException absent = assertThrows(IllegalArgumentException.class,
                () -> paths.requireFile(null, "table"));
        assertEquals("--table is required", absent.getMessage());
    }
}
