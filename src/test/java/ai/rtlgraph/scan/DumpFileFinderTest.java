package ai.rtlgraph.scan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DumpFileFinderTest {

    @TempDir
    Path tmp;

    @Test
    void whenFinding_givenDirectory_shouldReturnSortedExpandDumpsOnly() throws Exception {
        final Path b = Files.writeString(tmp.resolve("b.c.233r.expand"), "");
        final Path a = Files.writeString(tmp.resolve("a.c.233r.expand"), "");
        Files.writeString(tmp.resolve("a.c"), "int main(void) { return 0; }");
        Files.createDirectories(tmp.resolve("sub"));
        final Path c = Files.writeString(tmp.resolve("sub/c.c.233r.expand"), "");

        final List<Path> found = new DumpFileFinder(List.of(tmp)).findAll();

        assertEquals(List.of(a, b, c), found);
    }

    @Test
    void whenFinding_givenExplicitFiles_shouldKeepArgumentOrderAndAnySuffix() throws Exception {
        final Path second = Files.writeString(tmp.resolve("z.rtl"), "");
        final Path first = Files.writeString(tmp.resolve("a.c.233r.expand"), "");

        final List<Path> found = new DumpFileFinder(List.of(second, first)).findAll();

        assertEquals(List.of(second, first), found);
    }

    @Test
    void whenFinding_givenMissingPath_shouldThrow() {
        final DumpFileFinder finder = new DumpFileFinder(List.of(tmp.resolve("missing.expand")));

        assertThrows(NoSuchFileException.class, finder::findAll);
    }
}
