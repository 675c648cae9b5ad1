package ai.rtlgraph.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expands the input paths into the ordered list of dump files to read:
 * - a regular file is taken as-is, in argument order
 * - a directory contributes every *.expand file below it, sorted
 */
public final class DumpFileFinder {

    public static final String DUMP_SUFFIX = ".expand";

    private final List<Path> inputs;

    public DumpFileFinder(List<Path> inputs) {
        this.inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
    }

    public List<Path> findAll() throws IOException {
        final List<Path> out = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isRegularFile(input)) {
                out.add(input);
                continue;
            }
            if (!Files.isDirectory(input)) {
                throw new NoSuchFileException(input.toString(), null, "input not found");
            }
            out.addAll(walk(input));
        }
        return out;
    }

    private static List<Path> walk(Path dir) throws IOException {
        final List<Path> found = new ArrayList<>();
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                final String name = d.getFileName() != null ? d.getFileName().toString() : "";
                if (".git".equals(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                final String name = file.getFileName() != null ? file.getFileName().toString() : "";
                if (attrs.isRegularFile() && name.endsWith(DUMP_SUFFIX)) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(found);
        return found;
    }
}
