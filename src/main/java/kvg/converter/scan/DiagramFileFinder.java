package kvg.converter.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Lists the diagram files of a KanjiVG directory: {@code <hex>.svg} and {@code <hex>-<variant>.svg},
 * sorted by file name so runs are reproducible.
 */
public final class DiagramFileFinder {

    public static final String EXTENSION = ".svg";

    private final Path kanjiDir;

    public DiagramFileFinder(Path kanjiDir) {
        this.kanjiDir = Objects.requireNonNull(kanjiDir, "kanjiDir");
    }

    public List<Path> findDiagramFiles() throws IOException {
        if (!Files.isDirectory(kanjiDir)) {
            throw new NoSuchFileException(kanjiDir.toString(), null, "diagram directory not found");
        }
        try (var paths = Files.list(kanjiDir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        final var name = path.getFileName() != null ? path.getFileName().toString() : "";
                        return name.endsWith(EXTENSION);
                    })
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }
}
