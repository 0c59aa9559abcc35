package kvg.converter.scan;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramFileFinderTest {

    @Test
    void listsSvgFilesSortedByName(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("04e01.svg"), "<svg/>");
        Files.writeString(tmp.resolve("04e00.svg"), "<svg/>");
        Files.writeString(tmp.resolve("04e00-Kaisho.svg"), "<svg/>");
        Files.writeString(tmp.resolve("README.md"), "not a diagram");
        Files.createDirectories(tmp.resolve("nested.svg"));

        final List<Path> files = new DiagramFileFinder(tmp).findDiagramFiles();

        assertEquals(List.of("04e00-Kaisho.svg", "04e00.svg", "04e01.svg"),
                files.stream().map(p -> p.getFileName().toString()).toList());
    }

    @Test
    void missingDirectoryIsFatal(@TempDir Path tmp) {
        assertThrows(NoSuchFileException.class, () -> new DiagramFileFinder(tmp.resolve("kanji")).findDiagramFiles());
    }
}
