package kvg.converter.scan;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Copies classpath fixtures into a scratch directory.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Path resource(String name) {
        try {
            return Path.of(Objects.requireNonNull(Fixtures.class.getClassLoader().getResource(name), name).toURI());
        } catch (URISyntaxException ex) {
            throw new IllegalStateException(ex);
        }
    }

    /** Copies the named diagrams from {@code kanji/} into {@code dir}. */
    public static Path copyDiagrams(Path dir, String... fileNames) throws IOException {
        Files.createDirectories(dir);
        for (String name : fileNames) {
            Files.copy(resource("kanji/" + name), dir.resolve(name));
        }
        return dir;
    }
}
