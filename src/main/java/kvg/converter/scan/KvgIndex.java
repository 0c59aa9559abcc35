package kvg.converter.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The KanjiVG {@code kvg-index.json}: character -> diagram file names.
 * Only used to cross-check the diagrams found on disk.
 */
public final class KvgIndex {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, List<String>> filesByCharacter;

    private KvgIndex(Map<String, List<String>> filesByCharacter) {
        this.filesByCharacter = Collections.unmodifiableMap(filesByCharacter);
    }

    public static KvgIndex load(Path indexFile) throws IOException {
        Objects.requireNonNull(indexFile, "indexFile");
        if (!Files.isRegularFile(indexFile)) {
            throw new NoSuchFileException(indexFile.toString(), null, "index file not found");
        }

        final JsonNode root = MAPPER.readTree(indexFile.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Index file is not a JSON object: " + indexFile);
        }

        final Map<String, List<String>> out = new LinkedHashMap<>();
        final var fields = root.fields();
        while (fields.hasNext()) {
            final var e = fields.next();
            final JsonNode files = e.getValue();
            if (!files.isArray()) {
                throw new IOException("Index entry for '" + e.getKey() + "' is not a list: " + indexFile);
            }
            final List<String> names = new ArrayList<>(files.size());
            for (JsonNode f : files) {
                if (!f.isTextual()) {
                    throw new IOException("Index entry for '" + e.getKey() + "' has a non-string file name: " + indexFile);
                }
                names.add(f.asText());
            }
            out.put(e.getKey(), List.copyOf(names));
        }
        return new KvgIndex(out);
    }

    public List<String> filesFor(String character) {
        return filesByCharacter.getOrDefault(character, List.of());
    }

    public boolean lists(String character, String fileName) {
        return filesFor(character).contains(fileName);
    }

    public int characterCount() {
        return filesByCharacter.size();
    }
}
