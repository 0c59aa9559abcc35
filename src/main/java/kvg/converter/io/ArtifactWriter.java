package kvg.converter.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import kvg.converter.index.Corpus;
import kvg.converter.model.Ids;
import kvg.converter.model.KanjiRecord;

/**
 * Writes a {@link Corpus} below the output directory:
 * <pre>
 * individual/&lt;variantKey&gt;.json   one KanjiRecord each
 * lookup-index.json              variantKey -> individual/&lt;variantKey&gt;.json
 * kanjivg-index.json             character -> [variantKey, ...]
 * radical-index.json             radical element -> [character, ...]
 * range-index.json               unicode range tag -> [variantKey, ...]
 * </pre>
 * Null properties are left out unless the type says otherwise; that is the only place the
 * "absent means omitted" rule lives.
 */
public final class ArtifactWriter {

    public static final String LOOKUP_INDEX = "lookup-index.json";
    public static final String CHARACTER_INDEX = "kanjivg-index.json";
    public static final String RADICAL_INDEX = "radical-index.json";
    public static final String RANGE_INDEX = "range-index.json";

    private final Path outDir;
    private final ObjectMapper jsonMapper;

    public ArtifactWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);
        jsonMapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public void writeAll(Corpus corpus) throws IOException {
        Objects.requireNonNull(corpus, "corpus");

        final Path individualDir = outDir.resolve(Ids.INDIVIDUAL_DIR);
        Files.createDirectories(individualDir);

        for (KanjiRecord record : corpus.records()) {
            writeJson(outDir.resolve(Ids.relativePath(record.variantKey())), record);
        }

        writeJson(outDir.resolve(LOOKUP_INDEX), corpus.lookupIndex());
        writeJson(outDir.resolve(CHARACTER_INDEX), corpus.characterIndex());
        writeJson(outDir.resolve(RADICAL_INDEX), corpus.radicalIndex());
        writeJson(outDir.resolve(RANGE_INDEX), corpus.rangeIndex());

        removeStaleRecords(individualDir, corpus.lookupIndex().values());
    }

    // Runs last, so a failed write leaves the previous indices pointing at files that still exist.
    private void removeStaleRecords(Path individualDir, Collection<String> current) throws IOException {
        final Set<Path> keep = new HashSet<>();
        for (String relative : current) {
            keep.add(outDir.resolve(relative).normalize());
        }
        final List<Path> stale;
        try (var paths = Files.list(individualDir)) {
            stale = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .filter(p -> !keep.contains(p.normalize()))
                    .toList();
        }
        for (Path p : stale) {
            Files.delete(p);
        }
    }

    private void writeJson(Path file, Object data) throws IOException {
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            jsonMapper.writeValue(bw, data);
            bw.write('\n');
        }
    }
}
