package kvg.converter.index;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import kvg.converter.convert.StrokeFlattener;
import kvg.converter.convert.TreeConverter;
import kvg.converter.model.Ids;
import kvg.converter.model.KanjiRecord;
import kvg.converter.model.SourceDiagram;
import kvg.converter.scan.DiagramFileFinder;
import kvg.converter.scan.DiagramFormatException;
import kvg.converter.scan.DiagramReader;
import kvg.converter.scan.KvgIndex;

/**
 * Runs every diagram file through read -> convert -> flatten and feeds the result to the
 * {@link IndexBuilder}. A file that cannot be read is reported and left out; everything else
 * about the run is unaffected by it.
 */
public final class CorpusBuilder {

    static final int PROGRESS_EVERY = 100;

    private final DiagramFileFinder finder;
    private final KvgIndex kvgIndex;
    private final DiagramReader reader = new DiagramReader();
    private final TreeConverter converter = new TreeConverter();
    private final StrokeFlattener flattener = new StrokeFlattener();

    public CorpusBuilder(DiagramFileFinder finder, KvgIndex kvgIndex) {
        this.finder = Objects.requireNonNull(finder, "finder");
        this.kvgIndex = Objects.requireNonNull(kvgIndex, "kvgIndex");
    }

    /**
     * @throws IOException                  if the diagram directory cannot be listed
     * @throws DuplicateVariantKeyException if two diagrams claim the same variant key
     */
    public Corpus build() throws IOException {
        final List<Path> files = finder.findDiagramFiles();
        final IndexBuilder indices = new IndexBuilder();
        final List<String> failed = new ArrayList<>();
        int unindexed = 0;

        for (int i = 0; i < files.size(); i++) {
            if (i % PROGRESS_EVERY == 0) {
                System.out.println("Processing " + (i + 1) + "/" + files.size() + "...");
            }
            final Path file = files.get(i);
            final String fileName = file.getFileName().toString();

            final KanjiRecord record;
            try {
                record = toRecord(reader.read(file));
            } catch (DiagramFormatException | IOException ex) {
                failed.add(fileName);
                System.err.println("WARN: skipped " + file + " -> " + safeMsg(ex.getMessage()));
                continue;
            }

            if (!kvgIndex.lists(record.character(), fileName)) {
                unindexed++;
                System.err.println("WARN: " + fileName + " is not listed under '" + record.character()
                        + "' in the kvg index");
            }

            // Outside the per-file guard: a key collision ends the run.
            indices.add(record, fileName);
        }

        return indices.build(files.size(), failed, unindexed);
    }

    public KanjiRecord toRecord(SourceDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram");
        final String code = Ids.normalizeCode(diagram.code());
        return new KanjiRecord(
                code,
                Ids.character(code),
                diagram.variant(),
                converter.convert(diagram.root()),
                flattener.flatten(diagram.root())
        );
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
