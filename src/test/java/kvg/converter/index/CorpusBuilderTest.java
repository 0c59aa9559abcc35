package kvg.converter.index;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import kvg.converter.model.GroupNode;
import kvg.converter.model.KanjiRecord;
import kvg.converter.model.SourceDiagram;
import kvg.converter.model.StrokeNode;
import kvg.converter.model.StrokeRecord;
import kvg.converter.scan.DiagramFileFinder;
import kvg.converter.scan.Fixtures;
import kvg.converter.scan.KvgIndex;

import static org.junit.jupiter.api.Assertions.*;

public class CorpusBuilderTest {

    private static KvgIndex fixtureIndex() throws Exception {
        return KvgIndex.load(Fixtures.resource("kvg-index.json"));
    }

    @Test
    void buildsRecordForTwoStrokeRoot() throws Exception {
        final GroupNode root = GroupNode.of("kvg:04e00", List.of(
                new StrokeNode("S", "M1,1", null),
                new StrokeNode("S", "M2,2", null)));
        final CorpusBuilder builder = new CorpusBuilder(new DiagramFileFinder(Path.of(".")), fixtureIndex());

        final KanjiRecord rec = builder.toRecord(new SourceDiagram("4E00", null, root, "04e00.svg"));

        assertEquals("4e00", rec.code());
        assertEquals("一", rec.character());
        assertNull(rec.variant());
        assertEquals(2, rec.strokes().strokes().size());
        assertEquals(rec.strokes().strokes(), rec.allStrokes());
        assertEquals(List.of("M1,1", "M2,2"), rec.allStrokes().stream().map(StrokeRecord::path).toList());
    }

    @Test
    void convertsFixtureDirectoryAndSkipsBrokenFile(@TempDir Path tmp) throws Exception {
        final Path kanji = Fixtures.copyDiagrams(tmp.resolve("kanji"),
                "04e00.svg", "04e01.svg", "04e01-Kaisho.svg", "06f22.svg");

        final Corpus corpus = new CorpusBuilder(new DiagramFileFinder(kanji), fixtureIndex()).build();

        assertEquals(4, corpus.filesSeen());
        assertEquals(3, corpus.converted());
        assertEquals(List.of("06f22.svg"), corpus.failedFiles());
        assertEquals(0, corpus.unindexed());

        assertEquals(List.of("4e00", "4e01-Kaisho", "4e01"), List.copyOf(corpus.lookupIndex().keySet()));
        assertEquals(List.of("4e01-Kaisho", "4e01"), corpus.characterIndex().get("丁"));
        assertFalse(corpus.characterIndex().containsKey("漢"));
        assertEquals(List.of("一", "丁"), corpus.radicalIndex().get("一"));
        assertEquals(List.of("4e00", "4e01-Kaisho", "4e01"), corpus.rangeIndex().get("basic"));

        final KanjiRecord ding = corpus.records().get(2);
        assertEquals(List.of("㇐", "㇚"), ding.allStrokes().stream().map(StrokeRecord::type).toList());
        assertEquals(1, ding.strokes().strokes().size());
        assertEquals(1, ding.strokes().groups().size());
    }

    @Test
    void countsDiagramsMissingFromIndex(@TempDir Path tmp) throws Exception {
        final Path kanji = Fixtures.copyDiagrams(tmp.resolve("kanji"), "04e00.svg");
        final Path indexFile = tmp.resolve("kvg-index.json");
        Files.writeString(indexFile, "{\"一\": []}");

        final Corpus corpus = new CorpusBuilder(new DiagramFileFinder(kanji), KvgIndex.load(indexFile)).build();

        assertEquals(1, corpus.converted());
        assertEquals(1, corpus.unindexed());
    }

    @Test
    void skipsDiagramWhoseVariantIsNotAFileName(@TempDir Path tmp) throws Exception {
        final Path kanji = Fixtures.copyDiagrams(tmp.resolve("kanji"), "04e00.svg", "04e01.svg");
        final String text = Files.readString(kanji.resolve("04e00.svg"));
        Files.writeString(kanji.resolve("04e00-x.svg"), text.replace("id=\"kvg:04e00\"", "id=\"kvg:04e00-a/b\""));

        final Corpus corpus = new CorpusBuilder(new DiagramFileFinder(kanji), fixtureIndex()).build();

        assertEquals(3, corpus.filesSeen());
        assertEquals(List.of("04e00-x.svg"), corpus.failedFiles());
        assertEquals(List.of("4e00", "4e01"), List.copyOf(corpus.lookupIndex().keySet()));
    }

    @Test
    void duplicateVariantKeyAbortsTheRun(@TempDir Path tmp) throws Exception {
        final Path kanji = Fixtures.copyDiagrams(tmp.resolve("kanji"), "04e00.svg");
        // Same root id under another file name
        Files.copy(kanji.resolve("04e00.svg"), kanji.resolve("04e00-copy.svg"));

        final CorpusBuilder builder = new CorpusBuilder(new DiagramFileFinder(kanji), fixtureIndex());

        assertThrows(DuplicateVariantKeyException.class, builder::build);
    }
}
