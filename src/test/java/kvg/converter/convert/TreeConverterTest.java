package kvg.converter.convert;

import java.util.List;

import org.junit.jupiter.api.Test;

import kvg.converter.model.GroupNode;
import kvg.converter.model.GroupRecord;
import kvg.converter.model.NumberPos;
import kvg.converter.model.StrokeNode;
import kvg.converter.model.StrokeRecord;

import static org.junit.jupiter.api.Assertions.*;

public class TreeConverterTest {

    private final TreeConverter converter = new TreeConverter();

    @Test
    void keepsDirectStrokesInOrder() {
        final GroupNode root = GroupNode.of("kvg:04e00", List.of(
                new StrokeNode("S", "M1,1", null),
                new StrokeNode("S", "M2,2", null)));

        final GroupRecord rec = converter.convert(root);

        assertEquals("kvg:04e00", rec.id());
        assertTrue(rec.groups().isEmpty());
        assertEquals(List.of(
                new StrokeRecord("S", "M1,1", null),
                new StrokeRecord("S", "M2,2", null)), rec.strokes());
    }

    @Test
    void splitsChildrenIntoGroupsAndDirectStrokes() {
        final GroupNode inner = GroupNode.of("g1", List.of(new StrokeNode("A", "M0,0", null)));
        final GroupNode root = GroupNode.of("root", List.of(
                new StrokeNode("B", "M1,1", null),
                inner,
                new StrokeNode("C", "M2,2", null)));

        final GroupRecord rec = converter.convert(root);

        assertEquals(1, rec.groups().size());
        assertEquals("g1", rec.groups().get(0).id());
        assertEquals(List.of("A"), rec.groups().get(0).strokes().stream().map(StrokeRecord::type).toList());
        // direct strokes only, nested "A" is not repeated here
        assertEquals(List.of("B", "C"), rec.strokes().stream().map(StrokeRecord::type).toList());
    }

    @Test
    void copiesPresentMetadataAndDropsEmptyValues() {
        final GroupNode node = new GroupNode("g", "口", "", 2, 0, Boolean.TRUE, Boolean.FALSE, null,
                Boolean.TRUE, "left", "", "口", List.of());

        final GroupRecord rec = converter.convert(node);

        assertEquals("口", rec.element());
        assertNull(rec.original());
        assertEquals(2, rec.part());
        assertEquals(0, rec.number());
        assertEquals(Boolean.TRUE, rec.variant());
        assertNull(rec.partial());
        assertNull(rec.tradForm());
        assertEquals(Boolean.TRUE, rec.radicalForm());
        assertEquals("left", rec.position());
        assertNull(rec.radical());
        assertEquals("口", rec.phon());
    }

    @Test
    void anonymousGroupHasNoId() {
        final GroupRecord rec = converter.convert(GroupNode.of(null, List.of()));
        assertNull(rec.id());
        assertNull(rec.element());
    }

    @Test
    void missingPathBecomesEmptyStringAndNumberPosIsCarried() {
        final NumberPos pos = new NumberPos(4.25, 45.13);
        final GroupRecord rec = converter.convert(GroupNode.of("g", List.of(new StrokeNode("㇐", null, pos))));

        assertEquals(new StrokeRecord("㇐", "", pos), rec.strokes().get(0));
    }
}
