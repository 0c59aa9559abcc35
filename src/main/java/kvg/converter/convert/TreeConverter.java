package kvg.converter.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import kvg.converter.model.GroupNode;
import kvg.converter.model.GroupRecord;
import kvg.converter.model.SourceNode;
import kvg.converter.model.StrokeNode;
import kvg.converter.model.StrokeRecord;

/**
 * Maps a source group tree onto {@link GroupRecord}s.
 * <p>
 * Empty strings and unset flags become null so the writer leaves them out. Child groups and
 * direct strokes keep their relative order within their own list; the interleaving between
 * the two lists is not kept here (see {@link StrokeFlattener} for draw order).
 */
public final class TreeConverter {

    public GroupRecord convert(GroupNode node) {
        Objects.requireNonNull(node, "node");

        final List<GroupRecord> groups = new ArrayList<>();
        final List<StrokeRecord> strokes = new ArrayList<>();
        for (SourceNode child : node.children()) {
            if (child instanceof GroupNode group) {
                groups.add(convert(group));
            } else if (child instanceof StrokeNode stroke) {
                strokes.add(StrokeRecord.from(stroke));
            } else {
                throw new IllegalStateException("unknown node kind: " + child.getClass().getName());
            }
        }

        return new GroupRecord(
                text(node.id()),
                text(node.element()),
                text(node.original()),
                node.part(),
                node.number(),
                flag(node.variant()),
                flag(node.partial()),
                flag(node.tradForm()),
                flag(node.radicalForm()),
                text(node.position()),
                text(node.radical()),
                text(node.phon()),
                groups,
                strokes
        );
    }

    private static String text(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static Boolean flag(Boolean value) {
        return Boolean.TRUE.equals(value) ? Boolean.TRUE : null;
    }
}
