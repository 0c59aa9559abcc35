package kvg.converter.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import kvg.converter.model.GroupNode;
import kvg.converter.model.SourceNode;
import kvg.converter.model.StrokeNode;
import kvg.converter.model.StrokeRecord;

/**
 * Produces the draw-ordered stroke list of a group tree: pre-order, left to right, a nested
 * group's strokes inserted at the position where the group is defined.
 */
public final class StrokeFlattener {

    public List<StrokeRecord> flatten(GroupNode node) {
        Objects.requireNonNull(node, "node");
        final List<StrokeRecord> out = new ArrayList<>();
        collect(node, out);
        return Collections.unmodifiableList(out);
    }

    private static void collect(GroupNode node, List<StrokeRecord> out) {
        for (SourceNode child : node.children()) {
            if (child instanceof StrokeNode stroke) {
                out.add(StrokeRecord.from(stroke));
            } else if (child instanceof GroupNode group) {
                collect(group, out);
            } else {
                throw new IllegalStateException("unknown node kind: " + child.getClass().getName());
            }
        }
    }
}
