package kvg.converter.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Output form of a stroke group.
 * <p>
 * Null metadata means "absent" and is left out of the written JSON. {@code strokes}
 * holds only the strokes defined directly in this group; nested strokes live in
 * {@code groups}.
 */
@JsonPropertyOrder({
        "id", "element", "original", "part", "number", "variant", "partial",
        "tradForm", "radicalForm", "position", "radical", "phon", "groups", "strokes"
})
public record GroupRecord(
        String id,
        String element,
        String original,
        Integer part,
        Integer number,
        Boolean variant,
        Boolean partial,
        Boolean tradForm,
        Boolean radicalForm,
        String position,
        String radical,
        String phon,
        List<GroupRecord> groups,
        List<StrokeRecord> strokes
) {
    public GroupRecord {
        groups = List.copyOf(groups);
        strokes = List.copyOf(strokes);
    }
}
