package kvg.converter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Output form of a single stroke. All three properties are always written.
 */
@JsonPropertyOrder({"type", "path", "numberPos"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record StrokeRecord(
        String type,
        String path,          // "" when the source has no path
        NumberPos numberPos   // null when the stroke has no label
) {

    public static StrokeRecord from(StrokeNode stroke) {
        return new StrokeRecord(
                stroke.type(),
                stroke.path() == null ? "" : stroke.path(),
                stroke.numberPos());
    }
}
