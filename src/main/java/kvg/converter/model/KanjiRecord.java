package kvg.converter.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Content of {@code individual/<variantKey>.json}.
 */
@JsonPropertyOrder({"code", "character", "variant", "strokes", "all_strokes"})
public record KanjiRecord(
        String code,          // canonical lower-case hex, e.g. "4e00"
        String character,
        @JsonInclude(JsonInclude.Include.ALWAYS) String variant,
        GroupRecord strokes,
        @JsonProperty("all_strokes") List<StrokeRecord> allStrokes
) {
    public KanjiRecord {
        allStrokes = List.copyOf(allStrokes);
    }

    @JsonIgnore
    public String variantKey() {
        return Ids.variantKey(code, variant);
    }
}
