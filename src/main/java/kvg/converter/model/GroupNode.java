package kvg.converter.model;

import java.util.List;
import java.util.Objects;

/**
 * A {@code <g>} element of a diagram as handed over by the reader.
 * Every metadata component is nullable; children keep their definition (draw) order.
 */
public record GroupNode(
        String id,
        String element,       // kvg:element
        String original,      // kvg:original
        Integer part,         // kvg:part
        Integer number,       // kvg:number
        Boolean variant,      // kvg:variant
        Boolean partial,      // kvg:partial
        Boolean tradForm,     // kvg:tradForm
        Boolean radicalForm,  // kvg:radicalForm
        String position,      // kvg:position
        String radical,       // kvg:radical
        String phon,          // kvg:phon
        List<SourceNode> children
) implements SourceNode {

    public GroupNode {
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    /** Group without any metadata besides its id. */
    public static GroupNode of(String id, List<SourceNode> children) {
        return new GroupNode(id, null, null, null, null, null, null, null, null, null, null, null, children);
    }
}
