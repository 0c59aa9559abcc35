package kvg.converter.model;

/**
 * A {@code <path>} element of a diagram. {@code path} and {@code numberPos} may be null.
 */
public record StrokeNode(
        String type,          // kvg:type, e.g. "㇐"
        String path,          // d
        NumberPos numberPos
) implements SourceNode {
}
