package kvg.converter.model;

/**
 * A child of a stroke group in a source diagram: either a nested group or a terminal stroke.
 */
public sealed interface SourceNode permits GroupNode, StrokeNode {
}
