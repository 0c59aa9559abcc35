package kvg.converter.model;

import java.util.Objects;

/**
 * One parsed diagram file.
 *
 * @param code    hex code exactly as found in the root group id (e.g. "04e00")
 * @param variant diagram variant tag from the root group id, or null
 * @param root    root stroke group
 * @param file    file name the diagram was read from
 */
public record SourceDiagram(
        String code,
        String variant,
        GroupNode root,
        String file
) {
    public SourceDiagram {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(file, "file");
    }
}
