package kvg.converter.scan;

/**
 * A single diagram file could not be turned into a source tree. The file is skipped; the run goes on.
 */
public class DiagramFormatException extends Exception {

    private static final long serialVersionUID = 1L;

    public DiagramFormatException(String message) {
        super(message);
    }

    public DiagramFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
