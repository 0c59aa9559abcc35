package kvg.converter.index;

/**
 * Two diagrams map to the same variant key. Keeping either one would silently drop the other,
 * so the run is aborted.
 */
public class DuplicateVariantKeyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String variantKey;

    public DuplicateVariantKeyException(String variantKey, String firstFile, String secondFile) {
        super("variant key '" + variantKey + "' produced by both " + firstFile + " and " + secondFile);
        this.variantKey = variantKey;
    }

    public String variantKey() {
        return variantKey;
    }
}
