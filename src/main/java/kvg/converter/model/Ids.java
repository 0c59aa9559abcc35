package kvg.converter.model;

import java.util.Locale;
import java.util.Objects;

public final class Ids {

    public static final String INDIVIDUAL_DIR = "individual";

    private Ids() {
    }

    /**
     * Canonical form of a hex code: lower-case, no prefix, no leading zeros ("04E00" -> "4e00").
     */
    public static String normalizeCode(String hex) {
        return Integer.toHexString(codePoint(hex)).toLowerCase(Locale.ROOT);
    }

    public static int codePoint(String hex) {
        Objects.requireNonNull(hex, "hex");
        final String trimmed = hex.trim();
        if (trimmed.isEmpty() || trimmed.length() > 8) {
            throw new IllegalArgumentException("not a hex code: '" + hex + "'");
        }
        final long value;
        try {
            value = Long.parseLong(trimmed, 16);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("not a hex code: '" + hex + "'", ex);
        }
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("hex code out of range: '" + hex + "'");
        }
        return (int) value;
    }

    public static boolean isScalarValue(int codePoint) {
        return Character.isValidCodePoint(codePoint)
                && !(codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE);
    }

    /**
     * The single character a hex code stands for.
     */
    public static String character(String hex) {
        final int cp = codePoint(hex);
        if (!isScalarValue(cp)) {
            throw new IllegalArgumentException("not a Unicode scalar value: " + hex);
        }
        return new String(Character.toChars(cp));
    }

    public static String variantKey(String code, String variant) {
        Objects.requireNonNull(code, "code");
        if (variant == null || variant.isEmpty()) {
            return code;
        }
        return code + "-" + variant;
    }

    /** Location of a record artifact relative to the output directory. */
    public static String relativePath(String variantKey) {
        Objects.requireNonNull(variantKey, "variantKey");
        return INDIVIDUAL_DIR + "/" + variantKey + ".json";
    }
}
