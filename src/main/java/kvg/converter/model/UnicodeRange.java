package kvg.converter.model;

/**
 * Coarse Unicode block of a diagram's code point. Bounds are inclusive and do not overlap;
 * everything outside them is {@link #OTHER}.
 */
public enum UnicodeRange {
    BASIC("basic", 0x4E00, 0x9FFF),
    EXTENDED_A("extended-a", 0x3400, 0x4DBF),
    EXTENDED_B("extended-b", 0x20000, 0x2A6DF),
    EXTENDED_C("extended-c", 0x2A700, 0x2B73F),
    EXTENDED_D("extended-d", 0x2B740, 0x2B81F),
    EXTENDED_E("extended-e", 0x2B820, 0x2CEAF),
    COMPATIBILITY("compatibility", 0xF900, 0xFAFF),
    OTHER("other", -1, -1);

    private final String tag;
    private final int start;
    private final int end;

    UnicodeRange(String tag, int start, int end) {
        this.tag = tag;
        this.start = start;
        this.end = end;
    }

    public String tag() {
        return tag;
    }

    public boolean contains(int codePoint) {
        return this != OTHER && codePoint >= start && codePoint <= end;
    }

    public static UnicodeRange classify(int codePoint) {
        for (UnicodeRange range : values()) {
            if (range.contains(codePoint)) {
                return range;
            }
        }
        return OTHER;
    }

    public static UnicodeRange classify(String hex) {
        return classify(Ids.codePoint(hex));
    }
}
