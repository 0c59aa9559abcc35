package kvg.converter.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import kvg.converter.model.GroupRecord;
import kvg.converter.model.Ids;
import kvg.converter.model.KanjiRecord;
import kvg.converter.model.UnicodeRange;

/**
 * Accumulates the corpus-wide indices, one record at a time, in processing order.
 * This is the only holder of index state; {@link #build} hands out immutable copies.
 */
public final class IndexBuilder {

    // UTF-16 units; one character, or one supplementary-plane character
    static final int MAX_COMPONENT_LENGTH = 2;

    private final List<KanjiRecord> records = new ArrayList<>();
    private final Map<String, String> sourceFileByKey = new HashMap<>();

    private final Map<String, List<String>> characterIndex = new LinkedHashMap<>();
    private final Map<String, String> lookupIndex = new LinkedHashMap<>();
    private final Map<String, Set<String>> radicalIndex = new LinkedHashMap<>();
    private final Map<UnicodeRange, List<String>> rangeIndex = new EnumMap<>(UnicodeRange.class);

    /**
     * Registers a record under its variant key.
     *
     * @return the variant key
     * @throws DuplicateVariantKeyException if another record already claimed the key
     */
    public String add(KanjiRecord record, String sourceFile) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(sourceFile, "sourceFile");

        final String key = record.variantKey();
        final String previous = sourceFileByKey.putIfAbsent(key, sourceFile);
        if (previous != null) {
            throw new DuplicateVariantKeyException(key, previous, sourceFile);
        }

        records.add(record);
        characterIndex.computeIfAbsent(record.character(), k -> new ArrayList<>()).add(key);
        lookupIndex.put(key, Ids.relativePath(key));
        rangeIndex.computeIfAbsent(UnicodeRange.classify(record.code()), k -> new ArrayList<>()).add(key);
        collectRadicals(record.strokes(), record.character());
        return key;
    }

    public Corpus build(int filesSeen, List<String> failedFiles, int unindexed) {
        final Map<String, List<String>> characters = new LinkedHashMap<>();
        characterIndex.forEach((c, keys) -> characters.put(c, List.copyOf(keys)));

        final Map<String, List<String>> radicals = new LinkedHashMap<>();
        radicalIndex.forEach((r, chars) -> radicals.put(r, List.copyOf(chars)));

        // EnumMap iterates in declaration order
        final Map<String, List<String>> ranges = new LinkedHashMap<>();
        rangeIndex.forEach((range, keys) -> ranges.put(range.tag(), List.copyOf(keys)));

        return new Corpus(
                List.copyOf(records),
                Collections.unmodifiableMap(characters),
                Collections.unmodifiableMap(new LinkedHashMap<>(lookupIndex)),
                Collections.unmodifiableMap(radicals),
                Collections.unmodifiableMap(ranges),
                filesSeen,
                List.copyOf(failedFiles),
                unindexed
        );
    }

    /**
     * Keys a character under the element of every group with a radical classification, and under
     * every short component element other than the character itself.
     */
    private void collectRadicals(GroupRecord group, String character) {
        final String element = group.element();
        if (element != null && (group.radical() != null
                || (element.length() <= MAX_COMPONENT_LENGTH && !element.equals(character)))) {
            radicalIndex.computeIfAbsent(element, k -> new LinkedHashSet<>()).add(character);
        }
        for (GroupRecord child : group.groups()) {
            collectRadicals(child, character);
        }
    }
}
