package kvg.converter.index;

import java.util.List;
import java.util.Map;

import kvg.converter.model.KanjiRecord;

/**
 * Finished run, ready for writing.
 * - One record per converted diagram, in processing order
 * - characterIndex: character -> variant keys
 * - lookupIndex: variant key -> relative artifact path
 * - radicalIndex: radical element -> characters
 * - rangeIndex: unicode range tag -> variant keys
 */
public record Corpus(
        List<KanjiRecord> records,
        Map<String, List<String>> characterIndex,
        Map<String, String> lookupIndex,
        Map<String, List<String>> radicalIndex,
        Map<String, List<String>> rangeIndex,
        int filesSeen,
        List<String> failedFiles,
        int unindexed
) {
    public int converted() {
        return records.size();
    }

    public int failed() {
        return failedFiles.size();
    }
}
