package com.phillippitts.dictavault.service.detect;

import com.phillippitts.dictavault.domain.Match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyword detector for sensitive topics (medical, financial, legal, ...).
 *
 * <p>Each keyword is searched case-insensitively; occurrences of the same keyword never
 * overlap. Reported text keeps the input's original casing and the category is prefixed with
 * {@value #CATEGORY_PREFIX}. When two keywords hit the same start offset only the first one in
 * dictionary order is kept.
 *
 * <p>By default a keyword matches anywhere, including inside longer words ("scan" in
 * "scandal"). With {@code wholeWord} enabled a hit must sit between non-alphanumeric
 * characters or the text boundary.
 */
public final class TopicDetector {

    public static final String CATEGORY_PREFIX = "Topic:";

    private final Map<String, List<String>> topics;
    private final boolean wholeWord;

    public TopicDetector() {
        this(false);
    }

    public TopicDetector(boolean wholeWord) {
        this(TopicDictionary.TOPICS, wholeWord);
    }

    // Package-private for tests
    TopicDetector(Map<String, List<String>> topics, boolean wholeWord) {
        this.topics = topics;
        this.wholeWord = wholeWord;
    }

    /**
     * @return topic matches sorted by start offset, at most one per start offset
     */
    public List<Match> scan(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Match> matches = new ArrayList<>();
        Set<Integer> seenStarts = new HashSet<>();
        for (Map.Entry<String, List<String>> topic : topics.entrySet()) {
            String category = CATEGORY_PREFIX + topic.getKey();
            for (String keyword : topic.getValue()) {
                int from = 0;
                int start;
                while ((start = indexOfIgnoreCase(text, keyword, from)) >= 0) {
                    int end = start + keyword.length();
                    if ((!wholeWord || isWordBounded(text, start, end)) && seenStarts.add(start)) {
                        matches.add(Match.of(category, text.substring(start, end), start, end));
                    }
                    from = end;
                }
            }
        }
        matches.sort(Comparator.comparingInt(Match::startOffset));
        return matches;
    }

    /**
     * Returns true as soon as any keyword occurs in {@code text}.
     */
    public boolean containsAny(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (List<String> keywords : topics.values()) {
            for (String keyword : keywords) {
                int from = 0;
                int start;
                while ((start = indexOfIgnoreCase(text, keyword, from)) >= 0) {
                    if (!wholeWord || isWordBounded(text, start, start + keyword.length())) {
                        return true;
                    }
                    from = start + keyword.length();
                }
            }
        }
        return false;
    }

    /*
     * Case-insensitive search on the original string, so offsets stay valid even when
     * lowercasing would change the string length.
     */
    static int indexOfIgnoreCase(String text, String needle, int from) {
        int last = text.length() - needle.length();
        for (int i = Math.max(0, from); i <= last; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isWordBounded(String text, int start, int end) {
        boolean leftOk = start == 0 || !Character.isLetterOrDigit(text.charAt(start - 1));
        boolean rightOk = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
        return leftOk && rightOk;
    }
}
