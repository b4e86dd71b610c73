package com.phillippitts.dictavault.service.detect.llm;

import com.phillippitts.dictavault.domain.Match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parses the line-oriented classifier answer into matches.
 *
 * <p>Every line is trimmed. Blank lines and {@code NONE} are skipped, as is any line that does
 * not split into exactly two parts on {@code |}, or whose type or text part is empty. The
 * matched text is located with an exact search in the original text; when it cannot be found
 * the match is reported at offset 0, end clamped to the text length, and flagged approximate.
 * The category is the type prefixed with {@value #CATEGORY_PREFIX}.
 */
public final class ClassifierResponseParser {

    public static final String CATEGORY_PREFIX = "LLM:";

    private ClassifierResponseParser() {
    }

    public static List<Match> parse(String response, String originalText) {
        if (response == null || response.isBlank() || originalText == null || originalText.isEmpty()) {
            return List.of();
        }
        List<Match> matches = new ArrayList<>();
        for (String rawLine : response.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.equalsIgnoreCase("NONE")) {
                continue;
            }
            String[] parts = line.split("\\|", -1);
            if (parts.length != 2) {
                continue;
            }
            String type = parts[0].trim();
            String matched = parts[1].trim();
            if (type.isEmpty() || matched.isEmpty()) {
                continue;
            }
            String category = CATEGORY_PREFIX + type;
            int start = originalText.indexOf(matched);
            if (start >= 0) {
                matches.add(Match.of(category, matched, start, start + matched.length()));
            } else {
                int end = Math.min(matched.length(), originalText.length());
                matches.add(new Match(category, matched, 0, end, true));
            }
        }
        matches.sort(Comparator.comparingInt(Match::startOffset));
        return matches;
    }
}
