package com.phillippitts.dictavault.service.review;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a transcript into sentences.
 *
 * <p>Paragraphs are separated by a blank line ({@code \n\s*\n}); inside a paragraph a sentence
 * ends at {@code .}, {@code !} or {@code ?} followed by whitespace. Pieces are trimmed and empty
 * pieces dropped. Offsets refer to the original transcript.
 */
public final class SentenceSegmenter {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SentenceSegmenter() {
    }

    public static List<Sentence> segment(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Sentence> sentences = new ArrayList<>();
        for (int[] paragraph : split(text, 0, text.length(), PARAGRAPH_BREAK)) {
            for (int[] s : split(text, paragraph[0], paragraph[1], SENTENCE_BREAK)) {
                String sentence = text.substring(s[0], s[1]);
                sentences.add(new Sentence(sentence, s[0], s[1], countWords(sentence)));
            }
        }
        return sentences;
    }

    static int countWords(String s) {
        String trimmed = s.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    /*
     * Splits text[from, to) on the separator and returns trimmed, non-empty [start, end) ranges.
     */
    private static List<int[]> split(String text, int from, int to, Pattern separator) {
        List<int[]> ranges = new ArrayList<>();
        Matcher m = separator.matcher(text).region(from, to);
        int pieceStart = from;
        while (m.find()) {
            addTrimmed(text, pieceStart, m.start(), ranges);
            pieceStart = m.end();
        }
        addTrimmed(text, pieceStart, to, ranges);
        return ranges;
    }

    private static void addTrimmed(String text, int start, int end, List<int[]> out) {
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (end > start) {
            out.add(new int[] {start, end});
        }
    }
}
