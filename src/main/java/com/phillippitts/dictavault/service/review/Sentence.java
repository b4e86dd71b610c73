package com.phillippitts.dictavault.service.review;

/**
 * One sentence located in a transcript.
 *
 * @param text        trimmed sentence text
 * @param startOffset inclusive offset of the first character in the transcript
 * @param endOffset   exclusive offset after the last character
 * @param wordCount   number of whitespace-separated words
 */
public record Sentence(String text, int startOffset, int endOffset, int wordCount) {
}
