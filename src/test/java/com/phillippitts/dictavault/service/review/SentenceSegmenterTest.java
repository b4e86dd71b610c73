package com.phillippitts.dictavault.service.review;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SentenceSegmenterTest {

    @Test
    void splitsOnTerminalPunctuationFollowedByWhitespace() {
        List<Sentence> sentences = SentenceSegmenter.segment("I woke up late. Was it raining? Yes! Then work.");

        assertThat(sentences).extracting(Sentence::text)
                .containsExactly("I woke up late.", "Was it raining?", "Yes!", "Then work.");
    }

    @Test
    void blankLineStartsNewParagraph() {
        List<Sentence> sentences = SentenceSegmenter.segment("First thought\n\n  \nSecond thought. Third");

        assertThat(sentences).extracting(Sentence::text)
                .containsExactly("First thought", "Second thought.", "Third");
    }

    @Test
    void offsetsPointIntoOriginalText() {
        String text = "  Hello there.   General Kenobi!  ";

        List<Sentence> sentences = SentenceSegmenter.segment(text);

        assertThat(sentences).extracting(Sentence::startOffset).containsExactly(2, 17);
        assertThat(sentences).extracting(Sentence::endOffset).containsExactly(14, 32);
        for (Sentence s : sentences) {
            assertThat(text.substring(s.startOffset(), s.endOffset())).isEqualTo(s.text());
        }
    }

    @Test
    void decimalPointWithoutWhitespaceDoesNotSplit() {
        assertThat(SentenceSegmenter.segment("It cost 4.50 today.")).hasSize(1);
    }

    @Test
    void countsWords() {
        List<Sentence> sentences = SentenceSegmenter.segment("One two  three.");

        assertThat(sentences.get(0).wordCount()).isEqualTo(3);
        assertThat(SentenceSegmenter.countWords("   ")).isZero();
    }

    @Test
    void emptyInputHasNoSentences() {
        assertThat(SentenceSegmenter.segment("")).isEmpty();
        assertThat(SentenceSegmenter.segment(" \n\n ")).isEmpty();
        assertThat(SentenceSegmenter.segment(null)).isEmpty();
    }
}
