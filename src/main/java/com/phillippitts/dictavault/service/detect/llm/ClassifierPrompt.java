package com.phillippitts.dictavault.service.detect.llm;

/**
 * Builds the instruction sent to the language model.
 *
 * <p>The model is asked for one {@code TYPE|MATCHED_TEXT} line per finding, or the single word
 * {@code NONE}. {@link ClassifierResponseParser} reads that format back.
 */
public final class ClassifierPrompt {

    static final String VALID_TYPES =
            "Name, Address, Phone, Email, SSN, Credit Card, Medical, Financial, Password, Location";

    private ClassifierPrompt() {
    }

    public static String build(String text) {
        return "Analyze the following text and identify any private or sensitive information.\n"
                + "\n"
                + "For each piece of sensitive information found, output a line in this exact format:\n"
                + "TYPE|MATCHED_TEXT\n"
                + "\n"
                + "Valid types are: " + VALID_TYPES + "\n"
                + "\n"
                + "If no sensitive information is found, respond with: NONE\n"
                + "\n"
                + "Text to analyze:\n"
                + "---\n"
                + text + "\n"
                + "---\n"
                + "\n"
                + "Respond ONLY with the formatted lines or NONE, nothing else.";
    }
}
