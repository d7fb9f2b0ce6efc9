package uk.gegc.edgeprompt.features.ai.domain;

/**
 * Output language for generated text.
 */
public enum LanguageMode {
    ENGLISH("Respond in English.", "Generate the question in English."),
    SOURCE("Respond in the same language as the content.",
            "Generate the question in the same language as the context.");

    private final String responseInstruction;
    private final String questionInstruction;

    LanguageMode(String responseInstruction, String questionInstruction) {
        this.responseInstruction = responseInstruction;
        this.questionInstruction = questionInstruction;
    }

    public String responseInstruction() {
        return responseInstruction;
    }

    public String questionInstruction() {
        return questionInstruction;
    }

    public static LanguageMode fromSourceLanguageFlag(Boolean useSourceLanguage) {
        return Boolean.TRUE.equals(useSourceLanguage) ? SOURCE : ENGLISH;
    }
}
