package com.foliogate.processing;

/**
 * A prompt ready for a {@link GenerationProvider}.
 */
public record GenerationPrompt(GenerationFeature feature, String userText, String tone) {

    private static final String DEFAULT_TONE = "professional";

    public GenerationPrompt {
        if (feature == null) {
            throw new IllegalArgumentException("feature is required");
        }
        if (userText == null || userText.isBlank()) {
            throw new IllegalArgumentException("prompt text is required");
        }
        tone = tone == null || tone.isBlank() ? DEFAULT_TONE : tone.trim();
    }

    public String render() {
        return feature.getSystemInstruction() + "\nTone: " + tone + "\n\n" + userText;
    }
}
