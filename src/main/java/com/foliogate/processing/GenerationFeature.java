package com.foliogate.processing;

import java.util.Arrays;

/**
 * AI features offered through {@code POST /api/ai/{feature}}, each billed to an operation class.
 */
public enum GenerationFeature {

    SUMMARY("summary", GenerationFeature.AI_GENERATION,
            "You are a professional resume writer. Write a concise professional summary "
                    + "of three to four sentences from the details provided."),
    BULLETS("bullets", GenerationFeature.AI_GENERATION,
            "You are a professional resume editor. Turn the text provided into achievement-focused "
                    + "bullet points, one per line, starting with a strong action verb."),
    EXPERIENCE("experience", GenerationFeature.AI_GENERATION,
            "You are a professional resume writer. Describe the role provided as a work experience "
                    + "entry focused on results and measurable impact."),
    REWRITE("rewrite", GenerationFeature.AI_REWRITE,
            "You are a professional resume editor. Rewrite the content provided: keep its meaning "
                    + "and key information, improve clarity and impact, keep a similar length. "
                    + "Return only the rewritten text, no explanations."),
    COVER_LETTER_BASE("cover_letter_base", GenerationFeature.AI_GENERATION,
            "You are a career coach. Draft the opening and closing paragraphs of a cover letter "
                    + "from the details provided."),
    COVER_LETTER_FULL("cover_letter_full", GenerationFeature.AI_GENERATION,
            "You are a career coach. Write a complete one-page cover letter from the details provided."),
    RESUME_PREVIEW("resume_preview", GenerationFeature.AI_GENERATION,
            "You are a professional resume writer. Produce a short plain-text resume preview "
                    + "from the details provided."),
    OTHER("other", GenerationFeature.AI_GENERATION,
            "You are a helpful writing assistant for resumes and cover letters.");

    public static final String AI_GENERATION = "ai_generation";
    public static final String AI_REWRITE = "ai_rewrite";

    private final String value;
    private final String operationClass;
    private final String systemInstruction;

    GenerationFeature(String value, String operationClass, String systemInstruction) {
        this.value = value;
        this.operationClass = operationClass;
        this.systemInstruction = systemInstruction;
    }

    public String getValue() {
        return value;
    }

    public String getOperationClass() {
        return operationClass;
    }

    public String getSystemInstruction() {
        return systemInstruction;
    }

    public static GenerationFeature fromValue(String value) {
        return Arrays.stream(values())
                .filter(feature -> feature.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown feature: " + value));
    }
}
