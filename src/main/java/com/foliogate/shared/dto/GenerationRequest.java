package com.foliogate.shared.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for an AI generation call.
 */
public class GenerationRequest {

    @NotBlank(message = "prompt is required")
    @Size(max = 8000, message = "prompt must not exceed 8000 characters")
    private String prompt;

    @Size(max = 40, message = "tone must not exceed 40 characters")
    private String tone;

    public GenerationRequest() {
    }

    public GenerationRequest(String prompt, String tone) {
        this.prompt = prompt;
        this.tone = tone;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getTone() {
        return tone;
    }

    public void setTone(String tone) {
        this.tone = tone;
    }
}
