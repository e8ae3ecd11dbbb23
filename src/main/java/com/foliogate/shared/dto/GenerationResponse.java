package com.foliogate.shared.dto;

import java.math.BigDecimal;

/**
 * Response DTO for an AI generation call: the generated text plus call metadata.
 */
public class GenerationResponse {

    private String result;
    private Meta meta;

    public GenerationResponse() {
    }

    public GenerationResponse(String result, Meta meta) {
        this.result = result;
        this.meta = meta;
    }

    public String getResult() {
        return result;
    }

    public Meta getMeta() {
        return meta;
    }

    public static class Meta {
        private String model;
        private String feature;
        private BigDecimal costEstimate;

        public Meta() {
        }

        public Meta(String model, String feature, BigDecimal costEstimate) {
            this.model = model;
            this.feature = feature;
            this.costEstimate = costEstimate;
        }

        public String getModel() {
            return model;
        }

        public String getFeature() {
            return feature;
        }

        public BigDecimal getCostEstimate() {
            return costEstimate;
        }
    }
}
