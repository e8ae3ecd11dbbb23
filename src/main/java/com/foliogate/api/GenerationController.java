package com.foliogate.api;

import com.foliogate.processing.GenerationService;
import com.foliogate.security.Principal;
import com.foliogate.security.PrincipalFilter;
import com.foliogate.shared.dto.GenerationRequest;
import com.foliogate.shared.dto.GenerationResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for rate-limited AI generation features.
 */
@RestController
@RequestMapping("/api/ai")
@Tag(name = "AI", description = "Rate-limited, audited AI generation")
public class GenerationController {

    private static final Logger logger = LoggerFactory.getLogger(GenerationController.class);

    private final GenerationService generationService;

    public GenerationController(GenerationService generationService) {
        this.generationService = generationService;
    }

    @PostMapping("/{feature}")
    @Operation(summary = "Generate text",
               description = "Runs an AI feature. Returns 429 with Retry-After when the caller's quota is used up.")
    public ResponseEntity<GenerationResponse> generate(
            @Parameter(description = "Feature: summary, bullets, experience, rewrite, cover_letter_base, "
                    + "cover_letter_full, resume_preview, other")
            @PathVariable("feature") String feature,
            @Valid @RequestBody GenerationRequest body,
            HttpServletRequest request) {

        Principal principal = PrincipalFilter.requirePrincipal(request);
        logger.info("AI generation request: feature={}", feature);
        return ResponseEntity.ok(generationService.generate(principal.id(), feature, body));
    }
}
