package com.foliogate.api;

import com.foliogate.shared.dto.ResolvedShareResponse;
import com.foliogate.shared.exception.ShareNotFoundException;
import com.foliogate.shared.model.ResourceType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated read path for share tokens. Every failure is the same 404.
 */
@RestController
@RequestMapping("/api/public")
@Tag(name = "Public share", description = "Resolve public share tokens")
public class PublicShareController {

    private final ShareLinkService shareLinkService;

    public PublicShareController(ShareLinkService shareLinkService) {
        this.shareLinkService = shareLinkService;
    }

    @GetMapping("/shares/{token}")
    @Operation(summary = "Resolve share token")
    public ResponseEntity<ResolvedShareResponse> resolve(@PathVariable("token") String token) {
        return ResponseEntity.ok(toResponse(shareLinkService.resolvePublic(token, null)));
    }

    @GetMapping("/{segment:r|c}/{token}")
    @Operation(summary = "Resolve share token for a resume (r) or cover letter (c)")
    public ResponseEntity<ResolvedShareResponse> resolveTyped(
            @PathVariable("segment") String segment,
            @PathVariable("token") String token) {
        ResourceType expected = ResourceType.fromPublicSegment(segment)
                .orElseThrow(ShareNotFoundException::new);
        return ResponseEntity.ok(toResponse(shareLinkService.resolvePublic(token, expected)));
    }

    private static ResolvedShareResponse toResponse(ResolvedShare resolved) {
        return new ResolvedShareResponse(resolved.resourceType().getValue(), resolved.resourceId());
    }
}
