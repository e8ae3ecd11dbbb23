package com.foliogate.api;

import com.foliogate.security.Principal;
import com.foliogate.security.PrincipalFilter;
import com.foliogate.shared.dto.CreateShareLinkRequest;
import com.foliogate.shared.dto.ShareLinkResponse;
import com.foliogate.shared.model.ResourceType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.UUID;

/**
 * Controller for owners managing the share link of a resume or cover letter.
 */
@RestController
@RequestMapping("/api/shares")
@Tag(name = "Share", description = "Share link management for resource owners")
public class ShareController {

    private static final Logger logger = LoggerFactory.getLogger(ShareController.class);

    private final ShareLinkService shareLinkService;

    @Value("${app.base-url:http://localhost:8080}")
    private String baseUrl;

    public ShareController(ShareLinkService shareLinkService) {
        this.shareLinkService = shareLinkService;
    }

    @PostMapping("/{type}/{resourceId}")
    @Operation(summary = "Create or get share link",
               description = "Returns the resource's active share link, creating one if none exists")
    public ResponseEntity<ShareLinkResponse> createOrGet(
            @Parameter(description = "Resource type: resume or cover_letter")
            @PathVariable("type") String type,
            @Parameter(description = "Resource ID")
            @PathVariable("resourceId") UUID resourceId,
            @Valid @RequestBody(required = false) CreateShareLinkRequest body,
            HttpServletRequest request) {

        Principal principal = PrincipalFilter.requirePrincipal(request);
        ResourceType resourceType = ResourceType.fromValue(type);
        Duration ttl = body != null && body.getTtlSeconds() != null
                ? Duration.ofSeconds(body.getTtlSeconds())
                : null;

        IssuedShareLink issued = shareLinkService.createOrGetLink(resourceType, resourceId, principal.id(), ttl);
        logger.info("Share link {}: type={}, resourceId={}",
                issued.created() ? "created" : "reused", resourceType, resourceId);

        return ResponseEntity.status(issued.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(ShareLinkResponse.from(issued.link(), baseUrl));
    }

    @GetMapping("/{type}/{resourceId}")
    @Operation(summary = "Get current share link", description = "Returns the active share link or 404")
    public ResponseEntity<ShareLinkResponse> getCurrent(
            @PathVariable("type") String type,
            @PathVariable("resourceId") UUID resourceId,
            HttpServletRequest request) {

        Principal principal = PrincipalFilter.requirePrincipal(request);
        ResourceType resourceType = ResourceType.fromValue(type);
        return shareLinkService.findCurrentLink(resourceType, resourceId, principal)
                .map(link -> ResponseEntity.ok(ShareLinkResponse.from(link, baseUrl)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{type}/{resourceId}")
    @Operation(summary = "Revoke share link", description = "Revokes the active share link; succeeds when there is none")
    public ResponseEntity<Void> revoke(
            @PathVariable("type") String type,
            @PathVariable("resourceId") UUID resourceId,
            HttpServletRequest request) {

        Principal principal = PrincipalFilter.requirePrincipal(request);
        ResourceType resourceType = ResourceType.fromValue(type);
        shareLinkService.revoke(resourceType, resourceId, principal);
        return ResponseEntity.noContent().build();
    }
}
