package com.foliogate.api;

import com.foliogate.api.resource.ResourceCollaboratorRegistry;
import com.foliogate.observability.DatadogMetricsServiceInterface;
import com.foliogate.security.Principal;
import com.foliogate.shared.exception.NotOwnerException;
import com.foliogate.shared.exception.ResourceNotFoundException;
import com.foliogate.shared.exception.ShareNotFoundException;
import com.foliogate.shared.model.ResourceType;
import com.foliogate.shared.model.ShareLink;
import com.foliogate.shared.repository.ShareLinkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for issuing, resolving and revoking public share links.
 * A resource has at most one active link at a time.
 */
@Service
public class ShareLinkService {

    private static final Logger logger = LoggerFactory.getLogger(ShareLinkService.class);
    private static final int MAX_ISSUE_ATTEMPTS = 3;
    private static final int MAX_TOKEN_LENGTH = 64;

    private final ShareLinkRepository shareLinkRepository;
    private final ShareLinkIssuer shareLinkIssuer;
    private final ResourceCollaboratorRegistry resourceCollaborators;
    private final DatadogMetricsServiceInterface metricsService;
    private final Clock clock;
    private final Duration defaultTtl;

    public ShareLinkService(
            ShareLinkRepository shareLinkRepository,
            ShareLinkIssuer shareLinkIssuer,
            ResourceCollaboratorRegistry resourceCollaborators,
            DatadogMetricsServiceInterface metricsService,
            Clock clock,
            @Value("${app.share.default-ttl:30d}") Duration defaultTtl) {
        this.shareLinkRepository = shareLinkRepository;
        this.shareLinkIssuer = shareLinkIssuer;
        this.resourceCollaborators = resourceCollaborators;
        this.metricsService = metricsService;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    /**
     * Returns the resource's active link, minting one if there is none.
     *
     * @param ttl lifetime of a newly minted link; null uses the configured default
     * @throws ResourceNotFoundException if the resource does not exist
     * @throws NotOwnerException if the requester does not own the resource
     * @throws IllegalArgumentException if ttl is zero or negative
     */
    public IssuedShareLink createOrGetLink(ResourceType resourceType, UUID resourceId,
                                           String requesterId, Duration ttl) {
        Duration effectiveTtl = effectiveTtl(ttl);
        String ownerId = resourceCollaborators.getOwner(resourceType, resourceId)
                .orElseThrow(() -> new ResourceNotFoundException(resourceType.getValue() + " not found: " + resourceId));
        if (!ownerId.equals(requesterId)) {
            logger.warn("Share link refused, not owner: type={}, resourceId={}, requester={}",
                    resourceType, resourceId, requesterId);
            throw new NotOwnerException("Only the owner can share this " + resourceType.getValue());
        }

        DataIntegrityViolationException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_ISSUE_ATTEMPTS; attempt++) {
            try {
                IssuedShareLink issued = shareLinkIssuer.issueOrReuse(
                        resourceType, resourceId, ownerId, effectiveTtl, clock.instant());
                if (issued.created()) {
                    metricsService.recordShareLinkIssued(resourceType.getValue());
                }
                return issued;
            } catch (DataIntegrityViolationException e) {
                // A concurrent caller took the slot first; the next attempt reuses its link.
                logger.debug("Share slot conflict for type={}, resourceId={}, attempt={}",
                        resourceType, resourceId, attempt);
                lastConflict = e;
            }
        }
        throw lastConflict;
    }

    /**
     * Resolves a public token. Missing, revoked, expired and malformed tokens are
     * indistinguishable to the caller.
     *
     * @throws ShareNotFoundException unless the token is active
     */
    @Transactional(readOnly = true)
    public ResolvedShare resolve(String token) {
        Instant now = clock.instant();
        Optional<ShareLink> link = isWellFormed(token)
                ? shareLinkRepository.findByToken(token).filter(l -> l.isActiveAt(now))
                : Optional.empty();
        metricsService.recordShareResolve(link.isPresent());
        logger.debug("Share token resolved: found={}", link.isPresent());
        return link.map(l -> new ResolvedShare(l.getResourceType(), l.getResourceId()))
                .orElseThrow(ShareNotFoundException::new);
    }

    /**
     * Public read path: {@link #resolve} plus a check that the resource still exists
     * and, for type-scoped paths, has the expected type.
     *
     * @param expectedType required type, or null for any
     */
    @Transactional(readOnly = true)
    public ResolvedShare resolvePublic(String token, ResourceType expectedType) {
        ResolvedShare resolved = resolve(token);
        if (expectedType != null && resolved.resourceType() != expectedType) {
            throw new ShareNotFoundException();
        }
        if (!resourceCollaborators.exists(resolved.resourceType(), resolved.resourceId())) {
            throw new ShareNotFoundException();
        }
        return resolved;
    }

    /**
     * Revokes the resource's active link. Ownership is checked first; with no active
     * link the call is a no-op.
     *
     * @return true if a link was revoked by this call
     * @throws NotOwnerException if the requester is neither owner nor staff
     */
    @Transactional
    public boolean revoke(ResourceType resourceType, UUID resourceId, Principal requester) {
        requireOwnerOrStaff(resourceType, resourceId, requester);

        Instant now = clock.instant();
        Optional<ShareLink> holder = shareLinkRepository.findByActiveSlotForUpdate(
                ShareLink.slotKey(resourceType, resourceId));
        if (holder.isEmpty()) {
            logger.info("Revoke requested with no current link: type={}, resourceId={}", resourceType, resourceId);
            return false;
        }

        ShareLink link = holder.get();
        boolean wasActive = link.isActiveAt(now);
        link.revoke(now);
        shareLinkRepository.save(link);
        logger.info("Share link revoked: type={}, resourceId={}, linkId={}, by={}, wasActive={}",
                resourceType, resourceId, link.getId(), requester.id(), wasActive);
        return wasActive;
    }

    /**
     * Owner view of the resource's active link.
     */
    @Transactional(readOnly = true)
    public Optional<ShareLink> findCurrentLink(ResourceType resourceType, UUID resourceId, Principal requester) {
        requireOwnerOrStaff(resourceType, resourceId, requester);
        Instant now = clock.instant();
        return shareLinkRepository.findByActiveSlot(ShareLink.slotKey(resourceType, resourceId))
                .filter(link -> link.isActiveAt(now));
    }

    private void requireOwnerOrStaff(ResourceType resourceType, UUID resourceId, Principal requester) {
        if (requester.isStaff()) {
            return;
        }
        String ownerId = resourceCollaborators.getOwner(resourceType, resourceId)
                .orElseThrow(() -> new ResourceNotFoundException(resourceType.getValue() + " not found: " + resourceId));
        if (!ownerId.equals(requester.id())) {
            logger.warn("Share management refused, not owner: type={}, resourceId={}, requester={}",
                    resourceType, resourceId, requester.id());
            throw new NotOwnerException("Only the owner can manage sharing for this " + resourceType.getValue());
        }
    }

    private Duration effectiveTtl(Duration requested) {
        if (requested == null) {
            return defaultTtl.isZero() || defaultTtl.isNegative() ? null : defaultTtl;
        }
        if (requested.isZero() || requested.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return requested;
    }

    private static boolean isWellFormed(String token) {
        return token != null && !token.isBlank() && token.length() <= MAX_TOKEN_LENGTH;
    }
}
