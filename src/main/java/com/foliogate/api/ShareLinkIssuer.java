package com.foliogate.api;

import com.foliogate.security.TokenService;
import com.foliogate.shared.model.ResourceType;
import com.foliogate.shared.model.ShareLink;
import com.foliogate.shared.repository.ShareLinkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional half of create-or-get. Holds a row lock on the resource's slot
 * holder for the whole decision, so concurrent callers serialize per resource.
 * When no holder exists yet, two callers may both insert; the unique slot column
 * rejects the loser with a DataIntegrityViolationException and the caller retries.
 */
@Component
public class ShareLinkIssuer {

    private static final Logger logger = LoggerFactory.getLogger(ShareLinkIssuer.class);
    private static final int MAX_TOKEN_ATTEMPTS = 5;

    private final ShareLinkRepository shareLinkRepository;
    private final TokenService tokenService;

    public ShareLinkIssuer(ShareLinkRepository shareLinkRepository, TokenService tokenService) {
        this.shareLinkRepository = shareLinkRepository;
        this.tokenService = tokenService;
    }

    /**
     * @param ttl lifetime of a newly minted link, null for no expiry
     */
    @Transactional
    public IssuedShareLink issueOrReuse(ResourceType resourceType, UUID resourceId, String ownerId,
                                        Duration ttl, Instant now) {
        Optional<ShareLink> holder = shareLinkRepository.findByActiveSlotForUpdate(
                ShareLink.slotKey(resourceType, resourceId));

        if (holder.isPresent()) {
            ShareLink current = holder.get();
            if (current.isActiveAt(now)) {
                logger.info("Reusing active share link: type={}, resourceId={}, linkId={}",
                        resourceType, resourceId, current.getId());
                return new IssuedShareLink(current, false);
            }
            // Expired: keep the row, free the slot for the new link.
            current.releaseSlot();
            shareLinkRepository.saveAndFlush(current);
            logger.info("Retired expired share link: type={}, resourceId={}, linkId={}, expiredAt={}",
                    resourceType, resourceId, current.getId(), current.getExpiresAt());
        }

        Instant expiresAt = ttl != null ? now.plus(ttl) : null;
        ShareLink link = new ShareLink(newUniqueToken(), resourceType, resourceId, ownerId, now, expiresAt);
        link = shareLinkRepository.saveAndFlush(link);
        logger.info("Created new share link: type={}, resourceId={}, linkId={}, expiresAt={}",
                resourceType, resourceId, link.getId(), expiresAt);
        return new IssuedShareLink(link, true);
    }

    private String newUniqueToken() {
        for (int attempt = 0; attempt < MAX_TOKEN_ATTEMPTS; attempt++) {
            String token = tokenService.generateToken();
            if (!shareLinkRepository.existsByToken(token)) {
                return token;
            }
            logger.warn("Share token collision, regenerating (attempt {})", attempt + 1);
        }
        throw new IllegalStateException("Could not generate a unique share token");
    }
}
