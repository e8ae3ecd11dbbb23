package com.foliogate.api;

import com.foliogate.MutableClock;
import com.foliogate.api.resource.ResourceCollaboratorRegistry;
import com.foliogate.observability.DatadogMetricsServiceStub;
import com.foliogate.security.Principal;
import com.foliogate.shared.exception.NotOwnerException;
import com.foliogate.shared.exception.ResourceNotFoundException;
import com.foliogate.shared.exception.ShareNotFoundException;
import com.foliogate.shared.model.ResourceType;
import com.foliogate.shared.model.ShareLink;
import com.foliogate.shared.repository.ShareLinkRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShareLinkServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final UUID RESUME_ID = UUID.fromString("7d1f7f7e-2b1c-4a53-9c57-0a1f1b2c3d4e");
    private static final String OWNER = "user-1";

    @Mock
    private ShareLinkRepository shareLinkRepository;

    @Mock
    private ShareLinkIssuer shareLinkIssuer;

    @Mock
    private ResourceCollaboratorRegistry resourceCollaborators;

    private MutableClock clock;
    private ShareLinkService shareLinkService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        shareLinkService = new ShareLinkService(shareLinkRepository, shareLinkIssuer, resourceCollaborators,
                new DatadogMetricsServiceStub(), clock, Duration.ofDays(30));
    }

    private static ShareLink link(String token, Instant createdAt, Instant expiresAt) {
        return new ShareLink(token, ResourceType.RESUME, RESUME_ID, OWNER, createdAt, expiresAt);
    }

    @Test
    void createOrGet_missingResourceIsNotFound() {
        when(resourceCollaborators.getOwner(ResourceType.RESUME, RESUME_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> shareLinkService.createOrGetLink(ResourceType.RESUME, RESUME_ID, OWNER, null))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(shareLinkIssuer);
    }

    @Test
    void createOrGet_nonOwnerIsRefused() {
        when(resourceCollaborators.getOwner(ResourceType.RESUME, RESUME_ID)).thenReturn(Optional.of(OWNER));

        assertThatThrownBy(() -> shareLinkService.createOrGetLink(ResourceType.RESUME, RESUME_ID, "user-2", null))
                .isInstanceOf(NotOwnerException.class);
        verifyNoInteractions(shareLinkIssuer);
    }

    @Test
    void createOrGet_usesDefaultTtlWhenNoneGiven() {
        IssuedShareLink issued = new IssuedShareLink(link("tok", NOW, NOW.plus(Duration.ofDays(30))), true);
        when(resourceCollaborators.getOwner(ResourceType.RESUME, RESUME_ID)).thenReturn(Optional.of(OWNER));
        when(shareLinkIssuer.issueOrReuse(ResourceType.RESUME, RESUME_ID, OWNER, Duration.ofDays(30), NOW))
                .thenReturn(issued);

        assertThat(shareLinkService.createOrGetLink(ResourceType.RESUME, RESUME_ID, OWNER, null)).isSameAs(issued);
    }

    @Test
    void createOrGet_rejectsNonPositiveTtl() {
        assertThatThrownBy(() -> shareLinkService.createOrGetLink(
                ResourceType.RESUME, RESUME_ID, OWNER, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(resourceCollaborators, shareLinkIssuer);
    }

    @Test
    void createOrGet_retriesWhenAConcurrentCallerWinsTheSlot() {
        ShareLink winner = link("winner", NOW, NOW.plus(Duration.ofHours(1)));
        when(resourceCollaborators.getOwner(ResourceType.RESUME, RESUME_ID)).thenReturn(Optional.of(OWNER));
        when(shareLinkIssuer.issueOrReuse(ResourceType.RESUME, RESUME_ID, OWNER, Duration.ofHours(1), NOW))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"))
                .thenReturn(new IssuedShareLink(winner, false));

        IssuedShareLink issued = shareLinkService.createOrGetLink(
                ResourceType.RESUME, RESUME_ID, OWNER, Duration.ofHours(1));

        assertThat(issued.created()).isFalse();
        assertThat(issued.link().getToken()).isEqualTo("winner");
        verify(shareLinkIssuer, times(2)).issueOrReuse(ResourceType.RESUME, RESUME_ID, OWNER, Duration.ofHours(1), NOW);
    }

    @Test
    void resolve_activeTokenReturnsResource() {
        when(shareLinkRepository.findByToken("tok")).thenReturn(Optional.of(link("tok", NOW, NOW.plusSeconds(3600))));

        ResolvedShare resolved = shareLinkService.resolve("tok");

        assertThat(resolved.resourceType()).isEqualTo(ResourceType.RESUME);
        assertThat(resolved.resourceId()).isEqualTo(RESUME_ID);
    }

    @Test
    void resolve_missingRevokedAndExpiredTokensFailIdentically() {
        ShareLink revoked = link("revoked", NOW, null);
        revoked.revoke(NOW);
        ShareLink expired = link("expired", NOW.minusSeconds(7200), NOW.minusSeconds(1));
        when(shareLinkRepository.findByToken("missing")).thenReturn(Optional.empty());
        when(shareLinkRepository.findByToken("revoked")).thenReturn(Optional.of(revoked));
        when(shareLinkRepository.findByToken("expired")).thenReturn(Optional.of(expired));

        for (String token : new String[]{"missing", "revoked", "expired"}) {
            assertThatThrownBy(() -> shareLinkService.resolve(token))
                    .isInstanceOf(ShareNotFoundException.class)
                    .hasMessage("Not found");
        }
    }

    @Test
    void resolve_expiresExactlyAtExpiry() {
        when(shareLinkRepository.findByToken("tok")).thenReturn(Optional.of(link("tok", NOW, NOW.plusSeconds(60))));

        clock.advance(Duration.ofSeconds(59));
        assertThat(shareLinkService.resolve("tok")).isNotNull();

        clock.advance(Duration.ofSeconds(1));
        assertThatThrownBy(() -> shareLinkService.resolve("tok")).isInstanceOf(ShareNotFoundException.class);
    }

    @Test
    void resolve_malformedTokenNeverHitsTheStore() {
        assertThatThrownBy(() -> shareLinkService.resolve(" ")).isInstanceOf(ShareNotFoundException.class);
        assertThatThrownBy(() -> shareLinkService.resolve("x".repeat(65))).isInstanceOf(ShareNotFoundException.class);
        verify(shareLinkRepository, never()).findByToken(anyString());
    }

    @Test
    void resolvePublic_typeMismatchOrDeletedResourceIsNotFound() {
        when(shareLinkRepository.findByToken("tok")).thenReturn(Optional.of(link("tok", NOW, null)));

        assertThatThrownBy(() -> shareLinkService.resolvePublic("tok", ResourceType.COVER_LETTER))
                .isInstanceOf(ShareNotFoundException.class);

        when(resourceCollaborators.exists(ResourceType.RESUME, RESUME_ID)).thenReturn(false);
        assertThatThrownBy(() -> shareLinkService.resolvePublic("tok", ResourceType.RESUME))
                .isInstanceOf(ShareNotFoundException.class);
    }

    @Test
    void revoke_checksOwnershipBeforeLookingForALink() {
        when(resourceCollaborators.getOwner(ResourceType.RESUME, RESUME_ID)).thenReturn(Optional.of(OWNER));

        assertThatThrownBy(() -> shareLinkService.revoke(ResourceType.RESUME, RESUME_ID,
                new Principal("user-2", Set.of())))
                .isInstanceOf(NotOwnerException.class);
        verifyNoInteractions(shareLinkRepository);
    }

    @Test
    void revoke_withoutCurrentLinkIsANoOp() {
        when(resourceCollaborators.getOwner(ResourceType.RESUME, RESUME_ID)).thenReturn(Optional.of(OWNER));
        when(shareLinkRepository.findByActiveSlotForUpdate(ShareLink.slotKey(ResourceType.RESUME, RESUME_ID)))
                .thenReturn(Optional.empty());

        assertThat(shareLinkService.revoke(ResourceType.RESUME, RESUME_ID, new Principal(OWNER, Set.of()))).isFalse();
        verify(shareLinkRepository, never()).save(any());
    }

    @Test
    void revoke_staffCanRevokeAnyLink() {
        ShareLink active = link("tok", NOW, null);
        when(shareLinkRepository.findByActiveSlotForUpdate(ShareLink.slotKey(ResourceType.RESUME, RESUME_ID)))
                .thenReturn(Optional.of(active));

        boolean revoked = shareLinkService.revoke(ResourceType.RESUME, RESUME_ID,
                new Principal("admin", Set.of(Principal.STAFF_ROLE)));

        assertThat(revoked).isTrue();
        assertThat(active.getRevokedAt()).isEqualTo(NOW);
        assertThat(active.getActiveSlot()).isNull();
        verify(shareLinkRepository).save(eq(active));
        verifyNoInteractions(resourceCollaborators);
    }
}
