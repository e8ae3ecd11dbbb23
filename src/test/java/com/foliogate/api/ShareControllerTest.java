package com.foliogate.api;

import com.foliogate.security.Principal;
import com.foliogate.security.PrincipalFilter;
import com.foliogate.shared.exception.NotOwnerException;
import com.foliogate.shared.model.ResourceType;
import com.foliogate.shared.model.ShareLink;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web slice test for owner share link management.
 */
@WebMvcTest(ShareController.class)
class ShareControllerTest {

    private static final UUID RESUME_ID = UUID.fromString("9a7b6c5d-4e3f-4a1b-8c2d-1e0f9a8b7c6d");
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ShareLinkService shareLinkService;

    private static ShareLink link(String token) {
        return new ShareLink(token, ResourceType.RESUME, RESUME_ID, "owner-1", NOW, NOW.plus(Duration.ofDays(30)));
    }

    @Test
    void newLinkIsCreated() throws Exception {
        when(shareLinkService.createOrGetLink(ResourceType.RESUME, RESUME_ID, "owner-1", null))
                .thenReturn(new IssuedShareLink(link("tok-new"), true));

        mockMvc.perform(post("/api/shares/{type}/{id}", "resume", RESUME_ID)
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "owner-1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token").value("tok-new"))
                .andExpect(jsonPath("$.resourceType").value("resume"))
                .andExpect(jsonPath("$.shareUrl").value("http://localhost:8080/api/public/r/tok-new"));
    }

    @Test
    void existingLinkIsReusedWithOk() throws Exception {
        when(shareLinkService.createOrGetLink(ResourceType.RESUME, RESUME_ID, "owner-1", Duration.ofHours(1)))
                .thenReturn(new IssuedShareLink(link("tok-old"), false));

        mockMvc.perform(post("/api/shares/{type}/{id}", "resume", RESUME_ID)
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "owner-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ttlSeconds\":3600}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").value("tok-old"));
    }

    @Test
    void nonPositiveTtlIsRejected() throws Exception {
        mockMvc.perform(post("/api/shares/{type}/{id}", "resume", RESUME_ID)
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "owner-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ttlSeconds\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.ttlSeconds").exists());
        verifyNoInteractions(shareLinkService);
    }

    @Test
    void requestsWithoutPrincipalAreUnauthorized() throws Exception {
        mockMvc.perform(post("/api/shares/{type}/{id}", "resume", RESUME_ID))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
        verifyNoInteractions(shareLinkService);
    }

    @Test
    void nonOwnerIsForbidden() throws Exception {
        when(shareLinkService.createOrGetLink(eq(ResourceType.RESUME), eq(RESUME_ID), eq("intruder"), isNull()))
                .thenThrow(new NotOwnerException("Only the owner can share this resume"));

        mockMvc.perform(post("/api/shares/{type}/{id}", "resume", RESUME_ID)
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "intruder"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_OWNER"));
    }

    @Test
    void unknownResourceTypeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/shares/{type}/{id}", "portfolio", RESUME_ID)
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "owner-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void revokeAnswersNoContentEvenWithoutActiveLink() throws Exception {
        when(shareLinkService.revoke(eq(ResourceType.COVER_LETTER), eq(RESUME_ID), any(Principal.class)))
                .thenReturn(false);

        mockMvc.perform(delete("/api/shares/{type}/{id}", "cover_letter", RESUME_ID)
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "owner-1"))
                .andExpect(status().isNoContent());
        verify(shareLinkService).revoke(eq(ResourceType.COVER_LETTER), eq(RESUME_ID), any(Principal.class));
    }

    @Test
    void currentLinkIsNotFoundWhenNoneIsActive() throws Exception {
        when(shareLinkService.findCurrentLink(eq(ResourceType.RESUME), eq(RESUME_ID), any(Principal.class)))
                .thenReturn(Optional.empty());

        mockMvc.perform(get("/api/shares/{type}/{id}", "resume", RESUME_ID)
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "owner-1"))
                .andExpect(status().isNotFound());
    }
}
