package com.foliogate.api;

import com.foliogate.processing.UsageLedgerService;
import com.foliogate.security.Principal;
import com.foliogate.security.PrincipalFilter;
import com.foliogate.shared.dto.UsageRecordFilter;
import com.foliogate.shared.dto.UsageSummaryResponse;
import com.foliogate.shared.model.UsageOutcome;
import com.foliogate.shared.model.UsageRecord;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web slice test for the staff-only usage ledger listing.
 */
@WebMvcTest(AdminUsageController.class)
class AdminUsageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UsageLedgerService usageLedgerService;

    @Test
    void nonStaffIsForbidden() throws Exception {
        mockMvc.perform(get("/api/admin/usage")
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "u1")
                        .header(PrincipalFilter.ROLES_HEADER, "editor"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
        verifyNoInteractions(usageLedgerService);
    }

    @Test
    void staffListsNewestFirstWithFilters() throws Exception {
        UsageRecord record = new UsageRecord(UUID.fromString("5b1e2d3c-4a5b-4c6d-8e7f-9a0b1c2d3e4f"),
                "u1", "ai_generation", "summary", Instant.parse("2025-03-01T10:00:00Z"),
                UsageOutcome.RATE_LIMITED, null, null, 0, 0, BigDecimal.ZERO,
                "Rate limit exceeded for ai_generation", Map.of());
        when(usageLedgerService.search(any(UsageRecordFilter.class), any(Pageable.class)))
                .thenAnswer(invocation -> new PageImpl<>(List.of(record), invocation.getArgument(1), 1));

        mockMvc.perform(get("/api/admin/usage")
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "admin")
                        .header(PrincipalFilter.ROLES_HEADER, Principal.STAFF_ROLE)
                        .param("principalId", "u1")
                        .param("outcome", "RATE_LIMITED")
                        .param("size", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records[0].principalId").value("u1"))
                .andExpect(jsonPath("$.records[0].outcome").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.size").value(20))
                .andExpect(jsonPath("$.totalElements").value(1));

        ArgumentCaptor<UsageRecordFilter> filter = ArgumentCaptor.forClass(UsageRecordFilter.class);
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(usageLedgerService).search(filter.capture(), pageable.capture());
        assertThat(filter.getValue().getPrincipalId()).isEqualTo("u1");
        assertThat(filter.getValue().getOutcome()).isEqualTo(UsageOutcome.RATE_LIMITED);
        assertThat(pageable.getValue().getSort().getOrderFor("timestamp").getDirection())
                .isEqualTo(Sort.Direction.DESC);
    }

    @Test
    void oversizedPageIsRejected() throws Exception {
        mockMvc.perform(get("/api/admin/usage")
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "admin")
                        .header(PrincipalFilter.ROLES_HEADER, "staff")
                        .param("size", "500"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(usageLedgerService);
    }

    @Test
    void summaryReturnsTotals() throws Exception {
        when(usageLedgerService.summarize(any(UsageRecordFilter.class)))
                .thenReturn(new UsageSummaryResponse(12, 9, 1, 2, 1500, 600, new BigDecimal("0.001650")));

        mockMvc.perform(get("/api/admin/usage/summary")
                        .header(PrincipalFilter.PRINCIPAL_HEADER, "admin")
                        .header(PrincipalFilter.ROLES_HEADER, "Staff, billing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.attempts").value(12))
                .andExpect(jsonPath("$.rateLimited").value(2))
                .andExpect(jsonPath("$.tokensIn").value(1500));
    }
}
