package com.foliogate.api;

import com.foliogate.processing.UsageLedgerService;
import com.foliogate.shared.dto.UsageRecordFilter;
import com.foliogate.shared.dto.UsageRecordResponse;
import com.foliogate.shared.dto.UsageSummaryResponse;
import com.foliogate.shared.model.UsageOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Staff-only listing of the usage ledger. Access is enforced by PrincipalFilter.
 */
@RestController
@RequestMapping("/api/admin/usage")
@Tag(name = "Admin", description = "Usage ledger inspection")
public class AdminUsageController {

    private static final int MAX_PAGE_SIZE = 200;

    private final UsageLedgerService usageLedgerService;

    public AdminUsageController(UsageLedgerService usageLedgerService) {
        this.usageLedgerService = usageLedgerService;
    }

    @GetMapping
    @Operation(summary = "List usage records", description = "Newest first, filtered and paged")
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(value = "principalId", required = false) String principalId,
            @RequestParam(value = "operationClass", required = false) String operationClass,
            @RequestParam(value = "feature", required = false) String feature,
            @RequestParam(value = "outcome", required = false) UsageOutcome outcome,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) {

        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        UsageRecordFilter filter = filter(principalId, operationClass, feature, outcome, from, to);
        Page<UsageRecordResponse> records = usageLedgerService
                .search(filter, PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "timestamp")))
                .map(UsageRecordResponse::from);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("records", records.getContent());
        response.put("page", records.getNumber());
        response.put("size", records.getSize());
        response.put("totalElements", records.getTotalElements());
        response.put("totalPages", records.getTotalPages());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/summary")
    @Operation(summary = "Summarize usage", description = "Totals over the records matching the filters")
    public ResponseEntity<UsageSummaryResponse> summary(
            @RequestParam(value = "principalId", required = false) String principalId,
            @RequestParam(value = "operationClass", required = false) String operationClass,
            @RequestParam(value = "feature", required = false) String feature,
            @RequestParam(value = "outcome", required = false) UsageOutcome outcome,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        return ResponseEntity.ok(usageLedgerService.summarize(
                filter(principalId, operationClass, feature, outcome, from, to)));
    }

    private static UsageRecordFilter filter(String principalId, String operationClass, String feature,
                                            UsageOutcome outcome, Instant from, Instant to) {
        UsageRecordFilter filter = new UsageRecordFilter();
        filter.setPrincipalId(principalId);
        filter.setOperationClass(operationClass);
        filter.setFeature(feature);
        filter.setOutcome(outcome);
        filter.setFrom(from);
        filter.setTo(to);
        return filter;
    }
}
