package com.foliogate.shared.repository;

import com.foliogate.shared.dto.UsageRecordFilter;
import com.foliogate.shared.model.UsageRecord;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds criteria queries for the admin usage listing.
 */
public final class UsageRecordSpecifications {

    private UsageRecordSpecifications() {
    }

    public static Specification<UsageRecord> matching(UsageRecordFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getPrincipalId() != null && !filter.getPrincipalId().isBlank()) {
                predicates.add(cb.equal(root.get("principalId"), filter.getPrincipalId()));
            }
            if (filter.getOperationClass() != null && !filter.getOperationClass().isBlank()) {
                predicates.add(cb.equal(root.get("operationClass"), filter.getOperationClass()));
            }
            if (filter.getFeature() != null && !filter.getFeature().isBlank()) {
                predicates.add(cb.equal(root.get("feature"), filter.getFeature()));
            }
            if (filter.getOutcome() != null) {
                predicates.add(cb.equal(root.get("outcome"), filter.getOutcome()));
            }
            if (filter.getFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("timestamp"), filter.getFrom()));
            }
            if (filter.getTo() != null) {
                predicates.add(cb.lessThan(root.get("timestamp"), filter.getTo()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
