package com.security.response.persistence.repository;

import com.security.response.domain.ProposalFilter;
import com.security.response.persistence.entity.ActionProposalEntity;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * Criteria for operator queries over proposals.
 */
public final class ProposalSpecifications {

    private ProposalSpecifications() {
    }

    public static Specification<ActionProposalEntity> matching(ProposalFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), filter.getStatus()));
            }
            if (filter.getTarget() != null) {
                predicates.add(cb.equal(root.get("target"), filter.getTarget()));
            }
            if (filter.getActionType() != null) {
                predicates.add(cb.equal(root.get("actionType"), filter.getActionType()));
            }
            if (filter.getRequiresApproval() != null) {
                predicates.add(cb.equal(root.get("requiresApproval"), filter.getRequiresApproval()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
