package com.security.response.persistence.repository;

import com.security.response.persistence.entity.ActionProposalEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ActionProposalRepository extends JpaRepository<ActionProposalEntity, String>,
        JpaSpecificationExecutor<ActionProposalEntity> {

    /** Row-locking read used for every status compare-and-set. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM ActionProposalEntity p WHERE p.proposalId = :proposalId")
    Optional<ActionProposalEntity> findByIdForUpdate(@Param("proposalId") String proposalId);
}
