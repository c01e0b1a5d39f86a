package com.security.response.persistence.repository;

import com.security.response.domain.AuditEventType;
import com.security.response.persistence.entity.AuditEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AuditEntryRepository extends JpaRepository<AuditEntryEntity, Long> {

    List<AuditEntryEntity> findAllByOrderBySequenceAsc();

    List<AuditEntryEntity> findByProposalIdOrderBySequenceAsc(String proposalId);

    Optional<AuditEntryEntity> findFirstByEventTypeOrderBySequenceDesc(AuditEventType eventType);
}
