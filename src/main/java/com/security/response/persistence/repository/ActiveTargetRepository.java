package com.security.response.persistence.repository;

import com.security.response.persistence.entity.ActiveTargetEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ActiveTargetRepository extends JpaRepository<ActiveTargetEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM ActiveTargetEntity t WHERE t.target = :target")
    Optional<ActiveTargetEntity> findByTargetForUpdate(@Param("target") String target);
}
