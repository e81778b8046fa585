package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.VolumeLimitWindow;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VolumeLimitWindowRepository extends JpaRepository<VolumeLimitWindow, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM VolumeLimitWindow w WHERE w.scope = :scope")
    Optional<VolumeLimitWindow> findByScopeForUpdate(@Param("scope") String scope);
}
