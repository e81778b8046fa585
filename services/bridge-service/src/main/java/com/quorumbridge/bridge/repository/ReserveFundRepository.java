package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.ReserveFund;
import com.quorumbridge.bridge.domain.ReserveFundType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ReserveFundRepository extends JpaRepository<ReserveFund, Long> {

    Optional<ReserveFund> findByFundType(ReserveFundType fundType);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM ReserveFund f WHERE f.fundType = :fundType")
    Optional<ReserveFund> findByFundTypeForUpdate(@Param("fundType") ReserveFundType fundType);
}
