package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.Validator;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ValidatorRepository extends JpaRepository<Validator, Long> {

    Optional<Validator> findByAddress(String address);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Validator v WHERE v.address = :address")
    Optional<Validator> findByAddressForUpdate(@Param("address") String address);

    long countByActiveTrue();

    List<Validator> findByActiveTrueOrderByRegisteredAtAsc();

    List<Validator> findByAddressIn(List<String> addresses);
}
