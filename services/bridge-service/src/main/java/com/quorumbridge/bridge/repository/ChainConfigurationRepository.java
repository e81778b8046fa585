package com.quorumbridge.bridge.repository;

import com.quorumbridge.bridge.domain.ChainConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChainConfigurationRepository extends JpaRepository<ChainConfiguration, Long> {

    List<ChainConfiguration> findByEnabledTrueOrderByChainIdAsc();
}
