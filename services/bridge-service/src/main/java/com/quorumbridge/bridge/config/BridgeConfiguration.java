package com.quorumbridge.bridge.config;

import com.quorumbridge.bridge.service.ChainRegistryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Binds and checks bridge policy settings, seeds configured chains and enables the
 * outbox relay and commitment expiry schedulers.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(BridgeProperties.class)
@Slf4j
public class BridgeConfiguration {

    public BridgeConfiguration(BridgeProperties properties) {
        properties.validate();
        log.info("Bridge policy loaded: chainId={} mode={} threshold={} minActiveValidators={}",
                properties.getChainId(),
                properties.getAttestation().getMode(),
                properties.getAttestation().getThreshold(),
                properties.getValidator().getMinActiveValidators());
    }

    @Bean
    public ApplicationRunner chainConfigurationSeeder(ChainRegistryService chainRegistryService,
                                                      BridgeProperties properties) {
        return args -> chainRegistryService.seed(properties.getChains());
    }
}
