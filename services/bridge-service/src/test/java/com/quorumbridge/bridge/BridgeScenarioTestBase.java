package com.quorumbridge.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quorumbridge.bridge.client.TokenLedgerClient;
import com.quorumbridge.bridge.client.dto.BalanceResponse;
import com.quorumbridge.bridge.client.dto.TransferResult;
import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.domain.BridgeEventOutbox;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.dto.InitiateBridgeRequest;
import com.quorumbridge.bridge.event.BridgeEventPublisher;
import com.quorumbridge.bridge.event.BridgeEventType;
import com.quorumbridge.bridge.health.BridgeHealthIndicator;
import com.quorumbridge.bridge.metrics.BridgeMetricsService;
import com.quorumbridge.bridge.repository.AttestationCommitmentRepository;
import com.quorumbridge.bridge.repository.AttestationRepository;
import com.quorumbridge.bridge.repository.BridgeEventOutboxRepository;
import com.quorumbridge.bridge.repository.BridgeTransactionRepository;
import com.quorumbridge.bridge.repository.ChainConfigurationRepository;
import com.quorumbridge.bridge.repository.ChallengeRepository;
import com.quorumbridge.bridge.repository.ChallengeVoteRepository;
import com.quorumbridge.bridge.repository.FailureVoteRepository;
import com.quorumbridge.bridge.repository.ReserveFundRepository;
import com.quorumbridge.bridge.repository.ValidatorRepository;
import com.quorumbridge.bridge.repository.VolumeLimitWindowRepository;
import com.quorumbridge.bridge.service.AccessControl;
import com.quorumbridge.bridge.service.BridgeMonitoringService;
import com.quorumbridge.bridge.service.BridgeTransactionService;
import com.quorumbridge.bridge.service.ChainRegistryService;
import com.quorumbridge.bridge.service.ChallengeService;
import com.quorumbridge.bridge.service.ReputationPolicy;
import com.quorumbridge.bridge.service.ReserveFundService;
import com.quorumbridge.bridge.service.SlashingCalculator;
import com.quorumbridge.bridge.service.TokenLedger;
import com.quorumbridge.bridge.service.ValidatorRegistryService;
import com.quorumbridge.bridge.service.VolumeLimitService;
import com.quorumbridge.bridge.service.attestation.AttestationLedger;
import com.quorumbridge.bridge.service.attestation.CommitRevealStrategy;
import com.quorumbridge.bridge.service.attestation.DirectSignatureStrategy;
import com.quorumbridge.bridge.support.MutableClock;
import com.quorumbridge.bridge.support.TestProperties;
import com.quorumbridge.bridge.support.TestSigner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.when;

/**
 * Base for end-to-end bridge scenarios against an embedded database.
 *
 * <p>Service calls commit their own transactions. The token ledger is mocked and accepts
 * every transfer unless a test says otherwise.</p>
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        BridgeScenarioTestBase.ScenarioConfiguration.class,
        AccessControl.class,
        TokenLedger.class,
        ReputationPolicy.class,
        SlashingCalculator.class,
        ReserveFundService.class,
        VolumeLimitService.class,
        ChainRegistryService.class,
        ValidatorRegistryService.class,
        DirectSignatureStrategy.class,
        CommitRevealStrategy.class,
        AttestationLedger.class,
        BridgeTransactionService.class,
        BridgeMonitoringService.class,
        BridgeHealthIndicator.class,
        ChallengeService.class,
        BridgeEventPublisher.class,
        BridgeMetricsService.class
})
public abstract class BridgeScenarioTestBase {

    protected static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
    protected static final String OWNER = TestProperties.OWNER;
    protected static final String ARBITRATOR = TestProperties.ARBITRATOR;
    protected static final String USER = "0x00000000000000000000000000000000000000b1";
    protected static final BigInteger STAKE = BigInteger.valueOf(10_000);

    protected final TestSigner validatorA = TestSigner.fromSeed(1);
    protected final TestSigner validatorB = TestSigner.fromSeed(2);
    protected final TestSigner validatorC = TestSigner.fromSeed(3);

    @MockBean
    protected TokenLedgerClient tokenLedgerClient;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected BridgeProperties properties;

    @Autowired
    protected BridgeTransactionService transactionService;

    @Autowired
    protected ValidatorRegistryService validatorRegistry;

    @Autowired
    protected ChallengeService challengeService;

    @Autowired
    protected BridgeMonitoringService monitoringService;

    @Autowired
    protected BridgeHealthIndicator healthIndicator;

    @Autowired
    protected ChainRegistryService chainRegistry;

    @Autowired
    protected ReserveFundService reserveFundService;

    @Autowired
    protected AttestationLedger attestationLedger;

    @Autowired
    protected BridgeTransactionRepository transactionRepository;

    @Autowired
    protected ValidatorRepository validatorRepository;

    @Autowired
    protected BridgeEventOutboxRepository outboxRepository;

    @Autowired
    private AttestationRepository attestationRepository;

    @Autowired
    private AttestationCommitmentRepository commitmentRepository;

    @Autowired
    private FailureVoteRepository failureVoteRepository;

    @Autowired
    private ChallengeRepository challengeRepository;

    @Autowired
    private ChallengeVoteRepository challengeVoteRepository;

    @Autowired
    private ChainConfigurationRepository chainRepository;

    @Autowired
    private ReserveFundRepository reserveFundRepository;

    @Autowired
    private VolumeLimitWindowRepository windowRepository;

    @BeforeEach
    void resetBridge() {
        attestationRepository.deleteAllInBatch();
        commitmentRepository.deleteAllInBatch();
        failureVoteRepository.deleteAllInBatch();
        challengeVoteRepository.deleteAllInBatch();
        challengeRepository.deleteAllInBatch();
        transactionRepository.deleteAllInBatch();
        validatorRepository.deleteAllInBatch();
        chainRepository.deleteAllInBatch();
        reserveFundRepository.deleteAllInBatch();
        windowRepository.deleteAllInBatch();
        outboxRepository.deleteAllInBatch();

        BeanUtils.copyProperties(TestProperties.bridgeProperties(), properties);
        clock.set(START);

        reset(tokenLedgerClient);
        when(tokenLedgerClient.transferFrom(any()))
                .thenReturn(TransferResult.builder().success(true).transferId("lock").build());
        when(tokenLedgerClient.transfer(any()))
                .thenReturn(TransferResult.builder().success(true).transferId("payout").build());
        when(tokenLedgerClient.balanceOf(anyString()))
                .thenReturn(BalanceResponse.builder().balance(BigInteger.valueOf(1_000)).build());

        chainRegistry.seed(properties.getChains());
    }

    protected void registerValidators(TestSigner... signers) {
        for (TestSigner signer : signers) {
            validatorRegistry.addValidator(OWNER, signer.address(), STAKE);
        }
    }

    protected BridgeTransaction initiate(long amount) {
        return transactionService.initiate(USER, InitiateBridgeRequest.builder()
                .amount(BigInteger.valueOf(amount))
                .destinationChainId(TestProperties.DESTINATION_CHAIN)
                .build());
    }

    protected List<BridgeEventOutbox> events(BridgeEventType type) {
        return outboxRepository.findByEventTypeOrderByCreatedAtAsc(type.name());
    }

    @TestConfiguration
    static class ScenarioConfiguration {

        @Bean
        MutableClock clock() {
            return new MutableClock(START);
        }

        @Bean
        BridgeProperties bridgeProperties() {
            return TestProperties.bridgeProperties();
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }
}
