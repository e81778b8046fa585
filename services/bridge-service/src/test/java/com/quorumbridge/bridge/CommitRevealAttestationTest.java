package com.quorumbridge.bridge;

import com.quorumbridge.bridge.crypto.CanonicalMessage;
import com.quorumbridge.bridge.domain.AttestationCommitment;
import com.quorumbridge.bridge.domain.AttestationMode;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.BridgeTransactionStatus;
import com.quorumbridge.bridge.domain.CommitmentStatus;
import com.quorumbridge.bridge.event.BridgeEventType;
import com.quorumbridge.bridge.exception.BridgeStateException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ValidationException;
import com.quorumbridge.bridge.service.attestation.AttestationSubmission;
import com.quorumbridge.bridge.support.TestSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Commit-Reveal Attestation Tests")
class CommitRevealAttestationTest extends BridgeScenarioTestBase {

    private static final String SALT_A = Numeric.toHexStringWithPrefixZeroPadded(BigInteger.valueOf(0xA11CE), 64);
    private static final String SALT_B = Numeric.toHexStringWithPrefixZeroPadded(BigInteger.valueOf(0xB0B), 64);

    private BridgeTransaction tx;

    @BeforeEach
    void useCommitReveal() {
        properties.getAttestation().setMode(AttestationMode.COMMIT_REVEAL);
        registerValidators(validatorA, validatorB, validatorC);
        tx = initiate(1_000);
    }

    @Test
    @DisplayName("Should complete after two validators commit and reveal")
    void shouldCompleteAfterReveals() {
        // Given
        AttestationCommitment commitment = commit(validatorA, SALT_A);
        commit(validatorB, SALT_B);

        // When
        reveal(validatorA, SALT_A);
        BridgeTransaction completed = reveal(validatorB, SALT_B);

        // Then
        assertThat(commitment.getRevealDeadline()).isEqualTo(START.plus(Duration.ofHours(1)));
        assertThat(completed.getStatus()).isEqualTo(BridgeTransactionStatus.COMPLETED);
        assertThat(transactionService.listAttestations(tx.getNonce()))
                .allSatisfy(a -> assertThat(a.getMode()).isEqualTo(AttestationMode.COMMIT_REVEAL));
        assertThat(events(BridgeEventType.ATTESTATION_COMMITTED)).hasSize(2);
    }

    @Test
    @DisplayName("Should reject a reveal whose salt does not match the commitment")
    void shouldRejectWrongSalt() {
        commit(validatorA, SALT_A);

        assertThatThrownBy(() -> transactionService.attest(validatorA.address(), tx.getNonce(),
                new AttestationSubmission(validatorA.sign(commitmentHash(SALT_B)), SALT_B)))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo(ErrorCode.INVALID_COMMITMENT);
    }

    @Test
    @DisplayName("Should reject a reveal without a prior commitment")
    void shouldRequireCommitment() {
        assertThatThrownBy(() -> reveal(validatorA, SALT_A))
                .isInstanceOf(BridgeStateException.class)
                .extracting("code").isEqualTo(ErrorCode.COMMITMENT_NOT_FOUND);
    }

    @Test
    @DisplayName("Should reject a second live commitment")
    void shouldRejectDuplicateCommitment() {
        commit(validatorA, SALT_A);

        assertThatThrownBy(() -> commit(validatorA, SALT_B))
                .extracting("code").isEqualTo(ErrorCode.DUPLICATE_COMMITMENT);
    }

    @Test
    @DisplayName("Should expire unrevealed commitments and allow a fresh one")
    void shouldExpireAndRecommit() {
        // Given
        commit(validatorA, SALT_A);
        clock.advance(Duration.ofHours(1));

        // When
        assertThatThrownBy(() -> reveal(validatorA, SALT_A))
                .extracting("code").isEqualTo(ErrorCode.ATTESTATION_WINDOW_EXPIRED);
        int expired = attestationLedger.expireStaleCommitments(clock.instant());

        // Then
        assertThat(expired).isEqualTo(1);
        AttestationCommitment renewed = commit(validatorA, SALT_B);
        assertThat(renewed.getStatus()).isEqualTo(CommitmentStatus.PENDING);
        reveal(validatorA, SALT_B);
        assertThat(transactionService.listAttestations(tx.getNonce())).hasSize(1);
    }

    @Test
    @DisplayName("Should refuse commitments in direct mode")
    void shouldRefuseCommitInDirectMode() {
        properties.getAttestation().setMode(AttestationMode.DIRECT);

        assertThatThrownBy(() -> commit(validatorA, SALT_A))
                .extracting("code").isEqualTo(ErrorCode.ATTESTATION_MODE_MISMATCH);
    }

    private AttestationCommitment commit(TestSigner signer, String salt) {
        return transactionService.commitAttestation(signer.address(), tx.getNonce(), commitmentHash(salt));
    }

    private BridgeTransaction reveal(TestSigner signer, String salt) {
        return transactionService.attest(signer.address(), tx.getNonce(),
                new AttestationSubmission(signer.sign(commitmentHash(salt)), salt));
    }

    private String commitmentHash(String salt) {
        return CanonicalMessage.toHex(CanonicalMessage.commitment(
                CanonicalMessage.fromHex(tx.getMessageHash()), CanonicalMessage.fromHex(salt)));
    }
}
