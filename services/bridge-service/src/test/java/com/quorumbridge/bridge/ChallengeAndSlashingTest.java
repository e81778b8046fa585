package com.quorumbridge.bridge;

import com.quorumbridge.bridge.client.dto.BalanceResponse;
import com.quorumbridge.bridge.domain.Attestation;
import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.Challenge;
import com.quorumbridge.bridge.domain.ChallengeStatus;
import com.quorumbridge.bridge.domain.ChallengeVote;
import com.quorumbridge.bridge.domain.ReserveFundType;
import com.quorumbridge.bridge.domain.ResolutionMethod;
import com.quorumbridge.bridge.domain.Validator;
import com.quorumbridge.bridge.dto.OpenChallengeRequest;
import com.quorumbridge.bridge.event.BridgeEventType;
import com.quorumbridge.bridge.exception.AuthorizationException;
import com.quorumbridge.bridge.exception.BridgeStateException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.exception.ValidationException;
import com.quorumbridge.bridge.service.attestation.AttestationSubmission;
import com.quorumbridge.bridge.support.TestSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@DisplayName("Challenge and Slashing Tests")
class ChallengeAndSlashingTest extends BridgeScenarioTestBase {

    private static final String CHALLENGER = "0x00000000000000000000000000000000000000d1";
    private static final String SECOND_CHALLENGER = "0x00000000000000000000000000000000000000d2";
    private static final String VOTER_1 = "0x00000000000000000000000000000000000000e1";
    private static final String VOTER_2 = "0x00000000000000000000000000000000000000e2";

    private BridgeTransaction completed;

    @BeforeEach
    void completeTransfer() {
        registerValidators(validatorA, validatorB, validatorC);
        BridgeTransaction tx = initiate(1_000);
        attest(validatorA, tx);
        completed = attest(validatorB, tx);
    }

    @Nested
    @DisplayName("Opening Challenges")
    class OpeningTests {

        @Test
        @DisplayName("Should take the challenger stake and open with a deadline")
        void shouldOpenChallenge() {
            Challenge challenge = open(validatorA);

            assertThat(challenge.getStatus()).isEqualTo(ChallengeStatus.OPEN);
            assertThat(challenge.getStake()).isEqualTo(BigInteger.valueOf(1_000));
            assertThat(challenge.getDeadline()).isEqualTo(START.plus(Duration.ofDays(3)));
            assertThat(events(BridgeEventType.CHALLENGE_OPENED)).hasSize(1);
        }

        @Test
        @DisplayName("Should reject challenges without an attestation to dispute")
        void shouldRequireAttestation() {
            assertThatThrownBy(() -> open(validatorC))
                    .isInstanceOf(ValidationException.class)
                    .extracting("code").isEqualTo(ErrorCode.ATTESTATION_NOT_FOUND);
        }

        @Test
        @DisplayName("Should reject self challenges and duplicates")
        void shouldRejectSelfAndDuplicate() {
            open(validatorA);

            assertThatThrownBy(() -> open(validatorA))
                    .isInstanceOf(BridgeStateException.class)
                    .extracting("code").isEqualTo(ErrorCode.DUPLICATE_CHALLENGE);
            assertThatThrownBy(() -> challengeService.openChallenge(validatorA.address(), request(validatorA)))
                    .extracting("code").isEqualTo(ErrorCode.SELF_CHALLENGE);
        }

        @Test
        @DisplayName("Should close challenges after the post-completion window")
        void shouldCloseWindow() {
            clock.advance(Duration.ofDays(3).plusSeconds(1));

            assertThatThrownBy(() -> open(validatorA))
                    .extracting("code").isEqualTo(ErrorCode.CHALLENGE_WINDOW_CLOSED);
        }
    }

    @Nested
    @DisplayName("Arbitrator Resolution")
    class ArbitratorTests {

        @Test
        @DisplayName("Should slash, split and revoke trust when upheld")
        void shouldSlashWhenUpheld() {
            // Given
            Challenge challenge = open(validatorA);
            clock.advance(Duration.ofDays(3));

            // When
            Challenge resolved = challengeService.resolveChallenge(ARBITRATOR, challenge.getId(), true);

            // Then
            assertThat(resolved.getStatus()).isEqualTo(ChallengeStatus.UPHELD);
            assertThat(resolved.getResolutionMethod()).isEqualTo(ResolutionMethod.ARBITRATOR);
            assertThat(resolved.getSlashedAmount()).isEqualTo(BigInteger.valueOf(1_000));
            assertThat(resolved.getChallengerReward()).isEqualTo(BigInteger.valueOf(500));
            assertThat(resolved.getInsuranceShare()).isEqualTo(BigInteger.valueOf(500));

            Validator slashed = validatorRepository.findByAddress(validatorA.address()).orElseThrow();
            assertThat(slashed.getStake()).isEqualTo(BigInteger.valueOf(9_000));
            assertThat(slashed.getSlashCount()).isEqualTo(1);
            assertThat(slashed.getReputation()).isEqualTo(399);
            assertThat(reserveFundService.balance(ReserveFundType.INSURANCE)).isEqualTo(BigInteger.valueOf(500));

            assertThat(transactionRepository.findById(completed.getNonce()).orElseThrow().isTrustRevoked()).isTrue();
            assertThat(transactionService.listAttestations(completed.getNonce()))
                    .filteredOn(a -> a.getValidatorAddress().equals(validatorA.address()))
                    .extracting(Attestation::isInvalidated)
                    .containsExactly(true);
            assertThat(events(BridgeEventType.VALIDATOR_SLASHED)).hasSize(1);
        }

        @Test
        @DisplayName("Should refund the challenger when rejected")
        void shouldRefundWhenRejected() {
            Challenge challenge = open(validatorA);
            clock.advance(Duration.ofDays(3));

            Challenge resolved = challengeService.resolveChallenge(ARBITRATOR, challenge.getId(), false);

            assertThat(resolved.getStatus()).isEqualTo(ChallengeStatus.REJECTED);
            assertThat(resolved.getSlashedAmount()).isZero();
            assertThat(validatorRepository.findByAddress(validatorA.address()).orElseThrow().getStake()).isEqualTo(STAKE);
            assertThatThrownBy(() -> challengeService.resolveChallenge(ARBITRATOR, challenge.getId(), true))
                    .extracting("code").isEqualTo(ErrorCode.ALREADY_RESOLVED);
        }

        @Test
        @DisplayName("Should refuse early resolution and non-arbitrators")
        void shouldGuardResolution() {
            Challenge challenge = open(validatorA);

            assertThatThrownBy(() -> challengeService.resolveChallenge(ARBITRATOR, challenge.getId(), true))
                    .extracting("code").isEqualTo(ErrorCode.CHALLENGE_PERIOD_ACTIVE);
            assertThatThrownBy(() -> challengeService.resolveChallenge(CHALLENGER, challenge.getId(), true))
                    .isInstanceOf(AuthorizationException.class)
                    .extracting("code").isEqualTo(ErrorCode.NOT_ARBITRATOR);
        }

        @Test
        @DisplayName("Should hold a removed validator's stake until its challenge settles")
        void shouldHoldStakeWhileChallenged() {
            // Given
            Challenge challenge = open(validatorA);
            Validator removed = validatorRegistry.removeValidator(OWNER, validatorA.address(), "rotating keys");
            assertThat(removed.getStake()).isEqualTo(STAKE);

            // When
            clock.advance(Duration.ofDays(3));
            challengeService.resolveChallenge(ARBITRATOR, challenge.getId(), true);

            // Then
            assertThat(validatorRepository.findByAddress(validatorA.address()).orElseThrow().getStake()).isZero();
            assertThat(events(BridgeEventType.VALIDATOR_STAKE_RELEASED)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Community Vote")
    class CommunityVoteTests {

        @Test
        @DisplayName("Should finalize early on a supermajority against the validator")
        void shouldFinalizeOnSupermajority() {
            // Given
            Challenge challenge = open(validatorA);
            when(tokenLedgerClient.balanceOf(VOTER_1)).thenReturn(BalanceResponse.builder().balance(BigInteger.valueOf(900)).build());
            when(tokenLedgerClient.balanceOf(VOTER_2)).thenReturn(BalanceResponse.builder().balance(BigInteger.valueOf(200)).build());

            // When
            challengeService.castVote(VOTER_1, challenge.getId(), false);
            challengeService.castVote(VOTER_2, challenge.getId(), true);
            Challenge resolved = challengeService.finalizeByVote(VOTER_2, challenge.getId());

            // Then
            assertThat(resolved.getStatus()).isEqualTo(ChallengeStatus.UPHELD);
            assertThat(resolved.getResolutionMethod()).isEqualTo(ResolutionMethod.COMMUNITY_VOTE);
            assertThat(resolved.getVotesAgainstValidator()).isEqualTo(BigInteger.valueOf(900));
            assertThat(challengeService.listVotes(challenge.getId())).hasSize(2);
        }

        @Test
        @DisplayName("Should weigh a vote by the voter's balance when it is cast")
        void shouldFixWeightAtVotingTime() {
            // Given
            Challenge challenge = open(validatorA);
            when(tokenLedgerClient.balanceOf(VOTER_1)).thenReturn(BalanceResponse.builder().balance(BigInteger.valueOf(700)).build());
            challengeService.castVote(VOTER_1, challenge.getId(), false);

            // When
            when(tokenLedgerClient.balanceOf(VOTER_1)).thenReturn(BalanceResponse.builder().balance(BigInteger.ZERO).build());

            // Then
            assertThat(challengeService.listVotes(challenge.getId()))
                    .extracting(ChallengeVote::getWeight)
                    .containsExactly(BigInteger.valueOf(700));
            assertThat(challengeService.getChallenge(challenge.getId()).getVotesAgainstValidator())
                    .isEqualTo(BigInteger.valueOf(700));
        }

        @Test
        @DisplayName("Should wait for the deadline without a supermajority and reject on tie")
        void shouldRejectTieAfterDeadline() {
            Challenge challenge = open(validatorA);
            challengeService.castVote(VOTER_1, challenge.getId(), false);
            challengeService.castVote(VOTER_2, challenge.getId(), true);

            assertThatThrownBy(() -> challengeService.finalizeByVote(VOTER_1, challenge.getId()))
                    .extracting("code").isEqualTo(ErrorCode.CHALLENGE_PERIOD_ACTIVE);

            clock.advance(Duration.ofDays(3));
            Challenge resolved = challengeService.finalizeByVote(VOTER_1, challenge.getId());

            assertThat(resolved.getStatus()).isEqualTo(ChallengeStatus.REJECTED);
        }

        @Test
        @DisplayName("Should reject party votes, duplicate votes and weak voters")
        void shouldGuardVotes() {
            Challenge challenge = open(validatorA);
            challengeService.castVote(VOTER_1, challenge.getId(), true);
            when(tokenLedgerClient.balanceOf(VOTER_2)).thenReturn(BalanceResponse.builder().balance(BigInteger.TEN).build());

            assertThatThrownBy(() -> challengeService.castVote(CHALLENGER, challenge.getId(), false))
                    .extracting("code").isEqualTo(ErrorCode.CONFLICT_OF_INTEREST);
            assertThatThrownBy(() -> challengeService.castVote(validatorA.address(), challenge.getId(), true))
                    .extracting("code").isEqualTo(ErrorCode.CONFLICT_OF_INTEREST);
            assertThatThrownBy(() -> challengeService.castVote(VOTER_1, challenge.getId(), true))
                    .extracting("code").isEqualTo(ErrorCode.DUPLICATE_VOTE);
            assertThatThrownBy(() -> challengeService.castVote(VOTER_2, challenge.getId(), true))
                    .extracting("code").isEqualTo(ErrorCode.INSUFFICIENT_VOTING_POWER);
            assertThatThrownBy(() -> challengeService.finalizeByVote(VOTER_1, open(validatorB).getId()))
                    .extracting("code").isEqualTo(ErrorCode.NO_VOTES_CAST);
        }

        @Test
        @DisplayName("Should close voting at the deadline")
        void shouldCloseVoting() {
            Challenge challenge = open(validatorA);
            clock.advance(Duration.ofDays(3));

            assertThatThrownBy(() -> challengeService.castVote(VOTER_1, challenge.getId(), false))
                    .extracting("code").isEqualTo(ErrorCode.VOTING_CLOSED);
        }
    }

    @Nested
    @DisplayName("One Dispute per Attestation")
    class SingleDisputeTests {

        @Test
        @DisplayName("Should refuse to challenge an attestation that was already slashed")
        void shouldRejectChallengeOfSlashedAttestation() {
            // Given
            Challenge first = open(validatorA);
            clock.advance(Duration.ofDays(3));
            challengeService.resolveChallenge(ARBITRATOR, first.getId(), true);

            // When / Then
            assertThatThrownBy(() -> challengeService.openChallenge(SECOND_CHALLENGER, request(validatorA)))
                    .isInstanceOf(BridgeStateException.class)
                    .extracting("code").isEqualTo(ErrorCode.ATTESTATION_ALREADY_SLASHED);
            assertThatThrownBy(() -> open(validatorA))
                    .extracting("code").isEqualTo(ErrorCode.ATTESTATION_ALREADY_SLASHED);

            Validator slashed = validatorRepository.findByAddress(validatorA.address()).orElseThrow();
            assertThat(slashed.getStake()).isEqualTo(BigInteger.valueOf(9_000));
            assertThat(slashed.getSlashCount()).isEqualTo(1);
            assertThat(events(BridgeEventType.VALIDATOR_SLASHED)).hasSize(1);
        }

        @Test
        @DisplayName("Should refuse a second challenge while one is open on the same attestation")
        void shouldRejectParallelChallenge() {
            open(validatorA);

            assertThatThrownBy(() -> challengeService.openChallenge(SECOND_CHALLENGER, request(validatorA)))
                    .isInstanceOf(BridgeStateException.class)
                    .extracting("code").isEqualTo(ErrorCode.DUPLICATE_CHALLENGE);
        }

        @Test
        @DisplayName("Should allow a new challenge after a rejected one")
        void shouldAllowChallengeAfterRejection() {
            Challenge first = open(validatorA);
            clock.advance(Duration.ofDays(3));
            challengeService.resolveChallenge(ARBITRATOR, first.getId(), false);

            Challenge second = challengeService.openChallenge(SECOND_CHALLENGER, request(validatorA));

            assertThat(second.getStatus()).isEqualTo(ChallengeStatus.OPEN);
        }
    }

    @Test
    @DisplayName("Should deactivate a validator after the maximum number of slashes")
    void shouldDeactivateAfterRepeatedSlashes() {
        // Given
        properties.getValidator().setMaxSlashCount(2);
        BridgeTransaction second = initiate(1_000);
        attest(validatorA, second);
        attest(validatorB, second);
        Challenge onFirst = open(validatorA);
        Challenge onSecond = challengeService.openChallenge(CHALLENGER, request(validatorA, second.getNonce()));
        clock.advance(Duration.ofDays(3));

        // When
        challengeService.resolveChallenge(ARBITRATOR, onFirst.getId(), true);
        challengeService.resolveChallenge(ARBITRATOR, onSecond.getId(), true);

        // Then
        Validator banned = validatorRepository.findByAddress(validatorA.address()).orElseThrow();
        assertThat(banned.isActive()).isFalse();
        assertThat(banned.getSlashCount()).isEqualTo(2);
        assertThat(events(BridgeEventType.VALIDATOR_DEACTIVATED)).hasSize(1);
        assertThatThrownBy(() -> validatorRegistry.addValidator(OWNER, validatorA.address(), STAKE))
                .isInstanceOf(AuthorizationException.class)
                .extracting("code").isEqualTo(ErrorCode.VALIDATOR_BANNED);
    }

    private BridgeTransaction attest(TestSigner signer, BridgeTransaction tx) {
        return transactionService.attest(signer.address(), tx.getNonce(),
                AttestationSubmission.direct(signer.sign(tx.getMessageHash())));
    }

    private Challenge open(TestSigner validator) {
        return challengeService.openChallenge(CHALLENGER, request(validator));
    }

    private OpenChallengeRequest request(TestSigner validator) {
        return request(validator, completed.getNonce());
    }

    private OpenChallengeRequest request(TestSigner validator, Long nonce) {
        return OpenChallengeRequest.builder()
                .validator(validator.address())
                .transactionNonce(nonce)
                .proof("destination mint for nonce " + nonce + " never happened")
                .build();
    }
}
