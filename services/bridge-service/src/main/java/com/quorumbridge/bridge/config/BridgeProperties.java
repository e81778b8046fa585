package com.quorumbridge.bridge.config;

import com.quorumbridge.bridge.domain.AttestationMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Bridge policy configuration (bridge.*).
 *
 * <p>All token amounts are integer base units of the bridged token. Basis-point
 * values are out of 10 000.</p>
 */
@Data
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

    public static final int BPS_DENOMINATOR = 10_000;

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    /** Chain id of the ledger this service guards. */
    private long chainId = 1L;

    /** Owner account: validator set management, chain configuration, fee withdrawal. */
    private String owner;

    /** Additional accounts allowed to resolve challenges. The owner is always an arbitrator. */
    private List<String> arbitrators = new ArrayList<>();

    /** Token account holding locked principal, fees, validator and challenge stakes. */
    private String custodyAddress;

    private ValidatorProperties validator = new ValidatorProperties();
    private AttestationProperties attestation = new AttestationProperties();
    private TransactionProperties transaction = new TransactionProperties();
    private ChallengeProperties challenge = new ChallengeProperties();
    private VoteProperties vote = new VoteProperties();
    private MonitoringProperties monitoring = new MonitoringProperties();
    private List<ChainProperties> chains = new ArrayList<>();

    @Data
    public static class ValidatorProperties {
        private BigInteger minStake = BigInteger.valueOf(10_000);
        private int maxActiveValidators = 21;
        private int minActiveValidators = 3;
        private int initialReputation = 500;
        private int maxReputation = 1000;
        private int minReputationToValidate = 300;
        private int decayPerDay = 2;
        private int attestationReward = 5;
        private int slashReputationPenalty = 100;
        private int deactivationReputationFloor = 100;
        private int maxSlashCount = 3;
    }

    @Data
    public static class AttestationProperties {
        private AttestationMode mode = AttestationMode.DIRECT;
        private int threshold = 3;
        private Duration revealWindow = Duration.ofHours(1);
    }

    @Data
    public static class TransactionProperties {
        private Duration timeout = Duration.ofHours(24);
        private Duration epochLength = Duration.ofDays(1);
        /** Zero disables the global epoch limit. */
        private BigInteger globalEpochLimit = BigInteger.ZERO;
        /** Zero disables the per-user epoch limit. */
        private BigInteger userEpochLimit = BigInteger.ZERO;
    }

    @Data
    public static class ChallengeProperties {
        private BigInteger stake = BigInteger.valueOf(1_000);
        private Duration period = Duration.ofDays(3);
        private Duration postCompletionWindow = Duration.ofDays(3);
        private int slashBps = 1_000;
        private int maxSlashBps = 2_000;
        private int challengerRewardBps = 5_000;
    }

    @Data
    public static class VoteProperties {
        private BigInteger minVotingPower = BigInteger.valueOf(100);
        private int supermajorityBps = 6_667;
        private BigInteger minTotalVoteWeight = BigInteger.valueOf(1_000);
    }

    @Data
    public static class MonitoringProperties {
        /** A transfer still pending this long after initiation is reported as stuck. */
        private Duration stuckAfter = Duration.ofHours(24);
    }

    @Data
    public static class ChainProperties {
        private long chainId;
        private String name;
        private boolean enabled = true;
        private BigInteger minAmount = BigInteger.ONE;
        private BigInteger maxAmount = BigInteger.valueOf(1_000_000_000L);
        private BigInteger baseFee = BigInteger.ZERO;
        private int feeBps = 0;
    }

    /**
     * Rejects settings under which quorum could never be reached or payouts could
     * exceed the slashed amount.
     */
    public void validate() {
        requireAddress("bridge.owner", owner);
        requireAddress("bridge.custody-address", custodyAddress);
        arbitrators.forEach(a -> requireAddress("bridge.arbitrators", a));

        if (attestation.threshold < 1) {
            throw new IllegalStateException("bridge.attestation.threshold must be at least 1");
        }
        if (attestation.threshold > validator.minActiveValidators) {
            throw new IllegalStateException("bridge.attestation.threshold (" + attestation.threshold
                    + ") exceeds bridge.validator.min-active-validators (" + validator.minActiveValidators + ")");
        }
        if (validator.minActiveValidators > validator.maxActiveValidators) {
            throw new IllegalStateException("bridge.validator.min-active-validators exceeds max-active-validators");
        }
        if (validator.initialReputation < 0 || validator.initialReputation > validator.maxReputation) {
            throw new IllegalStateException("bridge.validator.initial-reputation must be within [0, max-reputation]");
        }
        if (validator.minStake.signum() < 0) {
            throw new IllegalStateException("bridge.validator.min-stake must not be negative");
        }
        requireBps("bridge.challenge.max-slash-bps", challenge.maxSlashBps);
        requireBps("bridge.challenge.slash-bps", challenge.slashBps);
        requireBps("bridge.challenge.challenger-reward-bps", challenge.challengerRewardBps);
        if (challenge.slashBps > challenge.maxSlashBps) {
            throw new IllegalStateException("bridge.challenge.slash-bps exceeds max-slash-bps");
        }
        requireBps("bridge.vote.supermajority-bps", vote.supermajorityBps);
        if (vote.supermajorityBps <= BPS_DENOMINATOR / 2) {
            throw new IllegalStateException("bridge.vote.supermajority-bps must be above a simple majority");
        }
        if (transaction.timeout.isNegative() || transaction.timeout.isZero()) {
            throw new IllegalStateException("bridge.transaction.timeout must be positive");
        }
        if (transaction.epochLength.getSeconds() <= 0) {
            throw new IllegalStateException("bridge.transaction.epoch-length must be at least one second");
        }
        if (monitoring.stuckAfter.isNegative() || monitoring.stuckAfter.isZero()) {
            throw new IllegalStateException("bridge.monitoring.stuck-after must be positive");
        }
    }

    public boolean isOwner(String address) {
        return address != null && owner != null
                && owner.toLowerCase(Locale.ROOT).equals(address.toLowerCase(Locale.ROOT));
    }

    public boolean isArbitrator(String address) {
        if (isOwner(address)) {
            return true;
        }
        return address != null && arbitrators.stream()
                .anyMatch(a -> a.toLowerCase(Locale.ROOT).equals(address.toLowerCase(Locale.ROOT)));
    }

    private static void requireAddress(String key, String value) {
        if (value == null || !ADDRESS.matcher(value).matches()) {
            throw new IllegalStateException(key + " must be a 0x-prefixed 20-byte hex address");
        }
    }

    private static void requireBps(String key, int value) {
        if (value < 0 || value > BPS_DENOMINATOR) {
            throw new IllegalStateException(key + " must be within [0, " + BPS_DENOMINATOR + "]");
        }
    }
}
