package com.quorumbridge.bridge.event;

/**
 * Events emitted by the bridge and the Kafka topic each one is relayed to.
 */
public enum BridgeEventType {
    BRIDGE_INITIATED(Topics.TRANSACTIONS),
    VALIDATOR_SIGNED(Topics.TRANSACTIONS),
    ATTESTATION_COMMITTED(Topics.TRANSACTIONS),
    FAILURE_VOTE_CAST(Topics.TRANSACTIONS),
    BRIDGE_COMPLETED(Topics.TRANSACTIONS),
    BRIDGE_FAILED(Topics.TRANSACTIONS),
    BRIDGE_CANCELLED(Topics.TRANSACTIONS),
    FEES_WITHDRAWN(Topics.TRANSACTIONS),
    CHAIN_CONFIGURED(Topics.TRANSACTIONS),

    VALIDATOR_ADDED(Topics.VALIDATORS),
    VALIDATOR_REMOVED(Topics.VALIDATORS),
    VALIDATOR_DEACTIVATED(Topics.VALIDATORS),
    VALIDATOR_STAKE_RELEASED(Topics.VALIDATORS),
    VALIDATOR_SLASHED(Topics.VALIDATORS),

    CHALLENGE_OPENED(Topics.CHALLENGES),
    CHALLENGE_VOTE_CAST(Topics.CHALLENGES),
    CHALLENGE_RESOLVED(Topics.CHALLENGES);

    private final String topic;

    BridgeEventType(String topic) {
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }

    public static final class Topics {
        public static final String TRANSACTIONS = "bridge-transaction-events";
        public static final String VALIDATORS = "bridge-validator-events";
        public static final String CHALLENGES = "bridge-challenge-events";

        private Topics() {
        }
    }
}
