package com.quorumbridge.bridge.domain;

public enum ResolutionMethod {
    ARBITRATOR,
    COMMUNITY_VOTE
}
