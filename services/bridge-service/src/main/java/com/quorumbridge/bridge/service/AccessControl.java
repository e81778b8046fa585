package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.exception.AuthorizationException;
import com.quorumbridge.bridge.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Role checks for owner and arbitrator operations.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AccessControl {

    private final BridgeProperties properties;

    public void requireOwner(String caller) {
        if (!properties.isOwner(caller)) {
            log.warn("Rejected owner-only operation from {}", caller);
            throw new AuthorizationException(ErrorCode.NOT_OWNER, "Caller is not the bridge owner");
        }
    }

    public void requireArbitrator(String caller) {
        if (!properties.isArbitrator(caller)) {
            log.warn("Rejected arbitrator-only operation from {}", caller);
            throw new AuthorizationException(ErrorCode.NOT_ARBITRATOR, "Caller is not an arbitrator");
        }
    }
}
