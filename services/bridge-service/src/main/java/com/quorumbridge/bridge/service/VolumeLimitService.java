package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.domain.VolumeLimitWindow;
import com.quorumbridge.bridge.exception.EconomicException;
import com.quorumbridge.bridge.exception.ErrorCode;
import com.quorumbridge.bridge.repository.VolumeLimitWindowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Fixed-epoch volume limits, global and per user. A limit of zero disables the check.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VolumeLimitService {

    private final VolumeLimitWindowRepository windowRepository;
    private final BridgeProperties properties;

    @Transactional
    public void consume(String user, BigInteger amount, Instant now) {
        BridgeProperties.TransactionProperties config = properties.getTransaction();
        long epoch = epochIndex(now);
        consume(VolumeLimitWindow.GLOBAL_SCOPE, amount, config.getGlobalEpochLimit(), epoch);
        consume(VolumeLimitWindow.userScope(user), amount, config.getUserEpochLimit(), epoch);
    }

    public long epochIndex(Instant now) {
        return Math.floorDiv(now.getEpochSecond(), properties.getTransaction().getEpochLength().getSeconds());
    }

    private void consume(String scope, BigInteger amount, BigInteger limit, long epoch) {
        if (limit == null || limit.signum() == 0) {
            return;
        }
        VolumeLimitWindow window = windowRepository.findByScopeForUpdate(scope)
                .orElseGet(() -> VolumeLimitWindow.builder()
                        .scope(scope)
                        .epochIndex(epoch)
                        .used(BigInteger.ZERO)
                        .build());
        if (!window.tryConsume(epoch, amount, limit)) {
            log.warn("Volume limit reached for {}: used {} + {} > {}", scope, window.getUsed(), amount, limit);
            throw new EconomicException(ErrorCode.DAILY_LIMIT_EXCEEDED,
                    "Volume limit exceeded for " + scope + " in current epoch", true);
        }
        windowRepository.save(window);
    }
}
