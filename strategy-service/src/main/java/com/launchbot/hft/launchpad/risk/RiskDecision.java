package com.launchbot.hft.launchpad.risk;

import com.launchbot.hft.domain.ProtectionLevel;

import java.math.BigDecimal;

/**
 * The only gate to execution. One per signal.
 *
 * @param adjustedSize approved size in base units, zero when rejected
 * @param reason {@code null} when approved
 */
public record RiskDecision(
        String signalId,
        boolean approved,
        BigDecimal adjustedSize,
        RejectReason reason,
        ProtectionLevel protectionLevel
) {

    public static RiskDecision approve(String signalId, BigDecimal size, ProtectionLevel protection) {
        return new RiskDecision(signalId, true, size, null, protection);
    }

    public static RiskDecision reject(String signalId, RejectReason reason, ProtectionLevel protection) {
        return new RiskDecision(signalId, false, BigDecimal.ZERO, reason, protection);
    }
}
