package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.config.ConfigurationException;
import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.WalletRole;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;

/**
 * Validated wallet rotation rules.
 *
 * @param dailyResetZone daily counters reset at {@code dailyResetHour} in this zone, same boundary as risk
 */
public record WalletPolicy(
        BigDecimal feeBuffer,
        Map<WalletRole, Integer> dailyTxCap,
        Duration longtermMinSpacing,
        double minReputation,
        Duration reputationHalfLife,
        double successNudge,
        double failureNudge,
        int maxConsecutiveFailures,
        Duration failureCooldown,
        ZoneId dailyResetZone,
        int dailyResetHour
) {

    public WalletPolicy {
        dailyTxCap = Map.copyOf(dailyTxCap);
    }

    public static WalletPolicy from(HftProperties.Wallets wallets, HftProperties.Risk risk) {
        if (wallets == null) {
            throw new ConfigurationException("hft.wallets is missing");
        }
        Map<WalletRole, Integer> caps = new EnumMap<>(WalletRole.class);
        for (WalletRole role : WalletRole.values()) {
            Integer cap = wallets.dailyTxCap().get(role);
            if (cap == null || cap < 0) {
                throw new ConfigurationException("hft.wallets.daily-tx-cap." + role.name().toLowerCase() + " is missing");
            }
            caps.put(role, cap);
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(risk.dailyResetZone());
        } catch (DateTimeException e) {
            throw new ConfigurationException("hft.risk.daily-reset-zone is invalid: " + risk.dailyResetZone(), e);
        }
        return new WalletPolicy(
                wallets.feeBuffer(),
                caps,
                Duration.ofSeconds(wallets.longtermMinSpacingSeconds()),
                wallets.minReputation(),
                Duration.ofMinutes(wallets.reputationHalfLifeMinutes()),
                wallets.reputationSuccessNudge(),
                wallets.reputationFailureNudge(),
                wallets.maxConsecutiveFailures(),
                Duration.ofSeconds(wallets.failureCooldownSeconds()),
                zone,
                risk.dailyResetHour()
        );
    }

    public int capFor(WalletRole role) {
        return dailyTxCap.getOrDefault(role, 0);
    }
}
