package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.domain.Wallet;
import com.launchbot.hft.domain.WalletRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Wallet records in the {@code launchbot_wallet} table. Schema lives in {@code schema-wallet.sql}.
 */
@Slf4j
public class JdbcWalletStore implements WalletStore {

    private static final String SELECT = """
            SELECT id, role, balance, reputation_score, reputation_updated_at, last_used_at,
                   daily_tx_count, cooldown_until, consecutive_failures
            FROM launchbot_wallet
            """;

    private static final String UPDATE = """
            UPDATE launchbot_wallet
            SET role = ?, balance = ?, reputation_score = ?, reputation_updated_at = ?, last_used_at = ?,
                daily_tx_count = ?, cooldown_until = ?, consecutive_failures = ?
            WHERE id = ?
            """;

    private static final String INSERT = """
            INSERT INTO launchbot_wallet
            (id, role, balance, reputation_score, reputation_updated_at, last_used_at,
             daily_tx_count, cooldown_until, consecutive_failures)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    static final RowMapper<Wallet> ROW_MAPPER = (rs, rowNum) -> new Wallet(
            rs.getString("id"),
            WalletRole.valueOf(rs.getString("role")),
            rs.getBigDecimal("balance"),
            rs.getDouble("reputation_score"),
            toInstant(rs.getTimestamp("reputation_updated_at")),
            toInstant(rs.getTimestamp("last_used_at")),
            rs.getInt("daily_tx_count"),
            toInstant(rs.getTimestamp("cooldown_until")),
            rs.getInt("consecutive_failures")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcWalletStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Wallet> findAll() {
        return jdbcTemplate.query(SELECT + " ORDER BY id", ROW_MAPPER);
    }

    @Override
    public Optional<Wallet> findById(String walletId) {
        List<Wallet> rows = jdbcTemplate.query(SELECT + " WHERE id = ?", ROW_MAPPER, walletId);
        return rows.stream().findFirst();
    }

    @Override
    public void save(Wallet wallet) {
        int updated = jdbcTemplate.update(UPDATE,
                wallet.role().name(),
                wallet.balance(),
                wallet.reputationScore(),
                toTimestamp(wallet.reputationUpdatedAt()),
                toTimestamp(wallet.lastUsedAt()),
                wallet.dailyTxCount(),
                toTimestamp(wallet.cooldownUntil()),
                wallet.consecutiveFailures(),
                wallet.id()
        );
        if (updated == 0) {
            jdbcTemplate.update(INSERT,
                    wallet.id(),
                    wallet.role().name(),
                    wallet.balance(),
                    wallet.reputationScore(),
                    toTimestamp(wallet.reputationUpdatedAt()),
                    toTimestamp(wallet.lastUsedAt()),
                    wallet.dailyTxCount(),
                    toTimestamp(wallet.cooldownUntil()),
                    wallet.consecutiveFailures()
            );
            log.info("wallet {} inserted role={}", wallet.id(), wallet.role());
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
