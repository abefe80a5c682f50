package com.launchbot.hft.launchpad.wallet;

import com.launchbot.hft.domain.Wallet;
import com.launchbot.hft.domain.WalletRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcWalletStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcWalletStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcWalletStore(jdbcTemplate);
    }

    @Test
    void shouldUpdateExistingRow() {
        // Given
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(1);
        Wallet wallet = Wallet.fresh("sniping-1", WalletRole.SNIPING, new BigDecimal("2"), NOW);

        // When
        store.save(wallet);

        // Then
        verify(jdbcTemplate).update(startsWith("UPDATE launchbot_wallet"),
                eq("SNIPING"), eq(new BigDecimal("2")), eq(5.0), eq(Timestamp.from(NOW)), isNull(),
                eq(0), isNull(), eq(0), eq("sniping-1"));
        verify(jdbcTemplate, never()).update(startsWith("INSERT"), any(Object[].class));
    }

    @Test
    void shouldInsertWhenRowIsMissing() {
        // Given
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(0);
        Wallet wallet = Wallet.fresh("longterm-1", WalletRole.LONGTERM, new BigDecimal("5"), NOW);

        // When
        store.save(wallet);

        // Then
        verify(jdbcTemplate).update(startsWith("INSERT INTO launchbot_wallet"),
                eq("longterm-1"), eq("LONGTERM"), eq(new BigDecimal("5")), eq(5.0), eq(Timestamp.from(NOW)),
                isNull(), eq(0), isNull(), eq(0));
    }

    @Test
    void shouldFindByIdThroughRowMapper() {
        Wallet wallet = Wallet.fresh("sniping-1", WalletRole.SNIPING, BigDecimal.ONE, NOW);
        when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<Wallet>>any(), eq("sniping-1")))
                .thenReturn(List.of(wallet));

        assertThat(store.findById("sniping-1")).contains(wallet);
    }

    @Test
    void shouldReturnEmptyForUnknownWallet() {
        when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<Wallet>>any(), eq("ghost")))
                .thenReturn(List.of());

        assertThat(store.findById("ghost")).isEmpty();
    }

    @Test
    void shouldMapRowsIncludingNullTimestamps() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("id")).thenReturn("sniping-2");
        when(rs.getString("role")).thenReturn("SNIPING");
        when(rs.getBigDecimal("balance")).thenReturn(new BigDecimal("1.5"));
        when(rs.getDouble("reputation_score")).thenReturn(4.2);
        when(rs.getTimestamp("reputation_updated_at")).thenReturn(Timestamp.from(NOW));
        when(rs.getTimestamp("last_used_at")).thenReturn(null);
        when(rs.getInt("daily_tx_count")).thenReturn(7);
        when(rs.getTimestamp("cooldown_until")).thenReturn(Timestamp.from(NOW.plusSeconds(300)));
        when(rs.getInt("consecutive_failures")).thenReturn(0);

        Wallet wallet = JdbcWalletStore.ROW_MAPPER.mapRow(rs, 0);

        assertThat(wallet.id()).isEqualTo("sniping-2");
        assertThat(wallet.role()).isEqualTo(WalletRole.SNIPING);
        assertThat(wallet.balance()).isEqualByComparingTo("1.5");
        assertThat(wallet.reputationScore()).isEqualTo(4.2);
        assertThat(wallet.reputationUpdatedAt()).isEqualTo(NOW);
        assertThat(wallet.lastUsedAt()).isNull();
        assertThat(wallet.dailyTxCount()).isEqualTo(7);
        assertThat(wallet.cooldownUntil()).isEqualTo(NOW.plusSeconds(300));
    }
}
