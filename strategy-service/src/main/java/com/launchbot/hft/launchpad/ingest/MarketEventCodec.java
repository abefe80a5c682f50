package com.launchbot.hft.launchpad.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchbot.hft.domain.MarketEvent;
import com.launchbot.hft.domain.MigrationEvent;
import com.launchbot.hft.domain.OrderSide;
import com.launchbot.hft.domain.TokenEvent;
import com.launchbot.hft.domain.TradeEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes feed envelopes into canonical market events.
 *
 * <pre>
 * {"ts": "...", "source": "...", "type": "launchpad.token|launchpad.trade|launchpad.migration", "data": {...}}
 * </pre>
 * Field names in {@code data} follow the event records; the venue's raw names ({@code mint},
 * {@code created_timestamp}, {@code txType}) are accepted as well.
 */
public class MarketEventCodec {

    private final ObjectMapper objectMapper;

    public MarketEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public MarketEvent decode(String payload) throws MalformedEventException {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("payload is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("payload is not a JSON object");
        }
        String type = root.path("type").asText("").toLowerCase(Locale.ROOT);
        JsonNode data = root.has("data") ? root.get("data") : root;
        Instant envelopeTs = instant(root.path("ts"));

        return switch (type) {
            case "launchpad.token", "token" -> token(data, envelopeTs, text(root, "source"));
            case "launchpad.trade", "trade" -> trade(data, envelopeTs);
            case "launchpad.migration", "migration" -> migration(data, envelopeTs);
            default -> throw new MalformedEventException("unknown event type '" + type + "'");
        };
    }

    private TokenEvent token(JsonNode d, Instant fallbackTs, String envelopeSource) throws MalformedEventException {
        String mint = mint(d);
        Instant createdAt = firstInstant(d, fallbackTs, "createdAt", "created_timestamp");
        return new TokenEvent(
                mint,
                text(d, "creator"),
                text(d, "name"),
                text(d, "symbol"),
                createdAt,
                d.hasNonNull("metadataQuality") ? d.get("metadataQuality").asDouble() : null,
                decimal(d.path("initialLiquidity")),
                d.hasNonNull("source") ? text(d, "source") : envelopeSource
        );
    }

    private TradeEvent trade(JsonNode d, Instant fallbackTs) throws MalformedEventException {
        String mint = mint(d);
        String side = text(d, "side");
        if (side == null) {
            side = text(d, "txType");
        }
        if (side == null) {
            throw new MalformedEventException("trade for " + mint + " has no side");
        }
        OrderSide orderSide;
        try {
            orderSide = OrderSide.valueOf(side.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("trade for " + mint + " has unknown side '" + side + "'", e);
        }
        List<BigDecimal> depth = new ArrayList<>();
        for (JsonNode level : d.path("depthAtLevels")) {
            BigDecimal v = decimal(level);
            if (v != null) {
                depth.add(v);
            }
        }
        return new TradeEvent(
                mint,
                text(d, "trader"),
                orderSide,
                decimal(d.path("baseAmount")),
                decimal(d.path("price")),
                d.hasNonNull("bondingCurveProgress") ? d.get("bondingCurveProgress").asDouble() : null,
                depth,
                firstInstant(d, fallbackTs, "timestamp"),
                text(d, "signature")
        );
    }

    private MigrationEvent migration(JsonNode d, Instant fallbackTs) throws MalformedEventException {
        return new MigrationEvent(mint(d), text(d, "destination"), firstInstant(d, fallbackTs, "timestamp"));
    }

    private static String mint(JsonNode d) throws MalformedEventException {
        String mint = text(d, "mintId");
        if (mint == null) {
            mint = text(d, "mint");
        }
        if (mint == null || mint.isBlank()) {
            throw new MalformedEventException("event has no mint");
        }
        return mint;
    }

    private static String text(JsonNode d, String field) {
        JsonNode n = d.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }

    private static BigDecimal decimal(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) {
            return null;
        }
        if (n.isNumber()) {
            return n.decimalValue();
        }
        try {
            return new BigDecimal(n.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant firstInstant(JsonNode d, Instant fallback, String... fields) throws MalformedEventException {
        for (String f : fields) {
            Instant ts = instant(d.path(f));
            if (ts != null) {
                return ts;
            }
        }
        if (fallback == null) {
            throw new MalformedEventException("event has no timestamp");
        }
        return fallback;
    }

    /**
     * ISO-8601 strings, or epoch numbers in seconds or milliseconds.
     */
    private static Instant instant(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) {
            return null;
        }
        if (n.isNumber()) {
            long v = n.asLong();
            return v > 1_000_000_000_000L ? Instant.ofEpochMilli(v) : Instant.ofEpochSecond(v);
        }
        String s = n.asText();
        if (s.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
