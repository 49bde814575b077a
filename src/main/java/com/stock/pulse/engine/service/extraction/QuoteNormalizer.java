package com.stock.pulse.engine.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.stock.pulse.engine.common.constants.PipelineProperties;
import com.stock.pulse.engine.model.canonical.CanonicalField;
import com.stock.pulse.engine.model.canonical.CanonicalFields;
import com.stock.pulse.engine.service.upstream.UpstreamQuote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.stock.pulse.engine.model.canonical.CanonicalField.*;

/**
 * Maps a decoded upstream quote onto canonical fields.
 * <ul>
 *   <li>top-level keys win over nested ones; nested keys are tried as {@code parent.child} then {@code child}</li>
 *   <li>absent or blank values are omitted, never zero-filled</li>
 *   <li>malformed values are dropped with a warning; the symbol still succeeds</li>
 * </ul>
 */
@Slf4j
@Component
public class QuoteNormalizer {

    private static final Set<String> BLANKS = Set.of("", "-", "--", "na", "n/a", "null", "none", "nil");

    private final ZoneId zone;

    public QuoteNormalizer(PipelineProperties props) {
        this.zone = ZoneId.of(props.getZone());
    }

    public NormalizationResult transform(UpstreamQuote quote) {
        return transform(quote.symbol(), quote.fields());
    }

    public NormalizationResult transform(String symbol, JsonNode payload) {
        CanonicalFields.Builder out = CanonicalFields.builder();
        List<String> warnings = new ArrayList<>();
        List<String> unmapped = new ArrayList<>();

        Deque<Map.Entry<String, JsonNode>> queue = new ArrayDeque<>();
        if (payload != null && payload.isObject()) queue.add(Map.entry("", payload));

        while (!queue.isEmpty()) {
            Map.Entry<String, JsonNode> level = queue.poll();
            String prefix = level.getKey();
            Iterator<Map.Entry<String, JsonNode>> it = level.getValue().fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                String key = FieldSynonyms.normalizeKey(e.getKey());
                String path = prefix.isEmpty() ? key : prefix + "." + key;
                JsonNode v = e.getValue();

                if (v.isObject()) {
                    queue.add(Map.entry(path, v));
                    continue;
                }
                if (v.isArray()) continue;

                Optional<CanonicalField> field = FieldSynonyms.resolve(path).or(() -> FieldSynonyms.resolve(key));
                if (field.isEmpty()) {
                    unmapped.add(path);
                    continue;
                }
                CanonicalField f = field.get();
                if (out.has(f)) continue;

                Object value = convert(f, v, path, symbol, warnings);
                if (value != null) out.put(f, value);
            }
        }

        out.putIfAbsent(SYMBOL, symbol);
        derive(out);
        return new NormalizationResult(out.build(), warnings, unmapped);
    }

    private Object convert(CanonicalField f, JsonNode v, String path, String symbol, List<String> warnings) {
        if (v == null || v.isNull() || v.isMissingNode()) return null;
        if (v.isTextual() && BLANKS.contains(v.asText().trim().toLowerCase(Locale.ROOT))) return null;

        Object converted = switch (f.type()) {
            case NUMBER -> toNumber(v);
            case TEXT -> v.isValueNode() ? v.asText().trim() : null;
            case BOOLEAN -> toBoolean(v);
            case DATE -> toDate(v);
            case TIMESTAMP -> toInstant(v);
        };
        if (converted == null) {
            String w = String.format("%s: dropped malformed %s value '%s' for %s", symbol, f.type(), v.asText(), path);
            log.warn(w);
            warnings.add(w);
        }
        return converted;
    }

    static Double toNumber(JsonNode v) {
        if (v.isNumber()) return finite(v.doubleValue());
        if (!v.isTextual()) return null;

        String s = v.asText().trim().toLowerCase(Locale.ROOT)
                .replace(",", "")
                .replace("₹", "")
                .replace("rs.", "")
                .replace("%", "")
                .trim();
        double multiplier = 1.0;
        if (s.endsWith("cr") || s.endsWith("crore")) {
            multiplier = 1e7;
            s = s.replaceAll("(crore|cr)$", "").trim();
        } else if (s.endsWith("lakh") || s.endsWith("l")) {
            multiplier = 1e5;
            s = s.replaceAll("(lakh|l)$", "").trim();
        } else if (s.endsWith("k")) {
            multiplier = 1e3;
            s = s.substring(0, s.length() - 1).trim();
        }
        try {
            return finite(Double.parseDouble(s) * multiplier);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double finite(double d) {
        return (Double.isNaN(d) || Double.isInfinite(d)) ? null : d;
    }

    private static Boolean toBoolean(JsonNode v) {
        if (v.isBoolean()) return v.booleanValue();
        if (v.isNumber()) return v.intValue() != 0;
        String s = v.asText().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "yes", "y", "1" -> Boolean.TRUE;
            case "false", "no", "n", "0" -> Boolean.FALSE;
            default -> null;
        };
    }

    private LocalDate toDate(JsonNode v) {
        if (v.isNumber()) {
            Instant at = epoch(v.asLong());
            try {
                return at == null ? null : at.atZone(zone).toLocalDate();
            } catch (DateTimeException e) {
                return null;
            }
        }
        String s = v.asText().trim();
        try {
            return LocalDate.parse(s.length() > 10 && s.charAt(10) == 'T' ? s.substring(0, 10) : s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Instant toInstant(JsonNode v) {
        if (v.isNumber()) return epoch(v.asLong());
        String s = v.asText().trim();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException notUtc) {
            try {
                return LocalDateTime.parse(s).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
    }

    /** null when the number is outside the representable range */
    private static Instant epoch(long v) {
        try {
            return v > 100_000_000_000L ? Instant.ofEpochMilli(v) : Instant.ofEpochSecond(v);
        } catch (DateTimeException e) {
            return null;
        }
    }

    /**
     * Metrics computable from fields already present. Never overrides an upstream value.
     */
    private static void derive(CanonicalFields.Builder b) {
        Optional<Double> price = b.number(LAST_PRICE).or(() -> b.number(CLOSE_PRICE));
        Optional<Double> prev = b.number(PREV_CLOSE);

        if (!b.has(TURNOVER) && price.isPresent() && b.number(VOLUME).isPresent()) {
            b.put(TURNOVER, price.get() * b.number(VOLUME).get());
        }
        if (price.isPresent() && prev.isPresent() && prev.get() != 0) {
            double change = price.get() - prev.get();
            b.putIfAbsent(PRICE_CHANGE, change);
            b.putIfAbsent(PRICE_CHANGE_PCT, change / prev.get() * 100.0);
        }
        Optional<Double> high = b.number(HIGH_PRICE);
        Optional<Double> low = b.number(LOW_PRICE);
        if (high.isPresent() && low.isPresent() && low.get() > 0) {
            b.putIfAbsent(DAY_RANGE_PCT, (high.get() - low.get()) / low.get() * 100.0);
        }
        if (price.isPresent()) {
            b.number(WEEK_52_HIGH).filter(h -> h > 0)
                    .ifPresent(h -> b.putIfAbsent(PCT_FROM_52W_HIGH, (price.get() - h) / h * 100.0));
            b.number(WEEK_52_LOW).filter(l -> l > 0)
                    .ifPresent(l -> b.putIfAbsent(PCT_FROM_52W_LOW, (price.get() - l) / l * 100.0));
        }
        if (!b.has(VOLUME_RATIO) && b.number(VOLUME).isPresent()) {
            b.number(AVG_VOLUME_20D).filter(a -> a > 0)
                    .ifPresent(a -> b.put(VOLUME_RATIO, b.number(VOLUME).get() / a));
        }
    }
}
