package io.cronhttp.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Conversions between {@link Instant} and the fractional epoch-second values stored in the
 * {@code job} and {@code job_result} tables.
 */
public final class EpochSeconds {
    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

    private EpochSeconds() {
    }

    public static Instant toInstant(double epochSeconds) {
        if (Double.isNaN(epochSeconds) || Double.isInfinite(epochSeconds)) {
            throw new IllegalArgumentException("epoch seconds must be finite: " + epochSeconds);
        }
        BigDecimal exact = new BigDecimal(Double.toString(epochSeconds));
        BigDecimal seconds = exact.setScale(0, RoundingMode.FLOOR);
        long nanos = exact.subtract(seconds)
                .multiply(NANOS_PER_SECOND)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
        return Instant.ofEpochSecond(seconds.longValueExact(), nanos);
    }

    public static double toDouble(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
    }

    /**
     * Reads a column value as an instant. Accepts any {@link Number}; {@code null} stays null.
     */
    public static Instant fromColumn(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return toInstant(n.doubleValue());
        }
        try {
            return toInstant(Double.parseDouble(value.toString()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Not an epoch-second value: " + value, ex);
        }
    }
}
