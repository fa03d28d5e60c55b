package com.ratiowatch.backend.modules.ratio.domain;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Observed children per staff member. Children present with nobody on duty has no finite
 * value and is represented by {@link #UNBOUNDED}, never by a large number.
 */
public final class ActualRatio {

    public static final ActualRatio UNBOUNDED = new ActualRatio(null);
    public static final ActualRatio ZERO = new ActualRatio(BigDecimal.ZERO.setScale(2));

    private final BigDecimal value;

    private ActualRatio(BigDecimal value) {
        this.value = value;
    }

    public static ActualRatio of(BigDecimal value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("ratio must not be negative");
        }
        return new ActualRatio(value);
    }

    /**
     * Maps a stored column value back; {@code null} is how the unbounded ratio is persisted.
     */
    public static ActualRatio fromStored(BigDecimal stored) {
        return stored == null ? UNBOUNDED : of(stored);
    }

    public boolean isUnbounded() {
        return value == null;
    }

    public Optional<BigDecimal> value() {
        return Optional.ofNullable(value);
    }

    public BigDecimal toStoredValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActualRatio that)) return false;
        if (value == null || that.value == null) {
            return value == that.value;
        }
        return value.compareTo(that.value) == 0;
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value == null ? "UNBOUNDED" : value.toPlainString();
    }
}
