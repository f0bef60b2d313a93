package org.colonysim.runtime.rules;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either an accepted value or a {@link RuleViolation}.
 *
 * @param <T> the accepted value type.
 */
public final class RuleOutcome<T> {

    private final T value;
    private final RuleViolation violation;

    private RuleOutcome(T value, RuleViolation violation) {
        this.value = value;
        this.violation = violation;
    }

    public static <T> RuleOutcome<T> ok(T value) {
        return new RuleOutcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> RuleOutcome<T> rejected(RuleViolation violation) {
        return new RuleOutcome<>(null, Objects.requireNonNull(violation, "violation"));
    }

    public boolean isOk() {
        return violation == null;
    }

    /**
     * Returns the accepted value.
     *
     * @throws IllegalStateException if the outcome was rejected.
     */
    public T value() {
        if (violation != null) {
            throw new IllegalStateException("Outcome was rejected: " + violation);
        }
        return value;
    }

    public Optional<RuleViolation> violation() {
        return Optional.ofNullable(violation);
    }

    /**
     * Maps an accepted value, passing a rejection through unchanged.
     */
    public <R> RuleOutcome<R> map(Function<? super T, ? extends R> mapper) {
        if (violation != null) {
            return rejected(violation);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleOutcome<?> other)) return false;
        return Objects.equals(value, other.value) && violation == other.violation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, violation);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok[" + value + "]" : "Rejected[" + violation + "]";
    }
}
