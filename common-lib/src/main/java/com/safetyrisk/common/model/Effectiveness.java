package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Operational-effectiveness ratio in [0, 1], or the explicit {@link #UNDEFINED} sentinel
 * when no operation took place and no enforcement outcome was recorded.
 *
 * <p>An undefined value carries no number: {@link #ratio()} throws rather than answering
 * 0 or NaN, so callers must branch on {@link #isDefined()} or use {@link #asOptional()}.
 */
@JsonPropertyOrder({"defined", "ratio", "band"})
public final class Effectiveness {

    public static final Effectiveness UNDEFINED = new Effectiveness(false, 0.0, EffectivenessBand.NOT_ASSESSABLE);

    private final boolean defined;
    private final double ratio;
    private final EffectivenessBand band;

    private Effectiveness(boolean defined, double ratio, EffectivenessBand band) {
        this.defined = defined;
        this.ratio = ratio;
        this.band = band;
    }

    public static Effectiveness of(double ratio, EffectivenessBand band) {
        if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
            throw new IllegalArgumentException("Effectiveness ratio must be within [0, 1]: " + ratio);
        }
        if (band == null || band == EffectivenessBand.NOT_ASSESSABLE) {
            throw new IllegalArgumentException("A defined effectiveness needs an assessable band");
        }
        return new Effectiveness(true, ratio, band);
    }

    @JsonProperty("defined")
    public boolean isDefined() {
        return defined;
    }

    /**
     * @throws IllegalStateException when this is {@link #UNDEFINED}
     */
    public double ratio() {
        if (!defined) {
            throw new IllegalStateException("Effectiveness is undefined: no operation and no enforcement outcome");
        }
        return ratio;
    }

    @JsonIgnore
    public OptionalDouble asOptional() {
        return defined ? OptionalDouble.of(ratio) : OptionalDouble.empty();
    }

    @JsonProperty("ratio")
    Double ratioOrNull() {
        return defined ? ratio : null;
    }

    @JsonProperty("band")
    public EffectivenessBand band() {
        return band;
    }

    /** LOW band or undefined. */
    @JsonIgnore
    public boolean isLowOrUndefined() {
        return !defined || band == EffectivenessBand.LOW;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Effectiveness that)) return false;
        return defined == that.defined
            && Double.compare(ratio, that.ratio) == 0
            && band == that.band;
    }

    @Override
    public int hashCode() {
        return Objects.hash(defined, ratio, band);
    }

    @Override
    public String toString() {
        return defined
            ? String.format("Effectiveness[%.1f%%, %s]", ratio * 100.0, band)
            : "Effectiveness[UNDEFINED]";
    }
}
