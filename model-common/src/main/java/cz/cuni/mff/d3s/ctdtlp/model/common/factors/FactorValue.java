package cz.cuni.mff.d3s.ctdtlp.model.common.factors;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;

/**
 * A single value of a factor domain: either a boolean or an integer.
 *
 * <p>The two kinds never compare equal to each other and never coerce into one another.
 * Ordering is total: within a kind values order naturally, and every boolean orders
 * before every integer.
 */
@Getter
@EqualsAndHashCode
public final class FactorValue implements Comparable<FactorValue>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final FactorValue FALSE = new FactorValue(Kind.BOOL, 0L);
    public static final FactorValue TRUE = new FactorValue(Kind.BOOL, 1L);

    /**
     * Discriminator of the tagged value.
     */
    public enum Kind {
        BOOL,
        INT
    }

    private final Kind kind;
    private final long raw;

    private FactorValue(Kind kind, long raw) {
        this.kind = kind;
        this.raw = raw;
    }

    public static FactorValue ofBool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static FactorValue ofInt(long value) {
        return new FactorValue(Kind.INT, value);
    }

    /**
     * Renders the value the way the model checker prints it ({@code TRUE}, {@code FALSE}, {@code 3}).
     */
    public String render() {
        if (kind == Kind.BOOL) {
            return raw != 0L ? "TRUE" : "FALSE";
        }
        return Long.toString(raw);
    }

    /**
     * Numeric encoding used in artifact names: booleans become {@code 1}/{@code 0}.
     */
    public String encode() {
        return Long.toString(raw);
    }

    @Override
    public int compareTo(FactorValue other) {
        if (kind != other.kind) {
            return kind == Kind.BOOL ? -1 : 1;
        }
        return Long.compare(raw, other.raw);
    }

    @Override
    public String toString() {
        if (kind == Kind.BOOL) {
            return raw != 0L ? "true" : "false";
        }
        return Long.toString(raw);
    }
}
