package io.kvcache.value;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * A scalar persisted verbatim under a generated identifier.
 */
public final class StoredValue {

    /**
     * The scalar kinds that can be stored.
     */
    public enum Kind {
        TEXT,
        BYTES,
        INTEGER,
        FLOATING
    }

    private final Kind kind;
    private final Object value;

    private StoredValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value");
    }

    public static StoredValue text(String value) {
        return new StoredValue(Kind.TEXT, value);
    }

    public static StoredValue bytes(byte[] value) {
        return new StoredValue(Kind.BYTES, value.clone());
    }

    public static StoredValue integer(long value) {
        return new StoredValue(Kind.INTEGER, value);
    }

    public static StoredValue floating(double value) {
        return new StoredValue(Kind.FLOATING, value);
    }

    /**
     * Wraps a plain Java scalar.
     *
     * @param value a String, byte[], integral Number, Float or Double
     * @return the stored value
     * @throws IllegalArgumentException if the type is not a supported scalar
     */
    public static StoredValue of(Object value) {
        if (value instanceof StoredValue) {
            return (StoredValue) value;
        }
        if (value instanceof String) {
            return text((String) value);
        }
        if (value instanceof byte[]) {
            return bytes((byte[]) value);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return integer(((Number) value).longValue());
        }
        if (value instanceof Float) {
            return floating(Double.parseDouble(value.toString()));
        }
        if (value instanceof Double) {
            return floating((Double) value);
        }
        throw new IllegalArgumentException("Unsupported value type: "
            + (value == null ? "null" : value.getClass().getName()));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Gets the wrapped scalar: a String, byte[], Long or Double depending on the kind.
     *
     * @return the value
     */
    public Object getValue() {
        return kind == Kind.BYTES ? ((byte[]) value).clone() : value;
    }

    /**
     * Encodes the value the way the store keeps it on the wire.
     *
     * @return the encoded bytes
     */
    public byte[] encode() {
        return switch (kind) {
            case TEXT -> ((String) value).getBytes(StandardCharsets.UTF_8);
            case BYTES -> ((byte[]) value).clone();
            case INTEGER -> value.toString().getBytes(StandardCharsets.US_ASCII);
            case FLOATING -> formatFloating((Double) value).getBytes(StandardCharsets.US_ASCII);
        };
    }

    /**
     * Formats a double as a decimal literal: plain notation with at least one fractional
     * digit when 1e-4 &lt;= |d| &lt; 1e16, exponent notation otherwise, and
     * {@code nan}, {@code inf}, {@code -inf} for the special values.
     * For example 1e7 gives {@code 10000000.0}, 1e-5 gives {@code 1e-05}.
     *
     * @param d the value
     * @return the literal
     */
    public static String formatFloating(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        if (d == 0) {
            return (1 / d < 0) ? "-0.0" : "0.0";
        }

        String sign = d < 0 ? "-" : "";
        double abs = Math.abs(d);
        BigDecimal digits = new BigDecimal(Double.toString(abs)).stripTrailingZeros();
        if (abs >= 1e-4 && abs < 1e16) {
            String plain = digits.toPlainString();
            return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
        }

        String unscaled = digits.unscaledValue().toString();
        int exponent = digits.precision() - digits.scale() - 1;
        String mantissa = unscaled.length() > 1 ? unscaled.charAt(0) + "." + unscaled.substring(1) : unscaled;
        return sign + mantissa + "e" + (exponent < 0 ? "-" : "+") + String.format(Locale.ROOT, "%02d", Math.abs(exponent));
    }

    /**
     * Parses a literal written by {@link #formatFloating} or by {@link Double#toString}.
     *
     * @param text the literal
     * @return the value
     * @throws NumberFormatException if the text is not a floating point literal
     */
    public static double parseFloating(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "nan" -> Double.NaN;
            case "inf", "+inf", "infinity" -> Double.POSITIVE_INFINITY;
            case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
            default -> Double.parseDouble(text.trim());
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoredValue that = (StoredValue) o;
        if (kind != that.kind) return false;
        if (kind == Kind.BYTES) {
            return Arrays.equals((byte[]) value, (byte[]) that.value);
        }
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        int valueHash = kind == Kind.BYTES ? Arrays.hashCode((byte[]) value) : value.hashCode();
        return 31 * kind.hashCode() + valueHash;
    }

    @Override
    public String toString() {
        return "StoredValue{kind=" + kind + ", value="
            + (kind == Kind.BYTES ? Arrays.toString((byte[]) value) : value) + "}";
    }
}
