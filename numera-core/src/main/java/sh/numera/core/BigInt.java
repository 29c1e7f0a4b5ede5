// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.numera.core;

import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.numera.core.error.DivisionByZeroException;
import sh.numera.core.error.DomainException;
import sh.numera.core.error.IntegerOverflowException;
import sh.numera.core.error.NumberParseException;
import sh.numera.primitives.Bytes;
import sh.numera.primitives.Hex;

/**
 * Immutable arbitrary-precision signed integer.
 * <p>
 * Arithmetic is delegated to {@link BigInteger}; this type fixes the conversion
 * and edge-case contract on top of it.
 * <p>
 * <strong>Construction:</strong>
 * <ul>
 * <li>{@link #from(String, int)} parses text in a given base, or auto-detects it with base 0</li>
 * <li>{@link #of(long)} and {@link #of(BigInteger)} wrap machine and engine values</li>
 * <li>{@link #fromBuffer(byte[], boolean)} reads an unsigned magnitude buffer</li>
 * </ul>
 * <p>
 * <strong>Buffers:</strong> {@link #toBuffer(boolean)} writes the magnitude only, so the
 * sign of a negative value is lost on a buffer round-trip. By default buffers are
 * little-endian ({@code reverse = true}).
 * <p>
 * <strong>Operands:</strong> every comparison and arithmetic method accepts an
 * {@link IntegerLike}, a {@code long} or a decimal {@code String} right-hand side.
 * <p>
 * Instances are safe to share between threads.
 *
 * @since 0.1.0
 */
public final class BigInt implements IntegerLike, Comparable<BigInt> {

    private final BigInteger value;

    private BigInt(final BigInteger value) {
        this.value = value;
    }

    // ═══════════════════════════════════════════════════════════════
    // Construction
    // ═══════════════════════════════════════════════════════════════

    /**
     * Parses a decimal string.
     *
     * @param value decimal digits with an optional leading sign
     * @return the parsed value
     * @throws NumberParseException if {@code value} is not a decimal integer
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BigInt from(final String value) {
        return from(value, 10);
    }

    /**
     * Parses a string in the given base.
     * <p>
     * With {@code base == 0} the base is taken from the prefix after an optional sign:
     * {@code 0x} selects 16, {@code 0b} selects 2, a leading {@code 0} followed by more
     * digits selects 8, anything else is decimal.
     *
     * @param value the text to parse; surrounding whitespace is not accepted
     * @param base  0, or a radix between 2 and 36
     * @return the parsed value
     * @throws NumberParseException if {@code value} is not an integer in {@code base},
     *                              or {@code base} is unsupported
     */
    public static BigInt from(final String value, final int base) {
        if (value == null) {
            throw new NumberParseException("String value does not represent a number: null");
        }
        if (base == 0) {
            return new BigInt(parseDetectingBase(value));
        }
        if (base < Character.MIN_RADIX || base > Character.MAX_RADIX) {
            throw new NumberParseException("Unsupported base " + base + " for value " + value);
        }

        final boolean signed = !value.isEmpty() && (value.charAt(0) == '-' || value.charAt(0) == '+');
        final BigInteger magnitude = parseDigits(value, signed ? value.substring(1) : value, base);
        return new BigInt(signed && value.charAt(0) == '-' ? magnitude.negate() : magnitude);
    }

    public static BigInt of(final long value) {
        if (value == 0L) {
            return zero();
        }
        if (value == 1L) {
            return one();
        }
        return new BigInt(BigInteger.valueOf(value));
    }

    public static BigInt of(final BigInteger value) {
        Objects.requireNonNull(value, "value");
        return new BigInt(value);
    }

    /**
     * Reads a little-endian unsigned magnitude buffer.
     *
     * @param buffer the bytes, least significant first
     * @return the non-negative value; zero for an empty buffer
     * @see #fromBuffer(byte[], boolean)
     */
    public static BigInt fromBuffer(final byte[] buffer) {
        return fromBuffer(buffer, true);
    }

    /**
     * Reads an unsigned magnitude buffer.
     * <p>
     * When {@code reverse} is {@code true} the buffer is little-endian and is flipped
     * before being read big-endian. The input array is not modified.
     *
     * @param buffer  the magnitude bytes
     * @param reverse whether {@code buffer} is little-endian
     * @return the non-negative value; zero for an empty buffer
     */
    public static BigInt fromBuffer(final byte[] buffer, final boolean reverse) {
        Objects.requireNonNull(buffer, "buffer");
        if (buffer.length == 0) {
            return zero();
        }
        final byte[] bigEndian = reverse ? Bytes.reverse(buffer) : buffer;
        return new BigInt(new BigInteger(Hex.encodeNoPrefix(bigEndian), 16));
    }

    /**
     * Returns the shared zero instance, created on first use.
     *
     * @return 0
     */
    public static BigInt zero() {
        return ZeroHolder.ZERO;
    }

    /**
     * Returns the shared one instance, created on first use.
     *
     * @return 1
     */
    public static BigInt one() {
        return OneHolder.ONE;
    }

    /**
     * Computes {@code n!} without caching.
     *
     * @param n a non-negative integer
     * @return the factorial of {@code n}
     * @throws DomainException if {@code n} is negative
     * @see sh.numera.core.util.BigIntUtils#cachedFactorial(int)
     */
    public static BigInt factorial(final int n) {
        if (n < 0) {
            throw new DomainException("Factorial of a negative number: " + n);
        }
        if (n < 2) {
            return one();
        }
        return new BigInt(product(2, n));
    }

    // ═══════════════════════════════════════════════════════════════
    // Conversion
    // ═══════════════════════════════════════════════════════════════

    @Override
    public BigInt toBigInt() {
        return this;
    }

    public BigInteger toBigInteger() {
        return value;
    }

    /**
     * Narrows to a {@code long}.
     *
     * @return the exact value
     * @throws IntegerOverflowException if the value is outside the {@code long} range
     */
    public long toLong() {
        if (value.bitLength() > Long.SIZE - 1) {
            throw new IntegerOverflowException(value.signum() > 0
                    ? "The number is greater than Long.MAX_VALUE: " + value
                    : "The number is less than Long.MIN_VALUE: " + value);
        }
        return value.longValue();
    }

    /**
     * Narrows to an {@code int}.
     *
     * @return the exact value
     * @throws IntegerOverflowException if the value is outside the {@code int} range
     */
    public int toInt() {
        if (value.bitLength() > Integer.SIZE - 1) {
            throw new IntegerOverflowException(value.signum() > 0
                    ? "The number is greater than Integer.MAX_VALUE: " + value
                    : "The number is less than Integer.MIN_VALUE: " + value);
        }
        return value.intValue();
    }

    /**
     * Canonical decimal form: a leading {@code -} for negative values and no leading zeros.
     */
    @JsonValue
    @Override
    public String toString() {
        return value.toString();
    }

    /**
     * Renders the value in the given radix using lowercase digits.
     *
     * @param radix between 2 and 36
     * @return the digits, prefixed with {@code -} for negative values
     * @throws DomainException if {@code radix} is unsupported
     */
    public String toString(final int radix) {
        if (radix < Character.MIN_RADIX || radix > Character.MAX_RADIX) {
            throw new DomainException("Unsupported radix: " + radix);
        }
        return value.toString(radix);
    }

    /**
     * Writes the magnitude as a little-endian buffer.
     *
     * @return the minimal magnitude bytes, least significant first
     * @see #toBuffer(boolean)
     */
    public byte[] toBuffer() {
        return toBuffer(true);
    }

    /**
     * Writes the magnitude as an unsigned buffer.
     * <p>
     * The sign is dropped. Leading zero bytes are stripped, so zero becomes an empty
     * array. When {@code reverse} is {@code true} the result is little-endian.
     *
     * @param reverse whether to emit little-endian bytes
     * @return a new array holding the magnitude
     */
    public byte[] toBuffer(final boolean reverse) {
        final String digits = Hex.padToWholeBytes(value.abs().toString(16));
        final byte[] bigEndian = Bytes.stripLeadingZeros(Hex.decode(digits));
        return reverse ? Bytes.reverse(bigEndian) : bigEndian;
    }

    // ═══════════════════════════════════════════════════════════════
    // Comparison
    // ═══════════════════════════════════════════════════════════════

    /**
     * Compares this value with {@code rhs}.
     *
     * @param rhs the right-hand side
     * @return -1, 0 or 1 as this value is less than, equal to or greater than {@code rhs}
     */
    public int compare(final IntegerLike rhs) {
        return Integer.signum(value.compareTo(operand(rhs, "rhs")));
    }

    public int compare(final long rhs) {
        return compare(of(rhs));
    }

    public int compare(final String rhs) {
        return compare(from(rhs));
    }

    @Override
    public int compareTo(final BigInt other) {
        return compare(other);
    }

    public boolean lessThan(final IntegerLike rhs) {
        return compare(rhs) < 0;
    }

    public boolean lessThan(final long rhs) {
        return compare(rhs) < 0;
    }

    public boolean lessThan(final String rhs) {
        return compare(rhs) < 0;
    }

    public boolean lessThanEqual(final IntegerLike rhs) {
        return compare(rhs) <= 0;
    }

    public boolean lessThanEqual(final long rhs) {
        return compare(rhs) <= 0;
    }

    public boolean lessThanEqual(final String rhs) {
        return compare(rhs) <= 0;
    }

    public boolean equal(final IntegerLike rhs) {
        return compare(rhs) == 0;
    }

    public boolean equal(final long rhs) {
        return compare(rhs) == 0;
    }

    public boolean equal(final String rhs) {
        return compare(rhs) == 0;
    }

    public boolean greaterThan(final IntegerLike rhs) {
        return compare(rhs) > 0;
    }

    public boolean greaterThan(final long rhs) {
        return compare(rhs) > 0;
    }

    public boolean greaterThan(final String rhs) {
        return compare(rhs) > 0;
    }

    public boolean greaterThanEqual(final IntegerLike rhs) {
        return compare(rhs) >= 0;
    }

    public boolean greaterThanEqual(final long rhs) {
        return compare(rhs) >= 0;
    }

    public boolean greaterThanEqual(final String rhs) {
        return compare(rhs) >= 0;
    }

    /**
     * Tests membership of the closed interval {@code [left, right]}.
     */
    public boolean between(final IntegerLike left, final IntegerLike right) {
        return between(left, right, false);
    }

    /**
     * Tests interval membership.
     *
     * @param left      lower endpoint
     * @param right     upper endpoint
     * @param exclusive if {@code true} both endpoints are excluded, {@code (left, right)}
     * @return whether this value lies in the interval
     */
    public boolean between(final IntegerLike left, final IntegerLike right, final boolean exclusive) {
        if (exclusive) {
            return !(lessThanEqual(left) || greaterThanEqual(right));
        }
        return !(lessThan(left) || greaterThan(right));
    }

    public boolean between(final long left, final long right) {
        return between(of(left), of(right), false);
    }

    public boolean between(final long left, final long right, final boolean exclusive) {
        return between(of(left), of(right), exclusive);
    }

    public boolean between(final String left, final String right) {
        return between(from(left), from(right), false);
    }

    public boolean between(final String left, final String right, final boolean exclusive) {
        return between(from(left), from(right), exclusive);
    }

    public boolean between(final IntegerLike left, final long right) {
        return between(left, of(right), false);
    }

    public boolean between(final IntegerLike left, final long right, final boolean exclusive) {
        return between(left, of(right), exclusive);
    }

    public boolean between(final IntegerLike left, final String right) {
        return between(left, from(right), false);
    }

    public boolean between(final IntegerLike left, final String right, final boolean exclusive) {
        return between(left, from(right), exclusive);
    }

    public boolean between(final long left, final IntegerLike right) {
        return between(of(left), right, false);
    }

    public boolean between(final long left, final IntegerLike right, final boolean exclusive) {
        return between(of(left), right, exclusive);
    }

    public boolean between(final long left, final String right) {
        return between(of(left), from(right), false);
    }

    public boolean between(final long left, final String right, final boolean exclusive) {
        return between(of(left), from(right), exclusive);
    }

    public boolean between(final String left, final IntegerLike right) {
        return between(from(left), right, false);
    }

    public boolean between(final String left, final IntegerLike right, final boolean exclusive) {
        return between(from(left), right, exclusive);
    }

    public boolean between(final String left, final long right) {
        return between(from(left), of(right), false);
    }

    public boolean between(final String left, final long right, final boolean exclusive) {
        return between(from(left), of(right), exclusive);
    }

    public int signum() {
        return value.signum();
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BigInt other)) {
            return false;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    // ═══════════════════════════════════════════════════════════════
    // Arithmetic
    // ═══════════════════════════════════════════════════════════════

    public BigInt add(final IntegerLike rhs) {
        return new BigInt(value.add(operand(rhs, "rhs")));
    }

    public BigInt add(final long rhs) {
        return add(of(rhs));
    }

    public BigInt add(final String rhs) {
        return add(from(rhs));
    }

    public BigInt sub(final IntegerLike rhs) {
        return new BigInt(value.subtract(operand(rhs, "rhs")));
    }

    public BigInt sub(final long rhs) {
        return sub(of(rhs));
    }

    public BigInt sub(final String rhs) {
        return sub(from(rhs));
    }

    public BigInt mul(final IntegerLike rhs) {
        return new BigInt(value.multiply(operand(rhs, "rhs")));
    }

    public BigInt mul(final long rhs) {
        return mul(of(rhs));
    }

    public BigInt mul(final String rhs) {
        return mul(from(rhs));
    }

    /**
     * Truncating division, same as {@link #divQ(IntegerLike)}.
     */
    public BigInt div(final IntegerLike rhs) {
        return div(rhs, RoundingMode.DOWN);
    }

    /**
     * Division with an explicit rounding mode, same as {@link #divQ(IntegerLike, RoundingMode)}.
     */
    public BigInt div(final IntegerLike rhs, final RoundingMode mode) {
        return new BigInt(quotient(divisor(rhs, "div"), mode));
    }

    public BigInt div(final long rhs) {
        return div(of(rhs), RoundingMode.DOWN);
    }

    public BigInt div(final long rhs, final RoundingMode mode) {
        return div(of(rhs), mode);
    }

    public BigInt div(final String rhs) {
        return div(from(rhs), RoundingMode.DOWN);
    }

    public BigInt div(final String rhs, final RoundingMode mode) {
        return div(from(rhs), mode);
    }

    /**
     * Quotient truncated toward zero.
     */
    public BigInt divQ(final IntegerLike rhs) {
        return divQ(rhs, RoundingMode.DOWN);
    }

    /**
     * Quotient of this value by {@code rhs}, rounded with {@code mode}.
     * <p>
     * {@link RoundingMode#DOWN} truncates toward zero, {@link RoundingMode#FLOOR} rounds
     * toward negative infinity and {@link RoundingMode#CEILING} toward positive infinity.
     * {@link RoundingMode#UP} and the half-way modes are supported as well.
     *
     * @param rhs  the divisor
     * @param mode the rounding applied to the exact quotient
     * @return the rounded quotient
     * @throws DivisionByZeroException if {@code rhs} is zero
     * @throws DomainException         if {@code mode} is {@link RoundingMode#UNNECESSARY}
     *                                 and the division is inexact
     */
    public BigInt divQ(final IntegerLike rhs, final RoundingMode mode) {
        return new BigInt(quotient(divisor(rhs, "divQ"), mode));
    }

    public BigInt divQ(final long rhs) {
        return divQ(of(rhs), RoundingMode.DOWN);
    }

    public BigInt divQ(final long rhs, final RoundingMode mode) {
        return divQ(of(rhs), mode);
    }

    public BigInt divQ(final String rhs) {
        return divQ(from(rhs), RoundingMode.DOWN);
    }

    public BigInt divQ(final String rhs, final RoundingMode mode) {
        return divQ(from(rhs), mode);
    }

    /**
     * Remainder of truncating division; takes the sign of this value.
     */
    public BigInt divR(final IntegerLike rhs) {
        return divR(rhs, RoundingMode.DOWN);
    }

    /**
     * Remainder left by {@link #divQ(IntegerLike, RoundingMode)} with the same mode,
     * that is {@code this - divQ(rhs, mode) * rhs}.
     *
     * @param rhs  the divisor
     * @param mode the rounding applied to the quotient
     * @return the remainder
     * @throws DivisionByZeroException if {@code rhs} is zero
     */
    public BigInt divR(final IntegerLike rhs, final RoundingMode mode) {
        final BigInteger d = divisor(rhs, "divR");
        return new BigInt(value.subtract(quotient(d, mode).multiply(d)));
    }

    public BigInt divR(final long rhs) {
        return divR(of(rhs), RoundingMode.DOWN);
    }

    public BigInt divR(final long rhs, final RoundingMode mode) {
        return divR(of(rhs), mode);
    }

    public BigInt divR(final String rhs) {
        return divR(from(rhs), RoundingMode.DOWN);
    }

    public BigInt divR(final String rhs, final RoundingMode mode) {
        return divR(from(rhs), mode);
    }

    public QuotientAndRemainder divQR(final IntegerLike rhs) {
        return divQR(rhs, RoundingMode.DOWN);
    }

    /**
     * Quotient and remainder in one step.
     *
     * @param rhs  the divisor
     * @param mode the rounding applied to the quotient
     * @return both results, consistent with {@link #divQ} and {@link #divR}
     * @throws DivisionByZeroException if {@code rhs} is zero
     */
    public QuotientAndRemainder divQR(final IntegerLike rhs, final RoundingMode mode) {
        final BigInteger d = divisor(rhs, "divQR");
        final BigInteger q = quotient(d, mode);
        return new QuotientAndRemainder(new BigInt(q), new BigInt(value.subtract(q.multiply(d))));
    }

    public QuotientAndRemainder divQR(final long rhs) {
        return divQR(of(rhs), RoundingMode.DOWN);
    }

    public QuotientAndRemainder divQR(final long rhs, final RoundingMode mode) {
        return divQR(of(rhs), mode);
    }

    public QuotientAndRemainder divQR(final String rhs) {
        return divQR(from(rhs), RoundingMode.DOWN);
    }

    public QuotientAndRemainder divQR(final String rhs, final RoundingMode mode) {
        return divQR(from(rhs), mode);
    }

    /**
     * Non-negative remainder modulo {@code |rhs|}.
     *
     * @param rhs the modulus; its sign is ignored
     * @return {@code r} with {@code 0 <= r < |rhs|}
     * @throws DivisionByZeroException if {@code rhs} is zero
     */
    public BigInt mod(final IntegerLike rhs) {
        return new BigInt(value.mod(divisor(rhs, "mod").abs()));
    }

    public BigInt mod(final long rhs) {
        return mod(of(rhs));
    }

    public BigInt mod(final String rhs) {
        return mod(from(rhs));
    }

    /**
     * Raises this value to a non-negative power.
     *
     * @param exponent the exponent
     * @return {@code this^exponent}; {@code 0^0} is 1
     * @throws DomainException if {@code exponent} is negative, or too large for a base
     *                         other than -1, 0 and 1
     */
    public BigInt pow(final IntegerLike exponent) {
        final BigInteger e = operand(exponent, "exponent");
        if (e.signum() < 0) {
            throw new DomainException("Negative exponent: " + e);
        }
        if (e.signum() == 0) {
            return one();
        }
        if (value.abs().compareTo(BigInteger.ONE) <= 0) {
            // 0, 1 and -1 stay bounded for any exponent.
            return value.signum() < 0 && !e.testBit(0) ? one() : this;
        }
        if (e.bitLength() > Integer.SIZE - 1) {
            throw new DomainException("Exponent too large: " + e);
        }
        return new BigInt(value.pow(e.intValue()));
    }

    public BigInt pow(final long exponent) {
        return pow(of(exponent));
    }

    public BigInt pow(final String exponent) {
        return pow(from(exponent));
    }

    /**
     * Modular exponentiation.
     *
     * @param exponent a non-negative exponent
     * @param modulus  a positive modulus
     * @return {@code this^exponent mod modulus}, in {@code [0, modulus)}
     * @throws DomainException if {@code modulus <= 0} or {@code exponent < 0}
     */
    public BigInt powMod(final IntegerLike exponent, final IntegerLike modulus) {
        final BigInteger e = operand(exponent, "exponent");
        final BigInteger m = operand(modulus, "modulus");
        if (m.signum() <= 0) {
            throw new DomainException("Modulus must be positive: " + m);
        }
        if (e.signum() < 0) {
            throw new DomainException("Negative exponent: " + e);
        }
        return new BigInt(value.modPow(e, m));
    }

    public BigInt powMod(final long exponent, final long modulus) {
        return powMod(of(exponent), of(modulus));
    }

    public BigInt powMod(final String exponent, final String modulus) {
        return powMod(from(exponent), from(modulus));
    }

    public BigInt powMod(final IntegerLike exponent, final long modulus) {
        return powMod(exponent, of(modulus));
    }

    public BigInt powMod(final IntegerLike exponent, final String modulus) {
        return powMod(exponent, from(modulus));
    }

    public BigInt powMod(final long exponent, final IntegerLike modulus) {
        return powMod(of(exponent), modulus);
    }

    public BigInt powMod(final long exponent, final String modulus) {
        return powMod(of(exponent), from(modulus));
    }

    public BigInt powMod(final String exponent, final IntegerLike modulus) {
        return powMod(from(exponent), modulus);
    }

    public BigInt powMod(final String exponent, final long modulus) {
        return powMod(from(exponent), of(modulus));
    }

    /**
     * Integer square root, rounded down.
     *
     * @return the largest {@code r} with {@code r * r <= this}
     * @throws DomainException if this value is negative
     */
    public BigInt sqrt() {
        if (value.signum() < 0) {
            throw new DomainException("Square root of a negative number: " + value);
        }
        return new BigInt(value.sqrt());
    }

    public BigInt abs() {
        return value.signum() < 0 ? new BigInt(value.negate()) : this;
    }

    public BigInt negate() {
        return new BigInt(value.negate());
    }

    /**
     * Greatest common divisor; always non-negative, and {@code gcd(0, 0) == 0}.
     */
    public BigInt gcd(final IntegerLike rhs) {
        return new BigInt(value.gcd(operand(rhs, "rhs")));
    }

    public BigInt gcd(final long rhs) {
        return gcd(of(rhs));
    }

    public BigInt gcd(final String rhs) {
        return gcd(from(rhs));
    }

    // ═══════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════

    private static BigInteger operand(final IntegerLike operand, final String name) {
        Objects.requireNonNull(operand, name);
        return Objects.requireNonNull(operand.toBigInt(), name).value;
    }

    private static BigInteger divisor(final IntegerLike rhs, final String operation) {
        final BigInteger d = operand(rhs, "rhs");
        if (d.signum() == 0) {
            throw DivisionByZeroException.forOperation(operation);
        }
        return d;
    }

    private BigInteger quotient(final BigInteger d, final RoundingMode mode) {
        Objects.requireNonNull(mode, "mode");
        final BigInteger[] qr = value.divideAndRemainder(d);
        final BigInteger q = qr[0];
        final BigInteger r = qr[1];
        if (r.signum() == 0) {
            return q;
        }

        // The exact quotient lies strictly between q and q + sign.
        final int sign = value.signum() * d.signum();
        final boolean awayFromZero = switch (mode) {
            case DOWN -> false;
            case UP -> true;
            case FLOOR -> sign < 0;
            case CEILING -> sign > 0;
            case HALF_UP, HALF_DOWN, HALF_EVEN -> {
                final int half = r.abs().shiftLeft(1).compareTo(d.abs());
                if (half != 0) {
                    yield half > 0;
                }
                yield mode == RoundingMode.HALF_UP || (mode == RoundingMode.HALF_EVEN && q.testBit(0));
            }
            case UNNECESSARY -> throw new DomainException(
                    "Rounding necessary for " + value + " / " + d);
        };
        return awayFromZero ? q.add(BigInteger.valueOf(sign)) : q;
    }

    private static BigInteger parseDetectingBase(final String value) {
        int pos = 0;
        if (!value.isEmpty() && (value.charAt(0) == '-' || value.charAt(0) == '+')) {
            pos = 1;
        }
        final boolean negative = pos == 1 && value.charAt(0) == '-';

        int radix = 10;
        if (value.length() - pos > 1 && value.charAt(pos) == '0') {
            final char marker = value.charAt(pos + 1);
            if (marker == 'x' || marker == 'X') {
                radix = 16;
                pos += 2;
            } else if (marker == 'b' || marker == 'B') {
                radix = 2;
                pos += 2;
            } else {
                radix = 8;
                pos += 1;
            }
        }

        final BigInteger magnitude = parseDigits(value, value.substring(pos), radix);
        return negative ? magnitude.negate() : magnitude;
    }

    private static BigInteger parseDigits(final String original, final String digits, final int radix) {
        if (digits.isEmpty()) {
            throw new NumberParseException("String value does not represent a number: \"" + original + "\"");
        }
        for (int i = 0; i < digits.length(); i++) {
            final char c = digits.charAt(i);
            // Character.digit also accepts non-ASCII digits, which are not numbers here.
            if (c >= 128 || Character.digit(c, radix) < 0) {
                throw new NumberParseException(
                        "String value does not represent a number in base " + radix + ": \"" + original + "\"");
            }
        }
        try {
            return new BigInteger(digits, radix);
        } catch (NumberFormatException e) {
            throw new NumberParseException("String value does not represent a number: \"" + original + "\"", e);
        }
    }

    private static BigInteger product(final long lo, final long hi) {
        if (hi - lo < 16) {
            BigInteger acc = BigInteger.valueOf(lo);
            for (long i = lo + 1; i <= hi; i++) {
                acc = acc.multiply(BigInteger.valueOf(i));
            }
            return acc;
        }
        final long mid = (lo + hi) >>> 1;
        return product(lo, mid).multiply(product(mid + 1, hi));
    }

    private static final class ZeroHolder {
        static final BigInt ZERO = new BigInt(BigInteger.ZERO);
    }

    private static final class OneHolder {
        static final BigInt ONE = new BigInt(BigInteger.ONE);
    }
}
