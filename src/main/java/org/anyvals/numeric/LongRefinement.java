package org.anyvals.numeric;

import java.util.function.LongUnaryOperator;

/**
 * The shared implementation of every {@code long}-backed refinement type.
 *
 * <p>Subclasses bind a {@link RefinementType} and add their factories and widening
 * conversions; everything else lives here. Each operator gives exactly the result of
 * applying the same Java operator to {@link #value()} and the argument, including the
 * binary numeric promotion of the result type and integer overflow.
 *
 * @param <T> the concrete refinement type
 */
public abstract class LongRefinement<T extends LongRefinement<T>> extends Number implements Comparable<T> {

  private static final long serialVersionUID = 1L;

  private final long value;

  protected LongRefinement(long value) {
    this.value = value;
  }

  /** The binding of the concrete type. */
  protected abstract RefinementType<Long, T> type();

  @SuppressWarnings("unchecked")
  private T self() {
    return (T) this;
  }

  /** The {@code long} value underlying this instance. */
  public final long value() {
    return value;
  }

  // Conversions

  public final byte toByte() {
    return (byte) value;
  }

  public final short toShort() {
    return (short) value;
  }

  public final char toChar() {
    return (char) value;
  }

  public final int toInt() {
    return (int) value;
  }

  public final long toLong() {
    return value;
  }

  public final float toFloat() {
    return value;
  }

  public final double toDouble() {
    return value;
  }

  @Override
  public final int intValue() {
    return (int) value;
  }

  @Override
  public final long longValue() {
    return value;
  }

  @Override
  public final float floatValue() {
    return value;
  }

  @Override
  public final double doubleValue() {
    return value;
  }

  public final String toBinaryString() {
    return Long.toBinaryString(value);
  }

  public final String toHexString() {
    return Long.toHexString(value);
  }

  public final String toOctalString() {
    return Long.toOctalString(value);
  }

  // Unary operators

  /** Returns this value, unmodified. */
  public final T unaryPlus() {
    return self();
  }

  /** Returns the negation of this value. */
  public final long unaryMinus() {
    return -value;
  }

  /** Returns the bitwise negation of this value. */
  public final long bitwiseNot() {
    return ~value;
  }

  /** Converts this value to a string then concatenates the given string. */
  public final String concat(String s) {
    return value + s;
  }

  // Comparisons

  /** Returns {@code true} if this value is less than {@code x}. */
  public final boolean lt(byte x) {
    return value < x;
  }

  public final boolean lt(short x) {
    return value < x;
  }

  public final boolean lt(char x) {
    return value < x;
  }

  public final boolean lt(int x) {
    return value < x;
  }

  public final boolean lt(long x) {
    return value < x;
  }

  public final boolean lt(float x) {
    return value < x;
  }

  public final boolean lt(double x) {
    return value < x;
  }

  /** Returns {@code true} if this value is less than or equal to {@code x}. */
  public final boolean le(byte x) {
    return value <= x;
  }

  public final boolean le(short x) {
    return value <= x;
  }

  public final boolean le(char x) {
    return value <= x;
  }

  public final boolean le(int x) {
    return value <= x;
  }

  public final boolean le(long x) {
    return value <= x;
  }

  public final boolean le(float x) {
    return value <= x;
  }

  public final boolean le(double x) {
    return value <= x;
  }

  /** Returns {@code true} if this value is greater than {@code x}. */
  public final boolean gt(byte x) {
    return value > x;
  }

  public final boolean gt(short x) {
    return value > x;
  }

  public final boolean gt(char x) {
    return value > x;
  }

  public final boolean gt(int x) {
    return value > x;
  }

  public final boolean gt(long x) {
    return value > x;
  }

  public final boolean gt(float x) {
    return value > x;
  }

  public final boolean gt(double x) {
    return value > x;
  }

  /** Returns {@code true} if this value is greater than or equal to {@code x}. */
  public final boolean ge(byte x) {
    return value >= x;
  }

  public final boolean ge(short x) {
    return value >= x;
  }

  public final boolean ge(char x) {
    return value >= x;
  }

  public final boolean ge(int x) {
    return value >= x;
  }

  public final boolean ge(long x) {
    return value >= x;
  }

  public final boolean ge(float x) {
    return value >= x;
  }

  public final boolean ge(double x) {
    return value >= x;
  }

  // Bitwise operators

  /** Returns the bitwise OR of this value and {@code x}. */
  public final long or(byte x) {
    return value | x;
  }

  public final long or(short x) {
    return value | x;
  }

  public final long or(char x) {
    return value | x;
  }

  public final long or(int x) {
    return value | x;
  }

  public final long or(long x) {
    return value | x;
  }

  /** Returns the bitwise AND of this value and {@code x}. */
  public final long and(byte x) {
    return value & x;
  }

  public final long and(short x) {
    return value & x;
  }

  public final long and(char x) {
    return value & x;
  }

  public final long and(int x) {
    return value & x;
  }

  public final long and(long x) {
    return value & x;
  }

  /** Returns the bitwise XOR of this value and {@code x}. */
  public final long xor(byte x) {
    return value ^ x;
  }

  public final long xor(short x) {
    return value ^ x;
  }

  public final long xor(char x) {
    return value ^ x;
  }

  public final long xor(int x) {
    return value ^ x;
  }

  public final long xor(long x) {
    return value ^ x;
  }

  /** Returns this value shifted left by {@code x} bits, filling with zeroes. */
  public final long shiftLeft(int x) {
    return value << x;
  }

  public final long shiftLeft(long x) {
    return value << x;
  }

  /** Returns this value shifted right by {@code x} bits, filling with the sign bit. */
  public final long shiftRight(int x) {
    return value >> x;
  }

  public final long shiftRight(long x) {
    return value >> x;
  }

  /** Returns this value shifted right by {@code x} bits, filling with zeroes. */
  public final long unsignedShiftRight(int x) {
    return value >>> x;
  }

  public final long unsignedShiftRight(long x) {
    return value >>> x;
  }

  // Arithmetic

  /** Returns the sum of this value and {@code x}. */
  public final long plus(byte x) {
    return value + x;
  }

  public final long plus(short x) {
    return value + x;
  }

  public final long plus(char x) {
    return value + x;
  }

  public final long plus(int x) {
    return value + x;
  }

  public final long plus(long x) {
    return value + x;
  }

  public final float plus(float x) {
    return value + x;
  }

  public final double plus(double x) {
    return value + x;
  }

  /** Returns the difference of this value and {@code x}. */
  public final long minus(byte x) {
    return value - x;
  }

  public final long minus(short x) {
    return value - x;
  }

  public final long minus(char x) {
    return value - x;
  }

  public final long minus(int x) {
    return value - x;
  }

  public final long minus(long x) {
    return value - x;
  }

  public final float minus(float x) {
    return value - x;
  }

  public final double minus(double x) {
    return value - x;
  }

  /** Returns the product of this value and {@code x}. */
  public final long times(byte x) {
    return value * x;
  }

  public final long times(short x) {
    return value * x;
  }

  public final long times(char x) {
    return value * x;
  }

  public final long times(int x) {
    return value * x;
  }

  public final long times(long x) {
    return value * x;
  }

  public final float times(float x) {
    return value * x;
  }

  public final double times(double x) {
    return value * x;
  }

  /**
   * Returns the quotient of this value and {@code x}.
   *
   * @throws ArithmeticException if {@code x} is an integral zero
   */
  public final long div(byte x) {
    return value / x;
  }

  public final long div(short x) {
    return value / x;
  }

  public final long div(char x) {
    return value / x;
  }

  public final long div(int x) {
    return value / x;
  }

  public final long div(long x) {
    return value / x;
  }

  public final float div(float x) {
    return value / x;
  }

  public final double div(double x) {
    return value / x;
  }

  /** Returns the remainder of the division of this value by {@code x}. */
  public final long rem(byte x) {
    return value % x;
  }

  public final long rem(short x) {
    return value % x;
  }

  public final long rem(char x) {
    return value % x;
  }

  public final long rem(int x) {
    return value % x;
  }

  public final long rem(long x) {
    return value % x;
  }

  public final float rem(float x) {
    return value % x;
  }

  public final double rem(double x) {
    return value % x;
  }

  // Extras

  /** Returns {@code this} if its value is greater than or equal to that of {@code that}, else {@code that}. */
  public final T max(T that) {
    return Math.max(value, that.value()) == value ? self() : that;
  }

  /** Returns {@code this} if its value is less than or equal to that of {@code that}, else {@code that}. */
  public final T min(T that) {
    return Math.min(value, that.value()) == value ? self() : that;
  }

  /**
   * Applies {@code f} to this value and wraps the result in the same refinement type.
   *
   * @throws AssertionError if the result is not valid for this type
   */
  public final T ensuringValid(LongUnaryOperator f) {
    return type().ensuringValid(f.applyAsLong(value));
  }

  /** An inclusive range from this value to {@code end}, by one. */
  public final NumericRange<Long> to(long end) {
    return NumericRange.ofLongs(value, end, 1L, true);
  }

  public final NumericRange<Long> to(long end, long step) {
    return NumericRange.ofLongs(value, end, step, true);
  }

  /** A range from this value up to but not including {@code end}, by one. */
  public final NumericRange<Long> until(long end) {
    return NumericRange.ofLongs(value, end, 1L, false);
  }

  public final NumericRange<Long> until(long end, long step) {
    return NumericRange.ofLongs(value, end, step, false);
  }

  @Override
  public final int compareTo(T that) {
    return Long.compare(value, that.value());
  }

  @Override
  public final boolean equals(Object other) {
    return other != null && other.getClass() == getClass() && ((LongRefinement<?>) other).value == value;
  }

  @Override
  public final int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public final String toString() {
    return type().name() + "(" + value + ")";
  }
}
