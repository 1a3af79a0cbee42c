package org.anyvals.numeric;

import java.util.function.IntUnaryOperator;

/**
 * The shared implementation of every {@code char}-backed refinement type.
 *
 * <p>As with the {@code char} primitive, every arithmetic and bitwise operator promotes this
 * value to at least {@code int} before it is applied.
 *
 * @param <T> the concrete refinement type
 */
public abstract class CharRefinement<T extends CharRefinement<T>> implements Comparable<T> {

  private final char value;

  protected CharRefinement(char value) {
    this.value = value;
  }

  /** The binding of the concrete type. */
  protected abstract RefinementType<Character, T> type();

  @SuppressWarnings("unchecked")
  private T self() {
    return (T) this;
  }

  /** The {@code char} value underlying this instance. */
  public final char value() {
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
    return value;
  }

  public final int toInt() {
    return value;
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

  // Unary operators

  /** Returns this value, unmodified. */
  public final T unaryPlus() {
    return self();
  }

  /** Returns the negation of this value. */
  public final int unaryMinus() {
    return -value;
  }

  /** Returns the bitwise negation of this value. */
  public final int bitwiseNot() {
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
  public final int or(byte x) {
    return value | x;
  }

  public final int or(short x) {
    return value | x;
  }

  public final int or(char x) {
    return value | x;
  }

  public final int or(int x) {
    return value | x;
  }

  public final long or(long x) {
    return value | x;
  }

  /** Returns the bitwise AND of this value and {@code x}. */
  public final int and(byte x) {
    return value & x;
  }

  public final int and(short x) {
    return value & x;
  }

  public final int and(char x) {
    return value & x;
  }

  public final int and(int x) {
    return value & x;
  }

  public final long and(long x) {
    return value & x;
  }

  /** Returns the bitwise XOR of this value and {@code x}. */
  public final int xor(byte x) {
    return value ^ x;
  }

  public final int xor(short x) {
    return value ^ x;
  }

  public final int xor(char x) {
    return value ^ x;
  }

  public final int xor(int x) {
    return value ^ x;
  }

  public final long xor(long x) {
    return value ^ x;
  }

  /** Returns this value shifted left by {@code x} bits, filling with zeroes. */
  public final int shiftLeft(int x) {
    return value << x;
  }

  public final int shiftLeft(long x) {
    return value << x;
  }

  /** Returns this value shifted right by {@code x} bits, filling with the sign bit. */
  public final int shiftRight(int x) {
    return value >> x;
  }

  public final int shiftRight(long x) {
    return value >> x;
  }

  /** Returns this value shifted right by {@code x} bits, filling with zeroes. */
  public final int unsignedShiftRight(int x) {
    return value >>> x;
  }

  public final int unsignedShiftRight(long x) {
    return value >>> x;
  }

  // Arithmetic

  /** Returns the sum of this value and {@code x}. */
  public final int plus(byte x) {
    return value + x;
  }

  public final int plus(short x) {
    return value + x;
  }

  public final int plus(char x) {
    return value + x;
  }

  public final int plus(int x) {
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
  public final int minus(byte x) {
    return value - x;
  }

  public final int minus(short x) {
    return value - x;
  }

  public final int minus(char x) {
    return value - x;
  }

  public final int minus(int x) {
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
  public final int times(byte x) {
    return value * x;
  }

  public final int times(short x) {
    return value * x;
  }

  public final int times(char x) {
    return value * x;
  }

  public final int times(int x) {
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
  public final int div(byte x) {
    return value / x;
  }

  public final int div(short x) {
    return value / x;
  }

  public final int div(char x) {
    return value / x;
  }

  public final int div(int x) {
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
  public final int rem(byte x) {
    return value % x;
  }

  public final int rem(short x) {
    return value % x;
  }

  public final int rem(char x) {
    return value % x;
  }

  public final int rem(int x) {
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
    return value >= that.value() ? self() : that;
  }

  /** Returns {@code this} if its value is less than or equal to that of {@code that}, else {@code that}. */
  public final T min(T that) {
    return value <= that.value() ? self() : that;
  }

  /**
   * Applies {@code f} to the code unit of this value and wraps the result in the same
   * refinement type.
   *
   * @throws AssertionError if the result is not a {@code char} value valid for this type
   */
  public final T ensuringValid(IntUnaryOperator f) {
    int result = f.applyAsInt(value);
    if (result < Character.MIN_VALUE || result > Character.MAX_VALUE) {
      throw new AssertionError(result + " was not a valid " + type().name());
    }
    return type().ensuringValid((char) result);
  }

  @Override
  public final int compareTo(T that) {
    return Character.compare(value, that.value());
  }

  @Override
  public final boolean equals(Object other) {
    return other != null && other.getClass() == getClass() && ((CharRefinement<?>) other).value == value;
  }

  @Override
  public final int hashCode() {
    return Character.hashCode(value);
  }

  @Override
  public final String toString() {
    return type().name() + "(" + value + ")";
  }
}
