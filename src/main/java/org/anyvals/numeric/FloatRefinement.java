package org.anyvals.numeric;

import java.util.function.DoubleUnaryOperator;

/**
 * The shared implementation of every {@code float}-backed refinement type.
 *
 * <p>Operators follow IEEE 754 exactly as the {@code float} primitive does: dividing by zero
 * yields an infinity or NaN, and comparisons involving NaN are {@code false}. Equality is the
 * exception: two instances holding NaN are equal, and {@code 0.0} equals {@code -0.0}.
 * {@link #compareTo} uses {@link Float#compare}, which orders NaN above positive infinity and
 * {@code -0.0} below {@code 0.0}.
 *
 * @param <T> the concrete refinement type
 */
public abstract class FloatRefinement<T extends FloatRefinement<T>> extends Number implements Comparable<T> {

  private static final long serialVersionUID = 1L;

  private final float value;

  protected FloatRefinement(float value) {
    this.value = value;
  }

  /** The binding of the concrete type. */
  protected abstract RefinementType<Float, T> type();

  @SuppressWarnings("unchecked")
  private T self() {
    return (T) this;
  }

  /** The {@code float} value underlying this instance. */
  public final float value() {
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
    return (long) value;
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
    return (long) value;
  }

  @Override
  public final float floatValue() {
    return value;
  }

  @Override
  public final double doubleValue() {
    return value;
  }

  // Unary operators

  /** Returns this value, unmodified. */
  public final T unaryPlus() {
    return self();
  }

  /** Returns the negation of this value. */
  public final float unaryMinus() {
    return -value;
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

  // Arithmetic

  /** Returns the sum of this value and {@code x}. */
  public final float plus(byte x) {
    return value + x;
  }

  public final float plus(short x) {
    return value + x;
  }

  public final float plus(char x) {
    return value + x;
  }

  public final float plus(int x) {
    return value + x;
  }

  public final float plus(long x) {
    return value + x;
  }

  public final float plus(float x) {
    return value + x;
  }

  public final double plus(double x) {
    return value + x;
  }

  /** Returns the difference of this value and {@code x}. */
  public final float minus(byte x) {
    return value - x;
  }

  public final float minus(short x) {
    return value - x;
  }

  public final float minus(char x) {
    return value - x;
  }

  public final float minus(int x) {
    return value - x;
  }

  public final float minus(long x) {
    return value - x;
  }

  public final float minus(float x) {
    return value - x;
  }

  public final double minus(double x) {
    return value - x;
  }

  /** Returns the product of this value and {@code x}. */
  public final float times(byte x) {
    return value * x;
  }

  public final float times(short x) {
    return value * x;
  }

  public final float times(char x) {
    return value * x;
  }

  public final float times(int x) {
    return value * x;
  }

  public final float times(long x) {
    return value * x;
  }

  public final float times(float x) {
    return value * x;
  }

  public final double times(double x) {
    return value * x;
  }

  /** Returns the quotient of this value and {@code x}. */
  public final float div(byte x) {
    return value / x;
  }

  public final float div(short x) {
    return value / x;
  }

  public final float div(char x) {
    return value / x;
  }

  public final float div(int x) {
    return value / x;
  }

  public final float div(long x) {
    return value / x;
  }

  public final float div(float x) {
    return value / x;
  }

  public final double div(double x) {
    return value / x;
  }

  /** Returns the remainder of the division of this value by {@code x}. */
  public final float rem(byte x) {
    return value % x;
  }

  public final float rem(short x) {
    return value % x;
  }

  public final float rem(char x) {
    return value % x;
  }

  public final float rem(int x) {
    return value % x;
  }

  public final float rem(long x) {
    return value % x;
  }

  public final float rem(float x) {
    return value % x;
  }

  public final double rem(double x) {
    return value % x;
  }

  // Extras

  public final boolean isPosInfinity() {
    return value == Float.POSITIVE_INFINITY;
  }

  public final boolean isNegInfinity() {
    return value == Float.NEGATIVE_INFINITY;
  }

  public final boolean isNaN() {
    return Float.isNaN(value);
  }

  /**
   * Returns {@code true} if this value has no fractional part. Values too large for a
   * {@code long} are whole, infinities and NaN are not.
   */
  public final boolean isWhole() {
    long longValue = (long) value;
    return longValue == value
        || longValue == Long.MAX_VALUE && value < Float.POSITIVE_INFINITY
        || longValue == Long.MIN_VALUE && value > Float.NEGATIVE_INFINITY;
  }

  /** Returns {@code this} if its value is greater than or equal to that of {@code that}, else {@code that}. */
  public final T max(T that) {
    return Math.max(value, that.value()) == value ? self() : that;
  }

  /** Returns {@code this} if its value is less than or equal to that of {@code that}, else {@code that}. */
  public final T min(T that) {
    return Math.min(value, that.value()) == value ? self() : that;
  }

  /**
   * Applies {@code f} to this value, narrows the result to {@code float} and wraps it in the
   * same refinement type.
   *
   * @throws AssertionError if the result is not valid for this type
   */
  public final T ensuringValid(DoubleUnaryOperator f) {
    return type().ensuringValid((float) f.applyAsDouble(value));
  }

  /** An inclusive range from this value to {@code end}, by one. */
  public final NumericRange<Float> to(float end) {
    return NumericRange.ofFloats(value, end, 1.0f, true);
  }

  public final NumericRange<Float> to(float end, float step) {
    return NumericRange.ofFloats(value, end, step, true);
  }

  /** A range from this value up to but not including {@code end}, by one. */
  public final NumericRange<Float> until(float end) {
    return NumericRange.ofFloats(value, end, 1.0f, false);
  }

  public final NumericRange<Float> until(float end, float step) {
    return NumericRange.ofFloats(value, end, step, false);
  }

  @Override
  public final int compareTo(T that) {
    return Float.compare(value, that.value());
  }

  @Override
  public final boolean equals(Object other) {
    if (other == null || other.getClass() != getClass()) {
      return false;
    }
    float that = ((FloatRefinement<?>) other).value;
    return value == that || Float.isNaN(value) && Float.isNaN(that);
  }

  @Override
  public final int hashCode() {
    // 0.0 and -0.0 are equal, so they must hash alike
    return value == 0.0f ? 0 : Float.hashCode(value);
  }

  @Override
  public final String toString() {
    return type().name() + "(" + value + ")";
  }
}
