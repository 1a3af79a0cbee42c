package org.anyvals.numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.LongFunction;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * A finite, lazily computed arithmetic progression of primitive values.
 *
 * <p>The {@code i}-th element is {@code start + i * step}. Floating point progressions are
 * computed in decimal arithmetic from the canonical string form of their endpoints, so
 * {@code 0.0 to 1.0 by 0.1} has eleven elements and no accumulated rounding error. A range is
 * restartable: every call to {@link #iterator()} or {@link #stream()} starts again from the
 * first element.
 *
 * @param <N> the boxed element type
 */
public final class NumericRange<N extends Number> implements Iterable<N> {

  private static final BigInteger MAX_LENGTH = BigInteger.valueOf(Long.MAX_VALUE);

  private final String description;
  private final long length;
  private final LongFunction<N> elementAt;

  private NumericRange(String description, long length, LongFunction<N> elementAt) {
    this.description = description;
    this.length = length;
    this.elementAt = elementAt;
  }

  public static NumericRange<Integer> ofInts(int start, int end, int step, boolean inclusive) {
    long length =
        integralLength(BigInteger.valueOf(start), BigInteger.valueOf(end), BigInteger.valueOf(step), inclusive);
    return new NumericRange<>(
        describe(start, end, step, inclusive), length, i -> (int) (start + i * (long) step));
  }

  public static NumericRange<Long> ofLongs(long start, long end, long step, boolean inclusive) {
    BigInteger first = BigInteger.valueOf(start);
    BigInteger by = BigInteger.valueOf(step);
    long length = integralLength(first, BigInteger.valueOf(end), by, inclusive);
    return new NumericRange<>(
        describe(start, end, step, inclusive),
        length,
        i -> first.add(by.multiply(BigInteger.valueOf(i))).longValueExact());
  }

  public static NumericRange<Float> ofFloats(float start, float end, float step, boolean inclusive) {
    requireFinite(start, end, step);
    BigDecimal first = new BigDecimal(Float.toString(start));
    BigDecimal by = new BigDecimal(Float.toString(step));
    long length = decimalLength(first, new BigDecimal(Float.toString(end)), by, inclusive);
    return new NumericRange<>(
        describe(start, end, step, inclusive),
        length,
        i -> first.add(by.multiply(BigDecimal.valueOf(i))).floatValue());
  }

  public static NumericRange<Double> ofDoubles(double start, double end, double step, boolean inclusive) {
    requireFinite(start, end, step);
    BigDecimal first = BigDecimal.valueOf(start);
    BigDecimal by = BigDecimal.valueOf(step);
    long length = decimalLength(first, BigDecimal.valueOf(end), by, inclusive);
    return new NumericRange<>(
        describe(start, end, step, inclusive),
        length,
        i -> first.add(by.multiply(BigDecimal.valueOf(i))).doubleValue());
  }

  public long size() {
    return length;
  }

  public boolean isEmpty() {
    return length == 0;
  }

  /**
   * Returns the element at {@code index}.
   *
   * @throws IndexOutOfBoundsException if {@code index} is negative or not less than {@link #size()}
   */
  public N get(long index) {
    if (index < 0 || index >= length) {
      throw new IndexOutOfBoundsException("Index " + index + " out of range of " + this);
    }
    return elementAt.apply(index);
  }

  public Stream<N> stream() {
    return LongStream.range(0, length).mapToObj(elementAt);
  }

  public List<N> toList() {
    List<N> result = new ArrayList<>();
    forEach(result::add);
    return result;
  }

  @Override
  public Iterator<N> iterator() {
    return new Iterator<N>() {
      private long next;

      @Override
      public boolean hasNext() {
        return next < length;
      }

      @Override
      public N next() {
        if (next >= length) {
          throw new NoSuchElementException();
        }
        return elementAt.apply(next++);
      }
    };
  }

  @Override
  public String toString() {
    return "NumericRange(" + description + ")";
  }

  private static long integralLength(BigInteger start, BigInteger end, BigInteger step, boolean inclusive) {
    if (step.signum() == 0) {
      throw new IllegalArgumentException("step cannot be 0");
    }
    BigInteger span = end.subtract(start);
    if (span.signum() == 0) {
      return inclusive ? 1 : 0;
    }
    if (span.signum() != step.signum()) {
      return 0;
    }
    BigInteger[] quotientAndRemainder = span.divideAndRemainder(step);
    BigInteger count = quotientAndRemainder[0];
    if (inclusive || quotientAndRemainder[1].signum() != 0) {
      count = count.add(BigInteger.ONE);
    }
    return checkedLength(count);
  }

  private static long decimalLength(BigDecimal start, BigDecimal end, BigDecimal step, boolean inclusive) {
    if (step.signum() == 0) {
      throw new IllegalArgumentException("step cannot be 0");
    }
    BigDecimal span = end.subtract(start);
    if (span.signum() == 0) {
      return inclusive ? 1 : 0;
    }
    if (span.signum() != step.signum()) {
      return 0;
    }
    BigDecimal quotient = span.divide(step, 0, RoundingMode.DOWN);
    BigDecimal remainder = span.subtract(quotient.multiply(step));
    BigInteger count = quotient.toBigIntegerExact();
    if (inclusive || remainder.signum() != 0) {
      count = count.add(BigInteger.ONE);
    }
    return checkedLength(count);
  }

  private static long checkedLength(BigInteger count) {
    if (count.compareTo(MAX_LENGTH) > 0) {
      throw new IllegalArgumentException("Range has more than " + Long.MAX_VALUE + " elements");
    }
    return count.longValueExact();
  }

  private static void requireFinite(double start, double end, double step) {
    if (!Double.isFinite(start) || !Double.isFinite(end) || !Double.isFinite(step)) {
      throw new IllegalArgumentException(
          "Range bounds and step must be finite: " + start + ", " + end + ", " + step);
    }
  }

  private static String describe(Number start, Number end, Number step, boolean inclusive) {
    return start + (inclusive ? " to " : " until ") + end + " by " + step;
  }
}
