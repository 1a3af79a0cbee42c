package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.Neg;

/**
 * An {@code int} that is less than zero.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the negative range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class NegInt extends IntRefinement<NegInt> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Integer, NegInt> TYPE =
      RefinementType.<Integer, NegInt>builder("NegInt", PrimitiveKind.INT)
          .predicate(NegInt::isValid)
          .constructor(NegInt::new)
          .bounds(Integer.MIN_VALUE, -1)
          .description("negative (i < 0)")
          .example("NegInt.of(-42)")
          .widensTo("NegZInt", "NonZeroInt", "NonZeroLong", "NonZeroFloat", "NonZeroDouble")
          .build();

  /** The smallest value of this type, {@code NegInt(-2147483648)}. */
  public static final NegInt MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code NegInt(-1)}. */
  public static final NegInt MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private NegInt(int value) {
    super(value);
  }

  @Override
  protected RefinementType<Integer, NegInt> type() {
    return TYPE;
  }

  /**
   * Returns the negative constant {@code value} as a {@code NegInt}.
   *
   * @throws AssertionError if {@code value} is not negative, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static NegInt of(@Neg int value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is negative: {@code value < 0}. */
  public static boolean isValid(int value) {
    return value < 0;
  }

  public static Optional<NegInt> from(int value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code NegInt}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static NegInt ensuringValid(int value) {
    return TYPE.ensuringValid(value);
  }

  public static NegInt fromOrElse(int value, NegInt fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<NegInt, B> goodOrElse(int value, Function<? super Integer, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(int value, Function<? super Integer, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<NegInt, AssertionError> tryingValid(int value) {
    return TYPE.tryingValid(value);
  }

  // Widening conversions

  public NegZInt toNegZInt() {
    return NegZInt.ensuringValid(value());
  }

  public NonZeroInt toNonZeroInt() {
    return NonZeroInt.ensuringValid(value());
  }

  public NonZeroLong toNonZeroLong() {
    return NonZeroLong.ensuringValid(toLong());
  }

  public NonZeroFloat toNonZeroFloat() {
    return NonZeroFloat.ensuringValid(toFloat());
  }

  public NonZeroDouble toNonZeroDouble() {
    return NonZeroDouble.ensuringValid(toDouble());
  }
}
