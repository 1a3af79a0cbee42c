package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.NegZ;

/**
 * An {@code int} that is less than or equal to zero.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the non-positive range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class NegZInt extends IntRefinement<NegZInt> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Integer, NegZInt> TYPE =
      RefinementType.<Integer, NegZInt>builder("NegZInt", PrimitiveKind.INT)
          .predicate(NegZInt::isValid)
          .constructor(NegZInt::new)
          .bounds(Integer.MIN_VALUE, 0)
          .description("non-positive (i <= 0)")
          .example("NegZInt.of(-42)")
          .build();

  /** The smallest value of this type, {@code NegZInt(-2147483648)}. */
  public static final NegZInt MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code NegZInt(0)}. */
  public static final NegZInt MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private NegZInt(int value) {
    super(value);
  }

  @Override
  protected RefinementType<Integer, NegZInt> type() {
    return TYPE;
  }

  /**
   * Returns the non-positive constant {@code value} as a {@code NegZInt}.
   *
   * @throws AssertionError if {@code value} is not non-positive, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static NegZInt of(@NegZ int value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is non-positive: {@code value <= 0}. */
  public static boolean isValid(int value) {
    return value <= 0;
  }

  public static Optional<NegZInt> from(int value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code NegZInt}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static NegZInt ensuringValid(int value) {
    return TYPE.ensuringValid(value);
  }

  public static NegZInt fromOrElse(int value, NegZInt fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<NegZInt, B> goodOrElse(int value, Function<? super Integer, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(int value, Function<? super Integer, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<NegZInt, AssertionError> tryingValid(int value) {
    return TYPE.tryingValid(value);
  }
}
