package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.PosZ;

/**
 * A {@code long} that is greater than or equal to zero.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the non-negative range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class PosZLong extends LongRefinement<PosZLong> {

  private static final long serialVersionUID = 1L;

  public static final RefinementType<Long, PosZLong> TYPE =
      RefinementType.<Long, PosZLong>builder("PosZLong", PrimitiveKind.LONG)
          .predicate(PosZLong::isValid)
          .constructor(PosZLong::new)
          .bounds(0L, Long.MAX_VALUE)
          .description("non-negative (i >= 0L)")
          .example("PosZLong.of(42L)")
          .widensTo("PosZFloat", "PosZDouble")
          .build();

  /** The smallest value of this type, {@code PosZLong(0)}. */
  public static final PosZLong MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code PosZLong(9223372036854775807)}. */
  public static final PosZLong MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private PosZLong(long value) {
    super(value);
  }

  @Override
  protected RefinementType<Long, PosZLong> type() {
    return TYPE;
  }

  /**
   * Returns the non-negative constant {@code value} as a {@code PosZLong}.
   *
   * @throws AssertionError if {@code value} is not non-negative, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static PosZLong of(@PosZ long value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is non-negative: {@code value >= 0L}. */
  public static boolean isValid(long value) {
    return value >= 0L;
  }

  public static Optional<PosZLong> from(long value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code PosZLong}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static PosZLong ensuringValid(long value) {
    return TYPE.ensuringValid(value);
  }

  public static PosZLong fromOrElse(long value, PosZLong fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<PosZLong, B> goodOrElse(long value, Function<? super Long, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(long value, Function<? super Long, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<PosZLong, AssertionError> tryingValid(long value) {
    return TYPE.tryingValid(value);
  }

  // Widening conversions

  /** Widens this value to a {@link PosZFloat}. */
  public PosZFloat toPosZFloat() {
    return PosZFloat.ensuringValid(toFloat());
  }

  /** Widens this value to a {@link PosZDouble}. */
  public PosZDouble toPosZDouble() {
    return PosZDouble.ensuringValid(toDouble());
  }
}
