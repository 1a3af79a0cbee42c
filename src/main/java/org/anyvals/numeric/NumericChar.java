package org.anyvals.numeric;

import java.util.Optional;
import java.util.function.Function;
import org.anyvals.Or;
import org.anyvals.Validation;
import org.anyvals.checker.qual.LiteralChecked;
import org.anyvals.checker.qual.NumericDigit;

/**
 * A {@code char} that holds one of the decimal digits {@code '0'} to {@code '9'}.
 *
 * <p>{@link #of} accepts constants only. When {@code RefinementChecker} runs, passing it a
 * constant outside the decimal digit range, or any non-constant expression, is a
 * compile-time error; use {@link #from} and its siblings for values computed at run time.
 */
public final class NumericChar extends CharRefinement<NumericChar> {

  public static final RefinementType<Character, NumericChar> TYPE =
      RefinementType.<Character, NumericChar>builder("NumericChar", PrimitiveKind.CHAR)
          .predicate(NumericChar::isValid)
          .constructor(NumericChar::new)
          .bounds('0', '9')
          .description("decimal digit ('0' <= i <= '9')")
          .example("NumericChar.of('4')")
          .widensTo("PosInt", "PosZInt", "PosLong", "PosZLong", "PosFloat", "PosZFloat", "PosDouble", "PosZDouble")
          .build();

  /** The smallest value of this type, {@code NumericChar(0)}. */
  public static final NumericChar MIN_VALUE = TYPE.ensuringValid(TYPE.minValue());

  /** The largest value of this type, {@code NumericChar(9)}. */
  public static final NumericChar MAX_VALUE = TYPE.ensuringValid(TYPE.maxValue());

  private NumericChar(char value) {
    super(value);
  }

  @Override
  protected RefinementType<Character, NumericChar> type() {
    return TYPE;
  }

  /**
   * Returns the decimal digit constant {@code value} as a {@code NumericChar}.
   *
   * @throws AssertionError if {@code value} is not a decimal digit, which cannot happen in code
   *     that passes {@code RefinementChecker}
   */
  @LiteralChecked
  public static NumericChar of(@NumericDigit char value) {
    return TYPE.ensuringValid(value);
  }

  /** Returns {@code true} if {@code value} is a decimal digit: {@code value >= '0' && value <= '9'}. */
  public static boolean isValid(char value) {
    return value >= '0' && value <= '9';
  }

  public static Optional<NumericChar> from(char value) {
    return TYPE.from(value);
  }

  /**
   * Returns {@code value} as a {@code NumericChar}, for callers that know it is valid.
   *
   * @throws AssertionError if it is not
   */
  public static NumericChar ensuringValid(char value) {
    return TYPE.ensuringValid(value);
  }

  public static NumericChar fromOrElse(char value, NumericChar fallback) {
    return TYPE.fromOrElse(value, fallback);
  }

  public static <B> Or<NumericChar, B> goodOrElse(char value, Function<? super Character, ? extends B> onInvalid) {
    return TYPE.goodOrElse(value, onInvalid);
  }

  public static <E> Validation<E> passOrElse(char value, Function<? super Character, ? extends E> onInvalid) {
    return TYPE.passOrElse(value, onInvalid);
  }

  public static Or<NumericChar, AssertionError> tryingValid(char value) {
    return TYPE.tryingValid(value);
  }

  /** Returns the digit this character stands for, from 0 to 9. */
  public int asDigit() {
    return value() - '0';
  }

  public PosZInt asDigitPosZInt() {
    return PosZInt.ensuringValid(asDigit());
  }

  // Widening conversions

  /** Widens this value to a {@link PosInt}. */
  public PosInt toPosInt() {
    return PosInt.ensuringValid(toInt());
  }

  /** Widens this value to a {@link PosZInt}. */
  public PosZInt toPosZInt() {
    return PosZInt.ensuringValid(toInt());
  }

  /** Widens this value to a {@link PosLong}. */
  public PosLong toPosLong() {
    return PosLong.ensuringValid(toLong());
  }

  /** Widens this value to a {@link PosZLong}. */
  public PosZLong toPosZLong() {
    return PosZLong.ensuringValid(toLong());
  }

  /** Widens this value to a {@link PosFloat}. */
  public PosFloat toPosFloat() {
    return PosFloat.ensuringValid(toFloat());
  }

  /** Widens this value to a {@link PosZFloat}. */
  public PosZFloat toPosZFloat() {
    return PosZFloat.ensuringValid(toFloat());
  }

  /** Widens this value to a {@link PosDouble}. */
  public PosDouble toPosDouble() {
    return PosDouble.ensuringValid(toDouble());
  }

  /** Widens this value to a {@link PosZDouble}. */
  public PosZDouble toPosZDouble() {
    return PosZDouble.ensuringValid(toDouble());
  }
}
