package org.anyvals.numeric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PosZDouble")
class PosZDoubleTest {

  @Test
  void fromAcceptsZeroAndRejectsNegatives() {
    assertThat(PosZDouble.from(0.0)).hasValueSatisfying(v -> assertThat(v.value()).isEqualTo(0.0));
    assertThat(PosZDouble.from(-0.00001)).isEmpty();
  }

  @Test
  void plusFollowsPrimitivePromotion() {
    double sum = PosZDouble.of(3.0).plus(3);
    assertThat(sum).isEqualTo(6.0);
  }

  @Test
  void sortsByUnderlyingValue() {
    List<PosZDouble> sorted =
        Stream.of(2.2, 0.0, 1.1, 3.3)
            .map(PosZDouble::ensuringValid)
            .sorted()
            .collect(Collectors.toList());

    assertThat(sorted).extracting(PosZDouble::value).containsExactly(0.0, 1.1, 2.2, 3.3);
  }

  @Test
  void maxValueIsTheLargestFiniteDouble() {
    assertThat(PosZDouble.MAX_VALUE).isEqualTo(PosZDouble.from(Double.MAX_VALUE).get());
    assertThat(PosZFloat.MAX_VALUE).isEqualTo(PosZFloat.from(Float.MAX_VALUE).get());
    assertThat(PosZDouble.MIN_VALUE.value()).isEqualTo(0.0);
  }

  @Test
  void rendersTypeNameAndValue() {
    assertThat(PosZDouble.of(42.0)).hasToString("PosZDouble(42.0)");
  }

  @Test
  void ensuringValidFailsWithAssertionError() {
    assertThatThrownBy(() -> PosZDouble.ensuringValid(-1.0))
        .isInstanceOf(AssertionError.class)
        .hasMessage("-1.0 was not a valid PosZDouble");
  }

  @Test
  void ofStillValidatesWhenTheCheckerDoesNotRun() {
    assertThatThrownBy(() -> PosZDouble.of(-1.0)).isInstanceOf(AssertionError.class);
  }

  @Test
  void acceptsPositiveInfinityButNotNaN() {
    assertThat(PosZDouble.from(Double.POSITIVE_INFINITY)).hasValueSatisfying(v -> assertThat(v.isPosInfinity()).isTrue());
    assertThat(PosZDouble.from(Double.NaN)).isEmpty();
    assertThat(PosZDouble.from(Double.NEGATIVE_INFINITY)).isEmpty();
  }

  @Test
  void negativeZeroEqualsZero() {
    PosZDouble negativeZero = PosZDouble.ensuringValid(-0.0);

    assertThat(negativeZero).isEqualTo(PosZDouble.of(0.0));
    assertThat(negativeZero.hashCode()).isEqualTo(PosZDouble.of(0.0).hashCode());
  }

  @Test
  void fallbackPaths() {
    PosZDouble fallback = PosZDouble.of(1.0);

    assertThat(PosZDouble.fromOrElse(-2.0, fallback)).isSameAs(fallback);
    assertThat(PosZDouble.fromOrElse(2.0, fallback).value()).isEqualTo(2.0);
    assertThat(PosZDouble.goodOrElse(-2.0, v -> v + " is negative").getBad()).isEqualTo("-2.0 is negative");
    assertThat(PosZDouble.passOrElse(-2.0, v -> "bad").error()).isEqualTo("bad");
    assertThat(PosZDouble.passOrElse(2.0, v -> "bad").isPass()).isTrue();
    assertThat(PosZDouble.tryingValid(-2.0).getBad()).hasMessage("-2.0 was not a valid PosZDouble");
    assertThat(PosZDouble.tryingValid(2.0).get().value()).isEqualTo(2.0);
  }

  @Test
  void roundingKeepsTheNarrowestGuaranteedType() {
    PosZDouble value = PosZDouble.of(2.5);

    PosZLong rounded = value.round();
    PosZDouble ceiling = value.ceil();
    PosZDouble floor = value.floor();

    assertThat(rounded.value()).isEqualTo(Math.round(2.5));
    assertThat(ceiling.value()).isEqualTo(Math.ceil(2.5));
    assertThat(floor.value()).isEqualTo(Math.floor(2.5));
  }

  @Test
  void widensWithoutLosingTheValue() {
    PosZDouble value = PosZDouble.of(7.5);

    assertThat(value.toDouble()).isEqualTo(7.5);
    assertThat(value.toInt()).isEqualTo(7);
    assertThat(value.ensuringValid(x -> x * 2).value()).isEqualTo(15.0);
  }

  @Test
  void minAndMaxFavourThisOnTies() {
    PosZDouble a = PosZDouble.of(1.0);
    PosZDouble b = PosZDouble.ensuringValid(1.0);

    assertThat(a.max(b)).isSameAs(a);
    assertThat(a.min(b)).isSameAs(a);
    assertThat(a.max(PosZDouble.of(2.0)).value()).isEqualTo(2.0);
  }
}
