package org.anyvals.numeric;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class FloatingRefinementTest {

  @ParameterizedTest
  @ValueSource(doubles = {Double.MIN_VALUE, 0.4, 0.5, 1.5, 2.5, 99.99, 1e17, Double.MAX_VALUE})
  void posDoubleRoundingMatchesMath(double raw) {
    PosDouble value = PosDouble.ensuringValid(raw);

    assertThat(value.round().value()).isEqualTo(Math.round(raw));
    assertThat(value.ceil().value()).isEqualTo(Math.ceil(raw));
    assertThat(value.floor().value()).isEqualTo(Math.floor(raw));
  }

  @ParameterizedTest
  @ValueSource(floats = {Float.MIN_VALUE, 0.4f, 0.5f, 2.5f, 1234.567f, Float.MAX_VALUE})
  void posFloatRoundingMatchesMath(float raw) {
    PosFloat value = PosFloat.ensuringValid(raw);

    PosZInt rounded = value.round();
    PosFloat ceiling = value.ceil();
    PosZFloat floor = value.floor();

    assertThat(rounded.value()).isEqualTo(Math.round(raw));
    assertThat(ceiling.value()).isEqualTo((float) Math.ceil(raw));
    assertThat(floor.value()).isEqualTo((float) Math.floor(raw));
  }

  @ParameterizedTest
  @ValueSource(doubles = {-2.5, -0.5, 0.5, 3.7})
  void nonZeroRoundingFallsBackToPrimitives(double raw) {
    NonZeroDouble value = NonZeroDouble.ensuringValid(raw);

    long rounded = value.round();
    double ceiling = value.ceil();
    double floor = value.floor();

    assertThat(rounded).isEqualTo(Math.round(raw));
    assertThat(ceiling).isEqualTo(Math.ceil(raw));
    assertThat(floor).isEqualTo(Math.floor(raw));
  }

  @Test
  void nanIsAValidNonZeroValueEqualToItself() {
    NonZeroDouble nan = NonZeroDouble.ensuringValid(Double.NaN);

    assertThat(nan.isNaN()).isTrue();
    assertThat(nan).isEqualTo(NonZeroDouble.ensuringValid(Double.NaN));
    assertThat(nan.hashCode()).isEqualTo(NonZeroDouble.ensuringValid(Double.NaN).hashCode());
    assertThat(nan).hasToString("NonZeroDouble(NaN)");
    assertThat(NonZeroFloat.from(Float.NaN)).isPresent();
    assertThat(PosDouble.from(Double.NaN)).isEmpty();
  }

  @Test
  void nanComparisonOperatorsKeepIeeeSemantics() {
    NonZeroDouble nan = NonZeroDouble.ensuringValid(Double.NaN);

    assertThat(nan.lt(1.0)).isFalse();
    assertThat(nan.ge(1.0)).isFalse();
    assertThat(nan.le(Double.NaN)).isFalse();
  }

  @Test
  void nanSortsAfterPositiveInfinity() {
    List<NonZeroDouble> values = new ArrayList<>();
    values.add(NonZeroDouble.ensuringValid(Double.NaN));
    values.add(NonZeroDouble.ensuringValid(Double.POSITIVE_INFINITY));
    values.add(NonZeroDouble.of(-1.0));
    values.add(NonZeroDouble.of(2.0));

    Collections.sort(values);

    assertThat(values)
        .extracting(NonZeroDouble::value)
        .containsExactly(-1.0, 2.0, Double.POSITIVE_INFINITY, Double.NaN);
  }

  @Test
  void infinitiesAreRecognised() {
    assertThat(PosDouble.ensuringValid(Double.POSITIVE_INFINITY).isPosInfinity()).isTrue();
    assertThat(NonZeroFloat.ensuringValid(Float.NEGATIVE_INFINITY).isNegInfinity()).isTrue();
    assertThat(PosFloat.MAX_VALUE.isPosInfinity()).isFalse();
  }

  @Test
  void isWholeDetectsIntegralValues() {
    assertThat(PosDouble.of(3.0).isWhole()).isTrue();
    assertThat(PosDouble.of(3.5).isWhole()).isFalse();
    assertThat(PosDouble.MAX_VALUE.isWhole()).isTrue();
    assertThat(PosDouble.ensuringValid(Double.POSITIVE_INFINITY).isWhole()).isFalse();
    assertThat(NonZeroFloat.ensuringValid(Float.NaN).isWhole()).isFalse();
    assertThat(NonZeroFloat.of(-8.0f).isWhole()).isTrue();
  }

  @Test
  void angleConversionsKeepTheirGuarantees() {
    PosDouble halfTurn = PosDouble.ensuringValid(Math.PI);

    assertThat(halfTurn.toDegrees().value()).isEqualTo(Math.toDegrees(Math.PI));
    assertThat(PosDouble.MIN_VALUE.toRadians().value()).isEqualTo(0.0);
    assertThat(NonZeroDouble.of(-180.0).toRadians()).isEqualTo(Math.toRadians(-180.0));
    assertThat(PosZFloat.of(90.0f).toRadians().value()).isEqualTo((float) Math.toRadians(90.0f));
  }

  @Test
  void rangesStepInDecimalArithmetic() {
    NumericRange<Double> range = PosZDouble.of(0.0).to(1.0, 0.1);

    assertThat(range.size()).isEqualTo(11);
    assertThat(range.get(3)).isEqualTo(0.3);
    assertThat(range.get(10)).isEqualTo(1.0);
  }

  @Test
  void ensuringValidOnAFunctionRevalidates() {
    PosFloat value = PosFloat.of(2.0f);

    assertThat(value.ensuringValid(x -> x * 2).value()).isEqualTo(4.0f);
    assertThat(PosZFloat.tryingValid(-1.0f).isBad()).isTrue();
  }
}
