package org.anyvals.numeric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class NumericRangeTest {

  @Test
  void inclusiveAndExclusiveEnds() {
    assertThat(PosInt.of(1).to(5)).containsExactly(1, 2, 3, 4, 5);
    assertThat(PosInt.of(1).until(5)).containsExactly(1, 2, 3, 4);
    assertThat(PosInt.of(3).until(3)).isEmpty();
    assertThat(PosInt.of(3).to(3)).containsExactly(3);
  }

  @Test
  void honoursTheStepInBothDirections() {
    assertThat(PosInt.of(1).to(10, 3)).containsExactly(1, 4, 7, 10);
    assertThat(PosInt.of(1).until(10, 3)).containsExactly(1, 4, 7);
    assertThat(PosInt.of(5).to(1, -2)).containsExactly(5, 3, 1);
    assertThat(PosLong.of(10L).until(0L, -5L)).containsExactly(10L, 5L);
  }

  @Test
  void isEmptyWhenTheStepPointsAway() {
    NumericRange<Integer> range = PosInt.of(5).to(1);

    assertThat(range.isEmpty()).isTrue();
    assertThat(range.size()).isZero();
  }

  @Test
  void rejectsAZeroStep() {
    assertThatThrownBy(() -> PosInt.of(1).to(5, 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("step cannot be 0");
    assertThatThrownBy(() -> PosDouble.of(1.0).to(2.0, 0.0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNonFiniteBounds() {
    PosDouble infinity = PosDouble.ensuringValid(Double.POSITIVE_INFINITY);

    assertThatThrownBy(() -> infinity.to(1.0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PosDouble.of(1.0).until(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsRangesLongerThanALong() {
    assertThatThrownBy(() -> NumericRange.ofLongs(Long.MIN_VALUE, Long.MAX_VALUE, 1L, true))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(NumericRange.ofLongs(Long.MIN_VALUE, Long.MAX_VALUE, Long.MAX_VALUE, true).size()).isEqualTo(3);
  }

  @Test
  void doesNotOverflowNearTheIntLimits() {
    assertThat(PosInt.of(Integer.MAX_VALUE - 2).to(Integer.MAX_VALUE)).containsExactly(
        Integer.MAX_VALUE - 2, Integer.MAX_VALUE - 1, Integer.MAX_VALUE);
  }

  @Test
  void floatingRangesHaveNoAccumulatedError() {
    assertThat(PosZFloat.of(0.0f).to(0.5f, 0.1f)).containsExactly(0.0f, 0.1f, 0.2f, 0.3f, 0.4f, 0.5f);
    assertThat(PosZDouble.of(0.0).until(1.0, 0.25)).containsExactly(0.0, 0.25, 0.5, 0.75);
  }

  @Test
  void isRestartable() {
    NumericRange<Integer> range = PosInt.of(1).to(3);
    List<Integer> first = new ArrayList<>();
    range.forEach(first::add);

    assertThat(range.toList()).isEqualTo(first);
    assertThat(range.stream().collect(Collectors.toList())).isEqualTo(first);
  }

  @Test
  void indexesElements() {
    NumericRange<Integer> range = PosInt.of(2).to(20, 2);

    assertThat(range.get(0)).isEqualTo(2);
    assertThat(range.get(9)).isEqualTo(20);
    assertThatThrownBy(() -> range.get(10)).isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> range.get(-1)).isInstanceOf(IndexOutOfBoundsException.class);
  }

  @Test
  void describesItself() {
    assertThat(PosInt.of(1).to(5)).hasToString("NumericRange(1 to 5 by 1)");
    assertThat(PosInt.of(1).until(5, 2)).hasToString("NumericRange(1 until 5 by 2)");
  }
}
