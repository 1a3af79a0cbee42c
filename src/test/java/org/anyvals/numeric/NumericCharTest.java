package org.anyvals.numeric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NumericCharTest {

  @Test
  void acceptsOnlyDecimalDigits() {
    assertThat(NumericChar.from('0')).isPresent();
    assertThat(NumericChar.from('9')).isPresent();
    assertThat(NumericChar.from('a')).isEmpty();
    assertThat(NumericChar.from('/')).isEmpty();
    assertThat(NumericChar.from(':')).isEmpty();
    assertThat(NumericChar.isValid('5')).isTrue();
  }

  @Test
  void convertsToItsDigit() {
    NumericChar five = NumericChar.of('5');

    assertThat(five.asDigit()).isEqualTo(5);
    assertThat(five.asDigitPosZInt()).isEqualTo(PosZInt.of(5));
    assertThat(five.toInt()).isEqualTo((int) '5');
    assertThat(five.toPosInt().value()).isEqualTo(53);
  }

  @Test
  void rendersTheCharacter() {
    assertThat(NumericChar.of('5')).hasToString("NumericChar(5)");
    assertThat(NumericChar.MIN_VALUE).hasToString("NumericChar(0)");
    assertThat(NumericChar.MAX_VALUE).hasToString("NumericChar(9)");
  }

  @Test
  void ordersAndComparesLikeChar() {
    NumericChar one = NumericChar.of('1');
    NumericChar two = NumericChar.of('2');

    assertThat(one).isLessThan(two);
    assertThat(one.max(two)).isSameAs(two);
    assertThat(one.lt('2')).isTrue();
    assertThat(one).isEqualTo(NumericChar.ensuringValid('1'));
  }

  @Test
  void failurePaths() {
    assertThatThrownBy(() -> NumericChar.ensuringValid('x'))
        .isInstanceOf(AssertionError.class)
        .hasMessage("x was not a valid NumericChar");
    assertThat(NumericChar.fromOrElse('x', NumericChar.MIN_VALUE)).isSameAs(NumericChar.MIN_VALUE);
    assertThat(NumericChar.goodOrElse('x', c -> "not a digit: " + c).getBad()).isEqualTo("not a digit: x");
    assertThat(NumericChar.passOrElse('x', c -> c).error()).isEqualTo('x');
  }

  @Test
  void mappingMustStayADigit() {
    NumericChar three = NumericChar.of('3');

    assertThat(three.ensuringValid(c -> c + 1)).isEqualTo(NumericChar.of('4'));
    assertThatThrownBy(() -> three.ensuringValid(c -> c + 10)).isInstanceOf(AssertionError.class);
  }
}
