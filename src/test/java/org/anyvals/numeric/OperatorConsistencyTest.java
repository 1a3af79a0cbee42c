package org.anyvals.numeric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

/**
 * Every operator must give the same result as the Java operator applied to the underlying
 * primitive.
 */
class OperatorConsistencyTest {

  private final Random random = new Random(20240601L);

  @RepeatedTest(50)
  void intBackedOperatorsMatchThePrimitive() {
    int a = 1 + random.nextInt(Integer.MAX_VALUE);
    PosInt v = PosInt.ensuringValid(a);
    byte b = (byte) random.nextInt();
    short s = (short) random.nextInt();
    char c = (char) random.nextInt();
    int i = random.nextInt();
    long l = random.nextLong();
    float f = random.nextFloat() * 1000 - 500;
    double d = random.nextDouble() * 1000 - 500;

    assertThat(v.plus(b)).isEqualTo(a + b);
    assertThat(v.plus(s)).isEqualTo(a + s);
    assertThat(v.plus(c)).isEqualTo(a + c);
    assertThat(v.plus(i)).isEqualTo(a + i);
    assertThat(v.plus(l)).isEqualTo(a + l);
    assertThat(v.plus(f)).isEqualTo(a + f);
    assertThat(v.plus(d)).isEqualTo(a + d);

    assertThat(v.minus(i)).isEqualTo(a - i);
    assertThat(v.minus(l)).isEqualTo(a - l);
    assertThat(v.times(i)).isEqualTo(a * i);
    assertThat(v.times(l)).isEqualTo(a * l);
    assertThat(v.times(f)).isEqualTo(a * f);
    if (i != 0) {
      assertThat(v.div(i)).isEqualTo(a / i);
      assertThat(v.rem(i)).isEqualTo(a % i);
    }
    assertThat(v.div(d)).isEqualTo(a / d);
    assertThat(v.rem(f)).isEqualTo(a % f);

    assertThat(v.lt(i)).isEqualTo(a < i);
    assertThat(v.le(l)).isEqualTo(a <= l);
    assertThat(v.gt(f)).isEqualTo(a > f);
    assertThat(v.ge(c)).isEqualTo(a >= c);

    assertThat(v.or(b)).isEqualTo(a | b);
    assertThat(v.and(s)).isEqualTo(a & s);
    assertThat(v.xor(l)).isEqualTo(a ^ l);
    assertThat(v.shiftLeft(i)).isEqualTo(a << i);
    assertThat(v.shiftRight(l)).isEqualTo(a >> l);
    assertThat(v.unsignedShiftRight(i)).isEqualTo(a >>> i);

    assertThat(v.unaryMinus()).isEqualTo(-a);
    assertThat(v.bitwiseNot()).isEqualTo(~a);
    assertThat(v.toByte()).isEqualTo((byte) a);
    assertThat(v.toChar()).isEqualTo((char) a);
    assertThat(v.toFloat()).isEqualTo((float) a);
  }

  @RepeatedTest(50)
  void longBackedOperatorsMatchThePrimitive() {
    long a = random.nextLong();
    if (a == 0) {
      a = 1;
    }
    NonZeroLong v = NonZeroLong.ensuringValid(a);
    int i = random.nextInt();
    long l = random.nextLong();
    double d = random.nextGaussian();

    assertThat(v.plus(i)).isEqualTo(a + i);
    assertThat(v.minus(l)).isEqualTo(a - l);
    assertThat(v.times(l)).isEqualTo(a * l);
    assertThat(v.div(d)).isEqualTo(a / d);
    if (i != 0) {
      assertThat(v.rem(i)).isEqualTo(a % i);
    }
    assertThat(v.gt(d)).isEqualTo(a > d);
    assertThat(v.xor(i)).isEqualTo(a ^ i);
    assertThat(v.shiftLeft(i)).isEqualTo(a << i);
    assertThat(v.unsignedShiftRight(l)).isEqualTo(a >>> l);
    assertThat(v.toInt()).isEqualTo((int) a);
    assertThat(v.toFloat()).isEqualTo((float) a);
  }

  @RepeatedTest(50)
  void floatBackedOperatorsMatchThePrimitive() {
    float a = random.nextFloat() * 1e6f;
    PosZFloat v = PosZFloat.ensuringValid(a);
    short s = (short) random.nextInt();
    long l = random.nextLong();
    float f = random.nextFloat() - 0.5f;
    double d = random.nextDouble();

    assertThat(v.plus(s)).isEqualTo(a + s);
    assertThat(v.minus(l)).isEqualTo(a - l);
    assertThat(v.times(f)).isEqualTo(a * f);
    assertThat(v.div(f)).isEqualTo(a / f);
    assertThat(v.rem(d)).isEqualTo(a % d);
    assertThat(v.le(f)).isEqualTo(a <= f);
    assertThat(v.unaryMinus()).isEqualTo(-a);
    assertThat(v.toInt()).isEqualTo((int) a);
    assertThat(v.toLong()).isEqualTo((long) a);
  }

  @RepeatedTest(50)
  void doubleBackedOperatorsMatchThePrimitive() {
    double a = random.nextGaussian() * 1e9;
    if (a == 0) {
      a = 1;
    }
    NonZeroDouble v = NonZeroDouble.ensuringValid(a);
    byte b = (byte) random.nextInt();
    int i = random.nextInt();
    float f = random.nextFloat();
    double d = random.nextDouble() - 0.5;

    assertThat(v.plus(b)).isEqualTo(a + b);
    assertThat(v.minus(f)).isEqualTo(a - f);
    assertThat(v.times(i)).isEqualTo(a * i);
    assertThat(v.div(d)).isEqualTo(a / d);
    assertThat(v.rem(i)).isEqualTo(a % i);
    assertThat(v.lt(d)).isEqualTo(a < d);
    assertThat(v.toShort()).isEqualTo((short) a);
    assertThat(v.toFloat()).isEqualTo((float) a);
  }

  @Test
  void charBackedOperatorsPromoteToInt() {
    NumericChar seven = NumericChar.of('7');

    assertThat(seven.plus(1)).isEqualTo('7' + 1);
    assertThat(seven.minus('0')).isEqualTo(7);
    assertThat(seven.times(2L)).isEqualTo('7' * 2L);
    assertThat(seven.div(2.0)).isEqualTo('7' / 2.0);
    assertThat(seven.or(0x100)).isEqualTo('7' | 0x100);
    assertThat(seven.shiftLeft(1)).isEqualTo('7' << 1);
    assertThat(seven.unaryMinus()).isEqualTo(-'7');
    assertThat(seven.concat("!")).isEqualTo("7!");
  }

  @Test
  void integerOverflowWrapsLikeThePrimitive() {
    assertThat(PosInt.MAX_VALUE.plus(1)).isEqualTo(Integer.MIN_VALUE);
    assertThat(PosLong.MAX_VALUE.times(2)).isEqualTo(Long.MAX_VALUE * 2);
    assertThat(NegInt.MIN_VALUE.unaryMinus()).isEqualTo(Integer.MIN_VALUE);
  }

  @Test
  void divisionByZeroFollowsThePrimitive() {
    assertThatThrownBy(() -> PosInt.of(1).div(0)).isInstanceOf(ArithmeticException.class);
    assertThatThrownBy(() -> PosLong.of(1L).rem(0L)).isInstanceOf(ArithmeticException.class);
    assertThat(PosInt.of(1).div(0.0)).isEqualTo(Double.POSITIVE_INFINITY);
    assertThat(PosZFloat.of(0.0f).div(0.0f)).isNaN();
  }

  @Test
  void unaryPlusReturnsTheSameInstance() {
    PosInt five = PosInt.of(5);

    assertThat(five.unaryPlus()).isSameAs(five);
    assertThat(five.concat(" apples")).isEqualTo("5 apples");
    assertThat(PosInt.of(255).toHexString()).isEqualTo("ff");
  }
}
