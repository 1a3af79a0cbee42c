package org.anyvals.checker;

import java.lang.annotation.Annotation;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;

import org.anyvals.checker.qual.Neg;
import org.anyvals.checker.qual.NegZ;
import org.anyvals.checker.qual.NonZero;
import org.anyvals.checker.qual.NumericDigit;
import org.anyvals.checker.qual.Pos;
import org.anyvals.checker.qual.PosZ;
import org.anyvals.checker.qual.RefinementBottom;
import org.anyvals.checker.qual.UnknownRefinement;
import org.anyvals.checker.qual.Zero;
import org.checkerframework.framework.type.AnnotatedTypeFactory;
import org.checkerframework.framework.type.QualifierHierarchy;
import org.checkerframework.javacutil.AnnotationBuilder;
import org.checkerframework.javacutil.AnnotationUtils;

/**
 * Sign reasoning over the refinement qualifiers, shared by the tree annotator and the
 * dataflow transfer function.
 *
 * <p>Integral arithmetic wraps on overflow and floating point arithmetic can produce
 * infinities, NaN and underflow to zero, so most operators only keep a precise qualifier
 * when one operand is {@code @Zero}.
 */
final class RefinementLattice {

  enum Comparison {
    /** == */
    EQ,
    /** != */
    NE,
    /** < */
    LT,
    /** <= */
    LE,
    /** > */
    GT,
    /** >= */
    GE
  }

  enum BinaryOperator {
    /** + */
    PLUS,
    /** - */
    MINUS,
    /** * */
    TIMES,
    /** / */
    DIVIDE,
    /** % */
    MOD
  }

  private final AnnotatedTypeFactory factory;

  final AnnotationMirror unknown;
  final AnnotationMirror nonZero;
  final AnnotationMirror posZ;
  final AnnotationMirror negZ;
  final AnnotationMirror pos;
  final AnnotationMirror neg;
  final AnnotationMirror zero;
  final AnnotationMirror digit;
  final AnnotationMirror bottom;

  RefinementLattice(AnnotatedTypeFactory factory) {
    this.factory = factory;
    this.unknown = reflect(UnknownRefinement.class);
    this.nonZero = reflect(NonZero.class);
    this.posZ = reflect(PosZ.class);
    this.negZ = reflect(NegZ.class);
    this.pos = reflect(Pos.class);
    this.neg = reflect(Neg.class);
    this.zero = reflect(Zero.class);
    this.digit = reflect(NumericDigit.class);
    this.bottom = reflect(RefinementBottom.class);
  }

  // ========================================================================
  // Constants

  /**
   * The most precise qualifier for a constant. NaN is {@code @NonZero}; integral constants
   * from 48 to 57 are {@code @NumericDigit}.
   */
  AnnotationMirror forConstant(Object value) {
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d)) {
        return nonZero;
      }
      return d > 0 ? pos : d < 0 ? neg : zero;
    }
    long l = value instanceof Character ? (Character) value : ((Number) value).longValue();
    if (l >= '0' && l <= '9') {
      return digit;
    }
    return l > 0 ? pos : l < 0 ? neg : zero;
  }

  static boolean isIntegral(TypeMirror type) {
    TypeKind kind = type.getKind();
    return kind == TypeKind.BYTE
        || kind == TypeKind.SHORT
        || kind == TypeKind.CHAR
        || kind == TypeKind.INT
        || kind == TypeKind.LONG;
  }

  // ========================================================================
  // Comparisons

  /**
   * Assuming that {@code lhs op rhs} holds, refines what is known about the left-hand side.
   * The result is never above {@code lhs} in the lattice.
   */
  AnnotationMirror refineLhsOfComparison(Comparison operator, AnnotationMirror lhs, AnnotationMirror rhs) {
    AnnotationMirror right = normalize(rhs);
    switch (operator) {
      case EQ:
        return glb(lhs, rhs);

      case NE:
        if (equal(right, zero)) {
          return glb(lhs, nonZero);
        }
        return lhs;

      case LT:
        // x < y <= 0
        if (isOneOf(right, zero, negZ, neg)) {
          return glb(lhs, neg);
        }
        return lhs;

      case LE:
        if (equal(right, neg)) {
          return glb(lhs, neg);
        }
        if (isOneOf(right, zero, negZ)) {
          return glb(lhs, negZ);
        }
        return lhs;

      case GT:
        // x > y >= 0
        if (isOneOf(right, zero, posZ, pos)) {
          return glb(lhs, pos);
        }
        return lhs;

      case GE:
        if (equal(right, pos)) {
          return glb(lhs, pos);
        }
        if (isOneOf(right, zero, posZ)) {
          return glb(lhs, posZ);
        }
        return lhs;

      default:
        return lhs;
    }
  }

  /** `x op y` == `y flip(op) x` */
  static Comparison flip(Comparison op) {
    switch (op) {
      case EQ:
        return Comparison.EQ;
      case NE:
        return Comparison.NE;
      case LT:
        return Comparison.GT;
      case LE:
        return Comparison.GE;
      case GT:
        return Comparison.LT;
      case GE:
        return Comparison.LE;
      default:
        throw new IllegalArgumentException(op.toString());
    }
  }

  /** `x op y` == `!(x negate(op) y)`, for operands that cannot be NaN */
  static Comparison negate(Comparison op) {
    switch (op) {
      case EQ:
        return Comparison.NE;
      case NE:
        return Comparison.EQ;
      case LT:
        return Comparison.GE;
      case LE:
        return Comparison.GT;
      case GT:
        return Comparison.LE;
      case GE:
        return Comparison.LT;
      default:
        throw new IllegalArgumentException(op.toString());
    }
  }

  // ========================================================================
  // Arithmetic

  /** The qualifier of {@code -x}. */
  AnnotationMirror negation(AnnotationMirror operand, boolean integral) {
    AnnotationMirror x = normalize(operand);
    if (equal(x, pos)) {
      return neg;
    }
    if (equal(x, posZ)) {
      return negZ;
    }
    if (isOneOf(x, zero, nonZero, bottom)) {
      return x;
    }
    // -MIN_VALUE == MIN_VALUE
    if (integral) {
      return unknown;
    }
    if (equal(x, neg)) {
      return pos;
    }
    if (equal(x, negZ)) {
      return posZ;
    }
    return unknown;
  }

  /** The qualifier of {@code lhs op rhs}, for operands of integral or floating point type. */
  AnnotationMirror arithmetic(
      BinaryOperator operator, AnnotationMirror lhs, AnnotationMirror rhs, boolean integral) {
    AnnotationMirror left = normalize(lhs);
    AnnotationMirror right = normalize(rhs);
    if (equal(left, bottom) || equal(right, bottom)) {
      return bottom;
    }
    switch (operator) {
      case PLUS:
        if (equal(left, zero)) {
          return right; // Zero + X => X
        }
        if (equal(right, zero)) {
          return left; // X + Zero => X
        }
        return integral ? unknown : floatingSum(left, right);

      case MINUS:
        if (equal(right, zero)) {
          return left;
        }
        if (equal(left, zero)) {
          return negation(right, integral);
        }
        return integral ? unknown : floatingSum(left, negation(right, false));

      case TIMES:
        if (integral) {
          return equal(left, zero) || equal(right, zero) ? zero : unknown;
        }
        if (equal(left, zero) && equal(right, zero)) {
          return zero;
        }
        // 0 * Infinity is NaN
        if (mayBeZero(left) || mayBeZero(right) || mayBeNaN(left) || mayBeNaN(right)) {
          return unknown;
        }
        // the product of two tiny values underflows to zero
        Set<Integer> productSigns = new HashSet<>();
        productSigns.add(0);
        for (int s1 : getPossibleSigns(left)) {
          for (int s2 : getPossibleSigns(right)) {
            productSigns.add(s1 * s2);
          }
        }
        return signSetToAnnotation(productSigns);

      case DIVIDE:
        if (mayBeZero(right) || mayBeNaN(right)) {
          return unknown;
        }
        if (equal(left, zero)) {
          return zero;
        }
        if (!integral) {
          // Infinity / Infinity is NaN
          return unknown;
        }
        if (equal(right, pos)) {
          // truncation toward zero keeps the sign of the dividend or yields zero
          if (isOneOf(left, pos, posZ)) {
            return posZ;
          }
          if (isOneOf(left, neg, negZ)) {
            return negZ;
          }
        }
        return unknown;

      case MOD:
        if (!integral || mayBeZero(right)) {
          return unknown;
        }
        // the remainder takes the sign of the dividend
        if (isOneOf(left, pos, posZ)) {
          return posZ;
        }
        if (isOneOf(left, neg, negZ)) {
          return negZ;
        }
        if (equal(left, zero)) {
          return zero;
        }
        return unknown;

      default:
        return unknown;
    }
  }

  // Sum of two floating point values that are known not to be NaN. +Infinity + -Infinity is NaN.
  private AnnotationMirror floatingSum(AnnotationMirror left, AnnotationMirror right) {
    if (mayBeNaN(left) || mayBeNaN(right)) {
      return unknown;
    }
    if (isOneOf(left, pos, posZ, zero) && isOneOf(right, pos, posZ, zero)) {
      return equal(left, pos) || equal(right, pos) ? pos : posZ;
    }
    if (isOneOf(left, neg, negZ, zero) && isOneOf(right, neg, negZ, zero)) {
      return equal(left, neg) || equal(right, neg) ? neg : negZ;
    }
    return unknown;
  }

  private boolean mayBeZero(AnnotationMirror ann) {
    return isOneOf(ann, zero, posZ, negZ, unknown);
  }

  private boolean mayBeNaN(AnnotationMirror ann) {
    return isOneOf(ann, nonZero, unknown);
  }

  // Helper: return the set of possible signs.
  // We use -1 for negative, 0 for zero, and 1 for positive.
  private Set<Integer> getPossibleSigns(AnnotationMirror ann) {
    if (equal(ann, zero)) {
      return Collections.singleton(0);
    } else if (equal(ann, pos)) {
      return Collections.singleton(1);
    } else if (equal(ann, neg)) {
      return Collections.singleton(-1);
    } else if (equal(ann, posZ)) {
      return new HashSet<>(Arrays.asList(0, 1));
    } else if (equal(ann, negZ)) {
      return new HashSet<>(Arrays.asList(-1, 0));
    } else if (equal(ann, nonZero)) {
      return new HashSet<>(Arrays.asList(-1, 1));
    }
    return new HashSet<>(Arrays.asList(-1, 0, 1));
  }

  // Helper: map a set of possible signs to an annotation.
  private AnnotationMirror signSetToAnnotation(Set<Integer> signs) {
    if (signs.equals(Collections.singleton(1))) {
      return pos;
    } else if (signs.equals(Collections.singleton(-1))) {
      return neg;
    } else if (signs.equals(Collections.singleton(0))) {
      return zero;
    } else if (signs.equals(new HashSet<>(Arrays.asList(0, 1)))) {
      return posZ;
    } else if (signs.equals(new HashSet<>(Arrays.asList(-1, 0)))) {
      return negZ;
    }
    return unknown;
  }

  // ========================================================================
  // Useful helpers

  /** Sign reasoning treats a digit like any other positive value. */
  private AnnotationMirror normalize(AnnotationMirror ann) {
    return equal(ann, digit) ? pos : ann;
  }

  private boolean isOneOf(AnnotationMirror ann, AnnotationMirror... candidates) {
    for (AnnotationMirror candidate : candidates) {
      if (equal(ann, candidate)) {
        return true;
      }
    }
    return false;
  }

  /** Compute the greatest-lower-bound of two points in the lattice */
  AnnotationMirror glb(AnnotationMirror x, AnnotationMirror y) {
    return hierarchy().greatestLowerBoundQualifiersOnly(x, y);
  }

  /** Determine whether two AnnotationMirrors are the same point in the lattice */
  static boolean equal(AnnotationMirror x, AnnotationMirror y) {
    return AnnotationUtils.areSame(x, y);
  }

  private QualifierHierarchy hierarchy() {
    return factory.getQualifierHierarchy();
  }

  /** Convert a "Class" object (e.g. "Pos.class") to a point in the lattice */
  private AnnotationMirror reflect(Class<? extends Annotation> qualifier) {
    Elements elements = factory.getProcessingEnv().getElementUtils();
    return AnnotationBuilder.fromClass(elements, qualifier);
  }
}
