package org.anyvals.checker;

import com.sun.source.tree.BinaryTree;
import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.LiteralTree;
import com.sun.source.tree.ParenthesizedTree;
import com.sun.source.tree.PrimitiveTypeTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.TypeCastTree;
import com.sun.source.tree.UnaryTree;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.TypeKind;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.TreeUtils;

/**
 * Evaluates the numeric expressions whose value is fixed at compile time: literals, unary and
 * binary operators applied to constants, primitive casts of those, and references to constant
 * fields or locals such as {@code Integer.MAX_VALUE}. Operators follow the Java promotion and
 * overflow rules, so {@code Integer.MAX_VALUE + 1} evaluates to {@code Integer.MIN_VALUE}.
 */
final class ConstantValues {

  private ConstantValues() {}

  /**
   * Returns the value of {@code tree} as a boxed {@link Number} or {@link Character}, or
   * {@code null} if it is not a numeric constant.
   */
  static @Nullable Object evaluate(ExpressionTree tree) {
    switch (tree.getKind()) {
      case INT_LITERAL:
      case LONG_LITERAL:
      case FLOAT_LITERAL:
      case DOUBLE_LITERAL:
      case CHAR_LITERAL:
        return ((LiteralTree) tree).getValue();

      case PARENTHESIZED:
        return evaluate(((ParenthesizedTree) tree).getExpression());

      case UNARY_MINUS:
        {
          Object operand = evaluate(((UnaryTree) tree).getExpression());
          return operand == null ? null : negate(operand);
        }

      case UNARY_PLUS:
        {
          Object operand = evaluate(((UnaryTree) tree).getExpression());
          return operand == null ? null : promote(operand);
        }

      case BITWISE_COMPLEMENT:
        {
          Object operand = evaluate(((UnaryTree) tree).getExpression());
          return operand == null ? null : complement(operand);
        }

      case PLUS:
      case MINUS:
      case MULTIPLY:
      case DIVIDE:
      case REMAINDER:
      case LEFT_SHIFT:
      case RIGHT_SHIFT:
      case UNSIGNED_RIGHT_SHIFT:
      case AND:
      case OR:
      case XOR:
        {
          BinaryTree binary = (BinaryTree) tree;
          Object left = evaluate(binary.getLeftOperand());
          Object right = left == null ? null : evaluate(binary.getRightOperand());
          return right == null ? null : fold(tree.getKind(), left, right);
        }

      case TYPE_CAST:
        {
          TypeCastTree cast = (TypeCastTree) tree;
          if (cast.getType().getKind() != Tree.Kind.PRIMITIVE_TYPE) {
            return null;
          }
          Object operand = evaluate(cast.getExpression());
          return operand == null
              ? null
              : convert(operand, ((PrimitiveTypeTree) cast.getType()).getPrimitiveTypeKind());
        }

      case IDENTIFIER:
      case MEMBER_SELECT:
        {
          Element element = TreeUtils.elementFromTree(tree);
          if (element == null
              || (element.getKind() != ElementKind.FIELD
                  && element.getKind() != ElementKind.LOCAL_VARIABLE)) {
            return null;
          }
          Object value = ((VariableElement) element).getConstantValue();
          return value instanceof Number || value instanceof Character ? value : null;
        }

      default:
        return null;
    }
  }

  static boolean isConstant(ExpressionTree tree) {
    return evaluate(tree) != null;
  }

  // Unary operators promote byte, short and char to int.
  private static Object promote(Object value) {
    if (value instanceof Character) {
      return (int) (Character) value;
    }
    if (value instanceof Byte || value instanceof Short) {
      return ((Number) value).intValue();
    }
    return value;
  }

  private static Object negate(Object value) {
    Object promoted = promote(value);
    if (promoted instanceof Integer) {
      return -(Integer) promoted;
    } else if (promoted instanceof Long) {
      return -(Long) promoted;
    } else if (promoted instanceof Float) {
      return -(Float) promoted;
    }
    return -(Double) promoted;
  }

  private static @Nullable Object complement(Object value) {
    Object promoted = promote(value);
    if (promoted instanceof Integer) {
      return ~(Integer) promoted;
    } else if (promoted instanceof Long) {
      return ~(Long) promoted;
    }
    return null;
  }

  private static @Nullable Object fold(Tree.Kind kind, Object left, Object right) {
    Object l = promote(left);
    Object r = promote(right);
    switch (kind) {
      case LEFT_SHIFT:
      case RIGHT_SHIFT:
      case UNSIGNED_RIGHT_SHIFT:
        // Each operand is promoted on its own and the count is masked by the shift itself.
        if (!(r instanceof Integer || r instanceof Long)) {
          return null;
        }
        return shift(kind, l, ((Number) r).intValue());
      default:
        break;
    }
    if (l instanceof Double || r instanceof Double) {
      return foldDouble(kind, ((Number) l).doubleValue(), ((Number) r).doubleValue());
    } else if (l instanceof Float || r instanceof Float) {
      return foldFloat(kind, ((Number) l).floatValue(), ((Number) r).floatValue());
    } else if (l instanceof Long || r instanceof Long) {
      return foldLong(kind, ((Number) l).longValue(), ((Number) r).longValue());
    }
    return foldInt(kind, ((Number) l).intValue(), ((Number) r).intValue());
  }

  private static @Nullable Object shift(Tree.Kind kind, Object value, int count) {
    if (value instanceof Integer) {
      int i = (Integer) value;
      switch (kind) {
        case LEFT_SHIFT:
          return i << count;
        case RIGHT_SHIFT:
          return i >> count;
        default:
          return i >>> count;
      }
    } else if (value instanceof Long) {
      long l = (Long) value;
      switch (kind) {
        case LEFT_SHIFT:
          return l << count;
        case RIGHT_SHIFT:
          return l >> count;
        default:
          return l >>> count;
      }
    }
    return null;
  }

  // Integral division by zero throws, so it is not a constant.
  private static @Nullable Object foldInt(Tree.Kind kind, int a, int b) {
    switch (kind) {
      case PLUS:
        return a + b;
      case MINUS:
        return a - b;
      case MULTIPLY:
        return a * b;
      case DIVIDE:
        return b == 0 ? null : a / b;
      case REMAINDER:
        return b == 0 ? null : a % b;
      case AND:
        return a & b;
      case OR:
        return a | b;
      case XOR:
        return a ^ b;
      default:
        return null;
    }
  }

  private static @Nullable Object foldLong(Tree.Kind kind, long a, long b) {
    switch (kind) {
      case PLUS:
        return a + b;
      case MINUS:
        return a - b;
      case MULTIPLY:
        return a * b;
      case DIVIDE:
        return b == 0 ? null : a / b;
      case REMAINDER:
        return b == 0 ? null : a % b;
      case AND:
        return a & b;
      case OR:
        return a | b;
      case XOR:
        return a ^ b;
      default:
        return null;
    }
  }

  private static @Nullable Object foldFloat(Tree.Kind kind, float a, float b) {
    switch (kind) {
      case PLUS:
        return a + b;
      case MINUS:
        return a - b;
      case MULTIPLY:
        return a * b;
      case DIVIDE:
        return a / b;
      case REMAINDER:
        return a % b;
      default:
        return null;
    }
  }

  private static @Nullable Object foldDouble(Tree.Kind kind, double a, double b) {
    switch (kind) {
      case PLUS:
        return a + b;
      case MINUS:
        return a - b;
      case MULTIPLY:
        return a * b;
      case DIVIDE:
        return a / b;
      case REMAINDER:
        return a % b;
      default:
        return null;
    }
  }

  private static @Nullable Object convert(Object value, TypeKind target) {
    if (value instanceof Float || value instanceof Double) {
      double d = ((Number) value).doubleValue();
      switch (target) {
        case BYTE:
          return (byte) d;
        case SHORT:
          return (short) d;
        case CHAR:
          return (char) d;
        case INT:
          return (int) d;
        case LONG:
          return (long) d;
        case FLOAT:
          return (float) d;
        case DOUBLE:
          return d;
        default:
          return null;
      }
    }
    long l = value instanceof Character ? (Character) value : ((Number) value).longValue();
    switch (target) {
      case BYTE:
        return (byte) l;
      case SHORT:
        return (short) l;
      case CHAR:
        return (char) l;
      case INT:
        return (int) l;
      case LONG:
        return l;
      case FLOAT:
        return (float) l;
      case DOUBLE:
        return (double) l;
      default:
        return null;
    }
  }
}
