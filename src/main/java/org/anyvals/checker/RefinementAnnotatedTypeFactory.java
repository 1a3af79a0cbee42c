package org.anyvals.checker;

import com.sun.source.tree.BinaryTree;
import com.sun.source.tree.CompoundAssignmentTree;
import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.IdentifierTree;
import com.sun.source.tree.LiteralTree;
import com.sun.source.tree.MemberSelectTree;
import com.sun.source.tree.ParenthesizedTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.TypeCastTree;
import com.sun.source.tree.UnaryTree;
import java.lang.annotation.Annotation;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.type.TypeKind;

import org.anyvals.checker.RefinementLattice.BinaryOperator;
import org.anyvals.checker.qual.Neg;
import org.anyvals.checker.qual.NegZ;
import org.anyvals.checker.qual.NonZero;
import org.anyvals.checker.qual.NumericDigit;
import org.anyvals.checker.qual.Pos;
import org.anyvals.checker.qual.PosZ;
import org.anyvals.checker.qual.RefinementBottom;
import org.anyvals.checker.qual.UnknownRefinement;
import org.anyvals.checker.qual.Zero;
import org.checkerframework.common.basetype.BaseAnnotatedTypeFactory;
import org.checkerframework.common.basetype.BaseTypeChecker;
import org.checkerframework.framework.flow.CFAbstractAnalysis;
import org.checkerframework.framework.flow.CFAnalysis;
import org.checkerframework.framework.flow.CFStore;
import org.checkerframework.framework.flow.CFTransfer;
import org.checkerframework.framework.flow.CFValue;
import org.checkerframework.framework.type.AnnotatedTypeMirror;
import org.checkerframework.framework.type.treeannotator.ListTreeAnnotator;
import org.checkerframework.framework.type.treeannotator.TreeAnnotator;
import org.checkerframework.javacutil.TreeUtils;

/**
 * Type factory for the refinement checker. Numeric constants get the most precise qualifier
 * for their value; arithmetic on refined values keeps a qualifier where the sign of the
 * result is certain. Shifts, bitwise operators and narrowing conversions lose the sign.
 */
public class RefinementAnnotatedTypeFactory extends BaseAnnotatedTypeFactory {

  private RefinementLattice lattice;

  public RefinementAnnotatedTypeFactory(BaseTypeChecker checker) {
    super(checker);
    this.postInit();
  }

  @Override
  protected Set<Class<? extends Annotation>> createSupportedTypeQualifiers() {
    return new LinkedHashSet<>(
        Arrays.asList(
            UnknownRefinement.class,
            NonZero.class,
            PosZ.class,
            NegZ.class,
            Pos.class,
            Neg.class,
            Zero.class,
            NumericDigit.class,
            RefinementBottom.class));
  }

  @Override
  public CFTransfer createFlowTransferFunction(
      CFAbstractAnalysis<CFValue, CFStore, CFTransfer> analysis) {
    return new RefinementTransfer((CFAnalysis) analysis);
  }

  @Override
  protected TreeAnnotator createTreeAnnotator() {
    // Runs before the default annotators so that constants are not widened to a least upper bound.
    return new ListTreeAnnotator(new ConstantTreeAnnotator(this), super.createTreeAnnotator());
  }

  RefinementLattice lattice() {
    if (lattice == null) {
      lattice = new RefinementLattice(this);
    }
    return lattice;
  }

  private class ConstantTreeAnnotator extends TreeAnnotator {

    ConstantTreeAnnotator(RefinementAnnotatedTypeFactory factory) {
      super(factory);
    }

    @Override
    public Void visitLiteral(LiteralTree tree, AnnotatedTypeMirror type) {
      annotateConstant(tree, type);
      return null;
    }

    @Override
    public Void visitParenthesized(ParenthesizedTree tree, AnnotatedTypeMirror type) {
      annotateConstant(tree, type);
      return null;
    }

    @Override
    public Void visitTypeCast(TypeCastTree tree, AnnotatedTypeMirror type) {
      if (annotateConstant(tree, type) || !isNumeric(type)) {
        return null;
      }
      // (int) -4294967295L == 1, (int) 0.5 == 0
      TypeKind source = TreeUtils.typeOf(tree.getExpression()).getKind();
      if (source.isPrimitive() && !isWidening(source, type.getKind())) {
        type.replaceAnnotation(lattice().unknown);
      }
      return null;
    }

    @Override
    public Void visitIdentifier(IdentifierTree tree, AnnotatedTypeMirror type) {
      annotateConstant(tree, type);
      return null;
    }

    @Override
    public Void visitMemberSelect(MemberSelectTree tree, AnnotatedTypeMirror type) {
      annotateConstant(tree, type);
      return null;
    }

    @Override
    public Void visitUnary(UnaryTree tree, AnnotatedTypeMirror type) {
      if (annotateConstant(tree, type) || !isNumeric(type)) {
        return null;
      }
      boolean integral = RefinementLattice.isIntegral(type.getUnderlyingType());
      switch (tree.getKind()) {
        case BITWISE_COMPLEMENT:
          type.replaceAnnotation(lattice().unknown);
          break;
        case UNARY_MINUS:
          {
            AnnotationMirror operand = qualifierOf(tree.getExpression());
            if (operand != null) {
              type.replaceAnnotation(lattice().negation(operand, integral));
            }
            break;
          }
        case PREFIX_INCREMENT:
        case PREFIX_DECREMENT:
          {
            AnnotationMirror operand = qualifierOf(tree.getExpression());
            BinaryOperator operator =
                tree.getKind() == Tree.Kind.PREFIX_INCREMENT ? BinaryOperator.PLUS : BinaryOperator.MINUS;
            // --c on a char holding 0 gives 65535
            boolean narrowed = !keepsWidth(TypeKind.INT, type.getKind());
            type.replaceAnnotation(
                operand == null || narrowed
                    ? lattice().unknown
                    : lattice().arithmetic(operator, operand, lattice().pos, integral));
            break;
          }
        default:
          // unary plus and the postfix forms have the operand's value
          break;
      }
      return null;
    }

    @Override
    public Void visitBinary(BinaryTree tree, AnnotatedTypeMirror type) {
      if (annotateConstant(tree, type) || !isNumeric(type)) {
        return null;
      }
      if (isBitwise(tree.getKind())) {
        // 1 >> 1 == 0, 1 << 31 < 0, 1 & 2 == 0
        type.replaceAnnotation(lattice().unknown);
        return null;
      }
      BinaryOperator operator = arithmeticOperator(tree.getKind());
      if (operator == null) {
        return null;
      }
      AnnotationMirror left = qualifierOf(tree.getLeftOperand());
      AnnotationMirror right = qualifierOf(tree.getRightOperand());
      if (left != null && right != null) {
        boolean integral = RefinementLattice.isIntegral(type.getUnderlyingType());
        type.replaceAnnotation(lattice().arithmetic(operator, left, right, integral));
      }
      return null;
    }

    @Override
    public Void visitCompoundAssignment(CompoundAssignmentTree tree, AnnotatedTypeMirror type) {
      if (!isNumeric(type)) {
        return null;
      }
      BinaryOperator operator = arithmeticOperator(tree.getKind());
      TypeKind operand = TreeUtils.typeOf(tree.getExpression()).getKind();
      // The result is narrowed back to the variable's type: byte b = 0; b -= 200 gives 56.
      if (operator == null || !operand.isPrimitive() || !keepsWidth(operand, type.getKind())) {
        type.replaceAnnotation(lattice().unknown);
        return null;
      }
      AnnotationMirror left = qualifierOf(tree.getVariable());
      AnnotationMirror right = qualifierOf(tree.getExpression());
      if (left == null || right == null) {
        type.replaceAnnotation(lattice().unknown);
        return null;
      }
      boolean integral = RefinementLattice.isIntegral(type.getUnderlyingType());
      type.replaceAnnotation(lattice().arithmetic(operator, left, right, integral));
      return null;
    }

    private boolean annotateConstant(ExpressionTree tree, AnnotatedTypeMirror type) {
      if (!isNumeric(type)) {
        return false;
      }
      Object value = ConstantValues.evaluate(tree);
      if (value == null) {
        return false;
      }
      type.replaceAnnotation(lattice().forConstant(value));
      return true;
    }

    private AnnotationMirror qualifierOf(ExpressionTree tree) {
      return getAnnotatedType(tree).getAnnotationInHierarchy(lattice().unknown);
    }

    private boolean isNumeric(AnnotatedTypeMirror type) {
      TypeKind kind = type.getKind();
      return kind.isPrimitive() && kind != TypeKind.BOOLEAN;
    }

    /** Identity and widening primitive conversions keep the sign of their operand. */
    private boolean isWidening(TypeKind from, TypeKind to) {
      if (from == to) {
        return true;
      }
      switch (from) {
        case BYTE:
          return to != TypeKind.CHAR;
        case SHORT:
        case CHAR:
          return to == TypeKind.INT || to == TypeKind.LONG || to == TypeKind.FLOAT || to == TypeKind.DOUBLE;
        case INT:
          return to == TypeKind.LONG || to == TypeKind.FLOAT || to == TypeKind.DOUBLE;
        case LONG:
          return to == TypeKind.FLOAT || to == TypeKind.DOUBLE;
        case FLOAT:
          return to == TypeKind.DOUBLE;
        default:
          return false;
      }
    }

    /** Whether {@code var op= operand} computes in the type of {@code var}. */
    private boolean keepsWidth(TypeKind operand, TypeKind variable) {
      boolean promoted =
          variable == TypeKind.INT
              || variable == TypeKind.LONG
              || variable == TypeKind.FLOAT
              || variable == TypeKind.DOUBLE;
      return promoted && isWidening(operand, variable);
    }

    private boolean isBitwise(Tree.Kind kind) {
      switch (kind) {
        case LEFT_SHIFT:
        case RIGHT_SHIFT:
        case UNSIGNED_RIGHT_SHIFT:
        case AND:
        case OR:
        case XOR:
          return true;
        default:
          return false;
      }
    }

    private BinaryOperator arithmeticOperator(Tree.Kind kind) {
      switch (kind) {
        case PLUS:
        case PLUS_ASSIGNMENT:
          return BinaryOperator.PLUS;
        case MINUS:
        case MINUS_ASSIGNMENT:
          return BinaryOperator.MINUS;
        case MULTIPLY:
        case MULTIPLY_ASSIGNMENT:
          return BinaryOperator.TIMES;
        case DIVIDE:
        case DIVIDE_ASSIGNMENT:
          return BinaryOperator.DIVIDE;
        case REMAINDER:
        case REMAINDER_ASSIGNMENT:
          return BinaryOperator.MOD;
        default:
          return null;
      }
    }
  }
}
