package org.anyvals.checker;

import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.Tree;
import java.util.Set;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.type.TypeKind;

import org.anyvals.checker.RefinementLattice.BinaryOperator;
import org.anyvals.checker.RefinementLattice.Comparison;
import org.checkerframework.dataflow.analysis.ConditionalTransferResult;
import org.checkerframework.dataflow.analysis.RegularTransferResult;
import org.checkerframework.dataflow.analysis.TransferInput;
import org.checkerframework.dataflow.analysis.TransferResult;
import org.checkerframework.dataflow.cfg.node.BinaryOperationNode;
import org.checkerframework.dataflow.cfg.node.BitwiseAndNode;
import org.checkerframework.dataflow.cfg.node.BitwiseComplementNode;
import org.checkerframework.dataflow.cfg.node.BitwiseOrNode;
import org.checkerframework.dataflow.cfg.node.BitwiseXorNode;
import org.checkerframework.dataflow.cfg.node.EqualToNode;
import org.checkerframework.dataflow.cfg.node.FloatingDivisionNode;
import org.checkerframework.dataflow.cfg.node.FloatingRemainderNode;
import org.checkerframework.dataflow.cfg.node.GreaterThanNode;
import org.checkerframework.dataflow.cfg.node.GreaterThanOrEqualNode;
import org.checkerframework.dataflow.cfg.node.IntegerDivisionNode;
import org.checkerframework.dataflow.cfg.node.IntegerRemainderNode;
import org.checkerframework.dataflow.cfg.node.LeftShiftNode;
import org.checkerframework.dataflow.cfg.node.LessThanNode;
import org.checkerframework.dataflow.cfg.node.LessThanOrEqualNode;
import org.checkerframework.dataflow.cfg.node.NarrowingConversionNode;
import org.checkerframework.dataflow.cfg.node.Node;
import org.checkerframework.dataflow.cfg.node.NotEqualNode;
import org.checkerframework.dataflow.cfg.node.NumericalAdditionNode;
import org.checkerframework.dataflow.cfg.node.NumericalMinusNode;
import org.checkerframework.dataflow.cfg.node.NumericalMultiplicationNode;
import org.checkerframework.dataflow.cfg.node.NumericalSubtractionNode;
import org.checkerframework.dataflow.cfg.node.SignedRightShiftNode;
import org.checkerframework.dataflow.cfg.node.UnsignedRightShiftNode;
import org.checkerframework.dataflow.expression.JavaExpression;
import org.checkerframework.framework.flow.CFAnalysis;
import org.checkerframework.framework.flow.CFStore;
import org.checkerframework.framework.flow.CFTransfer;
import org.checkerframework.framework.flow.CFValue;
import org.checkerframework.framework.type.QualifierHierarchy;

/**
 * Refines the sign of numeric variables through comparisons, and computes the sign of the
 * result of arithmetic, so that a value checked with {@code if (x > 0)} can be passed where a
 * {@code @Pos} value is expected.
 */
public class RefinementTransfer extends CFTransfer {

  private final RefinementLattice lattice;

  public RefinementTransfer(CFAnalysis analysis) {
    super(analysis);
    this.lattice = ((RefinementAnnotatedTypeFactory) analysis.getTypeFactory()).lattice();
  }

  private TransferResult<CFValue, CFStore> implementComparison(
      Comparison op, BinaryOperationNode n, TransferResult<CFValue, CFStore> out) {
    AnnotationMirror l = findAnnotation(n.getLeftOperand());
    AnnotationMirror r = findAnnotation(n.getRightOperand());

    if (l == null || r == null) {
      // this can happen for generic types
      return out;
    }

    CFStore thenStore = out.getThenStore().copy();
    CFStore elseStore = out.getElseStore().copy();

    thenStore.insertValue(
        JavaExpression.fromNode(n.getLeftOperand()), lattice.refineLhsOfComparison(op, l, r));
    thenStore.insertValue(
        JavaExpression.fromNode(n.getRightOperand()),
        lattice.refineLhsOfComparison(RefinementLattice.flip(op), r, l));

    // Every ordering comparison with NaN is false, so a failed floating point
    // comparison proves nothing.
    boolean orderedElse =
        op == Comparison.EQ
            || op == Comparison.NE
            || (RefinementLattice.isIntegral(n.getLeftOperand().getType())
                && RefinementLattice.isIntegral(n.getRightOperand().getType()));
    if (orderedElse) {
      Comparison negated = RefinementLattice.negate(op);
      elseStore.insertValue(
          JavaExpression.fromNode(n.getLeftOperand()), lattice.refineLhsOfComparison(negated, l, r));
      elseStore.insertValue(
          JavaExpression.fromNode(n.getRightOperand()),
          lattice.refineLhsOfComparison(RefinementLattice.flip(negated), r, l));
    }

    return new ConditionalTransferResult<>(out.getResultValue(), thenStore, elseStore);
  }

  private TransferResult<CFValue, CFStore> implementOperator(
      BinaryOperator op, BinaryOperationNode n, TransferResult<CFValue, CFStore> out) {
    AnnotationMirror l = findAnnotation(n.getLeftOperand());
    AnnotationMirror r = findAnnotation(n.getRightOperand());

    if (l == null || r == null || isConstant(n)) {
      return out;
    }

    AnnotationMirror res = lattice.arithmetic(op, l, r, RefinementLattice.isIntegral(n.getType()));
    return withResult(res, out);
  }

  /** Integral shifts, bitwise operators and narrowing conversions say nothing about the sign. */
  private TransferResult<CFValue, CFStore> forgetSign(Node n, TransferResult<CFValue, CFStore> out) {
    TypeKind kind = n.getType().getKind();
    if (!kind.isPrimitive()
        || kind == TypeKind.BOOLEAN
        || out.getResultValue() == null
        || isConstant(n)) {
      return out;
    }
    return withResult(lattice.unknown, out);
  }

  // The tree annotator already holds the exact qualifier of a constant.
  private static boolean isConstant(Node n) {
    Tree tree = n.getTree();
    return tree instanceof ExpressionTree && ConstantValues.isConstant((ExpressionTree) tree);
  }

  private TransferResult<CFValue, CFStore> withResult(
      AnnotationMirror res, TransferResult<CFValue, CFStore> out) {
    CFValue newResultValue =
        analysis.createSingleAnnotationValue(res, out.getResultValue().getUnderlyingType());
    return new RegularTransferResult<>(newResultValue, out.getRegularStore());
  }

  @Override
  public TransferResult<CFValue, CFStore> visitEqualTo(
      EqualToNode n, TransferInput<CFValue, CFStore> p) {
    return implementComparison(Comparison.EQ, n, super.visitEqualTo(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitNotEqual(
      NotEqualNode n, TransferInput<CFValue, CFStore> p) {
    return implementComparison(Comparison.NE, n, super.visitNotEqual(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitGreaterThan(
      GreaterThanNode n, TransferInput<CFValue, CFStore> p) {
    return implementComparison(Comparison.GT, n, super.visitGreaterThan(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitGreaterThanOrEqual(
      GreaterThanOrEqualNode n, TransferInput<CFValue, CFStore> p) {
    return implementComparison(Comparison.GE, n, super.visitGreaterThanOrEqual(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitLessThan(
      LessThanNode n, TransferInput<CFValue, CFStore> p) {
    return implementComparison(Comparison.LT, n, super.visitLessThan(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitLessThanOrEqual(
      LessThanOrEqualNode n, TransferInput<CFValue, CFStore> p) {
    return implementComparison(Comparison.LE, n, super.visitLessThanOrEqual(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitIntegerDivision(
      IntegerDivisionNode n, TransferInput<CFValue, CFStore> p) {
    return implementOperator(BinaryOperator.DIVIDE, n, super.visitIntegerDivision(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitIntegerRemainder(
      IntegerRemainderNode n, TransferInput<CFValue, CFStore> p) {
    return implementOperator(BinaryOperator.MOD, n, super.visitIntegerRemainder(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitFloatingDivision(
      FloatingDivisionNode n, TransferInput<CFValue, CFStore> p) {
    return implementOperator(BinaryOperator.DIVIDE, n, super.visitFloatingDivision(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitFloatingRemainder(
      FloatingRemainderNode n, TransferInput<CFValue, CFStore> p) {
    return implementOperator(BinaryOperator.MOD, n, super.visitFloatingRemainder(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitNumericalMultiplication(
      NumericalMultiplicationNode n, TransferInput<CFValue, CFStore> p) {
    return implementOperator(BinaryOperator.TIMES, n, super.visitNumericalMultiplication(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitNumericalAddition(
      NumericalAdditionNode n, TransferInput<CFValue, CFStore> p) {
    return implementOperator(BinaryOperator.PLUS, n, super.visitNumericalAddition(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitNumericalSubtraction(
      NumericalSubtractionNode n, TransferInput<CFValue, CFStore> p) {
    return implementOperator(BinaryOperator.MINUS, n, super.visitNumericalSubtraction(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitNumericalMinus(
      NumericalMinusNode n, TransferInput<CFValue, CFStore> p) {
    TransferResult<CFValue, CFStore> out = super.visitNumericalMinus(n, p);
    AnnotationMirror operand = findAnnotation(n.getOperand());
    if (operand == null || isConstant(n)) {
      return out;
    }
    return withResult(lattice.negation(operand, RefinementLattice.isIntegral(n.getType())), out);
  }

  @Override
  public TransferResult<CFValue, CFStore> visitLeftShift(
      LeftShiftNode n, TransferInput<CFValue, CFStore> p) {
    return forgetSign(n, super.visitLeftShift(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitSignedRightShift(
      SignedRightShiftNode n, TransferInput<CFValue, CFStore> p) {
    return forgetSign(n, super.visitSignedRightShift(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitUnsignedRightShift(
      UnsignedRightShiftNode n, TransferInput<CFValue, CFStore> p) {
    return forgetSign(n, super.visitUnsignedRightShift(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitBitwiseAnd(
      BitwiseAndNode n, TransferInput<CFValue, CFStore> p) {
    return forgetSign(n, super.visitBitwiseAnd(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitBitwiseOr(
      BitwiseOrNode n, TransferInput<CFValue, CFStore> p) {
    return forgetSign(n, super.visitBitwiseOr(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitBitwiseXor(
      BitwiseXorNode n, TransferInput<CFValue, CFStore> p) {
    return forgetSign(n, super.visitBitwiseXor(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitBitwiseComplement(
      BitwiseComplementNode n, TransferInput<CFValue, CFStore> p) {
    return forgetSign(n, super.visitBitwiseComplement(n, p));
  }

  @Override
  public TransferResult<CFValue, CFStore> visitNarrowingConversion(
      NarrowingConversionNode n, TransferInput<CFValue, CFStore> p) {
    return forgetSign(n, super.visitNarrowingConversion(n, p));
  }

  private AnnotationMirror findAnnotation(Node node) {
    CFValue value = analysis.getValue(node);
    if (value == null || value.getAnnotations().isEmpty()) {
      return null;
    }
    QualifierHierarchy hierarchy = analysis.getTypeFactory().getQualifierHierarchy();
    Set<? extends AnnotationMirror> tops = hierarchy.getTopAnnotations();
    return hierarchy.findAnnotationInSameHierarchy(value.getAnnotations(), tops.iterator().next());
  }
}
