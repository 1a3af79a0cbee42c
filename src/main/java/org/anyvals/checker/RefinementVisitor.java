package org.anyvals.checker;

import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.MethodInvocationTree;
import javax.lang.model.element.ExecutableElement;

import org.anyvals.checker.qual.LiteralChecked;
import org.checkerframework.common.basetype.BaseTypeChecker;
import org.checkerframework.common.basetype.BaseTypeVisitor;
import org.checkerframework.javacutil.TreeUtils;

/**
 * Reports a call to a {@link LiteralChecked} factory whose argument is not a constant. Whether
 * a constant argument satisfies the parameter's qualifier is checked by the usual argument
 * compatibility rules.
 */
public class RefinementVisitor extends BaseTypeVisitor<RefinementAnnotatedTypeFactory> {

  public RefinementVisitor(BaseTypeChecker checker) {
    super(checker);
  }

  @Override
  public Void visitMethodInvocation(MethodInvocationTree tree, Void p) {
    ExecutableElement method = TreeUtils.elementFromUse(tree);
    if (atypeFactory.getDeclAnnotation(method, LiteralChecked.class) != null
        && !checker.hasOption(RefinementChecker.ACCEPT_REFINED_VARIABLES)) {
      String owner = method.getEnclosingElement().getSimpleName().toString();
      for (ExpressionTree argument : tree.getArguments()) {
        if (!ConstantValues.isConstant(argument)) {
          checker.reportError(
              argument, "literal.required", owner + "." + method.getSimpleName(), owner + ".from");
        }
      }
    }
    return super.visitMethodInvocation(tree, p);
  }
}
