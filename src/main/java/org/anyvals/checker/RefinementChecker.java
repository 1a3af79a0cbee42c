package org.anyvals.checker;

import javax.annotation.processing.SupportedOptions;

import org.checkerframework.common.basetype.BaseTypeChecker;

/**
 * Checks at compile time that every {@code of} factory of a refinement type is given a
 * constant that satisfies the type's predicate, e.g. that {@code PosInt.of(-1)} is rejected.
 *
 * <p>Run it as an annotation processor: {@code -processor org.anyvals.checker.RefinementChecker}.
 * With {@code -AacceptRefinedVariables} the factories also accept variables whose sign has
 * been established by a comparison, as in {@code if (x > 0) PosInt.of(x)}. Only the sign is
 * tracked: {@code c >= '0' && c <= '9'} proves {@code c} positive but not a digit, so
 * such a {@code c} goes through {@code NumericChar.from(c)}. Shifts, bitwise operators
 * and narrowing conversions of variables lose the sign altogether.
 */
@SupportedOptions({RefinementChecker.ACCEPT_REFINED_VARIABLES})
public class RefinementChecker extends BaseTypeChecker {

  public static final String ACCEPT_REFINED_VARIABLES = "acceptRefinedVariables";
}
