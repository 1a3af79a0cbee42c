package org.anyvals.checker.qual;

import java.lang.annotation.ElementType;
import java.lang.annotation.Target;
import org.checkerframework.framework.qual.SubtypeOf;

/**
 * The bottom type in the refinement type hierarchy. No value has this type;
 * it is used for dead code and for the lower bounds of type variables.
 */
@SubtypeOf({Neg.class, Zero.class, NumericDigit.class})
@Target({ElementType.TYPE_USE, ElementType.TYPE_PARAMETER})
public @interface RefinementBottom {}
