package org.anyvals.checker.qual;

import java.lang.annotation.ElementType;
import java.lang.annotation.Target;
import org.checkerframework.framework.qual.SubtypeOf;

/**
 * A value that is greater than or equal to zero.
 */
@SubtypeOf({UnknownRefinement.class})
@Target({ElementType.TYPE_USE, ElementType.TYPE_PARAMETER})
public @interface PosZ {}
