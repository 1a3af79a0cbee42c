package org.anyvals.checker.qual;

import java.lang.annotation.ElementType;
import java.lang.annotation.Target;
import org.checkerframework.framework.qual.SubtypeOf;

/**
 * A value that is not zero. It may be negative or positive.
 * NaN also has this type, since {@code NaN != 0} holds.
 */
@SubtypeOf({UnknownRefinement.class})
@Target({ElementType.TYPE_USE, ElementType.TYPE_PARAMETER})
public @interface NonZero {}
