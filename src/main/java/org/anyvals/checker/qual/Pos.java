package org.anyvals.checker.qual;

import java.lang.annotation.ElementType;
import java.lang.annotation.Target;
import org.checkerframework.framework.qual.SubtypeOf;

/**
 * A value that is strictly greater than zero.
 * This type is a subtype of both NonZero and PosZ.
 */
@SubtypeOf({NonZero.class, PosZ.class})
@Target({ElementType.TYPE_USE, ElementType.TYPE_PARAMETER})
public @interface Pos {}
