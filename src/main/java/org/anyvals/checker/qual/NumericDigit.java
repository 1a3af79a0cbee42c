package org.anyvals.checker.qual;

import java.lang.annotation.ElementType;
import java.lang.annotation.Target;
import org.checkerframework.framework.qual.SubtypeOf;

/**
 * An integral value between {@code '0'} and {@code '9'}, inclusive (48 to 57).
 */
@SubtypeOf({Pos.class})
@Target({ElementType.TYPE_USE, ElementType.TYPE_PARAMETER})
public @interface NumericDigit {}
