package org.anyvals.checker.qual;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a factory method whose arguments must be compile-time constants.
 *
 * <p>When {@code RefinementChecker} runs, every argument passed to such a method
 * must be a literal, a signed or cast literal, or a reference to a constant
 * variable, and its value must fall within the range named by the parameter's
 * qualifier. Variables are rejected; callers should use the runtime
 * {@code from} factory of the same type instead.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.METHOD)
public @interface LiteralChecked {}
