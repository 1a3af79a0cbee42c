package org.anyvals.numeric;

import java.util.Locale;

/**
 * The primitive types a refinement can wrap, and the peer types its operators accept.
 */
public enum PrimitiveKind {
  BYTE(Byte.class, true),
  SHORT(Short.class, true),
  CHAR(Character.class, true),
  INT(Integer.class, true),
  LONG(Long.class, true),
  FLOAT(Float.class, false),
  DOUBLE(Double.class, false);

  private final Class<?> boxedType;
  private final boolean integral;

  PrimitiveKind(Class<?> boxedType, boolean integral) {
    this.boxedType = boxedType;
    this.integral = integral;
  }

  public Class<?> boxedType() {
    return boxedType;
  }

  public boolean isIntegral() {
    return integral;
  }

  /** The Java keyword for this primitive, e.g. {@code "double"}. */
  public String keyword() {
    return name().toLowerCase(Locale.ROOT);
  }
}
