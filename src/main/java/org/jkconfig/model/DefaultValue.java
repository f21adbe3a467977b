package org.jkconfig.model;

/**
 * A {@code default} property: the value applies when the condition is non-zero.
 *
 * @param value The default value expression.
 * @param condition The condition of the default.
 */
public record DefaultValue(Expr value, Expr condition) {}
