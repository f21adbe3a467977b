package org.jkconfig.model;

/**
 * A {@code select} or {@code imply} property.
 *
 * @param target The selected or implied symbol.
 * @param condition The condition of the property.
 */
public record TargetCondition(Symbol target, Expr condition) {}
