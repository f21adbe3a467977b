package org.jkconfig.model;

/**
 * A {@code range} property of an {@code int} or {@code hex} symbol.
 *
 * @param low The symbol giving the lower bound.
 * @param high The symbol giving the upper bound.
 * @param condition The condition under which the range is active.
 */
public record Range(Symbol low, Symbol high, Expr condition) {}
