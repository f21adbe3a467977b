package org.jkconfig.model;

/**
 * A Kconfig expression. Leaves are symbols and choices; inner nodes are the logical
 * operators and the relations between two symbols.
 * <p>
 * Expressions are immutable once built. Use {@link Expressions} to evaluate, combine and print them.
 */
public sealed interface Expr permits Expr.And, Expr.Or, Expr.Not, Expr.Comparison, ConfigItem {

	/**
	 * Logical AND; evaluates to the minimum of both operands.
	 * @param left The left operand.
	 * @param right The right operand.
	 */
	record And(Expr left, Expr right) implements Expr {}

	/**
	 * Logical OR; evaluates to the maximum of both operands.
	 * @param left The left operand.
	 * @param right The right operand.
	 */
	record Or(Expr left, Expr right) implements Expr {}

	/**
	 * Logical NOT; evaluates to {@code 2 - operand}.
	 * @param operand The negated expression.
	 */
	record Not(Expr operand) implements Expr {}

	/**
	 * A relation between the values of two symbols.
	 * @param relation The relational operator.
	 * @param left The left operand.
	 * @param right The right operand.
	 */
	record Comparison(Relation relation, Symbol left, Symbol right) implements Expr {}
}
