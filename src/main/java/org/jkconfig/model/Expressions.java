package org.jkconfig.model;

import org.jkconfig.io.ConfigStrings;

import java.math.BigInteger;
import java.util.Collection;

/**
 * Evaluation, construction and printing of {@link Expr} trees.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Evaluates an expression to a tristate value.
     *
     * @param expr The expression.
     * @return 0 (n), 1 (m) or 2 (y).
     */
    public static int value(Expr expr) {
        if (expr instanceof ConfigItem item) {
            return item.getTriValue();
        }
        if (expr instanceof Expr.And and) {
            int left = value(and.left());
            return left == 0 ? 0 : Math.min(left, value(and.right()));
        }
        if (expr instanceof Expr.Or or) {
            int left = value(or.left());
            return left == 2 ? 2 : Math.max(left, value(or.right()));
        }
        if (expr instanceof Expr.Not not) {
            return 2 - value(not.operand());
        }
        Expr.Comparison comparison = (Expr.Comparison) expr;
        return comparison.relation().holds(compare(comparison.left(), comparison.right())) ? 2 : 0;
    }

    /**
     * Returns the string value of an expression: the value of a symbol, or the tristate name
     * for compound expressions such as {@code default A && B}.
     */
    public static String strValue(Expr expr) {
        if (expr instanceof Symbol symbol) {
            return symbol.getStrValue();
        }
        return Tristate.toString(value(expr));
    }

    /**
     * Compares two symbol values. Two {@code string} symbols compare as text; otherwise both values
     * are compared as numbers (bool and tristate symbols as their tristate value), falling back to a
     * text comparison when either side is not a number.
     */
    private static int compare(Symbol left, Symbol right) {
        if (left.getOrigType() == SymbolType.STRING && right.getOrigType() == SymbolType.STRING) {
            return Integer.signum(left.getStrValue().compareTo(right.getStrValue()));
        }
        try {
            return toNumber(left).compareTo(toNumber(right));
        } catch (NumberFormatException e) {
            return Integer.signum(left.getStrValue().compareTo(right.getStrValue()));
        }
    }

    private static BigInteger toNumber(Symbol symbol) {
        if (symbol.getOrigType().isBoolOrTristate()) {
            return BigInteger.valueOf(symbol.getTriValue());
        }
        return NumericLiterals.parse(symbol.getStrValue(), symbol.getOrigType().getBase());
    }

    /**
     * Builds {@code left && right}, simplifying when either side is the constant n or y.
     */
    public static Expr and(Expr left, Expr right) {
        if (isConstant(left, "y")) {
            return right;
        }
        if (isConstant(right, "y")) {
            return left;
        }
        if (isConstant(left, "n")) {
            return left;
        }
        if (isConstant(right, "n")) {
            return right;
        }
        return new Expr.And(left, right);
    }

    /**
     * Builds {@code left || right}, simplifying when either side is the constant n or y.
     */
    public static Expr or(Expr left, Expr right) {
        if (isConstant(left, "n")) {
            return right;
        }
        if (isConstant(right, "n")) {
            return left;
        }
        if (isConstant(left, "y")) {
            return left;
        }
        if (isConstant(right, "y")) {
            return right;
        }
        return new Expr.Or(left, right);
    }

    /**
     * @param expr An expression.
     * @param name {@code "n"}, {@code "m"} or {@code "y"}.
     * @return Whether the expression is the built-in constant with that name.
     */
    public static boolean isConstant(Expr expr, String name) {
        return expr instanceof Symbol symbol && symbol.isConstant() && symbol.getName().equals(name);
    }

    /**
     * Decides whether an expression makes its holder depend on a symbol in the sense used for
     * implicit submenus: the expression is the symbol, a comparison of it against m or y (or
     * inequality to n), or a conjunction where one operand qualifies.
     *
     * @param expr The expression.
     * @param item The symbol or choice.
     * @return Whether the dependency exists.
     */
    public static boolean dependsOn(Expr expr, ConfigItem item) {
        if (expr instanceof ConfigItem) {
            return expr == item;
        }
        if (expr instanceof Expr.And and) {
            return dependsOn(and.left(), item) || dependsOn(and.right(), item);
        }
        if (expr instanceof Expr.Comparison comparison
                && (comparison.relation() == Relation.EQUAL || comparison.relation() == Relation.UNEQUAL)) {
            Symbol left = comparison.left();
            Symbol right = comparison.right();
            if (right == item) {
                right = left;
                left = comparison.right();
            }
            if (left != item) {
                return false;
            }
            if (comparison.relation() == Relation.EQUAL) {
                return isConstant(right, "m") || isConstant(right, "y");
            }
            return isConstant(right, "n");
        }
        return false;
    }

    /**
     * Adds every symbol and choice referenced by an expression to a collection.
     */
    public static void collectItems(Expr expr, Collection<? super ConfigItem> into) {
        if (expr instanceof ConfigItem item) {
            into.add(item);
        } else if (expr instanceof Expr.And and) {
            collectItems(and.left(), into);
            collectItems(and.right(), into);
        } else if (expr instanceof Expr.Or or) {
            collectItems(or.left(), into);
            collectItems(or.right(), into);
        } else if (expr instanceof Expr.Not not) {
            collectItems(not.operand(), into);
        } else if (expr instanceof Expr.Comparison comparison) {
            into.add(comparison.left());
            into.add(comparison.right());
        }
    }

    /**
     * Prints an expression in Kconfig syntax. Operands of {@code &&} that are {@code ||}
     * expressions are parenthesized, and the other way around.
     *
     * @param expr The expression.
     * @return The text.
     */
    public static String toString(Expr expr) {
        if (expr instanceof ConfigItem item) {
            return itemToString(item);
        }
        if (expr instanceof Expr.And and) {
            return parenthesizeIf(and.left(), Expr.Or.class) + " && " + parenthesizeIf(and.right(), Expr.Or.class);
        }
        if (expr instanceof Expr.Or or) {
            return parenthesizeIf(or.left(), Expr.And.class) + " || " + parenthesizeIf(or.right(), Expr.And.class);
        }
        if (expr instanceof Expr.Not not) {
            if (not.operand() instanceof ConfigItem item) {
                return "!" + itemToString(item);
            }
            return "!(" + toString(not.operand()) + ")";
        }
        Expr.Comparison comparison = (Expr.Comparison) expr;
        return itemToString(comparison.left()) + " " + comparison.relation().getOperator() + " "
                + itemToString(comparison.right());
    }

    private static String parenthesizeIf(Expr expr, Class<? extends Expr> type) {
        return type.isInstance(expr) ? "(" + toString(expr) + ")" : toString(expr);
    }

    /**
     * Prints a symbol or choice as it appears inside expressions. Constant symbols other than
     * n, m and y are quoted; choices print as {@code <choice NAME>}.
     */
    public static String itemToString(ConfigItem item) {
        if (item instanceof Symbol symbol) {
            if (symbol.isConstant() && Tristate.parse(symbol.getName()).isEmpty()) {
                return "\"" + ConfigStrings.escape(symbol.getName()) + "\"";
            }
            return symbol.getName();
        }
        return item.getName() == null ? "<choice>" : "<choice " + item.getName() + ">";
    }
}
