package org.jkconfig.frontend.parser;

import org.jkconfig.Kconfig;
import org.jkconfig.api.KconfigSyntaxException;
import org.jkconfig.frontend.lexer.Token;
import org.jkconfig.frontend.lexer.TokenType;
import org.jkconfig.model.Expr;
import org.jkconfig.model.Relation;
import org.jkconfig.model.Symbol;

/**
 * Recursive descent parser for Kconfig expressions.
 * <pre>
 * expr     := and_expr ['||' expr]
 * and_expr := factor   ['&amp;&amp;' and_expr]
 * factor   := symbol [relation symbol] | '!' factor | '(' expr ')'
 * </pre>
 * The trees are built as parsed, without simplification.
 */
class ExpressionParser {

    private final ParsingContext context;
    private final boolean transformM;

    /**
     * @param context The context providing the tokens.
     * @param transformM Whether a bare {@code m} is rewritten to {@code m && MODULES}, as in conditions.
     */
    ExpressionParser(ParsingContext context, boolean transformM) {
        this.context = context;
        this.transformM = transformM;
    }

    Expr expression() throws KconfigSyntaxException {
        Expr left = andExpression();
        if (context.match(TokenType.OR)) {
            return new Expr.Or(left, expression());
        }
        return left;
    }

    private Expr andExpression() throws KconfigSyntaxException {
        Expr left = factor();
        if (context.match(TokenType.AND)) {
            return new Expr.And(left, andExpression());
        }
        return left;
    }

    private Expr factor() throws KconfigSyntaxException {
        Token token = context.peek();
        if (token == null) {
            throw context.error("malformed expression");
        }
        if (token.type() == TokenType.WORD || token.type() == TokenType.STRING) {
            Symbol symbol = context.expectSymbol();
            Relation relation = relation(context.peek());
            if (relation == null) {
                Kconfig kconfig = context.getKconfig();
                if (transformM && symbol == kconfig.getM()) {
                    return new Expr.And(kconfig.getM(), kconfig.getModules());
                }
                return symbol;
            }
            context.advance();
            if (context.isAtEndOfLine()) {
                throw context.error("expected symbol after '" + relation.getOperator() + "'");
            }
            return new Expr.Comparison(relation, symbol, context.expectSymbol());
        }
        if (context.match(TokenType.NOT)) {
            return new Expr.Not(factor());
        }
        if (context.match(TokenType.OPEN_PAREN)) {
            Expr inner = expression();
            if (context.match(TokenType.CLOSE_PAREN)) {
                return inner;
            }
        }
        throw context.error("malformed expression");
    }

    private static Relation relation(Token token) {
        if (token == null) {
            return null;
        }
        return switch (token.type()) {
            case EQUAL -> Relation.EQUAL;
            case UNEQUAL -> Relation.UNEQUAL;
            case LESS -> Relation.LESS;
            case LESS_EQUAL -> Relation.LESS_EQUAL;
            case GREATER -> Relation.GREATER;
            case GREATER_EQUAL -> Relation.GREATER_EQUAL;
            default -> null;
        };
    }
}
