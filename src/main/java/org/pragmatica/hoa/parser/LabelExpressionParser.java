package org.pragmatica.hoa.parser;

import io.vavr.control.Either;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.HoaToken;
import org.pragmatica.hoa.lexer.TokenKind;
import org.pragmatica.hoa.tree.BooleanExpression;
import org.pragmatica.hoa.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Grammar of alias definitions and state/edge labels.
 * <pre>
 * term := INT | ALIAS_NAME | 't' | 'f' | '!' term | '(' expr ')'
 * </pre>
 * Negation binds to the following term only: {@code !a | b} is {@code (!a) | b}.
 */
public final class LabelExpressionParser extends ExpressionParser<BooleanExpression> {

    public LabelExpressionParser(List<HoaToken> tokens, SourceLocation endLocation) {
        super(tokens, endLocation);
    }

    @Override
    protected Either<ParseError, Parsed<BooleanExpression>> term(int pos) {
        var maybeToken = tokenAt(pos);
        if (maybeToken.isEmpty()) {
            return Either.left(new ParseError.UnexpectedEnd(
                locationAt(pos),
                "expected atom (integer, alias, t, f, '!' or '(')"
            ));
        }
        var token = maybeToken.get();
        return switch (token.kind()) {
            case INT -> Either.right(new Parsed<>(BooleanExpression.ap(token.intValue()), pos + 1));
            case ALIAS_NAME -> Either.right(new Parsed<>(BooleanExpression.alias(token.textValue()), pos + 1));
            case TRUE -> Either.right(new Parsed<>(BooleanExpression.ofTrue(), pos + 1));
            case FALSE -> Either.right(new Parsed<>(BooleanExpression.ofFalse(), pos + 1));
            case NOT -> term(pos + 1).map(inner -> new Parsed<>(inner.node().not(), inner.next()));
            case LPAREN -> parenthesized(pos);
            default -> Either.left(new ParseError.MismatchingToken(
                token.location(),
                "atom",
                token.description(),
                context()
            ));
        };
    }

    /**
     * Target states of an edge: {@code INT ('&' INT)*}, starting at {@code pos}.
     */
    public Either<ParseError, Parsed<List<Integer>>> stateConjunction(int pos) {
        var states = new ArrayList<Integer>();
        int current = pos;
        while (true) {
            var maybeToken = tokenAt(current);
            if (maybeToken.isEmpty()) {
                return Either.left(new ParseError.MissingToken(
                    locationAt(current),
                    "integer (target state)",
                    "edge"
                ));
            }
            var token = maybeToken.get();
            if (!token.is(TokenKind.INT)) {
                return Either.left(new ParseError.MismatchingToken(
                    token.location(),
                    "integer (target state)",
                    token.description(),
                    "edge"
                ));
            }
            states.add(token.intValue());
            current++;
            if (!isAt(current, TokenKind.AND)) {
                return Either.right(new Parsed<>(List.copyOf(states), current));
            }
            current++;
        }
    }

    @Override
    protected BooleanExpression conjunction(BooleanExpression left, BooleanExpression right) {
        return left.and(right);
    }

    @Override
    protected BooleanExpression disjunction(BooleanExpression left, BooleanExpression right) {
        return left.or(right);
    }

    @Override
    protected String context() {
        return "label expression";
    }
}
