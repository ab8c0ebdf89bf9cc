package org.pragmatica.hoa.parser;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.HoaToken;
import org.pragmatica.hoa.lexer.TokenKind;
import org.pragmatica.hoa.tree.AcceptanceCondition;
import org.pragmatica.hoa.tree.BooleanExpression;
import org.pragmatica.hoa.tree.SourceLocation;

import java.util.List;

/**
 * Recursive-descent skeleton shared by the label and acceptance grammars:
 * <pre>
 * expr     := conjunct [ '|' expr ]
 * conjunct := term [ '&amp;' expr ]
 * term     := grammar specific
 * </pre>
 * The right operand of {@code &} is a full {@code expr}, so {@code a & b | c}
 * parses as {@code a & (b | c)}.
 *
 * <p>Parsers work on a pre-sliced token list; an {@link TokenKind#EOF} token
 * inside the slice is treated like the end of the slice.
 *
 * @param <T> node type produced by the grammar
 */
public abstract class ExpressionParser<T> {

    /**
     * Parsed node together with the position of the first unconsumed token.
     */
    public record Parsed<T>(T node, int next) {}

    protected final List<HoaToken> tokens;
    private final SourceLocation endLocation;

    protected ExpressionParser(List<HoaToken> tokens, SourceLocation endLocation) {
        this.tokens = tokens;
        this.endLocation = endLocation;
    }

    /**
     * Parse a label or alias expression.
     */
    public static Either<ParseError, BooleanExpression> parseLabel(List<HoaToken> tokens) {
        return parseLabel(tokens, defaultEnd(tokens));
    }

    /**
     * Parse a label or alias expression; {@code endLocation} is reported when the slice runs out.
     */
    public static Either<ParseError, BooleanExpression> parseLabel(List<HoaToken> tokens,
                                                                   SourceLocation endLocation) {
        return new LabelExpressionParser(tokens, endLocation).parse();
    }

    /**
     * Parse an acceptance condition.
     */
    public static Either<ParseError, AcceptanceCondition> parseAcceptance(List<HoaToken> tokens) {
        return parseAcceptance(tokens, defaultEnd(tokens));
    }

    /**
     * Parse an acceptance condition; {@code endLocation} is reported when the slice runs out.
     */
    public static Either<ParseError, AcceptanceCondition> parseAcceptance(List<HoaToken> tokens,
                                                                          SourceLocation endLocation) {
        return new AcceptanceExpressionParser(tokens, endLocation).parse();
    }

    /**
     * Parse from position 0, discarding the reached position.
     */
    public Either<ParseError, T> parse() {
        return expression(0).map(Parsed::node);
    }

    protected Either<ParseError, Parsed<T>> expression(int pos) {
        var lhs = conjunct(pos);
        if (lhs.isLeft() || !isAt(lhs.get().next(), TokenKind.OR)) {
            return lhs;
        }
        var left = lhs.get();
        return expression(left.next() + 1)
            .map(rhs -> new Parsed<>(disjunction(left.node(), rhs.node()), rhs.next()));
    }

    protected Either<ParseError, Parsed<T>> conjunct(int pos) {
        var lhs = term(pos);
        if (lhs.isLeft() || !isAt(lhs.get().next(), TokenKind.AND)) {
            return lhs;
        }
        var left = lhs.get();
        return expression(left.next() + 1)
            .map(rhs -> new Parsed<>(conjunction(left.node(), rhs.node()), rhs.next()));
    }

    protected abstract Either<ParseError, Parsed<T>> term(int pos);

    protected abstract T conjunction(T left, T right);

    protected abstract T disjunction(T left, T right);

    /**
     * Context tag used in error messages.
     */
    protected abstract String context();

    /**
     * {@code '(' expr ')'} starting at the opening parenthesis.
     */
    protected Either<ParseError, Parsed<T>> parenthesized(int pos) {
        var inner = expression(pos + 1);
        if (inner.isLeft()) {
            return inner;
        }
        var parsed = inner.get();
        return expect(parsed.next(), TokenKind.RPAREN, "closing parenthesis")
            .map(next -> new Parsed<>(parsed.node(), next));
    }

    /**
     * Check that the token at {@code pos} has the given kind, returning the following position.
     */
    protected Either<ParseError, Integer> expect(int pos, TokenKind kind, String what) {
        var token = tokenAt(pos);
        if (token.isEmpty()) {
            return Either.left(new ParseError.UnexpectedEnd(locationAt(pos), "expected " + what));
        }
        if (!token.get().is(kind)) {
            return Either.left(new ParseError.MismatchingToken(
                token.get().location(),
                "'" + kind.text() + "'",
                token.get().description(),
                context()
            ));
        }
        return Either.right(pos + 1);
    }

    protected Option<HoaToken> tokenAt(int pos) {
        if (pos < 0 || pos >= tokens.size() || tokens.get(pos).is(TokenKind.EOF)) {
            return Option.none();
        }
        return Option.some(tokens.get(pos));
    }

    protected boolean isAt(int pos, TokenKind kind) {
        return tokenAt(pos).exists(token -> token.is(kind));
    }

    protected SourceLocation locationAt(int pos) {
        return pos < tokens.size() ? tokens.get(pos).location() : endLocation;
    }

    private static SourceLocation defaultEnd(List<HoaToken> tokens) {
        return tokens.isEmpty()
               ? SourceLocation.START
               : tokens.get(tokens.size() - 1).location();
    }
}
