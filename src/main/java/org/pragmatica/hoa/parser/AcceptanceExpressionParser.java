package org.pragmatica.hoa.parser;

import io.vavr.control.Either;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.HoaToken;
import org.pragmatica.hoa.lexer.TokenKind;
import org.pragmatica.hoa.tree.AcceptanceAtom;
import org.pragmatica.hoa.tree.AcceptanceCondition;
import org.pragmatica.hoa.tree.SourceLocation;

import java.util.List;

/**
 * Grammar of the {@code Acceptance:} header.
 * <pre>
 * term := ('Fin' | 'Inf') '(' ['!'] INT ')' | 't' | 'f' | '!' term | '(' expr ')'
 * </pre>
 * A leading {@code !} is folded into the atom or literal it precedes.
 */
public final class AcceptanceExpressionParser extends ExpressionParser<AcceptanceCondition> {

    public AcceptanceExpressionParser(List<HoaToken> tokens, SourceLocation endLocation) {
        super(tokens, endLocation);
    }

    @Override
    protected Either<ParseError, Parsed<AcceptanceCondition>> term(int pos) {
        var maybeToken = tokenAt(pos);
        if (maybeToken.isEmpty()) {
            return Either.left(new ParseError.UnexpectedEnd(
                locationAt(pos),
                "expected acceptance atom (Fin, Inf, t, f or '(')"
            ));
        }
        var token = maybeToken.get();
        return switch (token.kind()) {
            case IDENTIFIER -> setReference(token, pos);
            case TRUE -> Either.right(new Parsed<>(AcceptanceCondition.of(true), pos + 1));
            case FALSE -> Either.right(new Parsed<>(AcceptanceCondition.of(false), pos + 1));
            case LPAREN -> parenthesized(pos);
            case NOT -> negatedTerm(token, pos);
            default -> Either.left(new ParseError.MismatchingToken(
                token.location(),
                "acceptance atom",
                token.description(),
                context()
            ));
        };
    }

    private Either<ParseError, Parsed<AcceptanceCondition>> negatedTerm(HoaToken not, int pos) {
        var inner = term(pos + 1);
        if (inner.isLeft()) {
            return inner;
        }
        var parsed = inner.get();
        if (parsed.node() instanceof AcceptanceCondition.Conjunction
            || parsed.node() instanceof AcceptanceCondition.Disjunction) {
            return Either.left(new ParseError.MismatchingToken(
                not.location(),
                "Fin, Inf, t or f after '!'",
                "compound condition " + parsed.node(),
                context()
            ));
        }
        return Either.right(new Parsed<>(parsed.node().negate(), parsed.next()));
    }

    private Either<ParseError, Parsed<AcceptanceCondition>> setReference(HoaToken ident, int pos) {
        var keyword = ident.textValue();
        if (!keyword.equals("Fin") && !keyword.equals("Inf")) {
            return Either.left(new ParseError.UnknownToken(ident.location(), ident.description()));
        }
        boolean finite = keyword.equals("Fin");
        var open = expect(pos + 1, TokenKind.LPAREN, "'(' after " + keyword);
        if (open.isLeft()) {
            return Either.left(open.getLeft());
        }
        int next = open.get();
        boolean complemented = isAt(next, TokenKind.NOT);
        if (complemented) {
            next++;
        }
        var maybeSet = tokenAt(next);
        if (maybeSet.isEmpty()) {
            return Either.left(new ParseError.UnexpectedEnd(
                locationAt(next),
                keyword + " needs to be followed by an acceptance set number"
            ));
        }
        if (!maybeSet.get().is(TokenKind.INT)) {
            return Either.left(new ParseError.MismatchingToken(
                maybeSet.get().location(),
                complemented ? "integer after '!'" : "'!' or integer",
                maybeSet.get().description(),
                context()
            ));
        }
        var atom = finite
                   ? AcceptanceAtom.fin(maybeSet.get().intValue())
                   : AcceptanceAtom.inf(maybeSet.get().intValue());
        var condition = AcceptanceCondition.of(complemented ? atom.negate() : atom);
        return expect(next + 1, TokenKind.RPAREN, "closing parenthesis after acceptance set")
            .map(after -> new Parsed<>(condition, after));
    }

    @Override
    protected AcceptanceCondition conjunction(AcceptanceCondition left, AcceptanceCondition right) {
        return left.and(right);
    }

    @Override
    protected AcceptanceCondition disjunction(AcceptanceCondition left, AcceptanceCondition right) {
        return left.or(right);
    }

    @Override
    protected String context() {
        return "acceptance condition";
    }
}
