package org.pragmatica.hoa.parser;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.hoa.consumer.HoaConsumer;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.HoaToken;
import org.pragmatica.hoa.lexer.TokenKind;
import org.pragmatica.hoa.tree.BooleanExpression;
import org.pragmatica.hoa.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the tokens of one state block, i.e. everything after {@code State:}
 * up to the next {@code State:}, {@code --END--} or {@code --ABORT--}.
 * <pre>
 * state := ['[' label ']'] INT [STRING] [acc-sig] edge*
 * edge  := ['[' label ']'] INT ('&amp;' INT)* [acc-sig]
 * acc-sig := '{' INT* '}'
 * </pre>
 */
final class StateParser {
    private static final Logger log = LoggerFactory.getLogger(StateParser.class);

    private final List<HoaToken> block;
    private final SourceLocation endLocation;
    private final HoaConsumer consumer;
    private int pos;

    private StateParser(List<HoaToken> block, SourceLocation endLocation, HoaConsumer consumer) {
        this.block = block;
        this.endLocation = endLocation;
        this.consumer = consumer;
        this.pos = 0;
    }

    /**
     * Parse a state block and emit its events.
     *
     * @param endLocation location of the token that terminated the block
     * @return the state number
     */
    static Either<ParseError, Integer> parse(List<HoaToken> block, SourceLocation endLocation, HoaConsumer consumer) {
        return new StateParser(block, endLocation, consumer).parseState();
    }

    private Either<ParseError, Integer> parseState() {
        var label = optionalLabel("state label");
        if (label.isLeft()) {
            return Either.left(label.getLeft());
        }
        var number = stateNumber();
        if (number.isLeft()) {
            return number;
        }
        int state = number.get();

        Option<String> name = Option.none();
        if (isAt(TokenKind.STRING)) {
            name = Option.some(block.get(pos++).textValue());
        }

        var accSignature = optionalSignature("state acceptance signature");
        if (accSignature.isLeft()) {
            return Either.left(accSignature.getLeft());
        }
        consumer.addState(state, name, label.get(), accSignature.get());

        int edges = 0;
        while (pos < block.size()) {
            var edge = edge(state, label.get());
            if (edge.isLeft()) {
                return Either.left(edge.getLeft());
            }
            edges++;
        }

        consumer.notifyEndOfState(state);
        log.debug("State {} with {} edges", state, edges);
        return Either.right(state);
    }

    private Either<ParseError, Integer> stateNumber() {
        if (pos >= block.size()) {
            return Either.left(new ParseError.MissingToken(endLocation, "integer (state identifier)", "state extraction"));
        }
        var token = block.get(pos);
        if (!token.is(TokenKind.INT)) {
            return Either.left(new ParseError.MismatchingToken(
                token.location(),
                "integer (state identifier)",
                token.description(),
                "state extraction"
            ));
        }
        pos++;
        return Either.right(token.intValue());
    }

    /**
     * Peel one edge off the front of the remaining tokens.
     */
    private Either<ParseError, Integer> edge(int state, Option<BooleanExpression> stateLabel) {
        var ownLabel = optionalLabel("edge label");
        if (ownLabel.isLeft()) {
            return Either.left(ownLabel.getLeft());
        }
        var targets = new LabelExpressionParser(block, endLocation).stateConjunction(pos);
        if (targets.isLeft()) {
            return Either.left(targets.getLeft());
        }
        pos = targets.get().next();
        var accSignature = optionalSignature("edge acceptance signature");
        if (accSignature.isLeft()) {
            return Either.left(accSignature.getLeft());
        }

        var label = ownLabel.get().orElse(stateLabel);
        if (label.isDefined()) {
            consumer.addEdgeWithLabel(state, label.get(), targets.get().node(), accSignature.get());
        } else {
            consumer.addEdgeImplicit(state, targets.get().node(), accSignature.get());
        }
        return Either.right(state);
    }

    private Either<ParseError, Option<BooleanExpression>> optionalLabel(String context) {
        if (!isAt(TokenKind.LBRACKET)) {
            return Either.right(Option.none());
        }
        int close = pos + 1;
        while (close < block.size() && !block.get(close).is(TokenKind.RBRACKET)) {
            close++;
        }
        if (close >= block.size()) {
            return Either.left(new ParseError.MissingToken(endLocation, "']'", context));
        }
        var labelTokens = block.subList(pos + 1, close);
        var closeLocation = block.get(close).location();
        pos = close + 1;
        return ExpressionParser.parseLabel(labelTokens, closeLocation)
                               .map(Option::some);
    }

    private Either<ParseError, Option<List<Integer>>> optionalSignature(String context) {
        if (!isAt(TokenKind.LBRACE)) {
            return Either.right(Option.none());
        }
        pos++;
        var sets = new ArrayList<Integer>();
        while (true) {
            if (pos >= block.size()) {
                return Either.left(new ParseError.MissingToken(endLocation, "'}'", context));
            }
            var token = block.get(pos++);
            if (token.is(TokenKind.RBRACE)) {
                return Either.right(Option.some(List.copyOf(sets)));
            }
            if (!token.is(TokenKind.INT)) {
                return Either.left(new ParseError.MismatchingToken(
                    token.location(),
                    "integer or '}'",
                    token.description(),
                    context
                ));
            }
            sets.add(token.intValue());
        }
    }

    private boolean isAt(TokenKind kind) {
        return pos < block.size() && block.get(pos).is(kind);
    }
}
