package org.pragmatica.hoa.parser;

import io.vavr.control.Either;
import org.pragmatica.hoa.consumer.HoaConsumer;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.HoaToken;
import org.pragmatica.hoa.lexer.TokenKind;
import org.pragmatica.hoa.tree.AccNameInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for a complete HOA automaton over a token list produced by
 * {@link org.pragmatica.hoa.lexer.HoaLexer}.
 *
 * <p>Runs the header section up to {@code --BODY--}, then one block per {@code State:},
 * then requires {@code --END--} followed by the end of input. Events are sent to the
 * consumer as soon as each item is complete; parsing stops at the first error.
 */
public final class AutomatonParser {
    private static final Logger log = LoggerFactory.getLogger(AutomatonParser.class);

    private static final Either<ParseError, Boolean> CONTINUE = Either.right(true);

    private final List<HoaToken> tokens;
    private final HoaConsumer consumer;
    private int pos;

    private AutomatonParser(List<HoaToken> tokens, HoaConsumer consumer) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("Token list must end with an end-of-input token");
        }
        this.tokens = tokens;
        this.consumer = consumer;
        this.pos = 0;
    }

    /**
     * Parse the tokens, sending events to {@code consumer}.
     *
     * @return the consumer on success, the first error otherwise
     */
    public static <C extends HoaConsumer> Either<ParseError, C> parse(List<HoaToken> tokens, C consumer) {
        var result = new AutomatonParser(tokens, consumer).parseAutomaton();
        if (result.isLeft()) {
            log.debug("Parsing failed: {}", result.getLeft().message());
            return Either.left(result.getLeft());
        }
        return Either.right(consumer);
    }

    /**
     * Returns the number of states defined in the body.
     */
    private Either<ParseError, Integer> parseAutomaton() {
        var hoa = expect(TokenKind.HOA, "HOA header extraction");
        if (hoa.isLeft()) {
            return Either.left(hoa.getLeft());
        }
        var version = expect(TokenKind.IDENTIFIER, "HOA version");
        if (version.isLeft()) {
            return Either.left(version.getLeft());
        }
        log.debug("Header start, version {}", version.get().textValue());
        consumer.notifyHeaderStart(version.get().textValue());

        while (true) {
            var item = headerItem();
            if (item.isLeft()) {
                return Either.left(item.getLeft());
            }
            if (!item.get()) {
                break;
            }
        }

        log.debug("Body start at {}", peek().location());
        consumer.notifyBodyStart();

        int stateCount = 0;
        while (peek().is(TokenKind.STATE)) {
            advance();
            var state = state();
            if (state.isLeft()) {
                return Either.left(state.getLeft());
            }
            stateCount++;
        }

        if (peek().is(TokenKind.ABORT)) {
            return abort();
        }
        var end = expect(TokenKind.END, "end of automaton");
        if (end.isLeft()) {
            return Either.left(end.getLeft());
        }
        var eof = expect(TokenKind.EOF, "end of input");
        if (eof.isLeft()) {
            return Either.left(eof.getLeft());
        }
        consumer.notifyEnd();
        log.debug("Parsed automaton with {} states", stateCount);
        return Either.right(stateCount);
    }

    /**
     * Parse one header item. Right(false) means {@code --BODY--} was consumed.
     */
    private Either<ParseError, Boolean> headerItem() {
        var token = peek();
        return switch (token.kind()) {
            case STATES -> states();
            case START -> start();
            case AP -> aps();
            case ALIAS -> alias();
            case ACCEPTANCE -> acceptance();
            case ACC_NAME -> acceptanceName();
            case TOOL -> tool();
            case NAME -> name();
            case PROPERTIES -> properties();
            case HEADER_NAME -> unknownHeader();
            case BODY -> {
                advance();
                yield Either.right(false);
            }
            case ABORT -> abort();
            case EOF -> Either.left(new ParseError.MissingToken(token.location(), "--BODY--", "header section"));
            default -> Either.left(new ParseError.MismatchingToken(
                token.location(),
                "header item or --BODY--",
                token.description(),
                "header section"
            ));
        };
    }

    private Either<ParseError, Boolean> states() {
        advance();
        return expect(TokenKind.INT, "state number extraction")
            .map(count -> {
                consumer.setNumberOfStates(count.intValue());
                return true;
            });
    }

    private Either<ParseError, Boolean> start() {
        advance();
        var first = expect(TokenKind.INT, "first initial state");
        if (first.isLeft()) {
            return Either.left(first.getLeft());
        }
        var startStates = new ArrayList<Integer>();
        startStates.add(first.get().intValue());
        while (peek().is(TokenKind.INT)) {
            startStates.add(advance().intValue());
        }
        consumer.addStartStates(List.copyOf(startStates));
        return CONTINUE;
    }

    private Either<ParseError, Boolean> aps() {
        advance();
        var count = expect(TokenKind.INT, "number of atomic propositions");
        if (count.isLeft()) {
            return Either.left(count.getLeft());
        }
        int apCount = count.get().intValue();
        if (apCount < 1) {
            return Either.left(new ParseError.ZeroAtomicPropositions(count.get().location()));
        }
        var names = new ArrayList<String>();
        for (int i = 0; i < apCount; i++) {
            var name = expect(TokenKind.STRING, "atomic proposition extraction");
            if (name.isLeft()) {
                return Either.left(name.getLeft());
            }
            names.add(name.get().textValue());
        }
        consumer.setAps(List.copyOf(names));
        return CONTINUE;
    }

    private Either<ParseError, Boolean> alias() {
        advance();
        var name = expect(TokenKind.ALIAS_NAME, "alias name");
        if (name.isLeft()) {
            return Either.left(name.getLeft());
        }
        var content = headerContent();
        return ExpressionParser.parseLabel(content, peek().location())
                               .map(expression -> {
                                   consumer.addAlias(name.get().textValue(), expression);
                                   return true;
                               });
    }

    private Either<ParseError, Boolean> acceptance() {
        advance();
        var setCount = expect(TokenKind.INT, "number of acceptance sets");
        if (setCount.isLeft()) {
            return Either.left(setCount.getLeft());
        }
        var content = headerContent();
        return ExpressionParser.parseAcceptance(content, peek().location())
                               .map(condition -> {
                                   consumer.setAcceptanceCondition(setCount.get().intValue(), condition);
                                   return true;
                               });
    }

    private Either<ParseError, Boolean> acceptanceName() {
        advance();
        var name = expect(TokenKind.IDENTIFIER, "acceptance name extraction");
        if (name.isLeft()) {
            return Either.left(name.getLeft());
        }
        var extraInfo = new ArrayList<AccNameInfo>();
        for (var token : headerContent()) {
            switch (token.kind()) {
                case IDENTIFIER -> extraInfo.add(new AccNameInfo.StringValue(token.textValue()));
                case INT -> extraInfo.add(new AccNameInfo.IntegerValue(token.intValue()));
                case TRUE -> extraInfo.add(new AccNameInfo.BooleanValue(true));
                case FALSE -> extraInfo.add(new AccNameInfo.BooleanValue(false));
                default -> {
                    return Either.left(new ParseError.UnknownToken(token.location(), token.description()));
                }
            }
        }
        consumer.provideAcceptanceName(name.get().textValue(), List.copyOf(extraInfo));
        return CONTINUE;
    }

    private Either<ParseError, Boolean> tool() {
        advance();
        return strings("tool header").map(info -> {
            consumer.setTool(info);
            return true;
        });
    }

    private Either<ParseError, Boolean> name() {
        advance();
        return expect(TokenKind.STRING, "name header")
            .map(name -> {
                consumer.setName(name.textValue());
                return true;
            });
    }

    private Either<ParseError, Boolean> properties() {
        advance();
        return strings("properties header").map(properties -> {
            consumer.addProperties(properties);
            return true;
        });
    }

    private Either<ParseError, Boolean> unknownHeader() {
        var header = advance();
        var skipped = headerContent();
        log.debug("Skipping header {} with {} tokens", header.textValue(), skipped.size());
        return CONTINUE;
    }

    private Either<ParseError, List<String>> strings(String context) {
        var values = new ArrayList<String>();
        for (var token : headerContent()) {
            if (!token.is(TokenKind.STRING) && !token.is(TokenKind.IDENTIFIER)) {
                return Either.left(new ParseError.MismatchingToken(
                    token.location(),
                    "string",
                    token.description(),
                    context
                ));
            }
            values.add(token.textValue());
        }
        return Either.right(List.copyOf(values));
    }

    private Either<ParseError, Integer> state() {
        int start = pos;
        while (!isStateBlockEnd(peek())) {
            advance();
        }
        var block = tokens.subList(start, pos);
        return StateParser.parse(block, peek().location(), consumer);
    }

    private <T> Either<ParseError, T> abort() {
        var token = advance();
        log.debug("Automaton aborted at {}", token.location());
        consumer.notifyAbort();
        return Either.left(new ParseError.Aborted(token.location()));
    }

    /**
     * Tokens up to, but not including, the next header boundary.
     */
    private List<HoaToken> headerContent() {
        int start = pos;
        while (!peek().kind().isHeaderBoundary()) {
            advance();
        }
        return tokens.subList(start, pos);
    }

    private Either<ParseError, HoaToken> expect(TokenKind kind, String context) {
        var token = peek();
        if (token.is(kind)) {
            advance();
            return Either.right(token);
        }
        if (token.is(TokenKind.EOF)) {
            return Either.left(new ParseError.MissingToken(token.location(), kind.text(), context));
        }
        return Either.left(new ParseError.MismatchingToken(token.location(), kind.text(), token.description(), context));
    }

    private static boolean isStateBlockEnd(HoaToken token) {
        return switch (token.kind()) {
            case STATE, END, ABORT, EOF -> true;
            default -> false;
        };
    }

    private HoaToken peek() {
        return tokens.get(pos);
    }

    private HoaToken advance() {
        var token = peek();
        if (!token.is(TokenKind.EOF)) {
            pos++;
        }
        return token;
    }
}
