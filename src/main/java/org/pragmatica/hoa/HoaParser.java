package org.pragmatica.hoa;

import io.vavr.control.Either;
import org.pragmatica.hoa.consumer.HoaConsumer;
import org.pragmatica.hoa.error.Diagnostic;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.HoaToken;
import org.pragmatica.hoa.model.HoaAutomaton;
import org.pragmatica.hoa.parser.HoaParserConfig;
import org.pragmatica.hoa.parser.Parser;

import java.util.List;

/**
 * Entry point for parsing HOA automata.
 *
 * <p>Example usage:
 * <pre>{@code
 * var automaton = HoaParser.parseAutomaton("""
 *     HOA: v1
 *     States: 1
 *     Start: 0
 *     AP: 1 "a"
 *     Acceptance: 1 Inf(0)
 *     --BODY--
 *     State: 0 [0] 0 {0}
 *     --END--
 *     """);
 * }</pre>
 */
public final class HoaParser {
    private static final Parser DEFAULT_PARSER = Parser.create(HoaParserConfig.DEFAULT);

    private HoaParser() {}

    /**
     * Parse input, sending events to the consumer.
     */
    public static <C extends HoaConsumer> Either<ParseError, C> parse(String input, C consumer) {
        return DEFAULT_PARSER.parse(input, consumer);
    }

    /**
     * Parse input into an automaton model.
     */
    public static Either<ParseError, HoaAutomaton> parseAutomaton(String input) {
        return DEFAULT_PARSER.parseAutomaton(input);
    }

    /**
     * Tokenize input without parsing it.
     */
    public static Either<ParseError, List<HoaToken>> tokenize(String input) {
        return DEFAULT_PARSER.tokenize(input);
    }

    /**
     * Render an error against its source, e.g. for command line tools.
     *
     * @param filename name shown in the location line, may be {@code null}
     */
    public static String describe(ParseError error, String input, String filename) {
        return Diagnostic.of(error).format(input, filename);
    }

    /**
     * Create a builder for a parser with non-default configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxInputSize = HoaParserConfig.DEFAULT_MAX_INPUT_SIZE;
        private boolean comments = true;

        private Builder() {}

        public Builder maxInputSize(int size) {
            this.maxInputSize = size;
            return this;
        }

        public Builder comments(boolean enabled) {
            this.comments = enabled;
            return this;
        }

        public Parser build() {
            return Parser.create(new HoaParserConfig(maxInputSize, comments));
        }
    }
}
