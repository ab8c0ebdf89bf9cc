package org.pragmatica.hoa.parser;

import io.vavr.control.Either;
import org.pragmatica.hoa.consumer.HoaConsumer;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.HoaToken;
import org.pragmatica.hoa.model.HoaAutomaton;

import java.util.List;

/**
 * Parser interface - parses HOA text with a fixed configuration.
 */
public interface Parser {

    HoaParserConfig config();

    /**
     * Tokenize input without parsing it.
     */
    Either<ParseError, List<HoaToken>> tokenize(String input);

    /**
     * Parse input, sending events to the consumer. Returns the consumer on success.
     */
    <C extends HoaConsumer> Either<ParseError, C> parse(String input, C consumer);

    /**
     * Parse input into an automaton model.
     */
    Either<ParseError, HoaAutomaton> parseAutomaton(String input);

    static Parser create(HoaParserConfig config) {
        return new ConfiguredParser(config);
    }
}
