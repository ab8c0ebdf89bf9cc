package org.pragmatica.hoa.parser;

import io.vavr.control.Either;
import org.pragmatica.hoa.consumer.AutomatonBuilder;
import org.pragmatica.hoa.consumer.HoaConsumer;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.HoaLexer;
import org.pragmatica.hoa.lexer.HoaToken;
import org.pragmatica.hoa.model.HoaAutomaton;

import java.util.List;

record ConfiguredParser(HoaParserConfig config) implements Parser {

    @Override
    public Either<ParseError, List<HoaToken>> tokenize(String input) {
        return HoaLexer.tokenize(input, config);
    }

    @Override
    public <C extends HoaConsumer> Either<ParseError, C> parse(String input, C consumer) {
        return tokenize(input).flatMap(tokens -> AutomatonParser.parse(tokens, consumer));
    }

    @Override
    public Either<ParseError, HoaAutomaton> parseAutomaton(String input) {
        return parse(input, new AutomatonBuilder()).map(AutomatonBuilder::build);
    }
}
