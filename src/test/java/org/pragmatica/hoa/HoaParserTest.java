package org.pragmatica.hoa;

import org.junit.jupiter.api.Test;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.TokenKind;
import org.pragmatica.hoa.parser.HoaParserConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class HoaParserTest {

    private static final String COMMENTED = """
        HOA: v1 /* generated */
        AP: 1 "p"
        --BODY--
        State: 0 /* sink */
          [t] 0
        --END--
        """;

    @Test
    void parseAutomaton_defaultParser_acceptsComments() {
        var result = HoaParser.parseAutomaton(COMMENTED);

        assertTrue(result.isRight());
        assertThat(result.get().aps()).containsExactly("p");
        assertThat(result.get().states()).hasSize(1);
    }

    @Test
    void parse_deliversEventsToConsumer() {
        var result = HoaParser.parse(COMMENTED, new RecordingConsumer());

        assertThat(result.get().events()).containsExactly(
            "headerStart(v1)",
            "aps([p])",
            "state(0, none, none, none)",
            "edge(0, t, [0], none)",
            "endOfState(0)"
        );
    }

    @Test
    void tokenize_endsWithEof() {
        var tokens = HoaParser.tokenize("HOA: v1").get();

        assertEquals(TokenKind.EOF, tokens.get(tokens.size() - 1).kind());
    }

    @Test
    void builder_commentsDisabled_rejectsComment() {
        var parser = HoaParser.builder()
                              .comments(false)
                              .build();

        var result = parser.parseAutomaton(COMMENTED);

        assertFalse(parser.config().commentsEnabled());
        assertTrue(result.isLeft());
        assertInstanceOf(ParseError.LexError.class, result.getLeft());
    }

    @Test
    void builder_maxInputSize_enforced() {
        var parser = HoaParser.builder()
                              .maxInputSize(10)
                              .build();

        var result = parser.parse(COMMENTED, new RecordingConsumer());

        assertTrue(result.isLeft());
        assertThat(result.getLeft().message()).contains("exceeds maximum size");
    }

    @Test
    void builder_negativeMaxInputSize_rejected() {
        assertThatThrownBy(() -> HoaParser.builder().maxInputSize(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultConfig_values() {
        assertEquals(16 * 1024 * 1024, HoaParserConfig.DEFAULT.maxInputSize());
        assertTrue(HoaParserConfig.DEFAULT.commentsEnabled());
    }

    @Test
    void describe_rendersErrorAgainstInput() {
        var input = "HOA: v1\n--BODY--\nState: 0\n  [0 & ] 0\n--END--\n";
        var error = HoaParser.parseAutomaton(input).getLeft();

        var description = HoaParser.describe(error, input, "broken.hoa");

        assertThat(description).startsWith("error[E0004]: ");
        assertThat(description).contains("--> broken.hoa:4:8");
        assertThat(description).contains("4 |   [0 & ] 0\n");
        assertThat(description).contains("  |        ^\n");
    }
}
