package org.pragmatica.hoa.parser;

import io.vavr.control.Either;
import org.junit.jupiter.api.Test;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.lexer.HoaLexer;
import org.pragmatica.hoa.tree.AcceptanceAtom;
import org.pragmatica.hoa.tree.AcceptanceCondition;
import org.pragmatica.hoa.tree.BooleanExpression;
import org.pragmatica.hoa.tree.SourceLocation;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    // === Labels ===

    @Test
    void parseLabel_negationBindsToTerm() {
        assertEquals("(!t | f)", label("!t | f").get().toString());
    }

    @Test
    void parseLabel_disjunctionOfConjunction() {
        var expression = label("t | f & f").get();

        assertEquals(BooleanExpression.ofTrue().or(BooleanExpression.ofFalse().and(BooleanExpression.ofFalse())),
                     expression);
    }

    @Test
    void parseLabel_conjunctionAbsorbsFollowingDisjunction() {
        assertEquals("(0 & (1 | 2))", label("0 & 1 | 2").get().toString());
    }

    @Test
    void parseLabel_parenthesesGroup() {
        assertEquals("((0 | 1) & 2)", label("(0 | 1) & 2").get().toString());
        assertEquals("!(0 & @a)", label("!(0 & @a)").get().toString());
    }

    @Test
    void parseLabel_doubleNegation_kept() {
        assertEquals(BooleanExpression.ap(0).not().not(), label("!!0").get());
    }

    @Test
    void parseLabel_aliasReference_notResolved() {
        assertEquals(BooleanExpression.alias("undefined").and(BooleanExpression.ap(3)),
                     label("@undefined & 3").get());
    }

    @Test
    void parseLabel_trailingTokens_ignored() {
        assertEquals(BooleanExpression.ap(0), label("0 1").get());
    }

    @Test
    void parseLabel_danglingOperator_fails() {
        var result = label("0 &");

        assertTrue(result.isLeft());
        assertInstanceOf(ParseError.UnexpectedEnd.class, result.getLeft());
        assertEquals(SourceLocation.at(0, 3), result.getLeft().location());
    }

    @Test
    void parseLabel_unexpectedToken_fails() {
        var result = label("]");

        assertTrue(result.isLeft());
        var error = assertInstanceOf(ParseError.MismatchingToken.class, result.getLeft());
        assertEquals("]", error.actual());
        assertEquals("label expression", error.context());
    }

    @Test
    void parseLabel_unclosedParenthesis_fails() {
        var result = label("(0");

        assertTrue(result.isLeft());
        assertInstanceOf(ParseError.UnexpectedEnd.class, result.getLeft());
        assertThat(result.getLeft().message()).contains("closing parenthesis");
    }

    @Test
    void parseLabel_emptySlice_reportsEndLocation() {
        var result = ExpressionParser.parseLabel(List.of(), SourceLocation.at(4, 2));

        assertTrue(result.isLeft());
        assertEquals(SourceLocation.at(4, 2), result.getLeft().location());
    }

    @Test
    void stateConjunction_readsTargetsAndStopsAfterLast() {
        var tokens = HoaLexer.tokenize("0 & 1 & 2 {0}").get();
        var parsed = new LabelExpressionParser(tokens, SourceLocation.START).stateConjunction(0).get();

        assertThat(parsed.node()).containsExactly(0, 1, 2);
        assertEquals(5, parsed.next());
    }

    @Test
    void stateConjunction_missingTarget_fails() {
        var tokens = HoaLexer.tokenize("0 &").get();
        var result = new LabelExpressionParser(tokens, SourceLocation.START).stateConjunction(0);

        assertTrue(result.isLeft());
        var error = assertInstanceOf(ParseError.MissingToken.class, result.getLeft());
        assertEquals("edge", error.context());
    }

    @Test
    void stateConjunction_nonIntegerTarget_fails() {
        var tokens = HoaLexer.tokenize("0 & t").get();
        var result = new LabelExpressionParser(tokens, SourceLocation.START).stateConjunction(0);

        assertTrue(result.isLeft());
        assertInstanceOf(ParseError.MismatchingToken.class, result.getLeft());
        assertEquals(SourceLocation.at(0, 4), result.getLeft().location());
    }

    // === Acceptance conditions ===

    @Test
    void parseAcceptance_conjunctionOfAtoms() {
        var condition = acceptance("Fin(0) & Inf(!0)").get();

        assertEquals(AcceptanceCondition.of(AcceptanceAtom.fin(0))
                                        .and(AcceptanceCondition.of(AcceptanceAtom.infNegated(0))),
                     condition);
    }

    @Test
    void parseAcceptance_negatedAtom_foldedIntoAtom() {
        var negated = acceptance("!Fin(3)").get();

        assertEquals(acceptance("Fin(3)").get().negate(), negated);
        assertEquals(AcceptanceCondition.of(AcceptanceAtom.finNegated(3)), negated);
        assertEquals(AcceptanceCondition.of(AcceptanceAtom.inf(1)), acceptance("!!Inf(1)").get());
        assertEquals(AcceptanceCondition.of(false), acceptance("!t").get());
    }

    @Test
    void parseAcceptance_parenthesizedDisjunction() {
        assertEquals("((Fin(0) | Inf(1)) & Fin(2))", acceptance("(Fin(0) | Inf(1)) & Fin(2)").get().toString());
    }

    @Test
    void parseAcceptance_literals() {
        assertEquals(AcceptanceCondition.of(true), acceptance("t").get());
        assertEquals(AcceptanceCondition.of(false), acceptance("f").get());
    }

    @Test
    void parseAcceptance_unknownSetKeyword_fails() {
        var result = acceptance("Foo(0)");

        assertTrue(result.isLeft());
        var error = assertInstanceOf(ParseError.UnknownToken.class, result.getLeft());
        assertEquals("identifier 'Foo'", error.token());
    }

    @Test
    void parseAcceptance_missingOpenParenthesis_fails() {
        var result = acceptance("Fin 0");

        assertTrue(result.isLeft());
        var error = assertInstanceOf(ParseError.MismatchingToken.class, result.getLeft());
        assertEquals("'('", error.expected());
        assertEquals("integer 0", error.actual());
    }

    @Test
    void parseAcceptance_missingSetNumber_fails() {
        var result = acceptance("Fin(");

        assertTrue(result.isLeft());
        assertInstanceOf(ParseError.UnexpectedEnd.class, result.getLeft());
    }

    @Test
    void parseAcceptance_complementWithoutNumber_fails() {
        var result = acceptance("Fin(!)");

        assertTrue(result.isLeft());
        var error = assertInstanceOf(ParseError.MismatchingToken.class, result.getLeft());
        assertEquals("integer after '!'", error.expected());
    }

    @Test
    void parseAcceptance_missingCloseParenthesis_fails() {
        var result = acceptance("Fin(0");

        assertTrue(result.isLeft());
        assertInstanceOf(ParseError.UnexpectedEnd.class, result.getLeft());
    }

    @Test
    void parseAcceptance_negatedCompound_fails() {
        var result = acceptance("!(Fin(0) & Inf(1))");

        assertTrue(result.isLeft());
        assertInstanceOf(ParseError.MismatchingToken.class, result.getLeft());
        assertEquals(SourceLocation.START, result.getLeft().location());
    }

    private static Either<ParseError, BooleanExpression> label(String input) {
        return HoaLexer.tokenize(input).flatMap(ExpressionParser::parseLabel);
    }

    private static Either<ParseError, AcceptanceCondition> acceptance(String input) {
        return HoaLexer.tokenize(input).flatMap(ExpressionParser::parseAcceptance);
    }
}
