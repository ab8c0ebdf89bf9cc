package org.pragmatica.hoa.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ExpressionTreeTest {

    @Test
    void booleanExpression_display_parenthesizesBinaryNodes() {
        var expression = BooleanExpression.ap(0)
                                          .not()
                                          .and(BooleanExpression.alias("x").or(BooleanExpression.ofTrue()));

        assertEquals("(!0 & (@x | t))", expression.toString());
    }

    @Test
    void acceptanceAtom_display_showsComplement() {
        assertEquals("Fin(3)", AcceptanceAtom.fin(3).toString());
        assertEquals("Fin(!3)", AcceptanceAtom.finNegated(3).toString());
        assertEquals("Inf(0)", AcceptanceAtom.inf(0).toString());
        assertEquals("Inf(!0)", AcceptanceAtom.infNegated(0).toString());
    }

    @Test
    void acceptanceAtom_negate_isInvolution() {
        for (var kind : AcceptanceAtom.Kind.values()) {
            var atom = new AcceptanceAtom(kind, 2);
            assertThat(atom.negate()).isNotEqualTo(atom);
            assertThat(atom.negate().negate()).isEqualTo(atom);
        }
    }

    @Test
    void acceptanceAtom_negate_flipsComplementOnly() {
        assertEquals(AcceptanceAtom.finNegated(1), AcceptanceAtom.fin(1).negate());
        assertEquals(AcceptanceAtom.inf(1), AcceptanceAtom.infNegated(1).negate());
    }

    @Test
    void acceptanceCondition_negate_literalAndAtom() {
        assertEquals(AcceptanceCondition.of(false), AcceptanceCondition.of(true).negate());
        assertEquals(AcceptanceCondition.of(AcceptanceAtom.infNegated(4)),
                     AcceptanceCondition.of(AcceptanceAtom.inf(4)).negate());
    }

    @Test
    void acceptanceCondition_negateCompound_throws() {
        var conjunction = AcceptanceCondition.of(AcceptanceAtom.fin(0)).and(AcceptanceCondition.of(true));
        var disjunction = AcceptanceCondition.of(AcceptanceAtom.fin(0)).or(AcceptanceCondition.of(false));

        assertThatThrownBy(conjunction::negate).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(disjunction::negate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void acceptanceCondition_display() {
        var condition = AcceptanceCondition.of(AcceptanceAtom.fin(0))
                                           .or(AcceptanceCondition.of(AcceptanceAtom.infNegated(1))
                                                                  .and(AcceptanceCondition.of(true)));

        assertEquals("(Fin(0) | (Inf(!1) & t))", condition.toString());
    }

    @Test
    void sourceLocation_display_isOneBased() {
        var location = SourceLocation.at(2, 7);

        assertEquals("line 3, column 8", location.display());
        assertEquals("2:7", location.toString());
    }
}
