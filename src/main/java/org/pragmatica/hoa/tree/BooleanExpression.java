package org.pragmatica.hoa.tree;

/**
 * Boolean expression over atomic propositions, aliases and literals.
 * Used for alias definitions and state/edge labels.
 */
public sealed interface BooleanExpression {

    static BooleanExpression ofTrue() {
        return new Atom(new BooleanAtom.BooleanValue(true));
    }

    static BooleanExpression ofFalse() {
        return new Atom(new BooleanAtom.BooleanValue(false));
    }

    static BooleanExpression ap(int index) {
        return new Atom(new BooleanAtom.ApIndex(index));
    }

    static BooleanExpression alias(String name) {
        return new Atom(new BooleanAtom.AliasName(name));
    }

    default BooleanExpression and(BooleanExpression other) {
        return new Conjunction(this, other);
    }

    default BooleanExpression or(BooleanExpression other) {
        return new Disjunction(this, other);
    }

    default BooleanExpression not() {
        return new Negation(this);
    }

    /**
     * Atom of a boolean expression: literal, AP index or alias reference.
     */
    sealed interface BooleanAtom {
        record BooleanValue(boolean value) implements BooleanAtom {
            @Override
            public String toString() {
                return value ? "t" : "f";
            }
        }

        record ApIndex(int index) implements BooleanAtom {
            @Override
            public String toString() {
                return Integer.toString(index);
            }
        }

        /**
         * Alias reference, name stored without the leading '@'.
         */
        record AliasName(String name) implements BooleanAtom {
            @Override
            public String toString() {
                return "@" + name;
            }
        }
    }

    record Atom(BooleanAtom atom) implements BooleanExpression {
        @Override
        public String toString() {
            return atom.toString();
        }
    }

    record Negation(BooleanExpression operand) implements BooleanExpression {
        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    record Conjunction(BooleanExpression left, BooleanExpression right) implements BooleanExpression {
        @Override
        public String toString() {
            return "(" + left + " & " + right + ")";
        }
    }

    record Disjunction(BooleanExpression left, BooleanExpression right) implements BooleanExpression {
        @Override
        public String toString() {
            return "(" + left + " | " + right + ")";
        }
    }
}
