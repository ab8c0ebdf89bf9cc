package org.pragmatica.hoa.tree;

/**
 * Acceptance condition in negation-normal form over {@link AcceptanceAtom}s.
 * There is no negation node: negation is folded into the atoms.
 */
public sealed interface AcceptanceCondition {

    static AcceptanceCondition of(AcceptanceAtom atom) {
        return new Atom(atom);
    }

    static AcceptanceCondition of(boolean value) {
        return new BooleanValue(value);
    }

    default AcceptanceCondition and(AcceptanceCondition other) {
        return new Conjunction(this, other);
    }

    default AcceptanceCondition or(AcceptanceCondition other) {
        return new Disjunction(this, other);
    }

    /**
     * Negate an atom or a literal. Compound conditions cannot be negated.
     *
     * @throws IllegalStateException if this is a conjunction or disjunction
     */
    AcceptanceCondition negate();

    record Atom(AcceptanceAtom atom) implements AcceptanceCondition {
        @Override
        public AcceptanceCondition negate() {
            return new Atom(atom.negate());
        }

        @Override
        public String toString() {
            return atom.toString();
        }
    }

    record BooleanValue(boolean value) implements AcceptanceCondition {
        @Override
        public AcceptanceCondition negate() {
            return new BooleanValue(!value);
        }

        @Override
        public String toString() {
            return value ? "t" : "f";
        }
    }

    record Conjunction(AcceptanceCondition left, AcceptanceCondition right) implements AcceptanceCondition {
        @Override
        public AcceptanceCondition negate() {
            throw new IllegalStateException("Negation cannot be pushed through '&' in " + this);
        }

        @Override
        public String toString() {
            return "(" + left + " & " + right + ")";
        }
    }

    record Disjunction(AcceptanceCondition left, AcceptanceCondition right) implements AcceptanceCondition {
        @Override
        public AcceptanceCondition negate() {
            throw new IllegalStateException("Negation cannot be pushed through '|' in " + this);
        }

        @Override
        public String toString() {
            return "(" + left + " | " + right + ")";
        }
    }
}
