package org.pragmatica.hoa.tree;

/**
 * Acceptance-set reference: {@code Fin(n)}, {@code Fin(!n)}, {@code Inf(n)} or {@code Inf(!n)}.
 */
public record AcceptanceAtom(Kind kind, int set) {

    public enum Kind {
        FIN("Fin", false),
        FIN_NEGATED("Fin", true),
        INF("Inf", false),
        INF_NEGATED("Inf", true);

        private final String keyword;
        private final boolean complemented;

        Kind(String keyword, boolean complemented) {
            this.keyword = keyword;
            this.complemented = complemented;
        }

        public String keyword() {
            return keyword;
        }

        public boolean complemented() {
            return complemented;
        }

        public Kind negate() {
            return switch (this) {
                case FIN -> FIN_NEGATED;
                case FIN_NEGATED -> FIN;
                case INF -> INF_NEGATED;
                case INF_NEGATED -> INF;
            };
        }
    }

    public static AcceptanceAtom fin(int set) {
        return new AcceptanceAtom(Kind.FIN, set);
    }

    public static AcceptanceAtom finNegated(int set) {
        return new AcceptanceAtom(Kind.FIN_NEGATED, set);
    }

    public static AcceptanceAtom inf(int set) {
        return new AcceptanceAtom(Kind.INF, set);
    }

    public static AcceptanceAtom infNegated(int set) {
        return new AcceptanceAtom(Kind.INF_NEGATED, set);
    }

    public AcceptanceAtom negate() {
        return new AcceptanceAtom(kind.negate(), set);
    }

    @Override
    public String toString() {
        return kind.keyword() + "(" + (kind.complemented() ? "!" : "") + set + ")";
    }
}
