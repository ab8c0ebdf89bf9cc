package org.pragmatica.hoa.error;

import org.pragmatica.hoa.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    /**
     * One-line human-readable message.
     */
    String message();

    /**
     * Short stable code used by {@link Diagnostic}.
     */
    String code();

    /**
     * Malformed token.
     */
    record LexError(SourceLocation location, String reason) implements ParseError {
        @Override
        public String message() {
            return "Lexical error at " + location.display() + ": " + reason;
        }

        @Override
        public String code() {
            return "E0001";
        }
    }

    /**
     * Required token not present because input (or the enclosing block) ended.
     */
    record MissingToken(SourceLocation location, String expected, String context) implements ParseError {
        @Override
        public String message() {
            return "Necessary token " + expected + " is missing in " + context + " at " + location.display();
        }

        @Override
        public String code() {
            return "E0002";
        }
    }

    /**
     * Required token replaced by a different one.
     */
    record MismatchingToken(SourceLocation location, String expected, String actual, String context)
            implements ParseError {
        @Override
        public String message() {
            return "Syntax error, expected " + expected + " but got " + actual + " in " + context
                   + " at " + location.display();
        }

        @Override
        public String code() {
            return "E0003";
        }
    }

    /**
     * Expression grammar could not complete.
     */
    record UnexpectedEnd(SourceLocation location, String reason) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of expression at " + location.display() + ": " + reason;
        }

        @Override
        public String code() {
            return "E0004";
        }
    }

    /**
     * Token with an unrecognized value.
     */
    record UnknownToken(SourceLocation location, String token) implements ParseError {
        @Override
        public String message() {
            return "Unexpected token " + token + " at " + location.display();
        }

        @Override
        public String code() {
            return "E0005";
        }
    }

    record ZeroAtomicPropositions(SourceLocation location) implements ParseError {
        @Override
        public String message() {
            return "At least one atomic proposition is needed, got AP: 0 at " + location.display();
        }

        @Override
        public String code() {
            return "E0006";
        }
    }

    /**
     * The producer gave up on the automaton with {@code --ABORT--}.
     */
    record Aborted(SourceLocation location) implements ParseError {
        @Override
        public String message() {
            return "Automaton aborted by --ABORT-- at " + location.display();
        }

        @Override
        public String code() {
            return "E0007";
        }
    }
}
