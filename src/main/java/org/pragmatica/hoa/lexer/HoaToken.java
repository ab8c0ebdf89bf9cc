package org.pragmatica.hoa.lexer;

import io.vavr.control.Option;
import org.pragmatica.hoa.tree.SourceLocation;

/**
 * Token with its kind, optional payload and the location of its first character.
 * At most one of {@code text} and {@code integer} is present.
 */
public record HoaToken(TokenKind kind, Option<String> text, Option<Integer> integer, SourceLocation location) {

    public static HoaToken of(TokenKind kind, SourceLocation location) {
        return new HoaToken(kind, Option.none(), Option.none(), location);
    }

    public static HoaToken ofText(TokenKind kind, String text, SourceLocation location) {
        return new HoaToken(kind, Option.some(text), Option.none(), location);
    }

    public static HoaToken ofInt(int value, SourceLocation location) {
        return new HoaToken(TokenKind.INT, Option.none(), Option.some(value), location);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public int intValue() {
        return integer.getOrElseThrow(() -> new IllegalStateException("Token " + this + " carries no integer"));
    }

    public String textValue() {
        return text.getOrElseThrow(() -> new IllegalStateException("Token " + this + " carries no text"));
    }

    /**
     * Short description used in error messages.
     */
    public String description() {
        return switch (kind) {
            case INT -> "integer " + intValue();
            case IDENTIFIER -> "identifier '" + textValue() + "'";
            case STRING -> "\"" + textValue() + "\"";
            case HEADER_NAME -> "header " + textValue();
            case ALIAS_NAME -> "@" + textValue();
            default -> kind.text();
        };
    }

    @Override
    public String toString() {
        var payload = text.orElse(integer.map(String::valueOf))
                          .map(value -> "(" + value + ")")
                          .getOrElse("");
        return kind + payload + " at " + location;
    }
}
