package org.pragmatica.hoa.lexer;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.hoa.error.ParseError;
import org.pragmatica.hoa.parser.HoaParserConfig;
import org.pragmatica.hoa.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lexer for the HOA format.
 * Produces the complete token list in one pass; the last token is always {@link TokenKind#EOF}.
 */
public final class HoaLexer {
    private static final Logger log = LoggerFactory.getLogger(HoaLexer.class);

    private static final int DEFAULT_TOKEN_CAPACITY = 16;
    private static final String[] MARKERS = {"ABORT--", "BODY--", "END--"};

    private final String input;
    private final boolean commentsEnabled;
    private final Map<String, TokenKind> headerKeywords;
    private int pos;
    private int line;
    private int column;

    private HoaLexer(String input, boolean commentsEnabled) {
        this.input = input;
        this.commentsEnabled = commentsEnabled;
        this.headerKeywords = Map.ofEntries(
            Map.entry("HOA:", TokenKind.HOA),
            Map.entry("State:", TokenKind.STATE),
            Map.entry("States:", TokenKind.STATES),
            Map.entry("Start:", TokenKind.START),
            Map.entry("AP:", TokenKind.AP),
            Map.entry("Alias:", TokenKind.ALIAS),
            Map.entry("Acceptance:", TokenKind.ACCEPTANCE),
            Map.entry("acc-name:", TokenKind.ACC_NAME),
            Map.entry("tool:", TokenKind.TOOL),
            Map.entry("name:", TokenKind.NAME),
            Map.entry("properties:", TokenKind.PROPERTIES)
        );
        this.pos = 0;
        this.line = 0;
        this.column = 0;
    }

    public static Either<ParseError, List<HoaToken>> tokenize(String input) {
        return tokenize(input, HoaParserConfig.DEFAULT);
    }

    public static Either<ParseError, List<HoaToken>> tokenize(String input, HoaParserConfig config) {
        if (input.length() > config.maxInputSize()) {
            return Either.left(new ParseError.LexError(
                SourceLocation.START,
                "input of " + input.length() + " characters exceeds maximum size of "
                + config.maxInputSize() + " characters"
            ));
        }
        return new HoaLexer(input, config.commentsEnabled()).tokenizeAll();
    }

    private Either<ParseError, List<HoaToken>> tokenizeAll() {
        var tokens = new ArrayList<HoaToken>();
        while (true) {
            var skipped = skipWhitespaceAndComments();
            if (skipped.isDefined()) {
                return Either.left(skipped.get());
            }
            if (isAtEnd()) {
                break;
            }
            var token = nextToken();
            if (token.isLeft()) {
                return Either.left(token.getLeft());
            }
            tokens.add(token.get());
        }
        tokens.add(HoaToken.of(TokenKind.EOF, endOfInputLocation()));
        log.debug("Tokenized {} characters into {} tokens", input.length(), tokens.size());
        return Either.right(List.copyOf(tokens));
    }

    private Either<ParseError, HoaToken> nextToken() {
        var start = currentLocation();
        char c = peek();

        if (c == '-') {
            return scanMarker(start);
        }
        if (c == '"') {
            return scanString(start);
        }
        if (isDigit(c)) {
            return scanInteger(start);
        }
        if (c == '@') {
            advance();
            // skip @
            return Either.right(HoaToken.ofText(TokenKind.ALIAS_NAME, scanWord(false), start));
        }
        if (isIdentifierStart(c)) {
            return Either.right(scanIdentifierOrHeader(start));
        }
        return scanPunctuation(start);
    }

    private Either<ParseError, HoaToken> scanPunctuation(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case '!' -> Either.right(HoaToken.of(TokenKind.NOT, start));
            case '&' -> Either.right(HoaToken.of(TokenKind.AND, start));
            case '|' -> Either.right(HoaToken.of(TokenKind.OR, start));
            case '(' -> Either.right(HoaToken.of(TokenKind.LPAREN, start));
            case ')' -> Either.right(HoaToken.of(TokenKind.RPAREN, start));
            case '[' -> Either.right(HoaToken.of(TokenKind.LBRACKET, start));
            case ']' -> Either.right(HoaToken.of(TokenKind.RBRACKET, start));
            case '{' -> Either.right(HoaToken.of(TokenKind.LBRACE, start));
            case '}' -> Either.right(HoaToken.of(TokenKind.RBRACE, start));
            default -> Either.left(new ParseError.LexError(start, "unrecognized character '" + c + "'"));
        };
    }

    private Either<ParseError, HoaToken> scanMarker(SourceLocation start) {
        advance();
        // skip first -
        if (isAtEnd() || peek() != '-') {
            return Either.left(new ParseError.LexError(start, "markers need two dashes (--)"));
        }
        advance();
        for (var marker : MARKERS) {
            if (!isAtEnd() && peek() == marker.charAt(0)) {
                if (!input.startsWith(marker, pos)) {
                    return Either.left(new ParseError.LexError(start, "unrecognized marker, expected --" + marker));
                }
                for (int i = 0; i < marker.length(); i++) {
                    advance();
                }
                return Either.right(HoaToken.of(markerKind(marker), start));
            }
        }
        return Either.left(new ParseError.LexError(start, "unrecognized marker, expected --ABORT--, --BODY-- or --END--"));
    }

    private static TokenKind markerKind(String marker) {
        return switch (marker) {
            case "ABORT--" -> TokenKind.ABORT;
            case "BODY--" -> TokenKind.BODY;
            default -> TokenKind.END;
        };
    }

    private Either<ParseError, HoaToken> scanString(SourceLocation start) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                // escaped character is kept verbatim together with the backslash
                sb.append(advance());
            }
            sb.append(advance());
        }
        if (isAtEnd()) {
            return Either.left(new ParseError.LexError(start, "premature end of input in quoted string"));
        }
        advance();
        // skip closing quote
        return Either.right(HoaToken.ofText(TokenKind.STRING, sb.toString(), start));
    }

    private Either<ParseError, HoaToken> scanInteger(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        try {
            return Either.right(HoaToken.ofInt(Integer.parseInt(sb.toString()), start));
        } catch (NumberFormatException e) {
            return Either.left(new ParseError.LexError(start, "integer out of range: " + sb));
        }
    }

    /**
     * Words may contain ':'; only a word ending in ':' is a header.
     */
    private HoaToken scanIdentifierOrHeader(SourceLocation start) {
        var text = scanWord(true);
        if (text.endsWith(":")) {
            var kind = headerKeywords.get(text);
            return kind != null
                   ? HoaToken.of(kind, start)
                   : HoaToken.ofText(TokenKind.HEADER_NAME, text, start);
        }
        return switch (text) {
            case "t" -> HoaToken.of(TokenKind.TRUE, start);
            case "f" -> HoaToken.of(TokenKind.FALSE, start);
            default -> HoaToken.ofText(TokenKind.IDENTIFIER, text, start);
        };
    }

    private String scanWord(boolean withColon) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && (isWordPart(peek()) || (withColon && peek() == ':'))) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private Option<ParseError> skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (commentsEnabled && c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '*') {
                var start = currentLocation();
                if (!skipComment()) {
                    return Option.some(new ParseError.LexError(start, "unterminated comment"));
                }
            } else {
                break;
            }
        }
        return Option.none();
    }

    /**
     * Skip a possibly nested comment. Returns false if input ends inside it.
     */
    private boolean skipComment() {
        int depth = 0;
        while (!isAtEnd()) {
            if (input.startsWith("/*", pos)) {
                advance();
                advance();
                depth++;
            } else if (input.startsWith("*/", pos)) {
                advance();
                advance();
                depth--;
                if (depth == 0) {
                    return true;
                }
            } else {
                advance();
            }
        }
        return false;
    }

    /**
     * End of the last line. A trailing line break does not open a new line.
     */
    private SourceLocation endOfInputLocation() {
        if (!input.endsWith("\n")) {
            return currentLocation();
        }
        var text = input.substring(0, input.length() - 1);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return SourceLocation.at(line - 1, text.length() - text.lastIndexOf('\n') - 1);
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isWordPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '-';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
