package org.pragmatica.hoa.parser;

/**
 * Parser configuration options.
 *
 * @param maxInputSize    maximum accepted input length in characters
 * @param commentsEnabled whether nested block comments are skipped as whitespace
 */
public record HoaParserConfig(
    int maxInputSize,
    boolean commentsEnabled
) {
    public static final int DEFAULT_MAX_INPUT_SIZE = 16 * 1024 * 1024;

    public static final HoaParserConfig DEFAULT = new HoaParserConfig(
        DEFAULT_MAX_INPUT_SIZE,
        true
    );

    public HoaParserConfig {
        if (maxInputSize < 0) {
            throw new IllegalArgumentException("maxInputSize must not be negative: " + maxInputSize);
        }
    }
}
