package io.surfworks.parloops.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for the generic textual IR form.
 *
 * <p>Memref shapes are not lexed as a unit. {@code 4x?xf32} comes out as
 * INTEGER(4), IDENTIFIER(x), QUESTION, IDENTIFIER(xf32) and
 * {@link IrParser} stitches the pieces back together, which keeps dimension
 * handling in one place.
 */
public final class IrTokenizer {

    public enum TokenType {
        IDENTIFIER,      // module, func.func, memref, f32, dense

        PERCENT_ID,      // %arg0, %1
        AT_ID,           // @main
        CARET_ID,        // ^bb0

        INTEGER,         // 0, -1, 42
        FLOAT,           // 0.0, 1.5e3, -inf
        STRING,          // "lhlo.reduce"

        LPAREN, RPAREN,
        LBRACE, RBRACE,
        LANGLE, RANGLE,
        LBRACKET, RBRACKET,
        COLON, COMMA, EQUALS, ARROW, QUESTION,

        EOF
    }

    /** A lexed token; {@code value} keeps sigils but drops string quotes. */
    public record Token(TokenType type, String value, int line, int column) {
        @Override
        public String toString() {
            return type + " '" + value + "' at " + line + ":" + column;
        }
    }

    private static final Map<Character, TokenType> PUNCTUATION = Map.ofEntries(
            Map.entry('(', TokenType.LPAREN),
            Map.entry(')', TokenType.RPAREN),
            Map.entry('{', TokenType.LBRACE),
            Map.entry('}', TokenType.RBRACE),
            Map.entry('<', TokenType.LANGLE),
            Map.entry('>', TokenType.RANGLE),
            Map.entry('[', TokenType.LBRACKET),
            Map.entry(']', TokenType.RBRACKET),
            Map.entry(':', TokenType.COLON),
            Map.entry(',', TokenType.COMMA),
            Map.entry('=', TokenType.EQUALS),
            Map.entry('?', TokenType.QUESTION));

    private static final Map<Character, TokenType> SIGILS = Map.of(
            '%', TokenType.PERCENT_ID,
            '@', TokenType.AT_ID,
            '^', TokenType.CARET_ID);

    // Exponent only after a fraction, so an extent followed by "xe..." stays a shape.
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+([eE][+-]?\\d+)?)?");

    private static final IntPredicate NAME_CHAR = c -> Character.isLetterOrDigit(c) || c == '_';
    private static final IntPredicate WORD_CHAR = NAME_CHAR.or(c -> c == '.');

    private final String input;
    private final Matcher numberMatcher;
    private int pos;
    private int line = 1;
    private int column = 1;

    public IrTokenizer(String input) {
        this.input = input;
        this.numberMatcher = NUMBER.matcher(input);
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (skipTrivia(); !atEnd(); skipTrivia()) {
            tokens.add(lexToken());
        }
        tokens.add(new Token(TokenType.EOF, "", line, column));
        return tokens;
    }

    private Token lexToken() {
        int startLine = line;
        int startCol = column;
        char c = input.charAt(pos);

        if (lookingAt("->")) {
            return new Token(TokenType.ARROW, consume(2), startLine, startCol);
        }
        if (lookingAt("-inf")) {
            return new Token(TokenType.FLOAT, consume(4), startLine, startCol);
        }
        TokenType punct = PUNCTUATION.get(c);
        if (punct != null) {
            return new Token(punct, consume(1), startLine, startCol);
        }
        TokenType sigil = SIGILS.get(c);
        if (sigil != null) {
            String name = consume(1) + consumeWhile(NAME_CHAR);
            if (name.length() == 1) {
                throw new IrParseException("Empty name after '" + c + "'", startLine, startCol);
            }
            return new Token(sigil, name, startLine, startCol);
        }
        if (c == '"') {
            return new Token(TokenType.STRING, lexQuoted(startLine, startCol), startLine, startCol);
        }
        if (numberMatcher.region(pos, input.length()).lookingAt()) {
            String literal = consume(numberMatcher.end() - pos);
            TokenType type = numberMatcher.group(1) != null ? TokenType.FLOAT : TokenType.INTEGER;
            return new Token(type, literal, startLine, startCol);
        }
        if (Character.isLetter(c) || c == '_') {
            return new Token(TokenType.IDENTIFIER, consumeWhile(WORD_CHAR), startLine, startCol);
        }
        throw new IrParseException(String.format("Unexpected character '%c'", c), startLine, startCol);
    }

    private String lexQuoted(int startLine, int startCol) {
        StringBuilder text = new StringBuilder();
        consume(1);
        while (true) {
            if (atEnd() || input.charAt(pos) == '\n') {
                throw new IrParseException("Unterminated string literal", startLine, startCol);
            }
            char c = input.charAt(pos);
            if (c == '"') {
                consume(1);
                return text.toString();
            }
            if (c == '\\' && pos + 1 < input.length()) {
                consume(1);
            }
            text.append(consume(1));
        }
    }

    /** Skips whitespace and {@code //} line comments. */
    private void skipTrivia() {
        while (!atEnd()) {
            if (Character.isWhitespace(input.charAt(pos))) {
                consume(1);
            } else if (lookingAt("//")) {
                consumeWhile(c -> c != '\n');
            } else {
                return;
            }
        }
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private boolean lookingAt(String text) {
        return input.startsWith(text, pos);
    }

    private String consumeWhile(IntPredicate accept) {
        int end = pos;
        while (end < input.length() && accept.test(input.charAt(end))) {
            end++;
        }
        return consume(end - pos);
    }

    /** Consumes {@code count} characters, keeping line and column in step. */
    private String consume(int count) {
        String text = input.substring(pos, pos + count);
        for (int i = 0; i < count; i++) {
            if (input.charAt(pos++) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return text;
    }
}
