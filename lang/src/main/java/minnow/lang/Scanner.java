package minnow.lang;

import static minnow.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Single left-to-right scan of the source text into a flat token list. The
 * first unrecognized character aborts the scan with a {@link LexError}.
 */
@RequiredArgsConstructor
final class Scanner {

    private final @NonNull String source;
    private List<Token> tokens;

    private int start = 0;
    private int current = 0;
    private int lineStart = 0;
    private int line = 1;

    List<Token> getTokens() {
        if (tokens != null) {
            return tokens;
        }

        var scanned = new ArrayList<Token>();
        while (!isAtEnd()) {
            start = current;
            var token = scanToken();
            if (token != null) {
                scanned.add(token);
            }
        }

        tokens = Collections.unmodifiableList(scanned);
        return tokens;
    }

    private int getColumn() {
        return 1 + start - lineStart;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private Token scanToken() {
        var c = advance();
        switch (c) {
        case '(':
        case ')':
            return token(PAREN);

        case '\n':
            line++;
            lineStart = current;
            return null;

        case '"':
            return string();

        default:
            if (isWhitespace(c)) {
                return null;
            }
            if (isDigit(c)) {
                return number();
            }
            if (isAlpha(c)) {
                return name();
            }
            var unexpected = Character.toString(source.codePointAt(start));
            throw error("Unexpected character: '" + unexpected + "'", unexpected);
        }
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private Token name() {
        while (isAlpha(peek())) {
            advance();
        }
        return token(NAME);
    }

    private Token number() {
        while (isDigit(peek())) {
            advance();
        }
        return token(NUMBER);
    }

    private Token string() {
        var startLine = line;
        var startColumn = getColumn();
        while (peek() != '"' && !isAtEnd()) {
            if (advance() == '\n') {
                line++;
                lineStart = current;
            }
        }
        if (isAtEnd()) {
            throw new LexError("Unterminated string.", source.substring(start),
                    start, startLine, startColumn);
        }
        advance(); // closing quote

        var value = source.substring(start + 1, current - 1);
        return new Token(STRING, value, start, startLine, startColumn);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private Token token(Token.Type type) {
        var text = source.substring(start, current);
        return new Token(type, text, start, line, getColumn());
    }

    private LexError error(String message, String character) {
        return new LexError(message, character, start, line, getColumn());
    }
}
