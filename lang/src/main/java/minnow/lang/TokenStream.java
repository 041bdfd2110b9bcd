package minnow.lang;

import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Forward-only cursor over a token list.
 */
@RequiredArgsConstructor
public final class TokenStream {

    private final @NonNull List<Token> tokens;

    private int current = 0;
    private Token previous = null;

    /**
     * @return the last token returned by {@link #advance()}, or {@code null}
     *     before the first advance
     */
    public Token previous() {
        return previous;
    }

    public boolean isAtEnd() {
        return current >= tokens.size();
    }

    /**
     * @return the current token, or {@code null} at the end of input
     */
    public Token peek() {
        return isAtEnd() ? null : tokens.get(current);
    }

    /**
     * @return the current token, or {@code null} at the end of input, in
     *     which case the cursor does not move
     */
    public Token advance() {
        if (isAtEnd()) {
            return null;
        }
        previous = tokens.get(current++);
        return previous;
    }
}
