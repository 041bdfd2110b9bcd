package minnow.lang;

import static minnow.lang.Token.Type.*;

import java.util.ArrayList;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Recursive-descent parser with one token of lookahead. Aborts with a
 * {@link ParseError} on the first unexpected token.
 */
@RequiredArgsConstructor
final class Parser {

    private final @NonNull TokenStream tokens;

    public Source.Program parse() {
        return program();
    }

    //// grammar rules ////

    /**
     * <pre>
     * program     :: expression*
     * </pre>
     */
    private Source.Program program() {
        var body = new ArrayList<Source>();
        while (!isAtEnd()) {
            body.add(expression());
        }
        return new Source.Program(body);
    }

    /**
     * <pre>
     * expression  :: NUMBER | STRING | call
     * </pre>
     */
    private Source expression() {
        if (match(NUMBER)) {
            return new NumberLiteral(previous().lexeme());
        }
        if (match(STRING)) {
            return new StringLiteral(previous().lexeme());
        }
        if (matchParen("(")) {
            return call();
        }
        throw error(peek(), "Expect expression.");
    }

    /**
     * <pre>
     * call        :: "(" NAME expression* ")"
     * </pre>
     */
    private Source call() {
        var name = consume(NAME, "Expect function name after '('.");
        var params = new ArrayList<Source>();
        while (!checkParen(")")) {
            if (isAtEnd()) {
                throw error(null, "Expect ')' after call arguments.");
            }
            params.add(expression());
        }
        advance(); // closing paren
        return new Source.CallExpression(name.lexeme(), params);
    }

    //// utility methods ////

    private Token consume(Token.Type type, String message) {
        if (check(type)) {
            return advance();
        }

        throw error(peek(), message);
    }

    private ParseError error(Token token, String message) {
        return new ParseError(token, message);
    }

    private boolean match(Token.Type type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchParen(String paren) {
        if (checkParen(paren)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(Token.Type type) {
        return !isAtEnd() && peek().type() == type;
    }

    private boolean checkParen(String paren) {
        return !isAtEnd() && peek().is(PAREN, paren);
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token previous() {
        return tokens.previous();
    }
}
