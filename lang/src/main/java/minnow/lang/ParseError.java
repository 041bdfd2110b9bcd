package minnow.lang;

import lombok.Getter;

public class ParseError extends CompileError {

    /** The unexpected token; {@code null} when the input ended early. */
    @Getter
    private final Token token;

    ParseError(Token token, String message) {
        super(message);
        this.token = token;
    }

    public boolean isAtEnd() {
        return token == null;
    }

    @Override
    public String stage() {
        return "parser";
    }

    @Override
    public String location() {
        if (token == null) {
            return "end of input";
        }
        return "line " + token.line() + ", col " + token.column();
    }
}
