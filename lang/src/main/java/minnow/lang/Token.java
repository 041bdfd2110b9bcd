package minnow.lang;

import lombok.NonNull;

/**
 * A lexical unit. The position fields are for diagnostics only.
 *
 * @param type the token kind
 * @param lexeme the matched text; string tokens exclude their quotes
 * @param offset index of the first source character, 0-based
 * @param line 1-based line
 * @param column 1-based column
 */
public record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    int offset,
    int line,
    int column) {

    public boolean is(Type type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    @Override
    public String toString() {
        return "(Token " + type + " \"" + lexeme + "\" " + line + ":" + column + ")";
    }

    public enum Type {
        PAREN,

        // literals
        NUMBER,
        STRING,

        NAME;
    }
}
