package minnow.lang;

import lombok.Getter;

@Getter
public class LexError extends CompileError {

    /** The offending character, or the unterminated remainder of the input. */
    private final String character;
    private final int offset;
    private final int line;
    private final int column;

    LexError(String message, String character, int offset, int line, int column) {
        super(message);
        this.character = character;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    @Override
    public String stage() {
        return "scanner";
    }

    @Override
    public String location() {
        return "line " + line + ", col " + column;
    }
}
