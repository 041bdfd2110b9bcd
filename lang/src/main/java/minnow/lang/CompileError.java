package minnow.lang;

/**
 * Base of the fatal errors raised while compiling. Nothing is recovered; a
 * failing compilation produces no output.
 */
public abstract class CompileError extends RuntimeException {

    CompileError(String message) {
        super(message);
    }

    /**
     * @return the reporting stage, used as the prefix of CLI diagnostics
     */
    public abstract String stage();

    /**
     * @return a {@code line L, col C} style location, or a description of it
     */
    public abstract String location();
}
