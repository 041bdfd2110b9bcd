package minnow.lang;

import java.util.List;

import lombok.NonNull;

/**
 * Entry points of the translation pipeline. {@link #compile(String)} runs
 * every stage in order; each stage is also exposed on its own. All methods are
 * pure and safe to call concurrently.
 */
public final class Compiler {

    private Compiler() {}

    /**
     * Translates a program in the parenthesized call language, e.g.
     * {@code (add 2 (subtract 4 2))}, into call-expression statements, e.g.
     * {@code add(2, subtract(4, 2));}.
     *
     * @throws LexError if the text contains an unrecognized character or an
     *     unterminated string
     * @throws ParseError if the tokens do not form a sequence of expressions
     */
    public static String compile(@NonNull String source) {
        var tokens = tokenize(source);
        var program = parse(tokens);
        var transformed = transform(program);
        return generate(transformed);
    }

    public static List<Token> tokenize(@NonNull String source) {
        return new Scanner(source).getTokens();
    }

    public static Source.Program parse(@NonNull List<Token> tokens) {
        return new Parser(new TokenStream(tokens)).parse();
    }

    public static Target.Program transform(@NonNull Source.Program program) {
        return Transformer.transform(program);
    }

    public static String generate(@NonNull Target node) {
        return CodeGenerator.generate(node);
    }
}
