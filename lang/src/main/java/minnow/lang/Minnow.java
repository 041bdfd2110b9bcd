package minnow.lang;

import static lombok.AccessLevel.PRIVATE;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor(access = PRIVATE)
public class Minnow {

    static final int EX_OK = 0;
    static final int EX_ERROR = 1;
    static final int EX_USAGE = 64;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final Flags flags = new Flags();

    public static void main(String[] args) throws IOException {
        var exitCode = new Minnow(System.in, System.out, System.err).launch(args);
        System.exit(exitCode);
    }

    static Minnow withStreams(InputStream in, PrintStream out, PrintStream err) {
        return new Minnow(in, out, err);
    }

    int launch(String... args) throws IOException {
        String script = null;
        for (var arg : args) {
            if ("--tokens".equals(arg) && script == null) {
                flags.printTokens = true;
            } else if ("--ast".equals(arg) && script == null) {
                flags.printAst = true;
            } else if (script == null) {
                script = arg;
            } else {
                err.println("Usage: minnow [--tokens] [--ast] [script]");
                return EX_USAGE;
            }
        }

        if (script != null) {
            return runFile(script);
        }
        return runPrompt();
    }

    private int runFile(String path) throws IOException {
        byte[] bytes;
        if ("-".equals(path)) {
            bytes = in.readAllBytes();
        } else {
            bytes = Files.readAllBytes(Paths.get(path));
        }

        return run(new String(bytes, Charset.defaultCharset()));
    }

    private int runPrompt() throws IOException {
        var reader = new BufferedReader(new InputStreamReader(in, Charset.defaultCharset()));

        var unmatchedParens = 0;
        var lineBuffer = new ArrayList<String>();
        for (;;) {
            var prompt = String.format(":%02d> ", lineBuffer.size());
            out.print(prompt);
            var line = reader.readLine();

            if (line == null || ":q".equals(line)) {
                break;
            } else if (":b".equals(line)) {
                int n = 0;
                for (var l : lineBuffer) {
                    out.println(String.format("%02d  %s", ++n, l));
                }
            } else if (line.startsWith(":tok")) {
                var arg = line.substring(4).trim();
                if (!arg.isBlank()) {
                    flags.printTokens = Boolean.parseBoolean(arg);
                }
                out.println("print tokens: " + flags.printTokens);
            } else if (line.startsWith(":ast")) {
                var arg = line.substring(4).trim();
                if (!arg.isBlank()) {
                    flags.printAst = Boolean.parseBoolean(arg);
                }
                out.println("print ast: " + flags.printAst);
            } else if (!line.isBlank()) {
                lineBuffer.add(line);
                try {
                    unmatchedParens += countUnmatchedParens(line);
                } catch (LexError ex) {
                    // flush now so that run() reports it
                    unmatchedParens = 0;
                }

                // if parens are at least balanced, flush the buffer
                if (unmatchedParens <= 0) {
                    var source = String.join("\n", lineBuffer);
                    run(source);
                    lineBuffer.clear();
                    unmatchedParens = 0;
                }
            }
        }
        return EX_OK;
    }

    private int run(String source) {
        try {
            var tokens = Compiler.tokenize(source);
            if (flags.printTokens) {
                tokens.forEach(out::println);
            }

            var program = Compiler.parse(tokens);
            var transformed = Compiler.transform(program);
            if (flags.printAst) {
                out.println(program);
                out.println(transformed);
            }

            out.println(Compiler.generate(transformed));
            return EX_OK;
        } catch (CompileError error) {
            report(error);
            return EX_ERROR;
        }
    }

    private void report(CompileError error) {
        err.println(error.stage() + ": " + error.getMessage() + " [" + error.location() + "]");
    }

    private static int countUnmatchedParens(String line) {
        int count = 0;
        for (var token : Compiler.tokenize(line)) {
            if (token.is(Token.Type.PAREN, "(")) {
                count++;
            } else if (token.is(Token.Type.PAREN, ")")) {
                count--;
            }
        }
        return count;
    }

    private static class Flags {
        boolean printTokens = false;
        boolean printAst = false;
    }
}
