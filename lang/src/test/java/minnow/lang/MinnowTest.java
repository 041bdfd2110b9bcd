package minnow.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MinnowTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int launch(String input, String... args) throws IOException {
        var in = new ByteArrayInputStream(input.getBytes(Charset.defaultCharset()));
        var charset = Charset.defaultCharset();
        var minnow = Minnow.withStreams(in, new PrintStream(out, true, charset), new PrintStream(err, true, charset));
        return minnow.launch(args);
    }

    private String out() {
        return out.toString(Charset.defaultCharset()).replace("\r\n", "\n");
    }

    private String err() {
        return err.toString(Charset.defaultCharset()).replace("\r\n", "\n");
    }

    @Test
    void compilesFile(@TempDir Path dir) throws IOException {
        var script = dir.resolve("main.mn");
        Files.writeString(script, "(add 2 (subtract 4 2))\n(print \"done\")\n", Charset.defaultCharset());

        assertEquals(Minnow.EX_OK, launch("", script.toString()));
        assertEquals("add(2, subtract(4, 2));\nprint(\"done\");\n", out());
        assertEquals("", err());
    }

    @Test
    void compilesStdin() throws IOException {
        assertEquals(Minnow.EX_OK, launch("(foo)", "-"));
        assertEquals("foo();\n", out());
    }

    @Test
    void reportsScannerError() throws IOException {
        assertEquals(Minnow.EX_ERROR, launch("(add 2 #)", "-"));
        assertEquals("", out());
        assertEquals("scanner: Unexpected character: '#' [line 1, col 8]\n", err());
    }

    @Test
    void reportsParserErrorAtEnd() throws IOException {
        assertEquals(Minnow.EX_ERROR, launch("(add 2", "-"));
        assertEquals("parser: Expect ')' after call arguments. [end of input]\n", err());
    }

    @Test
    void printsTokens() throws IOException {
        assertEquals(Minnow.EX_OK, launch("(f 1)", "--tokens", "-"));
        assertEquals(String.join("\n",
            "(Token PAREN \"(\" 1:1)",
            "(Token NAME \"f\" 1:2)",
            "(Token NUMBER \"1\" 1:4)",
            "(Token PAREN \")\" 1:5)",
            "f(1);",
            ""), out());
    }

    @Test
    void tooManyArguments() throws IOException {
        assertEquals(Minnow.EX_USAGE, launch("", "a.mn", "b.mn"));
        assertTrue(err().startsWith("Usage: minnow"));
    }

    @Test
    void replBuffersUntilParensBalance() throws IOException {
        var session = String.join("\n",
            "(add 1",
            ":b",
            "  (sub 2 3))",
            "(foo)",
            ":q",
            "(never)");

        assertEquals(Minnow.EX_OK, launch(session));
        assertEquals(
            ":00> :01> 01  (add 1\n"
                + ":01> add(1, sub(2, 3));\n"
                + ":00> foo();\n"
                + ":00> ",
            out());
    }

    @Test
    void replReportsErrorsAndContinues() throws IOException {
        var session = String.join("\n",
            "(add 1",
            "  @)",
            "(ok)");

        assertEquals(Minnow.EX_OK, launch(session));
        assertEquals(":00> :01> :00> ok();\n:00> ", out());
        assertEquals("scanner: Unexpected character: '@' [line 2, col 3]\n", err());
    }

    @Test
    void replToggles() throws IOException {
        var session = String.join("\n", ":ast true", "(f)", ":ast");

        assertEquals(Minnow.EX_OK, launch(session));
        assertEquals(String.join("\n",
            ":00> print ast: true",
            ":00> Program[body=[CallExpression[name=f, params=[]]]]",
            "Program[body=[ExpressionStatement[expression=Call[callee=Identifier[name=f], args=[]]]]]",
            "f();",
            ":00> print ast: true",
            ":00> "), out());
    }
}
