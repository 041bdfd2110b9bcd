package minnow.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import minnow.lang.Target.Call;
import minnow.lang.Target.ExpressionStatement;
import minnow.lang.Target.Identifier;
import minnow.lang.Target.Program;

public class CodeGeneratorTest {

    private static String generate(Target node) {
        return CodeGenerator.generate(node);
    }

    @Test
    void leaves() {
        assertEquals("42", generate(new NumberLiteral("42")));
        assertEquals("\"hi there\"", generate(new StringLiteral("hi there")));
        assertEquals("print", generate(new Identifier("print")));
    }

    @Test
    void stringsAreNotEscaped() {
        assertEquals("\"a\\nb\"", generate(new StringLiteral("a\\nb")));
    }

    @Test
    void calls() {
        assertEquals("foo()", generate(new Call(new Identifier("foo"), List.of())));
        assertEquals("add(2, subtract(4, 2))", generate(
            new Call(new Identifier("add"), List.of(
                new NumberLiteral("2"),
                new Call(new Identifier("subtract"), List.of(new NumberLiteral("4"), new NumberLiteral("2")))))));
    }

    @Test
    void statement() {
        assertEquals("log(\"x\");", generate(
            new ExpressionStatement(new Call(new Identifier("log"), List.of(new StringLiteral("x"))))));
    }

    @Test
    void programJoinsWithNewlines() {
        var program = new Program(List.of(
            new ExpressionStatement(new Call(new Identifier("a"), List.of())),
            new ExpressionStatement(new Call(new Identifier("b"), List.of(new NumberLiteral("1"))))));

        assertEquals("a();\nb(1);", generate(program));
        assertEquals(generate(program), generate(program));
    }

    @Test
    void emptyProgram() {
        assertEquals("", generate(new Program(List.of())));
    }

    @Test
    void nodesKeepTheirOwnLists() {
        var args = new ArrayList<Target>();
        var call = new Call(new Identifier("f"), args);
        var body = new ArrayList<Target>(List.of(new ExpressionStatement(call)));
        var program = new Program(body);

        args.add(new NumberLiteral("1"));
        body.add(new NumberLiteral("2"));

        assertEquals("f()", generate(call));
        assertEquals("f();", generate(program));
        assertEquals(new Call(new Identifier("f"), List.of()), call);
    }

    @Test
    void deeplyNestedCalls() {
        Target node = new NumberLiteral("0");
        for (int i = 0; i < 5000; i++) {
            node = new Call(new Identifier("f"), List.of(node));
        }

        var text = generate(new ExpressionStatement(node));

        assertEquals("f(".repeat(5000) + "0" + ")".repeat(5000) + ";", text);
    }
}
