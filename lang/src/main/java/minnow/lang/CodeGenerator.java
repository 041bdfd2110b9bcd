package minnow.lang;

/**
 * Renders a {@link Target} tree as text, one rule per node kind. Every rule
 * appends to a single buffer owned by one {@link #generate(Target)} call.
 */
final class CodeGenerator implements Target.Visitor<Void> {

    private final StringBuilder out = new StringBuilder();

    private CodeGenerator() {}

    static String generate(Target node) {
        var generator = new CodeGenerator();
        generator.append(node);
        return generator.out.toString();
    }

    private void append(Target node) {
        node.accept(this);
    }

    @Override
    public Void visitProgram(Target.Program program) {
        var separator = "";
        for (var statement : program.body()) {
            out.append(separator);
            append(statement);
            separator = "\n";
        }
        return null;
    }

    @Override
    public Void visitExpressionStatement(Target.ExpressionStatement statement) {
        append(statement.expression());
        out.append(';');
        return null;
    }

    @Override
    public Void visitCall(Target.Call call) {
        append(call.callee());
        out.append('(');
        var separator = "";
        for (var arg : call.args()) {
            out.append(separator);
            append(arg);
            separator = ", ";
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitIdentifier(Target.Identifier identifier) {
        out.append(identifier.name());
        return null;
    }

    @Override
    public Void visitNumberLiteral(NumberLiteral literal) {
        out.append(literal.value());
        return null;
    }

    @Override
    public Void visitStringLiteral(StringLiteral literal) {
        out.append('"').append(literal.value()).append('"');
        return null;
    }
}
