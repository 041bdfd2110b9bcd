package minnow.lang;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import lombok.NonNull;
import minnow.lang.Traverser.Callbacks;
import minnow.lang.Traverser.Hooks;

/**
 * Rewrites a {@link Source} tree into a fresh {@link Target} tree. Each hook
 * receives its parent's output slot, the list its counterpart is appended
 * to, and a call hands a new argument list down as its children's slot. The
 * {@link Target.Call} itself is built on exit, once its arguments are complete.
 * Only literal text is shared with the source tree.
 */
final class Transformer {

    private final Deque<List<Target>> openCalls = new ArrayDeque<>();

    private final Callbacks<List<Target>> callbacks = Callbacks.<List<Target>>builder()
        .numberLiteral(Hooks.enter((literal, parent, slot) -> {
            slot.add(new NumberLiteral(literal.value()));
            return slot;
        }))
        .stringLiteral(Hooks.enter((literal, parent, slot) -> {
            slot.add(new StringLiteral(literal.value()));
            return slot;
        }))
        .callExpression(new Hooks<Source.CallExpression, List<Target>>(this::enterCall, this::exitCall))
        .build();

    private Transformer() {}

    static Target.Program transform(@NonNull Source.Program program) {
        var body = new ArrayList<Target>();
        Traverser.traverse(program, new Transformer().callbacks, body);
        return new Target.Program(body);
    }

    private List<Target> enterCall(Source.CallExpression call, Source parent, List<Target> slot) {
        var args = new ArrayList<Target>();
        openCalls.push(args);
        return args;
    }

    private void exitCall(Source.CallExpression call, Source parent, List<Target> slot) {
        var expression = new Target.Call(new Target.Identifier(call.name()), openCalls.pop());

        // calls outside another call are statements
        if (parent instanceof Source.CallExpression) {
            slot.add(expression);
        } else {
            slot.add(new Target.ExpressionStatement(expression));
        }
    }
}
