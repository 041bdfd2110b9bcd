package minnow.lang;

import java.util.ArrayDeque;
import java.util.List;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Depth-first walk over a {@link Source} tree. For every node the matching
 * {@link Hooks#enter() enter} hook runs before its children and the
 * {@link Hooks#exit() exit} hook after them. The walk itself builds nothing;
 * all effects belong to the hooks.
 *
 * <p>A context value of type {@code C} is threaded through the walk. The
 * root receives the caller's context; an enter hook returns the context its
 * node's children receive, and a node without an enter hook passes its own
 * context down unchanged.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Traverser<C> {

    @FunctionalInterface
    public interface Enter<N extends Source, C> {
        C enter(N node, Source parent, C context);
    }

    @FunctionalInterface
    public interface Exit<N extends Source, C> {
        void exit(N node, Source parent, C context);
    }

    /**
     * Optional enter and exit callbacks for one node kind. Either may be null.
     */
    public record Hooks<N extends Source, C>(Enter<N, C> enter, Exit<N, C> exit) {

        public static <N extends Source, C> Hooks<N, C> enter(Enter<N, C> enter) {
            return new Hooks<>(enter, null);
        }

        public static <N extends Source, C> Hooks<N, C> exit(Exit<N, C> exit) {
            return new Hooks<>(null, exit);
        }
    }

    /**
     * Hooks per node kind. Kinds left unset are walked without callbacks.
     */
    @Builder
    public static final class Callbacks<C> {
        private final Hooks<Source.Program, C> program;
        private final Hooks<Source.CallExpression, C> callExpression;
        private final Hooks<NumberLiteral, C> numberLiteral;
        private final Hooks<StringLiteral, C> stringLiteral;
    }

    public static void traverse(@NonNull Source root, @NonNull Callbacks<Void> callbacks) {
        traverse(root, callbacks, null);
    }

    public static <C> void traverse(@NonNull Source root, @NonNull Callbacks<C> callbacks, C context) {
        new Traverser<>(callbacks).walk(root, context);
    }

    private final Callbacks<C> callbacks;

    // iterative; nesting depth is bounded by the heap, not the thread stack
    private void walk(Source root, C context) {
        var pending = new ArrayDeque<Step<?>>();
        pending.push(enter(root, null, context));
        while (!pending.isEmpty()) {
            var step = pending.peek();
            if (step.next < step.children.size()) {
                var child = step.children.get(step.next++);
                pending.push(enter(child, step.node, step.childContext));
            } else {
                pending.pop();
                step.exit();
            }
        }
    }

    private Step<?> enter(Source node, Source parent, C context) {
        return node.accept(new Source.Visitor<Step<?>>() {
            @Override
            public Step<?> visitProgram(Source.Program program) {
                return new Step<>(program, parent, context, callbacks.program, program.body());
            }

            @Override
            public Step<?> visitCallExpression(Source.CallExpression call) {
                return new Step<>(call, parent, context, callbacks.callExpression, call.params());
            }

            @Override
            public Step<?> visitNumberLiteral(NumberLiteral literal) {
                return new Step<>(literal, parent, context, callbacks.numberLiteral, List.of());
            }

            @Override
            public Step<?> visitStringLiteral(StringLiteral literal) {
                return new Step<>(literal, parent, context, callbacks.stringLiteral, List.of());
            }
        });
    }

    /**
     * A node that has been entered and whose exit is pending.
     */
    private final class Step<N extends Source> {
        private final N node;
        private final Source parent;
        private final C context;
        private final Hooks<N, C> hooks;
        private final List<Source> children;
        private final C childContext;
        private int next = 0;

        Step(N node, Source parent, C context, Hooks<N, C> hooks, List<Source> children) {
            this.node = node;
            this.parent = parent;
            this.context = context;
            this.hooks = hooks;
            this.children = children;
            if (hooks != null && hooks.enter() != null) {
                this.childContext = hooks.enter().enter(node, parent, context);
            } else {
                this.childContext = context;
            }
        }

        void exit() {
            if (hooks != null && hooks.exit() != null) {
                hooks.exit().exit(node, parent, context);
            }
        }
    }
}
