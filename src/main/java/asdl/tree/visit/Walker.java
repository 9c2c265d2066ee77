package asdl.tree.visit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import asdl.schema.Grammar;
import asdl.tree.Arena;
import asdl.tree.Handle;
import asdl.tree.Node;

import com.google.common.collect.Lists;

/**
 * Dispatches on the kind of a node to one operation per constructor.
 * <p>
 * A walker must cover every constructor of its grammar:
 * {@link Builder#build()} fails with {@link MissingOperationException}
 * unless a default was chosen. Operations decide whether to descend by
 * calling {@link #visitChildren(Node)}.
 * <p>
 * Walks do not recurse on the Java stack. While an operation runs,
 * {@link #walk(Node)}, {@link #visitChildren(Node)} and
 * {@link #then(Runnable)} only schedule work; what an operation schedules
 * runs in the order it was scheduled, right after the operation returns
 * and before anything scheduled earlier. Work that must follow a child
 * therefore goes through {@code then}. One walker runs one walk at a
 * time.
 */
public final class Walker {

    public interface Operation {
        void visit(Walker walker, Node node);
    }

    private static final Operation VISIT_CHILDREN = new Operation() {
        @Override
        public void visit(Walker walker, Node node) {
            walker.visitChildren(node);
        }
    };

    private final Grammar grammar;
    private final List<Operation> operations;

    /** Pending nodes and actions of the running walk, null when idle. */
    private Deque<Object> pending;
    private List<Object> scheduled;

    private Walker(Grammar grammar, List<Operation> operations) {
        this.grammar = grammar;
        this.operations = operations;
    }

    public static Builder builder(Grammar grammar) {
        return new Builder(grammar);
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public void walk(Node node) {
        if (node.kind().getGrammar() != grammar) {
            throw new IllegalArgumentException("Node " + node + " is not of grammar " + grammar.getName());
        }
        if (pending != null) {
            scheduled.add(node);
            return;
        }
        pending = new ArrayDeque<>();
        scheduled = Lists.newArrayList();
        try {
            pending.push(node);
            while (!pending.isEmpty()) {
                Object next = pending.pop();
                if (next instanceof Node) {
                    Node n = (Node) next;
                    operations.get(n.kind().getTag()).visit(this, n);
                } else {
                    ((Runnable) next).run();
                }
                for (Object item : Lists.reverse(scheduled)) {
                    pending.push(item);
                }
                scheduled.clear();
            }
        } finally {
            pending = null;
            scheduled = null;
        }
    }

    public void walk(Arena arena, Handle handle) {
        walk(arena.node(handle));
    }

    /** Walks the children in declared field order, skipping absent optionals. */
    public void visitChildren(Node node) {
        Arena arena = node.arena();
        for (Handle h : node.childHandles()) {
            walk(arena.node(h));
        }
    }

    /** Runs {@code action} after the work scheduled so far by the current operation. */
    public void then(Runnable action) {
        if (pending == null) {
            action.run();
        } else {
            scheduled.add(action);
        }
    }

    public static final class Builder {
        private final OperationTable<Operation> table;
        private Operation otherwise;

        private Builder(Grammar grammar) {
            this.table = new OperationTable<>(grammar);
        }

        public Builder on(String constructor, Operation operation) {
            table.register(constructor, operation);
            return this;
        }

        /** Unregistered constructors just walk their children. */
        public Builder otherwiseVisitChildren() {
            return otherwise(VISIT_CHILDREN);
        }

        public Builder otherwise(Operation operation) {
            this.otherwise = operation;
            return this;
        }

        public Walker build() {
            return new Walker(table.getGrammar(), table.complete(otherwise));
        }
    }
}
