package asdl.tree.visit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.apache.log4j.Logger;

import asdl.Logging;
import asdl.schema.Grammar;
import asdl.schema.NodeKind;
import asdl.schema.Slot;
import asdl.tree.Arena;
import asdl.tree.Handle;
import asdl.tree.Node;
import asdl.tree.Tree;
import asdl.tree.TreeConstructionException;

import com.google.common.collect.Lists;

/**
 * Rebuilds a frozen tree into a fresh arena, one operation per
 * constructor. The source is never modified. Every source node is
 * transformed at most once per run.
 */
public final class Transformer {
    private static final Logger logger = Logging.getLogger();

    public interface Operation {
        /**
         * @return a handle of {@code context.target()} replacing {@code node}
         */
        Handle transform(Context context, Node node);
    }

    private static final Operation COPY = new Operation() {
        @Override
        public Handle transform(Context context, Node node) {
            return context.copy(node);
        }
    };

    private final Grammar grammar;
    private final List<Operation> operations;

    private Transformer(Grammar grammar, List<Operation> operations) {
        this.grammar = grammar;
        this.operations = operations;
    }

    public static Builder builder(Grammar grammar) {
        return new Builder(grammar);
    }

    public Tree transform(Tree source) {
        return transform(source.getArena(), source.getRoot());
    }

    /**
     * @return a frozen tree in a new arena
     */
    public Tree transform(Arena source, Handle root) {
        if (!source.isFrozen()) {
            throw new TreeConstructionException("Transformer source arena must be frozen");
        }
        if (source.grammar() != grammar) {
            throw new IllegalArgumentException("Arena is not of grammar " + grammar.getName());
        }
        if (!root.belongsTo(source)) {
            throw new TreeConstructionException("Root " + root + " belongs to another arena");
        }
        Context context = new Context(source, new Arena(grammar));
        Handle newRoot = context.rebuild(root);
        context.target.freeze();
        logger.debug("transformed " + source.size() + " nodes of " + grammar.getName()
                + " into " + context.target.size());
        return new Tree(context.target, newRoot);
    }

    /**
     * State of one transformation run.
     */
    public final class Context {
        private final Arena source;
        private final Arena target;
        private final Handle[] done;

        private Context(Arena source, Arena target) {
            this.source = source;
            this.target = target;
            this.done = new Handle[source.size()];
        }

        public Arena source() {
            return source;
        }

        public Arena target() {
            return target;
        }

        /**
         * The transformed version of a source node. Subtrees that are only
         * copied are rebuilt bottom-up from an explicit stack, so depth is
         * not limited by the Java stack.
         */
        public Handle rebuild(Handle sourceHandle) {
            if (!sourceHandle.belongsTo(source)) {
                throw new TreeConstructionException("Handle " + sourceHandle + " belongs to another arena");
            }
            if (done[sourceHandle.index()] != null) {
                return done[sourceHandle.index()];
            }
            Deque<Node> pending = new ArrayDeque<>();
            pending.push(source.node(sourceHandle));
            while (!pending.isEmpty()) {
                Node node = pending.peek();
                if (done[node.handle().index()] != null) {
                    pending.pop();
                    continue;
                }
                Operation operation = operations.get(node.kind().getTag());
                if (operation == COPY && pushChildren(node, pending)) {
                    continue;
                }
                pending.pop();
                Handle result = operation.transform(this, node);
                if (result == null || !result.belongsTo(target)) {
                    throw new TreeConstructionException("Operation for " + node.kind().getName()
                            + " did not return a handle of the target arena");
                }
                done[node.handle().index()] = result;
            }
            return done[sourceHandle.index()];
        }

        /** @return whether a child still had to be rebuilt */
        private boolean pushChildren(Node node, Deque<Node> pending) {
            boolean pushed = false;
            for (Handle child : Lists.reverse(node.childHandles())) {
                if (done[child.index()] == null) {
                    pending.push(source.node(child));
                    pushed = true;
                }
            }
            return pushed;
        }

        public Handle rebuild(Node node) {
            return rebuild(node.handle());
        }

        /** Allocates the same kind in the target with rebuilt children and the same location. */
        public Handle copy(Node node) {
            NodeKind kind = node.kind();
            Object[] values = new Object[kind.size()];
            for (Slot s : kind.getSlots()) {
                Object v = node.get(s.getIndex());
                if (v == null || !s.isNode()) {
                    values[s.getIndex()] = v;
                } else if (s.isSequence()) {
                    List<Handle> elements = Lists.newArrayList();
                    for (Object h : (List<?>) v) {
                        elements.add(rebuild((Handle) h));
                    }
                    values[s.getIndex()] = elements;
                } else {
                    values[s.getIndex()] = rebuild((Handle) v);
                }
            }
            return target.allocate(kind, node.location(), values);
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

        /** Unregistered constructors are copied unchanged. */
        public Builder otherwiseCopy() {
            this.otherwise = COPY;
            return this;
        }

        public Transformer build() {
            return new Transformer(table.getGrammar(), table.complete(otherwise));
        }
    }
}
