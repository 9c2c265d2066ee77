package asdl.tree.visit;

import java.util.Collections;
import java.util.List;

import asdl.schema.Grammar;
import asdl.schema.NodeKind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Operations indexed by constructor tag, as collected by the
 * {@link Walker} and {@link Transformer} builders.
 */
final class OperationTable<T> {
    private final Grammar grammar;
    private final List<T> operations;

    OperationTable(Grammar grammar) {
        this.grammar = grammar;
        this.operations = Lists.newArrayList(Collections.<T>nCopies(grammar.getKinds().size(), null));
    }

    Grammar getGrammar() {
        return grammar;
    }

    void register(String constructor, T operation) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation for " + constructor + " is null");
        }
        NodeKind kind = grammar.kind(constructor);
        if (operations.get(kind.getTag()) != null) {
            throw new IllegalArgumentException("Operation for " + constructor + " registered twice");
        }
        operations.set(kind.getTag(), operation);
    }

    /**
     * @param otherwise the operation of unregistered constructors, or null
     *                  if every constructor needs its own
     * @return one operation per tag
     */
    List<T> complete(T otherwise) {
        List<String> missing = Lists.newArrayList();
        List<T> result = Lists.newArrayList(operations);
        for (NodeKind k : grammar.getKinds()) {
            if (result.get(k.getTag()) == null) {
                if (otherwise == null) {
                    missing.add(k.getName());
                }
                result.set(k.getTag(), otherwise);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingOperationException(grammar.getName(), missing);
        }
        return ImmutableList.copyOf(result);
    }
}
