package asdl.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Test;

import asdl.ToySchema;
import asdl.schema.Grammar;
import asdl.source.Location;

import static org.junit.jupiter.api.Assertions.*;

public class ArenaTest {
    private final Grammar grammar = ToySchema.grammar();

    @Test
    public void allocateAndRead() {
        Arena arena = new Arena(grammar);
        Handle x = arena.allocate("Name", Location.at(1, 4), "x");
        Handle one = arena.allocate("Num", 1);
        Handle assign = arena.allocate("Assign", "x", one, null);
        assertEquals(3, arena.size());

        Node n = arena.node(assign);
        assertEquals("Assign", n.kind().getName());
        assertEquals("x", n.get("target"));
        assertEquals(1L, n.child("value").get("n"));
        assertFalse(n.isPresent("trivia"));
        assertSame(Trivia.EMPTY, n.trivia());
        assertEquals(Location.NONE, n.location());
        assertEquals(Location.at(1, 4), arena.node(x).location());
    }

    @Test
    public void intsAreWidenedToLong() {
        Arena arena = new Arena(grammar);
        Object v = arena.node(arena.allocate("Num", (short) 7)).get(0);
        assertEquals(Long.class, v.getClass());
        assertEquals(7L, v);
    }

    @Test
    public void wrongBuiltinValue() {
        Arena arena = new Arena(grammar);
        assertThrows(TreeConstructionException.class, () -> arena.allocate("Num", "seven"));
        assertThrows(TreeConstructionException.class, () -> arena.allocate("Str", 3));
    }

    @Test
    public void missingRequiredValue() {
        Arena arena = new Arena(grammar);
        Handle one = arena.allocate("Num", 1);
        assertThrows(TreeConstructionException.class,
                () -> arena.allocate("Assign", Location.NONE, null, one, null));
    }

    @Test
    public void wrongArity() {
        Arena arena = new Arena(grammar);
        assertThrows(TreeConstructionException.class, () -> arena.allocate("Num", 1, 2));
    }

    @Test
    public void unknownConstructor() {
        Arena arena = new Arena(grammar);
        assertThrows(TreeConstructionException.class, () -> arena.allocate("While", 1));
    }

    @Test
    public void childOfWrongType() {
        Arena arena = new Arena(grammar);
        Handle one = arena.allocate("Num", 1);
        Handle stmt = arena.allocate("Assign", "x", one, null);
        assertThrows(TreeConstructionException.class, () -> arena.allocate("Paren", stmt));
        assertThrows(TreeConstructionException.class, () -> arena.allocate("Paren", "x"));
    }

    @Test
    public void handlesOfAnotherArena() {
        Arena a = new Arena(grammar);
        Arena b = new Arena(grammar);
        Handle one = a.allocate("Num", 1);
        assertThrows(TreeConstructionException.class, () -> b.allocate("Paren", one));
        assertThrows(TreeConstructionException.class, () -> b.node(one));
        assertFalse(one.belongsTo(b));
    }

    @Test
    public void sequencesAreCopiedAndChecked() {
        Arena arena = new Arena(grammar);
        Handle one = arena.allocate("Num", 1);
        Handle two = arena.allocate("Num", 2);
        List<Handle> values = new ArrayList<>(List.of(one, two));
        Node print = arena.node(arena.allocate("Print", values, null));
        values.clear();
        assertEquals(2, print.sequenceLength("values"));
        assertEquals(List.of(one, two), print.childHandles());
        assertEquals(2L, print.children("values").get(1).get("n"));

        assertThrows(TreeConstructionException.class, () -> arena.allocate("Print", one, null));
        assertThrows(TreeConstructionException.class,
                () -> arena.allocate("Print", Arrays.asList(one, null), null));
    }

    @Test
    public void absentOptionalsAreSkippedInChildren() {
        Arena arena = new Arena(grammar);
        Handle a = arena.allocate("Name", "a");
        Node call = arena.node(arena.allocate("Call", "f", List.of(a), null, null));
        assertEquals(List.of(a), call.childHandles());
        assertNull(call.child("mask"));
        assertThrows(IllegalArgumentException.class, () -> call.child("args"));
        assertThrows(IllegalArgumentException.class, () -> call.sequenceLength("name"));
    }

    @Test
    public void frozenArenaRejectsAllocation() {
        Arena arena = new Arena(grammar);
        Handle one = arena.allocate("Num", 1);
        arena.freeze();
        arena.freeze();
        assertTrue(arena.isFrozen());
        assertThrows(TreeConstructionException.class, () -> arena.allocate("Num", 2));
        assertEquals(1L, arena.node(one).get("n"));
    }

    @Test
    public void closedArenaRejectsEverything() {
        Arena arena = new Arena(grammar);
        Handle one = arena.allocate("Num", 1);
        Node node = arena.node(one);
        Tree tree = new Tree(arena, one);
        tree.close();
        assertTrue(arena.isClosed());
        assertThrows(TreeConstructionException.class, () -> arena.node(one));
        assertThrows(TreeConstructionException.class, () -> arena.allocate("Num", 2));
        assertThrows(TreeConstructionException.class, () -> node.get(0));
        assertThrows(TreeConstructionException.class, arena::freeze);
    }

    @Test
    public void otherThreadsReadOnlyAfterFreeze() throws Exception {
        Arena arena = new Arena(grammar);
        Handle one = arena.allocate("Num", 1);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> CompletableFuture.supplyAsync(() -> arena.node(one)).get());
        assertTrue(e.getCause() instanceof TreeConstructionException);
        e = assertThrows(ExecutionException.class,
                () -> CompletableFuture.supplyAsync(() -> arena.allocate("Num", 2)).get());
        assertTrue(e.getCause() instanceof TreeConstructionException);

        arena.freeze();
        Object n = CompletableFuture.supplyAsync(() -> arena.node(one).get("n")).get();
        assertEquals(1L, n);
    }

    @Test
    public void structuralEqualityIgnoresLocations() {
        Arena a = new Arena(grammar);
        Handle ha = a.allocate("BinOp", Location.at(1, 1),
                a.allocate("Name", Location.at(1, 1), "x"), a.allocate("Add"), a.allocate("Num", 1));
        Arena b = new Arena(grammar);
        Handle hb = b.allocate("BinOp", Location.at(9, 9),
                b.allocate("Name", Location.at(9, 9), "x"), b.allocate("Add"), b.allocate("Num", 1));
        Handle hc = b.allocate("BinOp",
                b.allocate("Name", "x"), b.allocate("Sub"), b.allocate("Num", 1));

        assertTrue(a.node(ha).structuralEquals(b.node(hb)));
        assertFalse(a.node(ha).structuralEquals(b.node(hc)));
        assertFalse(a.node(ha).structuralEquals(a.node(ha).child("left")));
    }

    @Test
    public void triviaTakesPartInEquality() {
        Arena arena = new Arena(grammar);
        Handle one = arena.allocate("Num", 1);
        Handle plain = arena.allocate("Assign", "x", one, null);
        Handle commented = arena.allocate("Assign", "x", one, Trivia.after(TriviaItem.eolComment("c")));
        assertFalse(arena.node(plain).structuralEquals(arena.node(commented)));
        assertEquals("c", arena.node(commented).trivia().getAfter().get(0).getText());
    }

    @Test
    public void emptyTriviaIsAbsent() {
        Arena arena = new Arena(grammar);
        Handle one = arena.allocate("Num", 1);
        Handle plain = arena.allocate("Assign", "x", one, null);
        Handle empty = arena.allocate("Assign", "x", one, Trivia.EMPTY);
        assertFalse(arena.node(empty).isPresent("trivia"));
        assertTrue(arena.node(plain).structuralEquals(arena.node(empty)));
    }
}
