package asdl.tree;

import java.util.List;

import org.junit.jupiter.api.Test;

import asdl.tree.Trivia.LineState;

import static asdl.tree.TriviaItem.*;
import static org.junit.jupiter.api.Assertions.*;

public class TriviaTest {

    @Test
    public void emptySequenceEndsClosed() {
        assertEquals(LineState.CLOSED, Trivia.endState(List.of()));
    }

    @Test
    public void wellFormedSequences() {
        assertEquals(LineState.CLOSED, Trivia.endState(List.of(endOfLine())));
        assertEquals(LineState.CLOSED, Trivia.endState(List.of(eolComment(" note"))));
        assertEquals(LineState.SEPARATED, Trivia.endState(List.of(semicolon())));
        assertEquals(LineState.CLOSED, Trivia.endState(List.of(semicolon(), eolComment("x"))));
        assertEquals(LineState.CLOSED,
                Trivia.endState(List.of(endOfLine(), comment("a"), endOfLine(), comment("b"))));
    }

    @Test
    public void commentRightAfterStatementIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Trivia.endState(List.of(comment("x"))));
    }

    @Test
    public void twoSemicolonsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Trivia.endState(List.of(semicolon(), semicolon())));
    }

    @Test
    public void semicolonAfterLineEndIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Trivia.endState(List.of(endOfLine(), semicolon())));
    }

    @Test
    public void eolCommentOnFreshLineIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> Trivia.endState(List.of(endOfLine(), eolComment("x"))));
    }

    @Test
    public void ofChecksBothSequences() {
        assertThrows(IllegalArgumentException.class,
                () -> Trivia.of(List.of(comment("x")), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> Trivia.of(List.of(), List.of(semicolon(), semicolon())));
    }

    @Test
    public void emptyTriviaIsShared() {
        assertSame(Trivia.EMPTY, Trivia.of(List.of(), List.of()));
        assertTrue(Trivia.EMPTY.isEmpty());
    }

    @Test
    public void builderAndEquality() {
        Trivia built = Trivia.builder()
                .inside(eolComment(" then"))
                .after(endOfLine())
                .after(comment(" next"))
                .build();
        Trivia direct = Trivia.of(List.of(eolComment(" then")), List.of(endOfLine(), comment(" next")));
        assertEquals(direct, built);
        assertEquals(direct.hashCode(), built.hashCode());
        assertEquals(1, built.getInside().size());
        assertEquals(2, built.getAfter().size());
        assertNotEquals(Trivia.after(semicolon()), Trivia.after(endOfLine()));
    }

    @Test
    public void commentTextMustStayOnOneLine() {
        assertThrows(IllegalArgumentException.class, () -> comment("a\nb"));
        assertThrows(IllegalArgumentException.class, () -> eolComment("a\rb"));
        assertEquals("text", comment("text").getText());
        assertEquals("", semicolon().getText());
    }
}
