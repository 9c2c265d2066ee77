package asdl.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import asdl.schema.Slot;

/**
 * Structural equality of two subtrees, possibly in different arenas.
 * Locations are ignored; kinds are compared by name and discriminant, so
 * trees over two loads of the same schema compare equal.
 */
public final class TreeEquality {

    private TreeEquality() {
    }

    public static boolean equal(Node a, Node b) {
        Deque<Node[]> pending = new ArrayDeque<>();
        pending.push(new Node[] {a, b});
        while (!pending.isEmpty()) {
            Node[] pair = pending.pop();
            Node x = pair[0];
            Node y = pair[1];
            if (x.kind().getTag() != y.kind().getTag() || !x.kind().getName().equals(y.kind().getName())) {
                return false;
            }
            for (Slot s : x.kind().getSlots()) {
                Object vx = x.get(s.getIndex());
                Object vy = y.get(s.getIndex());
                if (vx == null || vy == null) {
                    if (vx != vy) {
                        return false;
                    }
                } else if (!s.isNode()) {
                    if (!vx.equals(vy)) {
                        return false;
                    }
                } else if (s.isSequence()) {
                    List<?> lx = (List<?>) vx;
                    List<?> ly = (List<?>) vy;
                    if (lx.size() != ly.size()) {
                        return false;
                    }
                    for (int i = 0; i < lx.size(); i++) {
                        pending.push(new Node[] {
                                x.arena().node((Handle) lx.get(i)), y.arena().node((Handle) ly.get(i))});
                    }
                } else {
                    pending.push(new Node[] {x.arena().node((Handle) vx), y.arena().node((Handle) vy)});
                }
            }
        }
        return true;
    }
}
