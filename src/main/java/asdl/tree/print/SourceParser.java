package asdl.tree.print;

import asdl.tree.Tree;

/**
 * A front end that reads source text back into a tree; supplied by the
 * language implementation, used by {@link RoundTripChecker}.
 */
public interface SourceParser {

    /**
     * @return a frozen tree of the parsed source
     */
    Tree parse(String source);
}
