package asdl.tree.print;

import org.apache.log4j.Logger;

import asdl.Logging;
import asdl.tree.Node;
import asdl.tree.Tree;
import asdl.tree.TreeEquality;

/**
 * Writes a tree, reads the text back and writes it again. A correct
 * printer and reader reach a fixpoint after one cycle.
 */
public final class RoundTripChecker {
    private static final Logger logger = Logging.getLogger();

    private RoundTripChecker() {
    }

    /** Pickle, read back, pickle again. */
    public static RoundTripReport checkPickle(Node node) {
        String first = Pickler.pickle(node);
        try (Tree reread = TreeReader.read(node.kind().getGrammar(), first)) {
            RoundTripReport report = new RoundTripReport(first, Pickler.pickle(reread.root()),
                    TreeEquality.equal(node, reread.root()));
            log(report);
            return report;
        }
    }

    /** Print, parse with {@code parser}, print again. */
    public static RoundTripReport checkSource(SourcePrinter printer, SourceParser parser, Node node) {
        String first = printer.print(node);
        try (Tree reparsed = parser.parse(first)) {
            RoundTripReport report = new RoundTripReport(first, printer.print(reparsed.root()),
                    TreeEquality.equal(node, reparsed.root()));
            log(report);
            return report;
        }
    }

    private static void log(RoundTripReport report) {
        if (!report.isSuccessful()) {
            logger.debug(report);
        }
    }
}
