package asdl;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

/**
 * Access to the single project logger. The library ships no log4j
 * configuration; callers configure log4j as usual.
 */
public class Logging {
    private static final String LOGGER_NAME = "asdl";

    public static Logger getLogger() {
        return Logger.getLogger(LOGGER_NAME);
    }

    /**
     * Console logging for the command line: messages at INFO and above
     * go to stderr. Does nothing if log4j was configured already.
     */
    public static Logger setupConsole() {
        Logger root = Logger.getRootLogger();
        Logger logger = getLogger();
        if (!root.getAllAppenders().hasMoreElements() && !logger.getAllAppenders().hasMoreElements()) {
            root.setLevel(Level.WARN);
            root.addAppender(new ConsoleAppender(new PatternLayout("%-5p %c: %m%n"), ConsoleAppender.SYSTEM_ERR));
            logger.setLevel(Level.INFO);
        }
        return logger;
    }
}
