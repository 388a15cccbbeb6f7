package ai.depgraph.util;

import ai.depgraph.model.Issue;
import ai.depgraph.model.Severity;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Creates issues and logs them at the level matching their severity. */
public final class Issues {
    private static final Logger logger = LogManager.getLogger(Issues.class);

    private Issues() {}

    public static Issue createAndLog(String source, String kind, String message, Severity severity) {
        var issue = new Issue(source, kind, message, severity);
        logger.log(levelFor(severity), "[{}] {}: {}", source, kind, message);
        return issue;
    }

    public static Issue createAndLog(String source, String message, Severity severity) {
        return createAndLog(source, Issue.GENERIC, message, severity);
    }

    static Level levelFor(Severity severity) {
        return switch (severity) {
            case HINT -> Level.INFO;
            case WARNING -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }
}
