package ai.depgraph.model;

import java.util.Objects;

/**
 * A diagnostic attached to a graph node or a project result.
 *
 * <p>Equality covers all four fields; two issues are duplicates only if source, kind, message and severity all
 * match.
 *
 * @param source name of the component that produced the issue, e.g. "Maven" or "PackageResolutionCache"
 * @param kind short machine-readable category, e.g. {@link #RESOLUTION_FAILED}
 * @param message human-readable detail
 * @param severity how serious the issue is
 */
public record Issue(String source, String kind, String message, Severity severity) {
    public static final String RESOLUTION_FAILED = "resolution-failed";
    public static final String PROJECT_FAILED = "project-failed";
    public static final String PROJECT_CANCELLED = "project-cancelled";
    public static final String GENERIC = "generic";

    public Issue {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
    }

    public static Issue of(String source, String message, Severity severity) {
        return new Issue(source, GENERIC, message, severity);
    }
}
