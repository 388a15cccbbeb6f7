package ai.depgraph.model;

public enum Severity {
    HINT,
    WARNING,
    ERROR
}
