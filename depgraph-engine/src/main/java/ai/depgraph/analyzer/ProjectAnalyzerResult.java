package ai.depgraph.analyzer;

import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import java.util.List;

/**
 * Result of analyzing one project.
 *
 * @param projectId identifier of the project; its scopes are qualified with it in the graph
 * @param scopeNames unqualified names of the project's scopes
 * @param issues issues concerning the project as a whole; node issues stay in the graph
 */
public record ProjectAnalyzerResult(Identifier projectId, List<String> scopeNames, List<Issue> issues) {

    public ProjectAnalyzerResult {
        scopeNames = List.copyOf(scopeNames);
        issues = List.copyOf(issues);
    }

    static ProjectAnalyzerResult failed(Identifier projectId, Issue issue) {
        return new ProjectAnalyzerResult(projectId, List.of(), List.of(issue));
    }
}
