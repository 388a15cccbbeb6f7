package ai.depgraph.analyzer;

import ai.depgraph.graph.DependencyGraph;
import ai.depgraph.model.Issue;
import ai.depgraph.model.Package;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combined outcome of one package manager run over many definition files.
 *
 * @param projectResults per definition file, in input order
 * @param graph the shared dependency graph of all projects
 * @param packages all resolved packages referenced from the graph
 */
public record PackageManagerResult<F>(
        Map<F, List<ProjectAnalyzerResult>> projectResults, DependencyGraph graph, Set<Package> packages) {

    public PackageManagerResult {
        projectResults = Collections.unmodifiableMap(new LinkedHashMap<>(projectResults));
        packages = Collections.unmodifiableSet(new LinkedHashSet<>(packages));
    }

    /** The project issues plus the distinct issues of every node reachable from the project's scopes. */
    public List<Issue> issuesFor(ProjectAnalyzerResult result) {
        var qualified = result.scopeNames().stream()
                .map(scope -> DependencyGraph.qualifyScope(result.projectId(), scope))
                .toList();
        var issues = new LinkedHashSet<>(result.issues());
        issues.addAll(graph.issuesFor(qualified));
        return List.copyOf(issues);
    }

    /** All project results flattened, in input order. */
    public List<ProjectAnalyzerResult> allProjects() {
        return projectResults.values().stream().flatMap(List::stream).toList();
    }
}
