package ai.depgraph.testutil;

import ai.depgraph.handler.DependencyHandler;
import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.PackageLinkage;
import java.util.List;

public final class TestNodeHandler implements DependencyHandler<TestNode> {

    @Override
    public Identifier identifierFor(TestNode dependency) {
        return dependency.id;
    }

    @Override
    public PackageLinkage linkageFor(TestNode dependency) {
        return dependency.linkage;
    }

    @Override
    public List<TestNode> childrenFor(TestNode dependency) {
        return List.copyOf(dependency.children);
    }

    @Override
    public List<Issue> issuesFor(TestNode dependency) {
        return List.copyOf(dependency.issues);
    }
}
