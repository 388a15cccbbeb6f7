package ai.depgraph.testutil;

import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.PackageLinkage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Minimal mutable native node, so tests can build arbitrary shapes including cycles. */
public final class TestNode {
    public static final String TYPE = "Maven";

    final Identifier id;
    final PackageLinkage linkage;
    final List<TestNode> children = new ArrayList<>();
    final List<Issue> issues = new ArrayList<>();

    private TestNode(Identifier id, PackageLinkage linkage) {
        this.id = id;
        this.linkage = linkage;
    }

    /** A dynamically linked package from {@code namespace:name:version}. */
    public static TestNode pkg(String gav) {
        return new TestNode(id(gav), PackageLinkage.DYNAMIC);
    }

    public static TestNode pkg(String gav, PackageLinkage linkage) {
        return new TestNode(id(gav), linkage);
    }

    /** A dependency on another project of the same analysis. */
    public static TestNode project(String gav) {
        return new TestNode(id(gav), PackageLinkage.PROJECT_DYNAMIC);
    }

    public static Identifier id(String gav) {
        var parts = gav.split(":");
        return new Identifier(TYPE, parts[0], parts[1], parts.length > 2 ? parts[2] : "");
    }

    public TestNode dependsOn(TestNode... nodes) {
        children.addAll(Arrays.asList(nodes));
        return this;
    }

    public TestNode withIssue(Issue issue) {
        issues.add(issue);
        return this;
    }

    public Identifier id() {
        return id;
    }

    public List<TestNode> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return id.toCoordinates();
    }
}
