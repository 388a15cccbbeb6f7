package ai.depgraph.model;

/** How a dependency is attached to its parent. Part of a graph node's identity. */
public enum PackageLinkage {
    DYNAMIC,
    STATIC,
    PROJECT_DYNAMIC,
    PROJECT_STATIC;

    /** True for links to other projects of the same analysis, which are never resolved as packages. */
    public boolean isProjectLinkage() {
        return this == PROJECT_DYNAMIC || this == PROJECT_STATIC;
    }
}
