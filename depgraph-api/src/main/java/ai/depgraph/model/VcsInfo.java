package ai.depgraph.model;

/** Version control coordinates of a package's sources; empty strings mean unknown. */
public record VcsInfo(String type, String url, String revision, String path) {
    public static final VcsInfo EMPTY = new VcsInfo("", "", "", "");
}
