package ai.depgraph.model;

/** Location of a binary or source artifact plus its checksum; empty strings mean unknown. */
public record RemoteArtifact(String url, String hashValue, String hashAlgorithm) {
    public static final RemoteArtifact EMPTY = new RemoteArtifact("", "", "");
}
