package ai.depgraph.handler;

import ai.depgraph.model.Identifier;

/** Thrown by a {@link PackageResolver} when a package's metadata cannot be obtained. */
public class PackageResolutionException extends Exception {
    private final Identifier id;

    public PackageResolutionException(Identifier id, String message) {
        super(message);
        this.id = id;
    }

    public PackageResolutionException(Identifier id, String message, Throwable cause) {
        super(message, cause);
        this.id = id;
    }

    public Identifier getId() {
        return id;
    }
}
