package ai.depgraph.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * The natural key of a package or project across all ecosystems.
 *
 * <p>Two graph nodes may share an Identifier and still be different nodes if their linkage or resolved
 * children differ.
 *
 * @param type the ecosystem, e.g. "Maven", "NPM", "PyPI"
 * @param namespace group id, npm scope or empty
 * @param name the package name
 * @param version the resolved version, possibly empty
 */
public record Identifier(String type, String namespace, String name, String version)
        implements Comparable<Identifier> {

    private static final Comparator<Identifier> ORDER = Comparator.comparing(Identifier::type)
            .thenComparing(Identifier::namespace)
            .thenComparing(Identifier::name)
            .thenComparing(Identifier::version);

    public Identifier {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Identifier name must not be blank");
        }
    }

    /**
     * Parses coordinates of the form {@code type:namespace:name:version}. Missing trailing parts are treated as
     * empty strings; extra colons are kept as part of the version.
     */
    public static Identifier fromCoordinates(String coordinates) {
        var parts = coordinates.split(":", 4);
        if (parts.length < 3) {
            throw new IllegalArgumentException("Expected type:namespace:name[:version] but got '" + coordinates + "'");
        }
        var version = parts.length == 4 ? parts[3] : "";
        return new Identifier(parts[0], parts[1], parts[2], version);
    }

    public String toCoordinates() {
        return type + ":" + namespace + ":" + name + ":" + version;
    }

    @Override
    public int compareTo(Identifier other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return toCoordinates();
    }
}
