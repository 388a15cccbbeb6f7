package ai.depgraph.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Resolved metadata for one {@link Identifier}. Created once per identifier by the package resolution cache and
 * immutable afterwards.
 */
public record Package(
        Identifier id,
        SortedSet<String> declaredLicenses,
        SortedSet<String> authors,
        String description,
        String homepageUrl,
        RemoteArtifact binaryArtifact,
        RemoteArtifact sourceArtifact,
        VcsInfo vcs) {

    public Package {
        Objects.requireNonNull(id, "id");
        declaredLicenses = Collections.unmodifiableSortedSet(new TreeSet<>(declaredLicenses));
        authors = Collections.unmodifiableSortedSet(new TreeSet<>(authors));
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(homepageUrl, "homepageUrl");
        Objects.requireNonNull(binaryArtifact, "binaryArtifact");
        Objects.requireNonNull(sourceArtifact, "sourceArtifact");
        Objects.requireNonNull(vcs, "vcs");
    }

    /** A package that only carries its identifier; metadata is filled in with the {@code with*} methods. */
    public static Package of(Identifier id) {
        return new Package(
                id,
                new TreeSet<>(),
                new TreeSet<>(),
                "",
                "",
                RemoteArtifact.EMPTY,
                RemoteArtifact.EMPTY,
                VcsInfo.EMPTY);
    }

    public Package withDeclaredLicenses(Set<String> licenses) {
        return new Package(
                id, new TreeSet<>(licenses), authors, description, homepageUrl, binaryArtifact, sourceArtifact, vcs);
    }

    public Package withAuthors(Set<String> newAuthors) {
        return new Package(
                id, declaredLicenses, new TreeSet<>(newAuthors), description, homepageUrl, binaryArtifact,
                sourceArtifact, vcs);
    }

    public Package withDescription(String newDescription) {
        return new Package(
                id, declaredLicenses, authors, newDescription, homepageUrl, binaryArtifact, sourceArtifact, vcs);
    }

    public Package withHomepageUrl(String url) {
        return new Package(id, declaredLicenses, authors, description, url, binaryArtifact, sourceArtifact, vcs);
    }

    public Package withArtifacts(RemoteArtifact binary, RemoteArtifact source) {
        return new Package(id, declaredLicenses, authors, description, homepageUrl, binary, source, vcs);
    }

    public Package withVcs(VcsInfo newVcs) {
        return new Package(
                id, declaredLicenses, authors, description, homepageUrl, binaryArtifact, sourceArtifact, newVcs);
    }
}
