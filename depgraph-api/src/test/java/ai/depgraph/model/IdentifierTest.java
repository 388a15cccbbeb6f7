package ai.depgraph.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class IdentifierTest {

    @Test
    void parsesCoordinates() {
        var id = Identifier.fromCoordinates("Maven:org.apache.commons:commons-lang3:3.14.0");

        assertEquals(new Identifier("Maven", "org.apache.commons", "commons-lang3", "3.14.0"), id);
        assertEquals("Maven:org.apache.commons:commons-lang3:3.14.0", id.toCoordinates());
        assertEquals(id.toCoordinates(), id.toString());
    }

    @Test
    void missingVersionIsEmptyAndExtraColonsStayInVersion() {
        assertEquals("", Identifier.fromCoordinates("NPM::left-pad").version());
        assertEquals("1.0:classifier", Identifier.fromCoordinates("Maven:g:a:1.0:classifier").version());
    }

    @Test
    void rejectsIncompleteCoordinatesAndBlankNames() {
        assertThrows(IllegalArgumentException.class, () -> Identifier.fromCoordinates("Maven:g"));
        assertThrows(IllegalArgumentException.class, () -> new Identifier("Maven", "g", " ", "1.0"));
        assertThrows(NullPointerException.class, () -> new Identifier("Maven", null, "a", "1.0"));
    }

    @Test
    void ordersByTypeNamespaceNameVersion() {
        var sorted = new TreeSet<>(List.of(
                new Identifier("NPM", "", "a", "1.0"),
                new Identifier("Maven", "g", "b", "1.0"),
                new Identifier("Maven", "g", "a", "2.0"),
                new Identifier("Maven", "g", "a", "1.0")));

        assertEquals(
                List.of("Maven:g:a:1.0", "Maven:g:a:2.0", "Maven:g:b:1.0", "NPM::a:1.0"),
                sorted.stream().map(Identifier::toCoordinates).toList());
    }

    @Test
    void packageCopiesAndSortsSets() {
        var pkg = Package.of(new Identifier("Maven", "g", "a", "1.0")).withAuthors(Set.of("zed", "amy"));

        assertEquals(List.of("amy", "zed"), List.copyOf(pkg.authors()));
        assertThrows(UnsupportedOperationException.class, () -> pkg.authors().add("bob"));
        assertEquals(RemoteArtifact.EMPTY, pkg.binaryArtifact());
        assertTrue(PackageLinkage.PROJECT_STATIC.isProjectLinkage());
        assertFalse(PackageLinkage.STATIC.isProjectLinkage());
    }
}
