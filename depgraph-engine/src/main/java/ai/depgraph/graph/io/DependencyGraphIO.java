package ai.depgraph.graph.io;

import ai.depgraph.graph.DependencyGraph;
import ai.depgraph.graph.GraphNode;
import ai.depgraph.model.Identifier;
import ai.depgraph.model.Issue;
import ai.depgraph.model.Package;
import ai.depgraph.model.PackageLinkage;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * JSON persistence for {@link DependencyGraph} and resolved package sets.
 *
 * <p>The graph is written as an ordered node list plus the scope map; packages are written separately. Reading
 * validates node indices, so a corrupted file fails with an {@link IOException} instead of producing a broken graph.
 */
public final class DependencyGraphIO {
    private static final Logger logger = LogManager.getLogger(DependencyGraphIO.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private DependencyGraphIO() {}

    /* ================= DTOs ================= */

    public record GraphDto(List<NodeDto> nodes, Map<String, List<Integer>> scopes) {}

    public record NodeDto(
            int index, Identifier identifier, PackageLinkage linkage, List<Issue> issues, List<Integer> children) {}

    public record PackagesDto(List<Package> packages) {}

    /* ================= Graphs ================= */

    public static String toJson(DependencyGraph graph) throws IOException {
        return MAPPER.writeValueAsString(toDto(graph));
    }

    public static DependencyGraph fromJson(String json) throws IOException {
        return fromDto(MAPPER.readValue(json, GraphDto.class));
    }

    public static void write(DependencyGraph graph, Path file) throws IOException {
        createParent(file);
        MAPPER.writeValue(file.toFile(), toDto(graph));
        logger.debug("Wrote dependency graph with {} nodes to {}", graph.nodes().size(), file);
    }

    public static DependencyGraph read(Path file) throws IOException {
        var graph = fromDto(MAPPER.readValue(file.toFile(), GraphDto.class));
        logger.debug("Read dependency graph with {} nodes from {}", graph.nodes().size(), file);
        return graph;
    }

    /* ================= Packages ================= */

    public static String packagesToJson(Set<Package> packages) throws IOException {
        return MAPPER.writeValueAsString(new PackagesDto(List.copyOf(packages)));
    }

    public static Set<Package> packagesFromJson(String json) throws IOException {
        return fromDto(MAPPER.readValue(json, PackagesDto.class));
    }

    public static void writePackages(Set<Package> packages, Path file) throws IOException {
        createParent(file);
        MAPPER.writeValue(file.toFile(), new PackagesDto(List.copyOf(packages)));
    }

    public static Set<Package> readPackages(Path file) throws IOException {
        return fromDto(MAPPER.readValue(file.toFile(), PackagesDto.class));
    }

    /* ================= Converters ================= */

    static GraphDto toDto(DependencyGraph graph) {
        var nodes = new ArrayList<NodeDto>(graph.nodes().size());
        for (var node : graph.nodes()) {
            nodes.add(new NodeDto(node.index(), node.identifier(), node.linkage(), node.issues(), node.children()));
        }
        return new GraphDto(nodes, new LinkedHashMap<>(graph.scopes()));
    }

    static DependencyGraph fromDto(GraphDto dto) throws IOException {
        if (dto.nodes() == null) {
            throw new IOException("Dependency graph document has no 'nodes' array");
        }
        var scopes = dto.scopes() == null ? Map.<String, List<Integer>>of() : dto.scopes();
        try {
            var nodes = new ArrayList<GraphNode>(dto.nodes().size());
            for (var n : dto.nodes()) {
                nodes.add(new GraphNode(
                        n.index(),
                        n.identifier(),
                        n.linkage(),
                        n.issues() == null ? List.of() : n.issues(),
                        n.children() == null ? List.of() : n.children()));
            }
            return new DependencyGraph(nodes, scopes);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IOException("Invalid dependency graph document: " + e.getMessage(), e);
        }
    }

    private static Set<Package> fromDto(PackagesDto dto) {
        if (dto.packages() == null) {
            return Set.of();
        }
        return new LinkedHashSet<>(dto.packages());
    }

    private static void createParent(Path file) throws IOException {
        var parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
