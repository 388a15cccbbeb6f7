package ai.depgraph.analyzer;

import ai.depgraph.model.Identifier;
import java.util.List;

/**
 * The per-ecosystem part of an analysis: turns one definition file (pom.xml, package.json, poetry.lock, ...) into
 * project results, feeding the project's native dependency trees into the shared builder via the
 * {@link ResolutionContext}.
 *
 * @param <F> the definition file type
 * @param <D> the native dependency node type
 */
public interface ProjectResolver<F, D> {

    /** Name of the package manager, used as the source of issues, e.g. "Maven". */
    String managerName();

    /**
     * Resolves the projects defined by {@code definitionFile}. Implementations should add dependencies only through
     * the context, which applies scope excludes and cancellation.
     *
     * @throws Exception if the external tooling fails; the failure is reported for this definition file only
     */
    List<ProjectAnalyzerResult> resolve(F definitionFile, ResolutionContext<D> context) throws Exception;

    /** Identifier used to report a definition file whose resolution failed before a project id was known. */
    default Identifier fallbackProjectId(F definitionFile) {
        return new Identifier(managerName(), "", definitionFile.toString(), "");
    }
}
