package ai.depgraph.config;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Scope name patterns whose dependencies are filtered out before they reach the graph builder. */
public final class ScopeExcludes {
    private static final ScopeExcludes NONE = new ScopeExcludes(List.of());

    private final List<Pattern> patterns;

    private ScopeExcludes(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    public static ScopeExcludes none() {
        return NONE;
    }

    /**
     * @param regexes regular expressions that must match the whole scope name
     * @throws IllegalArgumentException if a pattern is not a valid regular expression
     */
    public static ScopeExcludes of(List<String> regexes) {
        if (regexes.isEmpty()) {
            return NONE;
        }
        try {
            return new ScopeExcludes(regexes.stream().map(Pattern::compile).toList());
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid scope exclude pattern: " + e.getPattern(), e);
        }
    }

    public boolean isScopeExcluded(String scopeName) {
        return patterns.stream().anyMatch(p -> p.matcher(scopeName).matches());
    }

    @Override
    public String toString() {
        return "ScopeExcludes" + patterns;
    }
}
