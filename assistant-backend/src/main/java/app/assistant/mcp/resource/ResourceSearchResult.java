package app.assistant.mcp.resource;

import java.util.List;

public record ResourceSearchResult(List<ResourceMatch> matches, int totalMatches) {

    public ResourceSearchResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public record ResourceMatch(ResourceMetadata resource, List<String> snippets, double score) {

        public ResourceMatch {
            snippets = snippets == null ? List.of() : List.copyOf(snippets);
        }
    }
}
