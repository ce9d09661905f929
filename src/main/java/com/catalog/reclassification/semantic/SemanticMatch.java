package com.catalog.reclassification.semantic;

/**
 * Best vocabulary term for a query and its cosine similarity.
 * A zero similarity means "no match" and always comes with an empty term.
 *
 * @param term       best matching vocabulary term, or "" when nothing matched
 * @param similarity cosine similarity between 0.0 and 1.0
 */
public record SemanticMatch(String term, double similarity) {

    public static final SemanticMatch NONE = new SemanticMatch("", 0.0);

    public SemanticMatch {
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("Similarity must be between 0.0 and 1.0");
        }
        term = term != null ? term : "";
    }

    public boolean hasMatch() {
        return similarity > 0.0;
    }
}
