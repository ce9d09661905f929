package com.catalog.reclassification.semantic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Vector-space index over a target vocabulary, answering "which term does this text look like".
 *
 * <p>Terms are tokenized into words of two or more word characters; features are unigrams and
 * bigrams of those words. Weights are raw term counts times a smoothed inverse document frequency,
 * {@code ln((1 + n) / (1 + df)) + 1}, and every vector is L2-normalized, so the dot product of a
 * query vector and a term vector is their cosine similarity. Query features absent from the
 * vocabulary are ignored.</p>
 *
 * <p>An index built over an empty vocabulary (or one without any token) answers every query
 * with {@link SemanticMatch#NONE}.</p>
 */
public final class TfIdfIndex {
    private static final Logger log = LoggerFactory.getLogger(TfIdfIndex.class);
    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<String> terms;
    private final Map<String, Double> idf;
    private final Map<String, List<Posting>> postings;

    private TfIdfIndex(List<String> terms, Map<String, Double> idf, Map<String, List<Posting>> postings) {
        this.terms = terms;
        this.idf = idf;
        this.postings = postings;
    }

    /**
     * Builds the index. Term order is kept; on equal similarity the earlier term wins.
     */
    public static TfIdfIndex build(List<String> targetTerms) {
        List<String> terms = List.copyOf(targetTerms);
        List<Map<String, Integer>> counts = new ArrayList<>(terms.size());
        Map<String, Integer> documentFrequency = new HashMap<>();

        for (String term : terms) {
            Map<String, Integer> termCounts = featureCounts(term);
            counts.add(termCounts);
            for (String feature : termCounts.keySet()) {
                documentFrequency.merge(feature, 1, Integer::sum);
            }
        }

        int n = terms.size();
        Map<String, Double> idf = new HashMap<>();
        documentFrequency.forEach((feature, df) ->
                idf.put(feature, Math.log((1.0 + n) / (1.0 + df)) + 1.0));

        Map<String, List<Posting>> postings = new HashMap<>();
        for (int doc = 0; doc < n; doc++) {
            Map<String, Double> vector = weigh(counts.get(doc), idf);
            for (Map.Entry<String, Double> feature : vector.entrySet()) {
                postings.computeIfAbsent(feature.getKey(), k -> new ArrayList<>())
                        .add(new Posting(doc, feature.getValue()));
            }
        }

        log.debug("semantic.index.built terms={} features={}", n, idf.size());
        return new TfIdfIndex(terms, idf, postings);
    }

    /**
     * Returns the most similar term and its cosine similarity.
     */
    public SemanticMatch query(String text) {
        if (idf.isEmpty() || text == null || text.isBlank()) {
            return SemanticMatch.NONE;
        }
        Map<String, Double> vector = weigh(featureCounts(text), idf);
        if (vector.isEmpty()) {
            return SemanticMatch.NONE;
        }

        double[] scores = new double[terms.size()];
        for (Map.Entry<String, Double> feature : vector.entrySet()) {
            for (Posting posting : postings.getOrDefault(feature.getKey(), List.of())) {
                scores[posting.doc()] += feature.getValue() * posting.weight();
            }
        }

        int best = -1;
        double bestScore = 0.0;
        for (int doc = 0; doc < scores.length; doc++) {
            if (scores[doc] > bestScore) {
                bestScore = scores[doc];
                best = doc;
            }
        }
        if (best < 0) {
            return SemanticMatch.NONE;
        }
        return new SemanticMatch(terms.get(best), Math.min(1.0, bestScore));
    }

    public List<String> getTerms() {
        return terms;
    }

    public int size() {
        return terms.size();
    }

    public boolean isEmpty() {
        return idf.isEmpty();
    }

    /**
     * Unigram and bigram counts of a text.
     */
    static Map<String, Integer> featureCounts(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            counts.merge(tokens.get(i), 1, Integer::sum);
            if (i + 1 < tokens.size()) {
                counts.merge(tokens.get(i) + " " + tokens.get(i + 1), 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * TF-IDF weights of the known features, L2-normalized.
     */
    private static Map<String, Double> weigh(Map<String, Integer> counts, Map<String, Double> idf) {
        Map<String, Double> vector = new HashMap<>();
        double norm = 0.0;
        for (Map.Entry<String, Integer> feature : counts.entrySet()) {
            Double weight = idf.get(feature.getKey());
            if (weight != null) {
                double value = feature.getValue() * weight;
                vector.put(feature.getKey(), value);
                norm += value * value;
            }
        }
        if (norm == 0.0) {
            return Map.of();
        }
        double length = Math.sqrt(norm);
        vector.replaceAll((feature, value) -> value / length);
        return vector;
    }

    private record Posting(int doc, double weight) {}
}
