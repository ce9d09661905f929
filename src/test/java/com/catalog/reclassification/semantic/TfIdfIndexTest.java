package com.catalog.reclassification.semantic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TfIdfIndex Tests")
class TfIdfIndexTest {

    @Nested
    @DisplayName("Tokenization")
    class Tokenization {

        @Test
        @DisplayName("Should count unigrams and bigrams of words with two or more characters")
        void unigramsAndBigrams() {
            Map<String, Integer> counts = TfIdfIndex.featureCounts("bar do ze a bar");

            assertEquals(2, counts.get("bar"));
            assertEquals(1, counts.get("do"));
            assertEquals(1, counts.get("bar do"));
            assertEquals(1, counts.get("do ze"));
            assertEquals(1, counts.get("ze bar"));
            assertNull(counts.get("a"));
        }

        @Test
        @DisplayName("Should keep accented letters inside tokens")
        void unicodeTokens() {
            Map<String, Integer> counts = TfIdfIndex.featureCounts("açougue são jorge");

            assertTrue(counts.containsKey("açougue"));
            assertTrue(counts.containsKey("são jorge"));
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("An identical term should score 1.0")
        void identicalTerm() {
            TfIdfIndex index = TfIdfIndex.build(List.of("padaria", "salao de beleza", "mercado"));
            SemanticMatch match = index.query("padaria");

            assertEquals("padaria", match.term());
            assertEquals(1.0, match.similarity(), 1e-9);
        }

        @Test
        @DisplayName("Unknown query words should be ignored")
        void partialOverlap() {
            TfIdfIndex index = TfIdfIndex.build(List.of("padaria artesanal"));
            SemanticMatch match = index.query("padaria central");

            assertEquals("padaria artesanal", match.term());
            assertEquals(1.0 / Math.sqrt(3.0), match.similarity(), 1e-9);
        }

        @Test
        @DisplayName("Rarer shared words should weigh more")
        void idfWeighting() {
            TfIdfIndex index = TfIdfIndex.build(List.of("loja de roupas", "loja de calcados", "roupas infantis"));
            SemanticMatch match = index.query("calcados loja");

            assertEquals("loja de calcados", match.term());
        }

        @Test
        @DisplayName("On equal similarity the earlier term should win")
        void tieKeepsFirst() {
            TfIdfIndex index = TfIdfIndex.build(List.of("padaria x", "padaria y"));

            assertEquals("padaria x", index.query("padaria").term());
        }

        @Test
        @DisplayName("No overlap should return the empty match")
        void noOverlap() {
            TfIdfIndex index = TfIdfIndex.build(List.of("padaria", "mercado"));

            assertSame(SemanticMatch.NONE, index.query("oficina mecanica"));
            assertSame(SemanticMatch.NONE, index.query(""));
            assertSame(SemanticMatch.NONE, index.query(null));
        }

        @Test
        @DisplayName("An empty vocabulary should answer every query with the empty match")
        void emptyVocabulary() {
            TfIdfIndex empty = TfIdfIndex.build(List.of());
            TfIdfIndex tokenless = TfIdfIndex.build(List.of("a", "b"));

            assertTrue(empty.isEmpty());
            assertTrue(tokenless.isEmpty());
            assertEquals(2, tokenless.size());
            assertFalse(empty.query("padaria").hasMatch());
            assertFalse(tokenless.query("padaria").hasMatch());
        }
    }

    @Test
    @DisplayName("SemanticMatch should reject similarity outside [0, 1]")
    void testSemanticMatchValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SemanticMatch("x", 1.5));
        assertThrows(IllegalArgumentException.class, () -> new SemanticMatch("x", -0.1));
        assertEquals("", new SemanticMatch(null, 0.0).term());
    }
}
