package com.dorkroom.catalog.search;

import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.core.model.SearchResult;
import com.dorkroom.catalog.metrics.MetricsService;
import com.dorkroom.catalog.similarity.CompositeSimilarityScorer;
import com.dorkroom.catalog.similarity.ScoringPolicy;
import com.dorkroom.catalog.similarity.SearchText;
import com.dorkroom.catalog.similarity.UnavailableStringSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("FuzzyMatcher Tests")
@ExtendWith(MockitoExtension.class)
class FuzzyMatcherTest {

    private static final List<String> NAMES = List.of(
            "Kodak Tri-X 400",
            "Ilford HP5 Plus",
            "Kodak Portra 400",
            "Fujifilm Velvia 50",
            "Ilford Delta 3200");

    private static final Function<String, SearchText> TEXT = name -> new SearchText(name, "");

    @Mock
    private MetricsService metricsService;

    private FuzzyMatcher matcher() {
        return new FuzzyMatcher(new CompositeSimilarityScorer(), metricsService);
    }

    private List<SearchResult<String>> search(FuzzyMatcher matcher, String query, int limit, ScoringPolicy policy) {
        return matcher.search(NAMES, TEXT, RecordKind.FILM, query, limit, policy);
    }

    @Nested
    @DisplayName("Ranking")
    class RankingTests {

        @Test
        @DisplayName("The closest record should come first")
        void closestFirst() {
            List<SearchResult<String>> results = search(matcher(), "hp5", 10, ScoringPolicy.filmsAndDevelopers());

            assertFalse(results.isEmpty());
            assertEquals("Ilford HP5 Plus", results.get(0).record());
            assertEquals(RecordKind.FILM, results.get(0).kind());
        }

        @Test
        @DisplayName("Results should be sorted by descending score")
        void sortedDescending() {
            List<SearchResult<String>> results = search(matcher(), "ilford 400", 10, ScoringPolicy.filmsAndDevelopers());

            for (int i = 1; i < results.size(); i++) {
                assertTrue(results.get(i - 1).percent() >= results.get(i).percent());
            }
        }

        @Test
        @DisplayName("Equal scores should keep catalog order")
        void tiesKeepCatalogOrder() {
            List<String> items = List.of("first", "second", "third");
            Function<String, SearchText> sameText = s -> new SearchText("Kodak Tri-X 400", "");

            List<SearchResult<String>> results = matcher().search(items, sameText, RecordKind.FILM, "tri-x", 10,
                    ScoringPolicy.filmsAndDevelopers());

            assertEquals(List.of("first", "second", "third"), results.stream().map(SearchResult::record).toList());
        }

        @Test
        @DisplayName("Scores with the same whole percentage should keep catalog order")
        void fractionalDifferencesDoNotReorder() {
            Map<String, Double> scores = Map.of("first", 72.1, "second", 72.9, "third", 85.0);
            CompositeSimilarityScorer scorer = mock(CompositeSimilarityScorer.class);
            when(scorer.isAvailable()).thenReturn(true);
            when(scorer.score(eq("trix"), any(SearchText.class), any(ScoringPolicy.class)))
                    .thenAnswer(invocation -> scores.get(invocation.<SearchText>getArgument(1).primary()));

            List<SearchResult<String>> results = new FuzzyMatcher(scorer, metricsService).search(
                    List.of("first", "second", "third"), TEXT, RecordKind.FILM, "trix", 10,
                    ScoringPolicy.filmsAndDevelopers());

            assertEquals(List.of("third", "first", "second"), results.stream().map(SearchResult::record).toList());
            assertEquals(72.9, results.get(2).score(), 1e-9);
        }

        @Test
        @DisplayName("Repeated searches should return identical results")
        void deterministic() {
            FuzzyMatcher matcher = matcher();
            assertEquals(search(matcher, "kodak 400", 10, ScoringPolicy.filmsAndDevelopers()),
                    search(matcher, "kodak 400", 10, ScoringPolicy.filmsAndDevelopers()));
        }
    }

    @Nested
    @DisplayName("Threshold and limit")
    class ThresholdTests {

        @Test
        @DisplayName("Records at or below the threshold should be dropped")
        void threshold() {
            List<SearchResult<String>> results = search(matcher(), "zzzz qqqq", 10, ScoringPolicy.filmsAndDevelopers());
            assertTrue(results.isEmpty());
        }

        @Test
        @DisplayName("Every returned score should pass the policy")
        void scoresPassPolicy() {
            ScoringPolicy policy = ScoringPolicy.filmsAndDevelopers();
            for (SearchResult<String> result : search(matcher(), "ilford", 10, policy)) {
                assertTrue(policy.accepts(result.score()));
            }
        }

        @Test
        @DisplayName("Results should be cut to the limit")
        void limit() {
            List<SearchResult<String>> unlimited = search(matcher(), "kodak", 10, ScoringPolicy.filmsAndDevelopers());
            List<SearchResult<String>> limited = search(matcher(), "kodak", 1, ScoringPolicy.filmsAndDevelopers());

            assertTrue(unlimited.size() >= 2);
            assertEquals(1, limited.size());
            assertEquals(unlimited.get(0), limited.get(0));
        }

        @ParameterizedTest
        @DisplayName("A limit of zero or less should yield nothing")
        @ValueSource(ints = {0, -1, -100})
        void nonPositiveLimit(int limit) {
            assertTrue(search(matcher(), "kodak", limit, ScoringPolicy.filmsAndDevelopers()).isEmpty());
        }

        @Test
        @DisplayName("Two-signal policy should keep strong substring matches")
        void twoSignal() {
            List<SearchResult<String>> results = search(matcher(), "velvia", 10, ScoringPolicy.twoSignal());

            assertEquals(1, results.size());
            assertEquals("Fujifilm Velvia 50", results.get(0).record());
            assertEquals(90.0, results.get(0).score(), 1e-9);
        }

        @Test
        @DisplayName("Retained scores should be recorded")
        void recordsScores() {
            List<SearchResult<String>> results = search(matcher(), "hp5", 10, ScoringPolicy.filmsAndDevelopers());
            verify(metricsService, times(results.size())).recordSimilarityScore(anyDouble());
        }
    }

    @Nested
    @DisplayName("Degraded mode")
    class DegradedTests {

        @Test
        @DisplayName("Without a similarity capability the first records should come back unscored")
        void unscoredResults() {
            FuzzyMatcher matcher = new FuzzyMatcher(new CompositeSimilarityScorer(new UnavailableStringSimilarity()));

            List<SearchResult<String>> results = search(matcher, "anything", 3, ScoringPolicy.filmsAndDevelopers());

            assertEquals(List.of("Kodak Tri-X 400", "Ilford HP5 Plus", "Kodak Portra 400"),
                    results.stream().map(SearchResult::record).toList());
            assertTrue(results.stream().allMatch(r -> r.score() == 0.0));
        }

        @Test
        @DisplayName("Degraded mode should still honour the limit")
        void degradedLimit() {
            FuzzyMatcher matcher = new FuzzyMatcher(new CompositeSimilarityScorer(new UnavailableStringSimilarity()));

            assertEquals(5, search(matcher, "x", 50, ScoringPolicy.filmsAndDevelopers()).size());
            assertTrue(search(matcher, "x", 0, ScoringPolicy.filmsAndDevelopers()).isEmpty());
        }
    }
}
