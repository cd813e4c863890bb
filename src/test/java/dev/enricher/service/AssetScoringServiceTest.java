package dev.enricher.service;

import dev.enricher.config.ScoringConfig;
import dev.enricher.model.AnalyzedAsset;
import dev.enricher.model.ScoredAsset;
import dev.enricher.provider.AssetInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AssetScoringServiceTest {

    private AssetScoringService scoringService;

    @BeforeEach
    void setUp() {
        scoringService = new AssetScoringService(new ScoringConfig());
    }

    private AnalyzedAsset asset(String provider, int width, int height, Double voteAverage, Integer voteCount,
                                String language, Long perceptualHash) {
        AssetInfo info = new AssetInfo(provider, "poster", "https://img/" + provider + "/" + width + "x" + height,
                width, height, language, voteAverage, voteCount, null);
        return new AnalyzedAsset(info, provider + width + height, 0L, "image/jpeg", width, height,
                perceptualHash, null);
    }

    @Nested
    @DisplayName("Single asset scoring")
    class ScoreTests {

        @Test
        @DisplayName("Should score higher resolution at least as high")
        void shouldPreferHigherResolution() {
            double fullHd = scoringService.score(asset("tmdb", 1920, 1080, 7.0, 50, "en", null), List.of());
            double hd = scoringService.score(asset("tmdb", 1280, 720, 7.0, 50, "en", null), List.of());

            assertThat(fullHd).isGreaterThan(hd);
        }

        @Test
        @DisplayName("Should score a higher vote average higher")
        void shouldPreferBetterVotes() {
            double good = scoringService.score(asset("tmdb", 1000, 1500, 8.0, 200, "en", null), List.of());
            double poor = scoringService.score(asset("tmdb", 1000, 1500, 6.0, 200, "en", null), List.of());

            assertThat(good).isGreaterThan(poor);
        }

        @Test
        @DisplayName("Should damp votes with few voters")
        void shouldDampLowVoteCounts() {
            assertThat(scoringService.voteScore(10.0, 500)).isCloseTo(100.0, within(1e-9));
            assertThat(scoringService.voteScore(10.0, 5)).isLessThan(50.0);
            assertThat(scoringService.voteScore(null, 100)).isZero();
            assertThat(scoringService.voteScore(8.0, 0)).isZero();
        }

        @Test
        @DisplayName("Should keep preferring higher resolution above 4K")
        void shouldPreferHigherResolutionAbove4k() {
            double uhd = scoringService.score(asset("tmdb", 3840, 2160, 7.0, 50, "en", null), List.of());
            double dci = scoringService.score(asset("tmdb", 4096, 2160, 7.0, 50, "en", null), List.of());
            double huge = scoringService.score(asset("tmdb", 6000, 9000, 7.0, 50, "en", null), List.of());

            assertThat(dci).isGreaterThan(uhd);
            assertThat(huge).isGreaterThan(dci);
        }

        @Test
        @DisplayName("Should score half the resolution factor at the configured area and stay below the maximum")
        void shouldDampResolution() {
            assertThat(scoringService.resolutionScore(1920L * 1080L)).isCloseTo(50.0, within(1e-9));
            assertThat(scoringService.resolutionScore(100_000L * 100_000L)).isLessThan(100.0);
            assertThat(scoringService.resolutionScore(0)).isZero();
        }

        @Test
        @DisplayName("Should rank preferred, neutral and other languages")
        void shouldScoreLanguages() {
            assertThat(scoringService.languageScore("EN")).isEqualTo(100.0);
            assertThat(scoringService.languageScore(null)).isEqualTo(70.0);
            assertThat(scoringService.languageScore("xx")).isEqualTo(70.0);
            assertThat(scoringService.languageScore("de")).isEqualTo(30.0);
        }

        @Test
        @DisplayName("Should boost providers by their position in the order")
        void shouldApplyProviderMultiplier() {
            List<String> order = List.of("tmdb", "fanart");

            assertThat(scoringService.providerMultiplier("tmdb", order)).isCloseTo(1.1, within(1e-9));
            assertThat(scoringService.providerMultiplier("fanart", order)).isCloseTo(1.05, within(1e-9));
            assertThat(scoringService.providerMultiplier("omdb", order)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should be deterministic")
        void shouldBeDeterministic() {
            AnalyzedAsset asset = asset("tmdb", 2000, 3000, 5.5, 42, "fr", 0L);

            assertThat(scoringService.score(asset, List.of("tmdb"))).isEqualTo(scoringService.score(asset, List.of("tmdb")));
        }
    }

    @Nested
    @DisplayName("Batch scoring")
    class ScoreAllTests {

        @Test
        @DisplayName("Should sort by score, then by area")
        void shouldSortByScoreThenArea() {
            AnalyzedAsset uhd = asset("a", 3840, 2160, 7.0, 100, "en", null);
            AnalyzedAsset larger = asset("b", 4000, 3000, 7.0, 100, "en", null);
            AnalyzedAsset small = asset("c", 500, 750, 7.0, 100, "en", null);

            List<ScoredAsset> result = scoringService.scoreAll(List.of(small, uhd, larger), List.of());

            assertThat(result).extracting(s -> s.asset().source().providerName()).containsExactly("b", "a", "c");
        }

        @Test
        @DisplayName("Should keep near-duplicate images for later reselection")
        void shouldKeepNearDuplicates() {
            AnalyzedAsset best = asset("tmdb", 2000, 3000, 8.0, 300, "en", 0L);
            AnalyzedAsset copy = asset("fanart", 1000, 1500, 8.0, 300, "en", 0b111L);
            AnalyzedAsset different = asset("omdb", 1000, 1500, 8.0, 300, "en", -1L);

            List<ScoredAsset> result = scoringService.scoreAll(List.of(copy, different, best), List.of());

            assertThat(result).extracting(s -> s.asset().source().providerName()).containsExactly("tmdb", "fanart", "omdb");
        }
    }
}
