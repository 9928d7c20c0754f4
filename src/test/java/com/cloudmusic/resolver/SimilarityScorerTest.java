package com.cloudmusic.resolver;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SimilarityScorerTest {
    private final SimilarityScorer scorer = new SimilarityScorer(0.5, 0.2);

    @Test
    void normalizeStripsCasePunctuationAndWhitespace() {
        assertEquals("helloworld", SimilarityScorer.normalize(" Hello, World! "));
        assertEquals("jaychou", SimilarityScorer.normalize("Jay-Chou"));
        assertEquals("", SimilarityScorer.normalize(null));
    }

    @Test
    void identicalStringsScoreOne() {
        assertEquals(1.0, scorer.score("Love Story", "love-story"), 1e-9);
    }

    @Test
    void containmentScoresByLengthRatio() {
        // "abcd" in "abcdefgh": 0.5 + 0.5 * 4/8
        assertEquals(0.75, scorer.score("abcd", "abcdefgh"), 1e-9);
    }

    @Test
    void unrelatedLongTitleScoresBelowThreshold() {
        assertTrue(scorer.score("A", "Totally Different Long Title") < 0.5);
        assertTrue(scorer.score("Yesterday", "Bohemian Rhapsody") < 0.5);
    }

    @Test
    void emptyInputScoresZero() {
        assertEquals(0.0, scorer.score("", "x"), 1e-9);
        assertEquals(0.0, scorer.score("!!!", "x"), 1e-9);
    }

    @Test
    void artistBonusIsFullForContainedArtist() {
        assertEquals(0.2, scorer.artistBonus("Jay Chou", List.of("周杰伦", "Jay Chou & Friends")), 1e-9);
        assertEquals(0.0, scorer.artistBonus("Jay Chou", List.of("Zzz")), 1e-9);
        assertEquals(0.0, scorer.artistBonus("", List.of("Anyone")), 1e-9);
    }

    @Test
    void candidateBelowThresholdIsDiscardedBeforeBonus() {
        Song target = new Song("1", "Yesterday", List.of("The Beatles"), "netease");
        Song other = new Song("2", "Bohemian Rhapsody", List.of("The Beatles"), "kuwo");
        assertTrue(scorer.scoreCandidate(target, other) < 0);
    }

    @Test
    void candidateScoreIsCappedAtOne() {
        Song target = new Song("1", "Yesterday", List.of("The Beatles"), "netease");
        Song same = new Song("9", "Yesterday", List.of("The Beatles"), "kuwo");
        assertEquals(1.0, scorer.scoreCandidate(target, same), 1e-9);
    }
}
