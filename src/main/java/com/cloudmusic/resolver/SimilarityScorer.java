package com.cloudmusic.resolver;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores how likely a search hit on another catalog is the same recording as a target song.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Both strings are normalized: lowercased, whitespace, punctuation, symbols and brackets removed.</li>
 *   <li>Identical normalized strings score 1.0.</li>
 *   <li>Containment in either direction scores {@code 0.5 + 0.5 * shorter/longer}.</li>
 *   <li>Otherwise the Jaccard similarity of the two character sets is used.</li>
 *   <li>Non-identical pairs where either side is shorter than three characters have their score halved.</li>
 *   <li>Title scores below the similarity threshold are discarded; survivors get an artist bonus
 *       (full for an exact or contained artist, half for a Jaccard match of at least 0.5), capped at 1.0.</li>
 * </ul>
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class SimilarityScorer {
    private static final Pattern NOISE = Pattern.compile("[\\p{P}\\p{S}\\s]+");
    private static final int SHORT_LENGTH = 3;
    private static final double SHORT_PENALTY = 0.5;
    private static final double PARTIAL_ARTIST_SIMILARITY = 0.5;

    private final double threshold;
    private final double artistBonus;

    public SimilarityScorer(double threshold, double artistBonus) {
        this.threshold = threshold;
        this.artistBonus = artistBonus;
    }

    public SimilarityScorer(PreviewDetectionConfig config) {
        this(config.similarityThreshold(), config.artistMatchBonus());
    }

    public static String normalize(String value) {
        if (value == null) return "";
        return NOISE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Similarity of two strings in [0.0, 1.0].
     */
    public double score(String a, String b) {
        String x = normalize(a);
        String y = normalize(b);
        if (x.isEmpty() || y.isEmpty()) {
            return 0.0;
        }
        if (x.equals(y)) {
            return 1.0;
        }
        String shorter = x.length() <= y.length() ? x : y;
        String longer = shorter == x ? y : x;
        double result;
        if (longer.contains(shorter)) {
            result = 0.5 + 0.5 * ((double) shorter.length() / longer.length());
        } else {
            result = jaccard(x, y);
        }
        if (shorter.length() < SHORT_LENGTH) {
            result *= SHORT_PENALTY;
        }
        return result;
    }

    /**
     * Bonus for the candidate's artists matching the target artist.
     */
    public double artistBonus(String targetArtist, List<String> candidateArtists) {
        String target = normalize(targetArtist);
        if (target.isEmpty() || candidateArtists == null) {
            return 0.0;
        }
        double best = 0.0;
        for (String artist : candidateArtists) {
            String candidate = normalize(artist);
            if (candidate.isEmpty()) continue;
            if (candidate.equals(target) || candidate.contains(target) || target.contains(candidate)) {
                return artistBonus;
            }
            if (jaccard(target, candidate) >= PARTIAL_ARTIST_SIMILARITY) {
                best = artistBonus / 2;
            }
        }
        return best;
    }

    /**
     * Scores a candidate against the target, or returns a negative value when the title falls below the threshold.
     */
    public double scoreCandidate(Song target, Song candidate) {
        double titleScore = score(target.name(), candidate.name());
        if (titleScore < threshold) {
            return -1.0;
        }
        return Math.min(1.0, titleScore + artistBonus(target.primaryArtist(), candidate.artists()));
    }

    public double threshold() {
        return threshold;
    }

    private static double jaccard(String x, String y) {
        Set<Integer> a = new HashSet<>();
        x.codePoints().forEach(a::add);
        Set<Integer> b = new HashSet<>();
        y.codePoints().forEach(b::add);
        Set<Integer> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) return 0.0;
        a.retainAll(b);
        return (double) a.size() / union.size();
    }
}
