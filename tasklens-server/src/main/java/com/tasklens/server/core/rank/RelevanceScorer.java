package com.tasklens.server.core.rank;

import com.tasklens.server.core.model.ScoredMatch;
import com.tasklens.server.core.model.TaskRecord;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Additive relevance score of a task record against a free-text query.
 * <ul>
 *   <li>empty query: +10 for everything</li>
 *   <li>full query substring: +80, plus +10 per query token found in the text</li>
 *   <li>known source (claude / codex): +5</li>
 *   <li>recency: up to +25, losing one point every two days</li>
 * </ul>
 */
@Component
public class RelevanceScorer {

    public static final Comparator<ScoredMatch> RANKING =
            Comparator.comparingDouble(ScoredMatch::getScore).reversed()
                    .thenComparing(Comparator.comparingLong(ScoredMatch::getTimestampMs).reversed());

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9]+");
    private static final double MILLIS_PER_DAY = 86_400_000d;

    public static Set<String> tokenize(String query) {
        Set<String> tokens = new LinkedHashSet<>();
        if (query == null) {
            return tokens;
        }
        for (String token : TOKEN_SEPARATOR.split(query.toLowerCase(Locale.ROOT))) {
            if (token.length() > 1) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public double score(TaskRecord record, String queryLower, Set<String> tokens, long nowMs) {
        String textLower = record.getText().toLowerCase(Locale.ROOT);
        double score = 0;

        if (queryLower.isEmpty()) {
            score += 10;
        } else {
            if (textLower.contains(queryLower)) {
                score += 80;
            }
            for (String token : tokens) {
                if (textLower.contains(token)) {
                    score += 10;
                }
            }
        }

        if (record.getSource().isKnown()) {
            score += 5;
        }

        if (record.getTimestampMs() > 0) {
            double ageDays = Math.max(0, (nowMs - record.getTimestampMs()) / MILLIS_PER_DAY);
            score += Math.max(0, 25 - ageDays / 2);
        }
        return score;
    }

    /**
     * A record takes part in ranking when the query is empty, or the text holds the whole query or any token of it.
     */
    public boolean isEligible(TaskRecord record, String queryLower, Set<String> tokens) {
        if (queryLower.isEmpty()) {
            return true;
        }
        String textLower = record.getText().toLowerCase(Locale.ROOT);
        if (textLower.contains(queryLower)) {
            return true;
        }
        return tokens.stream().anyMatch(textLower::contains);
    }
}
