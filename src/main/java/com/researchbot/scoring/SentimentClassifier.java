package com.researchbot.scoring;

import com.researchbot.model.NewsItem;
import com.researchbot.model.SentimentLabel;
import com.researchbot.model.SentimentResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lexicon classifier over news titles and snippets. An article may count as both
 * positive and negative; an article matching neither list is neutral.
 */
public final class SentimentClassifier {
    static final List<String> POSITIVE_TERMS = List.of(
            "beat", "beats", "surge", "soar", "record", "growth", "upgrade", "strong",
            "gains", "rally", "profit", "outperform", "bullish", "raises", "exceeds",
            "jump", "boost", "expands", "launch", "innovation"
    );
    static final List<String> NEGATIVE_TERMS = List.of(
            "misses", "missed", "plunge", "drop", "decline", "downgrade", "weak", "loss",
            "lawsuit", "subpoena", "investigation", "recall", "layoffs", "job cuts", "bearish",
            "falls", "slump", "warning", "fraud", "tumble"
    );
    private static final int HEADLINE_LIMIT = 3;

    public SentimentResult classify(List<NewsItem> news) {
        List<NewsItem> items = news == null ? List.of() : news;
        int positive = 0;
        int negative = 0;
        int neutral = 0;
        List<String> headlines = new ArrayList<>(HEADLINE_LIMIT);

        for (NewsItem item : items) {
            String text = (item.title + " " + item.snippet).toLowerCase(Locale.ROOT);
            boolean pos = containsAny(text, POSITIVE_TERMS);
            boolean neg = containsAny(text, NEGATIVE_TERMS);
            if (pos) {
                positive++;
            }
            if (neg) {
                negative++;
            }
            if (!pos && !neg) {
                neutral++;
            }
            if (headlines.size() < HEADLINE_LIMIT) {
                headlines.add(item.title);
            }
        }

        SentimentLabel label = SentimentLabel.NEUTRAL;
        if (positive > negative) {
            label = SentimentLabel.POSITIVE;
        } else if (negative > positive) {
            label = SentimentLabel.NEGATIVE;
        }

        int total = items.size();
        double confidence = total == 0
                ? 100.0
                : round2(100.0 * Math.max(positive, negative) / total);

        return SentimentResult.builder()
                .label(label)
                .confidence(confidence)
                .positiveCount(positive)
                .negativeCount(negative)
                .neutralCount(neutral)
                .recentHeadlines(List.copyOf(headlines))
                .build();
    }

    private static boolean containsAny(String text, List<String> terms) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
