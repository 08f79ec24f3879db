package com.researchbot.data;

import com.researchbot.config.Config;
import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.model.NewsItem;
import com.researchbot.model.RawMetrics;
import com.researchbot.model.ResearchRecord;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Research summaries using LangChain4j + Ollama. The summary is informational only;
 * recommendations never depend on it.
 */
public final class LangChainSummaryService implements SummarizationService {
    private static final Logger log = LogManager.getLogger(LangChainSummaryService.class);
    static final int MAX_HEADLINES = 8;

    private final ChatLanguageModel chatModel;

    public LangChainSummaryService(Config config) {
        this(buildModel(config));
    }

    LangChainSummaryService(ChatLanguageModel chatModel) {
        this.chatModel = chatModel;
    }

    public boolean isEnabled() {
        return chatModel != null;
    }

    @Override
    public String summarize(ResearchRecord record) {
        if (chatModel == null) {
            throw new ResearchException(FailureKind.SERVICE_UNAVAILABLE, "AI summarizer disabled");
        }
        String out;
        try {
            out = chatModel.generate(buildPrompt(record));
        } catch (RuntimeException e) {
            throw new ResearchException(FailureKind.SERVICE_UNAVAILABLE, "summary generation failed: " + e.getMessage(), e);
        }
        String cleaned = cleanModelOutput(out);
        if (cleaned.isEmpty()) {
            throw new ResearchException(FailureKind.SERVICE_UNAVAILABLE, "model returned an empty summary");
        }
        return cleaned;
    }

    static String buildPrompt(ResearchRecord record) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Summarize the following investment research data concisely in 3-5 sentences.\n");
        sb.append("Do not give a buy or sell recommendation.\n\n");
        sb.append("Ticker: ").append(record.ticker).append("\n\n");

        sb.append("Financial Metrics:\n");
        RawMetrics m = record.metrics;
        appendMetric(sb, "P/E Ratio", m.peRatio);
        appendMetric(sb, "Market Cap", m.marketCap);
        appendMetric(sb, "Revenue", m.revenue);
        appendMetric(sb, "Earnings", m.earnings);
        appendMetric(sb, "Profit Margin", m.profitMargin);
        appendMetric(sb, "Revenue Growth", m.revenueGrowth);
        appendMetric(sb, "Current Price", m.currentPrice);

        List<NewsItem> news = record.news;
        sb.append('\n').append(String.format(Locale.US, "Recent News (%d articles):%n", news.size()));
        for (int i = 0; i < news.size() && i < MAX_HEADLINES; i++) {
            NewsItem n = news.get(i);
            sb.append(i + 1).append(". ").append(n.title);
            if (!n.source.isEmpty()) {
                sb.append(" (").append(n.source).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String cleanModelOutput(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        if (t.startsWith("```")) {
            int firstNewline = t.indexOf('\n');
            t = firstNewline < 0 ? "" : t.substring(firstNewline + 1);
            if (t.endsWith("```")) {
                t = t.substring(0, t.length() - 3);
            }
        }
        return t.trim();
    }

    private static void appendMetric(StringBuilder sb, String name, String value) {
        sb.append("- ").append(name).append(": ")
                .append(value == null || value.isBlank() ? "N/A" : value.trim())
                .append('\n');
    }

    private static ChatLanguageModel buildModel(Config config) {
        if (!config.getBoolean("ai.enabled")) {
            log.info("AI summary disabled (ai.enabled=false)");
            return null;
        }
        try {
            return OllamaChatModel.builder()
                    .baseUrl(config.getString("ai.base_url"))
                    .modelName(config.getString("ai.model"))
                    .temperature(config.getDouble("ai.temperature"))
                    .timeout(Duration.ofSeconds(Math.max(10, config.getInt("ai.timeout_sec"))))
                    .build();
        } catch (RuntimeException e) {
            log.warn("failed to initialize LangChain4j Ollama model: {}", e.getMessage());
            return null;
        }
    }
}
