package com.researchbot.data;

import com.researchbot.config.Config;
import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.model.NewsItem;
import com.researchbot.model.RawMetrics;
import com.researchbot.model.ResearchRecord;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LangChainSummaryServiceTest {

    @Test
    void summarize_shouldReturnCleanedModelOutput() {
        FixedModel model = new FixedModel("```text\nApple shows steady growth.\n```");
        LangChainSummaryService service = new LangChainSummaryService(model);

        String summary = service.summarize(record());

        assertEquals("Apple shows steady growth.", summary);
        assertEquals(1, model.prompts.size());
        assertTrue(model.prompts.get(0).contains("Ticker: AAPL"));
    }

    @Test
    void summarize_shouldReportEmptyOutputAsUnavailable() {
        LangChainSummaryService service = new LangChainSummaryService(new FixedModel("   "));

        ResearchException e = assertThrows(ResearchException.class, () -> service.summarize(record()));

        assertEquals(FailureKind.SERVICE_UNAVAILABLE, e.kind());
    }

    @Test
    void summarize_shouldWrapModelFailures() {
        LangChainSummaryService service = new LangChainSummaryService(new ChatLanguageModel() {
            @Override
            public Response<AiMessage> generate(List<ChatMessage> messages) {
                throw new IllegalStateException("connection refused");
            }
        });

        ResearchException e = assertThrows(ResearchException.class, () -> service.summarize(record()));

        assertEquals(FailureKind.SERVICE_UNAVAILABLE, e.kind());
        assertTrue(e.getMessage().contains("connection refused"));
    }

    @Test
    void constructor_shouldStayDisabledWhenAiIsOff() {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of("ai", Map.of("enabled", "false")));
        LangChainSummaryService service = new LangChainSummaryService(config);

        assertFalse(service.isEnabled());
        assertEquals(FailureKind.SERVICE_UNAVAILABLE,
                assertThrows(ResearchException.class, () -> service.summarize(record())).kind());
    }

    @Test
    void buildPrompt_shouldListMetricsAndCapHeadlines() {
        List<NewsItem> news = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            news.add(new NewsItem("Headline " + i, "", "https://n.example.com/" + i, i == 1 ? "Reuters" : "", null));
        }
        ResearchRecord record = new ResearchRecord("AAPL", RawMetrics.builder().peRatio("37.33").build(), news, null, List.of());

        String prompt = LangChainSummaryService.buildPrompt(record);

        assertTrue(prompt.contains("- P/E Ratio: 37.33"));
        assertTrue(prompt.contains("- Revenue: N/A"));
        assertTrue(prompt.contains("Recent News (10 articles):"));
        assertTrue(prompt.contains("1. Headline 1 (Reuters)"));
        assertTrue(prompt.contains("8. Headline 8"));
        assertFalse(prompt.contains("Headline 9"));
    }

    private static ResearchRecord record() {
        return new ResearchRecord(
                "AAPL",
                RawMetrics.builder().peRatio("28.1").profitMargin("26.92%").build(),
                List.of(new NewsItem("Apple beats estimates", "", "https://n.example.com/1", "Reuters", null)),
                null,
                List.of()
        );
    }

    private static final class FixedModel implements ChatLanguageModel {
        private final String output;
        private final List<String> prompts = new ArrayList<>();

        private FixedModel(String output) {
            this.output = output;
        }

        @Override
        public Response<AiMessage> generate(List<ChatMessage> messages) {
            for (ChatMessage m : messages) {
                prompts.add(m.text());
            }
            return Response.from(AiMessage.aiMessage(output));
        }
    }
}
