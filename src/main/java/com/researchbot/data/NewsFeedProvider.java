package com.researchbot.data;

import com.researchbot.model.NewsItem;

import java.util.List;

public interface NewsFeedProvider {

    /**
     * @return at most {@code limit} items in provider order
     * @throws com.researchbot.core.ResearchException PROVIDER_UNAVAILABLE or RATE_LIMITED
     */
    List<NewsItem> search(String query, int limit);
}
