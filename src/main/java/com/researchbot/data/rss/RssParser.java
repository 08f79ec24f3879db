package com.researchbot.data.rss;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.model.NewsItem;
import org.jsoup.Jsoup;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class RssParser {

    private RssParser() {
    }

    /**
     * Reads up to {@code maxItems} {@code <item>} entries in document order.
     *
     * @throws ResearchException PROVIDER_UNAVAILABLE when the feed is not well-formed XML
     */
    public static List<NewsItem> parse(String xml, int maxItems) {
        List<NewsItem> out = new ArrayList<>();
        if (xml == null || xml.isBlank()) {
            return out;
        }
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            doc = factory.newDocumentBuilder()
                    .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ResearchException(FailureKind.PROVIDER_UNAVAILABLE, "malformed RSS feed: " + e.getMessage(), e);
        }

        NodeList items = doc.getElementsByTagName("item");
        for (int i = 0; i < items.getLength() && out.size() < maxItems; i++) {
            Element item = (Element) items.item(i);
            String title = text(item, "title");
            String link = text(item, "link");
            out.add(new NewsItem(
                    title,
                    plainText(text(item, "description")),
                    link,
                    sourceText(item, title, link),
                    parseDate(text(item, "pubDate"))
            ));
        }
        return out;
    }

    static String plainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().trim();
    }

    private static ZonedDateTime parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(raw.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String text(Element parent, String tag) {
        NodeList nl = parent.getElementsByTagName(tag);
        if (nl.getLength() == 0) {
            return null;
        }
        Node n = nl.item(0);
        return n == null ? null : n.getTextContent();
    }

    private static String sourceText(Element item, String title, String link) {
        String source = text(item, "source");
        if (source != null && !source.trim().isEmpty()) {
            return source.trim();
        }

        // aggregated feeds append the outlet to the title: "Headline - Outlet"
        if (title != null && title.contains(" - ")) {
            String guessed = title.substring(title.lastIndexOf(" - ") + 3).trim();
            if (!guessed.isEmpty()) {
                return guessed;
            }
        }

        if (link != null && !link.trim().isEmpty()) {
            try {
                String host = URI.create(link.trim()).getHost();
                if (host != null && !host.isBlank()) {
                    return host.trim();
                }
            } catch (IllegalArgumentException e) {
                return "";
            }
        }
        return "";
    }
}
