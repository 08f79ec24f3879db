package com.researchbot.data.http;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin wrapper over the JDK client that maps transport faults onto {@link FailureKind}.
 */
public class HttpClientEx {
    static final String USER_AGENT = "ResearchBot/1.0";

    private final HttpClient client;

    public HttpClientEx() {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * @throws HttpStatusException for a non-2xx response (429 as RATE_LIMITED)
     * @throws ResearchException PROVIDER_UNAVAILABLE for I/O faults
     */
    public String getText(String url, int timeoutSeconds) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .GET()
                .header("User-Agent", USER_AGENT)
                .build();
        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ResearchException(FailureKind.PROVIDER_UNAVAILABLE, "request failed for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResearchException(FailureKind.PROVIDER_UNAVAILABLE, "request interrupted for " + url, e);
        }
        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return resp.body();
        }
        throw new HttpStatusException(status, "HTTP " + status + " for " + url);
    }
}
