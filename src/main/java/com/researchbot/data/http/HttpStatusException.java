package com.researchbot.data.http;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;

public class HttpStatusException extends ResearchException {
    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(statusCode == 429 ? FailureKind.RATE_LIMITED : FailureKind.PROVIDER_UNAVAILABLE, message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
