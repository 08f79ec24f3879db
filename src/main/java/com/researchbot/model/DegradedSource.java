package com.researchbot.model;

import com.researchbot.core.FailureKind;

/**
 * A collaborator that failed during research; its data was replaced with an empty value.
 */
public record DegradedSource(String source, FailureKind kind, String message) {
}
