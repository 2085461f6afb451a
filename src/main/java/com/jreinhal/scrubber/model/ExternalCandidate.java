package com.jreinhal.scrubber.model;

/**
 * Candidate span returned by the optional external recognition model.
 */
public record ExternalCandidate(String label, Span span, double score) {
}
