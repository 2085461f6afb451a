package com.jreinhal.scrubber.dto;

import java.util.List;

/**
 * An empty or absent identifier list requests full restoration.
 */
public record DeScrubRequestDto(
        String operationId,
        String actor,
        String sessionId,
        String role,
        String clearance,
        String justification,
        List<String> identifiers
) {
}
