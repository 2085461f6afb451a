package com.jreinhal.scrubber.dto;

public record ScrubTextRequest(String content, String actor, String sessionId, String tier, boolean receiptless) {
}
