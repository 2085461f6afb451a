package com.jreinhal.scrubber.dto;

import java.util.List;

public record ScrubCellsRequest(List<CellDto> cells, String actor, String sessionId, String tier, boolean receiptless) {
}
