package com.jreinhal.scrubber.model;

import java.util.List;

/**
 * Input to one scrub operation.
 *
 * @param receiptless skip receipt creation; honoured only when the deployment allows it
 */
public record ScrubRequest(
        List<ContentUnit> units,
        String actor,
        String sessionId,
        SensitivityTier requestedTier,
        boolean receiptless
) {

    public static ScrubRequest text(String content, String actor, String sessionId, SensitivityTier requestedTier) {
        return new ScrubRequest(content == null ? null : List.of(ContentUnit.flat(content)), actor, sessionId, requestedTier, false);
    }

    public static ScrubRequest cells(List<ContentUnit> cells, String actor, String sessionId, SensitivityTier requestedTier) {
        return new ScrubRequest(cells, actor, sessionId, requestedTier, false);
    }

    public ScrubRequest withoutReceipt() {
        return new ScrubRequest(units, actor, sessionId, requestedTier, true);
    }
}
