package com.jreinhal.scrubber.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jreinhal.scrubber.model.ContentUnit;
import com.jreinhal.scrubber.model.ScrubOperation;
import com.jreinhal.scrubber.model.ScrubResult;
import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScrubResponse(
        String operationId,
        String timestamp,
        String redactedContent,
        List<CellDto> cells,
        List<EntityView> entities,
        String requestedTier,
        String manifestVersion,
        String externalModelStatus,
        String receiptMode,
        String originalHash,
        String scrubbedHash,
        long auditSequence
) {

    public static ScrubResponse from(ScrubResult result, boolean structural) {
        ScrubOperation op = result.operation();
        List<EntityView> entities = new ArrayList<EntityView>();
        op.entities().forEach(e -> entities.add(EntityView.from(e)));
        List<CellDto> cells = null;
        String content = null;
        if (structural) {
            cells = new ArrayList<CellDto>();
            for (ContentUnit unit : result.redactedUnits()) {
                cells.add(new CellDto(unit.coordinate(), unit.text()));
            }
        } else {
            content = result.redactedContent();
        }
        return new ScrubResponse(op.operationId(), op.timestamp().toString(), content, cells, entities, op.requestedTier().name(),
                op.manifestVersion(), op.externalModelStatus().name(), op.receiptMode().name(), op.originalHash(), op.scrubbedHash(),
                op.auditSequence());
    }
}
