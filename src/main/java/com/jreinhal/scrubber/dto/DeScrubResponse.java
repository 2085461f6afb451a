package com.jreinhal.scrubber.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jreinhal.scrubber.model.ContentUnit;
import com.jreinhal.scrubber.model.DeScrubResult;
import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeScrubResponse(
        String operationId,
        String outcome,
        String restoredContent,
        List<CellDto> cells,
        List<String> restoredIdentifiers,
        String requiredTier,
        String reason,
        long auditSequence
) {

    public static DeScrubResponse from(DeScrubResult result) {
        String content = null;
        List<CellDto> cells = null;
        if (result.isGranted()) {
            List<ContentUnit> units = result.restoredUnits();
            if (units.size() == 1 && !units.get(0).isStructural()) {
                content = units.get(0).text();
            } else {
                cells = new ArrayList<CellDto>();
                for (ContentUnit unit : units) {
                    cells.add(new CellDto(unit.coordinate(), unit.text()));
                }
            }
        }
        return new DeScrubResponse(result.operationId(), result.outcome().name(), content, cells, result.restoredIdentifiers(),
                result.requiredTier() == null ? null : result.requiredTier().name(), result.reason(), result.auditSequence());
    }
}
