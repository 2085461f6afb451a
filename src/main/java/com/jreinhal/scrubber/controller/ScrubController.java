package com.jreinhal.scrubber.controller;

import com.jreinhal.scrubber.dto.CellDto;
import com.jreinhal.scrubber.dto.ScrubCellsRequest;
import com.jreinhal.scrubber.dto.ScrubResponse;
import com.jreinhal.scrubber.dto.ScrubTextRequest;
import com.jreinhal.scrubber.exception.ValidationException;
import com.jreinhal.scrubber.model.ContentUnit;
import com.jreinhal.scrubber.model.ScrubRequest;
import com.jreinhal.scrubber.model.ScrubResult;
import com.jreinhal.scrubber.service.ScrubOrchestrator;
import java.util.ArrayList;
import java.util.List;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/scrub"})
public class ScrubController {
    private final ScrubOrchestrator orchestrator;

    public ScrubController(ScrubOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ScrubResponse scrubText(@RequestBody ScrubTextRequest body) {
        if (body == null) {
            throw new ValidationException("Request body is required");
        }
        ScrubRequest request = new ScrubRequest(body.content() == null ? null : List.of(ContentUnit.flat(body.content())),
                body.actor(), body.sessionId(), Tiers.parse(body.tier(), "tier"), body.receiptless());
        ScrubResult result = this.orchestrator.scrub(request);
        return ScrubResponse.from(result, false);
    }

    @PostMapping(value={"/cells"})
    public ScrubResponse scrubCells(@RequestBody ScrubCellsRequest body) {
        if (body == null) {
            throw new ValidationException("Request body is required");
        }
        List<ContentUnit> units = null;
        if (body.cells() != null) {
            units = new ArrayList<ContentUnit>();
            for (CellDto cell : body.cells()) {
                if (cell == null || cell.coordinate() == null || cell.coordinate().isBlank()) {
                    throw new ValidationException("Every cell needs a coordinate");
                }
                units.add(new ContentUnit(cell.coordinate(), cell.text()));
            }
        }
        ScrubRequest request = new ScrubRequest(units, body.actor(), body.sessionId(), Tiers.parse(body.tier(), "tier"), body.receiptless());
        return ScrubResponse.from(this.orchestrator.scrub(request), true);
    }
}
