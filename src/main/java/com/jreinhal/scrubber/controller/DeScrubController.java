package com.jreinhal.scrubber.controller;

import com.jreinhal.scrubber.dto.DeScrubRequestDto;
import com.jreinhal.scrubber.dto.DeScrubResponse;
import com.jreinhal.scrubber.exception.ValidationException;
import com.jreinhal.scrubber.model.DeScrubRequest;
import com.jreinhal.scrubber.model.DeScrubResult;
import com.jreinhal.scrubber.model.SensitivityTier;
import com.jreinhal.scrubber.service.DeScrubService;
import java.util.HashSet;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * A denied reversal is a normal, audited outcome and is answered with 403 plus the decision body.
 */
@RestController
@RequestMapping(value={"/api/descrub"})
public class DeScrubController {
    private final DeScrubService deScrubService;

    public DeScrubController(DeScrubService deScrubService) {
        this.deScrubService = deScrubService;
    }

    @PostMapping
    public ResponseEntity<DeScrubResponse> descrub(@RequestBody DeScrubRequestDto body) {
        if (body == null) {
            throw new ValidationException("Request body is required");
        }
        SensitivityTier clearance = Tiers.parse(body.clearance(), "clearance");
        Set<String> identifiers = body.identifiers() == null ? Set.of() : new HashSet<String>(body.identifiers());
        DeScrubResult result = this.deScrubService.descrub(new DeScrubRequest(body.operationId(), body.actor(), body.sessionId(),
                body.role(), clearance, body.justification(), identifiers));
        HttpStatus status = result.isGranted() ? HttpStatus.OK : HttpStatus.FORBIDDEN;
        return ResponseEntity.status(status).body(DeScrubResponse.from(result));
    }
}
