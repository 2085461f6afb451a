package com.jreinhal.scrubber.controller;

import com.jreinhal.scrubber.dto.AuditEntryView;
import com.jreinhal.scrubber.model.AuditEntry;
import com.jreinhal.scrubber.service.AuditLedger;
import com.jreinhal.scrubber.util.LogSanitizer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/audit"})
public class AuditController {
    private static final Logger log = LoggerFactory.getLogger(AuditController.class);
    private final AuditLedger auditLedger;

    public AuditController(AuditLedger auditLedger) {
        this.auditLedger = auditLedger;
    }

    @GetMapping(value={"/verify"})
    public AuditLedger.VerificationReport verify() {
        return this.auditLedger.verify();
    }

    @GetMapping(value={"/tail"})
    public Map<String, Object> tail(@RequestParam(value="limit", defaultValue="50") int limit) {
        List<AuditEntryView> entries = toViews(this.auditLedger.tail(limit));
        HashMap<String, Object> response = new HashMap<String, Object>();
        response.put("count", entries.size());
        response.put("entries", entries);
        response.put("integrityHold", this.auditLedger.isOnIntegrityHold());
        return response;
    }

    @GetMapping(value={"/operations/{operationId}"})
    public Map<String, Object> operation(@PathVariable(value="operationId") String operationId) {
        List<AuditEntryView> entries = toViews(this.auditLedger.findByOperation(operationId));
        return Map.of("operationId", operationId, "count", entries.size(), "entries", entries);
    }

    @GetMapping(value={"/stats"})
    public AuditLedger.Statistics stats() {
        return this.auditLedger.statistics();
    }

    @PostMapping(value={"/integrity-hold/clear"})
    public AuditLedger.VerificationReport clearHold(@RequestParam(value="operator") String operator) {
        log.warn("Integrity hold clear requested by {}", LogSanitizer.sanitize(operator));
        return this.auditLedger.clearIntegrityHold(LogSanitizer.sanitize(operator));
    }

    private static List<AuditEntryView> toViews(List<AuditEntry> entries) {
        return entries.stream().map(AuditEntryView::from).collect(Collectors.toList());
    }
}
