package com.jreinhal.scrubber.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.scrubber.dto.DeScrubRequestDto;
import com.jreinhal.scrubber.dto.DeScrubResponse;
import com.jreinhal.scrubber.exception.ValidationException;
import com.jreinhal.scrubber.model.AuditEntry;
import com.jreinhal.scrubber.model.ContentUnit;
import com.jreinhal.scrubber.model.DeScrubRequest;
import com.jreinhal.scrubber.model.DeScrubResult;
import com.jreinhal.scrubber.model.SensitivityTier;
import com.jreinhal.scrubber.service.DeScrubService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class DeScrubControllerTest {

    @Test
    void grantedReturnsContent() {
        DeScrubService service = mock(DeScrubService.class);
        when(service.descrub(any(DeScrubRequest.class))).thenReturn(new DeScrubResult("op-1", AuditEntry.Outcome.GRANTED,
                List.of(ContentUnit.flat("IBAN BE71 0961 2345 6769")), List.of("C4::IBAN::d5dac3758a"), SensitivityTier.C4, null, 9L));
        DeScrubController controller = new DeScrubController(service);

        ResponseEntity<DeScrubResponse> response = controller.descrub(new DeScrubRequestDto("op-1", "auditor-1", null, "auditor", "C4",
                "case 2026-114", List.of("C4::IBAN::d5dac3758a")));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        DeScrubResponse body = response.getBody();
        assertNotNull(body);
        assertEquals("IBAN BE71 0961 2345 6769", body.restoredContent());
        assertEquals("GRANTED", body.outcome());

        ArgumentCaptor<DeScrubRequest> captor = ArgumentCaptor.forClass(DeScrubRequest.class);
        verify(service).descrub(captor.capture());
        assertEquals(SensitivityTier.C4, captor.getValue().clearance());
        assertTrue(captor.getValue().identifiers().contains("C4::IBAN::d5dac3758a"));
    }

    @Test
    void deniedReturns403WithoutContent() {
        DeScrubService service = mock(DeScrubService.class);
        when(service.descrub(any(DeScrubRequest.class))).thenReturn(new DeScrubResult("op-1", AuditEntry.Outcome.DENIED,
                null, null, SensitivityTier.C4, "clearance C2 below required C4", 10L));
        DeScrubController controller = new DeScrubController(service);

        ResponseEntity<DeScrubResponse> response = controller.descrub(new DeScrubRequestDto("op-1", "auditor-1", null, "auditor", "C2",
                "case 2026-114", null));

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        DeScrubResponse body = response.getBody();
        assertNotNull(body);
        assertNull(body.restoredContent());
        assertNull(body.cells());
        assertEquals("C4", body.requiredTier());
        assertEquals(10L, body.auditSequence());
    }

    @Test
    void clearanceIsRequired() {
        DeScrubService service = mock(DeScrubService.class);
        DeScrubController controller = new DeScrubController(service);

        assertThrows(ValidationException.class, () -> controller.descrub(new DeScrubRequestDto("op-1", "auditor-1", null, "auditor", null,
                "case 2026-114", null)));
        verify(service, never()).descrub(any());
    }
}
