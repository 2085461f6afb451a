package com.jreinhal.scrubber.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.scrubber.exception.EncryptionUnavailableException;
import com.jreinhal.scrubber.exception.ReceiptNotFoundException;
import com.jreinhal.scrubber.exception.ValidationException;
import com.jreinhal.scrubber.model.AuditEntry;
import com.jreinhal.scrubber.model.ContentUnit;
import com.jreinhal.scrubber.model.DeScrubRequest;
import com.jreinhal.scrubber.model.DeScrubResult;
import com.jreinhal.scrubber.model.ScrubRequest;
import com.jreinhal.scrubber.model.ScrubResult;
import com.jreinhal.scrubber.model.ScrubbedEntity;
import com.jreinhal.scrubber.model.SensitivityTier;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DeScrubServiceTest {
    private static final String IBAN_TEXT = "IBAN BE71 0961 2345 6769";

    private ScrubberTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new ScrubberTestFixture();
    }

    @Test
    @DisplayName("Full de-scrub with C4 clearance returns the original text and is audited as granted")
    void grantedRestoresOriginal() {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));

        DeScrubResult result = fixture.deScrubService.descrub(
                DeScrubRequest.full(scrubbed.operation().operationId(), "carol", "auditor", SensitivityTier.C4, "customer request"));

        assertTrue(result.isGranted());
        assertEquals(IBAN_TEXT, result.restoredContent());
        assertEquals(2L, fixture.ledgerRepository.count());
        AuditEntry audit = fixture.ledgerRepository.get(2);
        assertEquals(AuditEntry.EventType.DESCRUB, audit.getEventType());
        assertEquals(AuditEntry.Outcome.GRANTED, audit.getOutcome());
        assertEquals("customer request", audit.getJustification());
        assertEquals(2L, result.auditSequence());
    }

    @Test
    @DisplayName("Clearance C2 is denied: no content, one denied audit entry")
    void deniedBelowRequiredTier() {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));

        DeScrubResult result = fixture.deScrubService.descrub(
                DeScrubRequest.full(scrubbed.operation().operationId(), "carol", "auditor", SensitivityTier.C2, "customer request"));

        assertFalse(result.isGranted());
        assertNull(result.restoredContent());
        assertTrue(result.restoredUnits().isEmpty());
        assertEquals(SensitivityTier.C4, result.requiredTier());
        assertEquals(2L, fixture.ledgerRepository.count());
        assertEquals(AuditEntry.Outcome.DENIED, fixture.ledgerRepository.get(2).getOutcome());
    }

    @ParameterizedTest
    @ValueSource(strings = {"analyst", "", "ADMINISTRATOR"})
    void deniedForRolesOutsideAllowList(String role) {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));

        DeScrubResult result = fixture.deScrubService.descrub(
                DeScrubRequest.full(scrubbed.operation().operationId(), "carol", role, SensitivityTier.C4, "customer request"));

        assertEquals(AuditEntry.Outcome.DENIED, result.outcome());
        assertEquals(AuditEntry.Outcome.DENIED, fixture.ledgerRepository.get(2).getOutcome());
    }

    @Test
    void roleMatchIsCaseInsensitive() {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));

        DeScrubResult result = fixture.deScrubService.descrub(
                DeScrubRequest.full(scrubbed.operation().operationId(), "carol", "Admin", SensitivityTier.C4, "customer request"));

        assertTrue(result.isGranted());
    }

    @Test
    @DisplayName("Partial selection restores only the chosen identifiers")
    void partialSelection() {
        String text = "alice@example.com and BE71 0961 2345 6769";
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(text, "alice", null, SensitivityTier.C2));
        String ibanId = scrubbed.operation().entities().stream()
                .filter(e -> e.label().equals("IBAN")).map(ScrubbedEntity::identifier).findFirst().orElseThrow();

        DeScrubResult result = fixture.deScrubService.descrub(new DeScrubRequest(scrubbed.operation().operationId(), "carol", null,
                "admin", SensitivityTier.C4, "dispute", Set.of(ibanId)));

        assertEquals("*****@*******.*** and BE71 0961 2345 6769", result.restoredContent());
        assertEquals(List.of(ibanId), result.restoredIdentifiers());
    }

    @Test
    @DisplayName("Selecting only a C2 value needs only C2 clearance")
    void requiredTierFollowsSelection() {
        String text = "alice@example.com and BE71 0961 2345 6769";
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(text, "alice", null, SensitivityTier.C2));
        String emailId = scrubbed.operation().entities().get(0).identifier();

        DeScrubResult result = fixture.deScrubService.descrub(new DeScrubRequest(scrubbed.operation().operationId(), "carol", null,
                "admin", SensitivityTier.C2, "typo check", Set.of(emailId)));

        assertTrue(result.isGranted());
        assertEquals(SensitivityTier.C2, result.requiredTier());
        assertThat(result.restoredContent()).startsWith("alice@example.com and C4::IBAN::");
    }

    @Test
    void roundTripOverCells() {
        List<ContentUnit> cells = List.of(
                new ContentUnit("Sheet1!A1", "DOB: 1985-07-30"),
                new ContentUnit("Sheet1!B2", "no secrets"),
                new ContentUnit("Sheet1!C3", "SSN 123-45-6789, mail bob@corp.example.org"));
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.cells(cells, "alice", null, SensitivityTier.C4));

        DeScrubResult result = fixture.deScrubService.descrub(
                DeScrubRequest.full(scrubbed.operation().operationId(), "carol", "admin", SensitivityTier.C4, "migration"));

        assertEquals(cells, result.restoredUnits());
    }

    @Test
    void roundTripWithoutEntities() {
        String text = "Nothing sensitive here.";
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(text, "alice", null, SensitivityTier.C1));

        DeScrubResult result = fixture.deScrubService.descrub(
                DeScrubRequest.full(scrubbed.operation().operationId(), "carol", "admin", SensitivityTier.C1, "check"));

        assertEquals(text, result.restoredContent());
    }

    @Test
    void blankJustificationIsRejectedWithoutAudit() {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));

        assertThrows(ValidationException.class, () -> fixture.deScrubService.descrub(
                DeScrubRequest.full(scrubbed.operation().operationId(), "carol", "admin", SensitivityTier.C4, "  ")));
        assertEquals(1L, fixture.ledgerRepository.count());
    }

    @Test
    void unknownIdentifierIsRejected() {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));

        assertThrows(ValidationException.class, () -> fixture.deScrubService.descrub(new DeScrubRequest(
                scrubbed.operation().operationId(), "carol", null, "admin", SensitivityTier.C4, "why", Set.of("C4::IBAN::0000000000"))));
        assertEquals(1L, fixture.ledgerRepository.count());
    }

    @Test
    void missingReceiptIsNotFound() {
        assertThrows(ReceiptNotFoundException.class, () -> fixture.deScrubService.descrub(
                DeScrubRequest.full("no-such-operation", "carol", "admin", SensitivityTier.C4, "why")));
    }

    @Test
    void invalidatedReceiptIsNotRedeemable() {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));
        fixture.receiptStore.invalidate(scrubbed.operation().operationId(), "test");

        assertEquals("test", fixture.receiptRepository.findById(scrubbed.operation().operationId()).orElseThrow().getStatusReason());
        assertThrows(ReceiptNotFoundException.class, () -> fixture.deScrubService.descrub(
                DeScrubRequest.full(scrubbed.operation().operationId(), "carol", "admin", SensitivityTier.C4, "why")));
    }

    @Test
    @DisplayName("Granted de-scrub does not modify the stored receipt")
    void receiptIsUntouched() {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));
        String operationId = scrubbed.operation().operationId();

        fixture.deScrubService.descrub(DeScrubRequest.full(operationId, "carol", "admin", SensitivityTier.C4, "why"));

        assertEquals(scrubbed.redactedContent(),
                fixture.receiptRepository.findById(operationId).orElseThrow().getRedactedUnits().get(0).text());
        assertTrue(fixture.receiptStore.findRedeemable(operationId).isPresent());
    }

    @Test
    @DisplayName("De-scrub entries carry the content hashes of the scrub they reverse")
    void descrubEntryCarriesScrubHashes() {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));
        String operationId = scrubbed.operation().operationId();

        fixture.deScrubService.descrub(DeScrubRequest.full(operationId, "carol", "admin", SensitivityTier.C4, "why"));
        fixture.deScrubService.descrub(DeScrubRequest.full(operationId, "carol", "admin", SensitivityTier.C1, "why"));

        AuditEntry scrub = fixture.ledgerRepository.get(1);
        for (int sequence = 2; sequence <= 3; sequence++) {
            AuditEntry descrub = fixture.ledgerRepository.get(sequence);
            assertEquals(scrubbed.operation().originalHash(), descrub.getOriginalHash());
            assertEquals(scrub.getOriginalHash(), descrub.getOriginalHash());
            assertEquals(scrub.getScrubbedHash(), descrub.getScrubbedHash());
        }
        assertEquals(AuditEntry.Outcome.DENIED, fixture.ledgerRepository.get(3).getOutcome());
    }

    @Test
    @DisplayName("A granted de-scrub that cannot decrypt is audited as failed before the error surfaces")
    void decryptionFailureIsAudited() {
        ScrubResult scrubbed = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));
        ReceiptStore keyless = new ReceiptStore(fixture.receiptRepository,
                new ReceiptCipher(ScrubberSecrets.withoutKey(ScrubberTestFixture.SALT, "key rotated out")));
        DeScrubService service = new DeScrubService(keyless, fixture.auditLedger, "admin,auditor");

        assertThrows(EncryptionUnavailableException.class, () -> service.descrub(
                DeScrubRequest.full(scrubbed.operation().operationId(), "carol", "admin", SensitivityTier.C4, "why")));

        assertEquals(2L, fixture.ledgerRepository.count());
        AuditEntry failed = fixture.ledgerRepository.get(2);
        assertEquals(AuditEntry.EventType.DESCRUB, failed.getEventType());
        assertEquals(AuditEntry.Outcome.FAILED, failed.getOutcome());
        assertEquals("receipt could not be decrypted", failed.getOutcomeReason());
        assertEquals("carol", failed.getActor());
        assertTrue(fixture.auditLedger.verify().valid());
    }
}
