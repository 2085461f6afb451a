package com.jreinhal.scrubber.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.scrubber.exception.ChainIntegrityException;
import com.jreinhal.scrubber.exception.EncryptionUnavailableException;
import com.jreinhal.scrubber.exception.PolicyConfigException;
import com.jreinhal.scrubber.exception.ScrubFailedException;
import com.jreinhal.scrubber.exception.ValidationException;
import com.jreinhal.scrubber.fusion.NoOpRecognitionModel;
import com.jreinhal.scrubber.fusion.RecognitionCircuitBreaker;
import com.jreinhal.scrubber.fusion.RecognitionGateway;
import com.jreinhal.scrubber.fusion.RecognitionModel;
import com.jreinhal.scrubber.model.AuditEntry;
import com.jreinhal.scrubber.model.ContentUnit;
import com.jreinhal.scrubber.model.ExternalCandidate;
import com.jreinhal.scrubber.model.ExternalModelStatus;
import com.jreinhal.scrubber.model.PolicyAction;
import com.jreinhal.scrubber.model.Receipt;
import com.jreinhal.scrubber.model.ReceiptMode;
import com.jreinhal.scrubber.model.ScrubRequest;
import com.jreinhal.scrubber.model.ScrubResult;
import com.jreinhal.scrubber.model.ScrubbedEntity;
import com.jreinhal.scrubber.model.SensitivityTier;
import com.jreinhal.scrubber.model.Span;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ScrubOrchestratorTest {
    private static final String IBAN_TEXT = "IBAN BE71 0961 2345 6769";

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("IBAN at requested tier C3 is redacted with a C4 identifier")
    void redactsIbanWithIdentifier() {
        ScrubberTestFixture fixture = new ScrubberTestFixture();

        ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", "s-1", SensitivityTier.C3));

        assertThat(result.redactedContent()).matches("IBAN C4::IBAN::[0-9a-f]{10}");
        List<ScrubbedEntity> entities = result.operation().entities();
        assertEquals(1, entities.size());
        ScrubbedEntity iban = entities.get(0);
        assertEquals("IBAN_basic", iban.ruleId());
        assertEquals(0.95, iban.confidence(), 1e-9);
        assertEquals(SensitivityTier.C4, iban.tier());
        assertEquals(PolicyAction.REDACT, iban.action());
        assertEquals(new Span(5, 24), iban.span());
        assertTrue(iban.validated());
        assertEquals(ExternalModelStatus.DISABLED, result.operation().externalModelStatus());
        assertEquals(ReceiptMode.ENCRYPTED, result.operation().receiptMode());
        assertEquals(1L, result.operation().auditSequence());
    }

    @Test
    @DisplayName("Empty input yields no entities, equal hashes and one empty audit entry")
    void emptyInput() {
        ScrubberTestFixture fixture = new ScrubberTestFixture();

        ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.text("", "alice", null, SensitivityTier.C2));

        assertEquals("", result.redactedContent());
        assertTrue(result.operation().entities().isEmpty());
        assertEquals(result.operation().originalHash(), result.operation().scrubbedHash());
        assertEquals(1L, fixture.ledgerRepository.count());
        AuditEntry entry = fixture.ledgerRepository.get(1);
        assertTrue(entry.getEntities().isEmpty());
        assertTrue(entry.getActions().isEmpty());
        assertEquals(AuditEntry.Outcome.SUCCESS, entry.getOutcome());
    }

    @Test
    @DisplayName("Mask keeps separators, redact substitutes identifiers, text outside spans is untouched")
    void mixedActions() {
        ScrubberTestFixture fixture = new ScrubberTestFixture();
        String text = "Mail alice@example.com, call 555-123-4567, card 4111 1111 1111 1111.";

        ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.text(text, "alice", null, SensitivityTier.C2));

        String out = result.redactedContent();
        assertThat(out).startsWith("Mail *****@*******.***, call ***-***-****, card C4::PAN::");
        assertThat(out).endsWith(".");
        assertThat(out).doesNotContain("alice@example.com", "4111");
        assertThat(result.operation().entities()).extracting(ScrubbedEntity::label).containsExactly("EMAIL", "PHONE", "PAN");
    }

    @Test
    @DisplayName("Checksum-invalid card number is not reported as a PAN")
    void checksumRejection() {
        ScrubberTestFixture fixture = new ScrubberTestFixture();

        ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.text("card 4111 1111 1111 1112", "alice", null, SensitivityTier.C4));

        assertThat(result.operation().entities()).noneMatch(e -> e.label().equals("PAN"));
        assertEquals("card 4111 1111 1111 1112", result.redactedContent());
    }

    @Test
    @DisplayName("Receipt stores ciphertext, never the raw value")
    void receiptHoldsCiphertextOnly() {
        ScrubberTestFixture fixture = new ScrubberTestFixture();

        ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3));

        Receipt receipt = fixture.receiptRepository.findById(result.operation().operationId()).orElseThrow();
        assertEquals(1, receipt.getEntries().size());
        Receipt.Entry entry = receipt.getEntries().get(0);
        assertFalse(entry.ciphertext().contains("BE71"));
        assertEquals(result.operation().entities().get(0).identifier(), entry.placeholder());
        assertEquals(5, entry.outputStart());
        assertEquals(result.redactedContent(), receipt.getRedactedUnits().get(0).text());
    }

    @Test
    @DisplayName("Identical values get identical identifiers across operations")
    void identifiersLinkAcrossOperations() {
        ScrubberTestFixture fixture = new ScrubberTestFixture();

        String first = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3)).redactedContent();
        String second = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "bob", null, SensitivityTier.C3)).redactedContent();

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Cells are scrubbed independently and keep their coordinates")
    void structuralPayload() {
        ScrubberTestFixture fixture = new ScrubberTestFixture();
        List<ContentUnit> cells = List.of(new ContentUnit("Sheet1!A1", "name"), new ContentUnit("Sheet1!B7", "bob@corp.example.org"));

        ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.cells(cells, "alice", null, SensitivityTier.C2));

        assertEquals("name", result.redactedUnits().get(0).text());
        assertEquals("Sheet1!B7", result.redactedUnits().get(1).coordinate());
        assertEquals("***@****.*******.***", result.redactedUnits().get(1).text());
        assertEquals("Sheet1!B7", result.operation().entities().get(0).coordinate());
        assertThrows(IllegalStateException.class, result::redactedContent);
    }

    @Nested
    class Validation {

        @Test
        void rejectsNullContent() {
            ScrubberTestFixture fixture = new ScrubberTestFixture();
            assertThrows(ValidationException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.text(null, "alice", null, SensitivityTier.C2)));
            assertEquals(0L, fixture.ledgerRepository.count());
        }

        @Test
        void rejectsBlankActor() {
            ScrubberTestFixture fixture = new ScrubberTestFixture();
            assertThrows(ValidationException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.text("x", " ", null, SensitivityTier.C2)));
        }

        @Test
        void rejectsMissingTier() {
            ScrubberTestFixture fixture = new ScrubberTestFixture();
            assertThrows(ValidationException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.text("x", "alice", null, null)));
        }

        @Test
        void rejectsOversizedContent() {
            ScrubberTestFixture fixture = new ScrubberTestFixture();
            String huge = "a".repeat(10_001);
            assertThrows(ValidationException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.text(huge, "alice", null, SensitivityTier.C2)));
        }

        @Test
        void rejectsDuplicateCoordinates() {
            ScrubberTestFixture fixture = new ScrubberTestFixture();
            List<ContentUnit> cells = List.of(new ContentUnit("A1", "x"), new ContentUnit("A1", "y"));
            assertThrows(ValidationException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.cells(cells, "alice", null, SensitivityTier.C2)));
        }

        @Test
        void rejectsReceiptlessWhenNotAllowed() {
            ScrubberTestFixture fixture = new ScrubberTestFixture();
            assertThrows(ValidationException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.text("x", "alice", null, SensitivityTier.C2).withoutReceipt()));
        }
    }

    @Nested
    class Failures {

        @Test
        @DisplayName("Missing manifest for the requested tier aborts with no side effects")
        void requestedTierManifestMissing() {
            ScrubberTestFixture fixture = new ScrubberTestFixture(ScrubberSecrets.of(ScrubberTestFixture.SALT, ScrubberTestFixture.KEY),
                    RecognitionGateway.disabled(), "classpath:policy/missing.yml");

            assertThrows(PolicyConfigException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3)));
            assertEquals(0L, fixture.ledgerRepository.count());
            assertEquals(0, fixture.receiptRepository.size());
        }

        @Test
        @DisplayName("Missing manifest at an entity's tier redacts instead of masking")
        void entityTierManifestMissingFailsClosed() {
            ScrubberTestFixture fixture = new ScrubberTestFixture(ScrubberSecrets.of(ScrubberTestFixture.SALT, ScrubberTestFixture.KEY),
                    RecognitionGateway.disabled(), "classpath:policy/missing.yml");

            ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.text("DOB: 1985-07-30", "alice", null, SensitivityTier.C4));

            assertThat(result.redactedContent()).matches("DOB: C3::DATE_OF_BIRTH::[0-9a-f]{10}");
        }

        @Test
        @DisplayName("Unavailable receipt key aborts before any audit entry")
        void encryptionUnavailable() {
            ScrubberTestFixture fixture = new ScrubberTestFixture(ScrubberSecrets.withoutKey(ScrubberTestFixture.SALT, "no key"),
                    RecognitionGateway.disabled(), "classpath:policy/c3.yml");

            assertThrows(EncryptionUnavailableException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3)));
            assertEquals(0L, fixture.ledgerRepository.count());
        }

        @Test
        @DisplayName("Receipt-less mode works without a key and is recorded in the audit entry")
        void receiptlessMode() {
            ScrubberTestFixture fixture = new ScrubberTestFixture(ScrubberSecrets.withoutKey(ScrubberTestFixture.SALT, "no key"),
                    RecognitionGateway.disabled(), "classpath:policy/c3.yml");
            fixture.allowReceiptless();

            ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3).withoutReceipt());

            assertEquals(ReceiptMode.NONE, result.operation().receiptMode());
            assertEquals(0, fixture.receiptRepository.size());
            assertEquals(ReceiptMode.NONE, fixture.ledgerRepository.get(1).getReceiptMode());
        }

        @Test
        @DisplayName("Failed audit append invalidates the receipt")
        void auditFailureInvalidatesReceipt() {
            ScrubberTestFixture fixture = new ScrubberTestFixture();
            fixture.ledgerRepository.failNextAppend(new IllegalStateException("disk full"));

            assertThrows(ScrubFailedException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3)));

            assertEquals(1, fixture.receiptRepository.size());
            Receipt orphan = fixture.receiptRepository.all().get(0);
            assertEquals(Receipt.Status.INVALID, orphan.getStatus());
            assertThat(fixture.receiptStore.findRedeemable(orphan.getOperationId())).isEmpty();
            assertEquals(0L, fixture.ledgerRepository.count());
        }

        @Test
        @DisplayName("Integrity hold refuses the scrub and invalidates its receipt")
        void integrityHold() {
            ScrubberTestFixture fixture = new ScrubberTestFixture();
            fixture.orchestrator.scrub(ScrubRequest.text("a", "alice", null, SensitivityTier.C2));
            AuditEntry first = fixture.ledgerRepository.get(1);
            fixture.ledgerRepository.overwrite(1, first.withJustification("edited"));
            assertFalse(fixture.auditLedger.verify().valid());

            assertThrows(ChainIntegrityException.class,
                    () -> fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3)));
            assertEquals(1L, fixture.ledgerRepository.count());
            assertThat(fixture.receiptRepository.all()).filteredOn(r -> r.getEntries().size() == 1).hasSize(1)
                    .allMatch(r -> r.getStatus() == Receipt.Status.INVALID);
        }

        @Test
        @DisplayName("Interrupted caller leaves no receipt and no audit entry")
        void cancellationLeavesNoTrace() {
            ScrubberTestFixture fixture = new ScrubberTestFixture();
            Thread.currentThread().interrupt();
            try {
                assertThrows(CancellationException.class,
                        () -> fixture.orchestrator.scrub(ScrubRequest.text(IBAN_TEXT, "alice", null, SensitivityTier.C3)));
            } finally {
                Thread.interrupted();
            }
            assertEquals(0L, fixture.ledgerRepository.count());
            assertEquals(0, fixture.receiptRepository.size());
        }
    }

    @Nested
    class ExternalModel {

        @Test
        @DisplayName("A failing model yields output identical to the rule-only baseline")
        void failOpen() {
            String text = "Mail alice@example.com about IBAN BE71 0961 2345 6769";
            ScrubResult baseline = new ScrubberTestFixture().orchestrator.scrub(ScrubRequest.text(text, "alice", null, SensitivityTier.C2));

            RecognitionModel broken = new FixedModel(null);
            ScrubberTestFixture fixture = new ScrubberTestFixture(ScrubberSecrets.of(ScrubberTestFixture.SALT, ScrubberTestFixture.KEY),
                    gateway(broken), "classpath:policy/c3.yml");
            ScrubResult degraded = fixture.orchestrator.scrub(ScrubRequest.text(text, "alice", null, SensitivityTier.C2));

            assertEquals(baseline.redactedContent(), degraded.redactedContent());
            assertThat(degraded.operation().entities()).extracting(ScrubbedEntity::confidence)
                    .containsExactlyElementsOf(baseline.operation().entities().stream().map(ScrubbedEntity::confidence).toList());
            assertEquals(ExternalModelStatus.DEGRADED, degraded.operation().externalModelStatus());
            assertTrue(fixture.ledgerRepository.get(1).isDetectionDegraded());
        }

        @Test
        @DisplayName("An overlapping external score raises confidence in max mode")
        void contributes() {
            String text = "Mail alice@example.com";
            RecognitionModel model = new FixedModel(List.of(new ExternalCandidate("PER", new Span(5, 10), 0.97)));
            ScrubberTestFixture fixture = new ScrubberTestFixture(ScrubberSecrets.of(ScrubberTestFixture.SALT, ScrubberTestFixture.KEY),
                    gateway(model), "classpath:policy/c3.yml");

            ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.text(text, "alice", null, SensitivityTier.C2));

            ScrubbedEntity email = result.operation().entities().get(0);
            assertEquals(0.97, email.confidence(), 1e-9);
            assertEquals(0.97, email.externalScore(), 1e-9);
            assertEquals(ExternalModelStatus.CONTRIBUTED, result.operation().externalModelStatus());
        }

        @Test
        @DisplayName("A no-op model leaves the operation marked DISABLED")
        void noOpModelIsDisabled() {
            ScrubberTestFixture fixture = new ScrubberTestFixture(ScrubberSecrets.of(ScrubberTestFixture.SALT, ScrubberTestFixture.KEY),
                    gateway(NoOpRecognitionModel.INSTANCE), "classpath:policy/c3.yml");

            ScrubResult result = fixture.orchestrator.scrub(ScrubRequest.cells(List.of(
                    new ContentUnit("A1", "alice@example.com"), new ContentUnit("A2", "plain")), "alice", null, SensitivityTier.C2));

            assertEquals(ExternalModelStatus.DISABLED, result.operation().externalModelStatus());
            assertFalse(fixture.ledgerRepository.get(1).isDetectionDegraded());
        }

        @Test
        @DisplayName("The requested clearance picks the external-only threshold")
        void externalOnlyThresholdFollowsClearance() {
            String text = "Hello Jan Peeters";
            RecognitionModel model = new FixedModel(List.of(new ExternalCandidate("PERSON", new Span(6, 17), 0.78)));
            ScrubberTestFixture fixture = new ScrubberTestFixture(ScrubberSecrets.of(ScrubberTestFixture.SALT, ScrubberTestFixture.KEY),
                    gateway(model), "classpath:policy/c3.yml", true);

            ScrubResult low = fixture.orchestrator.scrub(ScrubRequest.text(text, "alice", null, SensitivityTier.C1));
            ScrubResult high = fixture.orchestrator.scrub(ScrubRequest.text(text, "alice", null, SensitivityTier.C3));

            assertTrue(low.operation().entities().isEmpty());
            assertEquals(text, low.redactedContent());
            assertThat(high.operation().entities()).extracting(ScrubbedEntity::label).containsExactly("NAME");
            assertEquals(0.78, high.operation().entities().get(0).externalScore(), 1e-9);
            assertEquals(ExternalModelStatus.CONTRIBUTED, high.operation().externalModelStatus());
        }

        private RecognitionGateway gateway(RecognitionModel model) {
            return new RecognitionGateway(model, executor, 1000L, new RecognitionCircuitBreaker(3, Duration.ofSeconds(30)));
        }
    }

    private static final class FixedModel implements RecognitionModel {
        private final List<ExternalCandidate> candidates;

        FixedModel(List<ExternalCandidate> candidates) {
            this.candidates = candidates;
        }

        @Override
        public String name() {
            return "fixed";
        }

        @Override
        public List<ExternalCandidate> recognize(String content) {
            if (candidates == null) {
                throw new IllegalStateException("model offline");
            }
            return candidates;
        }
    }
}
