package com.jreinhal.scrubber.detection;

import com.jreinhal.scrubber.detection.PatternDetector.InvalidMatchPolicy;
import com.jreinhal.scrubber.model.SensitivityTier;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Detector families shipped with the service. Adding a label means adding one entry here
 * or one rule to a rule manifest.
 */
public final class BuiltInDetectors {
    static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    static final Pattern PHONE = Pattern.compile("(?<![A-Za-z0-9+])(?:\\+\\d{1,3}[\\s.-]?)?(?:\\(\\d{3}\\)|\\d{3})[\\s.-]?\\d{3}[\\s.-]?\\d{4}\\b");
    static final Pattern IPV4 = Pattern.compile("\\b(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\b");
    static final Pattern DOB_CONTEXT = Pattern.compile("(?:DOB|D\\.O\\.B\\.|Date of Birth|Birth Date|Born)\\s*:?\\s*(\\d{4}[/-]\\d{1,2}[/-]\\d{1,2}|\\d{1,2}[/-]\\d{1,2}[/-]\\d{4})", Pattern.CASE_INSENSITIVE);
    static final Pattern IBAN = Pattern.compile("\\b[A-Z]{2}\\d{2}(?: ?[A-Z0-9]{4}){2,7}(?: ?[A-Z0-9]{1,3})?\\b");
    static final Pattern PAN = Pattern.compile("\\b(?:\\d[ -]?){12,18}\\d\\b");
    // possessive separators keep this linear on long digit runs
    static final Pattern SSN = Pattern.compile("\\b(?!000|666|9\\d{2})\\d{3}[- ]?+(?!00)\\d{2}[- ]?+(?!0000)\\d{4}\\b");
    static final Pattern BE_NATIONAL_NUMBER = Pattern.compile("\\b\\d{2}\\.\\d{2}\\.\\d{2}-\\d{3}\\.\\d{2}\\b|\\b\\d{11}\\b");
    static final Pattern AUTH_SECRET = Pattern.compile("(?:api[_-]?key|secret|token|password)\\s*[:=]\\s*([A-Za-z0-9_\\-]{16,})", Pattern.CASE_INSENSITIVE);

    private BuiltInDetectors() {
    }

    public static List<PatternDetector> all() {
        return List.of(
                new PatternDetector("EMAIL_basic", "EMAIL", EMAIL, 0, ValidityCheck.NONE, 0.90, SensitivityTier.C2, InvalidMatchPolicy.DROP),
                new PatternDetector("PHONE_basic", "PHONE", PHONE, 0, ValidityCheck.NONE, 0.85, SensitivityTier.C2, InvalidMatchPolicy.DROP),
                new PatternDetector("IPV4_basic", "IP_ADDRESS", IPV4, 0, ValidityCheck.NONE, 0.85, SensitivityTier.C2, InvalidMatchPolicy.DROP),
                new PatternDetector("DOB_context", "DATE_OF_BIRTH", DOB_CONTEXT, 1, ValidityCheck.CALENDAR_DATE, 0.90, SensitivityTier.C3, InvalidMatchPolicy.DEMOTE),
                new PatternDetector("IBAN_basic", "IBAN", IBAN, 0, ValidityCheck.IBAN_MOD97, 0.95, SensitivityTier.C4, InvalidMatchPolicy.DROP),
                new PatternDetector("PAN_basic", "PAN", PAN, 0, ValidityCheck.LUHN, 0.95, SensitivityTier.C4, InvalidMatchPolicy.DROP),
                new PatternDetector("SSN_basic", "SSN", SSN, 0, ValidityCheck.NONE, 0.90, SensitivityTier.C4, InvalidMatchPolicy.DROP),
                new PatternDetector("NID_basic", "NATIONAL_ID", BE_NATIONAL_NUMBER, 0, ValidityCheck.BE_NATIONAL_NUMBER, 0.90, SensitivityTier.C4, InvalidMatchPolicy.DEMOTE),
                new PatternDetector("AUTH_secret", "AUTH_TOKEN", AUTH_SECRET, 1, ValidityCheck.NONE, 0.90, SensitivityTier.C4, InvalidMatchPolicy.DROP));
    }
}
