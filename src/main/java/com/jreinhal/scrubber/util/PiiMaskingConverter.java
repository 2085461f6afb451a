package com.jreinhal.scrubber.util;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.regex.Pattern;

/**
 * Last-line masking of sensitive shapes in log output, registered as {@code %maskedMsg}
 * in logback-spring.xml.
 *
 * Identifiers ({@code C4::IBAN::0a1b2c3d4e}) and 64-char hex digests pass through untouched;
 * they are safe to log and needed to correlate log lines with the audit ledger.
 */
public class PiiMaskingConverter extends ClassicConverter {
    private static final Pattern IBAN = Pattern.compile("\\b[A-Z]{2}\\d{2}(?:\\s?[A-Z0-9]{4}){2,7}(?:\\s?[A-Z0-9]{1,4})?\\b");
    private static final Pattern CARD = Pattern.compile("\\b(?:\\d[ -]?){12,18}\\d\\b");
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile("(?<![\\w:])\\+?\\d{1,3}[\\s.-]?\\(?\\d{2,4}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{3,4}\\b");

    @Override
    public String convert(ILoggingEvent event) {
        String msg = event.getFormattedMessage();
        if (msg == null || msg.isEmpty()) {
            return "";
        }
        return mask(msg);
    }

    static String mask(String msg) {
        String masked = IBAN.matcher(msg).replaceAll("[IBAN-MASKED]");
        masked = CARD.matcher(masked).replaceAll("[PAN-MASKED]");
        masked = SSN.matcher(masked).replaceAll("[SSN-MASKED]");
        masked = EMAIL.matcher(masked).replaceAll("[EMAIL-MASKED]");
        masked = PHONE.matcher(masked).replaceAll("[PHONE-MASKED]");
        return masked;
    }
}
