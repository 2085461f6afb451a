package com.jreinhal.scrubber.detection;

import java.math.BigInteger;
import java.time.YearMonth;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Domain checks applied to a shape match before it is trusted.
 */
public enum ValidityCheck {
    NONE {
        @Override
        public boolean test(String value) {
            return true;
        }
    },
    LUHN {
        @Override
        public boolean test(String value) {
            return isValidLuhn(value);
        }
    },
    IBAN_MOD97 {
        @Override
        public boolean test(String value) {
            return isValidIban(value);
        }
    },
    BE_NATIONAL_NUMBER {
        @Override
        public boolean test(String value) {
            return isValidBelgianNationalNumber(value);
        }
    },
    CALENDAR_DATE {
        @Override
        public boolean test(String value) {
            return isCalendarDate(value);
        }
    };

    private static final BigInteger NINETY_SEVEN = BigInteger.valueOf(97L);
    private static final Pattern YEAR_FIRST = Pattern.compile("(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})");
    private static final Pattern DAY_FIRST = Pattern.compile("(\\d{1,2})[-/](\\d{1,2})[-/](\\d{4})");

    public abstract boolean test(String value);

    /**
     * Resolves the validator names used in rule manifests.
     */
    public static ValidityCheck fromManifestName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "luhn" -> LUHN;
            case "iban", "iban_checksum", "iban_mod97" -> IBAN_MOD97;
            case "be_nrn", "be_national_number" -> BE_NATIONAL_NUMBER;
            case "date", "calendar_date" -> CALENDAR_DATE;
            default -> throw new IllegalArgumentException("Unknown validator: " + name);
        };
    }

    static boolean isValidLuhn(String number) {
        String digits = number.replaceAll("[^0-9]", "");
        if (digits.length() < 13 || digits.length() > 19) {
            return false;
        }
        int sum = 0;
        boolean alternate = false;
        for (int i = digits.length() - 1; i >= 0; --i) {
            int digit = digits.charAt(i) - '0';
            if (alternate && (digit *= 2) > 9) {
                digit -= 9;
            }
            sum += digit;
            alternate = !alternate;
        }
        return sum % 10 == 0;
    }

    static boolean isValidIban(String value) {
        String iban = value.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (iban.length() < 15 || iban.length() > 34 || !iban.matches("[A-Z]{2}\\d{2}[A-Z0-9]+")) {
            return false;
        }
        String rearranged = iban.substring(4) + iban.substring(0, 4);
        StringBuilder numeric = new StringBuilder(rearranged.length() * 2);
        for (int i = 0; i < rearranged.length(); i++) {
            char ch = rearranged.charAt(i);
            if (Character.isLetter(ch)) {
                numeric.append(ch - 'A' + 10);
            } else {
                numeric.append(ch);
            }
        }
        return new BigInteger(numeric.toString()).mod(NINETY_SEVEN).intValue() == 1;
    }

    static boolean isValidBelgianNationalNumber(String value) {
        String digits = value.replaceAll("\\D", "");
        if (digits.length() != 11) {
            return false;
        }
        long base = Long.parseLong(digits.substring(0, 9));
        int check = Integer.parseInt(digits.substring(9));
        if (97 - (base % 97) == check) {
            return true;
        }
        // born in or after 2000: the base is prefixed with 2
        long base2000 = Long.parseLong("2" + digits.substring(0, 9));
        return 97 - (base2000 % 97) == check;
    }

    static boolean isCalendarDate(String value) {
        Matcher ymd = YEAR_FIRST.matcher(value.trim());
        if (ymd.matches()) {
            return isRealDay(ymd.group(1), ymd.group(2), ymd.group(3));
        }
        Matcher dmy = DAY_FIRST.matcher(value.trim());
        if (dmy.matches()) {
            return isRealDay(dmy.group(3), dmy.group(2), dmy.group(1));
        }
        return false;
    }

    private static boolean isRealDay(String year, String month, String day) {
        int m = Integer.parseInt(month);
        int d = Integer.parseInt(day);
        if (m < 1 || m > 12 || d < 1) {
            return false;
        }
        return YearMonth.of(Integer.parseInt(year), m).isValidDay(d);
    }
}
