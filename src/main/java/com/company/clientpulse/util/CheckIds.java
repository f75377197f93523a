package com.company.clientpulse.util;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Check run identifiers: {@code yyyyMMdd-HHmmss-<16 hex chars>} in UTC.
 */
public final class CheckIds {

    private static final DateTimeFormatter PREFIX_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Pattern FORMAT = Pattern.compile("\\d{8}-\\d{6}-[0-9a-f]{16}");

    private CheckIds() {
    }

    public static String generate(Clock clock) {
        byte[] suffix = new byte[8];
        RANDOM.nextBytes(suffix);
        return PREFIX_FORMAT.format(clock.instant()) + "-" + HexFormat.of().formatHex(suffix);
    }

    public static boolean isValid(String checkId) {
        return checkId != null && FORMAT.matcher(checkId).matches();
    }
}
