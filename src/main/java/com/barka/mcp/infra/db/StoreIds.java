package com.barka.mcp.infra.db;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;

/**
 * 24 hex character identifiers: 4 bytes of epoch seconds followed by 8 random bytes, so ids
 * sort roughly by creation time.
 */
public final class StoreIds {
    private static final SecureRandom RANDOM = new SecureRandom();

    private StoreIds() {}

    public static String newId(Instant now) {
        byte[] bytes = new byte[12];
        int seconds = (int) now.getEpochSecond();
        bytes[0] = (byte) (seconds >>> 24);
        bytes[1] = (byte) (seconds >>> 16);
        bytes[2] = (byte) (seconds >>> 8);
        bytes[3] = (byte) seconds;
        byte[] tail = new byte[8];
        RANDOM.nextBytes(tail);
        System.arraycopy(tail, 0, bytes, 4, 8);
        return HexFormat.of().formatHex(bytes);
    }
}
