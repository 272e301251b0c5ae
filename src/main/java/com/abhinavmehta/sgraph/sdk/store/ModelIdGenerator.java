package com.abhinavmehta.sgraph.sdk.store;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 24-character URL-safe model identifiers. The first {@value #SEQUENCE_WIDTH} characters encode a
 * process-wide sequence number, so an identifier is never issued twice within one process.
 */
final class ModelIdGenerator {
    private static final char[] ALPHABET =
            "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ_-".toCharArray();
    static final int ID_LENGTH = 24;
    static final int SEQUENCE_WIDTH = 8;

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final SecureRandom random = new SecureRandom();

    String next() {
        String sequence = Long.toString(SEQUENCE.incrementAndGet(), 36);
        StringBuilder id = new StringBuilder(ID_LENGTH);
        for (int i = sequence.length(); i < SEQUENCE_WIDTH; i++) {
            id.append('0');
        }
        id.append(sequence);
        while (id.length() < ID_LENGTH) {
            id.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return id.toString();
    }
}
