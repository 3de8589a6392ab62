package com.cred.freestyle.marketplace.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Random;

/**
 * Generates public transaction references: {@code TXN-YYYYMMDD-XXXXXXXXXXXXXXXX},
 * the UTC date followed by 8 random bytes as uppercase hex.
 * Uniqueness is checked by the ledger, not here.
 *
 * @author Marketplace Team
 */
@Component
public class TransactionReferenceGenerator {

    private static final String PREFIX = "TXN-";
    private static final int RANDOM_BYTES = 8;
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final Clock clock;
    private final Random random;

    public TransactionReferenceGenerator() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    TransactionReferenceGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Generate a new reference.
     *
     * @return Reference such as TXN-20240115-9F2C0A7B11D3E4F5
     */
    public String generate() {
        byte[] bytes = new byte[RANDOM_BYTES];
        random.nextBytes(bytes);
        return PREFIX + DATE_FORMAT.format(clock.instant()) + "-" + HEX.formatHex(bytes);
    }
}
