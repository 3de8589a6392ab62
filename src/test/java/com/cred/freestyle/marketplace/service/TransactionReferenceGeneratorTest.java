package com.cred.freestyle.marketplace.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TransactionReferenceGenerator Tests")
class TransactionReferenceGeneratorTest {

    @Test
    @DisplayName("generate - Uses the UTC date and 16 uppercase hex characters")
    void generate_Format() {
        // Given: 23:30 on the 14th in UTC+3 is still the 14th in UTC
        Clock clock = Clock.fixed(Instant.parse("2024-01-14T23:30:00Z"), ZoneOffset.ofHours(3));
        TransactionReferenceGenerator generator = new TransactionReferenceGenerator(clock, new Random(42));

        // When
        String reference = generator.generate();

        // Then
        assertThat(reference)
                .matches("^TXN-\\d{8}-[0-9A-F]{16}$")
                .startsWith("TXN-20240114-");
    }

    @Test
    @DisplayName("generate - Consecutive references differ")
    void generate_Distinct() {
        TransactionReferenceGenerator generator = new TransactionReferenceGenerator();
        Set<String> references = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            references.add(generator.generate());
        }

        assertThat(references).hasSize(1000);
    }
}
