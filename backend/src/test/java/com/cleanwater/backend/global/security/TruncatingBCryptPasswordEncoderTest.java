package com.cleanwater.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TruncatingBCryptPasswordEncoderTest {

    private final TruncatingBCryptPasswordEncoder encoder = new TruncatingBCryptPasswordEncoder(4);

    @Test
    void verifiesItsOwnHash() {
        String hash = encoder.encode("Correct1horse");

        assertThat(hash).startsWith("$2a$04$");
        assertThat(encoder.matches("Correct1horse", hash)).isTrue();
        assertThat(encoder.matches("Correct1horsf", hash)).isFalse();
    }

    @Test
    void saltsEveryHash() {
        assertThat(encoder.encode("Same1password")).isNotEqualTo(encoder.encode("Same1password"));
    }

    @Test
    void ignoresBytesBeyondSeventyTwo() {
        String prefix = "A1" + "x".repeat(70);
        String hash = encoder.encode(prefix + "tail-one");

        assertThat(encoder.matches(prefix + "tail-two", hash)).isTrue();
        assertThat(encoder.matches(prefix, hash)).isTrue();
    }

    @Test
    void differenceInsideTheFirstSeventyTwoBytesStillCounts() {
        String base = "x".repeat(71);
        String hash = encoder.encode(base + "a" + "suffix");

        assertThat(encoder.matches(base + "b" + "suffix", hash)).isFalse();
    }

    @Test
    void truncatesOnEncodedBytesNotCharacters() {
        // 36 two-byte characters fill the limit exactly
        String umlauts = "ä".repeat(36);
        String hash = encoder.encode(umlauts + "ignored");

        assertThat(TruncatingBCryptPasswordEncoder.truncate(umlauts + "ignored")).hasSize(72);
        assertThat(encoder.matches(umlauts, hash)).isTrue();
    }

    @Test
    void malformedStoredHashDoesNotMatch() {
        assertThat(encoder.matches("anything", "not-a-bcrypt-hash")).isFalse();
        assertThat(encoder.matches("anything", "")).isFalse();
        assertThat(encoder.matches("anything", null)).isFalse();
    }
}
