package com.lantromipis.pgasync.postgresprotocol.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PasswordUtilsTest {

    @Test
    void shouldEncodeMd5PasswordWithUserAndSalt() {
        // when
        String encoded = PasswordUtils.encodeMd5Password("alice", "secret", new byte[]{1, 2, 3, 4});

        // then
        assertThat(encoded).isEqualTo("md598a0412b9c31436fc53776e863350083");
    }
}
