package com.coshare.infrastructure.identity;

import com.coshare.domain.identity.IdentityId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static org.assertj.core.api.Assertions.assertThat;

class Sha3AddressDeriverTest {

    private static final IdentityId ALICE = IdentityId.parse("0xa11ce");
    private static final IdentityId BOB = IdentityId.parse("0xb0b");

    private final Sha3AddressDeriver deriver = new Sha3AddressDeriver();

    @Test
    void hashesParentSeedAndSchemeByte() throws Exception {
        byte[] seed = "team".getBytes(StandardCharsets.UTF_8);

        MessageDigest md = MessageDigest.getInstance("SHA3-256");
        md.update(ALICE.bytes());
        md.update(seed);
        md.update((byte) 0xFF);

        assertThat(deriver.derive(ALICE, seed)).isEqualTo(IdentityId.of(md.digest()));
    }

    @Test
    void deterministic() {
        byte[] seed = {1, 2, 3};

        assertThat(deriver.derive(ALICE, seed)).isEqualTo(deriver.derive(ALICE, seed.clone()));
    }

    @Test
    void distinctInputsGiveDistinctAddresses() {
        byte[] one = "one".getBytes(StandardCharsets.UTF_8);
        byte[] two = "two".getBytes(StandardCharsets.UTF_8);

        IdentityId a1 = deriver.derive(ALICE, one);

        assertThat(a1).isNotEqualTo(deriver.derive(ALICE, two));
        assertThat(a1).isNotEqualTo(deriver.derive(BOB, one));
        assertThat(a1).isNotEqualTo(ALICE);
    }

    @Test
    void emptySeedIsAllowed() {
        assertThat(deriver.derive(ALICE, new byte[0])).isNotNull();
    }
}
