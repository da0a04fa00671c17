package com.coshare.application.service;

import com.coshare.domain.account.Management;
import com.coshare.domain.account.SharedAccount;
import com.coshare.domain.failure.FailureKind;
import com.coshare.domain.failure.SharedAccountException;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.registry.AuditEvent;
import com.coshare.domain.registry.AuditEventKind;
import org.junit.jupiter.api.Test;

import static com.coshare.application.service.ModuleFixture.NOW;
import static com.coshare.application.service.ModuleFixture.id;
import static com.coshare.application.service.ModuleFixture.seed;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SharedAccountFactoryTest {

    private static final IdentityId ALICE = id("0xa11ce");
    private static final IdentityId BOB = id("0xb0b");

    @Test
    void createsAccountWithCreatorAsAdminAndEmptyAllowList() {
        ModuleFixture f = ModuleFixture.initialized();

        IdentityId target = f.createAccount(ALICE, "team");

        assertThat(target).isEqualTo(f.deriver.derive(ALICE, seed("team")));
        assertThat(f.module.queries().admin(target)).isEqualTo(ALICE);
        assertThat(f.module.queries().unclaimed(target)).isEmpty();
        assertThat(f.module.queries().isSharedAccount(target)).isTrue();

        SharedAccount account = f.store.inTransaction(tx -> tx.find(target, SharedAccount.class)).orElseThrow();
        assertThat(account.authoritySource().identity()).isEqualTo(target);
    }

    @Test
    void emitsCreationEvent() {
        ModuleFixture f = ModuleFixture.initialized();

        IdentityId target = f.createAccount(ALICE, "team");

        assertThat(f.audit.events(AuditEventKind.CREATION))
                .containsExactly(new AuditEvent(1, AuditEventKind.CREATION, ALICE, null, target, NOW));
        assertThat(f.module.registry().counters().creations()).isEqualTo(1);
    }

    @Test
    void sameCreatorAndSeedCollides() {
        ModuleFixture f = ModuleFixture.initialized();
        IdentityId first = f.createAccount(ALICE, "team");

        assertThatThrownBy(() -> f.createAccount(ALICE, "team"))
                .isInstanceOfSatisfying(SharedAccountException.class,
                        e -> assertThat(e.kind()).isEqualTo(FailureKind.ALREADY_EXISTS));

        assertThat(f.module.queries().admin(first)).isEqualTo(ALICE);
        assertThat(f.module.registry().counters().creations()).isEqualTo(1);
        assertThat(f.audit.events(AuditEventKind.CREATION)).hasSize(1);
    }

    @Test
    void differentSeedsOrCreatorsYieldDistinctAccounts() {
        ModuleFixture f = ModuleFixture.initialized();

        IdentityId a1 = f.createAccount(ALICE, "one");
        IdentityId a2 = f.createAccount(ALICE, "two");
        IdentityId b1 = f.createAccount(BOB, "one");

        assertThat(a1).isNotEqualTo(a2).isNotEqualTo(b1);
        assertThat(a2).isNotEqualTo(b1);
        assertThat(f.module.queries().admin(b1)).isEqualTo(BOB);
    }

    @Test
    void identityHoldingRecordsCountsAsExisting() {
        ModuleFixture f = ModuleFixture.initialized();
        IdentityId target = f.deriver.derive(ALICE, seed("taken"));
        f.store.inTransaction(tx -> {
            tx.create(target, Management.administeredBy(BOB));
            return null;
        });

        assertThatThrownBy(() -> f.createAccount(ALICE, "taken"))
                .isInstanceOfSatisfying(SharedAccountException.class,
                        e -> assertThat(e.kind()).isEqualTo(FailureKind.ALREADY_EXISTS));
    }

    @Test
    void seedArrayIsNotRetained() {
        ModuleFixture f = ModuleFixture.initialized();
        byte[] s = seed("mutable");

        IdentityId target = f.module.factory().createSharedAccount(ALICE, s);
        s[0] = 'X';

        assertThat(f.deriver.derive(ALICE, seed("mutable"))).isEqualTo(target);
    }
}
