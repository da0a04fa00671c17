package com.coshare.application.service;

import com.coshare.domain.account.Capability;
import com.coshare.domain.account.Management;
import com.coshare.domain.failure.FailureKind;
import com.coshare.domain.failure.SharedAccountException;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.registry.AuditCounters;
import com.coshare.domain.registry.AuditEventKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.coshare.application.service.ModuleFixture.id;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end properties of the claim/redeem protocol across several accounts and principals.
 */
class ProtocolPropertiesTest {

    private static final IdentityId ALICE = id("0xa11ce");
    private static final IdentityId BOB = id("0xb0b");
    private static final IdentityId CAROL = id("0xca201");
    private static final IdentityId DAVE = id("0xda4e");

    @Test
    void countersMatchSuccessfulOperations() {
        ModuleFixture f = ModuleFixture.initialized();
        IdentityId t1 = f.createAccount(ALICE, "one");
        IdentityId t2 = f.createAccount(BOB, "two");

        f.module.allowList().addClaimer(ALICE, t1, CAROL);
        f.module.allowList().addClaimer(ALICE, t1, DAVE);
        f.module.allowList().addClaimer(BOB, t2, CAROL);
        f.module.allowList().removeClaimer(BOB, t2, CAROL);
        f.module.issuer().claimCapability(CAROL, t1);
        f.module.redeemer().acquireAuthority(CAROL, t1);

        // failures never count
        attempt(() -> f.createAccount(ALICE, "one"));
        attempt(() -> f.module.allowList().addClaimer(BOB, t1, BOB));
        attempt(() -> f.module.issuer().claimCapability(CAROL, t2));
        attempt(() -> f.module.redeemer().acquireAuthority(DAVE, t1));

        assertThat(f.module.registry().counters()).isEqualTo(new AuditCounters(2, 3, 1, 1, 1));
        for (AuditEventKind kind : AuditEventKind.values()) {
            assertThat(f.audit.events(kind)).hasSize((int) f.module.registry().counters().get(kind));
        }
    }

    @Test
    void sequencesArePerKindAndContiguous() {
        ModuleFixture f = ModuleFixture.initialized();
        IdentityId t1 = f.createAccount(ALICE, "one");
        f.module.allowList().addClaimer(ALICE, t1, BOB);
        f.createAccount(ALICE, "two");
        f.module.allowList().addClaimer(ALICE, t1, CAROL);
        f.createAccount(BOB, "three");

        assertThat(f.audit.events(AuditEventKind.CREATION)).extracting(e -> e.sequence()).containsExactly(1L, 2L, 3L);
        assertThat(f.audit.events(AuditEventKind.ALLOW_ADD)).extracting(e -> e.sequence()).containsExactly(1L, 2L);
    }

    @Test
    void listedPrincipalsAndHoldersNeverOverlapPerAccount() {
        ModuleFixture f = ModuleFixture.initialized();
        IdentityId t1 = f.createAccount(ALICE, "one");
        IdentityId t2 = f.createAccount(ALICE, "two");
        List<IdentityId> principals = List.of(BOB, CAROL, DAVE, ALICE);

        for (IdentityId p : principals) {
            f.module.allowList().addClaimer(ALICE, t1, p);
            f.module.allowList().addClaimer(ALICE, t2, p);
        }
        f.module.issuer().claimCapability(BOB, t1);
        f.module.issuer().claimCapability(CAROL, t2);
        attempt(() -> f.module.issuer().claimCapability(BOB, t2));
        f.module.redeemer().acquireAuthority(CAROL, t2);
        f.module.issuer().claimCapability(CAROL, t1);

        for (IdentityId target : List.of(t1, t2)) {
            List<IdentityId> listed = f.module.queries().unclaimed(target);
            assertThat(listed).doesNotHaveDuplicates();
            for (IdentityId p : principals) {
                boolean holds = f.module.queries().heldCapability(p).filter(target::equals).isPresent();
                assertThat(holds && listed.contains(p)).as("%s on %s", p, target).isFalse();
            }
        }
    }

    @Test
    void capabilitiesAreRedeemedAtMostOnce() {
        ModuleFixture f = ModuleFixture.initialized();
        IdentityId t1 = f.createAccount(ALICE, "one");
        for (IdentityId p : List.of(BOB, CAROL, DAVE)) {
            f.module.allowList().addClaimer(ALICE, t1, p);
            f.module.issuer().claimCapability(p, t1);
        }

        int granted = 0;
        for (int round = 0; round < 3; round++) {
            for (IdentityId p : List.of(BOB, CAROL, DAVE)) {
                try {
                    f.module.redeemer().acquireAuthority(p, t1);
                    granted++;
                } catch (SharedAccountException e) {
                    assertThat(e.kind()).isEqualTo(FailureKind.NO_CAPABILITY);
                }
            }
        }

        assertThat(granted).isEqualTo(3);
        assertThat(f.module.registry().counters().redemptions()).isEqualTo(3);
    }

    @Test
    void adminNeverChanges() {
        ModuleFixture f = ModuleFixture.initialized();
        IdentityId t1 = f.createAccount(ALICE, "one");
        f.module.allowList().addClaimer(ALICE, t1, BOB);
        f.module.issuer().claimCapability(BOB, t1);
        f.module.redeemer().acquireAuthority(BOB, t1);

        assertThat(f.module.queries().admin(t1)).isEqualTo(ALICE);
        assertThatThrownBy(() -> f.module.allowList().addClaimer(BOB, t1, CAROL))
                .isInstanceOfSatisfying(SharedAccountException.class,
                        e -> assertThat(e.kind()).isEqualTo(FailureKind.NOT_ADMIN));
    }

    @Test
    void racingClaimAndRemoveReachOneConsistentOutcome() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 50; i++) {
                ModuleFixture f = ModuleFixture.initialized();
                IdentityId t1 = f.createAccount(ALICE, "race-" + i);
                f.module.allowList().addClaimer(ALICE, t1, BOB);

                CountDownLatch start = new CountDownLatch(1);
                Future<Boolean> claim = pool.submit(gated(start, () -> f.module.issuer().claimCapability(BOB, t1)));
                Future<Boolean> remove = pool.submit(gated(start, () -> f.module.allowList().removeClaimer(ALICE, t1, BOB)));
                start.countDown();

                boolean claimed = claim.get(10, TimeUnit.SECONDS);
                boolean removed = remove.get(10, TimeUnit.SECONDS);

                assertThat(claimed ^ removed).as("exactly one wins, round %d", i).isTrue();
                assertThat(f.module.queries().unclaimed(t1)).isEmpty();
                assertThat(f.module.queries().heldCapability(BOB).isPresent()).isEqualTo(claimed);
                assertThat(f.module.registry().counters().claims()).isEqualTo(claimed ? 1 : 0);
                assertThat(f.module.registry().counters().removes()).isEqualTo(removed ? 1 : 0);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void storeKeepsOneRecordPerType() {
        ModuleFixture f = ModuleFixture.initialized();
        IdentityId t1 = f.createAccount(ALICE, "one");
        f.module.allowList().addClaimer(ALICE, t1, BOB);
        f.module.issuer().claimCapability(BOB, t1);

        assertThatThrownBy(() -> f.store.inTransaction(tx -> {
            tx.create(BOB, Capability.forTarget(t1));
            return null;
        })).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> f.store.inTransaction(tx -> {
            tx.create(t1, Management.administeredBy(BOB));
            return null;
        })).isInstanceOf(IllegalStateException.class);
    }

    private static Callable<Boolean> gated(CountDownLatch start, Runnable op) {
        return () -> {
            start.await();
            try {
                op.run();
                return true;
            } catch (SharedAccountException e) {
                assertThat(e.kind()).isEqualTo(FailureKind.NOT_LISTED);
                return false;
            }
        };
    }

    private static void attempt(Runnable op) {
        assertThatThrownBy(op::run).isInstanceOf(SharedAccountException.class);
    }
}
