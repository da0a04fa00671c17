package com.coshare.domain.account;

import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.identity.IdentityRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Administration record co-located with a {@link SharedAccount}.
 *
 * {@code unclaimed} is the allow-list: unique principals in insertion order.
 * Mutators return a new record; the store swaps it in when the unit of work commits.
 */
public record Management(IdentityId admin, List<IdentityId> unclaimed) implements IdentityRecord {

    public Management {
        Objects.requireNonNull(admin, "admin");
        unclaimed = List.copyOf(Objects.requireNonNull(unclaimed, "unclaimed"));
        if (new HashSet<>(unclaimed).size() != unclaimed.size()) {
            throw new IllegalArgumentException("Allow-list contains duplicates: " + unclaimed);
        }
    }

    public static Management administeredBy(IdentityId admin) {
        return new Management(admin, List.of());
    }

    public boolean isAdmin(IdentityId principal) {
        return admin.equals(principal);
    }

    public boolean isListed(IdentityId principal) {
        return unclaimed.contains(principal);
    }

    /** Appends {@code claimer} at the end of the allow-list. */
    public Management withClaimer(IdentityId claimer) {
        Objects.requireNonNull(claimer, "claimer");
        if (isListed(claimer)) {
            throw new IllegalStateException("Already listed: " + claimer);
        }
        List<IdentityId> next = new ArrayList<>(unclaimed.size() + 1);
        next.addAll(unclaimed);
        next.add(claimer);
        return new Management(admin, next);
    }

    /** Removes {@code claimer}, keeping the order of everyone else. */
    public Management withoutClaimer(IdentityId claimer) {
        int idx = unclaimed.indexOf(claimer);
        if (idx < 0) {
            throw new IllegalStateException("Not listed: " + claimer);
        }
        List<IdentityId> next = new ArrayList<>(unclaimed);
        next.remove(idx);
        return new Management(admin, next);
    }
}
