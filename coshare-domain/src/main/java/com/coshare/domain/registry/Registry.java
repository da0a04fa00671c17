package com.coshare.domain.registry;

import com.coshare.domain.account.AuthoritySource;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.identity.IdentityRecord;

import java.util.Objects;

/**
 * Module-wide singleton stored at the module's derived identity.
 *
 * Holds the module's own authority source and the audit counters. Counters only ever grow.
 */
public record Registry(IdentityId self, AuthoritySource authoritySource, AuditCounters counters)
        implements IdentityRecord {

    public Registry {
        Objects.requireNonNull(self, "self");
        Objects.requireNonNull(authoritySource, "authoritySource");
        Objects.requireNonNull(counters, "counters");
        if (!authoritySource.identity().equals(self)) {
            throw new IllegalArgumentException("Registry authority source belongs to " + authoritySource.identity());
        }
    }

    public static Registry install(IdentityId self, AuthoritySource authoritySource) {
        return new Registry(self, authoritySource, AuditCounters.zero());
    }

    public long count(AuditEventKind kind) {
        return counters.get(kind);
    }

    public Registry withRecorded(AuditEventKind kind) {
        return new Registry(self, authoritySource, counters.increment(kind));
    }
}
