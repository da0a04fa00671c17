package com.coshare.api.audit;

import com.coshare.domain.registry.AuditEvent;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEventView(
    long sequence,
    String kind,
    String actor,
    String subject,
    String target,
    String at
) {
  public static AuditEventView of(AuditEvent e) {
    return new AuditEventView(
        e.sequence(),
        e.kind().name().toLowerCase(Locale.ROOT),
        e.actor().value(),
        e.subject() == null ? null : e.subject().value(),
        e.target().value(),
        e.at().toString()
    );
  }
}
