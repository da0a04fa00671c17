package com.coshare.api.wiring;

import com.coshare.application.config.ConfigKey;
import com.coshare.application.ports.AuditSink;
import com.coshare.application.ports.ConfigPort;
import com.coshare.application.ports.impl.InMemoryAuditSink;
import com.coshare.application.service.AllowListManager;
import com.coshare.application.service.AuthorityRedeemer;
import com.coshare.application.service.CredentialIssuer;
import com.coshare.application.service.RegistryService;
import com.coshare.application.service.SharedAccountFactory;
import com.coshare.application.service.SharedAccountModule;
import com.coshare.application.service.SharedAccountQueries;
import com.coshare.infrastructure.audit.CompositeAuditSink;
import com.coshare.infrastructure.audit.LoggingAuditSink;
import com.coshare.infrastructure.audit.MicrometerAuditSink;
import com.coshare.infrastructure.config.FileConfigService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class CoshareWiringConfig {

  @Bean
  public ConfigPort configPort(Environment env) throws IOException {
    return new SpringConfigPort(env, FileConfigService.defaultFromWorkingDir());
  }

  /** Queryable audit history (GET /api/v1/audit/{kind}). */
  @Bean
  public InMemoryAuditSink inMemoryAuditSink() {
    return new InMemoryAuditSink();
  }

  @Bean
  public SharedAccountModule sharedAccountModule(ConfigPort config,
                                                 InMemoryAuditSink history,
                                                 MeterRegistry meterRegistry) {
    List<AuditSink> sinks = new ArrayList<>();
    sinks.add(history);
    if (config.getBoolean(ConfigKey.AUDIT_LOG_ENABLED.key(), true)) {
      sinks.add(new LoggingAuditSink());
    }
    if (config.getBoolean(ConfigKey.AUDIT_METRICS_ENABLED.key(), true)) {
      sinks.add(new MicrometerAuditSink(meterRegistry));
    }
    return Bootstrap.createModule(config, CompositeAuditSink.of(sinks));
  }

  @Bean
  public RegistryService registryService(SharedAccountModule module) {
    return module.registry();
  }

  @Bean
  public SharedAccountFactory sharedAccountFactory(SharedAccountModule module) {
    return module.factory();
  }

  @Bean
  public AllowListManager allowListManager(SharedAccountModule module) {
    return module.allowList();
  }

  @Bean
  public CredentialIssuer credentialIssuer(SharedAccountModule module) {
    return module.issuer();
  }

  @Bean
  public AuthorityRedeemer authorityRedeemer(SharedAccountModule module) {
    return module.redeemer();
  }

  @Bean
  public SharedAccountQueries sharedAccountQueries(SharedAccountModule module) {
    return module.queries();
  }
}
