package com.keystone.tenantapi.config;

import com.keystone.audit.AuditEmitter;
import com.keystone.audit.AuditEntryFactory;
import com.keystone.audit.CompositeAuditSink;
import com.keystone.audit.InMemoryAuditSink;
import com.keystone.audit.LoggingAuditSink;
import com.keystone.audit.RetryingAuditFailureHandler;
import com.keystone.observability.MetricFactory;
import com.keystone.observability.SensitiveDataRedactor;
import com.keystone.persistence.InMemoryRecordStore;
import com.keystone.persistence.TenantScopedGateway;
import com.keystone.persistence.directory.GatewayTenantDirectory;
import com.keystone.persistence.directory.TenantRolePermissionResolver;
import com.keystone.persistence.repository.RoleDefinitionRepository;
import com.keystone.persistence.repository.TenantRepository;
import com.keystone.persistence.repository.UserRepository;
import com.keystone.security.AccessControlSettings;
import com.keystone.security.SecurityContextInitializer;
import com.keystone.security.access.AccessDecisionPipeline;
import com.keystone.security.access.PermissionResolver;
import com.keystone.security.authn.JwtTokenAuthenticator;
import com.keystone.security.authn.TimeBoundedTokenAuthenticator;
import com.keystone.security.authn.TokenAuthenticator;
import com.keystone.security.tenant.TenantDirectory;
import com.keystone.security.tenant.TenantResolver;
import com.keystone.security.tenant.TimeBoundedTenantDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the plain-Java access-control libraries into the Spring context.
 *
 * <p>The libraries carry no Spring annotations; every collaborator is constructed here from the
 * bound {@code keystone.*} properties.
 */
@Configuration
public class AccessControlConfig {

    private static final Logger log = LoggerFactory.getLogger(AccessControlConfig.class);

    @Bean
    public AccessControlSettings accessControlSettings(KeystoneSecurityProperties properties) {
        AccessControlSettings settings = properties.toSettings();
        log.info("Access control configured: {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, KeystoneServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    /** Pool running time-bounded credential checks and tenant lookups. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService accessLookupExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "keystone-lookup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(4, threads);
    }

    // Audit

    @Bean
    public InMemoryAuditSink inMemoryAuditSink() {
        return new InMemoryAuditSink();
    }

    /** Audit trail written to the {@code keystone.audit} log and kept in memory for the audit API. */
    @Bean
    public CompositeAuditSink auditSink(InMemoryAuditSink inMemory) {
        return new CompositeAuditSink(List.of(new LoggingAuditSink(), inMemory));
    }

    @Bean
    public RetryingAuditFailureHandler auditFailureHandler(CompositeAuditSink auditSink, KeystoneDataProperties data,
                                                           MetricFactory metrics) {
        return new RetryingAuditFailureHandler(auditSink, data.auditRetryCapacity(), metrics);
    }

    @Bean
    public AuditEmitter auditEmitter(CompositeAuditSink auditSink, RetryingAuditFailureHandler failureHandler,
                                     MetricFactory metrics, Clock clock) {
        return new AuditEmitter(auditSink, failureHandler, metrics, new SensitiveDataRedactor(),
                new AuditEntryFactory(clock));
    }

    // Persistence

    /** The record store is created here and is not a bean of its own. */
    @Bean
    public TenantScopedGateway tenantScopedGateway(AuditEmitter audit, MetricFactory metrics, Clock clock,
                                                   KeystoneDataProperties data) {
        return new TenantScopedGateway(new InMemoryRecordStore(), audit, metrics, clock, data.softDelete());
    }

    @Bean
    public TenantRepository tenantRepository(TenantScopedGateway gateway) {
        return new TenantRepository(gateway);
    }

    @Bean
    public UserRepository userRepository(TenantScopedGateway gateway) {
        return new UserRepository(gateway);
    }

    @Bean
    public RoleDefinitionRepository roleDefinitionRepository(TenantScopedGateway gateway) {
        return new RoleDefinitionRepository(gateway);
    }

    // Access control

    @Bean
    public TenantDirectory tenantDirectory(TenantRepository tenants, AccessControlSettings settings,
                                           ExecutorService accessLookupExecutor) {
        return new TimeBoundedTenantDirectory(new GatewayTenantDirectory(tenants), settings.lookupTimeout(),
                accessLookupExecutor);
    }

    @Bean
    public TenantResolver tenantResolver(AccessControlSettings settings, TenantDirectory directory) {
        return new TenantResolver(settings, directory);
    }

    @Bean
    public TokenAuthenticator tokenAuthenticator(AccessControlSettings settings, Clock clock,
                                                 ExecutorService accessLookupExecutor) {
        return new TimeBoundedTokenAuthenticator(new JwtTokenAuthenticator(settings, clock),
                settings.lookupTimeout(), accessLookupExecutor);
    }

    @Bean
    public SecurityContextInitializer securityContextInitializer(TenantResolver resolver,
                                                                 TokenAuthenticator authenticator) {
        return new SecurityContextInitializer(resolver, authenticator);
    }

    @Bean
    public PermissionResolver permissionResolver(RoleDefinitionRepository roles) {
        return new TenantRolePermissionResolver(roles);
    }

    @Bean
    public AccessDecisionPipeline accessDecisionPipeline(AccessControlSettings settings, TenantDirectory directory,
                                                         PermissionResolver permissions, AuditEmitter audit,
                                                         MetricFactory metrics) {
        return AccessDecisionPipeline.standard(settings, directory, permissions, audit, metrics);
    }
}
