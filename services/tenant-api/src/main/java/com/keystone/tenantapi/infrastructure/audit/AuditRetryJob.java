package com.keystone.tenantapi.infrastructure.audit;

import com.keystone.audit.RetryingAuditFailureHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically retries audit entries the sink failed to store. */
@Component
public class AuditRetryJob {

    private static final Logger log = LoggerFactory.getLogger(AuditRetryJob.class);

    private final RetryingAuditFailureHandler failureHandler;

    public AuditRetryJob(RetryingAuditFailureHandler failureHandler) {
        this.failureHandler = failureHandler;
    }

    @Scheduled(fixedDelayString = "${keystone.data.audit-retry-interval:PT30S}")
    public void retryPending() {
        if (failureHandler.pendingCount() == 0) {
            return;
        }
        int written = failureHandler.retryPending();
        log.info("Audit retry wrote {} entries, {} still pending, {} dropped so far",
                written, failureHandler.pendingCount(), failureHandler.droppedCount());
    }
}
