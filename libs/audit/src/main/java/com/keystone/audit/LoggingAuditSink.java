package com.keystone.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each entry as one JSON line to the dedicated {@value #LOGGER_NAME} logger, so the
 * logging backend can route the audit trail to its own appender.
 */
public class LoggingAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "keystone.audit";

    private static final Logger AUDIT = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void write(AuditEntry entry) {
        String line = AuditEntryCodec.encode(entry);
        if (entry.securityEvent()) {
            AUDIT.warn(line);
        } else {
            AUDIT.info(line);
        }
    }
}
