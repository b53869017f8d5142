package com.investigator.engine.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investigator.core.model.InvestigationRecord;
import com.investigator.engine.json.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each investigation record as one JSON line to the {@code investigator.audit} logger.
 * Route that logger to its own appender to keep an audit trail.
 */
public class LoggingAuditSink implements AuditSink {
    
    public static final String AUDIT_LOGGER = "investigator.audit";
    
    private static final Logger log = LoggerFactory.getLogger(LoggingAuditSink.class);
    
    private final Logger audit;
    private final ObjectMapper mapper;
    
    public LoggingAuditSink(ObjectMapper mapper) {
        this(LoggerFactory.getLogger(AUDIT_LOGGER), mapper);
    }
    
    public LoggingAuditSink() {
        this(ObjectMappers.standard());
    }
    
    LoggingAuditSink(Logger audit, ObjectMapper mapper) {
        this.audit = audit;
        this.mapper = mapper;
    }
    
    @Override
    public void record(InvestigationRecord record) {
        try {
            audit.info(mapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit record for investigation {}: {}",
                record.investigationId(), e.getOriginalMessage());
        }
    }
}
