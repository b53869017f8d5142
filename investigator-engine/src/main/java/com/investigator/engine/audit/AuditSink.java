package com.investigator.engine.audit;

import com.investigator.core.model.InvestigationRecord;

/**
 * Receives one record per investigation, including investigations that could not run.
 * Implementations must not throw; the investigator logs and ignores sink failures.
 */
@FunctionalInterface
public interface AuditSink {

    void record(InvestigationRecord record);

    static AuditSink noop() {
        return record -> { };
    }
}
