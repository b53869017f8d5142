package com.investigator.engine.audit;

import com.investigator.core.model.InvestigationRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps audit records in memory.
 * For demonstration and testing purposes.
 */
public class InMemoryAuditSink implements AuditSink {
    
    private final List<InvestigationRecord> records = new CopyOnWriteArrayList<>();
    
    @Override
    public void record(InvestigationRecord record) {
        records.add(record);
    }
    
    public List<InvestigationRecord> records() {
        return new ArrayList<>(records);
    }
    
    public Optional<InvestigationRecord> last() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }
    
    public void clear() {
        records.clear();
    }
}
