package com.chicu.airetrain.journal;

import com.chicu.airetrain.version.RollbackRecord;

import java.util.List;

/**
 * Append-only журнал переходов и откатов.
 */
public interface AuditJournal {

    void append(AuditEntry entry);

    void recordRollback(RollbackRecord record);

    /** Последние записи, старые первыми. */
    List<AuditEntry> recent(int limit);

    List<RollbackRecord> rollbacks();
}
