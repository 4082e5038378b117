package com.chicu.airetrain.journal;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.version.RollbackRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "airetrain.audit", name = "persistence", havingValue = "memory", matchIfMissing = true)
public class InMemoryAuditJournal implements AuditJournal {

    private final int maxEntries;
    private final Deque<AuditEntry> entries = new ArrayDeque<>();
    private final Deque<RollbackRecord> rollbacks = new ArrayDeque<>();

    public InMemoryAuditJournal(RetrainingProperties props) {
        this.maxEntries = props.getAudit().getMaxEntries();
    }

    @Override
    public synchronized void append(AuditEntry entry) {
        if (entry == null) return;
        entries.addLast(entry);
        while (entries.size() > maxEntries) entries.removeFirst();

        log.debug("🧾 AUDIT req={} {} -> {} status={} detail={}",
                entry.requestId(), entry.fromState(), entry.toState(), entry.status(), entry.detail());
    }

    @Override
    public synchronized void recordRollback(RollbackRecord record) {
        if (record == null) return;
        rollbacks.addLast(record);
        while (rollbacks.size() > maxEntries) rollbacks.removeFirst();
    }

    @Override
    public synchronized List<AuditEntry> recent(int limit) {
        List<AuditEntry> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    @Override
    public synchronized List<RollbackRecord> rollbacks() {
        return List.copyOf(rollbacks);
    }
}
