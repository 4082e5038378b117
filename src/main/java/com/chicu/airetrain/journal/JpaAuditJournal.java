package com.chicu.airetrain.journal;

import com.chicu.airetrain.version.RollbackRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Аудит в БД (airetrain.audit.persistence=jpa).
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "airetrain.audit", name = "persistence", havingValue = "jpa")
public class JpaAuditJournal implements AuditJournal {

    private static final int DETAIL_MAX = 2000;
    private static final int REASON_MAX = 1000;

    private final RetrainingAuditRepository auditRepo;
    private final RollbackRecordRepository rollbackRepo;

    @Override
    @Transactional
    public void append(AuditEntry entry) {
        if (entry == null) return;

        auditRepo.save(RetrainingAuditEntity.builder()
                .createdAt(entry.timestamp())
                .requestId(entry.requestId())
                .reason(entry.reason())
                .fromState(entry.fromState())
                .toState(entry.toState())
                .status(entry.status())
                .detail(cut(entry.detail(), DETAIL_MAX))
                .build());
    }

    @Override
    @Transactional
    public void recordRollback(RollbackRecord record) {
        if (record == null) return;

        RollbackRecordEntity saved = rollbackRepo.save(RollbackRecordEntity.builder()
                .createdAt(record.timestamp())
                .fromVersionId(record.fromVersionId())
                .toVersionId(record.toVersionId())
                .reason(cut(record.reason(), REASON_MAX))
                .build());

        log.debug("🧾 ROLLBACK saved id={} v{} -> v{}", saved.getId(), saved.getFromVersionId(), saved.getToVersionId());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEntry> recent(int limit) {
        if (limit <= 0) return List.of();

        List<AuditEntry> out = new ArrayList<>(auditRepo.findByOrderByIdDesc(PageRequest.of(0, limit)).stream()
                .map(e -> AuditEntry.builder()
                        .timestamp(e.getCreatedAt())
                        .requestId(e.getRequestId())
                        .reason(e.getReason())
                        .fromState(e.getFromState())
                        .toState(e.getToState())
                        .status(e.getStatus())
                        .detail(e.getDetail())
                        .build())
                .toList());
        Collections.reverse(out);
        return out;
    }

    @Override
    @Transactional(readOnly = true)
    public List<RollbackRecord> rollbacks() {
        return rollbackRepo.findAllByOrderByIdAsc().stream()
                .map(e -> RollbackRecord.builder()
                        .timestamp(e.getCreatedAt())
                        .fromVersionId(e.getFromVersionId())
                        .toVersionId(e.getToVersionId())
                        .reason(e.getReason())
                        .build())
                .toList();
    }

    private static String cut(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
