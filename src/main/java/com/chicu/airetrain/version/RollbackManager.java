package com.chicu.airetrain.version;

import com.chicu.airetrain.alert.AlertSeverity;
import com.chicu.airetrain.alert.AlertSink;
import com.chicu.airetrain.error.RollbackFailureException;
import com.chicu.airetrain.journal.AuditJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Откаты: по запросу оператора/watchdog и после неудачного промоушена.
 * Каждый успешный откат оставляет {@link RollbackRecord} в журнале.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RollbackManager {

    private final ModelVersionStore store;
    private final AuditJournal journal;
    private final AlertSink alertSink;
    private final Clock clock;

    public RollbackRecord rollback(Long targetId, String reason) {
        try {
            RollbackRecord record = store.rollback(targetId, reason);
            journal.recordRollback(record);

            alertSink.notify(AlertSeverity.WARNING,
                    "Rollback performed: v" + record.fromVersionId() + " -> v" + record.toVersionId(),
                    context(record.fromVersionId(), record.toVersionId(), reason));
            return record;

        } catch (RollbackFailureException e) {
            log.error("⏪ ROLLBACK FAILED target={} reason={}: {}", targetId, reason, e.getMessage());
            alertSink.notify(AlertSeverity.CRITICAL,
                    "Rollback failed, operator action required: " + e.getMessage(),
                    context(null, targetId, reason));
            throw e;
        }
    }

    /**
     * Store уже вернул бэкап на serving path; фиксируем это как откат candidate → backup.
     */
    public RollbackRecord recordPromotionFailure(ModelVersion candidate, Exception cause) {
        Long restoredId = store.active().map(ModelVersion::id).orElse(null);

        RollbackRecord record = RollbackRecord.builder()
                .timestamp(clock.instant())
                .fromVersionId(candidate.id())
                .toVersionId(restoredId)
                .reason("promotion failure: " + (cause != null ? cause.getMessage() : "unknown"))
                .build();
        journal.recordRollback(record);

        alertSink.notify(AlertSeverity.CRITICAL,
                "Promotion of v" + candidate.id() + " failed, active stays v" + restoredId,
                context(candidate.id(), restoredId, record.reason()));
        return record;
    }

    private static Map<String, Object> context(Long from, Long to, String reason) {
        Map<String, Object> ctx = new HashMap<>();
        ctx.put("fromVersionId", from);
        ctx.put("toVersionId", to);
        ctx.put("reason", reason);
        return ctx;
    }
}
