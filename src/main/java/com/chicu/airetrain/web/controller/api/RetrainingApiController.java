package com.chicu.airetrain.web.controller.api;

import com.chicu.airetrain.coordinator.RetrainingCoordinator;
import com.chicu.airetrain.journal.AuditEntry;
import com.chicu.airetrain.journal.AuditJournal;
import com.chicu.airetrain.trigger.RetrainingReason;
import com.chicu.airetrain.trigger.TriggerAggregator;
import com.chicu.airetrain.trigger.TriggerDecision;
import com.chicu.airetrain.version.ModelVersionStore;
import com.chicu.airetrain.version.RollbackRecord;
import com.chicu.airetrain.web.dto.RollbackRequestDto;
import com.chicu.airetrain.web.dto.StatusView;
import com.chicu.airetrain.web.dto.TriggerRequestDto;
import com.chicu.airetrain.web.dto.VersionView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping(value = "/api/retraining", produces = MediaType.APPLICATION_JSON_VALUE)
public class RetrainingApiController {

    private final TriggerAggregator aggregator;
    private final RetrainingCoordinator coordinator;
    private final ModelVersionStore store;
    private final AuditJournal journal;

    /**
     * Ручной триггер. 202 если заявка в очереди, 200 если отброшена (причина в теле).
     */
    @PostMapping("/trigger")
    public ResponseEntity<TriggerDecision> trigger(@Valid @RequestBody(required = false) TriggerRequestDto body) {
        String note = body != null ? body.note() : null;
        TriggerDecision decision = aggregator.submit(RetrainingReason.MANUAL, note);
        log.info("🖐 MANUAL trigger accepted={} reason={}", decision.accepted(), decision.reason());
        return ResponseEntity.status(decision.accepted() ? HttpStatus.ACCEPTED : HttpStatus.OK).body(decision);
    }

    @PostMapping("/rollback")
    public RollbackRecord rollback(@Valid @RequestBody(required = false) RollbackRequestDto body) {
        Long target = body != null ? body.targetVersionId() : null;
        String reason = body != null && body.reason() != null ? body.reason() : "manual";
        return coordinator.rollback(target, reason);
    }

    @GetMapping("/status")
    public StatusView status() {
        return StatusView.from(coordinator.status());
    }

    @GetMapping("/versions")
    public List<VersionView> versions() {
        return store.history().stream().map(VersionView::from).toList();
    }

    @GetMapping("/audit")
    public List<AuditEntry> audit(@RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return journal.recent(limit);
    }

    @GetMapping("/rollbacks")
    public List<RollbackRecord> rollbacks() {
        return journal.rollbacks();
    }
}
