package com.chicu.airetrain.journal;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "retraining_audit",
        indexes = {
                @Index(name = "ix_audit_request", columnList = "request_id"),
                @Index(name = "ix_audit_created_at", columnList = "created_at")
        }
)
public class RetrainingAuditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = 64)
    private String requestId;

    @Column(name = "reason", length = 32)
    private String reason;

    @Column(name = "from_state", length = 32)
    private String fromState;

    @Column(name = "to_state", length = 32)
    private String toState;

    @Column(name = "status", length = 16)
    private String status;

    /**
     * Причины гейтов / текст ошибки. Обрезается до длины колонки.
     */
    @Column(name = "detail", length = 2000)
    private String detail;
}
