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
        name = "rollback_record",
        indexes = @Index(name = "ix_rollback_created_at", columnList = "created_at")
)
public class RollbackRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "from_version_id")
    private Long fromVersionId;

    @Column(name = "to_version_id")
    private Long toVersionId;

    @Column(name = "reason", length = 1000)
    private String reason;
}
