package com.chicu.airetrain.journal;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RetrainingAuditRepository extends JpaRepository<RetrainingAuditEntity, Long> {

    List<RetrainingAuditEntity> findByOrderByIdDesc(Pageable pageable);
}
