package com.chicu.airetrain.journal;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RollbackRecordRepository extends JpaRepository<RollbackRecordEntity, Long> {

    List<RollbackRecordEntity> findAllByOrderByIdAsc();
}
