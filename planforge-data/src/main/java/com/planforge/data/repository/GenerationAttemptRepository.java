package com.planforge.data.repository;

import com.planforge.common.constants.AttemptStatus;
import com.planforge.data.entity.GenerationAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface GenerationAttemptRepository extends JpaRepository<GenerationAttempt, UUID> {

    @Query("SELECT COUNT(a) FROM GenerationAttempt a WHERE a.plan.id = :planId")
    long countByPlanId(@Param("planId") UUID planId);

    @Query("""
        SELECT COUNT(a) > 0 FROM GenerationAttempt a
        WHERE a.plan.id = :planId
          AND a.status = :status
        """)
    boolean existsByPlanIdAndStatus(@Param("planId") UUID planId, @Param("status") AttemptStatus status);

    Optional<GenerationAttempt> findFirstByPlanIdOrderByAttemptNumberDesc(UUID planId);
}
