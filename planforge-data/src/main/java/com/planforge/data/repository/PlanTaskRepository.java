package com.planforge.data.repository;

import com.planforge.data.entity.PlanTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PlanTaskRepository extends JpaRepository<PlanTask, UUID> {

    @Query("""
        SELECT t FROM PlanTask t
        WHERE t.plan.id = :planId
        ORDER BY t.module.position ASC, t.position ASC
        """)
    List<PlanTask> findByPlanIdInOrder(@Param("planId") UUID planId);

    @Query("SELECT COUNT(t) FROM PlanTask t WHERE t.plan.id = :planId")
    long countByPlanId(@Param("planId") UUID planId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM PlanTask t WHERE t.plan.id = :planId")
    int deleteByPlanId(@Param("planId") UUID planId);
}
