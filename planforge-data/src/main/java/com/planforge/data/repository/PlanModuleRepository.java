package com.planforge.data.repository;

import com.planforge.data.entity.PlanModule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PlanModuleRepository extends JpaRepository<PlanModule, UUID> {

    List<PlanModule> findByPlanIdOrderByPositionAsc(UUID planId);

    @Query("SELECT COUNT(m) FROM PlanModule m WHERE m.plan.id = :planId")
    long countByPlanId(@Param("planId") UUID planId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM PlanModule m WHERE m.plan.id = :planId")
    int deleteByPlanId(@Param("planId") UUID planId);
}
