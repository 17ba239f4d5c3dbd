package com.planforge.data.repository;

import com.planforge.data.entity.LearningPlan;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface LearningPlanRepository extends JpaRepository<LearningPlan, UUID> {

    Optional<LearningPlan> findByIdAndUserId(UUID id, UUID userId);

    /**
     * Row-locking read (SELECT ... FOR UPDATE). Serializes concurrent reservations and finalizations for a plan
     * until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM LearningPlan p WHERE p.id = :id")
    Optional<LearningPlan> findByIdForUpdate(@Param("id") UUID id);
}
