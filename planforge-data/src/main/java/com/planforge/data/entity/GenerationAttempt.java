package com.planforge.data.entity;

import com.planforge.common.constants.AttemptStatus;
import com.planforge.common.constants.FailureClassification;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One reservation-to-finalization cycle. Inserted as IN_PROGRESS by a reservation and updated exactly once
 * when finalized; never deleted.
 */
@Entity
@Table(
    name = "generation_attempts",
    uniqueConstraints = @UniqueConstraint(name = "uq_attempt_plan_number", columnNames = {"plan_id", "attempt_number"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GenerationAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "plan_id", nullable = false)
    private LearningPlan plan;

    @Column(name = "attempt_number", nullable = false)
    private Integer attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private AttemptStatus status = AttemptStatus.IN_PROGRESS;

    @Enumerated(EnumType.STRING)
    @Column(name = "classification")
    private FailureClassification classification;

    @Column(name = "duration_ms")
    @Builder.Default
    private Long durationMs = 0L;

    @Column(name = "modules_count")
    @Builder.Default
    private Integer modulesCount = 0;

    @Column(name = "tasks_count")
    @Builder.Default
    private Integer tasksCount = 0;

    @Column(name = "truncated_topic")
    @Builder.Default
    private boolean truncatedTopic = false;

    @Column(name = "truncated_notes")
    @Builder.Default
    private boolean truncatedNotes = false;

    @Column(name = "normalized_effort")
    @Builder.Default
    private boolean normalizedEffort = false;

    @Column(name = "prompt_hash", length = 64)
    private String promptHash;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @CreationTimestamp
    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
