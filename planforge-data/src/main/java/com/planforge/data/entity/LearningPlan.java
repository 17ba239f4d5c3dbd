package com.planforge.data.entity;

import com.planforge.common.constants.GenerationStatus;
import com.planforge.common.constants.LearningStyle;
import com.planforge.common.constants.SkillLevel;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A user's learning plan. Created elsewhere; generation fields are only written by the attempt ledger.
 */
@Entity
@Table(name = "learning_plans")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LearningPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "topic", nullable = false, columnDefinition = "TEXT")
    private String topic;

    @Enumerated(EnumType.STRING)
    @Column(name = "skill_level")
    private SkillLevel skillLevel;

    @Column(name = "weekly_hours")
    private Integer weeklyHours;

    @Enumerated(EnumType.STRING)
    @Column(name = "learning_style")
    private LearningStyle learningStyle;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "deadline_date")
    private LocalDate deadlineDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "generation_status", nullable = false)
    @Builder.Default
    private GenerationStatus generationStatus = GenerationStatus.NOT_STARTED;

    @Column(name = "quota_eligible", nullable = false)
    @Builder.Default
    private boolean quotaEligible = false;

    @Column(name = "finalized_at")
    private Instant finalizedAt;

    @CreationTimestamp
    @Column(name = "created_at")
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
