package com.planforge.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "plan_modules")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlanModule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "plan_id", nullable = false)
    private LearningPlan plan;

    // 1-based, follows the order the provider produced
    @Column(name = "order_index", nullable = false)
    private Integer position;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "estimated_minutes", nullable = false)
    private Integer estimatedMinutes;

    @CreationTimestamp
    @Column(name = "created_at")
    private Instant createdAt;
}
