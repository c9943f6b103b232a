package com.arbtrader.entity;

import com.arbtrader.event.RiskEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the risk_events table.
 * The risk state at the time of the event is stored as a JSON object.
 */
@Entity
@Table(name = "risk_events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", columnDefinition = "varchar(40)")
    private RiskEventType type;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "state_snapshot", columnDefinition = "TEXT")
    private String stateSnapshot;

    @Column(name = "occurred_at")
    private Instant timestamp;
}
