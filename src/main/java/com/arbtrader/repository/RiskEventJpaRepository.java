package com.arbtrader.repository;

import com.arbtrader.entity.RiskEventEntity;
import com.arbtrader.event.RiskEventType;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the risk_events table. */
@Repository
public interface RiskEventJpaRepository extends JpaRepository<RiskEventEntity, Long> {

    List<RiskEventEntity> findByTypeOrderByTimestampDesc(RiskEventType type);
}
