package com.arbtrader.domain.model;

import com.arbtrader.event.RiskEventType;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Append-only audit entry for a risk controller transition or advisory. */
@Data
@Builder
public class RiskEventRecord {

    private Long id;
    private RiskEventType type;
    private String description;
    private Map<String, Object> stateSnapshot;
    private Instant timestamp;
}
