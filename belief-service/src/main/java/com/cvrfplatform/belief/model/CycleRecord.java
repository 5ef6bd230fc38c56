package com.cvrfplatform.belief.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Append-only cycle history row. The queryable columns duplicate parts of
 * {@code payload}, the JSON-serialised {@code CvrfCycleResult}.
 */
@Data
@NoArgsConstructor
@Table("cvrf_cycle_history")
public class CycleRecord {

    @Id
    private String id;

    private String userId;

    private int cycleNumber;

    private LocalDateTime timestamp;

    private String earlierEpisodeId;

    private String laterEpisodeId;

    private double performanceDelta;

    private double decisionOverlap;

    private double learningRate;

    private boolean beliefChanged;

    private long beliefVersion;

    /** JSON-serialised {@code CvrfCycleResult} */
    private String payload;
}
