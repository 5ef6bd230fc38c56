package com.cvrfplatform.belief.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One decision row. {@code seq} is the 1-based append position inside the episode
 * and is the only ordering used on reload.
 *
 * factors: JSON-serialised factor snapshot; either an object or an array of
 *           {@code [name, exposure]} pairs (older rows)
 */
@Data
@NoArgsConstructor
@Table("cvrf_decisions")
public class DecisionRecord {

    @Id
    private String id;

    private String episodeId;

    private String userId;

    private int seq;

    private LocalDateTime timestamp;

    private String symbol;

    private String action;

    private double weightBefore;

    private double weightAfter;

    private String reason;

    private double confidence;

    /** JSON-serialised {@code Map<String, Double>} */
    private String factors;

    /** Null when the decision carried no sentiment reading. */
    private String sentimentLabel;

    private Double sentimentConfidence;

    private Double outcomeReturn;
}
