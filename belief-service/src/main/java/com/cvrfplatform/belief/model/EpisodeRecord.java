package com.cvrfplatform.belief.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted episode header. Decisions live in {@code cvrf_decisions}.
 *
 * Column mapping (R2DBC snake_case convention):
 *   episodeNumber   → episode_number
 *   startDate       → start_date
 *   endDate         → end_date (null while ACTIVE)
 *   portfolioReturn → portfolio_return
 *
 * status: {@code EpisodeStatus} name
 */
@Data
@NoArgsConstructor
@Table("cvrf_episodes")
public class EpisodeRecord {

    @Id
    private String id;

    private String userId;

    private int episodeNumber;

    private LocalDateTime startDate;

    private LocalDateTime endDate;

    private double portfolioReturn;

    private double sharpeRatio;

    private double maxDrawdown;

    private String status;
}
