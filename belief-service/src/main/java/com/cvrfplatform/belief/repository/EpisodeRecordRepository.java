package com.cvrfplatform.belief.repository;

import com.cvrfplatform.belief.model.EpisodeRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface EpisodeRecordRepository extends ReactiveCrudRepository<EpisodeRecord, String> {

    Mono<EpisodeRecord> findFirstByUserIdAndStatus(String userId, String status);

    Mono<Long> countByUserIdAndStatus(String userId, String status);

    @Query("""
        SELECT * FROM cvrf_episodes
        WHERE user_id = :userId
          AND status = 'COMPLETED'
        ORDER BY episode_number DESC
        LIMIT :limit
        """)
    Flux<EpisodeRecord> findRecentCompleted(String userId, int limit);

    @Query("""
        SELECT COALESCE(MAX(episode_number), 0) FROM cvrf_episodes
        WHERE user_id = :userId
        """)
    Mono<Integer> findLastEpisodeNumber(String userId);

    /**
     * Completes an episode only if it is still ACTIVE.
     *
     * @return rows updated; 0 means the episode was closed by someone else
     */
    @Modifying
    @Query("""
        UPDATE cvrf_episodes
        SET status           = 'COMPLETED',
            end_date         = :endDate,
            portfolio_return = :portfolioReturn,
            sharpe_ratio     = :sharpeRatio,
            max_drawdown     = :maxDrawdown
        WHERE id = :id
          AND status = 'ACTIVE'
        """)
    Mono<Integer> complete(String id, LocalDateTime endDate, double portfolioReturn,
                           double sharpeRatio, double maxDrawdown);
}
