package com.cvrfplatform.belief.repository;

import com.cvrfplatform.belief.model.DecisionRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface DecisionRecordRepository extends ReactiveCrudRepository<DecisionRecord, String> {

    /** Append order. */
    Flux<DecisionRecord> findByEpisodeIdOrderBySeqAsc(String episodeId);

    @Query("""
        SELECT COALESCE(MAX(seq), 0) FROM cvrf_decisions
        WHERE episode_id = :episodeId
        """)
    Mono<Integer> findLastSeq(String episodeId);

    /**
     * Stamps the realized return supplied at episode close.
     */
    @Modifying
    @Query("""
        UPDATE cvrf_decisions
        SET outcome_return = :outcomeReturn
        WHERE id = :id
          AND episode_id = :episodeId
        """)
    Mono<Integer> updateOutcome(String id, String episodeId, double outcomeReturn);
}
