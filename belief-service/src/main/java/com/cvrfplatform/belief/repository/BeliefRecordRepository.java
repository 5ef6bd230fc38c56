package com.cvrfplatform.belief.repository;

import com.cvrfplatform.belief.model.BeliefRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface BeliefRecordRepository extends ReactiveCrudRepository<BeliefRecord, String> {

    /**
     * Row-level lock for the version check of a cycle commit. Must run inside
     * the commit transaction; the lock is held until it ends.
     */
    @Query("""
        SELECT * FROM cvrf_beliefs
        WHERE user_id = :userId
        FOR UPDATE
        """)
    Mono<BeliefRecord> lockByUserId(String userId);
}
