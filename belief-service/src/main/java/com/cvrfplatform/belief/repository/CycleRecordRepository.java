package com.cvrfplatform.belief.repository;

import com.cvrfplatform.belief.model.CycleRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface CycleRecordRepository extends ReactiveCrudRepository<CycleRecord, String> {

    @Query("""
        SELECT * FROM cvrf_cycle_history
        WHERE user_id = :userId
        ORDER BY cycle_number ASC
        """)
    Flux<CycleRecord> findHistory(String userId);
}
