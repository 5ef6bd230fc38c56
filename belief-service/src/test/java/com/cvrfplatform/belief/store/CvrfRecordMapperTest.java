package com.cvrfplatform.belief.store;

import com.cvrfplatform.belief.config.BeliefServiceConfig;
import com.cvrfplatform.belief.model.BeliefRecord;
import com.cvrfplatform.belief.model.CycleRecord;
import com.cvrfplatform.belief.model.DecisionRecord;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.EpisodeComparison;
import com.cvrfplatform.common.model.MetaPrompt;
import com.cvrfplatform.common.model.SentimentLabel;
import com.cvrfplatform.common.model.SentimentSignal;
import com.cvrfplatform.common.model.TradeAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class CvrfRecordMapperTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private final CvrfRecordMapper mapper = new CvrfRecordMapper(new BeliefServiceConfig().objectMapper());

    @Nested
    @DisplayName("factor map encodings")
    class FactorMaps {

        @Test
        @DisplayName("object encoding → sorted map")
        void objectEncoding() {
            SortedMap<String, Double> map = mapper.readFactorMap("{\"value\":0.1,\"momentum\":0.4}");

            assertThat(map).containsExactly(entry("momentum", 0.4), entry("value", 0.1));
        }

        @Test
        @DisplayName("array of [name, value] pairs → same sorted map")
        void pairEncoding() {
            SortedMap<String, Double> pairs = mapper.readFactorMap("[[\"value\",0.1],[\"momentum\",0.4]]");

            assertThat(pairs).isEqualTo(mapper.readFactorMap("{\"momentum\":0.4,\"value\":0.1}"));
            assertThat(pairs.firstKey()).isEqualTo("momentum");
        }

        @Test
        @DisplayName("null or blank → empty map")
        void blank() {
            assertThat(mapper.readFactorMap(null)).isEmpty();
            assertThat(mapper.readFactorMap(" ")).isEmpty();
        }

        @Test
        @DisplayName("malformed pair → rejected")
        void malformedPair() {
            assertThatThrownBy(() -> mapper.readFactorMap("[[\"momentum\"]]"))
                .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("belief row written with pair-encoded factors reads back normalized")
    void legacyBeliefRow() {
        BeliefRecord row = mapper.toRecord(BeliefState.defaults("user-1", T0));
        row.setFactorWeights("[[\"value\",0.35],[\"momentum\",-0.1]]");
        row.setVersion(7);

        BeliefState state = mapper.toState(row);

        assertThat(state.version()).isEqualTo(7);
        assertThat(state.factorWeights().keySet()).containsExactly("momentum", "value");
        assertThat(state.factorWeight("value")).isEqualTo(0.35);
        assertThat(state.updatedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("cycle payload with pair-encoded maps nested in newBeliefState reads back normalized")
    void legacyCyclePayload() {
        BeliefState beliefs = BeliefState.defaults("user-1", T0);
        EpisodeComparison comparison = new EpisodeComparison("e1", "e2", "e2", "e1",
            0.03, 0.5, List.of(), List.of(), T0);
        CvrfCycleResult result = new CvrfCycleResult("c1", 1, "user-1", T0, comparison, List.of(),
            MetaPrompt.noSignal(), List.of(), beliefs, "no signal", 0.12, false);

        CycleRecord row = mapper.toRecord(result);
        row.setPayload(row.getPayload().replace(
            "\"factorWeights\":{\"momentum\":0.2,\"quality\":0.2,\"sentiment\":0.2,\"value\":0.2,\"volatility\":0.2}",
            "\"factorWeights\":[[\"volatility\",0.2],[\"momentum\",0.9]]"));
        assertThat(row.getPayload()).contains("[[\"volatility\",0.2]");

        CvrfCycleResult read = mapper.toCycleResult(row);

        assertThat(read.newBeliefState().factorWeights().keySet()).containsExactly("momentum", "volatility");
        assertThat(read.newBeliefState().factorWeight("momentum")).isEqualTo(0.9);
        assertThat(read.episodeComparison().performanceDelta()).isEqualTo(0.03);
        assertThat(row.getLaterEpisodeId()).isEqualTo("e2");
        assertThat(row.getBeliefVersion()).isEqualTo(BeliefState.INITIAL_VERSION);
    }

    @Test
    @DisplayName("decision sentiment survives the row; absent sentiment stays null")
    void decisionSentiment() {
        Decision withSentiment = new Decision("d1", "AAPL", TradeAction.BUY, 0.0, 0.05, "entry", 0.7,
            null, new SentimentSignal(SentimentLabel.NEGATIVE, 0.4), T0, null);

        DecisionRecord row = mapper.toRecord("user-1", "e1", 1, withSentiment);
        assertThat(row.getSentimentLabel()).isEqualTo("NEGATIVE");
        assertThat(mapper.toDecision(row)).isEqualTo(withSentiment);

        DecisionRecord plain = mapper.toRecord("user-1", "e1", 2, withSentiment.withSentiment(null));
        assertThat(plain.getSentimentLabel()).isNull();
        assertThat(mapper.toDecision(plain).sentiment()).isNull();
    }
}
