package com.cvrfplatform.belief.store;

import com.cvrfplatform.belief.model.BeliefRecord;
import com.cvrfplatform.belief.model.CycleRecord;
import com.cvrfplatform.belief.model.DecisionRecord;
import com.cvrfplatform.belief.model.EpisodeRecord;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.ConceptualInsight;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.Episode;
import com.cvrfplatform.common.model.EpisodeStatus;
import com.cvrfplatform.common.model.MarketRegime;
import com.cvrfplatform.common.model.SentimentLabel;
import com.cvrfplatform.common.model.SentimentSignal;
import com.cvrfplatform.common.model.TradeAction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Converts between the engine's records and the persisted rows.
 *
 * <p>Factor maps are stored as JSON. Rows written by older builds encode them as an
 * array of {@code [name, value]} pairs instead of an object; both encodings are
 * accepted on read and normalised into a name-sorted map, including inside cycle
 * payloads. Writes always use the object encoding.
 *
 * <p>Timestamps are persisted as UTC {@link LocalDateTime}.
 */
@Component
public class CvrfRecordMapper {

    private static final TypeReference<List<ConceptualInsight>> PRIORS_TYPE = new TypeReference<>() {};

    /** Payload fields that hold a factor name → value map. */
    private static final Set<String> FACTOR_MAP_FIELDS =
        Set.of("factors", "factorWeights", "factorConfidences", "factorAdjustments");

    private final ObjectMapper objectMapper;

    public CvrfRecordMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ── beliefs ──────────────────────────────────────────────────────────────

    public BeliefRecord toRecord(BeliefState state) {
        BeliefRecord r = new BeliefRecord();
        r.setUserId(state.userId());
        r.setVersion(state.version());
        r.setFactorWeights(writeJson(state.factorWeights(), "factor weights"));
        r.setFactorConfidences(writeJson(state.factorConfidences(), "factor confidences"));
        r.setCurrentRegime(state.currentRegime().name());
        r.setRegimeConfidence(state.regimeConfidence());
        r.setRiskTolerance(state.riskTolerance());
        r.setMaxDrawdownThreshold(state.maxDrawdownThreshold());
        r.setVolatilityTarget(state.volatilityTarget());
        r.setMomentumHorizon(state.momentumHorizon());
        r.setMeanReversionThreshold(state.meanReversionThreshold());
        r.setConcentrationLimit(state.concentrationLimit());
        r.setMinPositionSize(state.minPositionSize());
        r.setRebalanceThreshold(state.rebalanceThreshold());
        r.setConceptualPriors(writeJson(state.conceptualPriors(), "conceptual priors"));
        r.setUpdatedAt(toUtc(state.updatedAt()));
        return r;
    }

    public BeliefState toState(BeliefRecord r) {
        return new BeliefState(
            r.getUserId(),
            r.getVersion(),
            toInstant(r.getUpdatedAt()),
            readFactorMap(r.getFactorWeights()),
            readFactorMap(r.getFactorConfidences()),
            MarketRegime.valueOf(r.getCurrentRegime()),
            r.getRegimeConfidence(),
            r.getRiskTolerance(),
            r.getMaxDrawdownThreshold(),
            r.getVolatilityTarget(),
            r.getMomentumHorizon(),
            r.getMeanReversionThreshold(),
            r.getConcentrationLimit(),
            r.getMinPositionSize(),
            r.getRebalanceThreshold(),
            readPriors(r.getConceptualPriors()));
    }

    // ── episodes ─────────────────────────────────────────────────────────────

    public EpisodeRecord toRecord(Episode episode) {
        EpisodeRecord r = new EpisodeRecord();
        r.setId(episode.id());
        r.setUserId(episode.userId());
        r.setEpisodeNumber(episode.episodeNumber());
        r.setStartDate(toUtc(episode.startDate()));
        r.setEndDate(toUtc(episode.endDate()));
        r.setPortfolioReturn(episode.portfolioReturn());
        r.setSharpeRatio(episode.sharpeRatio());
        r.setMaxDrawdown(episode.maxDrawdown());
        r.setStatus(episode.status().name());
        return r;
    }

    public Episode toEpisode(EpisodeRecord r, List<DecisionRecord> decisionRows) {
        List<Decision> decisions = new ArrayList<>(decisionRows.size());
        decisionRows.forEach(d -> decisions.add(toDecision(d)));
        return new Episode(
            r.getId(),
            r.getUserId(),
            r.getEpisodeNumber(),
            toInstant(r.getStartDate()),
            toInstant(r.getEndDate()),
            decisions,
            r.getPortfolioReturn(),
            r.getSharpeRatio(),
            r.getMaxDrawdown(),
            EpisodeStatus.valueOf(r.getStatus()));
    }

    public DecisionRecord toRecord(String userId, String episodeId, int seq, Decision decision) {
        DecisionRecord r = new DecisionRecord();
        r.setId(decision.id());
        r.setEpisodeId(episodeId);
        r.setUserId(userId);
        r.setSeq(seq);
        r.setTimestamp(toUtc(decision.timestamp()));
        r.setSymbol(decision.symbol());
        r.setAction(decision.action().name());
        r.setWeightBefore(decision.weightBefore());
        r.setWeightAfter(decision.weightAfter());
        r.setReason(decision.reason());
        r.setConfidence(decision.confidence());
        r.setFactors(writeJson(decision.factors(), "decision factors"));
        if (decision.sentiment() != null) {
            r.setSentimentLabel(decision.sentiment().label().name());
            r.setSentimentConfidence(decision.sentiment().confidence());
        }
        r.setOutcomeReturn(decision.outcomeReturn());
        return r;
    }

    public Decision toDecision(DecisionRecord r) {
        return new Decision(
            r.getId(),
            r.getSymbol(),
            TradeAction.valueOf(r.getAction()),
            r.getWeightBefore(),
            r.getWeightAfter(),
            r.getReason(),
            r.getConfidence(),
            readFactorMap(r.getFactors()),
            r.getSentimentLabel() == null
                ? null
                : new SentimentSignal(SentimentLabel.valueOf(r.getSentimentLabel()),
                    r.getSentimentConfidence() == null ? 0.0 : r.getSentimentConfidence()),
            toInstant(r.getTimestamp()),
            r.getOutcomeReturn());
    }

    // ── cycle history ────────────────────────────────────────────────────────

    public CycleRecord toRecord(CvrfCycleResult result) {
        CycleRecord r = new CycleRecord();
        r.setId(result.cycleId());
        r.setUserId(result.userId());
        r.setCycleNumber(result.cycleNumber());
        r.setTimestamp(toUtc(result.timestamp()));
        r.setEarlierEpisodeId(result.episodeComparison().earlierEpisodeId());
        r.setLaterEpisodeId(result.episodeComparison().laterEpisodeId());
        r.setPerformanceDelta(result.episodeComparison().performanceDelta());
        r.setDecisionOverlap(result.episodeComparison().decisionOverlap());
        r.setLearningRate(result.learningRate());
        r.setBeliefChanged(result.beliefChanged());
        r.setBeliefVersion(result.newBeliefState().version());
        r.setPayload(writeJson(result, "cycle result"));
        return r;
    }

    public CvrfCycleResult toCycleResult(CycleRecord r) {
        try {
            JsonNode tree = objectMapper.readTree(r.getPayload());
            normalizeFactorMaps(tree);
            return objectMapper.treeToValue(tree, CvrfCycleResult.class);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize cycle result. cycleId=" + r.getId(), e);
        }
    }

    // ── factor maps ──────────────────────────────────────────────────────────

    /**
     * Reads either {@code {"momentum":0.4}} or {@code [["momentum",0.4]]}.
     * Null or blank input yields an empty map.
     */
    public SortedMap<String, Double> readFactorMap(String json) {
        if (json == null || json.isBlank()) {
            return new TreeMap<>();
        }
        try {
            return toFactorMap(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize factor map", e);
        }
    }

    private SortedMap<String, Double> toFactorMap(JsonNode node) {
        SortedMap<String, Double> out = new TreeMap<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                out.put(f.getKey(), f.getValue().asDouble());
            }
            return out;
        }
        if (node.isArray()) {
            for (JsonNode pair : node) {
                if (!pair.isArray() || pair.size() != 2) {
                    throw new IllegalStateException("Factor pair must be [name, value], was " + pair);
                }
                out.put(pair.get(0).asText(), pair.get(1).asDouble());
            }
            return out;
        }
        throw new IllegalStateException("Unsupported factor map encoding: " + node.getNodeType());
    }

    /** Rewrites every pair-array factor map in the tree into an object, in place. */
    private void normalizeFactorMaps(JsonNode node) {
        if (node instanceof ObjectNode obj) {
            List<String> names = new ArrayList<>();
            obj.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode child = obj.get(name);
                if (FACTOR_MAP_FIELDS.contains(name) && child.isArray()) {
                    ObjectNode normalized = objectMapper.createObjectNode();
                    toFactorMap(child).forEach(normalized::put);
                    obj.set(name, normalized);
                } else {
                    normalizeFactorMaps(child);
                }
            }
        } else if (node instanceof ArrayNode arr) {
            arr.forEach(this::normalizeFactorMaps);
        }
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private List<ConceptualInsight> readPriors(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, PRIORS_TYPE);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to deserialize conceptual priors", e);
        }
    }

    private String writeJson(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize " + what + " for persistence", e);
        }
    }

    static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant toInstant(LocalDateTime ldt) {
        return ldt == null ? null : ldt.toInstant(ZoneOffset.UTC);
    }
}
