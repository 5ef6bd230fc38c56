package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A symbolic, confidence-scored statement about what distinguished good from bad
 * decisions across two episodes.
 *
 * <ul>
 *   <li>{@code subject}   : factor name for {@link InsightType#FACTOR}, regime key for
 *       {@link InsightType#REGIME}. Used for tie-breaking and for locating the belief field.</li>
 *   <li>{@code confidence}: [0.0, 1.0]</li>
 * </ul>
 */
public record ConceptualInsight(
    @JsonProperty("id")              String          id,
    @JsonProperty("type")            InsightType     type,
    @JsonProperty("subject")         String          subject,
    @JsonProperty("concept")         String          concept,
    @JsonProperty("evidence")        List<String>    evidence,
    @JsonProperty("confidence")      double          confidence,
    @JsonProperty("sourceEpisode")   String          sourceEpisode,
    @JsonProperty("impactDirection") ImpactDirection impactDirection
) {

    public ConceptualInsight {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    /** Copy with a new confidence, used when retained priors decay. */
    public ConceptualInsight withConfidence(double newConfidence) {
        return new ConceptualInsight(id, type, subject, concept, evidence, newConfidence,
            sourceEpisode, impactDirection);
    }
}
