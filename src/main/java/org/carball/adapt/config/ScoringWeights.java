package org.carball.adapt.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Weights of the composite score
 * {@code base * usage^u * cardinality^c * resource^r * skew^s + predicateBonus * predicateRatio}.
 * An exponent of zero removes that factor from the product.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoringWeights {

    @Builder.Default
    @JsonProperty("base_weight")
    private double baseWeight = 1.0;

    @Builder.Default
    @JsonProperty("usage_exponent")
    private double usageExponent = 1.0;

    @Builder.Default
    @JsonProperty("cardinality_exponent")
    private double cardinalityExponent = 1.0;

    @Builder.Default
    @JsonProperty("resource_exponent")
    private double resourceExponent = 1.0;

    @Builder.Default
    @JsonProperty("skew_exponent")
    private double skewExponent = 1.0;

    @Builder.Default
    @JsonProperty("predicate_bonus_weight")
    private double predicateBonusWeight = 0.2;

    public static ScoringWeights defaults() {
        return ScoringWeights.builder().build();
    }

    public String getDescription() {
        return String.format("base=%.2f, usage^%.2f, cardinality^%.2f, resource^%.2f, skew^%.2f, predicateBonus=%.2f",
                baseWeight, usageExponent, cardinalityExponent, resourceExponent, skewExponent, predicateBonusWeight);
    }
}
