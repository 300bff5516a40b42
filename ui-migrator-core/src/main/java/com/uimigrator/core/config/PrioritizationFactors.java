package com.uimigrator.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.uimigrator.core.model.ComponentType;

import java.util.Map;

/**
 * Weights used to score components when building a migration plan.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * prioritization:
 *   complexityWeight: 0.3
 *   dependentsWeight: 0.4
 *   dependenciesWeight: 0.2
 *   leafComponentBonus: 0.1
 *   rootComponentBonus: 0.0
 *   typeWeights:
 *     React: 0.05
 * }</pre>
 *
 * @param complexityWeight reward for low complexity
 * @param dependentsWeight reward per normalized count of dependents
 * @param dependenciesWeight penalty per normalized count of dependencies
 * @param leafComponentBonus bonus for components with no dependencies
 * @param rootComponentBonus bonus for components nothing depends on
 * @param typeWeights extra bonus keyed by component type label
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrioritizationFactors(
    @JsonProperty("complexityWeight") Double complexityWeight,
    @JsonProperty("dependentsWeight") Double dependentsWeight,
    @JsonProperty("dependenciesWeight") Double dependenciesWeight,
    @JsonProperty("leafComponentBonus") Double leafComponentBonus,
    @JsonProperty("rootComponentBonus") Double rootComponentBonus,
    @JsonProperty("typeWeights") Map<String, Double> typeWeights
) {
    public PrioritizationFactors {
        complexityWeight = complexityWeight == null ? 0.3 : complexityWeight;
        dependentsWeight = dependentsWeight == null ? 0.4 : dependentsWeight;
        dependenciesWeight = dependenciesWeight == null ? 0.2 : dependenciesWeight;
        leafComponentBonus = leafComponentBonus == null ? 0.1 : leafComponentBonus;
        rootComponentBonus = rootComponentBonus == null ? 0.0 : rootComponentBonus;
        typeWeights = typeWeights == null ? Map.of() : Map.copyOf(typeWeights);
    }

    public static PrioritizationFactors defaults() {
        return new PrioritizationFactors(null, null, null, null, null, null);
    }

    /**
     * Looks up the bonus for a type, 0 when none is configured.
     *
     * @param type component type
     * @return type bonus
     */
    public double typeWeight(ComponentType type) {
        return typeWeights.getOrDefault(type.label(), 0.0);
    }
}
