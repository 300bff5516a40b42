package com.uimigrator.core.plan;

import com.uimigrator.core.model.ComponentMetadata;

import java.util.Objects;

/**
 * A component waiting to be migrated, with its priority score.
 *
 * @param component the component
 * @param score weighted priority, higher goes first
 * @param factors contribution of each weight to the score
 * @param outstandingDependencies dependencies that are not completed yet
 */
public record PrioritizedComponent(
    ComponentMetadata component,
    double score,
    ScoreBreakdown factors,
    int outstandingDependencies
) {
    public PrioritizedComponent {
        Objects.requireNonNull(component, "component must not be null");
        Objects.requireNonNull(factors, "factors must not be null");
    }

    public String id() {
        return component.id();
    }

    /**
     * Per-factor contributions; they sum to the score.
     *
     * @param dependents reward for components that depend on this one
     * @param complexity reward for low complexity
     * @param dependencies penalty for this component's own dependencies, zero or negative
     * @param leafBonus bonus for having no dependencies
     * @param rootBonus bonus for having no dependents
     * @param typeWeight configured bonus for the component type
     */
    public record ScoreBreakdown(
        double dependents,
        double complexity,
        double dependencies,
        double leafBonus,
        double rootBonus,
        double typeWeight
    ) {
        public double total() {
            return dependents + complexity + dependencies + leafBonus + rootBonus + typeWeight;
        }
    }
}
