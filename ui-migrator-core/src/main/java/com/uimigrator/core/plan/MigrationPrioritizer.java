package com.uimigrator.core.plan;

import com.uimigrator.core.config.PrioritizationFactors;
import com.uimigrator.core.graph.CycleDetector;
import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.MigrationState;
import com.uimigrator.core.store.ComponentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Scores waiting components and orders them into a dependency-respecting migration plan.
 *
 * <p><b>Score:</b>
 * <pre>
 *   dependentsWeight   * dependents   / maxDependents
 * + complexityWeight   * (1 - complexity / maxComplexity)
 * - dependenciesWeight * dependencies / maxDependencies
 * + leafComponentBonus   (no dependencies)
 * + rootComponentBonus   (no dependents)
 * + typeWeights[type]
 * </pre>
 * Maxima are taken over the tracked components; a zero maximum contributes nothing.
 *
 * <p><b>Plan:</b> a component is ready once each of its dependencies is completed or placed
 * earlier in the plan. The ready component with the highest score goes next, ties broken by
 * ID. When no component is ready, a component whose remaining dependencies failed, were
 * skipped or are in progress goes next (fewest such dependencies first); its dependents in
 * the plan still follow it. Only when every remaining component waits on another one in the
 * plan is a dependency cycle broken. The plan always holds every waiting component.
 */
public class MigrationPrioritizer {

    private static final Logger log = LoggerFactory.getLogger(MigrationPrioritizer.class);

    private static final Comparator<PrioritizedComponent> BY_PRIORITY =
        Comparator.comparingDouble(PrioritizedComponent::score).reversed()
            .thenComparing(PrioritizedComponent::id);

    private final PrioritizationFactors factors;

    public MigrationPrioritizer(PrioritizationFactors factors) {
        this.factors = factors == null ? PrioritizationFactors.defaults() : factors;
    }

    public PrioritizationFactors factors() {
        return factors;
    }

    /**
     * Scores every {@link MigrationState#NOT_STARTED} component.
     *
     * @param store component store
     * @return scored components, highest score first
     */
    public List<PrioritizedComponent> prioritize(ComponentStore store) {
        int maxDependents = 0;
        int maxDependencies = 0;
        int maxComplexity = 0;
        for (ComponentMetadata component : store.getAll()) {
            maxDependents = Math.max(maxDependents, component.dependents().size());
            maxDependencies = Math.max(maxDependencies, component.dependencies().size());
            maxComplexity = Math.max(maxComplexity, component.complexity());
        }

        List<PrioritizedComponent> scored = new ArrayList<>();
        for (ComponentMetadata component : store.getByStatus(MigrationState.NOT_STARTED)) {
            PrioritizedComponent.ScoreBreakdown breakdown = new PrioritizedComponent.ScoreBreakdown(
                factors.dependentsWeight() * ratio(component.dependents().size(), maxDependents),
                factors.complexityWeight() * (1.0 - ratio(component.complexity(), maxComplexity)),
                -factors.dependenciesWeight() * ratio(component.dependencies().size(), maxDependencies),
                component.dependencies().isEmpty() ? factors.leafComponentBonus() : 0.0,
                component.dependents().isEmpty() ? factors.rootComponentBonus() : 0.0,
                factors.typeWeight(component.componentType())
            );
            scored.add(new PrioritizedComponent(
                component,
                breakdown.total(),
                breakdown,
                outstanding(store, component, Set.of())
            ));
        }
        scored.sort(BY_PRIORITY);
        return scored;
    }

    /**
     * Orders every {@link MigrationState#NOT_STARTED} component for migration.
     *
     * <p>An empty plan means nothing is left to migrate.
     *
     * @param store component store
     * @return components in migration order
     */
    public List<ComponentMetadata> generateMigrationPlan(ComponentStore store) {
        Map<String, PrioritizedComponent> remaining = new LinkedHashMap<>();
        for (PrioritizedComponent candidate : prioritize(store)) {
            remaining.put(candidate.id(), candidate);
        }

        Set<String> placed = new HashSet<>();
        List<ComponentMetadata> plan = new ArrayList<>(remaining.size());
        int blocked = 0;
        int forced = 0;
        while (!remaining.isEmpty()) {
            // remaining is in priority order, so the first ready entry is the best one
            Optional<PrioritizedComponent> next = remaining.values().stream()
                .filter(candidate -> outstanding(store, candidate.component(), placed) == 0)
                .findFirst();
            if (next.isEmpty()) {
                // only waiting on components outside the plan: failed, skipped or in progress
                next = remaining.values().stream()
                    .filter(candidate -> waitingOn(candidate.component(), remaining.keySet()) == 0)
                    .min(Comparator.comparingInt(
                            (PrioritizedComponent candidate) -> outstanding(store, candidate.component(), placed))
                        .thenComparing(BY_PRIORITY));
                if (next.isPresent()) {
                    blocked++;
                }
            }
            if (next.isEmpty()) {
                next = Optional.of(breakCycle(remaining));
                forced++;
            }
            PrioritizedComponent chosen = next.orElseThrow();
            plan.add(chosen.component());
            placed.add(chosen.id());
            remaining.remove(chosen.id());
        }

        if (blocked > 0 || forced > 0) {
            log.debug("Placed {} components behind unfinished dependencies and broke {} cycles", blocked, forced);
        }
        return plan;
    }

    /**
     * Picks the member of a cycle to place first.
     *
     * <p>Only cycles that wait on nothing else in the plan qualify, so components that merely
     * depend on a cycle still follow it. Within that cycle the member waiting on the fewest
     * planned components goes first, then by score and ID.
     */
    private static PrioritizedComponent breakCycle(Map<String, PrioritizedComponent> remaining) {
        SortedMap<String, Set<String>> adjacency = new TreeMap<>();
        for (PrioritizedComponent candidate : remaining.values()) {
            Set<String> waiting = new TreeSet<>(candidate.component().dependencies());
            waiting.retainAll(remaining.keySet());
            adjacency.put(candidate.id(), waiting);
        }

        Comparator<PrioritizedComponent> byWaiting = Comparator.comparingInt(
                (PrioritizedComponent candidate) -> adjacency.get(candidate.id()).size())
            .thenComparing(BY_PRIORITY);
        for (List<String> cycle : CycleDetector.findCycles(adjacency)) {
            boolean closed = cycle.stream().allMatch(id -> cycle.containsAll(adjacency.get(id)));
            if (closed) {
                return cycle.stream().map(remaining::get).min(byWaiting).orElseThrow();
            }
        }
        // every remaining component waits on another one, so a closed cycle always exists
        return remaining.values().stream().min(byWaiting).orElseThrow();
    }

    /**
     * Counts dependencies that are still waiting in the plan.
     */
    private static int waitingOn(ComponentMetadata component, Set<String> remaining) {
        int count = 0;
        for (String dependencyId : component.dependencies()) {
            if (remaining.contains(dependencyId)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Counts dependencies that are neither completed nor already placed.
     *
     * <p>Dependencies that are no longer tracked are ignored.
     */
    private static int outstanding(ComponentStore store, ComponentMetadata component, Set<String> placed) {
        int count = 0;
        for (String dependencyId : component.dependencies()) {
            if (placed.contains(dependencyId)) {
                continue;
            }
            Optional<ComponentMetadata> dependency = store.get(dependencyId);
            if (dependency.isPresent() && !dependency.get().status().isCompleted()) {
                count++;
            }
        }
        return count;
    }

    private static double ratio(int value, int max) {
        return max == 0 ? 0.0 : (double) value / max;
    }
}
