package com.uimigrator.core.migration;

import com.uimigrator.core.analyzer.ComponentAnalyzer;
import com.uimigrator.core.generator.ComponentGenerator;
import com.uimigrator.core.model.ComponentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Pairs each supported component type with its analyzer and generator.
 *
 * <p>Types with an analyzer but no generator can still be discovered and tracked; migrating
 * them fails with an unsupported-type error.
 */
public final class MigrationRegistry {

    private static final Logger log = LoggerFactory.getLogger(MigrationRegistry.class);

    /**
     * Analyzer and generator for one component type.
     *
     * @param analyzer analyzer for the type
     * @param generator generator for the type, may be null
     */
    public record Pipeline(ComponentAnalyzer analyzer, ComponentGenerator generator) {
        public Pipeline {
            Objects.requireNonNull(analyzer, "analyzer must not be null");
        }

        public Optional<ComponentGenerator> generatorIfPresent() {
            return Optional.ofNullable(generator);
        }
    }

    private final Map<ComponentType, Pipeline> pipelines;

    private MigrationRegistry(Map<ComponentType, Pipeline> pipelines) {
        this.pipelines = Collections.unmodifiableMap(new LinkedHashMap<>(pipelines));
    }

    /**
     * Builds a registry from the analyzers and generators on the class path.
     *
     * @return registry of every discovered pipeline
     */
    public static MigrationRegistry loadDefault() {
        List<ComponentAnalyzer> analyzers = ServiceLoader.load(ComponentAnalyzer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
        List<ComponentGenerator> generators = ServiceLoader.load(ComponentGenerator.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
        log.debug("Loaded {} analyzers and {} generators", analyzers.size(), generators.size());
        return of(analyzers, generators);
    }

    /**
     * Builds a registry from explicit instances.
     *
     * <p>When two analyzers or two generators claim the same type the first one wins.
     *
     * @param analyzers analyzers, one per type
     * @param generators generators, one per type
     * @return registry
     */
    public static MigrationRegistry of(List<? extends ComponentAnalyzer> analyzers,
                                       List<? extends ComponentGenerator> generators) {
        Map<ComponentType, ComponentGenerator> generatorsByType = new LinkedHashMap<>();
        for (ComponentGenerator generator : generators) {
            if (generatorsByType.putIfAbsent(generator.getComponentType(), generator) != null) {
                log.warn("Ignoring duplicate generator {} for type {}", generator.getId(), generator.getComponentType());
            }
        }
        Map<ComponentType, Pipeline> pipelines = new LinkedHashMap<>();
        for (ComponentAnalyzer analyzer : analyzers) {
            ComponentType type = analyzer.getComponentType();
            if (pipelines.containsKey(type)) {
                log.warn("Ignoring duplicate analyzer {} for type {}", analyzer.getId(), type);
                continue;
            }
            pipelines.put(type, new Pipeline(analyzer, generatorsByType.get(type)));
        }
        return new MigrationRegistry(pipelines);
    }

    public Optional<Pipeline> pipeline(ComponentType type) {
        return Optional.ofNullable(pipelines.get(type));
    }

    public List<ComponentAnalyzer> analyzers() {
        return pipelines.values().stream().map(Pipeline::analyzer).toList();
    }

    public Map<ComponentType, Pipeline> pipelines() {
        return pipelines;
    }
}
