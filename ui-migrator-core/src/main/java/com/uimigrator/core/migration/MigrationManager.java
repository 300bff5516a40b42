package com.uimigrator.core.migration;

import com.uimigrator.core.complexity.ComplexityScorer;
import com.uimigrator.core.config.MigrationConfig;
import com.uimigrator.core.discovery.ComponentDiscovery;
import com.uimigrator.core.discovery.DiscoveryReport;
import com.uimigrator.core.exceptions.AnalysisException;
import com.uimigrator.core.exceptions.ComponentMigrationException;
import com.uimigrator.core.exceptions.GenerationException;
import com.uimigrator.core.exceptions.InvalidTransitionException;
import com.uimigrator.core.exceptions.MigrationException;
import com.uimigrator.core.generator.ComponentGenerator;
import com.uimigrator.core.graph.DependencyGraphBuilder;
import com.uimigrator.core.graph.GraphBuildResult;
import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.MigrationState;
import com.uimigrator.core.model.MigrationStats;
import com.uimigrator.core.model.MigrationStatus;
import com.uimigrator.core.model.ParsedComponent;
import com.uimigrator.core.plan.MigrationPrioritizer;
import com.uimigrator.core.plan.PrioritizedComponent;
import com.uimigrator.core.store.ComponentStore;
import com.uimigrator.core.store.StoreFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives the migration: discovery, graph building, planning and batched execution.
 *
 * <p>Every status change is saved to the store file before the next step starts, so a run can
 * be interrupted between any two components and resumed by invoking it again. Components left
 * {@link MigrationState#IN_PROGRESS} by an interrupted run are reset to
 * {@link MigrationState#NOT_STARTED} at start-up.
 *
 * <p>Not thread-safe. One manager owns its store; every mutation happens on the calling thread.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MigrationConfig config = ConfigLoader.load(Path.of("ui-migrator.yaml"));
 * MigrationManager manager = MigrationManager.create(config);
 * MigrationStats stats = manager.runMigration();
 * System.out.print(stats.progressSummary());
 * }</pre>
 */
public class MigrationManager {

    private static final Logger log = LoggerFactory.getLogger(MigrationManager.class);

    private static final String COMPONENTS_DIR = "components";

    private final MigrationConfig config;
    private final ComponentStore store;
    private final MigrationRegistry registry;
    private final ComponentDiscovery discovery;
    private final DependencyGraphBuilder graphBuilder;
    private final MigrationPrioritizer prioritizer;

    public MigrationManager(MigrationConfig config, ComponentStore store, MigrationRegistry registry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.discovery = new ComponentDiscovery(registry, new ComplexityScorer());
        this.graphBuilder = new DependencyGraphBuilder();
        this.prioritizer = new MigrationPrioritizer(config.prioritization());
    }

    /**
     * Creates a manager over the configured store file and the analyzers and generators on the
     * class path.
     *
     * @param config migration configuration
     * @return manager
     */
    public static MigrationManager create(MigrationConfig config) {
        return new MigrationManager(config, StoreFile.load(config.storeFile()), MigrationRegistry.loadDefault());
    }

    /**
     * Prepares the store: resets interrupted components, discovers components in every source
     * root, rebuilds the dependency graph when enabled and saves.
     *
     * @return initialization summary
     * @throws IOException if the store cannot be saved
     */
    public InitializationResult initialize() throws IOException {
        log.info("Initializing migration over {} source roots", config.sourceRoots().size());
        int reconciled = reconcileInterrupted();
        DiscoveryReport report = discovery.discover(store, config.sourceRootPaths());
        GraphBuildResult graph = null;
        if (config.autoDetectDependencies()) {
            graph = graphBuilder.build(store);
        }
        save();
        return new InitializationResult(reconciled, report, graph);
    }

    /**
     * Rebuilds the dependency graph from the stored hints and saves.
     *
     * @return graph build summary
     * @throws IOException if the store cannot be saved
     */
    public GraphBuildResult rebuildGraph() throws IOException {
        GraphBuildResult result = graphBuilder.build(store);
        save();
        return result;
    }

    /**
     * Resets components left in progress by an interrupted run.
     *
     * <p>Each reset component gets a note recording the reset.
     *
     * @return number of components reset
     * @throws IOException if the store cannot be saved
     */
    public int reconcileInterrupted() throws IOException {
        List<ComponentMetadata> interrupted = store.getByStatus(MigrationState.IN_PROGRESS);
        if (interrupted.isEmpty()) {
            return 0;
        }
        Instant now = Instant.now();
        for (ComponentMetadata component : interrupted) {
            String note = "Reset from In Progress after an interrupted run at " + now;
            store.replace(component.withStatus(MigrationStatus.notStarted(), now)
                .withNotes(appendNote(component.notes(), note)));
            log.warn("Component {} ({}) was left in progress by an interrupted run; reset to Not Started",
                component.name(), component.id());
        }
        save();
        return interrupted.size();
    }

    /**
     * Returns the full migration plan.
     *
     * @return waiting components in migration order
     */
    public List<ComponentMetadata> plan() {
        return prioritizer.generateMigrationPlan(store);
    }

    public List<PrioritizedComponent> prioritize() {
        return prioritizer.prioritize(store);
    }

    /**
     * Returns the next batch: the first {@code batchSize} entries of the plan.
     *
     * @return components to migrate next, empty when the migration is complete
     */
    public List<ComponentMetadata> nextBatch() {
        List<ComponentMetadata> plan = plan();
        return List.copyOf(plan.subList(0, Math.min(config.batchSize(), plan.size())));
    }

    /**
     * Migrates one component.
     *
     * <p>The component moves to In Progress (saved), is re-analyzed from its current source and
     * generated into {@code <outputDir>/components/<type>/}. On success it is Completed with its
     * migrated path recorded; on failure it is Skipped when skip-on-error is enabled and Failed
     * otherwise. Either way the store is saved before returning.
     *
     * @param id component ID
     * @return path of the generated file
     * @throws com.uimigrator.core.exceptions.ComponentNotFoundException if the ID is unknown; the store is unchanged
     * @throws InvalidTransitionException if the component is not Not Started; the store is unchanged
     * @throws ComponentMigrationException if analysis or generation failed; the failure is recorded
     * @throws IOException if the store cannot be saved
     */
    public Path migrateComponent(String id) throws MigrationException, IOException {
        ComponentMetadata component = store.require(id);
        MigrationState current = component.status().state();
        if (!current.canTransitionTo(MigrationState.IN_PROGRESS)) {
            throw new InvalidTransitionException(id, current, MigrationState.IN_PROGRESS);
        }

        log.info("Migrating {} component {} ({})", component.componentType(), component.name(), id);
        store.updateStatus(id, MigrationStatus.inProgress());
        save();

        Path migratedPath;
        try {
            migratedPath = translate(component);
        } catch (AnalysisException | GenerationException | RuntimeException e) {
            throw recordFailure(component, e);
        }

        store.updateMigratedPath(id, migratedPath.toString());
        store.updateStatus(id, MigrationStatus.completed());
        save();
        log.info("Migrated {} to {}", component.name(), migratedPath);
        return migratedPath;
    }

    /**
     * Migrates the next batch.
     *
     * <p>With skip-on-error enabled, failing components are skipped and the batch continues;
     * otherwise the first failure aborts the batch.
     *
     * @return batch summary, empty when nothing is left to migrate
     * @throws ComponentMigrationException if a component failed and skip-on-error is disabled
     * @throws MigrationException if a planned component can no longer be migrated
     * @throws IOException if the store cannot be saved
     */
    public BatchResult migrateBatch() throws MigrationException, IOException {
        List<ComponentMetadata> batch = nextBatch();
        if (batch.isEmpty()) {
            return BatchResult.empty();
        }

        List<String> attempted = new ArrayList<>();
        List<String> completed = new ArrayList<>();
        Map<String, String> skipped = new LinkedHashMap<>();
        for (ComponentMetadata component : batch) {
            attempted.add(component.id());
            try {
                migrateComponent(component.id());
                completed.add(component.id());
            } catch (ComponentMigrationException e) {
                if (!config.skipOnError()) {
                    throw e;
                }
                skipped.put(component.id(), e.getMessage());
            }
        }
        log.info("Batch finished: {} completed, {} skipped", completed.size(), skipped.size());
        return new BatchResult(attempted, completed, skipped);
    }

    /**
     * Runs batches until the plan is empty.
     *
     * <p>An empty store is initialized first; otherwise interrupted components are reset and
     * the existing store is resumed. Completed components are never processed again.
     *
     * @return final statistics
     * @throws ComponentMigrationException if a component failed and skip-on-error is disabled
     * @throws MigrationException if a planned component can no longer be migrated
     * @throws IOException if the store cannot be saved
     */
    public MigrationStats runMigration() throws MigrationException, IOException {
        if (store.isEmpty()) {
            initialize();
        } else {
            reconcileInterrupted();
        }

        int batches = 0;
        while (true) {
            BatchResult result = migrateBatch();
            if (result.isEmpty()) {
                break;
            }
            batches++;
            log.info("Batch {} done. {}", batches, store.progressSummary().lines().findFirst().orElse(""));
        }

        MigrationStats stats = store.stats();
        log.info("Migration finished after {} batches: {} completed, {} failed, {} skipped",
            batches, stats.completed(), stats.failed(), stats.skipped());
        return stats;
    }

    /**
     * Puts a failed, skipped or stuck component back into the plan.
     *
     * <p>This is an operator action outside the automatic state machine. Completed components
     * cannot be re-queued.
     *
     * @param id component ID
     * @return true if the component was reset, false if it was already waiting
     * @throws com.uimigrator.core.exceptions.ComponentNotFoundException if the ID is unknown
     * @throws InvalidTransitionException if the component is completed
     * @throws IOException if the store cannot be saved
     */
    public boolean requeue(String id) throws MigrationException, IOException {
        ComponentMetadata component = store.require(id);
        MigrationStatus status = component.status();
        if (status.isNotStarted()) {
            return false;
        }
        if (status.isCompleted()) {
            throw new InvalidTransitionException(id, MigrationState.COMPLETED, MigrationState.NOT_STARTED);
        }
        store.replace(component.withStatus(MigrationStatus.notStarted(), Instant.now())
            .withMigratedPath(null)
            .withNotes(appendNote(component.notes(), "Re-queued after " + status)));
        save();
        log.info("Re-queued {} ({}), previously {}", component.name(), id, status);
        return true;
    }

    /**
     * Re-queues every failed and skipped component.
     *
     * @return number of components re-queued
     * @throws IOException if the store cannot be saved
     */
    public int requeueFailed() throws MigrationException, IOException {
        List<ComponentMetadata> candidates = new ArrayList<>(store.getByStatus(MigrationState.FAILED));
        candidates.addAll(store.getByStatus(MigrationState.SKIPPED));
        int count = 0;
        for (ComponentMetadata component : candidates) {
            if (requeue(component.id())) {
                count++;
            }
        }
        return count;
    }

    public ComponentStore store() {
        return store;
    }

    public MigrationConfig config() {
        return config;
    }

    public MigrationStats stats() {
        return store.stats();
    }

    public void save() throws IOException {
        StoreFile.save(store, config.storeFile());
    }

    private Path translate(ComponentMetadata component) throws AnalysisException, GenerationException {
        ComponentType type = component.componentType();
        MigrationRegistry.Pipeline pipeline = registry.pipeline(type)
            .orElseThrow(() -> new AnalysisException("Unsupported component type: " + type));
        ComponentGenerator generator = pipeline.generatorIfPresent()
            .orElseThrow(() -> new GenerationException("Unsupported component type: " + type));

        Path file = Path.of(component.filePath());
        if (!Files.isRegularFile(file)) {
            throw new AnalysisException("Component file not found: " + file);
        }

        ParsedComponent parsed;
        try {
            parsed = pipeline.analyzer().analyzeFile(file)
                .orElseThrow(() -> new AnalysisException(type + " component not found in analyzer: " + component.name()));
        } catch (IOException e) {
            throw new AnalysisException("Failed to read " + file + ": " + e.getMessage(), e);
        }

        Path outputDir = config.outputDirectory().resolve(COMPONENTS_DIR).resolve(type.directoryName());
        return generator.generate(parsed, outputDir);
    }

    private ComponentMigrationException recordFailure(ComponentMetadata component, Exception cause) throws IOException {
        String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        MigrationStatus status = config.skipOnError()
            ? MigrationStatus.skipped(reason)
            : MigrationStatus.failed(reason);
        ComponentMetadata current = store.get(component.id()).orElse(component);
        store.replace(current.withStatus(status, Instant.now()));
        save();
        log.warn("Migration of {} ({}) failed, marked {}: {}", component.name(), component.id(),
            status.state().displayName(), reason);
        return new ComponentMigrationException(component.id(), reason, cause);
    }

    private static String appendNote(String existing, String note) {
        return existing == null || existing.isBlank() ? note : existing + "; " + note;
    }
}
