package org.strata.migration;

import lombok.extern.slf4j.Slf4j;
import org.strata.migration.differs.ModelDiff;
import org.strata.migration.differs.ModelDiffer;
import org.strata.migration.graph.CycleBreaker;
import org.strata.migration.graph.DirectedGraph;
import org.strata.migration.graph.OperationGraphBuilder;
import org.strata.migration.graph.TopologicalSequencer;
import org.strata.migration.sorter.MigrationSorter;
import org.strata.model.GeneratedMigration;
import org.strata.model.MigrationRecord;
import org.strata.model.ModelDescriptor;
import org.strata.model.dependency.Dependency;
import org.strata.model.operation.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Plans the next migration of a group.
 * <p>
 * Pipeline: sort history → latest snapshot → diff → break foreign key cycles → order
 * operations → resolve dependencies → name the migration. Nothing is kept between calls.
 */
@Slf4j
public class MigrationPlanner {
    private final ModelDiffer differ;
    private final OperationGraphBuilder graphBuilder;
    private final CycleBreaker cycleBreaker;
    private final TopologicalSequencer sequencer;
    private final MigrationSorter sorter;
    private final MigrationNaming naming;

    public MigrationPlanner() {
        this(new MigrationNaming());
    }

    public MigrationPlanner(MigrationNaming naming) {
        this(new ModelDiffer(), new OperationGraphBuilder(), new CycleBreaker(), new TopologicalSequencer(),
                new MigrationSorter(), naming);
    }

    public MigrationPlanner(ModelDiffer differ, OperationGraphBuilder graphBuilder, CycleBreaker cycleBreaker,
                            TopologicalSequencer sequencer, MigrationSorter sorter, MigrationNaming naming) {
        this.differ = Objects.requireNonNull(differ, "differ must not be null");
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder must not be null");
        this.cycleBreaker = Objects.requireNonNull(cycleBreaker, "cycleBreaker must not be null");
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer must not be null");
        this.sorter = Objects.requireNonNull(sorter, "sorter must not be null");
        this.naming = Objects.requireNonNull(naming, "naming must not be null");
    }

    /**
     * @return the new migration, or empty when the declared models match the snapshot
     * @throws MigrationPlanningException when the input cannot be planned
     * @throws IllegalArgumentException when a current model belongs to another group
     */
    public Optional<GeneratedMigration> plan(PlanRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String group = Objects.requireNonNull(request.getGroupIdentifier(), "groupIdentifier must not be null");

        List<ModelDescriptor> current = assignGroup(group, request.getCurrentModels());
        MigrationHistory history = MigrationHistory.of(request.getMigrations(), sorter);
        List<ModelDescriptor> snapshot = history.latestModels(group);
        log.debug("Group '{}': {} declared models, {} models in snapshot",
                group, current.size(), snapshot.size());

        ModelDiff diff = differ.diff(current, snapshot);
        if (diff.isEmpty()) {
            log.debug("Group '{}': no changes detected", group);
            return Optional.empty();
        }

        List<Operation> operations = orderOperations(diff.getOperations());

        Optional<MigrationRecord> previous = history.lastMigration(group);
        ModelCatalog catalog = catalogFor(request, current, history, snapshot);
        List<Dependency> dependencies = new MigrationDependencyResolver(catalog).resolve(operations, previous);

        String identifier = previous
                .map(p -> naming.next(p.getMigrationIdentifier()))
                .orElseGet(naming::initial);
        log.debug("Group '{}': planned migration '{}' with {} operations and {} dependencies",
                group, identifier, operations.size(), dependencies.size());

        return Optional.of(GeneratedMigration.builder()
                .groupIdentifier(group)
                .migrationIdentifier(identifier)
                .modifiedModels(diff.getModifiedModels())
                .dependencies(dependencies)
                .operations(operations)
                .build());
    }

    /**
     * Breaks foreign key cycles and puts the operations into dependency order.
     */
    public List<Operation> orderOperations(List<Operation> operations) {
        List<Operation> acyclic = cycleBreaker.breakCycles(operations);
        // 순환 제거 후 그래프를 다시 만들어야 함
        DirectedGraph graph = graphBuilder.build(acyclic);
        return sequencer.sequence(acyclic, graph);
    }

    /**
     * 그룹이 비어 있는 모델은 요청 그룹으로 채운다.
     */
    private static List<ModelDescriptor> assignGroup(String group, List<ModelDescriptor> models) {
        List<ModelDescriptor> assigned = new ArrayList<>(models.size());
        for (ModelDescriptor model : models) {
            String declared = model.getGroupIdentifier();
            if (declared == null) {
                assigned.add(model.toBuilder().groupIdentifier(group).build());
            } else if (declared.equals(group)) {
                assigned.add(model);
            } else {
                throw new IllegalArgumentException("Model '" + model.getTableName() + "' belongs to group '"
                        + declared + "', not to '" + group + "'");
            }
        }
        return assigned;
    }

    private static ModelCatalog catalogFor(PlanRequest request, List<ModelDescriptor> current,
                                           MigrationHistory history, List<ModelDescriptor> snapshot) {
        ModelCatalog catalog = new ModelCatalog()
                .register(current)
                .register(snapshot);
        for (String other : history.getGroups()) {
            if (!other.equals(request.getGroupIdentifier())) {
                catalog.register(history.latestModels(other));
            }
        }
        return catalog.registerExternal(request.getExternalModels());
    }
}
