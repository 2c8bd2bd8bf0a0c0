package org.strata.migration.graph;

import org.strata.model.FieldDescriptor;
import org.strata.model.operation.AddField;
import org.strata.model.operation.CreateModel;
import org.strata.model.operation.Operation;
import org.strata.model.operation.OperationVisitor;
import org.strata.model.operation.RemoveField;
import org.strata.model.operation.RemoveModel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Which model types an operation list creates and which types each operation refers to.
 * Shared by the graph builder and the migration dependency resolver.
 */
public final class OperationReferences {

    /**
     * One "operation {@code operationIndex} needs type {@code targetType}" fact.
     *
     * @param field the foreign key field behind the reference, or {@code null} when an
     *              {@link AddField} refers to the table it is added to
     */
    public record Reference(int operationIndex, String targetType, FieldDescriptor field) {
        public boolean isForeignKey() {
            return field != null;
        }
    }

    private OperationReferences() {
    }

    /**
     * 모델 타입 → 그 모델을 생성하는 CreateModel 인덱스
     */
    public static Map<String, Integer> providers(List<Operation> operations) {
        Map<String, Integer> providers = new HashMap<>();
        for (int i = 0; i < operations.size(); i++) {
            if (operations.get(i) instanceof CreateModel create) {
                providers.put(create.typeIdentifier(), i);
            }
        }
        return providers;
    }

    /**
     * All references in operation order. {@link CreateModel} contributes one per foreign key
     * field, {@link AddField} its owning table followed by its own foreign key, removals
     * nothing.
     */
    public static List<Reference> collect(List<Operation> operations) {
        List<Reference> references = new ArrayList<>();
        for (int i = 0; i < operations.size(); i++) {
            references.addAll(operations.get(i).accept(new ReferenceCollector(i)));
        }
        return references;
    }

    private static final class ReferenceCollector implements OperationVisitor<List<Reference>> {
        private final int index;

        private ReferenceCollector(int index) {
            this.index = index;
        }

        @Override
        public List<Reference> visitCreateModel(CreateModel operation) {
            List<Reference> refs = new ArrayList<>();
            for (FieldDescriptor field : operation.fields()) {
                field.getForeignKey().ifPresent(target -> refs.add(new Reference(index, target, field)));
            }
            return refs;
        }

        @Override
        public List<Reference> visitAddField(AddField operation) {
            List<Reference> refs = new ArrayList<>();
            // 컬럼을 추가하려면 테이블이 먼저 존재해야 함
            refs.add(new Reference(index, operation.typeIdentifier(), null));
            operation.field().getForeignKey()
                    .ifPresent(target -> refs.add(new Reference(index, target, operation.field())));
            return refs;
        }

        @Override
        public List<Reference> visitRemoveField(RemoveField operation) {
            return List.of();
        }

        @Override
        public List<Reference> visitRemoveModel(RemoveModel operation) {
            return List.of();
        }
    }
}
