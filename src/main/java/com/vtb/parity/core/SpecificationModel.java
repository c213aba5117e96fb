package com.vtb.parity.core;

import com.vtb.parity.models.LinkSpec;
import com.vtb.parity.models.Operation;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Операции спецификации в порядке объявления. Только для чтения после загрузки.
 */
@Getter
public class SpecificationModel {

    private final String source;
    private final String title;
    private final String version;
    private final List<Operation> operations;
    private final Map<String, Operation> operationsById;

    public SpecificationModel(String source, String title, String version, List<Operation> operations) {
        this.source = source;
        this.title = title;
        this.version = version;
        this.operations = List.copyOf(operations);
        Map<String, Operation> byId = new LinkedHashMap<>();
        for (Operation operation : operations) {
            byId.put(operation.getOperationId(), operation);
        }
        this.operationsById = Collections.unmodifiableMap(byId);
    }

    public Optional<Operation> find(String operationId) {
        return Optional.ofNullable(operationsById.get(operationId));
    }

    public List<LinkSpec> links() {
        return operations.stream()
            .flatMap(operation -> operation.getLinks().stream())
            .collect(Collectors.toList());
    }

    /**
     * Копия без исключённых операций
     */
    public SpecificationModel without(Collection<String> excluded) {
        if (excluded == null || excluded.isEmpty()) {
            return this;
        }
        Set<String> skip = Set.copyOf(excluded);
        List<Operation> kept = operations.stream()
            .filter(operation -> !skip.contains(operation.getOperationId()))
            .collect(Collectors.toList());
        return new SpecificationModel(source, title, version, kept);
    }
}
