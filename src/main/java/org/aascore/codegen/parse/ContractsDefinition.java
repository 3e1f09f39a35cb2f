package org.aascore.codegen.parse;

import java.util.List;

/**
 * Contracts of one method, each list in declaration order.
 */
public record ContractsDefinition(
        List<ContractDefinition> preconditions,
        List<SnapshotDefinition> snapshots,
        List<ContractDefinition> postconditions) {

    private static final ContractsDefinition EMPTY = new ContractsDefinition(List.of(), List.of(), List.of());

    public ContractsDefinition {
        preconditions = List.copyOf(preconditions);
        snapshots = List.copyOf(snapshots);
        postconditions = List.copyOf(postconditions);
    }

    public static ContractsDefinition empty() {
        return EMPTY;
    }
}
