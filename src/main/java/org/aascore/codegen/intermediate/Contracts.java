package org.aascore.codegen.intermediate;

import java.util.List;

public record Contracts(List<Contract> preconditions, List<Snapshot> snapshots, List<Contract> postconditions) {

    public Contracts {
        preconditions = List.copyOf(preconditions);
        snapshots = List.copyOf(snapshots);
        postconditions = List.copyOf(postconditions);
    }
}
