package com.designsync.engine.exception;

import com.designsync.engine.dto.graph.StructuralViolation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown before traversal when a document breaks an ownership or identity invariant.
 */
public class DocumentStructureException extends RuntimeException {

    private final List<StructuralViolation> violations;

    public DocumentStructureException(String documentName, List<StructuralViolation> violations) {
        super("Document '" + documentName + "' is structurally invalid: " + violations.stream()
                .map(StructuralViolation::getDescription)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<StructuralViolation> getViolations() {
        return violations;
    }

    public List<String> getOffendingNodeIds() {
        return violations.stream()
                .flatMap(v -> v.getNodeIds().stream())
                .distinct()
                .collect(Collectors.toList());
    }
}
