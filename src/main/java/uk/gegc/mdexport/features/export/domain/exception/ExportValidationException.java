package uk.gegc.mdexport.features.export.domain.exception;

import java.util.List;

/**
 * Carries every violation found in the export options, not only the first.
 */
public class ExportValidationException extends ExportException {

    private final List<String> violations;

    public ExportValidationException(List<String> violations) {
        super(ExportErrorKind.VALIDATION, "Invalid export options: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
