package uk.gegc.mdexport.features.export.application;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.export.domain.exception.ExportValidationException;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;

import java.util.List;
import java.util.Set;

/**
 * Validates export options and reports every violation at once.
 */
@Component
@RequiredArgsConstructor
public class ExportOptionsValidator {

    private final Validator validator;

    /**
     * @throws ExportValidationException listing all violations, sorted by field
     */
    public void validate(ExportOptions options) {
        if (options == null) {
            throw new ExportValidationException(List.of("options: must not be null"));
        }
        Set<ConstraintViolation<ExportOptions>> violations = validator.validate(options);
        if (violations.isEmpty()) {
            return;
        }
        List<String> messages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();
        throw new ExportValidationException(messages);
    }
}
