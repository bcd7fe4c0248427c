package uk.gegc.mdexport.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;
import uk.gegc.mdexport.features.export.domain.exception.ExportException;
import uk.gegc.mdexport.features.export.domain.exception.ExportValidationException;

import java.net.URI;
import java.time.Instant;

/**
 * Builds RFC 7807 {@link ProblemDetail} bodies for the export API.
 */
public final class ProblemDetailBuilder {

    private static final String WEB_REQUEST_URI_PREFIX = "uri=";

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            HttpServletRequest request
    ) {
        return build(status, type, title, detail, request != null ? request.getRequestURI() : null);
    }

    /**
     * Variant for {@code ResponseEntityExceptionHandler} overrides, which only get a {@link WebRequest}.
     */
    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            WebRequest request
    ) {
        String instance = null;
        if (request != null) {
            String description = request.getDescription(false);
            if (description != null) {
                instance = description.startsWith(WEB_REQUEST_URI_PREFIX)
                        ? description.substring(WEB_REQUEST_URI_PREFIX.length())
                        : description;
            }
        }
        return build(status, type, title, detail, instance);
    }

    /**
     * Maps a failed export to its problem detail. The detail is the exception's user-facing message;
     * validation failures also carry the full {@code violations} list.
     */
    public static ProblemDetail forExportError(ExportException ex, HttpServletRequest request) {
        ProblemDetail problem = create(statusOf(ex), typeOf(ex), titleOf(ex), ex.getMessage(), request);
        problem.setProperty("kind", ex.getKind().name());
        if (ex instanceof ExportValidationException validation) {
            problem.setProperty("violations", validation.getViolations());
        }
        return problem;
    }

    public static HttpStatus statusOf(ExportException ex) {
        return switch (ex.getKind()) {
            case EMPTY_CONTENT, VALIDATION -> HttpStatus.BAD_REQUEST;
            case POPUP_BLOCKED -> HttpStatus.CONFLICT;
            case GENERATION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static URI typeOf(ExportException ex) {
        return switch (ex.getKind()) {
            case EMPTY_CONTENT -> ErrorTypes.EMPTY_CONTENT;
            case VALIDATION -> ErrorTypes.VALIDATION_FAILED;
            case POPUP_BLOCKED -> ErrorTypes.POPUP_BLOCKED;
            case GENERATION -> ErrorTypes.GENERATION_FAILED;
        };
    }

    private static String titleOf(ExportException ex) {
        return switch (ex.getKind()) {
            case EMPTY_CONTENT -> "Empty Content";
            case VALIDATION -> "Validation Failed";
            case POPUP_BLOCKED -> "Print Window Blocked";
            case GENERATION -> "Export Failed";
        };
    }

    private static ProblemDetail build(HttpStatus status, URI type, String title, String detail, String instance) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (instance != null) {
            problem.setInstance(URI.create(instance));
        }
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
