package uk.gegc.mdexport.features.export.infra;

import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;

@Component
public class ExportMediaTypeResolver {

    public static final String HTML = "text/html; charset=utf-8";
    public static final String MS_WORD = "application/msword";

    public String contentTypeFor(ExportFormat format) {
        return switch (format) {
            case PRINT, EBOOK, SLIDES -> HTML;
            case WORD -> MS_WORD;
        };
    }

    public String fileExtensionFor(ExportFormat format) {
        return switch (format) {
            case PRINT, EBOOK, SLIDES -> ".html";
            case WORD -> ".doc";
        };
    }
}
