package uk.gegc.mdexport.features.export.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "mdexport.export")
public class ExportProperties {

    /**
     * Base file name used when the export options carry no title.
     */
    @NotBlank(message = "Property mdexport.export.fallback-file-name must be configured")
    private String fallbackFileName = "document";

    /**
     * Delay between the print window's load event and the print call.
     */
    @NotNull(message = "Property mdexport.export.print-settle-delay-ms must be configured")
    @Min(value = 0, message = "mdexport.export.print-settle-delay-ms must not be negative")
    private Long printSettleDelayMs = 500L;

    @NotBlank(message = "Property mdexport.export.default-theme must be configured")
    private String defaultTheme = "default";

    /**
     * Adds the tamper-logging script to watermarked browser documents.
     */
    private boolean watermarkProtectionScript = true;
}
