package uk.gegc.mdexport.features.markdown.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "mdexport.markdown")
public class MarkdownProperties {

    /**
     * Reading speed used for the reading time estimate.
     */
    @Min(value = 1, message = "mdexport.markdown.words-per-minute must be at least 1")
    private int wordsPerMinute = 200;
}
