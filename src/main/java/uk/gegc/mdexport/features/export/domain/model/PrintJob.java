package uk.gegc.mdexport.features.export.domain.model;

import java.time.Duration;

/**
 * Document handed to the host's print window.
 *
 * @param document    the print document; it triggers {@code print()} itself once loaded
 * @param settleDelay delay between the load event and the print call, already baked into the document
 */
public record PrintJob(GeneratedDocument document, Duration settleDelay) {
}
