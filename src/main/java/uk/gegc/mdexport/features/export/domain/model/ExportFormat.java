package uk.gegc.mdexport.features.export.domain.model;

/**
 * Output formats of the export pipeline.
 */
public enum ExportFormat {
    /**
     * HTML document opened in a print window; the user saves it as PDF from the print dialog
     */
    PRINT("PDF", "Print to PDF",
            "Print dialog opened. Choose \"Save as PDF\" in the print dialog."),

    /**
     * Office-namespaced HTML that Word opens as a document
     */
    WORD("Word", "Word-compatible document",
            "Document exported as a Word-compatible file."),

    /**
     * Self-contained, book-styled HTML page
     */
    EBOOK("HTML", "Web document (e-book style)",
            "Document exported as HTML (e-book format)."),

    /**
     * Single-file HTML slide deck with keyboard and touch navigation
     */
    SLIDES("Slides", "HTML presentation",
            "Document exported as an HTML presentation.");

    private final String label;
    private final String description;
    private final String successMessage;

    ExportFormat(String label, String description, String successMessage) {
        this.label = label;
        this.description = description;
        this.successMessage = successMessage;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    /**
     * Message shown to the user after a successful export.
     */
    public String successMessage() {
        return successMessage;
    }
}
