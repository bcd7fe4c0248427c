package uk.gegc.mdexport.features.export.domain.model;

/**
 * Paper sizes for print output, portrait dimensions in CSS units.
 */
public enum PageSize {
    A4("210mm", "297mm"),
    LETTER("8.5in", "11in"),
    LEGAL("8.5in", "14in");

    private final String width;
    private final String height;

    PageSize(String width, String height) {
        this.width = width;
        this.height = height;
    }

    /**
     * @return {@code "<width> <height>"} for the given orientation, ready for {@code @page size}
     */
    public String cssSize(PageOrientation orientation) {
        return orientation == PageOrientation.LANDSCAPE
                ? height + " " + width
                : width + " " + height;
    }
}
