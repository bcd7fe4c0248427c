package uk.gegc.mdexport.features.export.application.watermark;

import java.util.List;
import java.util.Locale;

/**
 * Placement of one watermark copy, relative to the viewport.
 */
public record WatermarkLayer(
    double topPercent,
    double leftPercent,
    int rotationDegrees,
    double opacity,
    double sizeEm
) {
    /**
     * Centre, four corners and two off-axis bands.
     */
    public static final List<WatermarkLayer> LAYOUT = List.of(
            new WatermarkLayer(50, 50, -45, 0.10, 4.0),
            new WatermarkLayer(20, 20, -45, 0.08, 2.5),
            new WatermarkLayer(20, 80, -45, 0.08, 2.5),
            new WatermarkLayer(80, 20, -45, 0.08, 2.5),
            new WatermarkLayer(80, 80, -45, 0.08, 2.5),
            new WatermarkLayer(35, 50, -30, 0.06, 3.0),
            new WatermarkLayer(65, 50, -60, 0.06, 3.0)
    );

    public String inlineStyle() {
        return String.format(Locale.ROOT,
                "top:%.0f%%;left:%.0f%%;transform:translate(-50%%,-50%%) rotate(%ddeg);opacity:%.2f;font-size:%.1fem;",
                topPercent, leftPercent, rotationDegrees, opacity, sizeEm);
    }
}
