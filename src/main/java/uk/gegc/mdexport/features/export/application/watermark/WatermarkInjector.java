package uk.gegc.mdexport.features.export.application.watermark;

import org.jsoup.Jsoup;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.zip.CRC32;

/**
 * Overlays repeated watermark copies on a complete HTML document and embeds a hidden
 * forensic record (encoded text, timestamp, id and checksum).
 *
 * <p>This is a deterrent. Anyone with the file can strip the markup.
 */
@Component
public class WatermarkInjector {

    static final String CONTAINER_CLASS = "wm-container";
    static final String LAYER_CLASS = "wm-layer";
    static final String OVERLAY_CLASS = "wm-print-overlay";
    static final String FORENSIC_CLASS = "wm-forensic";
    static final String STYLE_ID = "wm-style";

    private static final String STYLES = """
            .wm-container{position:fixed;inset:0;pointer-events:none;z-index:9999;overflow:hidden;}
            .wm-layer{position:absolute;white-space:nowrap;font-weight:bold;color:#808080;\
            user-select:none;-webkit-user-select:none;-webkit-user-drag:none;pointer-events:none;}
            .wm-print-overlay{display:none;}
            .wm-forensic{display:none !important;}
            @media print{
            .wm-container,.wm-layer,.wm-print-overlay{-webkit-print-color-adjust:exact;print-color-adjust:exact;color-adjust:exact;}
            .wm-print-overlay{display:flex;position:fixed;inset:0;align-items:center;justify-content:center;\
            font-size:5em;font-weight:bold;color:#808080;opacity:0.08;transform:rotate(-45deg);pointer-events:none;z-index:10000;}
            }
            """;

    private final Clock clock;
    private final WatermarkProtectionDecorator protectionDecorator;
    private final Supplier<String> idSource;

    @Autowired
    public WatermarkInjector(Clock clock, WatermarkProtectionDecorator protectionDecorator) {
        this(clock, protectionDecorator, () -> UUID.randomUUID().toString());
    }

    WatermarkInjector(Clock clock, WatermarkProtectionDecorator protectionDecorator, Supplier<String> idSource) {
        this.clock = clock;
        this.protectionDecorator = protectionDecorator;
        this.idSource = idSource;
    }

    /**
     * Returns the document with watermark layers added, or unchanged when {@code text} is blank.
     *
     * @param html             a complete HTML document
     * @param text             watermark text, unescaped
     * @param protectionScript whether to add the browser tamper-logging script
     */
    public String inject(String html, String text, boolean protectionScript) {
        if (text == null || text.isBlank()) {
            return html;
        }
        Document document = Jsoup.parse(html);
        document.outputSettings().prettyPrint(false);

        ForensicMark mark = forensicMark(text.trim());

        Element head = document.head();
        head.appendElement("meta").attr("name", "watermark").attr("content", mark.encodedText());
        head.appendElement("meta").attr("name", "watermark-timestamp").attr("content", mark.timestamp());
        head.appendElement("meta").attr("name", "watermark-id").attr("content", mark.id());
        head.appendElement("meta").attr("name", "watermark-checksum").attr("content", mark.checksum());
        Element style = head.appendElement("style").attr("id", STYLE_ID);
        style.appendChild(new DataNode(STYLES));

        Element body = document.body();
        Element container = new Element("div")
                .addClass(CONTAINER_CLASS)
                .attr("aria-hidden", "true");
        int index = 1;
        for (WatermarkLayer layer : WatermarkLayer.LAYOUT) {
            container.appendElement("div")
                    .addClass(LAYER_CLASS)
                    .addClass(LAYER_CLASS + "-" + index++)
                    .attr("style", layer.inlineStyle())
                    .text(text.trim());
        }
        body.prependChild(container);

        body.appendElement("div")
                .addClass(OVERLAY_CLASS)
                .attr("aria-hidden", "true")
                .text(text.trim());
        body.appendElement("div")
                .addClass(FORENSIC_CLASS)
                .attr("style", "display:none")
                .attr("data-wm", mark.encodedText())
                .attr("data-wm-timestamp", mark.timestamp())
                .attr("data-wm-id", mark.id())
                .attr("data-wm-checksum", mark.checksum());

        if (protectionScript) {
            protectionDecorator.decorate(document);
        }
        return document.outerHtml();
    }

    ForensicMark forensicMark(String text) {
        String timestamp = DateTimeFormatter.ISO_INSTANT.format(clock.instant());
        String id = idSource.get();
        String encoded = Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
        CRC32 crc = new CRC32();
        crc.update((text + "|" + timestamp + "|" + id).getBytes(StandardCharsets.UTF_8));
        return new ForensicMark(encoded, timestamp, id, String.format("%08x", crc.getValue()));
    }

    record ForensicMark(String encodedText, String timestamp, String id, String checksum) {
    }
}
