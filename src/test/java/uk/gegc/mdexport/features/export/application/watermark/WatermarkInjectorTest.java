package uk.gegc.mdexport.features.export.application.watermark;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Base64;
import java.util.zip.CRC32;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WatermarkInjector Tests")
class WatermarkInjectorTest {

    private static final String HTML = "<!DOCTYPE html><html><head><title>Doc</title></head>"
            + "<body><main><p>content</p></main></body></html>";

    private WatermarkInjector injector;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-10-17T12:00:00Z"), ZoneId.of("UTC"));
        injector = new WatermarkInjector(clock, new WatermarkProtectionDecorator(), () -> "wm-1");
    }

    @Test
    @DisplayName("inject: adds seven layers, print overlay and forensic record")
    void inject_addsLayers() {
        // When
        Document doc = Jsoup.parse(injector.inject(HTML, "CONFIDENTIAL", false));

        // Then
        Element container = doc.body().child(0);
        assertThat(container.hasClass(WatermarkInjector.CONTAINER_CLASS)).isTrue();
        assertThat(container.select("." + WatermarkInjector.LAYER_CLASS)).hasSize(7)
                .allSatisfy(layer -> assertThat(layer.text()).isEqualTo("CONFIDENTIAL"));
        assertThat(doc.select("." + WatermarkInjector.OVERLAY_CLASS).text()).isEqualTo("CONFIDENTIAL");
        assertThat(doc.select("main p").text()).isEqualTo("content");
        assertThat(doc.select("style#" + WatermarkInjector.STYLE_ID)).hasSize(1);
        assertThat(doc.select("script")).isEmpty();
    }

    @Test
    @DisplayName("inject: forensic record carries encoded text, timestamp, id and checksum")
    void inject_forensicRecord() {
        // Given
        CRC32 crc = new CRC32();
        crc.update("Draft|2025-10-17T12:00:00Z|wm-1".getBytes(StandardCharsets.UTF_8));
        String expectedChecksum = String.format("%08x", crc.getValue());

        // When
        Document doc = Jsoup.parse(injector.inject(HTML, "Draft", false));

        // Then
        Element forensic = doc.selectFirst("." + WatermarkInjector.FORENSIC_CLASS);
        assertThat(forensic).isNotNull();
        assertThat(forensic.attr("data-wm"))
                .isEqualTo(Base64.getEncoder().encodeToString("Draft".getBytes(StandardCharsets.UTF_8)));
        assertThat(forensic.attr("data-wm-timestamp")).isEqualTo("2025-10-17T12:00:00Z");
        assertThat(forensic.attr("data-wm-id")).isEqualTo("wm-1");
        assertThat(forensic.attr("data-wm-checksum")).isEqualTo(expectedChecksum);
        assertThat(doc.select("meta[name=watermark-checksum]").attr("content")).isEqualTo(expectedChecksum);
    }

    @Test
    @DisplayName("inject: watermark text is escaped")
    void inject_escapesText() {
        // When
        String html = injector.inject(HTML, "<b>x</b>", false);

        // Then
        assertThat(html).doesNotContain("<b>x</b>");
        assertThat(Jsoup.parse(html).select(".wm-layer-1").text()).isEqualTo("<b>x</b>");
    }

    @Test
    @DisplayName("inject: protection script added only when requested")
    void inject_protectionScript() {
        Document doc = Jsoup.parse(injector.inject(HTML, "Draft", true));

        assertThat(doc.select("script." + WatermarkProtectionDecorator.SCRIPT_CLASS)).hasSize(1);
    }

    @Test
    @DisplayName("inject: blank text leaves the document unchanged")
    void inject_blank_noop() {
        assertThat(injector.inject(HTML, "  ", true)).isSameAs(HTML);
        assertThat(injector.inject(HTML, null, true)).isSameAs(HTML);
    }
}
