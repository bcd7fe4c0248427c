package uk.gegc.mdexport.features.export.application.watermark;

import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Browser-only script that hardens watermark layers and logs tampering.
 * Removal is logged, never prevented. Not added to documents consumed outside a browser.
 */
@Component
public class WatermarkProtectionDecorator {

    static final String SCRIPT_CLASS = "wm-protection";

    private static final String SCRIPT = """
            (function () {
              var selector = '.wm-layer, .wm-print-overlay, .wm-forensic';
              function harden(el) {
                ['contextmenu', 'dragstart', 'selectstart'].forEach(function (type) {
                  el.addEventListener(type, function (e) { e.preventDefault(); });
                });
              }
              document.querySelectorAll(selector).forEach(harden);
              if (window.MutationObserver) {
                new MutationObserver(function (mutations) {
                  mutations.forEach(function (m) {
                    m.removedNodes.forEach(function (n) {
                      if (n.nodeType === 1 && n.matches && n.matches(selector)) {
                        console.warn('Watermark element removed');
                      }
                    });
                    if (m.type === 'attributes' && m.target.matches && m.target.matches(selector)) {
                      console.warn('Watermark element modified');
                    }
                  });
                }).observe(document.body, {childList: true, subtree: true, attributes: true, attributeFilter: ['style', 'class']});
              }
              var originalRemove = Element.prototype.remove;
              Element.prototype.remove = function () {
                if (this.matches && this.matches(selector)) {
                  console.warn('Attempt to remove watermark element');
                }
                return originalRemove.apply(this, arguments);
              };
            })();
            """;

    public void decorate(Document document) {
        if (!document.body().select("script." + SCRIPT_CLASS).isEmpty()) {
            return;
        }
        Element script = new Element("script").addClass(SCRIPT_CLASS);
        script.appendChild(new DataNode(SCRIPT));
        document.body().appendChild(script);
    }
}
