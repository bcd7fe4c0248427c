package uk.gegc.mdexport.features.export.application.generator.impl;

import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.export.application.generator.AbstractFormatGenerator;
import uk.gegc.mdexport.features.export.application.generator.GenerationContext;
import uk.gegc.mdexport.features.export.application.generator.GeneratorSupport;
import uk.gegc.mdexport.features.export.application.slides.SlideSegmenter;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.export.domain.model.SlideKind;
import uk.gegc.mdexport.features.export.domain.model.SlideRecord;
import uk.gegc.mdexport.features.markdown.domain.ContentBlock;
import uk.gegc.mdexport.features.theme.domain.model.RenderTarget;
import uk.gegc.mdexport.features.theme.domain.model.ResolvedThemeColors;
import uk.gegc.mdexport.features.theme.domain.model.ThemeDescriptor;

import java.util.List;

import static uk.gegc.mdexport.features.theme.domain.util.ColorContrast.isHexColor;
import static uk.gegc.mdexport.shared.util.HtmlEscaper.escape;

/**
 * Single-file HTML slide deck: a title slide, one slide per level-1/2 heading and a
 * closing slide, with keyboard, button and swipe navigation.
 */
@Component
public class SlidesFormatGenerator extends AbstractFormatGenerator {

    static final String DEFAULT_GRADIENT = "linear-gradient(135deg, #667eea 0%, #764ba2 100%)";
    static final String CLOSING_TITLE = "Thank You";

    private final SlideSegmenter segmenter;

    public SlidesFormatGenerator(GeneratorSupport support, SlideSegmenter segmenter) {
        super(support);
        this.segmenter = segmenter;
    }

    @Override
    protected ExportFormat format() {
        return ExportFormat.SLIDES;
    }

    @Override
    public RenderTarget renderTarget() {
        return RenderTarget.SCREEN;
    }

    @Override
    protected String documentTitle(GenerationContext context) {
        return context.options().title() + " - Presentation";
    }

    @Override
    protected String fileBaseName(GenerationContext context) {
        return context.baseFileName() + "-presentation";
    }

    @Override
    protected boolean appliesCustomCss() {
        return false;
    }

    @Override
    public String buildStyles(GenerationContext context) {
        ResolvedThemeColors colors = context.colors();
        StringBuilder sb = new StringBuilder();
        sb.append("*{margin:0;padding:0;box-sizing:border-box;}\n");
        sb.append("body{font-family:'").append(fontFamily(context)).append("',sans-serif;")
                .append("background:").append(gradient(context.descriptor())).append(";")
                .append("color:#ffffff;overflow:hidden;}\n");
        sb.append(".presentation{display:flex;flex-direction:column;height:100vh;position:relative;}\n");
        sb.append(".slide{display:none;flex:1;padding:60px;text-align:center;justify-content:center;")
                .append("align-items:center;flex-direction:column;position:relative;}\n");
        sb.append(".slide.active{display:flex;}\n");
        sb.append(".slide h1{font-size:3.5em;margin-bottom:0.5em;text-shadow:2px 2px 4px rgba(0,0,0,0.3);font-weight:700;}\n");
        sb.append(".slide h2{font-size:2.8em;margin-bottom:0.8em;text-shadow:2px 2px 4px rgba(0,0,0,0.3);font-weight:600;}\n");
        sb.append(".slide-content{font-size:1.5em;line-height:1.6;max-width:900px;text-align:left;}\n");
        sb.append(".slide-content h3,.slide-content h4,.slide-content h5,.slide-content h6{margin:0.6em 0 0.3em 0;}\n");
        sb.append(".slide-content p{margin:0.8em 0;}\n");
        sb.append(".slide-content ul,.slide-content ol{margin:1em 0;padding-left:2em;}\n");
        sb.append(".slide-content li{margin:0.5em 0;}\n");
        sb.append(".slide-content code{background:rgba(255,255,255,0.2);padding:0.2em 0.5em;border-radius:4px;font-family:monospace;}\n");
        sb.append(".slide-content pre{background:rgba(0,0,0,0.3);padding:1em;border-radius:8px;overflow-x:auto;}\n");
        sb.append(".slide-content pre code{background:none;padding:0;}\n");
        sb.append(".slide-content blockquote{border-left:4px solid ").append(colors.accentColor())
                .append(";padding-left:1em;margin:1em 0;font-style:italic;opacity:0.9;}\n");
        sb.append(".slide-content table{border-collapse:collapse;margin:1em 0;}\n");
        sb.append(".slide-content th,.slide-content td{border:1px solid rgba(255,255,255,0.4);padding:0.4em 0.8em;}\n");
        sb.append(".slide-content img{max-width:100%;max-height:50vh;}\n");
        sb.append(".title-slide h1{font-size:4em;margin-bottom:0.3em;}\n");
        sb.append(".title-slide .subtitle{font-size:1.5em;opacity:0.85;margin-bottom:0.5em;}\n");
        sb.append(".title-slide .author,.closing-slide .author{font-size:1.2em;opacity:0.8;}\n");
        sb.append(".navigation{position:fixed;bottom:30px;left:50%;transform:translateX(-50%);display:flex;gap:15px;z-index:1000;}\n");
        sb.append(".nav-btn{padding:12px 24px;background:rgba(255,255,255,0.2);border:none;border-radius:25px;color:#ffffff;")
                .append("cursor:pointer;font-size:1em;transition:all 0.3s ease;}\n");
        sb.append(".nav-btn:hover{background:rgba(255,255,255,0.3);transform:translateY(-2px);}\n");
        sb.append(".slide-counter{position:fixed;top:30px;right:30px;background:rgba(0,0,0,0.3);padding:10px 20px;")
                .append("border-radius:20px;z-index:1000;font-size:1.1em;}\n");
        sb.append(".progress-bar{position:fixed;bottom:0;left:0;height:4px;width:0;background:")
                .append(colors.accentColor()).append(";transition:width 0.3s ease;z-index:1000;}\n");
        sb.append("@media (max-width:768px){.slide{padding:30px 20px;} .slide h1{font-size:2.5em;} .slide h2{font-size:2em;} ")
                .append(".slide-content{font-size:1.2em;} .navigation{bottom:20px;gap:10px;} .nav-btn{padding:10px 16px;font-size:0.9em;}}\n");
        sb.append("@media print{.slide{display:flex !important;page-break-after:always;height:100vh;} ")
                .append(".navigation,.slide-counter,.progress-bar{display:none;}}\n");
        return sb.toString();
    }

    @Override
    public String buildHeader(GenerationContext context) {
        return "<div class=\"presentation\">\n";
    }

    @Override
    public String buildBody(GenerationContext context) {
        ExportOptions options = context.options();
        List<SlideRecord> slides = segmenter.toSlides(context.content().blocks(), options.title());
        int total = slides.size() + 1;

        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"slide-counter\"><span id=\"current-slide\">1</span> / <span id=\"total-slides\">")
                .append(total).append("</span></div>\n");
        for (SlideRecord slide : slides) {
            if (slide.kind() == SlideKind.TITLE) {
                appendTitleSlide(sb, slide, options);
            } else {
                appendContentSlide(sb, slide);
            }
        }
        sb.append("<section class=\"slide closing-slide\" data-slide=\"").append(total).append("\">\n");
        sb.append("<h1>").append(CLOSING_TITLE).append("</h1>\n");
        sb.append("<div class=\"author\">").append(escape(options.title())).append(" &bull; ")
                .append(escape(options.author())).append("</div>\n");
        sb.append("</section>\n");
        return sb.toString();
    }

    @Override
    public String buildFooter(GenerationContext context) {
        return "<div class=\"navigation\">\n"
                + "<button class=\"nav-btn\" type=\"button\" data-action=\"previous\">Previous</button>\n"
                + "<button class=\"nav-btn\" type=\"button\" data-action=\"fullscreen\">Fullscreen</button>\n"
                + "<button class=\"nav-btn\" type=\"button\" data-action=\"next\">Next</button>\n"
                + "</div>\n"
                + "<div class=\"progress-bar\"></div>\n"
                + "</div>\n";
    }

    @Override
    protected String bodyScripts(GenerationContext context) {
        return "<script>\n" + NAVIGATION_SCRIPT + "</script>\n";
    }

    private static void appendTitleSlide(StringBuilder sb, SlideRecord slide, ExportOptions options) {
        sb.append("<section class=\"slide title-slide active\" data-slide=\"").append(slide.number()).append("\">\n");
        sb.append("<h1>").append(escape(slide.title())).append("</h1>\n");
        if (options.hasDescription()) {
            sb.append("<div class=\"subtitle\">").append(escape(options.description())).append("</div>\n");
        }
        sb.append("<div class=\"author\">by ").append(escape(options.author())).append("</div>\n");
        sb.append("</section>\n");
    }

    private static void appendContentSlide(StringBuilder sb, SlideRecord slide) {
        sb.append("<section class=\"slide\" data-slide=\"").append(slide.number()).append("\">\n");
        sb.append("<h2>").append(escape(slide.title())).append("</h2>\n");
        sb.append("<div class=\"slide-content\">\n");
        for (ContentBlock block : slide.content()) {
            sb.append(block.html());
        }
        sb.append("</div>\n");
        sb.append("</section>\n");
    }

    /**
     * Host primary and accent colors when both are plain hex values, else the classic purple gradient.
     */
    static String gradient(ThemeDescriptor descriptor) {
        if (descriptor != null && isHexColor(descriptor.primary()) && isHexColor(descriptor.accent())) {
            return "linear-gradient(135deg, " + descriptor.primary().trim() + " 0%, " + descriptor.accent().trim() + " 100%)";
        }
        return DEFAULT_GRADIENT;
    }

    private static final String NAVIGATION_SCRIPT = """
            (function () {
              var slides = document.querySelectorAll('.slide');
              var total = slides.length;
              var current = 0;
              var counter = document.getElementById('current-slide');
              var progressBar = document.querySelector('.progress-bar');

              function showSlide(n) {
                slides[current].classList.remove('active');
                current = (n + total) % total;
                slides[current].classList.add('active');
                counter.textContent = current + 1;
                progressBar.style.width = ((current + 1) / total * 100) + '%';
              }
              function nextSlide() { showSlide(current + 1); }
              function previousSlide() { showSlide(current - 1); }
              function toggleFullscreen() {
                if (!document.fullscreenElement) {
                  document.documentElement.requestFullscreen();
                } else {
                  document.exitFullscreen();
                }
              }

              document.querySelectorAll('.nav-btn').forEach(function (button) {
                button.addEventListener('click', function () {
                  var action = button.getAttribute('data-action');
                  if (action === 'next') { nextSlide(); }
                  else if (action === 'previous') { previousSlide(); }
                  else if (action === 'fullscreen') { toggleFullscreen(); }
                });
              });

              document.addEventListener('keydown', function (e) {
                switch (e.key) {
                  case 'ArrowRight':
                  case ' ':
                  case 'PageDown':
                    e.preventDefault(); nextSlide(); break;
                  case 'ArrowLeft':
                  case 'PageUp':
                    e.preventDefault(); previousSlide(); break;
                  case 'Home':
                    e.preventDefault(); showSlide(0); break;
                  case 'End':
                    e.preventDefault(); showSlide(total - 1); break;
                  case 'F11':
                    e.preventDefault(); toggleFullscreen(); break;
                }
              });

              var startX = 0;
              var startY = 0;
              document.addEventListener('touchstart', function (e) {
                startX = e.touches[0].clientX;
                startY = e.touches[0].clientY;
              });
              document.addEventListener('touchend', function (e) {
                var diffX = startX - e.changedTouches[0].clientX;
                var diffY = startY - e.changedTouches[0].clientY;
                if (Math.abs(diffX) > Math.abs(diffY) && Math.abs(diffX) > 50) {
                  if (diffX > 0) { nextSlide(); } else { previousSlide(); }
                }
              });

              showSlide(0);
            })();
            """;
}
