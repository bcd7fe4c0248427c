package uk.gegc.mdexport.features.export.application.generator.impl;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.export.application.generator.AbstractFormatGenerator;
import uk.gegc.mdexport.features.export.application.generator.GenerationContext;
import uk.gegc.mdexport.features.export.application.generator.GeneratorSupport;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.export.domain.model.PageOrientation;
import uk.gegc.mdexport.features.theme.domain.model.RenderTarget;
import uk.gegc.mdexport.features.theme.domain.model.ResolvedThemeColors;

import static uk.gegc.mdexport.shared.util.HtmlEscaper.escape;

/**
 * Office-namespaced HTML that Word opens as a regular document.
 * Content is cleaned with a jsoup safelist, so no inline styles, scripts or data attributes
 * reach Word; the only inline styles left are the emoji wrappers added afterwards.
 */
@Component
public class WordFormatGenerator extends AbstractFormatGenerator {

    private static final Safelist WORD_SAFELIST = Safelist.relaxed()
            .addAttributes("h1", "id")
            .addAttributes("h2", "id")
            .addAttributes("h3", "id")
            .addAttributes("h4", "id")
            .addAttributes("h5", "id")
            .addAttributes("h6", "id")
            .addProtocols("a", "href", "#")
            .preserveRelativeLinks(true);

    public WordFormatGenerator(GeneratorSupport support) {
        super(support);
    }

    @Override
    protected ExportFormat format() {
        return ExportFormat.WORD;
    }

    @Override
    public RenderTarget renderTarget() {
        return RenderTarget.PRINT;
    }

    @Override
    protected String openingHtmlTag() {
        return "<html xmlns:o=\"urn:schemas-microsoft-com:office:office\" "
                + "xmlns:w=\"urn:schemas-microsoft-com:office:word\" "
                + "xmlns=\"http://www.w3.org/TR/REC-html40\">";
    }

    @Override
    protected String headExtras(GenerationContext context) {
        return "<!--[if gte mso 9]><xml><w:WordDocument><w:View>Print</w:View><w:Zoom>100</w:Zoom>"
                + "<w:DoNotOptimizeForBrowser/></w:WordDocument></xml><![endif]-->\n";
    }

    @Override
    protected boolean appliesCustomCss() {
        return false;
    }

    @Override
    protected boolean protectionScriptAllowed() {
        return false;
    }

    @Override
    public String buildStyles(GenerationContext context) {
        ExportOptions options = context.options();
        ResolvedThemeColors colors = context.colors();
        StringBuilder sb = new StringBuilder();

        sb.append("@page Section1{size:").append(options.pageSize().cssSize(options.orientation())).append(";margin:1in;");
        if (options.orientation() == PageOrientation.LANDSCAPE) {
            sb.append("mso-page-orientation:landscape;");
        }
        sb.append("mso-header-margin:.5in;mso-footer-margin:.5in;mso-paper-source:0;}\n");
        sb.append("div.Section1{page:Section1;}\n");
        sb.append("body{font-family:'").append(fontFamily(context)).append("','Times New Roman',serif;")
                .append("font-size:").append(options.fontSize()).append("px;line-height:1.6;")
                .append("color:").append(colors.bodyTextColor()).append(";")
                .append("background-color:").append(colors.backgroundColor()).append(";")
                .append("mso-ascii-font-family:'").append(fontFamily(context)).append("';}\n");
        sb.append("h1,h2,h3,h4,h5,h6{color:").append(colors.bodyTextColor())
                .append(";font-weight:bold;margin:1.5em 0 0.5em 0;mso-pagination:widow-orphan;}\n");
        sb.append("h1{font-size:2em;mso-outline-level:1;} h2{font-size:1.5em;mso-outline-level:2;} ")
                .append("h3{font-size:1.3em;mso-outline-level:3;} h4{font-size:1.1em;} h5{font-size:1em;} h6{font-size:0.9em;}\n");
        sb.append("p{margin:1em 0;mso-pagination:widow-orphan;}\n");
        sb.append("strong,b{font-weight:bold;} em,i{font-style:italic;}\n");
        sb.append("code{font-family:'Courier New',monospace;background-color:#f5f5f5;mso-highlight:#f5f5f5;}\n");
        sb.append("pre{font-family:'Courier New',monospace;background-color:#f5f5f5;padding:10px;mso-shading:#f5f5f5;}\n");
        sb.append("blockquote{border-left:4px solid #cccccc;margin:1em 0;padding:0.5em 1em;font-style:italic;}\n");
        sb.append("ul,ol{margin:1em 0;padding-left:2em;} li{margin:0.5em 0;}\n");
        sb.append("a{color:").append(colors.accentColor()).append(";}\n");
        sb.append("table{border-collapse:collapse;width:100%;margin:1em 0;border:1px solid #000000;")
                .append("mso-table-layout-alt:fixed;mso-table-lspace:9.0pt;mso-table-rspace:9.0pt;}\n");
        sb.append("th,td{border:1px solid #000000;padding:8px 12px;text-align:left;vertical-align:top;")
                .append("mso-border-alt:solid #000000 .5pt;}\n");
        sb.append("th{background-color:#f0f0f0;font-weight:bold;mso-shading:#f0f0f0;}\n");
        sb.append(".document-title{font-size:2.4em;font-weight:bold;text-align:center;color:")
                .append(colors.bodyTextColor()).append(";}\n");
        sb.append(".document-author,.document-description{text-align:center;color:").append(colors.authorColor()).append(";}\n");
        sb.append(".document-footer{margin-top:3em;text-align:center;font-size:0.85em;color:")
                .append(colors.authorColor()).append(";}\n");
        return sb.toString();
    }

    @Override
    public String buildHeader(GenerationContext context) {
        ExportOptions options = context.options();
        StringBuilder sb = new StringBuilder("<div class=\"Section1\">\n");
        if (!options.headerFooter()) {
            return sb.toString();
        }
        sb.append("<p class=\"document-title\">").append(escape(options.title())).append("</p>\n");
        sb.append("<p class=\"document-author\">by ").append(escape(options.author())).append("</p>\n");
        if (options.hasDescription()) {
            sb.append("<p class=\"document-description\">").append(escape(options.description())).append("</p>\n");
        }
        sb.append("<hr>\n");
        return sb.toString();
    }

    @Override
    public String buildBody(GenerationContext context) {
        return tableOfContents(context) + cleanForWord(context.content().html());
    }

    @Override
    public String buildFooter(GenerationContext context) {
        ExportOptions options = context.options();
        if (!options.headerFooter()) {
            return "</div>\n";
        }
        return "<p class=\"document-footer\">Generated on " + escape(footerDate(context))
                + " &bull; " + escape(options.title()) + "</p>\n</div>\n";
    }

    @Override
    protected String postProcess(String html) {
        return support.getEmojiEncoder().preserveEmoji(html);
    }

    String cleanForWord(String html) {
        Document.OutputSettings settings = new Document.OutputSettings().prettyPrint(false);
        String cleaned = Jsoup.clean(html, "", WORD_SAFELIST, settings);

        Document fragment = Jsoup.parseBodyFragment(cleaned);
        fragment.outputSettings().prettyPrint(false);
        for (Element table : fragment.select("table")) {
            table.attr("border", "1")
                    .attr("cellpadding", "8")
                    .attr("cellspacing", "0")
                    .attr("width", "100%");
        }
        return fragment.body().html() + "\n";
    }
}
