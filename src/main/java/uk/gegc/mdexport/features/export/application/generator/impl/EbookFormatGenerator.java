package uk.gegc.mdexport.features.export.application.generator.impl;

import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.export.application.generator.AbstractFormatGenerator;
import uk.gegc.mdexport.features.export.application.generator.GenerationContext;
import uk.gegc.mdexport.features.export.application.generator.GeneratorSupport;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.theme.domain.model.RenderTarget;
import uk.gegc.mdexport.features.theme.domain.model.ResolvedThemeColors;

import static uk.gegc.mdexport.shared.util.HtmlEscaper.escape;

/**
 * Self-contained, book-styled HTML page.
 */
@Component
public class EbookFormatGenerator extends AbstractFormatGenerator {

    public EbookFormatGenerator(GeneratorSupport support) {
        super(support);
    }

    @Override
    protected ExportFormat format() {
        return ExportFormat.EBOOK;
    }

    @Override
    public RenderTarget renderTarget() {
        return RenderTarget.SCREEN;
    }

    @Override
    protected String headExtras(GenerationContext context) {
        return "<meta name=\"generator\" content=\"markdown-export\">\n";
    }

    @Override
    public String buildStyles(GenerationContext context) {
        ResolvedThemeColors colors = context.colors();
        String panel = colors.dark() ? "rgba(255,255,255,0.06)" : "#f8f9fa";
        String shadow = colors.dark() ? "0 4px 12px rgba(0,0,0,0.5)" : "0 4px 12px rgba(0,0,0,0.12)";
        StringBuilder sb = new StringBuilder();

        sb.append("*{box-sizing:border-box;}\n");
        sb.append("body{font-family:Georgia,'Times New Roman',serif;line-height:1.8;max-width:700px;margin:0 auto;padding:40px 24px;")
                .append("font-size:").append(context.options().fontSize()).append("px;")
                .append("color:").append(colors.bodyTextColor()).append(";")
                .append("background-color:").append(colors.backgroundColor()).append(";}\n");
        sb.append(".book-header{text-align:center;margin-bottom:2.5em;padding-bottom:1.25em;border-bottom:2px solid ")
                .append(colors.borderColor()).append(";}\n");
        sb.append(".book-title{font-size:2.5em;font-weight:bold;margin:0 0 0.4em 0;border:none;color:")
                .append(colors.titleColor()).append(";}\n");
        sb.append(".book-author{font-size:1.2em;font-style:italic;text-indent:0;color:").append(colors.authorColor()).append(";}\n");
        sb.append(".book-description{text-indent:0;color:").append(colors.authorColor()).append(";}\n");
        sb.append(".book-content{text-align:justify;}\n");
        sb.append(".book-footer{margin-top:3em;padding-top:1em;border-top:1px solid ").append(colors.borderColor())
                .append(";text-align:center;font-size:0.9em;color:").append(colors.authorColor()).append(";}\n");
        sb.append(".book-footer p{text-indent:0;margin:0.3em 0;}\n");
        sb.append("h1,h2,h3,h4,h5,h6{color:").append(colors.titleColor()).append(";margin:1.5em 0 0.5em 0;line-height:1.3;}\n");
        sb.append("h1{font-size:2.2em;} h2{font-size:1.8em;} h3{font-size:1.5em;} h4{font-size:1.3em;} h5{font-size:1.1em;} h6{font-size:1em;}\n");
        sb.append("p{margin:1em 0;text-indent:1.5em;}\n");
        sb.append("h1+p,h2+p,h3+p,h4+p,h5+p,h6+p,blockquote p,li p{text-indent:0;}\n");
        sb.append("a{color:").append(colors.accentColor()).append(";text-decoration:none;}\n");
        sb.append("a:hover{text-decoration:underline;}\n");
        sb.append("blockquote{border-left:4px solid ").append(colors.accentColor())
                .append(";margin:1.5em 0;padding:1em 1.5em;font-style:italic;background-color:").append(panel).append(";}\n");
        sb.append("code{font-family:'Courier New',monospace;font-size:0.9em;padding:0.2em 0.4em;border-radius:3px;background-color:")
                .append(panel).append(";}\n");
        sb.append("pre{padding:1.5em;border-radius:8px;overflow-x:auto;margin:1.5em 0;border-left:4px solid ")
                .append(colors.accentColor()).append(";background-color:").append(panel).append(";}\n");
        sb.append("pre code{background:none;padding:0;}\n");
        sb.append("ul,ol{margin:1em 0;padding-left:2em;} li{margin:0.5em 0;}\n");
        sb.append("img{display:block;max-width:100%;height:auto;margin:1.5em auto;border-radius:6px;box-shadow:")
                .append(shadow).append(";}\n");
        sb.append("table{width:100%;border-collapse:collapse;margin:1.5em 0;box-shadow:").append(shadow).append(";}\n");
        sb.append("th,td{border:1px solid ").append(colors.borderColor()).append(";padding:0.75em;text-align:left;}\n");
        sb.append("th{background-color:").append(colors.tableHeaderColor())
                .append(";color:").append(colors.tableHeaderTextColor()).append(";}\n");
        sb.append(".table-of-contents{margin:0 0 2.5em 0;padding:1em 1.5em;background-color:").append(panel).append(";}\n");
        sb.append(".table-of-contents ul{list-style:none;padding-left:0;}\n");
        for (int level = 2; level <= 6; level++) {
            sb.append(".toc-level-").append(level).append("{padding-left:").append((level - 1) * 1.25).append("em;}\n");
        }
        sb.append("@media print{body{font-size:12pt;line-height:1.4;} h1{page-break-before:always;} ")
                .append("h1,h2,h3,h4,h5,h6{page-break-after:avoid;} img,pre,blockquote,table{page-break-inside:avoid;}}\n");
        sb.append("@media screen and (max-width:600px){body{padding:12px;font-size:16px;} .book-title{font-size:2em;}}\n");
        return sb.toString();
    }

    @Override
    public String buildHeader(GenerationContext context) {
        ExportOptions options = context.options();
        if (!options.headerFooter()) {
            return "<div class=\"book-container\">\n";
        }
        StringBuilder sb = new StringBuilder("<div class=\"book-container\">\n");
        sb.append("<header class=\"book-header\">\n");
        sb.append("<div class=\"book-title\">").append(escape(options.title())).append("</div>\n");
        sb.append("<p class=\"book-author\">by ").append(escape(options.author())).append("</p>\n");
        if (options.hasDescription()) {
            sb.append("<p class=\"book-description\">").append(escape(options.description())).append("</p>\n");
        }
        sb.append("</header>\n");
        return sb.toString();
    }

    @Override
    public String buildBody(GenerationContext context) {
        return tableOfContents(context)
                + "<main class=\"book-content\">\n"
                + context.content().html()
                + "</main>\n";
    }

    @Override
    public String buildFooter(GenerationContext context) {
        ExportOptions options = context.options();
        if (!options.headerFooter()) {
            return "</div>\n";
        }
        return "<footer class=\"book-footer\">\n"
                + "<p>Generated on " + escape(footerDate(context)) + "</p>\n"
                + "<p>" + escape(options.title()) + " &bull; " + escape(options.author()) + "</p>\n"
                + "</footer>\n"
                + "</div>\n";
    }

    @Override
    protected String postProcess(String html) {
        return support.getEmojiEncoder().preserveEmoji(html);
    }
}
