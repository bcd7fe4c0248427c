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
 * Print-ready document. Once loaded in the print window it opens the print dialog after
 * the configured settle delay and closes the window.
 */
@Component
public class PrintFormatGenerator extends AbstractFormatGenerator {

    public PrintFormatGenerator(GeneratorSupport support) {
        super(support);
    }

    @Override
    protected ExportFormat format() {
        return ExportFormat.PRINT;
    }

    @Override
    public RenderTarget renderTarget() {
        return RenderTarget.PRINT;
    }

    @Override
    public String buildStyles(GenerationContext context) {
        ExportOptions options = context.options();
        ResolvedThemeColors colors = context.colors();
        StringBuilder sb = new StringBuilder();

        sb.append("@page{size:").append(options.pageSize().cssSize(options.orientation())).append(";margin:1in;");
        if (options.includePageNumbers()) {
            sb.append("@bottom-center{content:\"Page \" counter(page) \" of \" counter(pages);font-size:9pt;color:#555555;}");
        }
        sb.append("}\n");

        sb.append("*{box-sizing:border-box;}\n");
        sb.append("body{font-family:'").append(fontFamily(context)).append("',sans-serif;")
                .append("font-size:").append(options.fontSize()).append("px;line-height:1.6;")
                .append("color:").append(colors.bodyTextColor()).append(";")
                .append("background-color:").append(colors.backgroundColor()).append(";")
                .append("margin:0;padding:0;-webkit-print-color-adjust:exact;print-color-adjust:exact;}\n");
        sb.append("h1,h2,h3,h4,h5,h6{color:").append(colors.titleColor())
                .append(";margin:1.5em 0 0.5em 0;font-weight:600;page-break-after:avoid;}\n");
        sb.append("h1{font-size:2.2em;border-bottom:2px solid ").append(colors.borderColor()).append(";padding-bottom:0.3em;}\n");
        sb.append("h2{font-size:1.8em;border-bottom:1px solid ").append(colors.borderColor()).append(";padding-bottom:0.2em;}\n");
        sb.append("h3{font-size:1.4em;} h4{font-size:1.2em;} h5{font-size:1.1em;} h6{font-size:1em;}\n");
        sb.append("p{margin:1em 0;text-align:justify;orphans:3;widows:3;}\n");
        sb.append("ul,ol{margin:1em 0;padding-left:2em;} li{margin:0.4em 0;}\n");
        sb.append("a{color:").append(colors.accentColor()).append(";text-decoration:none;}\n");
        sb.append("blockquote{border-left:4px solid ").append(colors.borderColor())
                .append(";margin:1.5em 0;padding:0.5em 1.5em;font-style:italic;page-break-inside:avoid;}\n");
        sb.append("code{font-family:'Courier New',monospace;font-size:0.9em;background-color:#f5f5f5;padding:0.1em 0.3em;border-radius:3px;}\n");
        sb.append("pre{background-color:#f5f5f5;padding:1em;border:1px solid #dddddd;border-radius:4px;")
                .append("white-space:pre-wrap;page-break-inside:avoid;}\n");
        sb.append("pre code{background:none;padding:0;}\n");
        sb.append("img{max-width:100%;height:auto;page-break-inside:avoid;}\n");
        sb.append("table{width:100%;border-collapse:collapse;margin:1.5em 0;page-break-inside:avoid;}\n");
        sb.append("th,td{border:1px solid ").append(colors.borderColor()).append(";padding:0.5em 0.75em;text-align:left;}\n");
        sb.append("th{background-color:").append(colors.tableHeaderColor())
                .append(";color:").append(colors.tableHeaderTextColor()).append(";font-weight:600;}\n");
        sb.append(".document-header{text-align:center;margin-bottom:2.5em;padding-bottom:1.5em;border-bottom:2px solid ")
                .append(colors.borderColor()).append(";}\n");
        sb.append(".document-title{font-size:2.6em;font-weight:700;color:").append(colors.titleColor()).append(";margin-bottom:0.3em;}\n");
        sb.append(".document-author{font-size:1.2em;color:").append(colors.authorColor()).append(";}\n");
        sb.append(".document-description{margin-top:0.5em;color:").append(colors.authorColor()).append(";}\n");
        sb.append(".document-footer{margin-top:3em;padding-top:1em;border-top:1px solid ").append(colors.borderColor())
                .append(";text-align:center;font-size:0.85em;color:").append(colors.authorColor()).append(";}\n");
        sb.append(".table-of-contents{margin-bottom:2em;page-break-after:always;}\n");
        sb.append(".table-of-contents ul{list-style:none;padding-left:0;}\n");
        for (int level = 2; level <= 6; level++) {
            sb.append(".toc-level-").append(level).append("{padding-left:").append((level - 1) * 1.25).append("em;}\n");
        }
        sb.append("@media screen{body{max-width:800px;margin:0 auto;padding:40px 20px;}}\n");
        return sb.toString();
    }

    @Override
    public String buildHeader(GenerationContext context) {
        ExportOptions options = context.options();
        if (!options.headerFooter()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("<header class=\"document-header\">\n");
        sb.append("<div class=\"document-title\">").append(escape(options.title())).append("</div>\n");
        sb.append("<div class=\"document-author\">by ").append(escape(options.author())).append("</div>\n");
        if (options.hasDescription()) {
            sb.append("<div class=\"document-description\">").append(escape(options.description())).append("</div>\n");
        }
        sb.append("</header>\n");
        return sb.toString();
    }

    @Override
    public String buildBody(GenerationContext context) {
        return tableOfContents(context)
                + "<main class=\"content\">\n"
                + context.content().html()
                + "</main>\n";
    }

    @Override
    public String buildFooter(GenerationContext context) {
        ExportOptions options = context.options();
        if (!options.headerFooter()) {
            return "";
        }
        return "<footer class=\"document-footer\">Generated on " + escape(footerDate(context))
                + " &bull; " + escape(options.title()) + "</footer>\n";
    }

    @Override
    protected String bodyScripts(GenerationContext context) {
        long delay = support.getProperties().getPrintSettleDelayMs();
        return "<script>\n"
                + "window.addEventListener('load', function () {\n"
                + "  setTimeout(function () {\n"
                + "    window.print();\n"
                + "    window.close();\n"
                + "  }, " + delay + ");\n"
                + "});\n"
                + "</script>\n";
    }
}
