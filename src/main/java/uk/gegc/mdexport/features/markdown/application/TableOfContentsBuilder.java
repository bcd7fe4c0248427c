package uk.gegc.mdexport.features.markdown.application;

import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.markdown.domain.HeadingEntry;

import java.util.List;

import static uk.gegc.mdexport.shared.util.HtmlEscaper.escape;

/**
 * Builds the table of contents block from a heading outline.
 */
@Component
public class TableOfContentsBuilder {

    public static final String TOC_CLASS = "table-of-contents";

    /**
     * @return the TOC HTML, or an empty string when there are no headings
     */
    public String build(List<HeadingEntry> headings) {
        if (headings == null || headings.isEmpty()) {
            return "";
        }
        StringBuilder html = new StringBuilder();
        html.append("<nav class=\"").append(TOC_CLASS).append("\">\n");
        html.append("<h2>Table of Contents</h2>\n<ul>\n");
        for (HeadingEntry heading : headings) {
            html.append("<li class=\"toc-level-").append(heading.level()).append("\">")
                    .append("<a href=\"#").append(escape(heading.id())).append("\">")
                    .append(escape(heading.text()))
                    .append("</a></li>\n");
        }
        html.append("</ul>\n</nav>\n");
        return html.toString();
    }
}
