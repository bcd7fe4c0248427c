package uk.gegc.mdexport.features.markdown.infra;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.markdown.domain.BlockType;
import uk.gegc.mdexport.features.markdown.domain.ContentBlock;
import uk.gegc.mdexport.features.markdown.domain.HeadingEntry;
import uk.gegc.mdexport.features.markdown.domain.HeadingIdGenerator;
import uk.gegc.mdexport.features.markdown.domain.MarkdownConverter;
import uk.gegc.mdexport.features.markdown.domain.RenderedMarkdown;
import uk.gegc.mdexport.shared.util.HtmlEscaper;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based fallback converter. Covers headings, emphasis, links, images, inline and
 * fenced code, lists, quotes and rules. Input is HTML-escaped before any markup is added,
 * so this converter never fails.
 */
@Component
@Order(100)
public class RegexMarkdownConverter implements MarkdownConverter {

    private static final Pattern FENCE = Pattern.compile("^\\s*```\\s*([\\w+#.-]*)\\s*$");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*?)\\s*#*\\s*$");
    private static final Pattern RULE = Pattern.compile("^\\s*(?:-{3,}|\\*{3,}|_{3,})\\s*$");
    private static final Pattern QUOTE = Pattern.compile("^\\s*>\\s?(.*)$");
    private static final Pattern BULLET = Pattern.compile("^\\s*[-*+]\\s+(.*)$");
    private static final Pattern NUMBERED = Pattern.compile("^\\s*\\d+[.)]\\s+(.*)$");

    private static final Pattern CODE_SPAN = Pattern.compile("`([^`]+)`");
    private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)]\\(([^)\\s]+)\\)");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)]\\(([^)\\s]+)\\)");
    private static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*|__(.+?)__");
    private static final Pattern ITALIC = Pattern.compile("\\*(?!\\s)(.+?)\\*|(?<![\\w/])_(?!\\s)(.+?)_(?!\\w)");
    private static final Pattern STRIKE = Pattern.compile("~~(.+?)~~");
    private static final Pattern SAFE_URL = Pattern.compile("^(?:https?:|mailto:|#|/|\\./|\\.\\./|[\\w.-]+(?:/|$)).*",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "regex";
    }

    @Override
    public RenderedMarkdown render(String markdown) {
        String[] lines = markdown.split("\\R", -1);
        List<ContentBlock> blocks = new ArrayList<>();
        List<HeadingEntry> headings = new ArrayList<>();
        HeadingIdGenerator ids = new HeadingIdGenerator();
        List<String> paragraph = new ArrayList<>();

        int i = 0;
        while (i < lines.length) {
            String line = lines[i];

            Matcher fence = FENCE.matcher(line);
            if (fence.matches()) {
                flushParagraph(paragraph, blocks);
                String language = fence.group(1);
                StringBuilder code = new StringBuilder();
                i++;
                while (i < lines.length && !FENCE.matcher(lines[i]).matches()) {
                    code.append(lines[i]).append('\n');
                    i++;
                }
                i++; // closing fence
                String cssClass = language.isEmpty()
                        ? CommonMarkMarkdownConverter.HIGHLIGHT_CLASS
                        : "language-" + HtmlEscaper.escape(language) + " " + CommonMarkMarkdownConverter.HIGHLIGHT_CLASS;
                blocks.add(ContentBlock.of(BlockType.CODE, code.toString().trim(),
                        "<pre><code class=\"" + cssClass + "\">" + HtmlEscaper.escape(code.toString()) + "</code></pre>\n"));
                continue;
            }

            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                flushParagraph(paragraph, blocks);
                int level = heading.group(1).length();
                String text = heading.group(2);
                String id = ids.next(text);
                headings.add(new HeadingEntry(level, text, id));
                blocks.add(ContentBlock.heading(level, text,
                        "<h" + level + " id=\"" + id + "\">" + inline(text) + "</h" + level + ">\n"));
                i++;
                continue;
            }

            if (RULE.matcher(line).matches()) {
                flushParagraph(paragraph, blocks);
                blocks.add(ContentBlock.of(BlockType.RULE, "", "<hr />\n"));
                i++;
                continue;
            }

            if (QUOTE.matcher(line).matches()) {
                flushParagraph(paragraph, blocks);
                List<String> quoted = new ArrayList<>();
                while (i < lines.length) {
                    Matcher quote = QUOTE.matcher(lines[i]);
                    if (!quote.matches()) {
                        break;
                    }
                    quoted.add(quote.group(1));
                    i++;
                }
                blocks.add(ContentBlock.of(BlockType.QUOTE, String.join(" ", quoted),
                        "<blockquote>\n<p>" + joinInline(quoted) + "</p>\n</blockquote>\n"));
                continue;
            }

            boolean bullet = BULLET.matcher(line).matches();
            if (bullet || NUMBERED.matcher(line).matches()) {
                flushParagraph(paragraph, blocks);
                Pattern itemPattern = bullet ? BULLET : NUMBERED;
                String tag = bullet ? "ul" : "ol";
                List<String> items = new ArrayList<>();
                while (i < lines.length) {
                    Matcher item = itemPattern.matcher(lines[i]);
                    if (!item.matches()) {
                        break;
                    }
                    items.add(item.group(1));
                    i++;
                }
                StringBuilder html = new StringBuilder("<").append(tag).append(">\n");
                for (String item : items) {
                    html.append("<li>").append(inline(item)).append("</li>\n");
                }
                html.append("</").append(tag).append(">\n");
                blocks.add(ContentBlock.of(BlockType.LIST, String.join(" ", items), html.toString()));
                continue;
            }

            if (line.isBlank()) {
                flushParagraph(paragraph, blocks);
            } else {
                paragraph.add(line.trim());
            }
            i++;
        }
        flushParagraph(paragraph, blocks);
        return new RenderedMarkdown(blocks, headings);
    }

    private static void flushParagraph(List<String> paragraph, List<ContentBlock> blocks) {
        if (paragraph.isEmpty()) {
            return;
        }
        blocks.add(ContentBlock.of(BlockType.PARAGRAPH, String.join(" ", paragraph),
                "<p>" + joinInline(paragraph) + "</p>\n"));
        paragraph.clear();
    }

    private static String joinInline(List<String> lines) {
        List<String> rendered = new ArrayList<>(lines.size());
        for (String line : lines) {
            rendered.add(inline(line));
        }
        return String.join("<br />\n", rendered);
    }

    /**
     * Renders inline markup. Code spans are kept literal.
     */
    static String inline(String text) {
        StringBuilder out = new StringBuilder();
        Matcher code = CODE_SPAN.matcher(text);
        int last = 0;
        while (code.find()) {
            out.append(emphasis(text.substring(last, code.start())));
            out.append("<code>").append(HtmlEscaper.escape(code.group(1))).append("</code>");
            last = code.end();
        }
        out.append(emphasis(text.substring(last)));
        return out.toString();
    }

    private static String emphasis(String raw) {
        String html = HtmlEscaper.escape(raw);
        html = replace(IMAGE, html, m -> "<img src=\"" + safeUrl(m.group(2)) + "\" alt=\"" + m.group(1) + "\" />");
        html = replace(LINK, html, m -> "<a href=\"" + safeUrl(m.group(2)) + "\">" + m.group(1) + "</a>");
        html = replace(BOLD, html, m -> "<strong>" + firstNonNull(m.group(1), m.group(2)) + "</strong>");
        html = replace(ITALIC, html, m -> "<em>" + firstNonNull(m.group(1), m.group(2)) + "</em>");
        html = replace(STRIKE, html, m -> "<del>" + m.group(1) + "</del>");
        return html;
    }

    private static String safeUrl(String url) {
        return SAFE_URL.matcher(url).matches() ? url : "#";
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private static String replace(Pattern pattern, String input, Function<Matcher, String> replacer) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacer.apply(matcher)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
