package uk.gegc.mdexport.features.markdown.infra;

import org.commonmark.Extension;
import org.commonmark.ext.autolink.AutolinkExtension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.AttributeProvider;
import org.commonmark.renderer.html.HtmlRenderer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.markdown.domain.BlockType;
import uk.gegc.mdexport.features.markdown.domain.ContentBlock;
import uk.gegc.mdexport.features.markdown.domain.HeadingEntry;
import uk.gegc.mdexport.features.markdown.domain.HeadingIdGenerator;
import uk.gegc.mdexport.features.markdown.domain.MarkdownConversionException;
import uk.gegc.mdexport.features.markdown.domain.MarkdownConverter;
import uk.gegc.mdexport.features.markdown.domain.RenderedMarkdown;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * GitHub-flavoured markdown converter backed by commonmark-java.
 * Raw HTML in the source is escaped and unsafe link schemes are dropped.
 */
@Component
@Order(1)
public class CommonMarkMarkdownConverter implements MarkdownConverter {

    static final String HIGHLIGHT_CLASS = "hljs";

    private static final List<Extension> EXTENSIONS = List.of(
            TablesExtension.create(),
            StrikethroughExtension.create(),
            AutolinkExtension.create(),
            TaskListItemsExtension.create()
    );

    private final Parser parser = Parser.builder()
            .extensions(EXTENSIONS)
            .build();

    @Override
    public String name() {
        return "commonmark";
    }

    @Override
    public RenderedMarkdown render(String markdown) throws MarkdownConversionException {
        try {
            Node document = parser.parse(markdown);

            Map<Node, String> headingIds = new IdentityHashMap<>();
            List<HeadingEntry> headings = new ArrayList<>();
            HeadingIdGenerator ids = new HeadingIdGenerator();
            document.accept(new AbstractVisitor() {
                @Override
                public void visit(Heading heading) {
                    String text = plainText(heading);
                    String id = ids.next(text);
                    headingIds.put(heading, id);
                    headings.add(new HeadingEntry(heading.getLevel(), text, id));
                }
            });

            HtmlRenderer renderer = HtmlRenderer.builder()
                    .extensions(EXTENSIONS)
                    .escapeHtml(true)
                    .sanitizeUrls(true)
                    .attributeProviderFactory(context -> new ExportAttributeProvider(headingIds))
                    .build();

            List<ContentBlock> blocks = new ArrayList<>();
            Node child = document.getFirstChild();
            while (child != null) {
                blocks.add(toBlock(child, renderer.render(child)));
                child = child.getNext();
            }
            return new RenderedMarkdown(blocks, headings);
        } catch (RuntimeException e) {
            throw new MarkdownConversionException("CommonMark conversion failed: " + e.getMessage(), e);
        }
    }

    private static ContentBlock toBlock(Node node, String html) {
        String text = plainText(node);
        if (node instanceof Heading heading) {
            return ContentBlock.heading(heading.getLevel(), text, html);
        }
        return ContentBlock.of(blockType(node), text, html);
    }

    private static BlockType blockType(Node node) {
        if (node instanceof BulletList || node instanceof OrderedList) {
            return BlockType.LIST;
        }
        if (node instanceof FencedCodeBlock || node instanceof IndentedCodeBlock) {
            return BlockType.CODE;
        }
        if (node instanceof BlockQuote) {
            return BlockType.QUOTE;
        }
        if (node instanceof TableBlock) {
            return BlockType.TABLE;
        }
        if (node instanceof ThematicBreak) {
            return BlockType.RULE;
        }
        if (node instanceof HtmlBlock) {
            return BlockType.HTML;
        }
        return BlockType.PARAGRAPH;
    }

    static String plainText(Node node) {
        StringBuilder sb = new StringBuilder();
        node.accept(new AbstractVisitor() {
            @Override
            public void visit(Text text) {
                sb.append(text.getLiteral());
            }

            @Override
            public void visit(Code code) {
                sb.append(code.getLiteral());
            }

            @Override
            public void visit(FencedCodeBlock codeBlock) {
                sb.append(codeBlock.getLiteral());
            }

            @Override
            public void visit(IndentedCodeBlock codeBlock) {
                sb.append(codeBlock.getLiteral());
            }

            @Override
            public void visit(SoftLineBreak softLineBreak) {
                sb.append(' ');
            }

            @Override
            public void visit(HardLineBreak hardLineBreak) {
                sb.append(' ');
            }
        });
        return sb.toString().trim();
    }

    private record ExportAttributeProvider(Map<Node, String> headingIds) implements AttributeProvider {

        @Override
        public void setAttributes(Node node, String tagName, Map<String, String> attributes) {
            if (node instanceof Heading) {
                String id = headingIds.get(node);
                if (id != null) {
                    attributes.put("id", id);
                }
            } else if ("code".equals(tagName)
                    && (node instanceof FencedCodeBlock || node instanceof IndentedCodeBlock)) {
                String existing = attributes.get("class");
                attributes.put("class", existing == null ? HIGHLIGHT_CLASS : existing + " " + HIGHLIGHT_CLASS);
            }
        }
    }
}
