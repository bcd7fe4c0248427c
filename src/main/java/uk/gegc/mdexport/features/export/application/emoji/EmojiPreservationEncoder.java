package uk.gegc.mdexport.features.export.application.emoji;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps emoji in spans that keep their native glyph rendering when the surrounding
 * palette is overridden (Word in particular recolors plain text glyphs).
 *
 * <p>Two passes over body text nodes:
 * <ol>
 *   <li>pictographic sequences get an {@value #PRESERVE_CLASS} span with inherited color
 *       and an emoji font stack;</li>
 *   <li>a fixed set of frequent symbols that pass one leaves alone (lone dingbats and arrows) get an
 *       {@value #LITERAL_CLASS} span with a literal color.</li>
 * </ol>
 * Text inside script, style, title or an existing wrapper is never touched, so the
 * transform is idempotent.
 */
@Component
public class EmojiPreservationEncoder {

    public static final String PRESERVE_CLASS = "emoji-preserve";
    public static final String LITERAL_CLASS = "emoji-literal";

    static final String EMOJI_FONT_STACK =
            "'Apple Color Emoji','Segoe UI Emoji','Noto Color Emoji','Segoe UI Symbol',sans-serif";

    private static final String MODIFIERS = "(?:\\x{FE0F}|[\\x{1F3FB}-\\x{1F3FF}]|\\x{20E3})*";
    private static final String PICTOGRAPH = "[\\x{1F000}-\\x{1FAFF}\\x{2600}-\\x{27BF}\\x{2B00}-\\x{2BFF}]";
    private static final String KEYCAP = "[0-9#*]\\x{FE0F}?\\x{20E3}";

    // flag pairs first, then keycaps, then pictographs with modifiers and ZWJ continuations
    private static final Pattern EMOJI_SEQUENCE = Pattern.compile(
            "[\\x{1F1E6}-\\x{1F1FF}]{2}"
                    + "|" + KEYCAP
                    + "|" + PICTOGRAPH + MODIFIERS + "(?:\\x{200D}" + PICTOGRAPH + MODIFIERS + ")*");

    private static final Map<String, String> LITERAL_COLORS = literalColors();

    private static final Pattern LITERAL_GLYPH = Pattern.compile(
            "(?:" + String.join("|", LITERAL_COLORS.keySet().stream().map(Pattern::quote).toList()) + ")\\x{FE0F}?");

    private static final Set<String> SKIPPED_TAGS = Set.of("script", "style", "title", "textarea");
    private static final Pattern FULL_DOCUMENT = Pattern.compile("(?i)<html[\\s>]");

    /**
     * Applies both passes to a full document or an HTML fragment.
     */
    public String preserveEmoji(String html) {
        if (html == null || html.isEmpty()) {
            return html == null ? "" : html;
        }
        boolean fullDocument = FULL_DOCUMENT.matcher(html).find();
        Document document = fullDocument ? Jsoup.parse(html) : Jsoup.parseBodyFragment(html);
        document.outputSettings().prettyPrint(false);

        wrapMatches(document.body(), EMOJI_SEQUENCE, EmojiPreservationEncoder::preserveSpanUnlessLiteral);
        wrapMatches(document.body(), LITERAL_GLYPH, EmojiPreservationEncoder::literalSpan);

        return fullDocument ? document.outerHtml() : document.body().html();
    }

    private static void wrapMatches(Element root, Pattern pattern, Function<String, Element> wrapper) {
        List<TextNode> candidates = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode text && !isProtected(text)) {
                candidates.add(text);
            }
        }, root);

        for (TextNode text : candidates) {
            String value = text.getWholeText();
            Matcher matcher = pattern.matcher(value);
            if (!matcher.find()) {
                continue;
            }
            List<Node> replacement = new ArrayList<>();
            int last = 0;
            do {
                if (matcher.start() > last) {
                    replacement.add(new TextNode(value.substring(last, matcher.start())));
                }
                Element wrapped = wrapper.apply(matcher.group());
                replacement.add(wrapped != null ? wrapped : new TextNode(matcher.group()));
                last = matcher.end();
            } while (matcher.find());
            if (last < value.length()) {
                replacement.add(new TextNode(value.substring(last)));
            }
            for (Node node : replacement) {
                text.before(node);
            }
            text.remove();
        }
    }

    private static boolean isProtected(TextNode text) {
        for (Element parent = text.parent() instanceof Element e ? e : null; parent != null; parent = parent.parent()) {
            if (SKIPPED_TAGS.contains(parent.normalName())
                    || parent.hasClass(PRESERVE_CLASS)
                    || parent.hasClass(LITERAL_CLASS)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A lone listed dingbat or arrow is left as text for the literal pass; anything with a
     * modifier, keycap or joiner stays one preserved sequence.
     */
    private static Element preserveSpanUnlessLiteral(String glyph) {
        String base = glyph.replace("\uFE0F", "");
        if (LITERAL_COLORS.containsKey(base) && isTextSymbol(base.codePointAt(0))) {
            return null;
        }
        return preserveSpan(glyph);
    }

    private static boolean isTextSymbol(int codePoint) {
        return (codePoint >= 0x2700 && codePoint <= 0x27BF) || (codePoint >= 0x2B00 && codePoint <= 0x2BFF);
    }

    private static Element preserveSpan(String glyph) {
        return new Element("span")
                .addClass(PRESERVE_CLASS)
                .attr("style", "color:inherit;-webkit-text-fill-color:initial;font-style:normal;"
                        + "font-family:" + EMOJI_FONT_STACK + ";mso-ascii-font-family:'Segoe UI Emoji';"
                        + "mso-hansi-font-family:'Segoe UI Emoji';")
                .attr("data-emoji", glyph)
                .appendText(glyph);
    }

    private static Element literalSpan(String glyph) {
        String color = LITERAL_COLORS.get(glyph.replace("\uFE0F", ""));
        return new Element("span")
                .addClass(LITERAL_CLASS)
                .attr("style", "color:" + color + ";-webkit-text-fill-color:" + color + ";"
                        + "font-family:" + EMOJI_FONT_STACK + ";")
                .attr("data-emoji", glyph)
                .appendText(glyph);
    }

    private static Map<String, String> literalColors() {
        Map<String, String> colors = new LinkedHashMap<>();
        colors.put("✅", "#16a34a");      // white heavy check mark
        colors.put("✔", "#16a34a");
        colors.put("✓", "#16a34a");
        colors.put("❌", "#dc2626");      // cross mark
        colors.put("✗", "#dc2626");
        colors.put("✘", "#dc2626");
        colors.put("⭐", "#f59e0b");      // star
        colors.put("✨", "#f59e0b");      // sparkles
        colors.put("❗", "#dc2626");
        colors.put("❓", "#2563eb");
        colors.put("➡", "#2563eb");
        colors.put("⬆", "#2563eb");
        colors.put("⬇", "#2563eb");
        colors.put("⭕", "#dc2626");
        colors.put("❤", "#e11d48");      // heart
        colors.put("⚠", "#d97706");      // warning
        colors.put("🚀", "#7c3aed"); // rocket
        return colors;
    }
}
