package uk.gegc.mdexport.features.export.application.generator;

import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.export.domain.model.GeneratedDocument;
import uk.gegc.mdexport.shared.util.CssValues;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

import static uk.gegc.mdexport.shared.util.HtmlEscaper.escape;

/**
 * Document skeleton shared by all generators. Subclasses provide the styles and the
 * header, body and footer sections; this class assembles them, runs the format's
 * post-processing and applies the watermark.
 */
public abstract class AbstractFormatGenerator implements FormatGenerator {

    private static final DateTimeFormatter FOOTER_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    protected final GeneratorSupport support;

    protected AbstractFormatGenerator(GeneratorSupport support) {
        this.support = support;
    }

    protected abstract ExportFormat format();

    @Override
    public boolean supports(ExportFormat format) {
        return format() == format;
    }

    @Override
    public GeneratedDocument generate(GenerationContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n");
        sb.append(openingHtmlTag()).append('\n');
        sb.append("<head>\n");
        sb.append("<meta charset=\"utf-8\">\n");
        sb.append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n");
        sb.append("<title>").append(escape(documentTitle(context))).append("</title>\n");
        sb.append(documentMeta(context.options()));
        sb.append(headExtras(context));
        sb.append("<style>\n");
        sb.append(buildStyles(context));
        if (appliesCustomCss()) {
            sb.append(CssValues.customCss(context.options().customCss())).append('\n');
        }
        sb.append("</style>\n");
        sb.append("</head>\n");
        sb.append("<body>\n");
        sb.append(buildHeader(context));
        sb.append(buildBody(context));
        sb.append(buildFooter(context));
        sb.append(bodyScripts(context));
        sb.append("</body>\n");
        sb.append("</html>\n");

        String html = postProcess(sb.toString());
        if (context.options().hasWatermark()) {
            html = support.getWatermarkInjector().inject(html, context.options().watermarkText(), protectionScriptAllowed());
        }

        String extension = support.getMediaTypeResolver().fileExtensionFor(format());
        String filename = support.getFilenameSanitizer().sanitize(fileBaseName(context), extension);
        return new GeneratedDocument(format(), filename, support.getMediaTypeResolver().contentTypeFor(format()), html);
    }

    protected String openingHtmlTag() {
        return "<html lang=\"en\">";
    }

    protected String documentTitle(GenerationContext context) {
        return context.options().title();
    }

    /**
     * Author and description travel in the head whether or not the visible header is rendered.
     */
    private static String documentMeta(ExportOptions options) {
        StringBuilder sb = new StringBuilder();
        sb.append("<meta name=\"author\" content=\"").append(escape(options.author())).append("\">\n");
        if (options.hasDescription()) {
            sb.append("<meta name=\"description\" content=\"").append(escape(options.description())).append("\">\n");
        }
        return sb.toString();
    }

    protected String headExtras(GenerationContext context) {
        return "";
    }

    protected String bodyScripts(GenerationContext context) {
        return "";
    }

    protected boolean appliesCustomCss() {
        return true;
    }

    /**
     * Browser-only documents may carry the watermark protection script.
     */
    protected boolean protectionScriptAllowed() {
        return support.getProperties().isWatermarkProtectionScript();
    }

    protected String postProcess(String html) {
        return html;
    }

    protected String fileBaseName(GenerationContext context) {
        return context.baseFileName();
    }

    protected String tableOfContents(GenerationContext context) {
        if (!context.options().includeToc()) {
            return "";
        }
        return support.getTocBuilder().build(context.content().metadata().headings());
    }

    protected static String fontFamily(GenerationContext context) {
        return CssValues.fontFamily(context.options().fontFamily());
    }

    protected static String footerDate(GenerationContext context) {
        return FOOTER_DATE.format(context.generatedAt());
    }
}
