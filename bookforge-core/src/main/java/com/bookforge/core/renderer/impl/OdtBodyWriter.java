package com.bookforge.core.renderer.impl;

import com.bookforge.core.renderer.FootnoteIndex;
import com.bookforge.core.template.Escaper;
import com.bookforge.core.token.BlockQuote;
import com.bookforge.core.token.BulletList;
import com.bookforge.core.token.CodeBlock;
import com.bookforge.core.token.CodeSpan;
import com.bookforge.core.token.Emphasis;
import com.bookforge.core.token.FootnoteDefinition;
import com.bookforge.core.token.FootnoteReference;
import com.bookforge.core.token.HardBreak;
import com.bookforge.core.token.Header;
import com.bookforge.core.token.Image;
import com.bookforge.core.token.Link;
import com.bookforge.core.token.ListItem;
import com.bookforge.core.token.OrderedList;
import com.bookforge.core.token.Paragraph;
import com.bookforge.core.token.Rule;
import com.bookforge.core.token.SoftBreak;
import com.bookforge.core.token.Strong;
import com.bookforge.core.token.Text;
import com.bookforge.core.token.Token;
import com.bookforge.core.token.TokenVisitor;
import com.bookforge.core.token.Tokens;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Writes token trees as ODF text markup for {@code content.xml}.
 *
 * <p>Style names refer to the styles declared in the built-in {@code styles.xml}.
 * Footnotes become native {@code text:note} elements at the reference point.
 */
class OdtBodyWriter implements TokenVisitor<Void> {

    static final String BODY_STYLE = "Text_20_body";
    private static final String QUOTE_STYLE = "Quotations";
    private static final String CODE_STYLE = "Preformatted_20_Text";
    private static final String NOTE_STYLE = "Footnote";

    private final StringBuilder out = new StringBuilder();
    private final FootnoteIndex footnotes;
    private final String notePrefix;
    private final Map<String, OdtImage> images;
    private final Set<String> openFootnotes = new HashSet<>();
    private String paragraphStyle = BODY_STYLE;
    private int listDepth;
    private int frameCount;

    /**
     * Embedded image and its display size.
     *
     * @param href path inside the package
     * @param widthCm display width in centimetres
     * @param heightCm display height in centimetres
     */
    record OdtImage(String href, double widthCm, double heightCm) {
    }

    OdtBodyWriter(FootnoteIndex footnotes, String notePrefix, Map<String, OdtImage> images) {
        this.footnotes = footnotes;
        this.notePrefix = notePrefix;
        this.images = images;
    }

    /**
     * Writes block content; runs of inline tokens are wrapped in a paragraph.
     *
     * @param tokens tokens to write
     */
    void write(List<Token> tokens) {
        List<Token> inline = new ArrayList<>();
        for (Token token : tokens) {
            if (Tokens.isBlock(token)) {
                flushInline(inline);
                token.accept(this);
            } else {
                inline.add(token);
            }
        }
        flushInline(inline);
    }

    String result() {
        return out.toString();
    }

    @Override
    public Void visitText(Text text) {
        out.append(escape(text.text()));
        return null;
    }

    @Override
    public Void visitParagraph(Paragraph paragraph) {
        out.append("<text:p text:style-name=\"").append(paragraphStyle).append("\">");
        writeInline(paragraph.children());
        out.append("</text:p>\n");
        return null;
    }

    @Override
    public Void visitHeader(Header header) {
        int level = Math.min(header.level() + 1, 10);
        out.append("<text:h text:style-name=\"Heading_20_").append(level)
            .append("\" text:outline-level=\"").append(level).append("\">");
        writeInline(header.children());
        out.append("</text:h>\n");
        return null;
    }

    @Override
    public Void visitEmphasis(Emphasis emphasis) {
        return span("Emphasis", emphasis.children());
    }

    @Override
    public Void visitStrong(Strong strong) {
        return span("Strong_20_Emphasis", strong.children());
    }

    @Override
    public Void visitCodeSpan(CodeSpan code) {
        out.append("<text:span text:style-name=\"Source_20_Text\">")
            .append(preserveSpaces(code.code())).append("</text:span>");
        return null;
    }

    @Override
    public Void visitCodeBlock(CodeBlock block) {
        for (String line : block.code().split("\n", -1)) {
            out.append("<text:p text:style-name=\"").append(CODE_STYLE).append("\">")
                .append(preserveSpaces(line)).append("</text:p>\n");
        }
        return null;
    }

    @Override
    public Void visitBlockQuote(BlockQuote quote) {
        String previous = paragraphStyle;
        paragraphStyle = QUOTE_STYLE;
        write(quote.children());
        paragraphStyle = previous;
        return null;
    }

    @Override
    public Void visitBulletList(BulletList list) {
        return list("List_20_1", list.children(), 1);
    }

    @Override
    public Void visitOrderedList(OrderedList list) {
        return list("Numbering_20_1", list.children(), list.start());
    }

    @Override
    public Void visitListItem(ListItem item) {
        out.append("<text:list-item>");
        write(item.children());
        out.append("</text:list-item>\n");
        return null;
    }

    @Override
    public Void visitRule(Rule rule) {
        out.append("<text:p text:style-name=\"Horizontal_20_Line\"/>\n");
        return null;
    }

    @Override
    public Void visitLink(Link link) {
        out.append("<text:a xlink:type=\"simple\" xlink:href=\"").append(escape(link.url())).append("\">");
        writeInline(link.children());
        out.append("</text:a>");
        return null;
    }

    @Override
    public Void visitImage(Image image) {
        OdtImage embedded = images.get(image.url());
        String alt = Tokens.plainText(image.children());
        if (embedded == null) {
            out.append(escape(alt.isEmpty() ? image.url() : alt));
            return null;
        }
        frameCount++;
        out.append("<draw:frame draw:name=\"").append(notePrefix).append("img").append(frameCount)
            .append("\" text:anchor-type=\"as-char\" svg:width=\"").append(cm(embedded.widthCm()))
            .append("\" svg:height=\"").append(cm(embedded.heightCm())).append("\">")
            .append("<draw:image xlink:href=\"").append(embedded.href())
            .append("\" xlink:type=\"simple\" xlink:show=\"embed\" xlink:actuate=\"onLoad\"/>");
        if (!alt.isEmpty()) {
            out.append("<svg:desc>").append(escape(alt)).append("</svg:desc>");
        }
        out.append("</draw:frame>");
        return null;
    }

    @Override
    public Void visitSoftBreak(SoftBreak lineBreak) {
        out.append(' ');
        return null;
    }

    @Override
    public Void visitHardBreak(HardBreak lineBreak) {
        out.append("<text:line-break/>");
        return null;
    }

    @Override
    public Void visitFootnoteReference(FootnoteReference reference) {
        String label = reference.label();
        OptionalInt number = footnotes.reference(label);
        Optional<FootnoteDefinition> definition = footnotes.definition(label);
        if (number.isEmpty() || definition.isEmpty()) {
            out.append(escape("[^" + label + "]"));
            return null;
        }
        if (!openFootnotes.add(label)) {
            return null;
        }
        int n = number.getAsInt();
        String previous = paragraphStyle;
        paragraphStyle = NOTE_STYLE;
        out.append("<text:note text:id=\"").append(notePrefix).append("ftn").append(n)
            .append("\" text:note-class=\"footnote\"><text:note-citation>").append(n)
            .append("</text:note-citation><text:note-body>");
        write(definition.get().children());
        out.append("</text:note-body></text:note>");
        paragraphStyle = previous;
        openFootnotes.remove(label);
        return null;
    }

    @Override
    public Void visitFootnoteDefinition(FootnoteDefinition definition) {
        return null;
    }

    private Void list(String style, List<Token> items, int start) {
        out.append("<text:list");
        if (listDepth == 0) {
            out.append(" text:style-name=\"").append(style).append('"');
        }
        out.append(">\n");
        listDepth++;
        boolean first = true;
        for (Token item : items) {
            if (first && start != 1 && item instanceof ListItem listItem) {
                out.append("<text:list-item text:start-value=\"").append(start).append("\">");
                write(listItem.children());
                out.append("</text:list-item>\n");
            } else {
                item.accept(this);
            }
            first = false;
        }
        listDepth--;
        out.append("</text:list>\n");
        return null;
    }

    private Void span(String style, List<Token> children) {
        out.append("<text:span text:style-name=\"").append(style).append("\">");
        writeInline(children);
        out.append("</text:span>");
        return null;
    }

    private void writeInline(List<Token> tokens) {
        for (Token token : tokens) {
            token.accept(this);
        }
    }

    private void flushInline(List<Token> inline) {
        if (inline.isEmpty()) {
            return;
        }
        out.append("<text:p text:style-name=\"").append(paragraphStyle).append("\">");
        writeInline(inline);
        out.append("</text:p>\n");
        inline.clear();
    }

    /**
     * Escapes text, keeping runs of spaces and tabs that ODF would otherwise collapse.
     */
    static String preserveSpaces(String text) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\t') {
                sb.append("<text:tab/>");
                i++;
            } else if (c == ' ') {
                int run = 0;
                while (i < text.length() && text.charAt(i) == ' ') {
                    run++;
                    i++;
                }
                sb.append(' ');
                if (run > 1) {
                    sb.append("<text:s text:c=\"").append(run - 1).append("\"/>");
                }
            } else {
                int end = i;
                while (end < text.length() && text.charAt(end) != ' ' && text.charAt(end) != '\t') {
                    end++;
                }
                sb.append(escape(text.substring(i, end)));
                i = end;
            }
        }
        return sb.toString();
    }

    private static String cm(double value) {
        return String.format(Locale.ROOT, "%.2fcm", value);
    }

    private static String escape(String text) {
        return Escaper.XML.apply(text);
    }
}
