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

import java.util.List;
import java.util.OptionalInt;
import java.util.function.UnaryOperator;

/**
 * Writes token trees as HTML markup, well-formed enough to be used as XHTML too.
 *
 * <p>Shared by the HTML and EPUB renderers. Footnote definitions are skipped where
 * they appear and written by {@link #writeFootnotes()} after the chapter body.
 */
class HtmlBodyWriter implements TokenVisitor<Void> {

    private final StringBuilder out = new StringBuilder();
    private final FootnoteIndex footnotes;
    private final String idPrefix;
    private final UnaryOperator<String> imageSource;

    /**
     * @param footnotes footnotes of the chapter being written
     * @param idPrefix prefix making footnote anchors unique within a page
     * @param imageSource maps an image url to the {@code src} attribute value
     */
    HtmlBodyWriter(FootnoteIndex footnotes, String idPrefix, UnaryOperator<String> imageSource) {
        this.footnotes = footnotes;
        this.idPrefix = idPrefix;
        this.imageSource = imageSource;
    }

    void write(List<Token> tokens) {
        for (Token token : tokens) {
            token.accept(this);
        }
    }

    /**
     * Writes the footnotes referenced so far, including ones referenced from other footnotes.
     */
    void writeFootnotes() {
        if (footnotes.count() == 0) {
            return;
        }
        out.append("<div class=\"footnotes\">\n<hr />\n");
        for (int i = 0; i < footnotes.count(); i++) {
            FootnoteIndex.Footnote footnote = footnotes.get(i);
            int n = footnote.number();
            out.append("<div class=\"footnote\" id=\"").append(noteId(n)).append("\">\n")
                .append("<a class=\"footnote-back\" href=\"#").append(refId(n)).append("\">")
                .append(n).append(".</a>\n");
            write(footnote.definition().children());
            out.append("</div>\n");
        }
        out.append("</div>\n");
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
        out.append("<p>");
        write(paragraph.children());
        out.append("</p>\n");
        return null;
    }

    @Override
    public Void visitHeader(Header header) {
        out.append("<h").append(header.level()).append('>');
        write(header.children());
        out.append("</h").append(header.level()).append(">\n");
        return null;
    }

    @Override
    public Void visitEmphasis(Emphasis emphasis) {
        return inline("em", emphasis.children());
    }

    @Override
    public Void visitStrong(Strong strong) {
        return inline("strong", strong.children());
    }

    @Override
    public Void visitCodeSpan(CodeSpan code) {
        out.append("<code>").append(escape(code.code())).append("</code>");
        return null;
    }

    @Override
    public Void visitCodeBlock(CodeBlock block) {
        out.append("<pre><code");
        if (!block.language().isEmpty()) {
            out.append(" class=\"language-").append(escape(block.language())).append('"');
        }
        out.append('>').append(escape(block.code())).append("</code></pre>\n");
        return null;
    }

    @Override
    public Void visitBlockQuote(BlockQuote quote) {
        out.append("<blockquote>\n");
        write(quote.children());
        out.append("</blockquote>\n");
        return null;
    }

    @Override
    public Void visitBulletList(BulletList list) {
        out.append("<ul>\n");
        write(list.children());
        out.append("</ul>\n");
        return null;
    }

    @Override
    public Void visitOrderedList(OrderedList list) {
        out.append("<ol");
        if (list.start() != 1) {
            out.append(" start=\"").append(list.start()).append('"');
        }
        out.append(">\n");
        write(list.children());
        out.append("</ol>\n");
        return null;
    }

    @Override
    public Void visitListItem(ListItem item) {
        out.append("<li>");
        write(item.children());
        out.append("</li>\n");
        return null;
    }

    @Override
    public Void visitRule(Rule rule) {
        out.append("<hr />\n");
        return null;
    }

    @Override
    public Void visitLink(Link link) {
        out.append("<a href=\"").append(escape(link.url())).append('"');
        if (!link.title().isEmpty()) {
            out.append(" title=\"").append(escape(link.title())).append('"');
        }
        out.append('>');
        write(link.children());
        out.append("</a>");
        return null;
    }

    @Override
    public Void visitImage(Image image) {
        out.append("<img src=\"").append(escape(imageSource.apply(image.url())))
            .append("\" alt=\"").append(escape(Tokens.plainText(image.children()))).append('"');
        if (!image.title().isEmpty()) {
            out.append(" title=\"").append(escape(image.title())).append('"');
        }
        out.append(" />");
        return null;
    }

    @Override
    public Void visitSoftBreak(SoftBreak lineBreak) {
        out.append('\n');
        return null;
    }

    @Override
    public Void visitHardBreak(HardBreak lineBreak) {
        out.append("<br />\n");
        return null;
    }

    @Override
    public Void visitFootnoteReference(FootnoteReference reference) {
        OptionalInt number = footnotes.reference(reference.label());
        if (number.isEmpty()) {
            out.append(escape("[^" + reference.label() + "]"));
            return null;
        }
        int n = number.getAsInt();
        out.append("<a class=\"footnote-ref\" id=\"").append(refId(n)).append("\" href=\"#")
            .append(noteId(n)).append("\"><sup>").append(n).append("</sup></a>");
        return null;
    }

    @Override
    public Void visitFootnoteDefinition(FootnoteDefinition definition) {
        return null;
    }

    private Void inline(String tag, List<Token> children) {
        out.append('<').append(tag).append('>');
        write(children);
        out.append("</").append(tag).append('>');
        return null;
    }

    private String refId(int n) {
        return idPrefix + "fnref" + n;
    }

    private String noteId(int n) {
        return idPrefix + "fn" + n;
    }

    private static String escape(String text) {
        return Escaper.XML.apply(text);
    }
}
