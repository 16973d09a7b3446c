package com.bookforge.core.renderer.impl;

import com.bookforge.core.book.Book;
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

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Writes token trees as LaTeX. Footnotes are emitted inline with {@code \footnote}.
 */
class LatexBodyWriter implements TokenVisitor<Void> {

    private static final String[] SECTIONS = {"section", "subsection", "subsubsection", "paragraph", "subparagraph"};
    private static final String[] ENUM_COUNTERS = {"enumi", "enumii", "enumiii", "enumiv"};

    private final StringBuilder out = new StringBuilder();
    private final Book book;
    private final FootnoteIndex footnotes;
    private final Set<String> openFootnotes = new HashSet<>();
    private int enumDepth;

    LatexBodyWriter(Book book, FootnoteIndex footnotes) {
        this.book = book;
        this.footnotes = footnotes;
    }

    void write(List<Token> tokens) {
        for (Token token : tokens) {
            token.accept(this);
        }
    }

    String result() {
        return out.toString();
    }

    @Override
    public Void visitText(Text text) {
        out.append(Escaper.LATEX.apply(text.text()));
        return null;
    }

    @Override
    public Void visitParagraph(Paragraph paragraph) {
        write(paragraph.children());
        out.append("\n\n");
        return null;
    }

    @Override
    public Void visitHeader(Header header) {
        String command = SECTIONS[Math.min(Math.max(header.level() - 1, 1), SECTIONS.length) - 1];
        out.append('\\').append(command).append("*{");
        write(header.children());
        out.append("}\n\n");
        return null;
    }

    @Override
    public Void visitEmphasis(Emphasis emphasis) {
        return command("emph", emphasis.children());
    }

    @Override
    public Void visitStrong(Strong strong) {
        return command("textbf", strong.children());
    }

    @Override
    public Void visitCodeSpan(CodeSpan code) {
        out.append("\\texttt{").append(Escaper.LATEX.apply(code.code())).append('}');
        return null;
    }

    @Override
    public Void visitCodeBlock(CodeBlock block) {
        out.append("\\begin{verbatim}\n").append(block.code());
        if (!block.code().endsWith("\n")) {
            out.append('\n');
        }
        out.append("\\end{verbatim}\n\n");
        return null;
    }

    @Override
    public Void visitBlockQuote(BlockQuote quote) {
        return environment("quote", quote.children());
    }

    @Override
    public Void visitBulletList(BulletList list) {
        return environment("itemize", list.children());
    }

    @Override
    public Void visitOrderedList(OrderedList list) {
        out.append("\\begin{enumerate}\n");
        if (list.start() != 1 && enumDepth < ENUM_COUNTERS.length) {
            out.append("\\setcounter{").append(ENUM_COUNTERS[enumDepth]).append("}{").append(list.start() - 1).append("}\n");
        }
        enumDepth++;
        write(list.children());
        enumDepth--;
        out.append("\\end{enumerate}\n\n");
        return null;
    }

    @Override
    public Void visitListItem(ListItem item) {
        out.append("\\item{} ");
        write(item.children());
        out.append('\n');
        return null;
    }

    @Override
    public Void visitRule(Rule rule) {
        out.append("\\begin{center}\\rule{0.5\\linewidth}{0.5pt}\\end{center}\n\n");
        return null;
    }

    @Override
    public Void visitLink(Link link) {
        out.append("\\href{").append(escapeUrl(link.url())).append("}{");
        write(link.children());
        out.append('}');
        return null;
    }

    @Override
    public Void visitImage(Image image) {
        if (image.isRemote()) {
            out.append(Escaper.LATEX.apply(Tokens.plainText(image.children())));
            return null;
        }
        String path = book.resolve(image.url()).toString().replace('\\', '/');
        out.append("\\includegraphics[width=\\linewidth,height=0.8\\textheight,keepaspectratio]{")
            .append(escapeUrl(path)).append('}');
        return null;
    }

    @Override
    public Void visitSoftBreak(SoftBreak lineBreak) {
        out.append('\n');
        return null;
    }

    @Override
    public Void visitHardBreak(HardBreak lineBreak) {
        out.append("\\\\{}\n");
        return null;
    }

    @Override
    public Void visitFootnoteReference(FootnoteReference reference) {
        String label = reference.label();
        footnotes.reference(label);
        Optional<FootnoteDefinition> definition = footnotes.definition(label);
        if (definition.isEmpty()) {
            out.append(Escaper.LATEX.apply("[^" + label + "]"));
            return null;
        }
        if (!openFootnotes.add(label)) {
            return null;
        }
        out.append("\\footnote{");
        int start = out.length();
        write(definition.get().children());
        trimTrailingWhitespace(start);
        out.append('}');
        openFootnotes.remove(label);
        return null;
    }

    @Override
    public Void visitFootnoteDefinition(FootnoteDefinition definition) {
        return null;
    }

    private Void command(String name, List<Token> children) {
        out.append('\\').append(name).append('{');
        write(children);
        out.append('}');
        return null;
    }

    private Void environment(String name, List<Token> children) {
        out.append("\\begin{").append(name).append("}\n");
        write(children);
        out.append("\\end{").append(name).append("}\n\n");
        return null;
    }

    private void trimTrailingWhitespace(int floor) {
        int end = out.length();
        while (end > floor && Character.isWhitespace(out.charAt(end - 1))) {
            end--;
        }
        out.setLength(end);
    }

    private static String escapeUrl(String url) {
        return url.replace("\\", "/").replace("%", "\\%").replace("#", "\\#");
    }
}
