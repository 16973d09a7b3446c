package com.bookforge.core.parser;

import com.bookforge.core.cleaner.Cleaner;
import com.bookforge.core.cleaner.NoOpCleaner;
import com.bookforge.core.error.ParseException;
import com.bookforge.core.error.ResourceNotFoundException;
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
import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.HtmlCommentBlock;
import com.vladsch.flexmark.ast.HtmlEntity;
import com.vladsch.flexmark.ast.HtmlInline;
import com.vladsch.flexmark.ast.HtmlInlineComment;
import com.vladsch.flexmark.ast.ImageRef;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.LinkRef;
import com.vladsch.flexmark.ast.MailLink;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.footnotes.Footnote;
import com.vladsch.flexmark.ext.footnotes.FootnoteBlock;
import com.vladsch.flexmark.ext.footnotes.FootnoteExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Parses Markdown chapters into {@link Token} trees.
 *
 * <p>Markdown is parsed with flexmark (CommonMark plus the footnotes extension) and the
 * resulting AST is converted node by node, in source order. Every text run is passed
 * through the {@link Cleaner} at the moment it is emitted, so cleaning sees the leaf
 * boundaries the parser produced.
 *
 * <p>The parser never fails on content. Unclosed delimiters, undefined link references
 * and undefined footnotes come out as literal text; raw HTML is kept as literal text;
 * HTML comments are dropped. Only I/O level problems raise exceptions, from
 * {@link #parseFile(Path)}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MarkdownParser parser = new MarkdownParser(Cleaner.forLanguage("fr", true, ' '));
 * List<Token> chapter = parser.parseFile(Path.of("/books/novel/chapter_01.md"));
 * }</pre>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public class MarkdownParser {

    private static final Logger log = LoggerFactory.getLogger(MarkdownParser.class);

    private final Parser parser;
    private final Cleaner cleaner;

    /**
     * Creates a parser that leaves text untouched.
     */
    public MarkdownParser() {
        this(NoOpCleaner.INSTANCE);
    }

    /**
     * Creates a parser applying the given cleaner to every text run.
     *
     * @param cleaner cleaner to apply
     */
    public MarkdownParser(Cleaner cleaner) {
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner must not be null");
        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, Arrays.asList(FootnoteExtension.create()))
            .set(Parser.BLANK_LINES_IN_AST, false);
        this.parser = Parser.builder(options).build();
    }

    /**
     * Returns the cleaner applied to text runs.
     *
     * @return cleaner
     */
    public Cleaner getCleaner() {
        return cleaner;
    }

    /**
     * Parses Markdown text.
     *
     * @param markdown Markdown source
     * @return top-level tokens in source order
     */
    public List<Token> parse(String markdown) {
        Objects.requireNonNull(markdown, "markdown must not be null");
        Document document = parser.parse(stripBom(markdown));
        return new Converter(document).blocks(document);
    }

    /**
     * Reads and parses a UTF-8 Markdown file.
     *
     * @param file chapter file
     * @return top-level tokens in source order
     * @throws ResourceNotFoundException if the file does not exist
     * @throws ParseException if the file cannot be read or is not valid UTF-8
     */
    public List<Token> parseFile(Path file) throws ResourceNotFoundException, ParseException {
        log.debug("Parsing chapter file: {}", file);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ResourceNotFoundException(file, e);
        } catch (CharacterCodingException e) {
            throw new ParseException(file, "file contains invalid UTF-8", e);
        } catch (IOException e) {
            throw new ParseException(file, "file could not be read: " + e.getMessage(), e);
        }
        List<Token> tokens = parse(content);
        log.debug("Parsed {} top-level tokens from {}", tokens.size(), file);
        return tokens;
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }

    /**
     * Single-use converter from a flexmark document to tokens.
     */
    private final class Converter {

        private final Document document;
        private boolean lineStart = true;

        Converter(Document document) {
            this.document = document;
        }

        List<Token> blocks(Node parent) {
            List<Token> out = new ArrayList<>();
            for (Node child : parent.getChildren()) {
                block(child, out);
            }
            return out;
        }

        private void block(Node node, List<Token> out) {
            if (node instanceof com.vladsch.flexmark.ast.Paragraph) {
                out.add(new Paragraph(inlines(node)));
            } else if (node instanceof Heading heading) {
                out.add(new Header(Math.max(1, Math.min(6, heading.getLevel())), inlines(node)));
            } else if (node instanceof com.vladsch.flexmark.ast.BlockQuote) {
                out.add(new BlockQuote(blocks(node)));
            } else if (node instanceof com.vladsch.flexmark.ast.BulletList) {
                out.add(new BulletList(blocks(node)));
            } else if (node instanceof com.vladsch.flexmark.ast.OrderedList list) {
                out.add(new OrderedList(list.getStartNumber(), blocks(node)));
            } else if (node instanceof com.vladsch.flexmark.ast.ListItem) {
                out.add(new ListItem(blocks(node)));
            } else if (node instanceof FencedCodeBlock fenced) {
                out.add(new CodeBlock(language(fenced.getInfo().toString()),
                    stripTrailingNewline(fenced.getContentChars().toString())));
            } else if (node instanceof IndentedCodeBlock indented) {
                out.add(new CodeBlock("", stripTrailingNewline(dedent(indented.getContentChars().toString()))));
            } else if (node instanceof ThematicBreak) {
                out.add(new Rule());
            } else if (node instanceof FootnoteBlock footnote) {
                out.add(new FootnoteDefinition(footnote.getText().toString(), blocks(node)));
            } else if (node instanceof HtmlCommentBlock || node instanceof Reference) {
                // dropped: comments and link reference definitions carry no content
            } else if (node instanceof HtmlBlock) {
                lineStart = true;
                out.add(new Paragraph(List.of(text(stripTrailingNewline(node.getChars().toString())))));
            } else if (node.hasChildren()) {
                for (Node child : node.getChildren()) {
                    block(child, out);
                }
            }
        }

        private List<Token> inlines(Node parent) {
            lineStart = true;
            List<Token> out = new ArrayList<>();
            appendInlines(parent, out);
            return out;
        }

        private void appendInlines(Node parent, List<Token> out) {
            for (Node child : parent.getChildren()) {
                inline(child, out);
            }
        }

        private List<Token> nested(Node parent) {
            List<Token> out = new ArrayList<>();
            appendInlines(parent, out);
            return out;
        }

        private void inline(Node node, List<Token> out) {
            if (node instanceof com.vladsch.flexmark.ast.Text) {
                out.add(text(node.getChars().unescape()));
            } else if (node instanceof HtmlEntity) {
                out.add(text(node.getChars().unescape()));
            } else if (node instanceof com.vladsch.flexmark.ast.Emphasis) {
                out.add(new Emphasis(nested(node)));
            } else if (node instanceof StrongEmphasis) {
                out.add(new Strong(nested(node)));
            } else if (node instanceof Code code) {
                out.add(new CodeSpan(code.getText().toString()));
                lineStart = false;
            } else if (node instanceof com.vladsch.flexmark.ast.Link link) {
                out.add(new Link(link.getUrl().unescape(), link.getTitle().unescape(), nested(node)));
            } else if (node instanceof com.vladsch.flexmark.ast.Image image) {
                out.add(new Image(image.getUrl().unescape(), image.getTitle().unescape(), nested(node)));
            } else if (node instanceof LinkRef ref) {
                Reference reference = ref.isDefined() ? ref.getReferenceNode(document) : null;
                if (reference == null) {
                    out.add(text(node.getChars().unescape()));
                } else {
                    out.add(new Link(reference.getUrl().unescape(), reference.getTitle().unescape(), nested(node)));
                }
            } else if (node instanceof ImageRef ref) {
                Reference reference = ref.isDefined() ? ref.getReferenceNode(document) : null;
                if (reference == null) {
                    out.add(text(node.getChars().unescape()));
                } else {
                    out.add(new Image(reference.getUrl().unescape(), reference.getTitle().unescape(), nested(node)));
                }
            } else if (node instanceof AutoLink autoLink) {
                String url = autoLink.getText().toString();
                out.add(new Link(url, "", List.of(new Text(url))));
                lineStart = false;
            } else if (node instanceof MailLink mailLink) {
                String address = mailLink.getText().toString();
                out.add(new Link("mailto:" + address, "", List.of(new Text(address))));
                lineStart = false;
            } else if (node instanceof Footnote footnote) {
                if (footnote.isDefined()) {
                    out.add(new FootnoteReference(footnote.getText().toString()));
                    lineStart = false;
                } else {
                    out.add(text("[^" + footnote.getText() + "]"));
                }
            } else if (node instanceof SoftLineBreak) {
                out.add(new SoftBreak());
                lineStart = true;
            } else if (node instanceof HardLineBreak) {
                out.add(new HardBreak());
                lineStart = true;
            } else if (node instanceof HtmlInlineComment) {
                // dropped
            } else if (node instanceof HtmlInline) {
                out.add(text(node.getChars().toString()));
            } else if (node.hasChildren()) {
                appendInlines(node, out);
            } else if (node.getTextLength() > 0) {
                out.add(text(node.getChars().unescape()));
            }
        }

        private Text text(String raw) {
            String cleaned = cleaner.clean(raw, lineStart);
            lineStart = false;
            return new Text(cleaned);
        }
    }

    private static String language(String info) {
        String trimmed = info.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    private static String stripTrailingNewline(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) {
            end--;
        }
        return s.substring(0, end);
    }

    /**
     * Removes the indentation shared by every non-blank line.
     */
    static String dedent(String code) {
        String[] lines = code.split("\n", -1);
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int indent = 0;
            while (indent < line.length() && line.charAt(indent) == ' ') {
                indent++;
            }
            common = Math.min(common, indent);
        }
        if (common == 0 || common == Integer.MAX_VALUE) {
            return code;
        }
        StringBuilder sb = new StringBuilder(code.length());
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            sb.append(line.length() >= common ? line.substring(common) : line.stripLeading());
            if (i < lines.length - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
