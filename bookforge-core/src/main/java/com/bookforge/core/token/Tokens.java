package com.bookforge.core.token;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Read-only helpers over token trees.
 */
public final class Tokens {

    private static final TokenVisitor<List<Token>> CHILDREN = new TokenVisitor<>() {
        @Override public List<Token> visitText(Text text) { return List.of(); }
        @Override public List<Token> visitParagraph(Paragraph paragraph) { return paragraph.children(); }
        @Override public List<Token> visitHeader(Header header) { return header.children(); }
        @Override public List<Token> visitEmphasis(Emphasis emphasis) { return emphasis.children(); }
        @Override public List<Token> visitStrong(Strong strong) { return strong.children(); }
        @Override public List<Token> visitCodeSpan(CodeSpan code) { return List.of(); }
        @Override public List<Token> visitCodeBlock(CodeBlock block) { return List.of(); }
        @Override public List<Token> visitBlockQuote(BlockQuote quote) { return quote.children(); }
        @Override public List<Token> visitBulletList(BulletList list) { return list.children(); }
        @Override public List<Token> visitOrderedList(OrderedList list) { return list.children(); }
        @Override public List<Token> visitListItem(ListItem item) { return item.children(); }
        @Override public List<Token> visitRule(Rule rule) { return List.of(); }
        @Override public List<Token> visitLink(Link link) { return link.children(); }
        @Override public List<Token> visitImage(Image image) { return image.children(); }
        @Override public List<Token> visitSoftBreak(SoftBreak lineBreak) { return List.of(); }
        @Override public List<Token> visitHardBreak(HardBreak lineBreak) { return List.of(); }
        @Override public List<Token> visitFootnoteReference(FootnoteReference reference) { return List.of(); }
        @Override public List<Token> visitFootnoteDefinition(FootnoteDefinition definition) { return definition.children(); }
    };

    private Tokens() {
        // Utility class
    }

    /**
     * Returns the direct children of a token, empty for leaves.
     *
     * @param token token to inspect
     * @return unmodifiable list of children
     */
    public static List<Token> children(Token token) {
        return token.accept(CHILDREN);
    }

    /**
     * Visits every token of the given trees in document order (pre-order).
     *
     * @param tokens root tokens
     * @param action action applied to each token
     */
    public static void walk(List<Token> tokens, Consumer<Token> action) {
        for (Token token : tokens) {
            action.accept(token);
            walk(children(token), action);
        }
    }

    /**
     * Flattens inline content to plain text.
     *
     * <p>Breaks become spaces; footnote references and images contribute nothing
     * except image alt text.
     *
     * @param tokens tokens to flatten
     * @return concatenated text
     */
    public static String plainText(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        appendPlainText(tokens, sb);
        return sb.toString();
    }

    private static void appendPlainText(List<Token> tokens, StringBuilder sb) {
        for (Token token : tokens) {
            if (token instanceof Text text) {
                sb.append(text.text());
            } else if (token instanceof CodeSpan code) {
                sb.append(code.code());
            } else if (token instanceof SoftBreak || token instanceof HardBreak) {
                sb.append(' ');
            } else if (!(token instanceof FootnoteReference)) {
                appendPlainText(children(token), sb);
            }
        }
    }

    /**
     * Finds the first level-1 heading among the top-level tokens of a chapter.
     *
     * @param chapter top-level tokens of a chapter
     * @return the chapter title heading, if any
     */
    public static Optional<Header> findTitle(List<Token> chapter) {
        for (Token token : chapter) {
            if (token instanceof Header header && header.level() == 1) {
                return Optional.of(header);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns whether a token is a block-level variant.
     *
     * @param token token to test
     * @return true for paragraphs, headers, lists, list items, quotes, code blocks, rules and footnote definitions
     */
    public static boolean isBlock(Token token) {
        return token instanceof Paragraph
            || token instanceof Header
            || token instanceof BulletList
            || token instanceof OrderedList
            || token instanceof ListItem
            || token instanceof BlockQuote
            || token instanceof CodeBlock
            || token instanceof Rule
            || token instanceof FootnoteDefinition;
    }
}
