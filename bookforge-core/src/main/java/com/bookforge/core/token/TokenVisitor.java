package com.bookforge.core.token;

/**
 * Visitor over every {@link Token} variant.
 *
 * @param <R> result type of a visit
 */
public interface TokenVisitor<R> {

    R visitText(Text text);

    R visitParagraph(Paragraph paragraph);

    R visitHeader(Header header);

    R visitEmphasis(Emphasis emphasis);

    R visitStrong(Strong strong);

    R visitCodeSpan(CodeSpan code);

    R visitCodeBlock(CodeBlock block);

    R visitBlockQuote(BlockQuote quote);

    R visitBulletList(BulletList list);

    R visitOrderedList(OrderedList list);

    R visitListItem(ListItem item);

    R visitRule(Rule rule);

    R visitLink(Link link);

    R visitImage(Image image);

    R visitSoftBreak(SoftBreak lineBreak);

    R visitHardBreak(HardBreak lineBreak);

    R visitFootnoteReference(FootnoteReference reference);

    R visitFootnoteDefinition(FootnoteDefinition definition);
}
