package com.bookforge.core.template;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EscaperTest {

    @Test
    void xml_escapesMarkupCharacters() {
        assertThat(Escaper.XML.apply("<a & \"b\">")).isEqualTo("&lt;a &amp; &quot;b&quot;&gt;");
    }

    @Test
    void xml_leavesPlainTextAlone() {
        assertThat(Escaper.XML.apply("Hello, world.")).isEqualTo("Hello, world.");
    }

    @Test
    void latex_escapesSpecialCharacters() {
        assertThat(Escaper.LATEX.apply("50% of a_b \\ {x} & #1 $2"))
            .isEqualTo("50\\% of a\\_b \\textbackslash{} \\{x\\} \\& \\#1 \\$2");
    }

    @Test
    void latex_escapesTildeAndCaret() {
        assertThat(Escaper.LATEX.apply("~^")).isEqualTo("\\textasciitilde{}\\textasciicircum{}");
    }

    @Test
    void latex_mapsNonBreakingSpaces() {
        assertThat(Escaper.LATEX.apply("a\u00A0b\u202Fc")).isEqualTo("a~b\\,c");
    }

    @Test
    void latex_leavesPlainTextUnchanged() {
        String text = "Il était une fois, dans un pays lointain.";

        assertThat(Escaper.LATEX.apply(text)).isEqualTo(text);
    }
}
