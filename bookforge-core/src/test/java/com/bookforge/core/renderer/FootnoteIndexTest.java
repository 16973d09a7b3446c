package com.bookforge.core.renderer;

import com.bookforge.core.parser.MarkdownParser;
import com.bookforge.core.token.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FootnoteIndexTest {

    private final List<Token> chapter = new MarkdownParser().parse(
        "First[^b] then[^a] and[^b] again.\n\n[^a]: Note A.\n\n[^b]: Note B.\n");

    @Test
    void reference_numbersInOrderOfFirstUse() {
        FootnoteIndex index = FootnoteIndex.of(chapter);

        assertThat(index.reference("b")).hasValue(1);
        assertThat(index.reference("a")).hasValue(2);
        assertThat(index.reference("b")).hasValue(1);
        assertThat(index.count()).isEqualTo(2);
        assertThat(index.get(0).definition().label()).isEqualTo("b");
    }

    @Test
    void reference_withUnknownLabel_isRecordedAsUnresolved() {
        FootnoteIndex index = FootnoteIndex.of(chapter);

        assertThat(index.reference("zzz")).isEmpty();
        assertThat(index.unresolved()).containsExactly("zzz");
        assertThat(index.count()).isZero();
    }

    @Test
    void definition_isAvailableBeforeAnyReference() {
        FootnoteIndex index = FootnoteIndex.of(chapter);

        assertThat(index.definition("a")).isPresent();
        assertThat(index.definition("nope")).isEmpty();
        assertThat(index.count()).isZero();
    }
}
