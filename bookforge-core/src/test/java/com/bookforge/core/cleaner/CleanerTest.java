package com.bookforge.core.cleaner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Cleaner} selection and the built-in cleaners.
 */
class CleanerTest {

    private final FrenchCleaner french = new FrenchCleaner('~');

    @Test
    void forLanguage_withAutocleanOff_returnsNoOp() {
        assertThat(Cleaner.forLanguage("fr", false, '~')).isSameAs(NoOpCleaner.INSTANCE);
    }

    @Test
    void forLanguage_withFrenchTag_returnsFrenchCleanerWithNbChar() {
        Cleaner cleaner = Cleaner.forLanguage("fr-CA", true, '~');

        assertThat(cleaner).isInstanceOf(FrenchCleaner.class);
        assertThat(((FrenchCleaner) cleaner).getNbChar()).isEqualTo('~');
    }

    @Test
    void forLanguage_withOtherTag_returnsDefaultCleaner() {
        assertThat(Cleaner.forLanguage("en", true, ' ')).isSameAs(DefaultCleaner.INSTANCE);
        assertThat(Cleaner.forLanguage(null, true, ' ')).isSameAs(DefaultCleaner.INSTANCE);
    }

    @Test
    void noOp_returnsInputUnchanged() {
        String text = "  Hello ,\tworld ! ";

        assertThat(NoOpCleaner.INSTANCE.clean(text, true)).isEqualTo(text);
    }

    @Test
    void defaultCleaner_collapsesSpacesAndTabs() {
        assertThat(DefaultCleaner.INSTANCE.clean("a  b\t\tc \t d", false)).isEqualTo("a b c d");
    }

    @Test
    void defaultCleaner_withNothingToCollapse_returnsSameInstance() {
        String text = "nothing to do";

        assertThat(DefaultCleaner.INSTANCE.clean(text, false)).isSameAs(text);
    }

    @Test
    void french_replacesSpaceBeforeHighPunctuation() {
        assertThat(french.clean("Quoi ? Non ! Enfin ; voilà : fini", false))
            .isEqualTo("Quoi~? Non~! Enfin~; voilà~: fini");
    }

    @Test
    void french_insertsNbCharInsideGuillemets() {
        assertThat(french.clean("Il dit «Bonjour» puis part", false))
            .isEqualTo("Il dit «~Bonjour~» puis part");
    }

    @Test
    void french_replacesSpacesInsideGuillemets() {
        assertThat(french.clean("« Bonjour »", false)).isEqualTo("«~Bonjour~»");
    }

    @Test
    void french_dialogueDashAtLineStart_getsNbChar() {
        assertThat(french.clean("— Oui, dit-il.", true)).isEqualTo("—~Oui, dit-il.");
    }

    @Test
    void french_dialogueDashNotAtLineStart_isUnchanged() {
        assertThat(french.clean("— Oui, dit-il.", false)).isEqualTo("— Oui, dit-il.");
    }

    @Test
    void french_leavesGluedColonsAlone() {
        assertThat(french.clean("Voir http://example.org à 12:30", false))
            .isEqualTo("Voir http://example.org à 12:30");
    }

    @Test
    void french_neverAltersLetters() {
        String cleaned = french.clean("« Ça va ? » — Très bien !", true);

        assertThat(cleaned.replaceAll("[^\\p{L}]", "")).isEqualTo("ÇavaTrèsbien");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "Quoi ?",
        "« Bonjour »",
        "«Bonjour»",
        "— Oui !",
        "a  b\t c",
        "Il dit :« non »",
        "»",
        "«",
        ""
    })
    void french_isIdempotent(String text) {
        for (char nb : new char[] {'~', ' ', '\u00A0', '\u202F'}) {
            FrenchCleaner cleaner = new FrenchCleaner(nb);
            for (boolean first : new boolean[] {true, false}) {
                String once = cleaner.clean(text, first);
                assertThat(cleaner.clean(once, first)).as("nb=U+%04X first=%s", (int) nb, first).isEqualTo(once);
            }
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"a  b", "\t\tx", "plain", "  "})
    void defaultCleaner_isIdempotent(String text) {
        String once = DefaultCleaner.INSTANCE.clean(text, true);

        assertThat(DefaultCleaner.INSTANCE.clean(once, true)).isEqualTo(once);
    }
}
