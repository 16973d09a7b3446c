package com.bookforge.core.renderer;

import com.bookforge.core.token.FootnoteDefinition;
import com.bookforge.core.token.Token;
import com.bookforge.core.token.Tokens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Footnotes of one chapter.
 *
 * <p>Definitions are collected up front; numbers are handed out in the order references
 * are met while rendering, starting at 1. A reference to a label with no definition is
 * recorded as unresolved, and the chapter cannot complete.
 */
public final class FootnoteIndex {

    /**
     * A referenced footnote and its number.
     *
     * @param number one-based footnote number
     * @param definition footnote content
     */
    public record Footnote(int number, FootnoteDefinition definition) {
    }

    private final Map<String, FootnoteDefinition> definitions;
    private final Map<String, Integer> numbers = new HashMap<>();
    private final List<Footnote> referenced = new ArrayList<>();
    private final Set<String> unresolved = new LinkedHashSet<>();

    private FootnoteIndex(Map<String, FootnoteDefinition> definitions) {
        this.definitions = definitions;
    }

    /**
     * Collects the footnote definitions of a chapter.
     *
     * @param tokens chapter tokens
     * @return index with no references yet
     */
    public static FootnoteIndex of(List<Token> tokens) {
        Map<String, FootnoteDefinition> definitions = new LinkedHashMap<>();
        Tokens.walk(tokens, token -> {
            if (token instanceof FootnoteDefinition definition) {
                definitions.putIfAbsent(definition.label(), definition);
            }
        });
        return new FootnoteIndex(definitions);
    }

    /**
     * Records a reference and returns the footnote number.
     *
     * @param label footnote label
     * @return number, empty if the label has no definition
     */
    public OptionalInt reference(String label) {
        Integer existing = numbers.get(label);
        if (existing != null) {
            return OptionalInt.of(existing);
        }
        FootnoteDefinition definition = definitions.get(label);
        if (definition == null) {
            unresolved.add(label);
            return OptionalInt.empty();
        }
        int number = referenced.size() + 1;
        numbers.put(label, number);
        referenced.add(new Footnote(number, definition));
        return OptionalInt.of(number);
    }

    public Optional<FootnoteDefinition> definition(String label) {
        return Optional.ofNullable(definitions.get(label));
    }

    /**
     * Returns the number of footnotes referenced so far.
     *
     * <p>Grows while footnote bodies that reference other footnotes are rendered.
     *
     * @return referenced count
     */
    public int count() {
        return referenced.size();
    }

    public Footnote get(int position) {
        return referenced.get(position);
    }

    public Set<String> unresolved() {
        return Collections.unmodifiableSet(unresolved);
    }
}
