package com.tessera.search.query;

import com.tessera.search.context.SearchContext;
import com.tessera.search.interner.Interned;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sequence of words that must appear consecutively in a document.
 */
public record Phrase(List<Interned<String>> words) {

    public Phrase {
        if (words.isEmpty()) {
            throw new IllegalArgumentException("A phrase needs at least one word");
        }
        words = List.copyOf(words);
    }

    public Interned<String> firstWord() {
        return words.get(0);
    }

    public Interned<String> lastWord() {
        return words.get(words.size() - 1);
    }

    public String description(SearchContext ctx) {
        return words.stream().map(ctx::wordText).collect(Collectors.joining(" "));
    }
}
