package com.tessera.search.query;

import com.tessera.search.interner.Interned;

/**
 * The exact form of a query term: either its original word or its quoted phrase.
 * Exactly one of the components is non-null.
 */
public record ExactTerm(Interned<String> word, Interned<Phrase> phrase) {

    public ExactTerm {
        if ((word == null) == (phrase == null)) {
            throw new IllegalArgumentException("An exact term is either a word or a phrase");
        }
    }

    public static ExactTerm ofWord(Interned<String> word) {
        return new ExactTerm(word, null);
    }

    public static ExactTerm ofPhrase(Interned<Phrase> phrase) {
        return new ExactTerm(null, phrase);
    }

    public boolean isPhrase() {
        return phrase != null;
    }
}
