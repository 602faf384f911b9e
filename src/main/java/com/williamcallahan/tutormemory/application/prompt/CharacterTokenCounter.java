package com.williamcallahan.tutormemory.application.prompt;

/**
 * Counts one token per UTF-16 character. Useful as a predictable proxy in tests and for
 * providers without a published tokenizer.
 */
public class CharacterTokenCounter implements TokenCounter {

    @Override
    public int count(String text) {
        return text == null ? 0 : text.length();
    }
}
