package com.market.intel.pipeline.analysis;

public class UnsupportedLanguageException extends RuntimeException {
    public UnsupportedLanguageException(String language) {
        super("Unsupported language: " + language);
    }
}
