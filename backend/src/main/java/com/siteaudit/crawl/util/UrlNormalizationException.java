package com.siteaudit.crawl.util;

public class UrlNormalizationException extends RuntimeException {
    private final String input;

    public UrlNormalizationException(String input, String message) {
        super(message + ": " + input);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
