package com.sitescraper.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrlExclusionTest {

    private static boolean ex(String url, String... patterns) {
        return UrlExclusion.isExcluded(URI.create(url), List.of(patterns));
    }

    @Test
    void prefixPath() {
        assertTrue(ex("https://ex.com/logout", "/logout"));
        assertTrue(ex("https://ex.com/logout/now", "/logout"));
        assertFalse(ex("https://ex.com/login", "/logout"));
    }

    @Test
    void prefixAbsolute() {
        assertTrue(ex("https://ex.com/private/a", "https://ex.com/private"));
        assertFalse(ex("https://other.com/private/a", "https://ex.com/private"));
    }

    @Test
    void globAnchoredToPath() {
        assertTrue(ex("https://ex.com/admin/users", "/admin/*"));
        assertFalse(ex("https://ex.com/public/admin/users", "/admin/*"));
        assertTrue(ex("https://ex.com/page1", "/page?"));
        assertFalse(ex("https://ex.com/page12", "/page?"));
    }

    @Test
    void regex() {
        assertTrue(ex("https://ex.com/a?SessionId=42", "re:\\?.*sessionid="));
        assertFalse(ex("https://ex.com/a?q=1", "re:\\?.*sessionid="));
    }

    @Test
    void blankOrEmptyPatternsExcludeNothing() {
        assertFalse(ex("https://ex.com/a", " "));
        assertFalse(UrlExclusion.isExcluded(URI.create("https://ex.com/a"), List.of()));
        assertFalse(UrlExclusion.isExcluded(URI.create("https://ex.com/a"), null));
    }

    @Test
    void skippedExtensions() {
        List<String> exts = List.of(".pdf", "JPG");
        assertTrue(UrlExclusion.hasSkippedExtension(URI.create("https://ex.com/doc/file.PDF"), exts));
        assertTrue(UrlExclusion.hasSkippedExtension(URI.create("https://ex.com/img/a.jpg?w=1"), exts));
        assertFalse(UrlExclusion.hasSkippedExtension(URI.create("https://ex.com/pdf/guide"), exts));
        assertFalse(UrlExclusion.hasSkippedExtension(URI.create("https://ex.com/v1.2/page.html"), exts));
    }
}
