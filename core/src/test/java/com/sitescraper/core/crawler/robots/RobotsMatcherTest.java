package com.sitescraper.core.crawler.robots;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class RobotsMatcherTest {

    private static boolean allowed(String url, RobotsRules rules) {
        return RobotsMatcher.isAllowed(URI.create(url), rules);
    }

    @Test
    void noMatchingRuleMeansAllowed() {
        RobotsRules r = new RobotsRules().addDisallow("/private");
        assertTrue(allowed("https://ex.com/public", r));
        assertTrue(allowed("https://ex.com/", new RobotsRules()));
    }

    @Test
    void prefixMatchIsPlainPrefix() {
        RobotsRules r = new RobotsRules().addDisallow("/private");
        assertFalse(allowed("https://ex.com/private", r));
        assertFalse(allowed("https://ex.com/private/x", r));
        assertFalse(allowed("https://ex.com/private-data", r));
    }

    @Test
    void longestRuleWinsAndTieGoesToAllow() {
        RobotsRules r = new RobotsRules().addDisallow("/shop").addAllow("/shop/public");
        assertFalse(allowed("https://ex.com/shop/cart", r));
        assertTrue(allowed("https://ex.com/shop/public/item", r));

        RobotsRules tie = new RobotsRules().addDisallow("/page").addAllow("/page");
        assertTrue(allowed("https://ex.com/page", tie));
    }

    @Test
    void wildcardAndEndAnchor() {
        RobotsRules r = new RobotsRules().addDisallow("/*.pdf$").addDisallow("/*?sessionid=");
        assertFalse(allowed("https://ex.com/docs/a.pdf", r));
        assertTrue(allowed("https://ex.com/docs/a.pdf?download=1", r));
        assertFalse(allowed("https://ex.com/cart?sessionid=9", r));
        assertTrue(allowed("https://ex.com/cart?id=9", r));
    }

    @Test
    void disallowAllWithAllowedRoot() {
        RobotsRules r = new RobotsRules().addDisallow("/").addAllow("/$");
        assertTrue(allowed("https://ex.com/", r));
        assertFalse(allowed("https://ex.com/anything", r));
    }

    @Test
    void percentEncodingComparedCaseInsensitively() {
        RobotsRules r = new RobotsRules().addDisallow("/a%2fb");
        assertFalse(allowed("https://ex.com/a%2Fb/c", r));
        assertEquals("/x%3A?q=%2F", RobotsMatcher.normalizeTarget(URI.create("https://ex.com/x%3a?q=%2f")));
    }

    @Test
    void specificityIgnoresWildcards() {
        assertEquals(3, RobotsMatcher.specificity("/a*b$"));
        assertEquals(6, RobotsMatcher.specificity("/a/b/c"));
    }
}
