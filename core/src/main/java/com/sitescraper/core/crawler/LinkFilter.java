package com.sitescraper.core.crawler;

import com.sitescraper.core.model.ScrapeConfig;
import com.sitescraper.core.util.UrlExclusion;
import com.sitescraper.core.util.UrlUtils;

import java.net.URI;
import java.util.List;

/** 발견 링크를 frontier 에 넣을지 판단: 스킴, 도메인 스코프, 확장자, 제외 패턴 */
public final class LinkFilter {

    private final String scopeHost;
    private final boolean sameDomainOnly;
    private final boolean includeSubdomains;
    private final List<String> skipExtensions;
    private final List<String> excludePaths;

    public LinkFilter(String scopeHost, ScrapeConfig cfg) {
        this.scopeHost = scopeHost;
        this.sameDomainOnly = cfg.isSameDomainOnly();
        this.includeSubdomains = cfg.isIncludeSubdomains();
        this.skipExtensions = cfg.getSkipExtensions();
        this.excludePaths = cfg.getExcludePaths();
    }

    public boolean accept(URI link) {
        if (!UrlUtils.isHttp(link)) return false;
        if (sameDomainOnly && !UrlUtils.inScope(link, scopeHost, includeSubdomains)) return false;
        if (UrlExclusion.hasSkippedExtension(link, skipExtensions)) return false;
        return !UrlExclusion.isExcluded(link, excludePaths);
    }

    public String scopeHost() { return scopeHost; }
}
