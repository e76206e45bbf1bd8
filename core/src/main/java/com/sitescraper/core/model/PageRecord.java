package com.sitescraper.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 페이지 하나의 정규화된 추출 결과 (불변).
 * 컬렉션 필드는 null 이 아니며(없으면 빈 값), 문자열 필드는 없으면 "".
 * 단 title 은 title 태그와 h1 이 모두 비어 있으면 null.
 * 구조 데이터(structuredData)는 JSON-LD 블록 하나당 압축된 JSON 문자열 하나.
 */
public final class PageRecord {

    private final URI url;
    private final URI finalUrl;
    private final String title;
    private final String metaDescription;
    private final String metaKeywords;
    private final Map<String, List<String>> headings;
    private final String text;
    private final int wordCount;
    private final Set<URI> links;
    private final List<URI> images;
    private final Set<String> emails;
    private final Set<String> phones;
    private final Set<URI> socialLinks;
    private final Map<String, String> meta;
    private final List<String> paragraphs;
    private final List<List<List<String>>> tables;
    private final List<List<String>> orderedLists;
    private final List<List<String>> unorderedLists;
    private final List<PageForm> forms;
    private final List<URI> scripts;
    private final List<URI> stylesheets;
    private final List<String> structuredData;
    private final Map<URI, String> linkTexts;
    private final Map<URI, String> imageAlts;
    private final int status;
    private final String contentType;
    private final long contentLength;
    private final Instant fetchedAt;

    private PageRecord(Builder b) {
        this.url = Objects.requireNonNull(b.url, "url");
        this.finalUrl = (b.finalUrl == null) ? b.url : b.finalUrl;
        this.title = (b.title == null || b.title.isBlank()) ? null : b.title;
        this.metaDescription = nz(b.metaDescription);
        this.metaKeywords = nz(b.metaKeywords);
        Map<String, List<String>> h = new LinkedHashMap<>();
        b.headings.forEach((k, v) -> h.put(k, List.copyOf(v)));
        this.headings = Collections.unmodifiableMap(h);
        this.text = nz(b.text);
        this.wordCount = Math.max(0, b.wordCount);
        this.links = Collections.unmodifiableSet(new LinkedHashSet<>(b.links));
        this.images = List.copyOf(b.images);
        this.emails = Collections.unmodifiableSet(new LinkedHashSet<>(b.emails));
        this.phones = Collections.unmodifiableSet(new LinkedHashSet<>(b.phones));
        this.socialLinks = Collections.unmodifiableSet(new LinkedHashSet<>(b.socialLinks));
        this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(b.meta));
        this.paragraphs = List.copyOf(b.paragraphs);
        List<List<List<String>>> t = new ArrayList<>();
        for (List<List<String>> table : b.tables) {
            List<List<String>> rows = new ArrayList<>();
            table.forEach(row -> rows.add(List.copyOf(row)));
            t.add(List.copyOf(rows));
        }
        this.tables = List.copyOf(t);
        this.orderedLists = copyNested(b.orderedLists);
        this.unorderedLists = copyNested(b.unorderedLists);
        this.forms = List.copyOf(b.forms);
        this.scripts = List.copyOf(b.scripts);
        this.stylesheets = List.copyOf(b.stylesheets);
        this.structuredData = List.copyOf(b.structuredData);
        this.linkTexts = Collections.unmodifiableMap(new LinkedHashMap<>(b.linkTexts));
        this.imageAlts = Collections.unmodifiableMap(new LinkedHashMap<>(b.imageAlts));
        this.status = b.status;
        this.contentType = nz(b.contentType);
        this.contentLength = Math.max(0, b.contentLength);
        this.fetchedAt = b.fetchedAt;
    }

    private static String nz(String s) { return s == null ? "" : s; }

    private static List<List<String>> copyNested(List<List<String>> src) {
        List<List<String>> out = new ArrayList<>(src.size());
        src.forEach(l -> out.add(List.copyOf(l)));
        return List.copyOf(out);
    }

    public URI getUrl() { return url; }
    public URI getFinalUrl() { return finalUrl; }
    public String getTitle() { return title; }
    public String getMetaDescription() { return metaDescription; }
    public String getMetaKeywords() { return metaKeywords; }
    public Map<String, List<String>> getHeadings() { return headings; }
    public String getText() { return text; }
    public int getWordCount() { return wordCount; }
    public Set<URI> getLinks() { return links; }
    public List<URI> getImages() { return images; }
    public Set<String> getEmails() { return emails; }
    public Set<String> getPhones() { return phones; }
    public Set<URI> getSocialLinks() { return socialLinks; }
    public Map<String, String> getMeta() { return meta; }
    public List<String> getParagraphs() { return paragraphs; }
    /** 표 → 행 → 셀 텍스트 */
    public List<List<List<String>>> getTables() { return tables; }
    public List<List<String>> getOrderedLists() { return orderedLists; }
    public List<List<String>> getUnorderedLists() { return unorderedLists; }
    public List<PageForm> getForms() { return forms; }
    public List<URI> getScripts() { return scripts; }
    public List<URI> getStylesheets() { return stylesheets; }
    public List<String> getStructuredData() { return structuredData; }
    /** 링크 → 앵커 텍스트(최대 100자, 첫 값) */
    public Map<URI, String> getLinkTexts() { return linkTexts; }
    public Map<URI, String> getImageAlts() { return imageAlts; }
    public int getStatus() { return status; }
    public String getContentType() { return contentType; }
    public long getContentLength() { return contentLength; }
    public Instant getFetchedAt() { return fetchedAt; }

    /** fetch 메타데이터만 바꾼 사본 (추출 결과는 그대로) */
    public Builder toBuilder() {
        return builder()
                .url(url).finalUrl(finalUrl).title(title)
                .metaDescription(metaDescription).metaKeywords(metaKeywords)
                .headings(headings).text(text).wordCount(wordCount)
                .links(links).images(images).emails(emails).phones(phones)
                .socialLinks(socialLinks).meta(meta)
                .paragraphs(paragraphs).tables(tables)
                .orderedLists(orderedLists).unorderedLists(unorderedLists)
                .forms(forms).scripts(scripts).stylesheets(stylesheets)
                .structuredData(structuredData).linkTexts(linkTexts).imageAlts(imageAlts)
                .status(status).contentType(contentType).contentLength(contentLength)
                .fetchedAt(fetchedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageRecord r)) return false;
        return wordCount == r.wordCount
                && status == r.status
                && contentLength == r.contentLength
                && url.equals(r.url)
                && finalUrl.equals(r.finalUrl)
                && Objects.equals(title, r.title)
                && metaDescription.equals(r.metaDescription)
                && metaKeywords.equals(r.metaKeywords)
                && headings.equals(r.headings)
                && text.equals(r.text)
                && new ArrayList<>(links).equals(new ArrayList<>(r.links))
                && images.equals(r.images)
                && new ArrayList<>(emails).equals(new ArrayList<>(r.emails))
                && new ArrayList<>(phones).equals(new ArrayList<>(r.phones))
                && new ArrayList<>(socialLinks).equals(new ArrayList<>(r.socialLinks))
                && meta.equals(r.meta)
                && paragraphs.equals(r.paragraphs)
                && tables.equals(r.tables)
                && orderedLists.equals(r.orderedLists)
                && unorderedLists.equals(r.unorderedLists)
                && forms.equals(r.forms)
                && scripts.equals(r.scripts)
                && stylesheets.equals(r.stylesheets)
                && structuredData.equals(r.structuredData)
                && new ArrayList<>(linkTexts.entrySet()).equals(new ArrayList<>(r.linkTexts.entrySet()))
                && new ArrayList<>(imageAlts.entrySet()).equals(new ArrayList<>(r.imageAlts.entrySet()))
                && contentType.equals(r.contentType)
                && Objects.equals(fetchedAt, r.fetchedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, finalUrl, title, text, links, images, emails, status, fetchedAt);
    }

    @Override
    public String toString() {
        return "PageRecord{url=" + url + ", status=" + status + ", title=" + title
                + ", links=" + links.size() + ", images=" + images.size() + ", emails=" + emails.size()
                + ", tables=" + tables.size() + ", forms=" + forms.size() + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private URI finalUrl;
        private String title;
        private String metaDescription;
        private String metaKeywords;
        private final Map<String, List<String>> headings = new LinkedHashMap<>();
        private String text;
        private int wordCount;
        private final Set<URI> links = new LinkedHashSet<>();
        private final List<URI> images = new ArrayList<>();
        private final Set<String> emails = new LinkedHashSet<>();
        private final Set<String> phones = new LinkedHashSet<>();
        private final Set<URI> socialLinks = new LinkedHashSet<>();
        private final Map<String, String> meta = new LinkedHashMap<>();
        private final List<String> paragraphs = new ArrayList<>();
        private final List<List<List<String>>> tables = new ArrayList<>();
        private final List<List<String>> orderedLists = new ArrayList<>();
        private final List<List<String>> unorderedLists = new ArrayList<>();
        private final List<PageForm> forms = new ArrayList<>();
        private final List<URI> scripts = new ArrayList<>();
        private final List<URI> stylesheets = new ArrayList<>();
        private final List<String> structuredData = new ArrayList<>();
        private final Map<URI, String> linkTexts = new LinkedHashMap<>();
        private final Map<URI, String> imageAlts = new LinkedHashMap<>();
        private int status;
        private String contentType;
        private long contentLength;
        private Instant fetchedAt;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder finalUrl(URI finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder metaDescription(String v) { this.metaDescription = v; return this; }
        public Builder metaKeywords(String v) { this.metaKeywords = v; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder wordCount(int wordCount) { this.wordCount = wordCount; return this; }
        public Builder status(int status) { this.status = status; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder contentLength(long contentLength) { this.contentLength = contentLength; return this; }
        public Builder fetchedAt(Instant fetchedAt) { this.fetchedAt = fetchedAt; return this; }

        public Builder heading(String level, String value) {
            if (level != null && value != null && !value.isBlank()) {
                headings.computeIfAbsent(level, k -> new ArrayList<>()).add(value);
            }
            return this;
        }
        public Builder headings(Map<String, List<String>> all) {
            headings.clear();
            if (all != null) all.forEach((k, vs) -> { if (vs != null) vs.forEach(v -> heading(k, v)); });
            return this;
        }

        public Builder link(URI u) { if (u != null) links.add(u); return this; }
        public Builder links(Collection<URI> us) { links.clear(); if (us != null) us.forEach(this::link); return this; }

        public Builder image(URI u) { if (u != null) images.add(u); return this; }
        public Builder images(Collection<URI> us) { images.clear(); if (us != null) us.forEach(this::image); return this; }

        public Builder email(String e) { if (e != null && !e.isBlank()) emails.add(e); return this; }
        public Builder emails(Collection<String> es) { emails.clear(); if (es != null) es.forEach(this::email); return this; }

        public Builder phone(String p) { if (p != null && !p.isBlank()) phones.add(p); return this; }
        public Builder phones(Collection<String> ps) { phones.clear(); if (ps != null) ps.forEach(this::phone); return this; }

        public Builder socialLink(URI u) { if (u != null) socialLinks.add(u); return this; }
        public Builder socialLinks(Collection<URI> us) { socialLinks.clear(); if (us != null) us.forEach(this::socialLink); return this; }

        public Builder meta(String name, String content) {
            if (name != null && !name.isBlank() && content != null) meta.putIfAbsent(name, content);
            return this;
        }
        public Builder meta(Map<String, String> all) {
            meta.clear();
            if (all != null) all.forEach(this::meta);
            return this;
        }

        public Builder paragraph(String p) { if (p != null && !p.isBlank()) paragraphs.add(p); return this; }
        public Builder paragraphs(Collection<String> ps) { paragraphs.clear(); if (ps != null) ps.forEach(this::paragraph); return this; }

        /** 빈 표/빈 행은 버린다 */
        public Builder table(List<List<String>> rows) {
            if (rows == null) return this;
            List<List<String>> kept = new ArrayList<>();
            for (List<String> row : rows) if (row != null && !row.isEmpty()) kept.add(row);
            if (!kept.isEmpty()) tables.add(kept);
            return this;
        }
        public Builder tables(Collection<? extends List<List<String>>> ts) { tables.clear(); if (ts != null) ts.forEach(this::table); return this; }

        public Builder orderedList(List<String> items) { if (items != null && !items.isEmpty()) orderedLists.add(items); return this; }
        public Builder orderedLists(Collection<? extends List<String>> ls) { orderedLists.clear(); if (ls != null) ls.forEach(this::orderedList); return this; }

        public Builder unorderedList(List<String> items) { if (items != null && !items.isEmpty()) unorderedLists.add(items); return this; }
        public Builder unorderedLists(Collection<? extends List<String>> ls) { unorderedLists.clear(); if (ls != null) ls.forEach(this::unorderedList); return this; }

        public Builder form(PageForm f) { if (f != null) forms.add(f); return this; }
        public Builder forms(Collection<PageForm> fs) { forms.clear(); if (fs != null) fs.forEach(this::form); return this; }

        public Builder script(URI u) { if (u != null) scripts.add(u); return this; }
        public Builder scripts(Collection<URI> us) { scripts.clear(); if (us != null) us.forEach(this::script); return this; }

        public Builder stylesheet(URI u) { if (u != null) stylesheets.add(u); return this; }
        public Builder stylesheets(Collection<URI> us) { stylesheets.clear(); if (us != null) us.forEach(this::stylesheet); return this; }

        public Builder structuredData(String json) { if (json != null && !json.isBlank()) structuredData.add(json); return this; }
        public Builder structuredData(Collection<String> js) { structuredData.clear(); if (js != null) js.forEach(this::structuredData); return this; }

        public Builder linkText(URI u, String text) {
            if (u != null && text != null && !text.isBlank()) linkTexts.putIfAbsent(u, text);
            return this;
        }
        public Builder linkTexts(Map<URI, String> all) { linkTexts.clear(); if (all != null) all.forEach(this::linkText); return this; }

        public Builder imageAlt(URI u, String alt) {
            if (u != null && alt != null && !alt.isBlank()) imageAlts.putIfAbsent(u, alt);
            return this;
        }
        public Builder imageAlts(Map<URI, String> all) { imageAlts.clear(); if (all != null) all.forEach(this::imageAlt); return this; }

        public PageRecord build() { return new PageRecord(this); }
    }
}
