package com.sitescraper.core.service.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sitescraper.core.model.ErrorMarker;
import com.sitescraper.core.model.FailureKind;
import com.sitescraper.core.model.PageForm;
import com.sitescraper.core.model.PageOutcome;
import com.sitescraper.core.model.PageRecord;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 모든 포맷이 공유하는 평면 행 스키마 (번들 항목 1개 = 행 1개).
 * 값이 없으면 키를 빼지 않고 빈 값으로 둔다: 문자열 "", 목록 [], 숫자/시각 null.
 * 표/목록/폼/JSON-LD 는 JSON 에서는 중첩 값, CSV/엑셀에서는 연결 문자열 또는 개수.
 */
@JsonPropertyOrder({
        "key", "url", "final_url", "outcome", "depth", "attempts", "status",
        "content_type", "content_length", "fetched_at", "title", "meta_description", "meta_keywords",
        "headings", "text", "word_count", "links", "images", "emails", "phones", "social_links", "meta",
        "paragraphs", "tables", "ordered_lists", "unordered_lists", "forms", "scripts", "stylesheets",
        "structured_data", "link_texts", "image_alts",
        "error_kind", "error_message"})
public final class BundleRow {

    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";

    /** CSV/엑셀 열 순서 (JSON 키와 동일) */
    public static final List<String> COLUMNS = List.of(
            "key", "url", "final_url", "outcome", "depth", "attempts", "status",
            "content_type", "content_length", "fetched_at", "title", "meta_description", "meta_keywords",
            "headings", "text", "word_count", "links", "images", "emails", "phones", "social_links", "meta",
            "paragraphs", "tables", "ordered_lists", "unordered_lists", "forms", "scripts", "stylesheets",
            "structured_data", "link_texts", "image_alts",
            "error_kind", "error_message");

    private static final ObjectMapper JSON = new ObjectMapper();

    public String key = "";
    public String url = "";
    @JsonProperty("final_url") public String finalUrl = "";
    public String outcome = "";
    public int depth;
    public int attempts;
    public Integer status;
    @JsonProperty("content_type") public String contentType = "";
    @JsonProperty("content_length") public Long contentLength;
    @JsonProperty("fetched_at") public Instant fetchedAt;
    public String title = "";
    @JsonProperty("meta_description") public String metaDescription = "";
    @JsonProperty("meta_keywords") public String metaKeywords = "";
    public Map<String, List<String>> headings = new LinkedHashMap<>();
    public String text = "";
    @JsonProperty("word_count") public Integer wordCount;
    public List<String> links = new ArrayList<>();
    public List<String> images = new ArrayList<>();
    public List<String> emails = new ArrayList<>();
    public List<String> phones = new ArrayList<>();
    @JsonProperty("social_links") public List<String> socialLinks = new ArrayList<>();
    public Map<String, String> meta = new LinkedHashMap<>();
    public List<String> paragraphs = new ArrayList<>();
    public List<List<List<String>>> tables = new ArrayList<>();
    @JsonProperty("ordered_lists") public List<List<String>> orderedLists = new ArrayList<>();
    @JsonProperty("unordered_lists") public List<List<String>> unorderedLists = new ArrayList<>();
    public List<PageForm> forms = new ArrayList<>();
    public List<String> scripts = new ArrayList<>();
    public List<String> stylesheets = new ArrayList<>();
    @JsonProperty("structured_data") public List<JsonNode> structuredData = new ArrayList<>();
    @JsonProperty("link_texts") public Map<String, String> linkTexts = new LinkedHashMap<>();
    @JsonProperty("image_alts") public Map<String, String> imageAlts = new LinkedHashMap<>();
    @JsonProperty("error_kind") public String errorKind = "";
    @JsonProperty("error_message") public String errorMessage = "";

    public static BundleRow of(PageOutcome o) {
        BundleRow r = new BundleRow();
        r.key = o.key();
        r.url = o.url().toString();
        r.depth = o.depth();
        r.attempts = o.attempts();

        if (o.isSuccess()) {
            PageRecord p = o.record();
            r.outcome = SUCCESS;
            r.finalUrl = p.getFinalUrl().toString();
            r.status = p.getStatus();
            r.contentType = p.getContentType();
            r.contentLength = p.getContentLength();
            r.fetchedAt = p.getFetchedAt();
            r.title = p.getTitle() == null ? "" : p.getTitle();
            r.metaDescription = p.getMetaDescription();
            r.metaKeywords = p.getMetaKeywords();
            p.getHeadings().forEach((k, v) -> r.headings.put(k, new ArrayList<>(v)));
            r.text = p.getText();
            r.wordCount = p.getWordCount();
            r.links = strings(p.getLinks());
            r.images = strings(p.getImages());
            r.emails = new ArrayList<>(p.getEmails());
            r.phones = new ArrayList<>(p.getPhones());
            r.socialLinks = strings(p.getSocialLinks());
            r.meta = new LinkedHashMap<>(p.getMeta());
            r.paragraphs = new ArrayList<>(p.getParagraphs());
            r.tables = new ArrayList<>(p.getTables());
            r.orderedLists = new ArrayList<>(p.getOrderedLists());
            r.unorderedLists = new ArrayList<>(p.getUnorderedLists());
            r.forms = new ArrayList<>(p.getForms());
            r.scripts = strings(p.getScripts());
            r.stylesheets = strings(p.getStylesheets());
            for (String json : p.getStructuredData()) r.structuredData.add(tree(json));
            p.getLinkTexts().forEach((u, t) -> r.linkTexts.put(u.toString(), t));
            p.getImageAlts().forEach((u, t) -> r.imageAlts.put(u.toString(), t));
        } else {
            ErrorMarker e = o.error();
            r.outcome = FAILED;
            r.status = e.httpStatus() > 0 ? e.httpStatus() : null;
            r.errorKind = e.kind().name();
            r.errorMessage = e.message();
        }
        return r;
    }

    /** JSON 에서 다시 읽은 행 → 번들 항목 */
    public PageOutcome toOutcome() {
        URI u = URI.create(url);
        if (FAILED.equals(outcome)) {
            ErrorMarker e = new ErrorMarker(FailureKind.valueOf(errorKind), status == null ? 0 : status, errorMessage);
            return new PageOutcome(key, u, depth, attempts, null, e);
        }
        PageRecord rec = PageRecord.builder()
                .url(u)
                .finalUrl(finalUrl == null || finalUrl.isEmpty() ? u : URI.create(finalUrl))
                .title(title)
                .metaDescription(metaDescription)
                .metaKeywords(metaKeywords)
                .headings(headings)
                .text(text)
                .wordCount(wordCount == null ? 0 : wordCount)
                .links(uris(links))
                .images(uris(images))
                .emails(emails)
                .phones(phones)
                .socialLinks(uris(socialLinks))
                .meta(meta)
                .paragraphs(paragraphs)
                .tables(tables)
                .orderedLists(orderedLists)
                .unorderedLists(unorderedLists)
                .forms(forms)
                .scripts(uris(scripts))
                .stylesheets(uris(stylesheets))
                .structuredData(compact(structuredData))
                .linkTexts(uriKeys(linkTexts))
                .imageAlts(uriKeys(imageAlts))
                .status(status == null ? 0 : status)
                .contentType(contentType)
                .contentLength(contentLength == null ? 0 : contentLength)
                .fetchedAt(fetchedAt)
                .build();
        return new PageOutcome(key, u, depth, attempts, rec, null);
    }

    /** CSV/엑셀 셀 값 (COLUMNS 순서). 목록은 " | " 로 연결 */
    public List<String> cells() {
        List<String> c = new ArrayList<>(COLUMNS.size());
        c.add(key);
        c.add(url);
        c.add(finalUrl);
        c.add(outcome);
        c.add(String.valueOf(depth));
        c.add(String.valueOf(attempts));
        c.add(status == null ? "" : String.valueOf(status));
        c.add(contentType);
        c.add(contentLength == null ? "" : String.valueOf(contentLength));
        c.add(fetchedAt == null ? "" : fetchedAt.toString());
        c.add(title);
        c.add(metaDescription);
        c.add(metaKeywords);
        List<String> hs = new ArrayList<>();
        headings.forEach((k, vs) -> vs.forEach(v -> hs.add(k + ": " + v)));
        c.add(join(hs));
        c.add(text);
        c.add(wordCount == null ? "" : String.valueOf(wordCount));
        c.add(join(links));
        c.add(join(images));
        c.add(join(emails));
        c.add(join(phones));
        c.add(join(socialLinks));
        List<String> ms = new ArrayList<>();
        meta.forEach((k, v) -> ms.add(k + "=" + v));
        c.add(join(ms));
        c.add(join(paragraphs));
        c.add(tables == null ? "" : String.valueOf(tables.size()));
        c.add(joinLists(orderedLists));
        c.add(joinLists(unorderedLists));
        List<String> fs = new ArrayList<>();
        if (forms != null) forms.forEach(f -> fs.add(f.summary()));
        c.add(join(fs));
        c.add(join(scripts));
        c.add(join(stylesheets));
        c.add(join(compact(structuredData)));
        c.add(join(pairs(linkTexts)));
        c.add(join(pairs(imageAlts)));
        c.add(errorKind);
        c.add(errorMessage);
        return c;
    }

    static final String LIST_DELIMITER = " | ";

    private static String join(Collection<String> xs) {
        return (xs == null || xs.isEmpty()) ? "" : String.join(LIST_DELIMITER, xs);
    }

    /** 목록 하나는 "; " 로, 목록끼리는 " | " 로 */
    private static String joinLists(List<List<String>> ls) {
        if (ls == null) return "";
        List<String> out = new ArrayList<>(ls.size());
        ls.forEach(l -> out.add(String.join(ITEM_DELIMITER, l)));
        return join(out);
    }

    static final String ITEM_DELIMITER = "; ";

    private static List<String> pairs(Map<String, String> m) {
        List<String> out = new ArrayList<>();
        if (m != null) m.forEach((k, v) -> out.add(k + "=" + v));
        return out;
    }

    /** 추출기가 만든 압축 JSON 이라 실패하지 않지만, 깨졌으면 문자열 노드로 둔다 */
    private static JsonNode tree(String json) {
        try {
            return JSON.readTree(json);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(json);
        }
    }

    private static List<String> compact(List<JsonNode> nodes) {
        List<String> out = new ArrayList<>();
        if (nodes != null) for (JsonNode n : nodes) if (n != null) out.add(n.toString());
        return out;
    }

    private static Map<URI, String> uriKeys(Map<String, String> m) {
        Map<URI, String> out = new LinkedHashMap<>();
        if (m != null) m.forEach((k, v) -> out.put(URI.create(k), v));
        return out;
    }

    private static List<String> strings(Collection<URI> us) {
        List<String> out = new ArrayList<>(us.size());
        for (URI u : us) out.add(u.toString());
        return out;
    }

    private static List<URI> uris(List<String> ss) {
        List<URI> out = new ArrayList<>();
        if (ss != null) for (String s : ss) out.add(URI.create(s));
        return out;
    }
}
