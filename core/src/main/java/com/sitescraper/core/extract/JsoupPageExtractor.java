package com.sitescraper.core.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitescraper.core.api.IPageExtractor;
import com.sitescraper.core.model.PageForm;
import com.sitescraper.core.model.PageRecord;
import com.sitescraper.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * jsoup 기반 추출기.
 * 깨진 마크업도 관대하게 파싱하고, 없는 요소는 빈 값으로 둔다.
 * 같은 (body, baseUrl) 이면 항상 같은 결과. fetch 메타(status 등)는 호출자가 채운다.
 */
public final class JsoupPageExtractor implements IPageExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupPageExtractor.class);
    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int LINK_TEXT_MAX = 100;
    private static final int MIN_PARAGRAPH = 10;

    private final int textMaxLength;

    public JsoupPageExtractor() { this(5000); }

    public JsoupPageExtractor(int textMaxLength) {
        if (textMaxLength < 1) throw new IllegalArgumentException("textMaxLength must be >= 1");
        this.textMaxLength = textMaxLength;
    }

    @Override
    public PageRecord extract(byte[] body, URI baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        PageRecord.Builder b = PageRecord.builder().url(baseUrl).finalUrl(baseUrl);
        byte[] bytes = (body == null) ? new byte[0] : body;
        b.contentLength(bytes.length);

        Document doc;
        try {
            doc = Jsoup.parse(new ByteArrayInputStream(bytes), null, baseUrl.toString());
        } catch (IOException | RuntimeException e) {
            LOG.debug("Parse failed for {}: {}", baseUrl, e.toString());
            return b.build();
        }

        // 메타 태그 (name 또는 property, 첫 값 우선)
        for (Element m : doc.select("meta[content]")) {
            String key = m.hasAttr("name") ? m.attr("name") : m.attr("property");
            if (!key.isBlank()) b.meta(key.trim().toLowerCase(Locale.ROOT), m.attr("content").trim());
        }
        b.metaDescription(metaOf(doc, "description"));
        b.metaKeywords(metaOf(doc, "keywords"));

        for (int level = 1; level <= 6; level++) {
            for (Element h : doc.select("h" + level)) b.heading("h" + level, h.text().trim());
        }
        b.title(pickTitle(doc));

        // 링크: http/https 만, 발견 순서, 정규화 key 로 중복 제거 (값은 발견된 경로 그대로)
        Set<String> seen = new HashSet<>();
        for (Element a : doc.select("a[href]")) {
            String raw = a.attr("href").trim();
            String mail = ContactPatterns.emailFromMailto(raw);
            if (mail != null) { b.email(mail); continue; }
            if (raw.isEmpty() || raw.startsWith("#") || isSkippedProtocol(raw)) continue;
            URI u = toHttpUri(a.absUrl("href"));
            if (u == null || !seen.add(UrlUtils.key(u))) continue;
            b.link(u);
            b.linkText(u, clip(a.text().trim(), LINK_TEXT_MAX));
            if (ContactPatterns.isSocialProfile(u)) b.socialLink(u);
        }

        for (Element img : doc.select("img[src]")) {
            String src = img.attr("src").trim();
            if (src.isEmpty() || src.regionMatches(true, 0, "data:", 0, 5)) continue;
            URI u = toHttpUri(img.absUrl("src"));
            if (u == null) continue;
            b.image(u);
            String alt = img.attr("alt").trim();
            b.imageAlt(u, alt.isEmpty() ? img.attr("title").trim() : alt);
        }

        extractStructure(doc, b);

        // 본문 텍스트: script/style/noscript 제거 후 공백 정리
        doc.select("script, style, noscript, template").remove();
        String text = doc.body() == null ? "" : doc.body().text().trim();
        b.wordCount(countWords(text));
        ContactPatterns.emails(text).forEach(b::email);
        ContactPatterns.phones(text).forEach(b::phone);
        b.text(truncate(text));

        return b.build();
    }

    /** script 제거 전에 호출: 외부 리소스, JSON-LD, 문단, 표, 목록, 폼 */
    private void extractStructure(Document doc, PageRecord.Builder b) {
        for (Element s : doc.select("script[src]")) {
            b.script(toHttpUri(s.absUrl("src")));
        }
        for (Element l : doc.select("link[rel][href]")) {
            if (hasToken(l.attr("rel"), "stylesheet")) b.stylesheet(toHttpUri(l.absUrl("href")));
        }
        for (Element s : doc.select("script[type]")) {
            if (!"application/ld+json".equalsIgnoreCase(s.attr("type").trim())) continue;
            String json = jsonLd(s.data());
            if (json != null) b.structuredData(json);
        }

        for (Element p : doc.select("p")) {
            String t = p.text().trim();
            if (t.length() > MIN_PARAGRAPH) b.paragraph(t);
        }

        for (Element table : doc.select("table")) {
            List<List<String>> rows = new ArrayList<>();
            for (Element tr : table.select("tr")) {
                List<String> cells = new ArrayList<>();
                for (Element cell : tr.select("td, th")) cells.add(cell.text().trim());
                rows.add(cells);
            }
            b.table(rows);
        }

        for (Element ol : doc.select("ol")) b.orderedList(items(ol));
        for (Element ul : doc.select("ul")) b.unorderedList(items(ul));

        Map<String, String> labelFor = new HashMap<>();
        for (Element label : doc.select("label[for]")) {
            labelFor.putIfAbsent(label.attr("for"), label.text().trim());
        }
        for (Element form : doc.select("form")) {
            List<PageForm.Input> inputs = new ArrayList<>();
            for (Element in : form.select("input, textarea, select")) {
                String type = in.normalName().equals("input") ? in.attr("type") : in.normalName();
                inputs.add(new PageForm.Input(type, in.attr("name"), in.attr("placeholder"), labelOf(in, labelFor)));
            }
            b.form(new PageForm(form.attr("action").trim(), form.attr("method"), inputs));
        }
    }

    private static List<String> items(Element list) {
        List<String> out = new ArrayList<>();
        for (Element li : list.select("li")) out.add(li.text().trim());
        return out;
    }

    /** label[for=id] 우선, 없으면 감싸고 있는 label */
    private static String labelOf(Element input, Map<String, String> labelFor) {
        String id = input.id();
        if (!id.isEmpty() && labelFor.containsKey(id)) return labelFor.get(id);
        for (Element parent : input.parents()) {
            if (parent.normalName().equals("label")) return parent.text().trim();
        }
        return "";
    }

    /** 파싱 실패한 블록은 건너뛴다. 성공하면 압축 JSON 문자열 */
    private static String jsonLd(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            JsonNode node = JSON.readTree(raw.trim());
            if (node == null || node.isMissingNode()) return null;
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            LOG.debug("Skipping unparsable JSON-LD block: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static boolean hasToken(String attr, String token) {
        for (String t : attr.trim().split("\\s+")) {
            if (t.equalsIgnoreCase(token)) return true;
        }
        return false;
    }

    private static String clip(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    /** title 태그 → 첫 h1 → null */
    private static String pickTitle(Document doc) {
        String t = doc.title() == null ? "" : doc.title().trim();
        if (!t.isEmpty()) return t;
        Element h1 = doc.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) return h1.text().trim();
        return null;
    }

    private static String metaOf(Document doc, String name) {
        for (Element m : doc.select("meta[name][content]")) {
            if (m.attr("name").trim().equalsIgnoreCase(name)) return m.attr("content").trim();
        }
        return "";
    }

    private static boolean isSkippedProtocol(String href) {
        String h = href.toLowerCase(Locale.ROOT);
        return h.startsWith("tel:") || h.startsWith("javascript:") || h.startsWith("ftp:") || h.startsWith("data:");
    }

    /**
     * 절대 URL 문자열 → 정리된 http(s) URI. 공백처럼 URI 에 쓸 수 없는 문자가 남아 있으면
     * URL 로 다시 읽어 성분별 생성자로 인코딩한다. 그래도 안 되면 null.
     */
    static URI toHttpUri(String abs) {
        if (abs == null || abs.isEmpty()) return null;
        URI u;
        try {
            u = new URI(abs);
        } catch (URISyntaxException e) {
            u = quoted(abs);
        }
        return UrlUtils.isHttp(u) ? UrlUtils.clean(u) : null;
    }

    private static URI quoted(String abs) {
        try {
            URL url = new URL(abs);
            return new URI(url.getProtocol(), url.getUserInfo(), url.getHost(), url.getPort(),
                    url.getPath(), url.getQuery(), null);
        } catch (MalformedURLException | URISyntaxException | IllegalArgumentException e) {
            LOG.debug("Dropping unparsable url {}: {}", abs, e.getMessage());
            return null;
        }
    }

    private String truncate(String text) {
        if (text.length() <= textMaxLength) return text;
        int end = textMaxLength;
        if (Character.isHighSurrogate(text.charAt(end - 1))) end--;
        return text.substring(0, end) + "...";
    }

    static int countWords(String text) {
        if (text == null || text.isEmpty()) return 0;
        var m = WORD.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
