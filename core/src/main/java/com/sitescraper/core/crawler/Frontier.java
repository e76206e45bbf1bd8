package com.sitescraper.core.crawler;

import com.sitescraper.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 크롤 상태: FIFO 대기열 + 방문 집합.
 * URL 상태는 Unseen → Queued → Visited. 꺼내는 순간 Visited 로 본다(진행 중 포함).
 * 불변식: |queue| + |visited| ≤ maxPages, depth ≤ maxDepth, 같은 URL 은 한 번만.
 * 크롤러 제어 루프 스레드만 만진다 (동기화 없음).
 */
public final class Frontier {

    /** url 은 발견된 그대로(정리만 한) fetch 대상, key 는 방문 집합용 정규화 문자열 */
    public record Node(URI url, String key, int depth) {}

    private final Deque<Node> queue = new ArrayDeque<>();
    private final Set<String> queued = new HashSet<>();
    private final Set<String> visited = new LinkedHashSet<>();
    private final int maxDepth;
    private final int maxPages;

    public Frontier(int maxDepth, int maxPages) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        this.maxDepth = maxDepth;
        this.maxPages = maxPages;
    }

    /**
     * 정규화 key 로 Unseen 이고 한도 안이면 Queued 로.
     * 대기열에는 key 가 아니라 발견된 URL 이 들어간다.
     * @return 실제로 대기열에 들어갔으면 true
     */
    public boolean offer(URI url, int depth) {
        if (url == null || depth > maxDepth) return false;
        String key = UrlUtils.key(url);
        if (visited.contains(key) || queued.contains(key)) return false;
        if (queue.size() + visited.size() >= maxPages) return false;
        queue.addLast(new Node(UrlUtils.clean(url), key, depth));
        queued.add(key);
        return true;
    }

    /** 다음 노드를 꺼내 Visited 로 표시. 없으면 null */
    public Node next() {
        Node n = queue.pollFirst();
        if (n == null) return null;
        queued.remove(n.key());
        visited.add(n.key());
        return n;
    }

    public boolean hasNext() { return !queue.isEmpty(); }

    public boolean isVisited(URI url) { return visited.contains(UrlUtils.key(url)); }

    public boolean isQueued(URI url) { return queued.contains(UrlUtils.key(url)); }

    public int visitedCount() { return visited.size(); }

    public int queuedCount() { return queue.size(); }

    public boolean isFull() { return visited.size() >= maxPages; }

    public int maxDepth() { return maxDepth; }

    public int maxPages() { return maxPages; }
}
