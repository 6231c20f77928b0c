package com.scaniq.collector.service.discovery;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls same-domain page links out of raw HTML/CSS.
 */
@Component
public class LinkExtractor {

    private static final Pattern HREF = Pattern.compile("href\\s*=\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern SRC = Pattern.compile("src\\s*=\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern CSS_URL = Pattern.compile("url\\(\\s*[\"']?([^\"')]+)[\"']?\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ABSOLUTE = Pattern.compile("https?://[a-zA-Z0-9.-]+(?::\\d+)?[^\\s\"'<>)]*");

    private static final Set<String> BINARY_EXTENSIONS = Set.of(
            ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp", ".ico", ".bmp",
            ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx",
            ".zip", ".tar", ".gz", ".rar", ".7z",
            ".css", ".js", ".mjs", ".map",
            ".woff", ".woff2", ".ttf", ".eot", ".otf",
            ".mp3", ".mp4", ".wav", ".avi", ".mov", ".webm", ".ogg");

    /**
     * All acceptable links found in {@code html}, resolved against {@code pageUrl}, in
     * document order.
     */
    public Set<String> extract(String html, String pageUrl, String domain) {
        Set<String> links = new LinkedHashSet<>();
        if (html == null || html.isEmpty()) return links;

        for (Pattern pattern : new Pattern[]{HREF, SRC, CSS_URL, ABSOLUTE}) {
            Matcher m = pattern.matcher(html);
            while (m.find()) {
                String raw = m.groupCount() > 0 ? m.group(1) : m.group();
                String resolved = resolve(raw.trim(), pageUrl);
                if (resolved != null && isAcceptable(resolved, domain)) {
                    links.add(resolved);
                }
            }
        }
        return links;
    }

    String resolve(String link, String pageUrl) {
        if (link.isEmpty()) return null;
        String lower = link.toLowerCase(Locale.ROOT);
        if (lower.startsWith("mailto:") || lower.startsWith("tel:")
                || lower.startsWith("javascript:") || lower.startsWith("data:")) {
            return null;
        }
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return link;
        }
        try {
            URI base = URI.create(pageUrl);
            if (link.startsWith("//")) {
                return base.getScheme() + ":" + link;
            }
            return base.resolve(link).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Same-domain http(s) page without a fragment that is not a static or binary asset.
     */
    public boolean isAcceptable(String url, String domain) {
        if (url.contains("#")) return false;
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return false;
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) return false;
        if (!isSameDomain(uri.getHost(), domain)) return false;

        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        if (path.contains("/wp-content/") || path.contains("/wp-includes/")) return false;
        int dot = path.lastIndexOf('.');
        return dot < 0 || dot < path.lastIndexOf('/') || !BINARY_EXTENSIONS.contains(path.substring(dot));
    }

    public static boolean isSameDomain(String host, String domain) {
        if (host == null || domain == null) return false;
        String h = host.toLowerCase(Locale.ROOT);
        String d = domain.toLowerCase(Locale.ROOT);
        if (d.startsWith("www.")) d = d.substring(4);
        return h.equals(d) || h.endsWith("." + d);
    }
}
