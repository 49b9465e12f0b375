package net.cloudtolocalllm.relay.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Base URL of an HTTP endpoint, split into the parts a Netty client needs.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class HttpTarget {
    private final boolean secure;
    private final String host;
    private final int port;
    private final String basePath;

    public static HttpTarget parse(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid url: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("url must use http or https: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("url has no host: " + url);
        }
        boolean secure = scheme.equals("https");
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return new HttpTarget(secure, uri.getHost(), port, path);
    }

    /**
     * Request URI for {@code path} below the base path.
     */
    public String requestUri(String path) {
        if (path == null || path.isEmpty()) {
            return basePath.isEmpty() ? "/" : basePath;
        }
        String suffix = path;
        if (!suffix.startsWith("/")) {
            suffix = "/" + suffix;
        }
        return basePath + suffix;
    }

    /**
     * Value for the Host header; default ports are omitted.
     */
    public String hostHeader() {
        boolean defaultPort = secure ? port == 443 : port == 80;
        return defaultPort ? host : host + ":" + port;
    }

    @Override
    public String toString() {
        return (secure ? "https://" : "http://") + hostHeader() + basePath;
    }
}
