package phishinganalytics.utils;

import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import phishinganalytics.exceptions.ValidationException;

import java.net.IDN;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public class UrlUtils {

    private UrlUtils() {
    }

    public static String normalizeUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("url", "Не задан URL");
        }
        String trimmed = url.trim();
        UriComponents uri = parse(trimmed);

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = asciiHost(uri.getHost(), trimmed);
        int port = port(uri, trimmed);
        if (("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) {
            port = -1;
        }

        StringBuilder normalized = new StringBuilder(scheme).append("://");
        if (uri.getUserInfo() != null) {
            normalized.append(uri.getUserInfo()).append('@');
        }
        normalized.append(host);
        if (port != -1) {
            normalized.append(':').append(port);
        }
        // путь и запрос не перекодируются
        String path = uri.getPath();
        if (path != null && !path.equals("/")) {
            normalized.append(path);
        }
        if (uri.getQuery() != null) {
            if (path == null || path.isEmpty() || path.equals("/")) {
                normalized.append('/');
            }
            normalized.append('?').append(uri.getQuery());
        }
        return normalized.toString();
    }

    public static String extractDomain(String url) {
        String normalized = normalizeUrl(url);
        return asciiHost(parse(normalized).getHost(), normalized);
    }

    public static String normalizeDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new ValidationException("domain", "Не задан домен");
        }
        return domain.trim().toLowerCase(Locale.ROOT);
    }

    // совпадает с md5(url) из схемы
    public static String urlHash(String normalizedUrl) {
        return DigestUtils.md5DigestAsHex(normalizedUrl.getBytes(StandardCharsets.UTF_8));
    }

    // разбор без строгой проверки RFC 3986: отклоняется только URL без схемы или хоста
    private static UriComponents parse(String url) {
        UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(url).build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ValidationException("url", "Некорректный URL: " + url);
        }
        if (uri.getScheme() == null || !StringUtils.hasText(uri.getHost())) {
            throw new ValidationException("url", "Некорректный URL: " + url);
        }
        return uri;
    }

    // IDN-хосты хранятся в punycode
    private static String asciiHost(String host, String url) {
        try {
            return IDN.toASCII(host).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("url", "Некорректный хост в URL: " + url);
        }
    }

    private static int port(UriComponents uri, String url) {
        try {
            return uri.getPort();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ValidationException("url", "Некорректный порт в URL: " + url);
        }
    }
}
