package com.github.stormino.hlsdl.service.playlist;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.util.regex.Pattern;

/**
 * Resolves playlist references against the URL of the playlist that contains them.
 * Paths are kept as written, so percent-escapes such as %2F survive resolution.
 */
@Slf4j
@UtilityClass
public class UrlResolver {

    private static final Pattern ABSOLUTE_URL = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");

    /**
     * Resolve a segment or variant reference.
     * Absolute URLs are kept, "/path" references go to the manifest host, anything else to the
     * manifest directory.
     *
     * @param manifestUrl URL the playlist was loaded from
     * @param reference URI as written in the playlist
     * @return Absolute URL
     */
    public static String resolve(String manifestUrl, String reference) {
        if (isAbsolute(reference)) {
            return reference;
        }
        if (reference.startsWith("/")) {
            return originOf(manifestUrl) + reference;
        }
        return directoryOf(manifestUrl) + reference;
    }

    public static boolean isAbsolute(String reference) {
        return ABSOLUTE_URL.matcher(reference).matches();
    }

    /**
     * The manifest URL with query and last path component stripped, ending in "/".
     */
    public static String directoryOf(String url) {
        String withoutQuery = stripQuery(url);
        int pathStart = pathStart(withoutQuery);
        if (pathStart < 0) {
            return withoutQuery + "/";
        }
        return withoutQuery.substring(0, withoutQuery.lastIndexOf('/') + 1);
    }

    /**
     * Scheme, host and port of a URL, without a trailing slash. Default ports are dropped.
     */
    public static String originOf(String url) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed != null) {
            String root = parsed.newBuilder()
                    .encodedPath("/")
                    .query(null)
                    .fragment(null)
                    .build()
                    .toString();
            return root.substring(0, root.length() - 1);
        }

        log.debug("Not an HTTP URL, taking origin from raw text: {}", url);
        String withoutQuery = stripQuery(url);
        int pathStart = pathStart(withoutQuery);
        return pathStart >= 0 ? withoutQuery.substring(0, pathStart) : withoutQuery;
    }

    private static int pathStart(String url) {
        int schemeEnd = url.indexOf("://");
        return url.indexOf('/', schemeEnd >= 0 ? schemeEnd + 3 : 0);
    }

    private static String stripQuery(String url) {
        int end = url.length();
        int query = url.indexOf('?');
        if (query >= 0) {
            end = query;
        }
        int fragment = url.indexOf('#');
        if (fragment >= 0 && fragment < end) {
            end = fragment;
        }
        return url.substring(0, end);
    }
}
