package uk.gegc.edgeprompt.features.conversion.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.edgeprompt.features.conversion.config.LinkFetchConfig;
import uk.gegc.edgeprompt.features.conversion.domain.ContentSizeLimitException;
import uk.gegc.edgeprompt.features.conversion.domain.LinkFetchException;
import uk.gegc.edgeprompt.features.conversion.domain.SsrfProtectionException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Downloads the body of a {@code url} material.
 * The body is returned as UTF-8 text without any markup stripping.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkFetchService {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");
    private static final Set<Integer> ALLOWED_PORTS = Set.of(80, 443);
    private static final int MAX_URL_LENGTH = 2048;

    private final LinkFetchConfig config;

    /**
     * Fetches the URL and returns its body.
     *
     * @param url absolute http(s) URL
     * @return the response body decoded as UTF-8
     * @throws SsrfProtectionException if the URL or a redirect target is not allowed
     * @throws LinkFetchException if the request fails or answers with a non-2xx status
     */
    public String fetchBody(String url) {
        log.info("Fetching link: {}", url);

        URI uri = parseAndValidate(url);
        String body = fetch(uri);

        log.info("Fetched link: {} ({} characters)", url, body.length());
        return body;
    }

    private URI parseAndValidate(String url) {
        if (url == null || url.isBlank()) {
            throw new SsrfProtectionException("URL cannot be null or empty");
        }
        if (url.length() > MAX_URL_LENGTH) {
            throw new SsrfProtectionException("URL exceeds maximum length of " + MAX_URL_LENGTH + " characters");
        }
        try {
            return validate(new URI(url.trim()).normalize());
        } catch (SsrfProtectionException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new SsrfProtectionException("Invalid URL format: " + ex.getMessage(), ex);
        }
    }

    private URI validate(URI uri) {
        if (!uri.isAbsolute()) {
            throw new SsrfProtectionException("URL must be absolute");
        }
        String scheme = uri.getScheme();
        if (scheme == null || !ALLOWED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
            throw new SsrfProtectionException("Only HTTP and HTTPS schemes are allowed");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new SsrfProtectionException("URL must have a valid host");
        }
        if (!config.isSsrfProtectionEnabled()) {
            return uri;
        }

        if (uri.getUserInfo() != null) {
            throw new SsrfProtectionException("URL must not contain embedded credentials");
        }
        int port = uri.getPort();
        if (port != -1 && !ALLOWED_PORTS.contains(port)) {
            throw new SsrfProtectionException("Only ports 80 and 443 are allowed");
        }
        checkResolvedAddresses(host);
        return uri;
    }

    private void checkResolvedAddresses(String host) {
        InetAddress[] addresses;
        try {
            addresses = InetAddress.getAllByName(host);
        } catch (UnknownHostException ex) {
            throw new SsrfProtectionException("Cannot resolve host: " + host, ex);
        }
        for (InetAddress address : addresses) {
            if (address.isLoopbackAddress()
                    || address.isLinkLocalAddress()
                    || address.isSiteLocalAddress()
                    || address.isAnyLocalAddress()
                    || address.isMulticastAddress()
                    || isUniqueLocalIpv6(address)) {
                throw new SsrfProtectionException("Host resolves to a non-public address: " + host);
            }
        }
    }

    private boolean isUniqueLocalIpv6(InetAddress address) {
        byte[] bytes = address.getAddress();
        return bytes.length == 16 && ((bytes[0] & 0xFE) == 0xFC);
    }

    private String fetch(URI startingUri) {
        HttpURLConnection connection = null;
        URI currentUri = startingUri;
        int redirects = 0;

        try {
            connection = openConnection(currentUri);
            int status = connection.getResponseCode();

            while (isRedirect(status)) {
                if (++redirects > config.getMaxRedirects()) {
                    throw new LinkFetchException("Too many redirects (max: " + config.getMaxRedirects() + ")");
                }
                String location = connection.getHeaderField("Location");
                if (location == null || location.isBlank()) {
                    throw new LinkFetchException("Redirect without Location header");
                }
                connection.disconnect();
                currentUri = validate(resolveRedirect(currentUri, location));
                connection = openConnection(currentUri);
                status = connection.getResponseCode();
            }

            if (status < 200 || status >= 300) {
                throw new LinkFetchException("HTTP error code " + status + " from " + currentUri);
            }
            if (connection.getContentLengthLong() > config.getMaxContentSizeBytes()) {
                throw sizeLimitExceeded();
            }
            try (InputStream in = connection.getInputStream()) {
                return readWithSizeLimit(in);
            }
        } catch (IOException ex) {
            throw new LinkFetchException("Failed to fetch URL: " + ex.getMessage(), ex);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private HttpURLConnection openConnection(URI target) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) target.toURL().openConnection();
        connection.setRequestMethod("GET");
        connection.setConnectTimeout(config.getConnectTimeoutMs());
        connection.setReadTimeout(config.getReadTimeoutMs());
        connection.setInstanceFollowRedirects(false);
        connection.setRequestProperty("User-Agent", config.getUserAgent());
        connection.connect();
        return connection;
    }

    private boolean isRedirect(int status) {
        return status == HttpURLConnection.HTTP_MOVED_PERM
                || status == HttpURLConnection.HTTP_MOVED_TEMP
                || status == HttpURLConnection.HTTP_SEE_OTHER
                || status == 307
                || status == 308;
    }

    private URI resolveRedirect(URI base, String location) {
        try {
            URI locationUri = new URI(location.trim());
            return (locationUri.isAbsolute() ? locationUri : base.resolve(locationUri)).normalize();
        } catch (Exception ex) {
            throw new LinkFetchException("Invalid redirect URL: " + location, ex);
        }
    }

    private String readWithSizeLimit(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        long total = 0;
        int read;
        while ((read = in.read(chunk)) != -1) {
            total += read;
            if (total > config.getMaxContentSizeBytes()) {
                throw sizeLimitExceeded();
            }
            buffer.write(chunk, 0, read);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private ContentSizeLimitException sizeLimitExceeded() {
        return new ContentSizeLimitException(
                String.format("Content size exceeds limit of %d bytes", config.getMaxContentSizeBytes()));
    }
}
