package com.siqiu.scriptmonitor.network;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The only path from script code to the network. Each hop of a request (including every redirect)
 * is checked for scheme, host allow-list and resolved address before any connection is made.
 */
public class NetworkGatekeeper implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(NetworkGatekeeper.class);

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");
    private static final Set<String> ALLOWED_METHODS = Set.of("GET", "HEAD", "POST", "PUT", "PATCH", "DELETE", "OPTIONS");
    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);
    // managed by the client itself
    private static final Set<String> RESTRICTED_HEADERS = Set.of("host", "content-length", "transfer-encoding", "connection");
    private static final Set<String> CREDENTIAL_HEADERS = Set.of("authorization", "cookie", "proxy-authorization");

    private final HostAllowList allowList;
    private final GuardedDnsResolver resolver;
    private final CloseableHttpClient client;
    private final int maxRedirects;
    private final long maxBodyBytes;
    private final Clock clock;

    public NetworkGatekeeper(
            HostAllowList allowList,
            GuardedDnsResolver resolver,
            CloseableHttpClient client,
            int maxRedirects,
            long maxBodyBytes,
            Clock clock
    ) {
        this.allowList = allowList;
        this.resolver = resolver;
        this.client = client;
        this.maxRedirects = maxRedirects;
        this.maxBodyBytes = maxBodyBytes;
        this.clock = clock;
    }

    public FetchSession openSession(Instant deadline) {
        return new Session(deadline);
    }

    /**
     * Scheme, allow-list and address checks for one target. Runs before any request I/O.
     */
    URI validate(String rawUrl) {
        URI uri;
        try {
            uri = new URI(rawUrl);
        } catch (URISyntaxException e) {
            throw new NetworkRejectedException("invalid URL: " + rawUrl);
        }
        return validate(uri);
    }

    URI validate(URI uri) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!ALLOWED_SCHEMES.contains(scheme)) {
            throw new NetworkRejectedException("scheme not allowed: " + (scheme.isEmpty() ? "<none>" : scheme));
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new NetworkRejectedException("URL has no host: " + uri);
        }
        String bareHost = host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host;
        if (!allowList.permits(bareHost)) {
            throw new NetworkRejectedException("host not in allow-list: " + bareHost);
        }
        try {
            resolver.resolve(bareHost);
        } catch (BlockedAddressException e) {
            throw new NetworkRejectedException(e.getMessage());
        } catch (UnknownHostException e) {
            throw new NetworkRejectedException("unknown host: " + bareHost);
        }
        return uri;
    }

    @Override
    public void close() throws IOException {
        client.close();
    }

    private final class Session implements FetchSession {

        private final Instant deadline;
        private final AtomicReference<HttpUriRequest> inFlight = new AtomicReference<>();
        private volatile boolean aborted;

        Session(Instant deadline) {
            this.deadline = deadline;
        }

        @Override
        public FetchResponse fetch(FetchRequest request) throws IOException {
            String method = request.method().toUpperCase(Locale.ROOT);
            if (!ALLOWED_METHODS.contains(method)) {
                throw new NetworkRejectedException("method not allowed: " + method);
            }

            URI target = validate(request.url());
            Map<String, String> headers = sanitize(request.headers());
            String body = request.body();
            boolean redirected = false;

            for (int hop = 0; ; hop++) {
                Duration timeout = effectiveTimeout(request.timeoutMs());
                HttpUriRequest httpRequest = build(method, target, headers, body, timeout);

                try (CloseableHttpResponse response = execute(httpRequest)) {
                    int status = response.getStatusLine().getStatusCode();
                    Header location = response.getFirstHeader("Location");

                    if (REDIRECT_STATUSES.contains(status) && location != null) {
                        EntityUtils.consumeQuietly(response.getEntity());
                        if (hop + 1 > maxRedirects) {
                            throw new NetworkRejectedException("too many redirects (max " + maxRedirects + ")");
                        }
                        URI next = resolveLocation(target, location.getValue());
                        try {
                            validate(next);
                        } catch (NetworkRejectedException e) {
                            log.info("fetch_redirect_rejected from={} to={} reason={}", target, next, e.getMessage());
                            throw new NetworkRejectedException("redirect to disallowed target: " + e.getMessage());
                        }
                        if (!sameHost(target, next)) {
                            headers = withoutCredentials(headers);
                        }
                        if (status == 303 || ((status == 301 || status == 302) && !"GET".equals(method) && !"HEAD".equals(method))) {
                            method = "HEAD".equals(method) ? "HEAD" : "GET";
                            body = null;
                        }
                        target = next;
                        redirected = true;
                        continue;
                    }

                    return new FetchResponse(
                            status,
                            response.getStatusLine().getReasonPhrase(),
                            target.toString(),
                            redirected,
                            headersOf(response),
                            readBody(response.getEntity())
                    );
                } finally {
                    inFlight.compareAndSet(httpRequest, null);
                }
            }
        }

        private CloseableHttpResponse execute(HttpUriRequest httpRequest) throws IOException {
            if (aborted) {
                throw new IOException("fetch aborted: execution deadline reached");
            }
            inFlight.set(httpRequest);
            try {
                return client.execute(httpRequest);
            } catch (BlockedAddressException e) {
                // address changed between validation and connect
                throw new NetworkRejectedException(e.getMessage());
            }
        }

        private Duration effectiveTimeout(Long requestedMs) throws IOException {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new IOException("fetch deadline exceeded");
            }
            if (requestedMs == null || requestedMs <= 0) {
                return remaining;
            }
            Duration requested = Duration.ofMillis(requestedMs);
            return requested.compareTo(remaining) < 0 ? requested : remaining;
        }

        @Override
        public void abort() {
            aborted = true;
            HttpUriRequest current = inFlight.getAndSet(null);
            if (current != null) {
                current.abort();
            }
        }
    }

    private static HttpUriRequest build(String method, URI target, Map<String, String> headers, String body, Duration timeout) {
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
        RequestConfig config = RequestConfig.custom()
                .setConnectTimeout(timeoutMs)
                .setConnectionRequestTimeout(timeoutMs)
                .setSocketTimeout(timeoutMs)
                .setRedirectsEnabled(false)
                .build();

        RequestBuilder builder = RequestBuilder.create(method)
                .setUri(target)
                .setConfig(config);
        headers.forEach(builder::addHeader);
        if (body != null && !"GET".equals(method) && !"HEAD".equals(method)) {
            builder.setEntity(new StringEntity(body, StandardCharsets.UTF_8));
        }
        return builder.build();
    }

    private String readBody(HttpEntity entity) throws IOException {
        if (entity == null) return "";
        if (entity.getContentLength() > maxBodyBytes) {
            EntityUtils.consumeQuietly(entity);
            throw new NetworkRejectedException("response body exceeds " + maxBodyBytes + " bytes");
        }
        Charset charset = StandardCharsets.UTF_8;
        ContentType contentType = ContentType.get(entity);
        if (contentType != null && contentType.getCharset() != null) {
            charset = contentType.getCharset();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (InputStream in = entity.getContent()) {
            byte[] buf = new byte[8192];
            long total = 0;
            int n;
            while ((n = in.read(buf)) != -1) {
                total += n;
                if (total > maxBodyBytes) {
                    throw new NetworkRejectedException("response body exceeds " + maxBodyBytes + " bytes");
                }
                out.write(buf, 0, n);
            }
        }
        return out.toString(charset);
    }

    private static Map<String, String> headersOf(CloseableHttpResponse response) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Header h : response.getAllHeaders()) {
            out.merge(h.getName().toLowerCase(Locale.ROOT), h.getValue(), (a, b) -> a + ", " + b);
        }
        return out;
    }

    private static Map<String, String> sanitize(Map<String, String> headers) {
        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (name != null && value != null && !RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                out.put(name, value);
            }
        });
        return out;
    }

    private static Map<String, String> withoutCredentials(Map<String, String> headers) {
        Map<String, String> out = new LinkedHashMap<>(headers);
        out.keySet().removeIf(name -> CREDENTIAL_HEADERS.contains(name.toLowerCase(Locale.ROOT)));
        return out;
    }

    private static URI resolveLocation(URI base, String location) {
        try {
            return base.resolve(new URI(location.trim()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new NetworkRejectedException("invalid redirect location: " + location);
        }
    }

    private static boolean sameHost(URI a, URI b) {
        return a.getHost() != null && a.getHost().equalsIgnoreCase(b.getHost()) && a.getPort() == b.getPort();
    }
}
