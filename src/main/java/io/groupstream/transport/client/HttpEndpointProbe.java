package io.groupstream.transport.client;

import io.groupstream.registry.EndpointProbe;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@code GET <endpoint><path>?group=<label>}; passes on a 2xx answer within the timeout.
 * The dispatcher answers 409 when it serves another group, so a recycled port never
 * passes for the wrong dispatcher.
 */
@Slf4j
public final class HttpEndpointProbe implements EndpointProbe {
    private final HttpJsonClient http;
    private final Duration timeout;
    private final String path;

    private HttpEndpointProbe(final HttpJsonClient http, final Duration timeout, final String path) {
        this.http = http;
        this.timeout = timeout;
        this.path = path;
    }

    /** Consumer attached: used while provisioning. */
    public static HttpEndpointProbe readiness(final HttpJsonClient http, final Duration timeout) {
        return new HttpEndpointProbe(http, timeout, "/ready");
    }

    /** Process up and serving: used by periodic health checks. */
    public static HttpEndpointProbe liveness(final HttpJsonClient http, final Duration timeout) {
        return new HttpEndpointProbe(http, timeout, "/health");
    }

    @Override
    public boolean check(final String group, final String endpoint) {
        final String url = endpoint + path + "?group=" + URLEncoder.encode(group, StandardCharsets.UTF_8);
        try {
            final HttpResult r = http.get(url, timeout)
                    .get(timeout.toMillis() + 100, TimeUnit.MILLISECONDS);
            if (!r.isSuccess()) {
                log.debug("{} answered {} for group [{}]", url, r.status(), group);
            }
            return r.isSuccess();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (final ExecutionException | TimeoutException e) {
            log.debug("Check of {} failed: {}", url, e.toString());
            return false;
        }
    }
}
