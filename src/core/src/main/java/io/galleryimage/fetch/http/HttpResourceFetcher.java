/*
 * Copyright 2026 The gallery-image Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.galleryimage.fetch.http;

import static java.util.Objects.requireNonNull;

import io.galleryimage.ResourceUnavailableException;
import io.galleryimage.fetch.AbstractResourceFetcher;
import io.galleryimage.fetch.ResourceFetcher;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ResourceFetcher} downloading whole resources over HTTP/HTTPS with {@link HttpClient}.
 * <p>
 * Every request is bounded by a request timeout (5 seconds by default) on top of the client's connect
 * timeout. A timeout aborts that request only and surfaces as a {@link ResourceUnavailableException};
 * requests running concurrently through the same fetcher are unaffected.
 */
public class HttpResourceFetcher extends AbstractResourceFetcher implements ResourceFetcher {

    /** Default connect and request timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient httpClient;
    private final HttpAuthentication authentication;
    private final Duration requestTimeout;

    HttpResourceFetcher(HttpClient httpClient, HttpAuthentication authentication, Duration requestTimeout) {
        this.httpClient = requireNonNull(httpClient);
        this.authentication = requireNonNull(authentication);
        this.requestTimeout = requireNonNull(requestTimeout);
    }

    @Override
    protected byte[] fetchInternal(URI uri) throws IOException {
        final HttpRequest request = buildRequest(uri);
        final String location = uri.toString();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpConnectTimeoutException timeout) {
            throw rethrow(location, "Connection timeout", httpClient.connectTimeout().orElse(null), timeout);
        } catch (HttpTimeoutException timeout) {
            throw rethrow(location, "Request timeout", requestTimeout, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceUnavailableException(location, "Request was interrupted: " + location, e);
        }

        checkStatusCode(location, response.statusCode());
        return response.body();
    }

    private HttpRequest buildRequest(URI uri) {
        HttpRequest.Builder requestBuilder =
                HttpRequest.newBuilder().GET().uri(uri).timeout(requestTimeout);
        return authentication.authenticate(requestBuilder).build();
    }

    private static void checkStatusCode(String location, int statusCode) throws ResourceUnavailableException {
        if (statusCode == 401 || statusCode == 403) {
            throw new ResourceUnavailableException(
                    location, "Authentication failed for URI: " + location + ", status code: " + statusCode);
        }
        if (statusCode < 200 || statusCode > 299) {
            throw new ResourceUnavailableException(
                    location, "Failed to fetch URI: " + location + ", status code: " + statusCode);
        }
    }

    private static ResourceUnavailableException rethrow(
            String location, String what, Duration timeout, HttpTimeoutException cause) {
        String duration = timeout == null ? "default timeout" : timeout.toMillis() + " milliseconds";
        return new ResourceUnavailableException(location, what + " after " + duration + " to " + location, cause);
    }

    @Override
    public String getId() {
        return HttpResourceFetcherProvider.ID;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * @return a builder with the default timeouts and no authentication
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a fetcher with the default timeouts and no authentication
     */
    public static HttpResourceFetcher create() {
        return builder().build();
    }

    /**
     * Builder for {@link HttpResourceFetcher}.
     */
    public static class Builder {
        private Duration connectTimeout = DEFAULT_TIMEOUT;
        private Duration requestTimeout = DEFAULT_TIMEOUT;
        private HttpAuthentication authentication = HttpAuthentication.NONE;
        private HttpClient suppliedHttpClient;

        private Builder() {}

        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = positive(timeout, "Connect timeout");
            return this;
        }

        public Builder requestTimeout(Duration timeout) {
            this.requestTimeout = positive(timeout, "Request timeout");
            return this;
        }

        public Builder authentication(HttpAuthentication authentication) {
            this.authentication = Objects.requireNonNull(authentication, "Authentication cannot be null");
            return this;
        }

        public Builder basicAuth(String username, String password) {
            return authentication(new BasicAuthentication(username, password));
        }

        public Builder bearerToken(String token) {
            return authentication(new BearerTokenAuthentication(token));
        }

        /**
         * Uses the given client instead of building one; the connect timeout setting is then ignored.
         */
        public Builder httpClient(HttpClient client) {
            this.suppliedHttpClient = client;
            return this;
        }

        public HttpResourceFetcher build() {
            HttpClient httpClient = this.suppliedHttpClient;
            if (httpClient == null) {
                httpClient = HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(connectTimeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build();
            }
            return new HttpResourceFetcher(httpClient, authentication, requestTimeout);
        }

        private static Duration positive(Duration timeout, String name) {
            Objects.requireNonNull(timeout, name + " cannot be null");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + timeout);
            }
            return timeout;
        }
    }
}
