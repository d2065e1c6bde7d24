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

import java.net.http.HttpRequest;
import java.util.Objects;

/**
 * Sends an {@code Authorization: Bearer <token>} header, as expected by token-protected image APIs.
 */
public class BearerTokenAuthentication implements HttpAuthentication {

    private final String token;

    /**
     * @param token the bearer token
     */
    public BearerTokenAuthentication(String token) {
        this.token = Objects.requireNonNull(token, "Token cannot be null");
    }

    @Override
    public HttpRequest.Builder authenticate(HttpRequest.Builder requestBuilder) {
        return requestBuilder.header("Authorization", "Bearer " + token);
    }
}
