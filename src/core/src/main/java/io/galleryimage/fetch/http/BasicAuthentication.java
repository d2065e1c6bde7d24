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
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * HTTP Basic authentication for image hosts behind a password.
 */
public class BasicAuthentication implements HttpAuthentication {

    private final String username;
    private final String encodedCredentials;

    /**
     * @param username the user name
     * @param password the password
     */
    public BasicAuthentication(String username, String password) {
        this.username = Objects.requireNonNull(username, "Username cannot be null");
        Objects.requireNonNull(password, "Password cannot be null");
        String credentials = username + ":" + password;
        this.encodedCredentials = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public HttpRequest.Builder authenticate(HttpRequest.Builder requestBuilder) {
        return requestBuilder.header("Authorization", "Basic " + encodedCredentials);
    }

    public String getUsername() {
        return username;
    }
}
