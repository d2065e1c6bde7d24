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

/**
 * Adds credentials to the requests issued by {@link HttpResourceFetcher}, typically as a header.
 */
@FunctionalInterface
public interface HttpAuthentication {

    /** Leaves requests untouched. */
    HttpAuthentication NONE = requestBuilder -> requestBuilder;

    /**
     * @param requestBuilder the request being built
     * @return the same builder with credentials applied
     */
    HttpRequest.Builder authenticate(HttpRequest.Builder requestBuilder);
}
