package me.golemcore.gateway.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * A message from the agent runtime could not be interpreted.
 */
public class MalformedRuntimeMessageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final int MAX_EXCERPT_LENGTH = 200;

    private final boolean initMessage;
    private final String excerpt;

    public MalformedRuntimeMessageException(String message, boolean initMessage, String rawContent) {
        super(message);
        this.initMessage = initMessage;
        this.excerpt = excerpt(rawContent);
    }

    /**
     * Whether the malformed message was the runtime's own init message, which
     * makes the whole query unusable.
     */
    public boolean isInitMessage() {
        return initMessage;
    }

    public String getExcerpt() {
        return excerpt;
    }

    static String excerpt(String rawContent) {
        if (rawContent == null) {
            return "";
        }
        if (rawContent.length() <= MAX_EXCERPT_LENGTH) {
            return rawContent;
        }
        return rawContent.substring(0, MAX_EXCERPT_LENGTH) + "...";
    }
}
