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

import java.time.Duration;

/**
 * A distributed lock could not be acquired within its timeout. Retryable.
 */
public class LockAcquisitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String resourceId;
    private final transient Duration timeout;

    public LockAcquisitionException(String resourceId, String operationName, Duration timeout) {
        super("Could not acquire lock for " + operationName + " within " + timeout.toMillis()
                + "ms, retry later");
        this.resourceId = resourceId;
        this.timeout = timeout;
    }

    public LockAcquisitionException(String resourceId, String operationName, Duration timeout, Throwable cause) {
        this(resourceId, operationName, timeout);
        initCause(cause);
    }

    public String getResourceId() {
        return resourceId;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isRetryable() {
        return true;
    }
}
