package me.golemcore.gateway.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.model.QueryRequest;
import me.golemcore.gateway.domain.stream.EventStreamGenerator;
import me.golemcore.gateway.port.outbound.AgentRuntimePort;
import org.springframework.stereotype.Service;

/**
 * Interrupt, resume and fork of existing sessions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionControlService {

    private final SessionRecordService recordService;
    private final ActiveSessionTracker tracker;
    private final QueryStreamService queryStreamService;
    private final AgentRuntimePort runtime;

    /**
     * Ask a running session to stop. The replica running it observes the
     * marker after its next event.
     *
     * <p>
     * Ownership is checked against the session record, or against the owner
     * hash on the active marker while the record is not written yet.
     *
     * @return false if the session is not running
     * @throws SessionNotFoundException
     *             if the session belongs to someone else
     */
    public boolean interrupt(String sessionId, String credential) {
        if (recordService.exists(sessionId)) {
            recordService.get(sessionId, credential);
        } else {
            enforceActiveOwner(sessionId, credential);
        }
        if (!tracker.isActive(sessionId)) {
            log.debug("[Control] Interrupt for inactive session {}", sessionId);
            return false;
        }
        tracker.markInterrupted(sessionId);
        runtime.stop(sessionId);
        return true;
    }

    private void enforceActiveOwner(String sessionId, String credential) {
        if (!OwnerHashSupport.hasCredential(credential)) {
            return;
        }
        tracker.activeOwnerHash(sessionId).ifPresent(ownerHash -> {
            if (!OwnerHashSupport.matches(ownerHash, credential)) {
                throw new SessionNotFoundException(sessionId);
            }
        });
    }

    public EventStreamGenerator resume(String sessionId, QueryRequest request, String credential) {
        QueryRequest resumeRequest = request.toBuilder()
                .sessionId(sessionId)
                .resume(true)
                .forkSession(false)
                .build();
        log.info("[Control] Resuming session {}", sessionId);
        return queryStreamService.open(resumeRequest, credential);
    }

    public EventStreamGenerator fork(String sessionId, QueryRequest request, String credential) {
        QueryRequest forkRequest = request.toBuilder()
                .sessionId(sessionId)
                .resume(false)
                .forkSession(true)
                .build();
        EventStreamGenerator generator = queryStreamService.open(forkRequest, credential);
        log.info("[Control] Forked session {} into {}", sessionId, generator.getSessionId());
        return generator;
    }
}
