/*
 * Copyright 2024 The MacGate Authors. All Rights Reserved
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package macgate.jobs;

import java.time.Instant;

/**
 * The state of a refresh or matching run as reported to clients.
 */
public class RefreshStatus {
    public static final String QUEUED = "queued";
    public static final String RUNNING = "running";
    public static final String COMPLETED = "completed";
    public static final String ERROR = "error";

    private String status;
    private String reason;
    private String queuedAt;
    private String startedAt;
    private String completedAt;
    private String error;
    private PortalStats stats;
    private Integer matched;
    private int attempts;

    public RefreshStatus() {
    }

    public RefreshStatus copy() {
        RefreshStatus returnValue = new RefreshStatus();
        returnValue.status = status;
        returnValue.reason = reason;
        returnValue.queuedAt = queuedAt;
        returnValue.startedAt = startedAt;
        returnValue.completedAt = completedAt;
        returnValue.error = error;
        returnValue.stats = stats;
        returnValue.matched = matched;
        returnValue.attempts = attempts;
        return returnValue;
    }

    void markQueued(String reason) {
        this.status = QUEUED;
        this.reason = reason;
        this.queuedAt = now();
        this.startedAt = null;
        this.completedAt = null;
        this.error = null;
        this.stats = null;
        this.attempts = 0;
    }

    void markRunning() {
        this.status = RUNNING;
        this.startedAt = now();
        this.completedAt = null;
        this.error = null;
    }

    void markCompleted() {
        this.status = COMPLETED;
        this.completedAt = now();
        this.error = null;
    }

    void markError(String error) {
        this.status = ERROR;
        this.completedAt = now();
        this.error = error;
    }

    void setStats(PortalStats stats) {
        this.stats = stats;
    }

    void setMatched(Integer matched) {
        this.matched = matched;
    }

    void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    public String getQueuedAt() {
        return queuedAt;
    }

    public String getStartedAt() {
        return startedAt;
    }

    public String getCompletedAt() {
        return completedAt;
    }

    public String getError() {
        return error;
    }

    public PortalStats getStats() {
        return stats;
    }

    public Integer getMatched() {
        return matched;
    }

    /**
     * @return How many times the job behind this status has run. Retries count as runs.
     */
    public int getAttempts() {
        return attempts;
    }

    private static String now() {
        return Instant.now().toString();
    }
}
