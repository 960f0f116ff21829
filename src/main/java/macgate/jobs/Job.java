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

import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A unit of background work. Jobs are ordered by the time they become runnable.
 */
public class Job implements Delayed {
    private static final AtomicLong sequencer = new AtomicLong(0);

    private final JobType type;
    private final String portalId;
    private final String reason;
    private volatile int attempts;
    private volatile long runAt;
    private volatile long sequence;

    public Job(JobType type, String portalId, String reason) {
        this.type = type;
        this.portalId = portalId;
        this.reason = reason == null ? "" : reason;
        this.runAt = System.currentTimeMillis();
        this.sequence = sequencer.incrementAndGet();
    }

    /**
     * Jobs with the same key are never queued or running more than once at the same time.
     */
    public static String key(JobType type, String portalId) {
        return type.NAME + ":" + (portalId == null ? "" : portalId);
    }

    public String getKey() {
        return key(type, portalId);
    }

    public JobType getType() {
        return type;
    }

    public String getPortalId() {
        return portalId;
    }

    public String getReason() {
        return reason;
    }

    /**
     * @return The number of times this job has been run, including the current run.
     */
    public int getAttempts() {
        return attempts;
    }

    int incrementAttempts() {
        return ++attempts;
    }

    public long getRunAt() {
        return runAt;
    }

    /**
     * Must only be called while the job is not in a queue.
     */
    void reschedule(long runAt) {
        this.runAt = runAt;
        this.sequence = sequencer.incrementAndGet();
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(runAt - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        if (o == this) {
            return 0;
        }

        if (o instanceof Job) {
            Job other = (Job) o;
            int compare = Long.compare(runAt, other.runAt);
            return compare != 0 ? compare : Long.compare(sequence, other.sequence);
        }

        return Long.compare(getDelay(TimeUnit.MILLISECONDS), o.getDelay(TimeUnit.MILLISECONDS));
    }

    @Override
    public String toString() {
        return type.NAME + (portalId == null ? "" : " for " + portalId);
    }
}
