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

import macgate.portal.Portal;
import macgate.portal.PortalLocks;
import macgate.portal.PortalStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs portal channel refreshes and EPG refreshes in the background.
 * <p/>
 * A job is identified by its type and portal. While a job is queued or running, asking for the
 * same job again only reports what is already happening. Worker threads are started on demand up
 * to the configured maximum and exit once the queue is empty. Jobs for the same portal never run
 * at the same time and only one EPG refresh runs at a time. Failed jobs are retried with a growing
 * delay before they are reported as errors.
 */
public class JobManager {
    private static final Logger logger = LogManager.getLogger(JobManager.class);

    public static final String STATUS_QUEUED = "queued";
    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_STOPPED = "stopped";

    public static final long MAX_BACKOFF_UNITS = 60;
    // How long a worker waits for a job to become runnable before it checks if it should exit.
    private static final long IDLE_POLL_MS = 1000;
    private static final long EPG_BUSY_DELAY_MS = 500;

    private final PortalStore portalStore;
    private final PortalLocks portalLocks;
    private final ChannelRefresher channelRefresher;
    private final EpgRefresher epgRefresher;
    private final ChannelMatcher channelMatcher;
    private final boolean matchingEnabled;
    private final int maxWorkers;
    private final int maxRetries;
    private final long backoffUnitMs;

    private final Object stateLock = new Object();
    private final DelayQueue<Job> queue = new DelayQueue<>();
    private final Set<String> queuedKeys = new HashSet<>();
    private final Set<String> inFlight = new HashSet<>();
    private final Set<Thread> workers = new HashSet<>();
    private boolean shutdown;

    private final ReentrantLock epgLock = new ReentrantLock();

    private final Map<String, RefreshStatus> portalStatus = new HashMap<>();
    private final Map<String, RefreshStatus> matchStatus = new HashMap<>();
    private final RefreshStatus epgStatus = new RefreshStatus();

    /**
     * @param portalStore Source of portal definitions.
     * @param portalLocks Per portal locks shared with everything else that changes portals.
     * @param channelRefresher Refreshes the channel cache of a portal.
     * @param epgRefresher Refreshes the programme guide.
     * @param channelMatcher Matches channels after a refresh or <i>null</i> to never match.
     * @param matchingEnabled If matching runs for portals that ask for it.
     * @param maxWorkers The maximum number of worker threads.
     * @param maxRetries How many times a failed job is retried.
     * @param backoffUnitMs The length of one backoff unit. Retry <i>n</i> waits
     *                      <i>min(60, 2^n)</i> units.
     */
    public JobManager(PortalStore portalStore, PortalLocks portalLocks, ChannelRefresher channelRefresher,
                      EpgRefresher epgRefresher, ChannelMatcher channelMatcher, boolean matchingEnabled,
                      int maxWorkers, int maxRetries, long backoffUnitMs) {

        this.portalStore = portalStore;
        this.portalLocks = portalLocks;
        this.channelRefresher = channelRefresher;
        this.epgRefresher = epgRefresher;
        this.channelMatcher = channelMatcher;
        this.matchingEnabled = matchingEnabled;
        this.maxWorkers = Math.max(1, maxWorkers);
        this.maxRetries = Math.max(0, maxRetries);
        this.backoffUnitMs = backoffUnitMs;
    }

    public String enqueueRefreshPortal(String portalId, String reason) {
        return enqueue(JobType.REFRESH_PORTAL, portalId, reason);
    }

    /**
     * Requests a refresh of every enabled portal.
     *
     * @return The number of portals that are now queued or already running.
     */
    public int enqueueRefreshAll(String reason) {
        int enqueued = 0;

        for (Portal portal : portalStore.getPortals()) {
            if (!portal.isEnabled()) {
                continue;
            }

            String status = enqueueRefreshPortal(portal.getId(), reason);
            if (STATUS_QUEUED.equals(status) || STATUS_RUNNING.equals(status)) {
                enqueued++;
            }
        }

        return enqueued;
    }

    public String enqueueEpgRefresh(String reason) {
        return enqueue(JobType.REFRESH_EPG, null, reason);
    }

    /**
     * Queues a job unless the same job is already queued or running.
     *
     * @return {@link #STATUS_RUNNING} if the job is running, {@link #STATUS_STOPPED} if the job
     *         manager was shut down, otherwise {@link #STATUS_QUEUED}.
     */
    public String enqueue(JobType type, String portalId, String reason) {
        String key = Job.key(type, portalId);

        synchronized (stateLock) {
            if (shutdown) {
                logger.warn("Not queuing {} for {}. The job manager is stopped.", type, portalId);
                return STATUS_STOPPED;
            }

            if (inFlight.contains(key)) {
                return STATUS_RUNNING;
            }

            if (queuedKeys.contains(key)) {
                return STATUS_QUEUED;
            }

            Job job = new Job(type, portalId, reason);
            queuedKeys.add(key);
            queue.add(job);

            logger.debug("Queued job {} ({}).", job, job.getReason());
        }

        if (type == JobType.REFRESH_PORTAL) {
            markPortalQueued(portalId, reason);
        } else {
            synchronized (epgStatus) {
                epgStatus.markQueued(reason);
            }
        }

        ensureWorkers();
        return STATUS_QUEUED;
    }

    public RefreshStatus getPortalRefreshStatus(String portalId) {
        synchronized (portalStatus) {
            RefreshStatus status = portalStatus.get(portalId);
            return status == null ? null : status.copy();
        }
    }

    public RefreshStatus getMatchStatus(String portalId) {
        synchronized (matchStatus) {
            RefreshStatus status = matchStatus.get(portalId);
            return status == null ? null : status.copy();
        }
    }

    public RefreshStatus getEpgStatus() {
        synchronized (epgStatus) {
            return epgStatus.copy();
        }
    }

    public int getRunningWorkers() {
        synchronized (stateLock) {
            return workers.size();
        }
    }

    /**
     * @return <i>true</i> if nothing is queued or running.
     */
    public boolean isIdle() {
        synchronized (stateLock) {
            return queuedKeys.isEmpty() && inFlight.isEmpty();
        }
    }

    /**
     * Drops every queued job and interrupts the workers.
     */
    public void shutdown() {
        List<Thread> stopping;

        synchronized (stateLock) {
            shutdown = true;
            queue.clear();
            queuedKeys.clear();
            stopping = new ArrayList<>(workers);
        }

        for (Thread worker : stopping) {
            worker.interrupt();
        }
    }

    private void ensureWorkers() {
        synchronized (stateLock) {
            while (!shutdown && workers.size() < maxWorkers && !queue.isEmpty()) {
                Thread worker = new Thread(new Runnable() {
                    @Override
                    public void run() {
                        runWorker();
                    }
                });

                worker.setName("JobWorker-" + worker.getId());
                worker.setDaemon(true);
                workers.add(worker);
                worker.start();
            }
        }
    }

    private void runWorker() {
        try {
            while (true) {
                synchronized (stateLock) {
                    if (shutdown || queue.isEmpty()) {
                        return;
                    }
                }

                Job job;
                try {
                    job = queue.poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    return;
                }

                if (job == null) {
                    continue;
                }

                synchronized (stateLock) {
                    queuedKeys.remove(job.getKey());
                    inFlight.add(job.getKey());
                }

                execute(job);
            }
        } finally {
            synchronized (stateLock) {
                workers.remove(Thread.currentThread());
            }

            // A job may have been queued between the empty check and the removal above.
            ensureWorkers();
        }
    }

    private void execute(Job job) {
        ReentrantLock lock = null;

        if (job.getPortalId() != null) {
            lock = portalLocks.getLock(job.getPortalId());
            lock.lock();
        } else if (job.getType() == JobType.REFRESH_EPG) {
            if (!epgLock.tryLock()) {
                logger.debug("EPG refresh is busy. Trying again in {}ms.", EPG_BUSY_DELAY_MS);
                requeue(job, System.currentTimeMillis() + EPG_BUSY_DELAY_MS);
                return;
            }
            lock = epgLock;
        }

        boolean requeued = false;
        int attempts = job.incrementAttempts();

        try {
            runJob(job);
        } catch (Exception e) {
            if (attempts <= maxRetries) {
                long backoff = backoffUnits(attempts);
                logger.error("Job {} failed (retry in {} units of {}ms) => {}",
                        job, backoff, backoffUnitMs, e.getMessage());

                if (lock != null) {
                    lock.unlock();
                    lock = null;
                }
                requeue(job, System.currentTimeMillis() + backoff * backoffUnitMs);
                requeued = true;
            } else {
                logger.error("Job {} failed after {} attempts => ", job, attempts, e);
                markJobError(job, e);
            }
        } finally {
            if (lock != null) {
                lock.unlock();
            }

            if (!requeued) {
                synchronized (stateLock) {
                    inFlight.remove(job.getKey());
                }
            }
        }
    }

    /**
     * The number of backoff units to wait after a job failed on the given run. The delay doubles
     * with every run up to {@link #MAX_BACKOFF_UNITS}.
     */
    static long backoffUnits(int attempts) {
        if (attempts >= 6) {
            return MAX_BACKOFF_UNITS;
        }

        return Math.min(MAX_BACKOFF_UNITS, 1L << Math.max(0, attempts));
    }

    private void requeue(Job job, long runAt) {
        job.reschedule(runAt);

        synchronized (stateLock) {
            inFlight.remove(job.getKey());

            if (shutdown) {
                return;
            }

            queuedKeys.add(job.getKey());
            queue.add(job);
        }
    }

    private void runJob(Job job) throws Exception {
        switch (job.getType()) {
            case REFRESH_PORTAL:
                refreshPortal(job.getPortalId(), job.getAttempts());
                break;
            case REFRESH_EPG:
                refreshEpg(job.getAttempts());
                break;
            default:
                logger.warn("Unknown job type: {}", job.getType());
        }
    }

    private void refreshPortal(String portalId, int attempts) throws Exception {
        Portal portal = portalStore.getPortal(portalId);
        String portalName = portal == null ? portalId : portal.getName();

        logger.info("Job refresh_portal started: {}", portalName);

        synchronized (portalStatus) {
            RefreshStatus status = getOrCreate(portalStatus, portalId);
            status.markRunning();
            status.setAttempts(attempts);
        }

        epgRefresher.invalidateGuide();
        channelRefresher.refreshChannels(portalId);
        PortalStats stats = channelRefresher.computeStats(portalId);

        synchronized (portalStatus) {
            RefreshStatus status = getOrCreate(portalStatus, portalId);
            status.markCompleted();
            status.setStats(stats);
        }

        if (shouldMatch(portal)) {
            runMatching(portalId);
        }

        enqueueEpgRefresh("portal_refresh");
        logger.info("Job refresh_portal completed: {}", portalName);
    }

    private void runMatching(String portalId) throws Exception {
        synchronized (matchStatus) {
            RefreshStatus status = getOrCreate(matchStatus, portalId);
            status.markRunning();
            status.setMatched(0);
        }

        try {
            int matched = channelMatcher.matchPortal(portalId);

            synchronized (matchStatus) {
                RefreshStatus status = getOrCreate(matchStatus, portalId);
                status.markCompleted();
                status.setMatched(matched);
            }
        } catch (Exception e) {
            synchronized (matchStatus) {
                getOrCreate(matchStatus, portalId).markError(String.valueOf(e.getMessage()));
            }
            throw e;
        }
    }

    private void refreshEpg(int attempts) throws Exception {
        logger.info("Job refresh_epg started.");

        synchronized (epgStatus) {
            epgStatus.markRunning();
            epgStatus.setAttempts(attempts);
        }

        epgRefresher.refreshEpg();

        synchronized (epgStatus) {
            epgStatus.markCompleted();
        }

        logger.info("Job refresh_epg completed.");
    }

    private boolean shouldMatch(Portal portal) {
        return matchingEnabled && channelMatcher != null && portal != null && portal.isAutoMatch();
    }

    private void markPortalQueued(String portalId, String reason) {
        synchronized (portalStatus) {
            getOrCreate(portalStatus, portalId).markQueued(reason);
        }

        if (shouldMatch(portalStore.getPortal(portalId))) {
            synchronized (matchStatus) {
                RefreshStatus status = getOrCreate(matchStatus, portalId);
                status.markQueued(reason);
                status.setMatched(0);
            }
        }
    }

    private void markJobError(Job job, Exception e) {
        String message = String.valueOf(e.getMessage());

        if (job.getType() == JobType.REFRESH_PORTAL) {
            synchronized (portalStatus) {
                RefreshStatus status = getOrCreate(portalStatus, job.getPortalId());
                status.markError(message);
                status.setAttempts(job.getAttempts());
            }
        } else if (job.getType() == JobType.REFRESH_EPG) {
            synchronized (epgStatus) {
                epgStatus.markError(message);
                epgStatus.setAttempts(job.getAttempts());
            }
        }
    }

    private static RefreshStatus getOrCreate(Map<String, RefreshStatus> map, String key) {
        RefreshStatus status = map.get(key);

        if (status == null) {
            status = new RefreshStatus();
            map.put(key, status);
        }

        return status;
    }
}
