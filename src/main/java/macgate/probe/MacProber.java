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

package macgate.probe;

import macgate.channel.CachedChannel;
import macgate.config.StreamingSettings;
import macgate.credential.MacRotator;
import macgate.credential.MacScorer;
import macgate.credential.OccupancyRegistry;
import macgate.credential.OccupiedSession;
import macgate.portal.MacRecord;
import macgate.portal.Portal;
import macgate.portal.PortalChannel;
import macgate.portal.PortalClient;
import macgate.stream.FailureReason;
import macgate.util.ThreadPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.concurrent.*;

/**
 * Finds a MAC that can deliver a channel.
 * <p/>
 * The MACs of the portal are scored, ordered and then tried one at a time or several at once.
 * The first MAC that produces a link wins. Every MAC that failed during the round is rotated to the
 * end of the portal's MAC list once the round is over.
 */
public class MacProber {
    private static final Logger logger = LogManager.getLogger(MacProber.class);

    private static final String LOCAL_CMD = "http://localhost/";

    private final PortalClient portalClient;
    private final OccupancyRegistry occupancy;
    private final MacRotator rotator;
    private final StreamTester tester;
    private final StreamingSettings settings;

    public MacProber(PortalClient portalClient, OccupancyRegistry occupancy, MacRotator rotator,
                     StreamTester tester, StreamingSettings settings) {

        this.portalClient = portalClient;
        this.occupancy = occupancy;
        this.rotator = rotator;
        this.tester = tester;
        this.settings = settings;
    }

    /**
     * Runs one probe round.
     *
     * @param request The request to satisfy.
     * @return The outcome. If a reservation was requested and a MAC won, the winner's slot is
     *         already taken and must be released by the caller.
     * @throws InterruptedException If the calling thread was interrupted. Any slot taken for the
     *                              round is released.
     */
    public ProbeOutcome probe(ProbeRequest request) throws InterruptedException {
        Portal portal = request.getPortal();
        CachedChannel cached = request.getCachedChannel();

        List<MacRecord> candidates = MacScorer.orderCandidates(
                portal.getMacs(),
                occupancy.snapshot(portal.getId()),
                portal.getStreamsPerMac(),
                cached == null ? null : cached.getAvailableMacs());

        logger.debug("Probing channel {} on portal '{}' with {} candidate MAC{}.",
                request.getChannelId(), portal.getName(), candidates.size(), candidates.size() == 1 ? "" : "s");

        Round round = new Round();

        try {
            if (settings.isParallelProbing() && candidates.size() > 1) {
                probeParallel(request, candidates, round);
            } else {
                probeSequential(request, candidates, round);
            }
        } catch (InterruptedException e) {
            ProbeResult claimed;
            Set<String> failed;
            synchronized (round) {
                round.closed = true;
                claimed = round.winner;
                round.winner = null;
                failed = new LinkedHashSet<>(round.failures.keySet());
            }

            // A parallel probe can win just before the interrupt arrives.
            if (claimed != null) {
                occupancy.release(claimed.getReservation());
            }

            if (!failed.isEmpty()) {
                rotator.rotate(portal.getId(), failed);
            }

            logger.debug("Probing channel {} on portal '{}' was interrupted.",
                    request.getChannelId(), portal.getName());
            throw e;
        }

        ProbeOutcome outcome;
        synchronized (round) {
            round.closed = true;
            outcome = new ProbeOutcome(round.winner, round.failures, round.anyMacFree);
        }

        if (!outcome.getFailures().isEmpty()) {
            rotator.rotate(portal.getId(), outcome.getFailures().keySet());
        }

        if (outcome.isFound()) {
            logger.info("MAC {} on portal '{}' will deliver channel {}.",
                    outcome.getResult().getMac(), portal.getName(), request.getChannelId());
        } else {
            logger.info("No MAC on portal '{}' could deliver channel {}: {}",
                    portal.getName(), request.getChannelId(), outcome.getFailures());
        }

        return outcome;
    }

    private void probeSequential(ProbeRequest request, List<MacRecord> candidates, Round round)
            throws InterruptedException {

        for (MacRecord mac : candidates) {
            Attempt attempt = probeSingleMac(request, mac, round);

            if (attempt.result != null) {
                synchronized (round) {
                    round.winner = attempt.result;
                }
                return;
            }

            if (attempt.cancelled) {
                throw new InterruptedException("Probing was interrupted.");
            }

            synchronized (round) {
                round.failures.put(mac.getMac(), attempt.reason);
            }

            if (!settings.isTryAllMacs()) {
                logger.debug("Not trying the remaining MACs because trying all MACs is disabled.");
                return;
            }
        }
    }

    private void probeParallel(final ProbeRequest request, List<MacRecord> candidates, final Round round)
            throws InterruptedException {

        int workers = Math.min(settings.getParallelWorkers(), candidates.size());
        ExecutorService executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<Runnable>(), ThreadPool.namedFactory("MacProbe"));
        CompletionService<Attempt> completionService = new ExecutorCompletionService<>(executor);

        try {
            for (final MacRecord mac : candidates) {
                completionService.submit(new Callable<Attempt>() {
                    @Override
                    public Attempt call() throws Exception {
                        synchronized (round) {
                            if (round.winner != null || round.closed) {
                                return Attempt.cancelled(mac.getMac());
                            }
                        }

                        Attempt attempt = probeSingleMac(request, mac, round);

                        if (attempt.result != null) {
                            synchronized (round) {
                                if (round.winner == null && !round.closed) {
                                    round.winner = attempt.result;
                                    return attempt;
                                }
                            }

                            // Another MAC already won or the round is over.
                            occupancy.release(attempt.result.getReservation());
                            return Attempt.cancelled(mac.getMac());
                        }

                        return attempt;
                    }
                });
            }

            long deadline = System.currentTimeMillis() + settings.getProbeRoundTimeout() * 1000L;
            int pending = candidates.size();

            while (pending > 0) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    logger.warn("Parallel probing of portal '{}' did not finish within {}s.",
                            request.getPortal().getName(), settings.getProbeRoundTimeout());
                    break;
                }

                Future<Attempt> future = completionService.poll(remaining, TimeUnit.MILLISECONDS);
                if (future == null) {
                    continue;
                }
                pending--;

                Attempt attempt;
                try {
                    attempt = future.get();
                } catch (ExecutionException e) {
                    logger.error("Probe threw an unexpected exception => ", e.getCause());
                    continue;
                }

                if (attempt.result != null) {
                    break;
                }

                if (!attempt.cancelled) {
                    synchronized (round) {
                        round.failures.put(attempt.mac, attempt.reason);
                    }

                    if (!settings.isTryAllMacs()) {
                        break;
                    }
                }
            }
        } finally {
            synchronized (round) {
                round.closed = true;
            }
            // Interrupts probes that are still running. Their late results are discarded.
            executor.shutdownNow();
        }
    }

    private Attempt probeSingleMac(ProbeRequest request, MacRecord macRecord, Round round) {
        Portal portal = request.getPortal();
        String mac = macRecord.getMac();
        OccupiedSession reservation = null;

        if (request.isReserve()) {
            reservation = occupancy.reserve(portal.getId(), portal.getName(), mac,
                    portal.getStreamsPerMac(), request.getChannelId(), null, request.getClientAddr());

            if (reservation == null) {
                logger.debug("MAC {} has no free playback slot.", mac);
                return Attempt.failed(mac, FailureReason.CREDENTIAL_UNAVAILABLE);
            }
        } else if (portal.getStreamsPerMac() != 0 &&
                occupancy.count(portal.getId(), mac) >= portal.getStreamsPerMac()) {

            logger.debug("MAC {} has no free playback slot.", mac);
            return Attempt.failed(mac, FailureReason.CREDENTIAL_UNAVAILABLE);
        }

        synchronized (round) {
            round.anyMacFree = true;
        }

        boolean keepReservation = false;

        try {
            Attempt attempt = resolve(request, mac, reservation);
            keepReservation = attempt.result != null;
            return attempt;
        } catch (InterruptedException e) {
            return Attempt.cancelled(mac);
        } finally {
            if (!keepReservation) {
                occupancy.release(reservation);
            }
        }
    }

    private Attempt resolve(ProbeRequest request, String mac, OccupiedSession reservation)
            throws InterruptedException {

        Portal portal = request.getPortal();
        String url = portal.getUrl();
        String proxy = portal.getProxy();
        CachedChannel cached = request.getCachedChannel();

        String token;
        try {
            token = portalClient.getToken(url, mac, proxy);
        } catch (Exception e) {
            logger.debug("Unable to get a token for MAC {} => {}", mac, e.getMessage());
            token = null;
        }

        if (token == null) {
            return Attempt.failed(mac, FailureReason.AUTH_FAILURE);
        }

        checkInterrupted();

        try {
            portalClient.getProfile(url, mac, token, proxy);
        } catch (Exception e) {
            logger.debug("Profile request for MAC {} failed => {}", mac, e.getMessage());
        }

        String channelName = cached == null ? null : cached.getName();
        String cmd = cached == null ? null : cached.getCmd();

        if (cmd == null || cmd.trim().length() == 0) {
            checkInterrupted();

            List<PortalChannel> channels;
            try {
                channels = portalClient.getAllChannels(url, mac, token, proxy);
            } catch (Exception e) {
                logger.debug("Unable to list channels for MAC {} => {}", mac, e.getMessage());
                channels = null;
            }

            PortalChannel channel = findChannel(channels, request.getChannelId(),
                    cached == null ? Collections.<String>emptyList() : cached.getAlternateIds());

            if (channel != null) {
                cmd = channel.getCmd();
                if (channelName == null) {
                    channelName = channel.getName();
                }
            }
        }

        if (cmd == null || cmd.trim().length() == 0) {
            logger.debug("MAC {} does not list channel {}.", mac, request.getChannelId());
            return Attempt.failed(mac, FailureReason.CHANNEL_RESOLUTION_FAILURE);
        }

        checkInterrupted();

        String link;
        if (cmd.contains(LOCAL_CMD)) {
            try {
                link = portalClient.getLink(url, mac, token, cmd, proxy);
            } catch (Exception e) {
                logger.debug("Unable to resolve a link for MAC {} => {}", mac, e.getMessage());
                link = null;
            }
        } else {
            link = linkFromCmd(cmd);
        }

        if (link == null || link.trim().length() == 0) {
            return Attempt.failed(mac, FailureReason.LINK_RESOLUTION_FAILURE);
        }

        checkInterrupted();

        if (settings.isTestStreams() && !tester.test(link, proxy, settings.getFfmpegTimeout())) {
            logger.debug("The link from MAC {} did not pass the stream test.", mac);
            return Attempt.failed(mac, FailureReason.STREAM_LIVENESS_FAILURE);
        }

        if (reservation != null) {
            reservation.setChannelName(channelName);
        }

        return Attempt.succeeded(mac, new ProbeResult(mac, token, link, channelName, reservation));
    }

    /**
     * Looks for the channel under its own id first, then under each alternate id in order.
     */
    static PortalChannel findChannel(List<PortalChannel> channels, String channelId, List<String> alternateIds) {
        if (channels == null) {
            return null;
        }

        List<String> ids = new ArrayList<>(alternateIds.size() + 1);
        ids.add(channelId);
        ids.addAll(alternateIds);

        for (String id : ids) {
            for (PortalChannel channel : channels) {
                if (id.equals(channel.getId()) && channel.getCmd() != null) {
                    return channel;
                }
            }
        }

        return null;
    }

    /**
     * The link is the second whitespace separated token of a command. A command with only one
     * token is the link itself.
     */
    static String linkFromCmd(String cmd) {
        String parts[] = cmd.trim().split("\\s+");

        if (parts.length > 1) {
            return parts[1];
        }

        return parts[0];
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException();
        }
    }

    private static class Round {
        private ProbeResult winner;
        private boolean closed;
        private boolean anyMacFree;
        private final Map<String, FailureReason> failures = new LinkedHashMap<>();
    }

    private static class Attempt {
        private final String mac;
        private final ProbeResult result;
        private final FailureReason reason;
        private final boolean cancelled;

        private Attempt(String mac, ProbeResult result, FailureReason reason, boolean cancelled) {
            this.mac = mac;
            this.result = result;
            this.reason = reason;
            this.cancelled = cancelled;
        }

        static Attempt succeeded(String mac, ProbeResult result) {
            return new Attempt(mac, result, null, false);
        }

        static Attempt failed(String mac, FailureReason reason) {
            return new Attempt(mac, null, reason, false);
        }

        static Attempt cancelled(String mac) {
            return new Attempt(mac, null, null, true);
        }
    }
}
