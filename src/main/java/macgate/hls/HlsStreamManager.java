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

package macgate.hls;

import macgate.channel.ChannelCache;
import macgate.config.HlsSettings;
import macgate.portal.Portal;
import macgate.probe.MacProber;
import macgate.probe.ProbeOutcome;
import macgate.probe.ProbeRequest;
import macgate.process.ExternalProcess;
import macgate.process.ProcessLauncher;
import macgate.stream.FailureReason;
import macgate.stream.StreamException;
import macgate.util.Util;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;

/**
 * Shares one upstream pull per channel between every HLS viewer.
 * <p/>
 * At most {@link HlsSettings#getMaxStreams()} streams exist at once. A reaper thread removes
 * streams whose process died or that nobody requested a file from for longer than the inactive
 * timeout. Streams are added to and removed from the registry while holding the registry lock.
 * Starting a process, stopping it and deleting its files happens outside of it.
 */
public class HlsStreamManager {
    private static final Logger logger = LogManager.getLogger(HlsStreamManager.class);

    public static final long STOP_GRACE_MS = 5000;

    private final HlsSettings settings;
    private final ProcessLauncher launcher;
    private final File tempRoot;
    private final MacProber prober;
    private final ChannelCache channelCache;

    private final Object lock = new Object();
    private final Map<String, HlsStream> streams = new HashMap<>();
    // Keys of streams whose process is being started outside of the lock.
    private final Set<String> starting = new HashSet<>();
    private boolean stopped;

    private Thread reaperThread;
    private volatile boolean running;

    /**
     * @param settings The HLS options.
     * @param launcher Starts the transcoding processes.
     * @param tempRoot The directory temp directories are created in.
     * @param prober Resolves links for {@link #openStream}. Can be <i>null</i> if that method is
     *               never used.
     * @param channelCache Cached channel data used for probing. Can be <i>null</i>.
     */
    public HlsStreamManager(HlsSettings settings, ProcessLauncher launcher, File tempRoot,
                            MacProber prober, ChannelCache channelCache) {

        this.settings = settings;
        this.launcher = launcher;
        this.tempRoot = tempRoot;
        this.prober = prober;
        this.channelCache = channelCache;
    }

    public static String streamKey(String portalId, String channelId) {
        return portalId + "_" + channelId;
    }

    public synchronized void startReaper() {
        if (reaperThread != null) {
            return;
        }

        running = true;
        reaperThread = new Thread(new Runnable() {
            @Override
            public void run() {
                logger.info("HLS reaper started. Checking every {}ms.", settings.getReapIntervalMs());

                while (running && !Thread.currentThread().isInterrupted()) {
                    try {
                        Thread.sleep(settings.getReapIntervalMs());
                    } catch (InterruptedException e) {
                        break;
                    }

                    try {
                        reap();
                    } catch (Exception e) {
                        logger.error("Unexpected exception while removing inactive HLS streams => ", e);
                    }
                }

                logger.info("HLS reaper stopped.");
            }
        });

        reaperThread.setName("HlsReaper-" + reaperThread.getId());
        reaperThread.setDaemon(true);
        reaperThread.start();
    }

    /**
     * Returns the stream for a channel, starting it if needed.
     *
     * @param portalId The portal.
     * @param channelId The channel.
     * @param sourceUrl The upstream link.
     * @param proxy The proxy or <i>null</i>.
     * @return The new or existing stream.
     * @throws StreamException If the stream limit is reached or the process could not start.
     */
    public HlsStream startStream(String portalId, String channelId, String sourceUrl, String proxy)
            throws StreamException {

        String key = streamKey(portalId, channelId);

        synchronized (lock) {
            // Another request is already starting this channel.
            while (starting.contains(key)) {
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StreamException(FailureReason.PROCESS_CRASH,
                            "Interrupted while waiting for the HLS stream to start.", e);
                }
            }

            if (stopped) {
                throw new StreamException(FailureReason.ADMISSION_REJECTED, "HLS streaming is stopped.");
            }

            HlsStream existing = streams.get(key);
            if (existing != null) {
                existing.touch();
                logger.debug("Reusing HLS stream {}.", key);
                return existing;
            }

            if (streams.size() + starting.size() >= settings.getMaxStreams()) {
                logger.warn("Unable to start HLS stream {}. The limit of {} streams is reached.",
                        key, settings.getMaxStreams());
                throw new StreamException(FailureReason.ADMISSION_REJECTED,
                        "The maximum of " + settings.getMaxStreams() + " HLS streams are already active.");
            }

            starting.add(key);
        }

        HlsStream stream = null;
        boolean registered = false;
        try {
            stream = spawn(portalId, channelId, key, sourceUrl, proxy);
        } finally {
            synchronized (lock) {
                starting.remove(key);
                if (stream != null && !stopped) {
                    streams.put(key, stream);
                    registered = true;
                }
                lock.notifyAll();
            }
        }

        if (!registered) {
            // Stopped while the process was starting.
            stopAndClean(stream, 0);
            throw new StreamException(FailureReason.ADMISSION_REJECTED, "HLS streaming is stopped.");
        }

        return stream;
    }

    private HlsStream spawn(String portalId, String channelId, String key, String sourceUrl, String proxy)
            throws StreamException {

        File tempDir = createTempDir(key);
        boolean passthrough = HlsCommandBuilder.isPassthroughSource(sourceUrl);

        try {
            if (passthrough) {
                logger.info("Creating HLS passthrough for {}.", key);
                writeFile(new File(tempDir, HlsStream.MASTER_PLAYLIST),
                        HlsCommandBuilder.passthroughMasterPlaylist(sourceUrl));

                return new HlsStream(portalId, channelId, null, true, tempDir, sourceUrl);
            }

            logger.info("Starting HLS transcoding for {}.", key);
            List<String> command = HlsCommandBuilder.build(settings, sourceUrl, proxy, tempDir);
            ExternalProcess process = launcher.launch("hls-" + key, command, false, tempDir);

            try {
                writeFile(new File(tempDir, HlsStream.MASTER_PLAYLIST),
                        HlsCommandBuilder.transcodeMasterPlaylist());
            } catch (IOException e) {
                process.kill();
                throw e;
            }

            return new HlsStream(portalId, channelId, process, false, tempDir, sourceUrl);
        } catch (IOException e) {
            Util.deleteRecursively(tempDir);
            logger.error("Unable to start HLS stream {} => ", key, e);
            throw new StreamException(FailureReason.PROCESS_CRASH, "Unable to start the HLS stream.", e);
        }
    }

    /**
     * Returns the stream for a channel. If it isn't running, a MAC is probed for a link first.
     * Probing does not take a playback slot.
     *
     * @throws StreamException If no MAC could deliver the channel or the stream couldn't start.
     */
    public HlsStream openStream(Portal portal, String channelId) throws StreamException {
        HlsStream existing = getStream(portal.getId(), channelId);
        if (existing != null) {
            existing.touch();
            return existing;
        }

        if (prober == null) {
            throw new IllegalStateException("No prober is available to resolve links.");
        }

        ProbeRequest request = new ProbeRequest(portal, channelId,
                channelCache == null ? null : channelCache.getChannel(portal.getId(), channelId),
                false, null);

        ProbeOutcome outcome;
        try {
            outcome = prober.probe(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StreamException(FailureReason.NO_WORKING_STREAM, "Probing was interrupted.", e);
        }

        if (!outcome.isFound()) {
            logger.error("Could not get a stream link for portal '{}' channel {}.", portal.getName(), channelId);
            throw new StreamException(outcome.getExhaustionReason(), "Stream not available");
        }

        return startStream(portal.getId(), channelId, outcome.getResult().getLink(), portal.getProxy());
    }

    public HlsStream getStream(String portalId, String channelId) {
        synchronized (lock) {
            return streams.get(streamKey(portalId, channelId));
        }
    }

    /**
     * Looks up a file of an active stream and marks the stream as accessed.
     *
     * @return The file or <i>null</i> if the stream isn't active or the file doesn't exist yet.
     */
    public File getFile(String portalId, String channelId, String filename) {
        HlsStream stream = getStream(portalId, channelId);

        if (stream == null) {
            logger.debug("File request for inactive stream {}/{}.", streamKey(portalId, channelId), filename);
            return null;
        }

        stream.touch();

        File file = new File(stream.getTempDir(), filename);
        try {
            String root = stream.getTempDir().getCanonicalPath() + File.separator;
            if (!file.getCanonicalPath().startsWith(root)) {
                logger.warn("Rejected file request outside of the stream directory: {}", filename);
                return null;
            }
        } catch (IOException e) {
            logger.warn("Unable to resolve '{}' => {}", filename, e.getMessage());
            return null;
        }

        if (file.isFile()) {
            return file;
        }

        if (stream.isCrashed()) {
            logger.error("HLS process for {} died with exit code {}. Missing file: {}",
                    stream.getKey(), stream.getProcess().getExitCode(), filename);
        }

        return null;
    }

    public int getActiveCount() {
        synchronized (lock) {
            return streams.size();
        }
    }

    public List<HlsStream> getStreams() {
        synchronized (lock) {
            return new ArrayList<>(streams.values());
        }
    }

    /**
     * Removes crashed and inactive streams. Normally called by the reaper thread.
     *
     * @return The number of streams removed.
     */
    public int reap() {
        long now = System.currentTimeMillis();
        List<HlsStream> removed = new ArrayList<>();

        synchronized (lock) {
            Iterator<HlsStream> iterator = streams.values().iterator();

            while (iterator.hasNext()) {
                HlsStream stream = iterator.next();

                if (stream.isCrashed()) {
                    logger.error("HLS process for {} crashed with exit code {}. Last output: {}",
                            stream.getKey(), stream.getProcess().getExitCode(),
                            stream.getProcess().getStderrTail(8));
                    iterator.remove();
                    removed.add(stream);
                } else if (now - stream.getLastAccessed() > settings.getInactiveTimeoutMs()) {
                    logger.info("Removing HLS stream {} after {}ms without requests.",
                            stream.getKey(), now - stream.getLastAccessed());
                    iterator.remove();
                    removed.add(stream);
                }
            }
        }

        for (HlsStream stream : removed) {
            stopAndClean(stream, STOP_GRACE_MS);
        }

        return removed.size();
    }

    /**
     * Stops the reaper and every stream.
     */
    public void shutdown() {
        logger.info("Cleaning up all HLS streams...");

        Thread thread;
        synchronized (this) {
            running = false;
            thread = reaperThread;
            reaperThread = null;
        }

        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(STOP_GRACE_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        List<HlsStream> remaining;
        synchronized (lock) {
            stopped = true;
            remaining = new ArrayList<>(streams.values());
            streams.clear();
        }

        for (HlsStream stream : remaining) {
            stopAndClean(stream, 0);
        }

        logger.info("All HLS streams cleaned up.");
    }

    private void stopAndClean(HlsStream stream, long graceMs) {
        ExternalProcess process = stream.getProcess();

        if (process != null) {
            if (graceMs > 0) {
                process.terminate(graceMs);
            } else {
                process.kill();
            }
        }

        if (Util.deleteRecursively(stream.getTempDir())) {
            logger.debug("Deleted '{}'.", stream.getTempDir());
        }
    }

    private File createTempDir(String key) throws StreamException {
        String prefix = "macgate_hls_" + key.replaceAll("[^A-Za-z0-9_-]", "_") + "_";

        try {
            if (tempRoot != null) {
                Files.createDirectories(tempRoot.toPath());
                return Files.createTempDirectory(tempRoot.toPath(), prefix).toFile();
            }

            return Files.createTempDirectory(prefix).toFile();
        } catch (IOException e) {
            logger.error("Unable to create a temp directory for {} => ", key, e);
            throw new StreamException(FailureReason.PROCESS_CRASH, "Unable to create a temp directory.", e);
        }
    }

    private static void writeFile(File file, String content) throws IOException {
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    }
}
