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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;

/**
 * Waits a bounded amount of time for ffmpeg to write a requested file.
 */
public class HlsFileWaiter {
    private static final Logger logger = LogManager.getLogger(HlsFileWaiter.class);

    public static final int TRANSCODE_PLAYLIST_POLLS = 100;
    public static final int PASSTHROUGH_PLAYLIST_POLLS = 10;
    public static final int SEGMENT_POLLS = 30;

    private final HlsStreamManager manager;
    private final long pollIntervalMs;

    public HlsFileWaiter(HlsStreamManager manager) {
        this(manager, 100);
    }

    public HlsFileWaiter(HlsStreamManager manager, long pollIntervalMs) {
        this.manager = manager;
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * Polls for a file of an active stream.
     *
     * @return The file or <i>null</i> if it didn't appear in time.
     * @throws InterruptedException If the thread was interrupted while waiting.
     */
    public File waitForFile(String portalId, String channelId, String filename) throws InterruptedException {
        HlsStream stream = manager.getStream(portalId, channelId);
        int polls = pollsFor(filename, stream != null && stream.isPassthrough());

        for (int i = 0; i < polls; i++) {
            File file = manager.getFile(portalId, channelId, filename);

            if (file != null) {
                if (i > 0) {
                    logger.debug("'{}' was ready after {}ms.", filename, i * pollIntervalMs);
                }
                return file;
            }

            if (i + 1 < polls) {
                Thread.sleep(pollIntervalMs);
            }
        }

        logger.warn("'{}' for {} was not ready after {}ms.", filename,
                HlsStreamManager.streamKey(portalId, channelId), polls * pollIntervalMs);

        return null;
    }

    static int pollsFor(String filename, boolean passthrough) {
        if (filename.endsWith(".m3u8")) {
            return passthrough ? PASSTHROUGH_PLAYLIST_POLLS : TRANSCODE_PLAYLIST_POLLS;
        }

        return SEGMENT_POLLS;
    }

    public static String contentType(String filename) {
        if (filename.endsWith(".m3u8")) {
            return "application/vnd.apple.mpegurl";
        } else if (filename.endsWith(".ts")) {
            return "video/mp2t";
        } else if (filename.endsWith(".m4s") || filename.endsWith(".mp4")) {
            return "video/mp4";
        }

        return "application/octet-stream";
    }
}
