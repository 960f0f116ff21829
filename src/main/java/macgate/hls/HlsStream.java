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

import macgate.process.ExternalProcess;

import java.io.File;

/**
 * One shared HLS output. Every viewer of the same channel reads the same files.
 */
public class HlsStream {
    public static final String PLAYLIST = "stream.m3u8";
    public static final String MASTER_PLAYLIST = "master.m3u8";

    private final String key;
    private final String portalId;
    private final String channelId;
    private final ExternalProcess process;
    private final boolean passthrough;
    private final File tempDir;
    private final String sourceUrl;
    private final long createdAt;
    private volatile long lastAccessed;

    HlsStream(String portalId, String channelId, ExternalProcess process, boolean passthrough,
              File tempDir, String sourceUrl) {

        this.key = HlsStreamManager.streamKey(portalId, channelId);
        this.portalId = portalId;
        this.channelId = channelId;
        this.process = process;
        this.passthrough = passthrough;
        this.tempDir = tempDir;
        this.sourceUrl = sourceUrl;
        this.createdAt = System.currentTimeMillis();
        this.lastAccessed = createdAt;
    }

    public String getKey() {
        return key;
    }

    public String getPortalId() {
        return portalId;
    }

    public String getChannelId() {
        return channelId;
    }

    /**
     * @return The transcoding process or <i>null</i> for a passthrough stream.
     */
    public ExternalProcess getProcess() {
        return process;
    }

    public boolean isPassthrough() {
        return passthrough;
    }

    public File getTempDir() {
        return tempDir;
    }

    public File getPlaylistFile() {
        return new File(tempDir, PLAYLIST);
    }

    public File getMasterPlaylistFile() {
        return new File(tempDir, MASTER_PLAYLIST);
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastAccessed() {
        return lastAccessed;
    }

    void touch() {
        lastAccessed = System.currentTimeMillis();
    }

    /**
     * @return <i>true</i> if this stream has a process and it is no longer running.
     */
    public boolean isCrashed() {
        return process != null && !process.isAlive();
    }
}
