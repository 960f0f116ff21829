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

package macgate.config;

/**
 * Options used by the shared HLS stream registry.
 */
public class HlsSettings {
    public static final String SEGMENT_MPEGTS = "mpegts";
    public static final String SEGMENT_FMP4 = "fmp4";

    private String segmentType = SEGMENT_MPEGTS;
    private int segmentDuration = 4;
    private int playlistSize = 6;
    private int maxStreams = 10;
    private long inactiveTimeoutMs = 30000;
    private long reapIntervalMs = 10000;
    private int ffmpegTimeout = 5;
    private String ffmpegPath = "ffmpeg";

    public static HlsSettings fromConfig() {
        HlsSettings settings = new HlsSettings();

        settings.segmentType = Config.getString("hls.segment_type", SEGMENT_MPEGTS);
        settings.segmentDuration = Config.getInteger("hls.segment_duration", 4);
        settings.playlistSize = Config.getInteger("hls.playlist_size", 6);
        settings.maxStreams = Config.getInteger("hls.max_streams", 10);
        settings.inactiveTimeoutMs = Config.getInteger("hls.inactive_timeout", 30) * 1000L;
        settings.reapIntervalMs = Config.getInteger("hls.reap_interval", 10) * 1000L;
        settings.ffmpegTimeout = Config.getInteger("streaming.ffmpeg_timeout", 5);
        settings.ffmpegPath = Config.getString("streaming.ffmpeg_path", "ffmpeg");

        return settings;
    }

    public String getSegmentType() {
        return segmentType;
    }

    public void setSegmentType(String segmentType) {
        this.segmentType = segmentType;
    }

    public boolean isFmp4() {
        return SEGMENT_FMP4.equalsIgnoreCase(segmentType);
    }

    public int getSegmentDuration() {
        return segmentDuration;
    }

    public void setSegmentDuration(int segmentDuration) {
        this.segmentDuration = segmentDuration;
    }

    public int getPlaylistSize() {
        return playlistSize;
    }

    public void setPlaylistSize(int playlistSize) {
        this.playlistSize = playlistSize;
    }

    public int getMaxStreams() {
        return maxStreams;
    }

    public void setMaxStreams(int maxStreams) {
        this.maxStreams = maxStreams;
    }

    public long getInactiveTimeoutMs() {
        return inactiveTimeoutMs;
    }

    public void setInactiveTimeoutMs(long inactiveTimeoutMs) {
        this.inactiveTimeoutMs = inactiveTimeoutMs;
    }

    public long getReapIntervalMs() {
        return reapIntervalMs;
    }

    public void setReapIntervalMs(long reapIntervalMs) {
        this.reapIntervalMs = reapIntervalMs;
    }

    public int getFfmpegTimeout() {
        return ffmpegTimeout;
    }

    public void setFfmpegTimeout(int ffmpegTimeout) {
        this.ffmpegTimeout = ffmpegTimeout;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }
}
