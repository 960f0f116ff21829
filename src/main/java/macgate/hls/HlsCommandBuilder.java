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

import macgate.config.HlsSettings;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class HlsCommandBuilder {

    /**
     * Sources that are already HLS are served as is.
     */
    public static boolean isPassthroughSource(String sourceUrl) {
        String lower = sourceUrl.toLowerCase(Locale.ROOT);
        return lower.contains(".m3u8") || lower.contains("hls") || lower.contains("stitcher");
    }

    /**
     * Builds the ffmpeg command that copies video, re-encodes audio to AAC and writes an HLS
     * playlist with segments into the temp directory.
     */
    public static List<String> build(HlsSettings settings, String sourceUrl, String proxy, File tempDir) {
        boolean fmp4 = settings.isFmp4();
        List<String> command = new ArrayList<>();

        command.add(settings.getFfmpegPath());

        add(command, "-fflags", "+genpts+igndts+nobuffer");
        add(command, "-err_detect", "aggressive");
        add(command, "-flags", "low_delay");
        add(command, "-reconnect", "1");
        add(command, "-reconnect_at_eof", "1");
        add(command, "-reconnect_streamed", "1");
        add(command, "-reconnect_delay_max", "15");

        if (proxy != null) {
            add(command, "-http_proxy", proxy);
        }

        add(command, "-timeout", String.valueOf(settings.getFfmpegTimeout() * 1000000L));
        add(command, "-i", sourceUrl);

        add(command, "-map", "0");
        add(command, "-c:v", "copy");
        command.add("-copyts");
        command.add("-start_at_zero");
        add(command, "-c:a", "aac");
        add(command, "-b:a", "256k");
        add(command, "-af", "aresample=async=1");

        String hlsFlags = "independent_segments+omit_endlist";
        if (!fmp4) {
            add(command, "-mpegts_flags", "pat_pmt_at_frames");
            add(command, "-pcr_period", "20");
            hlsFlags += "+program_date_time";
        }

        add(command, "-f", "hls");
        add(command, "-hls_time", String.valueOf(settings.getSegmentDuration()));
        add(command, "-hls_list_size", String.valueOf(settings.getPlaylistSize()));
        add(command, "-hls_flags", hlsFlags);
        add(command, "-hls_segment_type", fmp4 ? "fmp4" : "mpegts");
        add(command, "-hls_segment_filename",
                new File(tempDir, fmp4 ? "seg_%03d.m4s" : "seg_%03d.ts").getPath());
        add(command, "-start_number", "0");
        add(command, "-flush_packets", "0");

        if (fmp4) {
            add(command, "-hls_fmp4_init_filename", "init.mp4");
        }

        command.add(new File(tempDir, HlsStream.PLAYLIST).getPath());

        return command;
    }

    public static String passthroughMasterPlaylist(String sourceUrl) {
        return "#EXTM3U\n" +
                "#EXT-X-VERSION:7\n" +
                "#EXT-X-STREAM-INF:BANDWIDTH=15000000,CODECS=\"avc1.640028,mp4a.40.2\"\n" +
                sourceUrl + "\n";
    }

    public static String transcodeMasterPlaylist() {
        return "#EXTM3U\n" +
                "#EXT-X-VERSION:3\n" +
                "#EXT-X-STREAM-INF:BANDWIDTH=5000000\n" +
                HlsStream.PLAYLIST + "\n";
    }

    private static void add(List<String> command, String option, String value) {
        command.add(option);
        command.add(value);
    }
}
