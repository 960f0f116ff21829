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
import org.testng.annotations.Test;

import java.io.File;
import java.util.List;

import static org.testng.Assert.assertEquals;

public class HlsCommandBuilderTest {

    @Test(groups = { "hls", "command" })
    public void passthroughSources() {
        assert HlsCommandBuilder.isPassthroughSource("http://host/live/index.M3U8?token=1");
        assert HlsCommandBuilder.isPassthroughSource("http://host/hls/123");
        assert HlsCommandBuilder.isPassthroughSource("http://stitcher.example/abc");
        assert !HlsCommandBuilder.isPassthroughSource("http://host/live/123.ts");
    }

    @Test(groups = { "hls", "command" })
    public void mpegtsSegments() {
        HlsSettings settings = new HlsSettings();
        File tempDir = new File("tmp", "stream");

        List<String> command = HlsCommandBuilder.build(settings, "http://host/live.ts", null, tempDir);

        assertEquals(command.get(command.indexOf("-i") + 1), "http://host/live.ts");
        assertEquals(command.get(command.indexOf("-hls_time") + 1), "4");
        assertEquals(command.get(command.indexOf("-hls_list_size") + 1), "6");
        assertEquals(command.get(command.indexOf("-hls_segment_type") + 1), "mpegts");
        assertEquals(command.get(command.indexOf("-hls_flags") + 1),
                "independent_segments+omit_endlist+program_date_time");
        assertEquals(command.get(command.indexOf("-hls_segment_filename") + 1),
                new File(tempDir, "seg_%03d.ts").getPath());
        assert command.contains("-mpegts_flags");
        assert !command.contains("-http_proxy");
        assertEquals(command.get(command.size() - 1), new File(tempDir, HlsStream.PLAYLIST).getPath());
    }

    @Test(groups = { "hls", "command" })
    public void fmp4Segments() {
        HlsSettings settings = new HlsSettings();
        settings.setSegmentType(HlsSettings.SEGMENT_FMP4);
        settings.setSegmentDuration(2);
        File tempDir = new File("tmp", "stream");

        List<String> command = HlsCommandBuilder.build(settings, "http://host/live.ts", "http://proxy:3128", tempDir);

        assertEquals(command.get(command.indexOf("-http_proxy") + 1), "http://proxy:3128");
        assert command.indexOf("-http_proxy") < command.indexOf("-i");
        assertEquals(command.get(command.indexOf("-hls_time") + 1), "2");
        assertEquals(command.get(command.indexOf("-hls_segment_type") + 1), "fmp4");
        assertEquals(command.get(command.indexOf("-hls_fmp4_init_filename") + 1), "init.mp4");
        assertEquals(command.get(command.indexOf("-hls_segment_filename") + 1),
                new File(tempDir, "seg_%03d.m4s").getPath());
        assert !command.contains("-mpegts_flags");
    }

    @Test(groups = { "hls", "command" })
    public void masterPlaylists() {
        String passthrough = HlsCommandBuilder.passthroughMasterPlaylist("http://host/index.m3u8");
        assert passthrough.startsWith("#EXTM3U\n");
        assert passthrough.trim().endsWith("http://host/index.m3u8");

        String transcode = HlsCommandBuilder.transcodeMasterPlaylist();
        assert transcode.trim().endsWith(HlsStream.PLAYLIST);
    }
}
