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

package macgate.stream;

import macgate.config.StreamingSettings;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

import static org.testng.Assert.assertEquals;

public class CommandTemplateTest {

    @Test(groups = { "stream", "command" })
    public void placeholdersAreReplaced() {
        List<String> command = CommandTemplate.build(
                "ffmpeg -http_proxy <proxy> -timeout <timeout> -i <url> -f mpegts pipe:",
                "http://host/live.ts", 5, "http://proxy:8080");

        assertEquals(command, Arrays.asList("ffmpeg", "-http_proxy", "http://proxy:8080",
                "-timeout", "5000000", "-i", "http://host/live.ts", "-f", "mpegts", "pipe:"));
    }

    @Test(groups = { "stream", "command" })
    public void proxyPairIsRemovedWithoutProxy() {
        List<String> command = CommandTemplate.build(StreamingSettings.DEFAULT_FFMPEG_COMMAND,
                "http://host/live.ts", 10, null);

        assert !command.contains("-http_proxy");
        for (String token : command) {
            assert !token.contains("<") : token;
        }
        assertEquals(command.get(0), "ffmpeg");
        assertEquals(command.get(command.indexOf("-timeout") + 1), "10000000");
        assertEquals(command.get(command.indexOf("-i") + 1), "http://host/live.ts");
        assertEquals(command.get(command.size() - 1), "pipe:");
    }

    @Test(groups = { "stream", "command" })
    public void webCommandRemuxesToFragmentedMp4() {
        List<String> command = CommandTemplate.webCommand("/usr/bin/ffmpeg", "http://host/live.ts", null);

        assertEquals(command.get(0), "/usr/bin/ffmpeg");
        assertEquals(command.get(command.indexOf("-i") + 1), "http://host/live.ts");
        assertEquals(command.get(command.indexOf("-f") + 1), "mp4");
        assertEquals(command.get(command.indexOf("-movflags") + 1), "frag_keyframe+empty_moov");
    }

    @Test(groups = { "stream", "command" })
    public void webCommandUsesPortalProxy() {
        List<String> command = CommandTemplate.webCommand("ffmpeg", "http://host/live.ts", "http://proxy:3128");

        assertEquals(command.subList(0, 3), Arrays.asList("ffmpeg", "-http_proxy", "http://proxy:3128"));
        assertEquals(command.get(command.indexOf("-i") + 1), "http://host/live.ts");
        assertEquals(command.get(command.size() - 1), "pipe:");
    }
}
