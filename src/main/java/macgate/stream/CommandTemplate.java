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

import macgate.util.Util;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a configured command line into program arguments.
 * <p/>
 * Supported placeholders are <i>&lt;url&gt;</i>, <i>&lt;timeout&gt;</i> in microseconds and
 * <i>&lt;proxy&gt;</i>. When there is no proxy, the <i>-http_proxy &lt;proxy&gt;</i> pair is
 * removed.
 */
public class CommandTemplate {
    public static final String URL = "<url>";
    public static final String TIMEOUT = "<timeout>";
    public static final String PROXY = "<proxy>";

    public static List<String> build(String template, String url, int timeoutSeconds, String proxy) {
        List<String> tokens = Util.splitCommand(template);
        List<String> returnValue = new ArrayList<>(tokens.size());
        String timeout = String.valueOf(timeoutSeconds * 1000000L);

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);

            if (proxy == null) {
                if (token.equals("-http_proxy") && i + 1 < tokens.size() && tokens.get(i + 1).contains(PROXY)) {
                    i++;
                    continue;
                }
                if (token.contains(PROXY)) {
                    continue;
                }
            }

            token = token.replace(URL, url).replace(TIMEOUT, timeout);
            if (proxy != null) {
                token = token.replace(PROXY, proxy);
            }

            returnValue.add(token);
        }

        return returnValue;
    }

    /**
     * The command used for browser playback. The stream is copied into fragmented MP4.
     *
     * @param proxy The proxy or <i>null</i>.
     */
    public static List<String> webCommand(String ffmpegPath, String url, String proxy) {
        List<String> returnValue = new ArrayList<>();

        returnValue.add(ffmpegPath);
        if (proxy != null) {
            returnValue.add("-http_proxy");
            returnValue.add(proxy);
        }
        returnValue.add("-loglevel");
        returnValue.add("panic");
        returnValue.add("-hide_banner");
        returnValue.add("-i");
        returnValue.add(url);
        returnValue.add("-vcodec");
        returnValue.add("copy");
        returnValue.add("-f");
        returnValue.add("mp4");
        returnValue.add("-movflags");
        returnValue.add("frag_keyframe+empty_moov");
        returnValue.add("pipe:");

        return returnValue;
    }
}
