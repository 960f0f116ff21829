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
 * Options used by probing and direct stream delivery.
 * <p/>
 * An instance is a snapshot. Use {@link #fromConfig()} to read the current values from the
 * properties file.
 */
public class StreamingSettings {
    public static final String DEFAULT_FFMPEG_COMMAND =
            "ffmpeg -re -http_proxy <proxy> -timeout <timeout> -i <url> -map 0 -codec copy -f mpegts" +
                    " -flush_packets 0 -fflags +nobuffer -flags low_delay -strict experimental" +
                    " -analyzeduration 0 -probesize 32 -copyts -threads 12 pipe:";

    public static final String METHOD_FFMPEG = "ffmpeg";
    public static final String METHOD_REDIRECT = "redirect";
    public static final String OUTPUT_MPEGTS = "mpegts";
    public static final String OUTPUT_HLS = "hls";

    private boolean tryAllMacs = true;
    private boolean testStreams = true;
    private boolean parallelProbing = false;
    private int parallelWorkers = 3;
    private int ffmpegTimeout = 5;
    private int probeRoundTimeout = -1;
    private String ffmpegCommand = DEFAULT_FFMPEG_COMMAND;
    private String ffmpegPath = "ffmpeg";
    private String ffprobePath = "ffprobe";
    private String method = METHOD_FFMPEG;
    private String outputFormat = OUTPUT_MPEGTS;

    public static StreamingSettings fromConfig() {
        StreamingSettings settings = new StreamingSettings();

        settings.tryAllMacs = Config.getBoolean("streaming.try_all_macs", true);
        settings.testStreams = Config.getBoolean("streaming.test_streams", true);
        settings.parallelProbing = Config.getBoolean("streaming.parallel_probing", false);
        settings.parallelWorkers = Config.getInteger("streaming.parallel_workers", 3);
        settings.ffmpegTimeout = Config.getInteger("streaming.ffmpeg_timeout", 5);
        settings.probeRoundTimeout = Config.getInteger("streaming.probe_round_timeout", -1);
        settings.ffmpegCommand = Config.getString("streaming.ffmpeg_command", DEFAULT_FFMPEG_COMMAND);
        settings.ffmpegPath = Config.getString("streaming.ffmpeg_path", "ffmpeg");
        settings.ffprobePath = Config.getString("streaming.ffprobe_path", "ffprobe");
        settings.method = Config.getString("streaming.method", METHOD_FFMPEG);
        settings.outputFormat = Config.getString("streaming.output_format", OUTPUT_MPEGTS);

        return settings;
    }

    public boolean isTryAllMacs() {
        return tryAllMacs;
    }

    public void setTryAllMacs(boolean tryAllMacs) {
        this.tryAllMacs = tryAllMacs;
    }

    public boolean isTestStreams() {
        return testStreams;
    }

    public void setTestStreams(boolean testStreams) {
        this.testStreams = testStreams;
    }

    public boolean isParallelProbing() {
        return parallelProbing;
    }

    public void setParallelProbing(boolean parallelProbing) {
        this.parallelProbing = parallelProbing;
    }

    public int getParallelWorkers() {
        return Math.max(1, parallelWorkers);
    }

    public void setParallelWorkers(int parallelWorkers) {
        this.parallelWorkers = parallelWorkers;
    }

    /**
     * @return The upstream timeout in seconds.
     */
    public int getFfmpegTimeout() {
        return ffmpegTimeout;
    }

    public void setFfmpegTimeout(int ffmpegTimeout) {
        this.ffmpegTimeout = ffmpegTimeout;
    }

    /**
     * @return The maximum number of seconds a parallel probe round may take. When this isn't set,
     *         it is derived from the upstream timeout.
     */
    public int getProbeRoundTimeout() {
        if (probeRoundTimeout <= 0) {
            return ffmpegTimeout * 3 + 5;
        }

        return probeRoundTimeout;
    }

    public void setProbeRoundTimeout(int probeRoundTimeout) {
        this.probeRoundTimeout = probeRoundTimeout;
    }

    public String getFfmpegCommand() {
        return ffmpegCommand;
    }

    public void setFfmpegCommand(String ffmpegCommand) {
        this.ffmpegCommand = ffmpegCommand;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public String getFfprobePath() {
        return ffprobePath;
    }

    public void setFfprobePath(String ffprobePath) {
        this.ffprobePath = ffprobePath;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public boolean isRedirect() {
        return METHOD_REDIRECT.equalsIgnoreCase(method);
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public boolean isHlsOutput() {
        return OUTPUT_HLS.equalsIgnoreCase(outputFormat);
    }
}
