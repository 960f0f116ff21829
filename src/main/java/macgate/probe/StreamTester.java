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

import macgate.process.ExternalProcess;
import macgate.process.ProcessLauncher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a link actually serves media by running ffprobe against it.
 */
public class StreamTester {
    private static final Logger logger = LogManager.getLogger(StreamTester.class);

    private final ProcessLauncher launcher;
    private final String ffprobePath;

    public StreamTester(ProcessLauncher launcher, String ffprobePath) {
        this.launcher = launcher;
        this.ffprobePath = ffprobePath;
    }

    /**
     * Runs ffprobe and waits for it to exit.
     * <p/>
     * ffprobe gets the upstream timeout itself. The wait here is a few seconds longer and ffprobe
     * is killed if it still hasn't exited by then.
     *
     * @param link The link to test.
     * @param proxy The proxy to use or <i>null</i>.
     * @param timeoutSeconds The upstream timeout.
     * @return <i>true</i> if ffprobe exited with 0.
     * @throws InterruptedException If the thread was interrupted while waiting. ffprobe is killed.
     */
    public boolean test(String link, String proxy, int timeoutSeconds) throws InterruptedException {
        List<String> command = new ArrayList<>();
        command.add(ffprobePath);
        command.add("-timeout");
        command.add(String.valueOf(timeoutSeconds * 1000000L));
        if (proxy != null) {
            command.add("-http_proxy");
            command.add(proxy);
        }
        command.add("-i");
        command.add(link);

        ExternalProcess process;
        try {
            process = launcher.launch("ffprobe", command, false, null);
        } catch (IOException e) {
            logger.error("Unable to start ffprobe => {}", e.getMessage());
            return false;
        }

        try {
            if (!process.waitFor(timeoutSeconds * 1000L + 5000)) {
                logger.debug("ffprobe did not finish within {}s for {}.", timeoutSeconds + 5, link);
                return false;
            }

            Integer exitCode = process.getExitCode();
            if (exitCode == null || exitCode != 0) {
                logger.debug("ffprobe exited with {} for {}. {}", exitCode, link, process.getStderrTail(3));
                return false;
            }

            return true;
        } finally {
            process.kill();
        }
    }
}
