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

package macgate.process;

import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.testng.Assert.assertEquals;

public class SupervisedProcessTest {

    /**
     * A finished operating system process with fixed output.
     */
    private static class ExitedProcess extends Process {
        private final ByteArrayInputStream stdout;
        private final ByteArrayInputStream stderr;

        private ExitedProcess(String stdout, String stderr) {
            this.stdout = new ByteArrayInputStream(stdout.getBytes(StandardCharsets.UTF_8));
            this.stderr = new ByteArrayInputStream(stderr.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return stderr;
        }

        @Override
        public int waitFor() {
            return 0;
        }

        @Override
        public int exitValue() {
            return 0;
        }

        @Override
        public void destroy() {
        }
    }

    private static void waitUntilDrained(InputStream stream) throws Exception {
        long deadline = System.currentTimeMillis() + 5000;
        while (stream.available() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assert stream.available() == 0 : "bytes left = " + stream.available();
    }

    @Test(groups = { "process", "supervision" })
    public void uncapturedOutputIsDrained() throws Exception {
        ExitedProcess os = new ExitedProcess("frame=1\nframe=2\n", "Opening stream\n");
        SupervisedProcess process = new SupervisedProcess("hls-p1_100", os, false);

        assert process.getOutput().read() == -1;
        waitUntilDrained(os.getInputStream());
        waitUntilDrained(os.getErrorStream());
    }

    @Test(groups = { "process", "supervision" })
    public void capturedOutputIsLeftForTheReader() throws Exception {
        ExitedProcess os = new ExitedProcess("stream-bytes", "Opening stream\nConnection reset\n");
        SupervisedProcess process = new SupervisedProcess("ffmpeg-p1-100", os, true);

        byte buffer[] = new byte[64];
        int bytesRead = process.getOutput().read(buffer);
        assertEquals(new String(buffer, 0, bytesRead, StandardCharsets.UTF_8), "stream-bytes");

        waitUntilDrained(os.getErrorStream());
        long deadline = System.currentTimeMillis() + 5000;
        while (process.getStderrTail(2).size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(process.getStderrTail(2), Arrays.asList("Opening stream", "Connection reset"));
        assertEquals(process.getExitCode(), Integer.valueOf(0));
    }
}
