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

import java.io.InputStream;
import java.util.List;

/**
 * A running external program such as ffmpeg or ffprobe.
 * <p/>
 * Implementations must drain the error stream on their own so the program never blocks on it.
 */
public interface ExternalProcess {

    /**
     * @return A short name used in log messages.
     */
    String getName();

    /**
     * The standard output of the program. Returns an empty stream if the output was not captured.
     */
    InputStream getOutput();

    boolean isAlive();

    /**
     * @return The exit code or <i>null</i> if the program has not exited yet.
     */
    Integer getExitCode();

    /**
     * Waits for the program to exit.
     *
     * @param timeoutMs The maximum time to wait in milliseconds.
     * @return <i>true</i> if the program exited within the time.
     * @throws InterruptedException If the calling thread was interrupted.
     */
    boolean waitFor(long timeoutMs) throws InterruptedException;

    /**
     * Requests the program to stop, then forcefully kills it if it is still running after the
     * grace period. Safe to call more than once.
     *
     * @param graceMs Time in milliseconds to wait before killing the program.
     */
    void terminate(long graceMs);

    /**
     * Forcefully kills the program if it is still running. Safe to call more than once.
     */
    void kill();

    /**
     * @param lines The maximum number of lines to return.
     * @return The most recent lines written to the error stream, oldest first.
     */
    List<String> getStderrTail(int lines);
}
