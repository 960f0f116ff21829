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

import macgate.util.LineRingBuffer;
import macgate.util.ThreadPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Wraps an operating system process with a stderr drain and idempotent termination.
 */
public class SupervisedProcess implements ExternalProcess {
    private static final Logger logger = LogManager.getLogger(SupervisedProcess.class);

    public static final int STDERR_LINES = 50;

    private final String name;
    private final Process process;
    private final boolean outputCaptured;
    private final LineRingBuffer stderr = new LineRingBuffer(STDERR_LINES);

    public SupervisedProcess(String name, Process process, boolean outputCaptured) {
        this.name = name;
        this.process = process;
        this.outputCaptured = outputCaptured;

        ThreadPool.submit(new StderrCollector(name, process.getErrorStream(), logger, stderr),
                "StderrCollector", name);

        // Output nobody reads still needs to be drained or the process blocks when the pipe fills.
        if (!outputCaptured) {
            ThreadPool.submit(new StderrCollector(name + " std", process.getInputStream(), logger,
                    new LineRingBuffer(STDERR_LINES)), "StdoutCollector", name);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public InputStream getOutput() {
        if (!outputCaptured) {
            return new ByteArrayInputStream(new byte[0]);
        }

        return process.getInputStream();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public Integer getExitCode() {
        if (process.isAlive()) {
            return null;
        }

        return process.exitValue();
    }

    @Override
    public boolean waitFor(long timeoutMs) throws InterruptedException {
        return process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void terminate(long graceMs) {
        if (!process.isAlive()) {
            return;
        }

        logger.debug("Stopping '{}'...", name);
        process.destroy();

        try {
            if (process.waitFor(graceMs, TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        logger.debug("'{}' did not stop within {}ms. Killing it.", name, graceMs);
        kill();
    }

    @Override
    public void kill() {
        if (process.isAlive()) {
            process.destroyForcibly();
        }
    }

    @Override
    public List<String> getStderrTail(int lines) {
        return stderr.tail(lines);
    }
}
