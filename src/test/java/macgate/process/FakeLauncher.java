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

import java.io.File;
import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Launches {@link FakeProcess} instances.
 * <p/>
 * ffprobe exits with 0 unless the link was marked dead. Every other program writes the configured
 * output and exits with the configured code.
 */
public class FakeLauncher implements ProcessLauncher {
    private final Set<String> deadLinks = Collections.newSetFromMap(new ConcurrentHashMap<String, Boolean>());
    private final Map<String, Long> probeDelays = new ConcurrentHashMap<>();
    private final List<FakeProcess> launched = new CopyOnWriteArrayList<>();
    private final List<File> workingDirectories = new CopyOnWriteArrayList<>();
    private final Map<String, CountDownLatch> launchGates = new ConcurrentHashMap<>();
    private final List<String> launchAttempts = new CopyOnWriteArrayList<>();

    private volatile boolean failLaunch;
    private volatile byte output[] = new byte[0];
    private volatile Integer exitCode = 0;
    private volatile List<String> stderr = new ArrayList<>();

    public void markDead(String link) {
        deadLinks.add(link);
    }

    public void setProbeDelay(String link, long delayMs) {
        probeDelays.put(link, delayMs);
    }

    /**
     * Launches of processes with this name wait until the gate opens.
     */
    public void blockLaunch(String name, CountDownLatch gate) {
        launchGates.put(name, gate);
    }

    /**
     * @return The names of every launch that was started, including ones still waiting on a gate.
     */
    public List<String> getLaunchAttempts() {
        return new ArrayList<>(launchAttempts);
    }

    public void setFailLaunch(boolean failLaunch) {
        this.failLaunch = failLaunch;
    }

    public void setOutput(byte output[]) {
        this.output = output;
    }

    /**
     * @param exitCode The exit code of programs other than ffprobe or <i>null</i> to keep them
     *                 running until killed.
     */
    public void setExitCode(Integer exitCode) {
        this.exitCode = exitCode;
    }

    public void setStderr(String... lines) {
        this.stderr = Arrays.asList(lines);
    }

    public List<FakeProcess> getLaunched() {
        return new ArrayList<>(launched);
    }

    public List<FakeProcess> getLaunched(String namePrefix) {
        List<FakeProcess> returnValue = new ArrayList<>();
        for (FakeProcess process : launched) {
            if (process.getName().startsWith(namePrefix)) {
                returnValue.add(process);
            }
        }
        return returnValue;
    }

    public List<File> getWorkingDirectories() {
        return new ArrayList<>(workingDirectories);
    }

    @Override
    public ExternalProcess launch(String name, List<String> command, boolean captureOutput, File workingDirectory)
            throws IOException {

        launchAttempts.add(name);

        CountDownLatch gate = launchGates.get(name);
        if (gate != null) {
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    throw new IOException("Launch of " + name + " was never released.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Launch of " + name + " was interrupted.");
            }
        }

        if (failLaunch) {
            throw new IOException("Cannot run program \"" + command.get(0) + "\"");
        }

        FakeProcess process;

        if (name.equals("ffprobe")) {
            String link = command.get(command.size() - 1);
            Long delay = probeDelays.get(link);
            process = new FakeProcess(name, command, new byte[0], deadLinks.contains(link) ? 1 : 0,
                    delay == null ? 0 : delay);
        } else {
            process = new FakeProcess(name, command, captureOutput ? output : new byte[0], exitCode, 0);
            for (String line : stderr) {
                process.addStderr(line);
            }
        }

        if (workingDirectory != null) {
            workingDirectories.add(workingDirectory);
        }
        launched.add(process);
        return process;
    }
}
