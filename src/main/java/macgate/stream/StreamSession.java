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

import macgate.credential.MacRotator;
import macgate.credential.OccupancyRegistry;
import macgate.portal.Portal;
import macgate.probe.MacProber;
import macgate.probe.ProbeOutcome;
import macgate.probe.ProbeRequest;
import macgate.probe.ProbeResult;
import macgate.process.ExternalProcess;
import macgate.process.ProcessLauncher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Collections;
import java.util.List;

/**
 * One client's direct stream from request to cleanup.
 * <p/>
 * The session owns the playback slot taken during probing and the external process that produces
 * the stream. {@link #close()} releases both and is safe to call from any thread any number of
 * times.
 */
public class StreamSession implements Closeable {
    private static final Logger logger = LogManager.getLogger(StreamSession.class);

    public static final int CHUNK_SIZE = 65536;
    public static final int CRASH_LOG_LINES = 8;

    public enum State {
        REQUESTED,
        CREDENTIALS_SCORED,
        PROBING,
        FOUND,
        OCCUPIED,
        STREAMING,
        UNOCCUPIED,
        EXHAUSTED,
        CLOSED
    }

    /**
     * Creates the command that will produce the stream once a link is known.
     */
    public interface CommandFactory {
        List<String> create(String link, String proxy);
    }

    private final ProbeRequest request;
    private final MacProber prober;
    private final ProcessLauncher launcher;
    private final OccupancyRegistry occupancy;
    private final MacRotator rotator;

    private volatile State state = State.REQUESTED;
    private volatile ProbeResult result;
    private volatile ExternalProcess process;
    private boolean closed;
    private boolean endHandled;

    public StreamSession(ProbeRequest request, MacProber prober, ProcessLauncher launcher,
                         OccupancyRegistry occupancy, MacRotator rotator) {

        this.request = request;
        this.prober = prober;
        this.launcher = launcher;
        this.occupancy = occupancy;
        this.rotator = rotator;
    }

    /**
     * Finds a MAC and, when a command factory is provided, starts the process.
     *
     * @param commandFactory Creates the command or <i>null</i> to only resolve the link. Without a
     *                       process the playback slot is released before this returns.
     * @throws StreamException If no MAC could deliver the channel or the process couldn't start.
     *                         The session is closed.
     */
    public void start(CommandFactory commandFactory) throws StreamException {
        Portal portal = request.getPortal();

        setState(State.CREDENTIALS_SCORED);
        setState(State.PROBING);

        ProbeOutcome outcome;
        try {
            outcome = prober.probe(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new StreamException(FailureReason.NO_WORKING_STREAM, "Probing was interrupted.", e);
        }

        if (!outcome.isFound()) {
            setState(State.EXHAUSTED);
            close();

            FailureReason reason = outcome.getExhaustionReason();
            if (reason == FailureReason.CREDENTIAL_UNAVAILABLE) {
                logger.warn("No free MAC for channel {} on portal '{}'.", request.getChannelId(), portal.getName());
            } else {
                logger.warn("No working streams for channel {} on portal '{}'.", request.getChannelId(), portal.getName());
            }

            throw new StreamException(reason, "No streams available");
        }

        result = outcome.getResult();
        setState(State.FOUND);

        if (result.getReservation() != null) {
            setState(State.OCCUPIED);
        }

        if (commandFactory == null) {
            close();
            return;
        }

        String name = "ffmpeg-" + portal.getId() + "-" + request.getChannelId();
        try {
            process = launcher.launch(name, commandFactory.create(result.getLink(), portal.getProxy()), true, null);
        } catch (IOException e) {
            logger.error("Unable to start the stream process for channel {} => ", request.getChannelId(), e);
            close();
            throw new StreamException(FailureReason.PROCESS_CRASH, "Unable to start the stream process.", e);
        }

        synchronized (this) {
            if (closed) {
                // Closed by another thread while the process was starting.
                process.kill();
                throw new StreamException(FailureReason.PROCESS_CRASH, "The session was closed.");
            }
        }

        setState(State.STREAMING);
        logger.info("Streaming channel {} from portal '{}' using MAC {} to {}.",
                request.getChannelId(), portal.getName(), result.getMac(), request.getClientAddr());
    }

    /**
     * The process output. Reading to the end checks how the process exited and closing the
     * stream closes the session.
     */
    public InputStream getInputStream() {
        if (process == null) {
            throw new IllegalStateException("The session is not streaming.");
        }

        return new SessionInputStream(process.getOutput());
    }

    /**
     * Copies the process output to a client until the output ends or the client goes away. The
     * session is always closed when this returns.
     *
     * @throws IOException If the client could not be written to.
     */
    public void relay(OutputStream out) throws IOException {
        InputStream in = getInputStream();
        byte buffer[] = new byte[CHUNK_SIZE];

        try {
            int bytesRead;
            while ((bytesRead = in.read(buffer)) != -1) {
                out.write(buffer, 0, bytesRead);
                out.flush();
            }
        } finally {
            in.close();
        }
    }

    private void onEndOfOutput() {
        synchronized (this) {
            if (endHandled || closed) {
                return;
            }
            endHandled = true;
        }

        Integer exitCode = null;
        try {
            if (process.waitFor(5000)) {
                exitCode = process.getExitCode();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (exitCode != null && exitCode == 0) {
            logger.info("Stream for channel {} ended normally.", request.getChannelId());
            return;
        }

        logger.error("Stream process for channel {} on MAC {} exited with {}. Last output:{}{}",
                request.getChannelId(), result.getMac(), exitCode, System.lineSeparator(),
                joinLines(process.getStderrTail(CRASH_LOG_LINES)));

        rotator.rotate(request.getPortal().getId(), Collections.singletonList(result.getMac()));
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }

        ExternalProcess currentProcess = process;
        if (currentProcess != null) {
            currentProcess.kill();
        }

        ProbeResult currentResult = result;
        if (currentResult != null && currentResult.getReservation() != null) {
            occupancy.release(currentResult.getReservation());
            setState(State.UNOCCUPIED);
        }

        setState(State.CLOSED);
    }

    public State getState() {
        return state;
    }

    /**
     * @return The winning MAC and link or <i>null</i> if none was found.
     */
    public ProbeResult getResult() {
        return result;
    }

    public ProbeRequest getRequest() {
        return request;
    }

    private void setState(State newState) {
        logger.trace("Session for channel {} changed from {} to {}.", request.getChannelId(), state, newState);
        state = newState;
    }

    private static String joinLines(List<String> lines) {
        StringBuilder builder = new StringBuilder();

        for (String line : lines) {
            builder.append("    ").append(line).append(System.lineSeparator());
        }

        return builder.toString();
    }

    private class SessionInputStream extends InputStream {
        private final InputStream in;

        private SessionInputStream(InputStream in) {
            this.in = in;
        }

        @Override
        public int read() throws IOException {
            int value = in.read();
            if (value == -1) {
                onEndOfOutput();
            }
            return value;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int bytesRead = in.read(b, off, len);
            if (bytesRead == -1) {
                onEndOfOutput();
            }
            return bytesRead;
        }

        @Override
        public int available() throws IOException {
            return in.available();
        }

        @Override
        public void close() throws IOException {
            try {
                in.close();
            } finally {
                StreamSession.this.close();
            }
        }
    }
}
