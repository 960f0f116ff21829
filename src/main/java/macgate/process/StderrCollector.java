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
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains a process error stream line by line. Unread standard output is drained the same way.
 * <p/>
 * Every line is logged at debug level with a prefix and kept in a ring buffer so the last lines
 * can be reported if the process fails. Draining must happen on its own thread or the process can
 * block when the pipe fills.
 */
public class StderrCollector implements Runnable {

    private final String prepend;
    private final InputStreamReader reader;
    private final Logger logger;
    private final LineRingBuffer lines;
    private final StringBuilder stringBuilder = new StringBuilder();

    public StderrCollector(String prepend, InputStream stream, Logger logger, LineRingBuffer lines) {
        this.prepend = prepend;
        this.reader = new InputStreamReader(stream, StandardCharsets.UTF_8);
        this.logger = logger;
        this.lines = lines;
    }

    @Override
    public void run() {
        char buffer[] = new char[256];
        int bufferIndex;
        int bytesRead;

        try {
            while (true) {
                bytesRead = reader.read(buffer, 0, buffer.length);

                if (bytesRead == -1) {
                    flushLine();
                    break;
                }

                bufferIndex = 0;
                for (int i = 0; i < bytesRead; i++) {
                    if (buffer[i] == '\n' || buffer[i] == '\r') {
                        if (bufferIndex != i) {
                            stringBuilder.append(buffer, bufferIndex, i - bufferIndex);
                        }
                        bufferIndex = i + 1;
                        flushLine();
                    }
                }
                if (bytesRead - bufferIndex > 0) {
                    stringBuilder.append(buffer, bufferIndex, bytesRead - bufferIndex);
                    // Prevent the buffer from getting enormous.
                    if (stringBuilder.length() > 65536) {
                        flushLine();
                    }
                }
            }
        } catch (IOException e) {
            flushLine();
            logger.debug("{}: collector terminated => {}", prepend, e.getMessage());
        } catch (Exception e) {
            logger.error("{}: collector terminated in an unexpected way => ", prepend, e);
        } finally {
            try {
                reader.close();
            } catch (IOException e) {
                logger.debug("{}: unable to close the stream => {}", prepend, e.getMessage());
            }
        }
    }

    private void flushLine() {
        if (stringBuilder.length() > 0) {
            String line = stringBuilder.toString();
            lines.add(line);
            logger.debug("{}: {}", prepend, line);
            stringBuilder.setLength(0);
        }
    }
}
