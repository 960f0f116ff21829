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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;

import static org.testng.Assert.assertEquals;

public class StderrCollectorTest {

    @Test(groups = { "process", "lineProcessing" })
    public void executeStderrCollector() throws IOException {
        byte bytes[] = "Testing1\nTesting2\rTesting3\r\nTesting4\rTesting5\nTesting6\nTesting7\r\nTesting8\r\nTesting9".getBytes();
        ByteArrayInputStream stream = new ByteArrayInputStream(bytes);
        Logger logger = LogManager.getLogger(StderrCollectorTest.class);
        LineRingBuffer lines = new LineRingBuffer(4);

        StderrCollector collector = new StderrCollector("test", stream, logger, lines);
        collector.run();

        assert stream.available() == 0;
        // Blank lines between \r and \n are not recorded.
        assertEquals(lines.snapshot(), Arrays.asList("Testing6", "Testing7", "Testing8", "Testing9"));
    }

    @Test(groups = { "process", "lineProcessing" })
    public void emptyStreamRecordsNothing() {
        ByteArrayInputStream stream = new ByteArrayInputStream(new byte[0]);
        LineRingBuffer lines = new LineRingBuffer(4);

        new StderrCollector("empty", stream, LogManager.getLogger(StderrCollectorTest.class), lines).run();

        assert lines.size() == 0;
    }
}
