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

package macgate.util;

import java.util.ArrayList;
import java.util.List;

/**
 * A fixed capacity buffer of text lines that keeps only the most recent entries.
 * <p/>
 * All methods are synchronized so one thread can write while another takes a snapshot.
 */
public class LineRingBuffer {
    private final String lines[];
    private int start;
    private int size;

    public LineRingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }

        lines = new String[capacity];
    }

    public synchronized void add(String line) {
        int index = (start + size) % lines.length;
        lines[index] = line;

        if (size < lines.length) {
            size++;
        } else {
            start = (start + 1) % lines.length;
        }
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return lines.length;
    }

    /**
     * Returns up to the last <i>count</i> lines in the order they were added.
     */
    public synchronized List<String> tail(int count) {
        int returnSize = Math.min(Math.max(count, 0), size);
        List<String> returnValue = new ArrayList<>(returnSize);

        for (int i = size - returnSize; i < size; i++) {
            returnValue.add(lines[(start + i) % lines.length]);
        }

        return returnValue;
    }

    public synchronized List<String> snapshot() {
        return tail(size);
    }
}
