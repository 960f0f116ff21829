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
import java.util.List;

public interface ProcessLauncher {

    /**
     * Starts an external program.
     *
     * @param name A short name used in log messages.
     * @param command The program and its arguments.
     * @param captureOutput If <i>false</i>, standard output is discarded.
     * @param workingDirectory The working directory or <i>null</i> to inherit it.
     * @return The started process.
     * @throws IOException If the program could not be started.
     */
    ExternalProcess launch(String name, List<String> command, boolean captureOutput, File workingDirectory)
            throws IOException;
}
