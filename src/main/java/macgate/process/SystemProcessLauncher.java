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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.List;

public class SystemProcessLauncher implements ProcessLauncher {
    private static final Logger logger = LogManager.getLogger(SystemProcessLauncher.class);

    @Override
    public ExternalProcess launch(String name, List<String> command, boolean captureOutput, File workingDirectory)
            throws IOException {

        ProcessBuilder builder = new ProcessBuilder(command);

        if (workingDirectory != null) {
            builder.directory(workingDirectory);
        }

        builder.redirectInput(ProcessBuilder.Redirect.PIPE);

        logger.debug("Starting '{}': {}", name, command);
        Process process = builder.start();

        // Nothing is ever written to the programs.
        process.getOutputStream().close();

        return new SupervisedProcess(name, process, captureOutput);
    }
}
