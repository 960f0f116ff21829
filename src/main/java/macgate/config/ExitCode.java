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

package macgate.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

public enum ExitCode {
    // All exit messages pass through one place so the returned codes always mean something
    // specific.

    // Failures that can prevent the program from even starting.
    SUCCESS(0, "MacGate is closing without any critical errors."),
    CONFIG_DIRECTORY(2, "MacGate was unable to open or create the configuration directory."),
    CONFIG_ISSUE(3, "MacGate was unable to open or create configuration data."),
    PORTAL_STORE(4, "MacGate was unable to read the portal definitions."),

    // Failures from the delivery side.
    NO_PORTAL_CLIENT(10, "MacGate does not have a usable portal client implementation."),
    WEB_SERVER(11, "MacGate was unable to open the web server listening port.");

    private final Logger logger = LogManager.getLogger(ExitCode.class);
    public final int CODE;
    public final String DESCRIPTION;

    ExitCode(int exitCode, String exitDescription) {
        CODE = exitCode;
        DESCRIPTION = exitDescription;
    }

    @Override
    public String toString() {
        if (this == SUCCESS) {
            return DESCRIPTION;
        }

        return "MacGate experienced a fatal error: " + DESCRIPTION;
    }

    /**
     * Terminates the program providing the selected ExitCode as the reason with a description.
     */
    public void terminateJVM() {
        terminateJVM(null);
    }

    /**
     * Terminates the program providing the selected ExitCode as the reason with a description.
     * <p/>
     * It also prints to the console in case visible logging is turned off.
     *
     * @param help Provide a specific hint as to what could correct the situation.
     */
    public void terminateJVM(String help) {
        Config.setExitCode(CODE);
        logger.fatal(toString());
        System.err.println(toString());

        if (help != null && !help.equals("")) {
            logger.info(help);
            System.err.println(help);
        }

        if (this != SUCCESS) {
            File source = new File(Config.LOG_DIR + Config.DIR_SEPARATOR + "macgate.log");
            File destination = new File(Config.LOG_DIR + Config.DIR_SEPARATOR + "macgate-crash-0.log");

            int increment = 1;
            while (destination.exists() && increment > 0) {
                destination = new File(Config.LOG_DIR + Config.DIR_SEPARATOR + "macgate-crash-" + increment++ + ".log");
            }

            if (source.exists()) {
                try {
                    Files.copy(source.toPath(), destination.toPath());
                } catch (IOException e) {
                    logger.error("Unable to create a copy of the crash log => ", e);
                }
            }
        }

        System.exit(CODE);
    }
}
