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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

public class Util {
    private static final Logger logger = LogManager.getLogger(Util.class);

    /**
     * Deletes a file or a directory and everything under it.
     *
     * @param file The file or directory to remove.
     * @return <i>true</i> if nothing remains at the path.
     */
    public static boolean deleteRecursively(File file) {
        if (file == null || !file.exists()) {
            return true;
        }

        File children[] = file.listFiles();
        if (children != null) {
            for (File child : children) {
                deleteRecursively(child);
            }
        }

        if (!file.delete() && file.exists()) {
            logger.warn("Unable to delete '{}'.", file);
            return false;
        }

        return true;
    }

    /**
     * Splits a command line on whitespace. Quoting is not supported.
     */
    public static List<String> splitCommand(String command) {
        List<String> returnValue = new ArrayList<>();

        if (command == null) {
            return returnValue;
        }

        for (String part : command.trim().split("\\s+")) {
            if (part.length() > 0) {
                returnValue.add(part);
            }
        }

        return returnValue;
    }
}
