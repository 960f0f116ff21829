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
import org.apache.logging.log4j.core.LoggerContext;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Properties;
import java.util.TreeSet;

import static macgate.config.StaticConfig.VERSION_CONFIG;
import static macgate.config.StaticConfig.VERSION_PROGRAM;

public class Config {
    private static final Logger logger = LogManager.getLogger(Config.class);

    private static Properties properties = new Properties();
    private static volatile boolean isShutdown = false;

    public static final String DIR_SEPARATOR = File.separator;

    /**
     * This is the working directory of the running program.
     */
    public static final String PROJECT_DIR;
    // All configuration must go in this directory. portals.json also lives here.
    public static final String CONFIG_DIR;
    // All logging must go in this directory.
    public static final String LOG_DIR;
    // Are we running as a service/daemon?
    public static final boolean IS_DAEMON;

    private static int exitCode = 0;

    private static final String configFileName = "macgate.properties";

    static {
        PROJECT_DIR = System.getProperty("user.dir");
        LOG_DIR = System.getProperty("macgate_log_root", PROJECT_DIR);

        if (System.getProperty("macgate_log_root") == null) {
            System.setProperty("macgate_log_root", LOG_DIR);

            LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
            ctx.reconfigure();

            logger.info("To avoid log4j2 warnings when MacGate starts, set the Java" +
                    " property 'macgate_log_root' to the desired logging path.");
        }

        // If this path doesn't exist and can't be created, the program will exit.
        CONFIG_DIR = System.getProperty("config_dir", PROJECT_DIR);
        createConfigDirectory();

        IS_DAEMON = System.getProperty("daemon_mode", "false").equalsIgnoreCase("true");
    }

    public static String getDefaultConfigFilename() {
        return Config.CONFIG_DIR + File.separator + configFileName;
    }

    public static String getPortalsFilename() {
        return Config.CONFIG_DIR + File.separator + getString("portals.file", "portals.json");
    }

    private static void createConfigDirectory() {
        File file = new File(CONFIG_DIR);

        boolean returnValue = file.exists();

        if (!returnValue) {
            try {
                logger.info("The directory '{}' does not exist. Attempting to create it...", CONFIG_DIR);
                returnValue = file.mkdirs();
            } catch (Exception e) {
                logger.fatal("An exception was created while attempting to create the configuration directory => ", e);
            }

            if (!returnValue) {
                ExitCode.CONFIG_DIRECTORY.terminateJVM("Ensure the path " + CONFIG_DIR + " is accessible.");
            }
        }
    }

    public static synchronized boolean loadConfig() {
        logger.entry();

        String filename = getDefaultConfigFilename();

        if (new File(filename).exists()) {
            try (FileInputStream fileInputStream = new FileInputStream(filename)) {
                Config.properties = new Properties();
                Config.properties.load(fileInputStream);
            } catch (IOException e) {
                logger.fatal("Unable to read the configuration file '{}' => ", filename, e);
                return logger.exit(false);
            }
        } else {
            logger.info("'{}' was not found. A new configuration file will be created with that name on the next save.", filename);
        }

        if (properties.getProperty("version.config", "").equals("")) {
            properties.setProperty("version.config", String.valueOf(VERSION_CONFIG));
        }

        properties.setProperty("version.program", VERSION_PROGRAM);

        return logger.exit(true);
    }

    public static synchronized boolean saveConfig() {
        logger.entry();

        String filename = getDefaultConfigFilename();

        File file = new File(filename);
        File fileBackup = new File(filename + ".backup");

        if (file.exists()) {
            try {
                Files.copy(file.toPath(), fileBackup.toPath(), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                logger.warn("Unable to create the backup '{}' => {}", fileBackup, e.getMessage());
            }
        }

        try (FileOutputStream fileOutputStream = new FileOutputStream(filename)) {
            Properties sortedProperties = new Properties() {
                @Override
                public synchronized Enumeration<Object> keys() {
                    return Collections.enumeration(new TreeSet<>(super.keySet()));
                }
            };
            sortedProperties.putAll(properties);

            sortedProperties.store(fileOutputStream, "MacGate Configuration File");
        } catch (IOException e) {
            logger.error("Unable to write the configuration file '{}' => {}", filename, e);
            return logger.exit(false);
        }

        return logger.exit(true);
    }

    public static void setExitCode(int exitCode) {
        Config.exitCode = exitCode;
    }

    public static int getExitCode() {
        return exitCode;
    }

    public static void setShutdown() {
        isShutdown = true;
    }

    public static boolean isShutdown() {
        return isShutdown;
    }

    // This will be used to set all string properties so we can do trace logging if there is any
    // configuration related weirdness.
    public static void setString(String key, String value) {
        logger.entry(key, value);

        Config.properties.setProperty(key, value);

        logger.exit();
    }

    public static String getString(String key, String defaultValue) {
        logger.entry(key, defaultValue);

        String returnValue = Config.properties.getProperty(key, defaultValue);

        if (returnValue != null) {
            setString(key, returnValue);
        }

        return logger.exit(returnValue);
    }

    public static String getString(String key) {
        logger.entry(key);
        return logger.exit(properties.getProperty(key));
    }

    public static void setBoolean(String key, boolean value) {
        Config.properties.setProperty(key, Boolean.toString(value));
    }

    public static void setInteger(String key, int value) {
        Config.properties.setProperty(key, Integer.toString(value));
    }

    public static void setDouble(String key, double value) {
        Config.properties.setProperty(key, Double.toString(value));
    }

    public static boolean getBoolean(String key, boolean defaultValue) {
        logger.entry(key, defaultValue);

        String stringValue = properties.getProperty(key, String.valueOf(defaultValue)).trim();
        boolean returnValue;

        if (stringValue.equalsIgnoreCase("true") || stringValue.equals("1")) {
            returnValue = true;
        } else if (stringValue.equalsIgnoreCase("false") || stringValue.equals("0")) {
            returnValue = false;
        } else {
            logger.error("The property '{}' should be boolean, but '{}' was returned. Using the default value of '{}'", key, stringValue, defaultValue);
            returnValue = defaultValue;
        }

        setBoolean(key, returnValue);

        return logger.exit(returnValue);
    }

    public static int getInteger(String key, int defaultValue) {
        logger.entry(key, defaultValue);

        int returnValue;
        String stringValue = properties.getProperty(key, String.valueOf(defaultValue));

        try {
            returnValue = Integer.parseInt(stringValue.trim());
        } catch (NumberFormatException e) {
            logger.error("The property '{}' should be an integer, but '{}' was returned. Using the default value of '{}'", key, stringValue, defaultValue);
            returnValue = defaultValue;
        }

        setInteger(key, returnValue);

        return logger.exit(returnValue);
    }

    public static double getDouble(String key, double defaultValue) {
        logger.entry(key, defaultValue);

        double returnValue;
        String stringValue = properties.getProperty(key, String.valueOf(defaultValue));

        try {
            returnValue = Double.parseDouble(stringValue.trim());
        } catch (NumberFormatException e) {
            logger.error("The property '{}' should be a number, but '{}' was returned. Using the default value of '{}'", key, stringValue, defaultValue);
            returnValue = defaultValue;
        }

        setDouble(key, returnValue);

        return logger.exit(returnValue);
    }

    /**
     * Creates a new instance of a configurable collaborator.
     * <p/>
     * The class named by the property must have a public no argument constructor and implement the
     * requested interface. If the property is not set or the class can't be created, the provided
     * default is returned.
     *
     * @param key The property holding the fully qualified class name.
     * @param type The interface the class must implement.
     * @param defaultValue The instance to use if the property is not usable. Can be <i>null</i>.
     * @return A new instance or the default.
     */
    public static <T> T getInstance(String key, Class<T> type, T defaultValue) {
        logger.entry(key, type);

        String className = properties.getProperty(key, "").trim();

        if (className.length() == 0) {
            if (defaultValue != null) {
                properties.setProperty(key, defaultValue.getClass().getName());
            }
            return logger.exit(defaultValue);
        }

        if (defaultValue != null && className.equals(defaultValue.getClass().getName())) {
            return logger.exit(defaultValue);
        }

        try {
            Object instance = Class.forName(className).getDeclaredConstructor().newInstance();
            return logger.exit(type.cast(instance));
        } catch (Exception e) {
            logger.error("The property '{}' with the value '{}' does not refer to a valid {} implementation => ",
                    key, className, type.getSimpleName(), e);
        }

        return logger.exit(defaultValue);
    }
}
