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

package macgate.nanohttpd;

import macgate.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class NanoHTTPDManager {
    private static final Logger logger = LogManager.getLogger(NanoHTTPDManager.class);

    private static int port = Config.getInteger("web.port", 8001);
    private static NanoServlet currentServer = null;
    private static WebContext context = null;

    /**
     * Start the webserver on the configured port.
     *
     * @param context The services shared by all request handlers.
     * @return <i>true</i> if successful.
     */
    public synchronized static boolean startWebServer(WebContext context) {
        NanoHTTPDManager.context = context;
        return startWebServer(NanoHTTPDManager.port);
    }

    /**
     * Start the webserver on a specific port.
     * <p/>
     * If a webserver is already running, it will not be stopped until the new one successfully
     * starts.
     *
     * @param port The port number.
     * @return <i>true</i> if the server was able to start.
     */
    public synchronized static boolean startWebServer(int port) {
        if (!Config.getBoolean("web.enabled", true)) {
            logger.info("Webserver is disabled.");
            return false;
        }

        if (context == null) {
            logger.error("Webserver cannot start without services.");
            return false;
        }

        if (currentServer != null && port == NanoHTTPDManager.port) {
            logger.warn("Webserver is already running on port {}...", port);
            return true;
        }

        logger.info("Starting webserver on port {}...", port);

        try {
            NanoServlet nanoServlet = new NanoServlet(port, context);
            // Streams can be idle for a long time between chunks.
            nanoServlet.start(0, true);
            NanoHTTPDManager.port = port;

            stopWebServer();

            currentServer = nanoServlet;

            return true;
        } catch (Exception e) {
            logger.error("Unable to open webserver on port {} => ", port, e);
        }

        return false;
    }

    public synchronized static void stopWebServer() {
        if (currentServer != null) {
            logger.info("Stopping webserver on port {}...", port);

            currentServer.stop();
            currentServer = null;
        }
    }
}
