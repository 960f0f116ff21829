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

package macgate;

import macgate.channel.ChannelCacheRefresher;
import macgate.channel.MemoryChannelCache;
import macgate.config.Config;
import macgate.config.ExitCode;
import macgate.config.HlsSettings;
import macgate.config.StaticConfig;
import macgate.config.StreamingSettings;
import macgate.credential.MacRotator;
import macgate.credential.OccupancyRegistry;
import macgate.hls.HlsFileWaiter;
import macgate.hls.HlsStreamManager;
import macgate.jobs.ChannelMatcher;
import macgate.jobs.EpgRefresher;
import macgate.jobs.JobManager;
import macgate.jobs.LoggingEpgRefresher;
import macgate.jobs.RefreshScheduler;
import macgate.nanohttpd.NanoHTTPDManager;
import macgate.nanohttpd.WebContext;
import macgate.portal.JsonPortalStore;
import macgate.portal.PortalClient;
import macgate.portal.PortalLocks;
import macgate.probe.MacProber;
import macgate.probe.StreamTester;
import macgate.process.ProcessLauncher;
import macgate.process.SystemProcessLauncher;
import macgate.stream.DirectStreamService;
import macgate.util.ThreadPool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Executor;

public class Main {
    private static final Logger logger = LogManager.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        logger.info("Starting MacGate {}...", StaticConfig.VERSION_PROGRAM);

        Runtime.getRuntime().addShutdownHook(new Thread("Shutdown") {
            @Override
            public void run() {
                shutdown();
            }
        });

        if (!Config.loadConfig()) {
            ExitCode.CONFIG_ISSUE.terminateJVM();
            return;
        }

        logger.info("MacGate logging to the directory '{}'.", Config.LOG_DIR);

        final JsonPortalStore portalStore = new JsonPortalStore(new File(Config.getPortalsFilename()));
        try {
            portalStore.load();
        } catch (IOException e) {
            logger.fatal("Unable to load portals from '{}' => ", Config.getPortalsFilename(), e);
            ExitCode.PORTAL_STORE.terminateJVM("Check that '" + Config.getPortalsFilename() +
                    "' contains a JSON array of portals.");
            return;
        }

        PortalClient portalClient = Config.getInstance("portal.client_class", PortalClient.class, null);
        if (portalClient == null) {
            Config.saveConfig();
            ExitCode.NO_PORTAL_CLIENT.terminateJVM("Set 'portal.client_class' in '" +
                    Config.getDefaultConfigFilename() + "' to a PortalClient implementation.");
            return;
        }

        EpgRefresher epgRefresher = Config.getInstance(
                "epg.refresher_class", EpgRefresher.class, new LoggingEpgRefresher());
        ChannelMatcher channelMatcher = Config.getInstance(
                "matching.matcher_class", ChannelMatcher.class, null);

        StreamingSettings streamingSettings = StreamingSettings.fromConfig();
        HlsSettings hlsSettings = HlsSettings.fromConfig();

        ProcessLauncher launcher = new SystemProcessLauncher();
        OccupancyRegistry occupancy = new OccupancyRegistry();
        PortalLocks portalLocks = new PortalLocks();

        MacRotator rotator = new MacRotator(portalStore, portalLocks, new Executor() {
            @Override
            public void execute(Runnable command) {
                ThreadPool.submit(command, "MacRotator", "move");
            }
        });

        MemoryChannelCache channelCache = new MemoryChannelCache();
        StreamTester tester = new StreamTester(launcher, streamingSettings.getFfprobePath());
        MacProber prober = new MacProber(portalClient, occupancy, rotator, tester, streamingSettings);

        DirectStreamService directStreams = new DirectStreamService(
                portalStore, channelCache, prober, launcher, occupancy, rotator, streamingSettings);

        File hlsTempRoot = new File(Config.getString("hls.temp_dir", System.getProperty("java.io.tmpdir")));
        final HlsStreamManager hlsStreams = new HlsStreamManager(
                hlsSettings, launcher, hlsTempRoot, prober, channelCache);
        hlsStreams.startReaper();

        Runtime.getRuntime().addShutdownHook(new Thread("HlsStreamManagerShutdown") {
            @Override
            public void run() {
                logger.info("Stopping all HLS streams...");
                hlsStreams.shutdown();
            }
        });

        final JobManager jobManager = new JobManager(
                portalStore,
                portalLocks,
                new ChannelCacheRefresher(portalStore, portalClient, channelCache),
                epgRefresher,
                channelMatcher,
                Config.getBoolean("matching.enabled", false),
                Config.getInteger("jobs.max_workers", 2),
                Config.getInteger("jobs.max_retries", 2),
                Config.getInteger("jobs.backoff_unit_ms", 1000));

        final RefreshScheduler scheduler = new RefreshScheduler(jobManager);

        Runtime.getRuntime().addShutdownHook(new Thread("JobManagerShutdown") {
            @Override
            public void run() {
                logger.info("Stopping refresh scheduling...");
                scheduler.stop();
                jobManager.shutdown();
            }
        });

        if (Config.getBoolean("refresh.on_startup", true)) {
            jobManager.enqueueRefreshAll("startup");
        }
        scheduler.start();

        WebContext context = new WebContext(portalStore, directStreams, hlsStreams,
                new HlsFileWaiter(hlsStreams), jobManager, occupancy);

        if (NanoHTTPDManager.startWebServer(context)) {
            Runtime.getRuntime().addShutdownHook(new Thread("NanoHTTPDShutdown") {
                @Override
                public void run() {
                    logger.info("Stopping web server...");
                    try {
                        NanoHTTPDManager.stopWebServer();
                    } catch (Exception e) {
                        logger.debug("Stopping web server created an exception => ", e);
                    }
                }
            });
        } else if (Config.getBoolean("web.enabled", true)) {
            Config.saveConfig();
            ExitCode.WEB_SERVER.terminateJVM("Set 'web.port' in '" +
                    Config.getDefaultConfigFilename() + "' to a free port.");
            return;
        }

        Config.saveConfig();

        if (Config.IS_DAEMON) {
            logger.info("Running in daemon mode...");

            while (!Config.isShutdown()) {
                Thread.sleep(60000);
            }
        } else {
            logger.info("Press ENTER at any time to exit...");
            System.in.read();
        }

        System.exit(0);
    }

    public static void shutdown() {
        logger.info("MacGate has received a signal to stop.");

        logger.info("Saving current configuration...");

        Config.saveConfig();

        // This will allow the main thread to stop.
        Config.setShutdown();
    }
}
