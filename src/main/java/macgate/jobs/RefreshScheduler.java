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

package macgate.jobs;

import macgate.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Queues periodic channel and EPG refreshes.
 * <p/>
 * The intervals are read from the configuration before every wait so changes apply without a
 * restart. An interval of 0 disables the refresh and the setting is checked again every hour.
 */
public class RefreshScheduler {
    private static final Logger logger = LogManager.getLogger(RefreshScheduler.class);

    public static final long MIN_INTERVAL_MS = 60000;
    public static final long DISABLED_RECHECK_MS = 3600000;
    public static final long ERROR_DELAY_MS = 300000;

    private final JobManager jobManager;
    private Thread channelThread;
    private Thread epgThread;

    public RefreshScheduler(JobManager jobManager) {
        this.jobManager = jobManager;
    }

    public synchronized void start() {
        if (channelThread != null) {
            return;
        }

        channelThread = new Thread(new Runnable() {
            @Override
            public void run() {
                loop("Channel", "refresh.channel_interval_hours", 24);
            }
        });
        channelThread.setName("ChannelScheduler-" + channelThread.getId());
        channelThread.setDaemon(true);
        channelThread.start();

        epgThread = new Thread(new Runnable() {
            @Override
            public void run() {
                loop("EPG", "refresh.epg_interval_hours", 0.5);
            }
        });
        epgThread.setName("EpgScheduler-" + epgThread.getId());
        epgThread.setDaemon(true);
        epgThread.start();

        logger.info("Refresh schedulers started.");
    }

    public synchronized void stop() {
        if (channelThread != null) {
            channelThread.interrupt();
            channelThread = null;
        }

        if (epgThread != null) {
            epgThread.interrupt();
            epgThread = null;
        }
    }

    private void loop(String name, String key, double defaultHours) {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                double hours = Config.getDouble(key, defaultHours);

                if (hours <= 0) {
                    logger.info("{} scheduler: automatic refresh is disabled (interval = 0).", name);
                    Thread.sleep(DISABLED_RECHECK_MS);
                    continue;
                }

                long interval = intervalMillis(hours);
                logger.info("{} scheduler: next refresh in {} hours ({} seconds).", name, hours, interval / 1000);
                Thread.sleep(interval);

                if (name.equals("EPG")) {
                    jobManager.enqueueEpgRefresh("scheduled");
                    logger.info("{} scheduler: EPG refresh queued.", name);
                } else {
                    int total = jobManager.enqueueRefreshAll("scheduled");
                    logger.info("{} scheduler: channel refresh queued ({} portals).", name, total);
                }
            } catch (InterruptedException e) {
                break;
            } catch (Exception e) {
                logger.error("{} scheduler error => ", name, e);

                try {
                    Thread.sleep(ERROR_DELAY_MS);
                } catch (InterruptedException e1) {
                    break;
                }
            }
        }

        logger.info("{} scheduler stopped.", name);
    }

    /**
     * Converts an interval in hours to milliseconds, never less than a minute.
     */
    static long intervalMillis(double hours) {
        return Math.max(MIN_INTERVAL_MS, (long) (hours * 3600000));
    }
}
