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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Used when no guide implementation is configured. Guide refreshes only log.
 */
public class LoggingEpgRefresher implements EpgRefresher {
    private static final Logger logger = LogManager.getLogger(LoggingEpgRefresher.class);

    @Override
    public void invalidateGuide() {
        logger.debug("No programme guide is cached.");
    }

    @Override
    public void refreshEpg() {
        logger.info("No EPG refresher is configured. Set 'epg.refresher_class' to enable guide refreshes.");
    }
}
