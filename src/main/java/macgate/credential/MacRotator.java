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

package macgate.credential;

import macgate.portal.PortalLocks;
import macgate.portal.PortalStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Moves failing MACs to the end of their portal's MAC list.
 * <p/>
 * The moves run on the provided executor so a request never waits on portal persistence. Each
 * move holds the portal lock so it can't interleave with a channel refresh of the same portal.
 */
public class MacRotator {
    private static final Logger logger = LogManager.getLogger(MacRotator.class);

    private final PortalStore portalStore;
    private final PortalLocks portalLocks;
    private final Executor executor;

    public MacRotator(PortalStore portalStore, PortalLocks portalLocks, Executor executor) {
        this.portalStore = portalStore;
        this.portalLocks = portalLocks;
        this.executor = executor;
    }

    /**
     * Rotates each distinct MAC once, in the order given.
     */
    public void rotate(final String portalId, Collection<String> macs) {
        if (macs == null || macs.isEmpty()) {
            return;
        }

        final Set<String> distinct = new LinkedHashSet<>(macs);

        try {
            executor.execute(new Runnable() {
                @Override
                public void run() {
                    moveNow(portalId, distinct);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("Unable to schedule MAC rotation for portal '{}' => {}", portalId, e.getMessage());
        }
    }

    private void moveNow(String portalId, Collection<String> macs) {
        ReentrantLock lock = portalLocks.getLock(portalId);
        lock.lock();

        try {
            for (String mac : macs) {
                try {
                    if (!portalStore.moveMac(portalId, mac)) {
                        logger.debug("MAC {} is no longer part of portal '{}'.", mac, portalId);
                    }
                } catch (IOException e) {
                    logger.error("Unable to move MAC {} on portal '{}' => ", mac, portalId, e);
                }
            }
        } finally {
            lock.unlock();
        }
    }
}
