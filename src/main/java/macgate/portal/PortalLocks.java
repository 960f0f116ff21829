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

package macgate.portal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per portal.
 * <p/>
 * Everything that changes a portal definition or refreshes its cached data holds the lock for that
 * portal so those changes never interleave. The locks are reentrant.
 */
public class PortalLocks {
    private static final Logger logger = LogManager.getLogger(PortalLocks.class);

    private final Map<String, ReentrantLock> locks = new HashMap<>();

    public ReentrantLock getLock(String portalId) {
        synchronized (locks) {
            ReentrantLock lock = locks.get(portalId);

            if (lock == null) {
                logger.debug("Creating lock for portal '{}'.", portalId);
                lock = new ReentrantLock();
                locks.put(portalId, lock);
            }

            return lock;
        }
    }
}
