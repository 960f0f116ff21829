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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracks which MAC playback slots are in use.
 * <p/>
 * A slot is only ever taken through {@link #reserve}, which checks the capacity and adds the entry
 * while holding the registry lock. Two requests can never both take the last free slot of a MAC.
 */
public class OccupancyRegistry {
    private static final Logger logger = LogManager.getLogger(OccupancyRegistry.class);

    private final Object lock = new Object();
    private final List<OccupiedSession> sessions = new ArrayList<>();

    /**
     * Takes a playback slot on a MAC if one is free.
     *
     * @param streamsPerMac The number of slots per MAC. 0 means unlimited.
     * @return The new entry or <i>null</i> if every slot of the MAC is in use.
     */
    public OccupiedSession reserve(String portalId, String portalName, String mac, int streamsPerMac,
                                   String channelId, String channelName, String clientAddr) {

        synchronized (lock) {
            if (streamsPerMac != 0 && countLocked(portalId, mac) >= streamsPerMac) {
                return null;
            }

            OccupiedSession session = new OccupiedSession(
                    portalId, portalName, mac, channelId, channelName, clientAddr);
            sessions.add(session);

            logger.debug("Occupied {}.", session);
            return session;
        }
    }

    /**
     * Releases a slot. Releasing the same entry twice has no effect.
     *
     * @return <i>true</i> if the entry was still registered.
     */
    public boolean release(OccupiedSession session) {
        if (session == null) {
            return false;
        }

        synchronized (lock) {
            for (int i = 0; i < sessions.size(); i++) {
                if (sessions.get(i).getId() == session.getId()) {
                    sessions.remove(i);
                    logger.debug("Unoccupied {}.", session);
                    return true;
                }
            }
        }

        return false;
    }

    public int count(String portalId, String mac) {
        synchronized (lock) {
            return countLocked(portalId, mac);
        }
    }

    public List<OccupiedSession> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(sessions);
        }
    }

    public List<OccupiedSession> snapshot(String portalId) {
        List<OccupiedSession> returnValue = new ArrayList<>();

        synchronized (lock) {
            for (OccupiedSession session : sessions) {
                if (session.getPortalId().equals(portalId)) {
                    returnValue.add(session);
                }
            }
        }

        return returnValue;
    }

    private int countLocked(String portalId, String mac) {
        int count = 0;

        for (OccupiedSession session : sessions) {
            if (session.getPortalId().equals(portalId) && session.getMac().equalsIgnoreCase(mac)) {
                count++;
            }
        }

        return count;
    }
}
