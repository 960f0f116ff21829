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

import java.util.concurrent.atomic.AtomicLong;

/**
 * One active consumer of a MAC playback slot.
 */
public class OccupiedSession {
    private static final AtomicLong ids = new AtomicLong(0);

    private final long id;
    private final String portalId;
    private final String portalName;
    private final String mac;
    private final String channelId;
    private volatile String channelName;
    private final String clientAddr;
    private final long startTime;

    public OccupiedSession(String portalId, String portalName, String mac, String channelId,
                           String channelName, String clientAddr) {

        this.id = ids.incrementAndGet();
        this.portalId = portalId;
        this.portalName = portalName;
        this.mac = mac;
        this.channelId = channelId;
        this.channelName = channelName;
        this.clientAddr = clientAddr;
        this.startTime = System.currentTimeMillis();
    }

    public long getId() {
        return id;
    }

    public String getPortalId() {
        return portalId;
    }

    public String getPortalName() {
        return portalName;
    }

    public String getMac() {
        return mac;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getChannelName() {
        return channelName;
    }

    public void setChannelName(String channelName) {
        this.channelName = channelName;
    }

    public String getClientAddr() {
        return clientAddr;
    }

    public long getStartTime() {
        return startTime;
    }

    @Override
    public String toString() {
        return "OccupiedSession{" +
                "portal=" + portalName +
                ", mac=" + mac +
                ", channel=" + channelId +
                ", client=" + clientAddr +
                '}';
    }
}
