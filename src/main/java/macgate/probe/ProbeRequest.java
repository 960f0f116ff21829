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

package macgate.probe;

import macgate.channel.CachedChannel;
import macgate.portal.Portal;

/**
 * What a client asked for.
 */
public class ProbeRequest {
    private final Portal portal;
    private final String channelId;
    private final CachedChannel cachedChannel;
    private final boolean reserve;
    private final String clientAddr;

    /**
     * @param portal A copy of the portal to probe.
     * @param channelId The requested channel.
     * @param cachedChannel What is cached about the channel or <i>null</i>.
     * @param reserve If <i>true</i>, a playback slot is taken on each MAC before it is probed and
     *                kept by the winning MAC.
     * @param clientAddr The address of the client for occupancy reporting.
     */
    public ProbeRequest(Portal portal, String channelId, CachedChannel cachedChannel, boolean reserve, String clientAddr) {
        this.portal = portal;
        this.channelId = channelId;
        this.cachedChannel = cachedChannel;
        this.reserve = reserve;
        this.clientAddr = clientAddr;
    }

    public Portal getPortal() {
        return portal;
    }

    public String getChannelId() {
        return channelId;
    }

    public CachedChannel getCachedChannel() {
        return cachedChannel;
    }

    public boolean isReserve() {
        return reserve;
    }

    public String getClientAddr() {
        return clientAddr;
    }
}
