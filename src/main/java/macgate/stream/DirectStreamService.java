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

package macgate.stream;

import macgate.channel.ChannelCache;
import macgate.config.StreamingSettings;
import macgate.credential.MacRotator;
import macgate.credential.OccupancyRegistry;
import macgate.portal.Portal;
import macgate.portal.PortalStore;
import macgate.probe.MacProber;
import macgate.probe.ProbeRequest;
import macgate.process.ProcessLauncher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Creates direct stream sessions for clients.
 */
public class DirectStreamService {
    private static final Logger logger = LogManager.getLogger(DirectStreamService.class);

    private final PortalStore portalStore;
    private final ChannelCache channelCache;
    private final MacProber prober;
    private final ProcessLauncher launcher;
    private final OccupancyRegistry occupancy;
    private final MacRotator rotator;
    private final StreamingSettings settings;

    public DirectStreamService(PortalStore portalStore, ChannelCache channelCache, MacProber prober,
                               ProcessLauncher launcher, OccupancyRegistry occupancy, MacRotator rotator,
                               StreamingSettings settings) {

        this.portalStore = portalStore;
        this.channelCache = channelCache;
        this.prober = prober;
        this.launcher = launcher;
        this.occupancy = occupancy;
        this.rotator = rotator;
        this.settings = settings;
    }

    /**
     * Starts streaming a channel to a client.
     *
     * @param portalId The portal.
     * @param channelId The channel.
     * @param clientAddr The address of the client.
     * @param web If <i>true</i>, the stream is remuxed into fragmented MP4 for browser playback.
     * @return A session that is streaming. The caller must close it.
     * @throws StreamException If the stream could not be started.
     */
    public StreamSession open(String portalId, String channelId, String clientAddr, final boolean web)
            throws StreamException {

        StreamSession session = createSession(portalId, channelId, clientAddr);

        session.start(new StreamSession.CommandFactory() {
            @Override
            public List<String> create(String link, String proxy) {
                return buildCommand(link, proxy, web);
            }
        });

        return session;
    }

    /**
     * Finds a working link without starting a process. Used when clients are redirected to the
     * upstream link.
     *
     * @return The link.
     * @throws StreamException If no MAC could deliver the channel.
     */
    public String resolveLink(String portalId, String channelId, String clientAddr) throws StreamException {
        StreamSession session = createSession(portalId, channelId, clientAddr);
        session.start(null);

        logger.info("Redirecting {} to the link for channel {} from MAC {}.",
                clientAddr, channelId, session.getResult().getMac());

        return session.getResult().getLink();
    }

    List<String> buildCommand(String link, String proxy, boolean web) {
        if (web) {
            return CommandTemplate.webCommand(settings.getFfmpegPath(), link, proxy);
        }

        return CommandTemplate.build(settings.getFfmpegCommand(), link, settings.getFfmpegTimeout(), proxy);
    }

    public StreamingSettings getSettings() {
        return settings;
    }

    private StreamSession createSession(String portalId, String channelId, String clientAddr)
            throws StreamException {

        Portal portal = portalStore.getPortal(portalId);

        if (portal == null || !portal.isEnabled()) {
            throw new StreamException(FailureReason.PORTAL_NOT_FOUND,
                    "The portal '" + portalId + "' does not exist or is disabled.");
        }

        ProbeRequest request = new ProbeRequest(portal, channelId,
                channelCache.getChannel(portalId, channelId), true, clientAddr);

        return new StreamSession(request, prober, launcher, occupancy, rotator);
    }
}
