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

package macgate.channel;

import macgate.jobs.ChannelRefresher;
import macgate.jobs.PortalStats;
import macgate.portal.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.*;

/**
 * Rebuilds the channel cache of a portal by asking every MAC for its channel list.
 * <p/>
 * A channel listed by several MACs is cached once with all of those MACs as available MACs.
 * Channels sharing the same name are treated as alternates of each other. MAC expiry dates are
 * recorded while the MACs are queried.
 */
public class ChannelCacheRefresher implements ChannelRefresher {
    private static final Logger logger = LogManager.getLogger(ChannelCacheRefresher.class);

    private final PortalStore portalStore;
    private final PortalClient portalClient;
    private final ChannelCache channelCache;
    private final Map<String, Integer> workingMacs = new HashMap<>();

    public ChannelCacheRefresher(PortalStore portalStore, PortalClient portalClient, ChannelCache channelCache) {
        this.portalStore = portalStore;
        this.portalClient = portalClient;
        this.channelCache = channelCache;
    }

    @Override
    public void refreshChannels(String portalId) throws Exception {
        Portal portal = portalStore.getPortal(portalId);

        if (portal == null) {
            throw new IllegalArgumentException("The portal '" + portalId + "' does not exist.");
        }

        logger.info("Fetching channels for portal '{}'...", portal.getName());

        Map<String, PortalChannel> channelsById = new LinkedHashMap<>();
        Map<String, List<String>> macsById = new HashMap<>();
        Map<String, String> genres = new HashMap<>();
        int working = 0;

        for (MacRecord macRecord : portal.getMacs()) {
            String mac = macRecord.getMac();

            try {
                String token = portalClient.getToken(portal.getUrl(), mac, portal.getProxy());
                if (token == null) {
                    logger.warn("Could not get a token for MAC {} on portal '{}'.", mac, portal.getName());
                    continue;
                }

                portalClient.getProfile(portal.getUrl(), mac, token, portal.getProxy());

                String expiry = portalClient.getExpires(portal.getUrl(), mac, token, portal.getProxy());
                if (expiry != null) {
                    portalStore.updateMacExpiry(portalId, mac, expiry);
                }

                List<PortalChannel> macChannels = portalClient.getAllChannels(portal.getUrl(), mac, token, portal.getProxy());
                if (macChannels == null || macChannels.isEmpty()) {
                    logger.warn("No channels returned for MAC {} on portal '{}'.", mac, portal.getName());
                    continue;
                }

                Map<String, String> macGenres = portalClient.getGenreNames(portal.getUrl(), mac, token, portal.getProxy());
                if (macGenres != null) {
                    genres.putAll(macGenres);
                }

                working++;
                logger.info("MAC {} returned {} channels.", mac, macChannels.size());

                for (PortalChannel channel : macChannels) {
                    if (channel.getId() == null) {
                        continue;
                    }

                    if (!channelsById.containsKey(channel.getId())) {
                        channelsById.put(channel.getId(), channel);
                        macsById.put(channel.getId(), new ArrayList<String>());
                    }

                    List<String> macs = macsById.get(channel.getId());
                    if (!macs.contains(mac)) {
                        macs.add(mac);
                    }
                }
            } catch (IOException e) {
                logger.error("Error fetching channels from MAC {} on portal '{}' => {}", mac, portal.getName(), e.getMessage());
            }
        }

        if (channelsById.isEmpty()) {
            throw new IOException("No channels were returned by any MAC on portal '" + portal.getName() + "'.");
        }

        Map<String, List<String>> idsByName = new HashMap<>();
        for (PortalChannel channel : channelsById.values()) {
            String name = normalizeName(channel.getName());
            List<String> ids = idsByName.get(name);

            if (ids == null) {
                ids = new ArrayList<>();
                idsByName.put(name, ids);
            }

            ids.add(channel.getId());
        }

        List<CachedChannel> cached = new ArrayList<>(channelsById.size());
        for (PortalChannel channel : channelsById.values()) {
            List<String> alternates = new ArrayList<>();
            String name = normalizeName(channel.getName());

            // Unnamed channels can't be told apart, so they never get alternates.
            if (name.length() > 0) {
                alternates.addAll(idsByName.get(name));
                alternates.remove(channel.getId());
            }

            cached.add(new CachedChannel(portalId, channel.getId(), channel.getName(),
                    channel.getGenreId(), channel.getCmd(), macsById.get(channel.getId()), alternates));
        }

        channelCache.replacePortal(portalId, cached, genres);

        synchronized (workingMacs) {
            workingMacs.put(portalId, working);
        }

        logger.info("Cached {} channels for portal '{}'.", cached.size(), portal.getName());
    }

    @Override
    public PortalStats computeStats(String portalId) {
        Portal portal = portalStore.getPortal(portalId);
        int totalMacs = portal == null ? 0 : portal.getMacs().size();
        int working;

        synchronized (workingMacs) {
            Integer value = workingMacs.get(portalId);
            working = value == null ? 0 : value;
        }

        return new PortalStats(channelCache.getChannels(portalId).size(),
                channelCache.getGenres(portalId).size(), totalMacs, working);
    }

    private static String normalizeName(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
