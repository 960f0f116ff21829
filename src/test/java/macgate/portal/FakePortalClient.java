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

import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted portal. Every MAC gets a token and lists the default channels unless told otherwise.
 */
public class FakePortalClient implements PortalClient {
    public static final String LINK_PREFIX = "http://upstream/";

    private final Set<String> rejectedMacs = Collections.newSetFromMap(new ConcurrentHashMap<String, Boolean>());
    private final Set<String> unreachableMacs = Collections.newSetFromMap(new ConcurrentHashMap<String, Boolean>());
    private final Map<String, List<PortalChannel>> channelsByMac = new ConcurrentHashMap<>();
    private final Map<String, String> genres = new ConcurrentHashMap<>();
    private final List<String> tokenRequests = new CopyOnWriteArrayList<>();
    private final Map<String, Runnable> linkActions = new ConcurrentHashMap<>();
    private volatile List<PortalChannel> defaultChannels = new ArrayList<>();

    /**
     * The MAC gets no token.
     */
    public void reject(String mac) {
        rejectedMacs.add(mac);
    }

    /**
     * Every call for the MAC throws.
     */
    public void unreachable(String mac) {
        unreachableMacs.add(mac);
    }

    public void setDefaultChannels(PortalChannel... channels) {
        defaultChannels = Arrays.asList(channels);
    }

    public void setChannels(String mac, PortalChannel... channels) {
        channelsByMac.put(mac, Arrays.asList(channels));
    }

    public void addGenre(String id, String name) {
        genres.put(id, name);
    }

    /**
     * Runs the action on the probing thread before the link for the MAC is returned.
     */
    public void onGetLink(String mac, Runnable action) {
        linkActions.put(mac, action);
    }

    public List<String> getTokenRequests() {
        return new ArrayList<>(tokenRequests);
    }

    private void check(String mac) throws IOException {
        if (unreachableMacs.contains(mac)) {
            throw new IOException("Portal unreachable for " + mac);
        }
    }

    @Override
    public String getToken(String url, String mac, String proxy) throws IOException {
        tokenRequests.add(mac);
        check(mac);
        return rejectedMacs.contains(mac) ? null : "token-" + mac;
    }

    @Override
    public Map<String, String> getProfile(String url, String mac, String token, String proxy) throws IOException {
        check(mac);
        return Collections.singletonMap("status", "1");
    }

    @Override
    public List<PortalChannel> getAllChannels(String url, String mac, String token, String proxy) throws IOException {
        check(mac);
        List<PortalChannel> channels = channelsByMac.get(mac);
        return channels != null ? channels : defaultChannels;
    }

    @Override
    public Map<String, String> getGenreNames(String url, String mac, String token, String proxy) throws IOException {
        check(mac);
        return new HashMap<>(genres);
    }

    /**
     * Links resolved through the portal are <i>http://upstream/mac/cmd-suffix</i>.
     */
    @Override
    public String getLink(String url, String mac, String token, String cmd, String proxy) throws IOException {
        check(mac);
        Runnable action = linkActions.get(mac);
        if (action != null) {
            action.run();
        }
        return LINK_PREFIX + mac + "/" + cmd.substring(cmd.lastIndexOf('/') + 1);
    }

    @Override
    public String getExpires(String url, String mac, String token, String proxy) throws IOException {
        check(mac);
        return "January 1, 2030";
    }
}
