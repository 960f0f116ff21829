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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What was learned about a channel during the last refresh of its portal.
 */
public class CachedChannel {
    private final String portalId;
    private final String channelId;
    private final String name;
    private final String genreId;
    private final String cmd;
    private final List<String> availableMacs;
    private final List<String> alternateIds;

    public CachedChannel(String portalId, String channelId, String name, String genreId, String cmd,
                         List<String> availableMacs, List<String> alternateIds) {

        this.portalId = portalId;
        this.channelId = channelId;
        this.name = name;
        this.genreId = genreId;
        this.cmd = cmd;
        this.availableMacs = availableMacs == null ?
                Collections.<String>emptyList() :
                Collections.unmodifiableList(new ArrayList<>(availableMacs));
        this.alternateIds = alternateIds == null ?
                Collections.<String>emptyList() :
                Collections.unmodifiableList(new ArrayList<>(alternateIds));
    }

    public String getPortalId() {
        return portalId;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getName() {
        return name;
    }

    public String getGenreId() {
        return genreId;
    }

    /**
     * @return The last known command for the channel or <i>null</i>. When present, probing can skip
     *         fetching the full channel list.
     */
    public String getCmd() {
        return cmd;
    }

    /**
     * @return MACs that listed this channel during the last refresh.
     */
    public List<String> getAvailableMacs() {
        return availableMacs;
    }

    /**
     * @return Other ids for the same channel, tried in order when the primary id isn't listed.
     */
    public List<String> getAlternateIds() {
        return alternateIds;
    }
}
