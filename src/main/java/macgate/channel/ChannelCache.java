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

import java.util.List;
import java.util.Map;

public interface ChannelCache {

    /**
     * @return The cached channel or <i>null</i> if the channel is not known.
     */
    CachedChannel getChannel(String portalId, String channelId);

    List<CachedChannel> getChannels(String portalId);

    Map<String, String> getGenres(String portalId);

    /**
     * Replaces everything cached for a portal in one step.
     */
    void replacePortal(String portalId, List<CachedChannel> channels, Map<String, String> genres);
}
