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

import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class MemoryChannelCache implements ChannelCache {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Map<String, CachedChannel>> channels = new HashMap<>();
    private final Map<String, Map<String, String>> genres = new HashMap<>();

    @Override
    public CachedChannel getChannel(String portalId, String channelId) {
        lock.readLock().lock();

        try {
            Map<String, CachedChannel> portalChannels = channels.get(portalId);
            return portalChannels == null ? null : portalChannels.get(channelId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<CachedChannel> getChannels(String portalId) {
        lock.readLock().lock();

        try {
            Map<String, CachedChannel> portalChannels = channels.get(portalId);

            if (portalChannels == null) {
                return Collections.emptyList();
            }

            return new ArrayList<>(portalChannels.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, String> getGenres(String portalId) {
        lock.readLock().lock();

        try {
            Map<String, String> portalGenres = genres.get(portalId);

            if (portalGenres == null) {
                return Collections.emptyMap();
            }

            return new HashMap<>(portalGenres);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void replacePortal(String portalId, List<CachedChannel> newChannels, Map<String, String> newGenres) {
        Map<String, CachedChannel> portalChannels = new LinkedHashMap<>();
        for (CachedChannel channel : newChannels) {
            portalChannels.put(channel.getChannelId(), channel);
        }

        lock.writeLock().lock();

        try {
            channels.put(portalId, portalChannels);
            genres.put(portalId, newGenres == null ?
                    new HashMap<String, String>() : new HashMap<>(newGenres));
        } finally {
            lock.writeLock().unlock();
        }
    }
}
