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

import macgate.portal.MacRecord;

import java.util.*;

/**
 * Ranks the MACs of a portal by how likely they are to deliver a stream right now.
 * <p/>
 * Idle MACs rank above recently used MACs and MACs with more free playback slots rank above MACs
 * with fewer. A MAC with no free slot scores -1 and is only tried when nothing else is left.
 */
public class MacScorer {

    public static final int NO_CAPACITY = -1;

    /**
     * Scores one MAC.
     *
     * @param mac The MAC to score.
     * @param occupied The occupied slots of the portal the MAC belongs to.
     * @param streamsPerMac The number of slots per MAC. 0 means unlimited.
     * @return The score or {@link #NO_CAPACITY} if every slot of the MAC is in use.
     */
    public static int score(MacRecord mac, Collection<OccupiedSession> occupied, int streamsPerMac) {
        int currentStreams = 0;

        for (OccupiedSession session : occupied) {
            if (session.getMac().equalsIgnoreCase(mac.getMac())) {
                currentStreams++;
            }
        }

        int availableSlots = streamsPerMac - currentStreams;

        if (streamsPerMac != 0 && availableSlots <= 0) {
            return NO_CAPACITY;
        }

        int score = idleScore(mac.getWatchdogTimeout());

        if (streamsPerMac != 0) {
            score += availableSlots * 20;
        }

        return score;
    }

    static int idleScore(int watchdogTimeout) {
        if (watchdogTimeout > 1800) {
            return 100;
        } else if (watchdogTimeout > 300) {
            return 75;
        } else if (watchdogTimeout >= 60) {
            return 50;
        } else if (watchdogTimeout > 0) {
            return 10;
        }

        return 0;
    }

    /**
     * Orders the MACs of a portal into the sequence they should be probed in.
     * <p/>
     * MACs with a score of 0 or more are sorted by score, highest first. Ties keep the portal
     * order. If no MAC has a usable score, every MAC is returned in portal order. When the channel
     * is known to be listed by some of the MACs, those are moved to the front.
     *
     * @param macs The MACs of the portal in portal order.
     * @param occupied The occupied slots of the portal.
     * @param streamsPerMac The number of slots per MAC. 0 means unlimited.
     * @param availableMacs MACs known to list the channel. Can be empty or <i>null</i>.
     * @return The MACs in the order they should be probed.
     */
    public static List<MacRecord> orderCandidates(List<MacRecord> macs, Collection<OccupiedSession> occupied,
                                                  int streamsPerMac, Collection<String> availableMacs) {

        final Map<MacRecord, Integer> scores = new IdentityHashMap<>();
        List<MacRecord> candidates = new ArrayList<>();

        for (MacRecord mac : macs) {
            int score = score(mac, occupied, streamsPerMac);
            scores.put(mac, score);

            if (score >= 0) {
                candidates.add(mac);
            }
        }

        if (candidates.isEmpty()) {
            candidates.addAll(macs);
        } else {
            // Collections.sort is stable so equal scores keep the portal order.
            Collections.sort(candidates, new Comparator<MacRecord>() {
                @Override
                public int compare(MacRecord o1, MacRecord o2) {
                    return Integer.compare(scores.get(o2), scores.get(o1));
                }
            });
        }

        if (availableMacs == null || availableMacs.isEmpty()) {
            return candidates;
        }

        Set<String> known = new HashSet<>();
        for (String mac : availableMacs) {
            known.add(mac.toUpperCase(Locale.ROOT));
        }

        List<MacRecord> preferred = new ArrayList<>();
        List<MacRecord> others = new ArrayList<>();

        for (MacRecord mac : candidates) {
            if (known.contains(mac.getMac().toUpperCase(Locale.ROOT))) {
                preferred.add(mac);
            } else {
                others.add(mac);
            }
        }

        if (preferred.isEmpty()) {
            return candidates;
        }

        preferred.addAll(others);
        return preferred;
    }
}
