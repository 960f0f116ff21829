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
import org.testng.annotations.Test;

import java.util.*;

import static org.testng.Assert.assertEquals;

public class MacScorerTest {

    private static OccupiedSession occupied(String mac) {
        return new OccupiedSession("p1", "Portal", mac, "100", null, "127.0.0.1");
    }

    private static List<String> names(List<MacRecord> macs) {
        List<String> returnValue = new ArrayList<>();
        for (MacRecord mac : macs) {
            returnValue.add(mac.getMac());
        }
        return returnValue;
    }

    @Test(groups = { "credential", "scoring" })
    public void idleTimeAndFreeSlotsAreScored() {
        MacRecord a = new MacRecord("A", 2000);
        MacRecord b = new MacRecord("B", 50);
        List<OccupiedSession> sessions = Collections.singletonList(occupied("A"));

        assert MacScorer.score(a, sessions, 2) == 120;
        assert MacScorer.score(b, sessions, 2) == 50;

        List<MacRecord> ordered = MacScorer.orderCandidates(Arrays.asList(b, a), sessions, 2, null);
        assertEquals(names(ordered), Arrays.asList("A", "B"));
    }

    @Test(groups = { "credential", "scoring" })
    public void idleTiers() {
        assert MacScorer.idleScore(1801) == 100;
        assert MacScorer.idleScore(1800) == 75;
        assert MacScorer.idleScore(301) == 75;
        assert MacScorer.idleScore(300) == 50;
        assert MacScorer.idleScore(60) == 50;
        assert MacScorer.idleScore(59) == 10;
        assert MacScorer.idleScore(1) == 10;
        assert MacScorer.idleScore(0) == 0;
    }

    @Test(groups = { "credential", "scoring" })
    public void fullMacHasNoCapacity() {
        MacRecord a = new MacRecord("A", 2000);
        List<OccupiedSession> sessions = Arrays.asList(occupied("a"), occupied("A"));

        assert MacScorer.score(a, sessions, 2) == MacScorer.NO_CAPACITY;
        // Unlimited slots never run out and get no slot bonus.
        assert MacScorer.score(a, sessions, 0) == 100;
    }

    @Test(groups = { "credential", "ordering" })
    public void everyMacFullFallsBackToPortalOrder() {
        MacRecord a = new MacRecord("A", 100);
        MacRecord b = new MacRecord("B", 5000);
        List<OccupiedSession> sessions = Arrays.asList(occupied("A"), occupied("B"));

        List<MacRecord> ordered = MacScorer.orderCandidates(Arrays.asList(a, b), sessions, 1, null);
        assertEquals(names(ordered), Arrays.asList("A", "B"));
    }

    @Test(groups = { "credential", "ordering" })
    public void fullMacsAreLeftOut() {
        MacRecord a = new MacRecord("A", 100);
        MacRecord b = new MacRecord("B", 5000);
        MacRecord c = new MacRecord("C", 0);

        List<MacRecord> ordered = MacScorer.orderCandidates(Arrays.asList(a, b, c),
                Collections.singletonList(occupied("B")), 1, null);
        assertEquals(names(ordered), Arrays.asList("A", "C"));
    }

    @Test(groups = { "credential", "ordering" })
    public void equalScoresKeepPortalOrder() {
        MacRecord a = new MacRecord("A", 100);
        MacRecord b = new MacRecord("B", 200);
        MacRecord c = new MacRecord("C", 250);

        List<MacRecord> ordered = MacScorer.orderCandidates(Arrays.asList(c, a, b),
                Collections.<OccupiedSession>emptyList(), 1, null);
        assertEquals(names(ordered), Arrays.asList("C", "A", "B"));
    }

    @Test(groups = { "credential", "ordering" })
    public void macsListingTheChannelGoFirst() {
        MacRecord a = new MacRecord("A", 5000);
        MacRecord b = new MacRecord("B", 100);
        MacRecord c = new MacRecord("C", 10);

        List<MacRecord> ordered = MacScorer.orderCandidates(Arrays.asList(a, b, c),
                Collections.<OccupiedSession>emptyList(), 1, Arrays.asList("c", "B"));
        assertEquals(names(ordered), Arrays.asList("B", "C", "A"));

        // Unknown MACs don't change the order.
        ordered = MacScorer.orderCandidates(Arrays.asList(a, b, c),
                Collections.<OccupiedSession>emptyList(), 1, Collections.singletonList("Z"));
        assertEquals(names(ordered), Arrays.asList("A", "B", "C"));
    }
}
