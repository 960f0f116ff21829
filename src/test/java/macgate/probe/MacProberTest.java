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
import macgate.config.StreamingSettings;
import macgate.credential.MacRotator;
import macgate.credential.MacRotatorTest;
import macgate.credential.OccupancyRegistry;
import macgate.portal.*;
import macgate.process.FakeLauncher;
import macgate.stream.FailureReason;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.*;

import static org.testng.Assert.assertEquals;

public class MacProberTest {
    private MemoryPortalStore store;
    private FakePortalClient client;
    private FakeLauncher launcher;
    private OccupancyRegistry occupancy;
    private StreamingSettings settings;
    private MacProber prober;

    @BeforeMethod(groups = { "probe" })
    public void setUp() {
        store = new MemoryPortalStore();
        Portal portal = new Portal("p1", "Portal", "http://portal/");
        portal.setMacs(new ArrayList<>(Arrays.asList(
                new MacRecord("A", 0), new MacRecord("B", 0), new MacRecord("C", 0))));
        store.addPortal(portal);

        client = new FakePortalClient();
        client.setDefaultChannels(new PortalChannel("100", "News", "ffmpeg http://localhost/ch/100", "1"));

        launcher = new FakeLauncher();
        occupancy = new OccupancyRegistry();
        settings = new StreamingSettings();

        MacRotator rotator = new MacRotator(store, new PortalLocks(), MacRotatorTest.DIRECT);
        prober = new MacProber(client, occupancy, rotator, new StreamTester(launcher, "ffprobe"), settings);
    }

    private ProbeRequest request(boolean reserve) {
        return new ProbeRequest(store.getPortal("p1"), "100", null, reserve, "10.0.0.1");
    }

    private List<String> macOrder() {
        List<String> returnValue = new ArrayList<>();
        for (MacRecord mac : store.getPortal("p1").getMacs()) {
            returnValue.add(mac.getMac());
        }
        return returnValue;
    }

    private void waitForOccupancy(int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (occupancy.snapshot("p1").size() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assert occupancy.snapshot("p1").size() == expected :
                "occupied = " + occupancy.snapshot("p1").size() + " != expected = " + expected;
    }

    @Test(groups = { "probe", "sequential" })
    public void firstWorkingMacWins() throws InterruptedException {
        client.reject("A");
        launcher.markDead(FakePortalClient.LINK_PREFIX + "B/100");

        ProbeOutcome outcome = prober.probe(request(true));

        assert outcome.isFound();
        assertEquals(outcome.getResult().getMac(), "C");
        assertEquals(outcome.getResult().getLink(), FakePortalClient.LINK_PREFIX + "C/100");
        assertEquals(outcome.getResult().getChannelName(), "News");
        assertEquals(outcome.getFailures().get("A"), FailureReason.AUTH_FAILURE);
        assertEquals(outcome.getFailures().get("B"), FailureReason.STREAM_LIVENESS_FAILURE);

        // The winner keeps its slot, failed MACs don't.
        assert outcome.getResult().getReservation() != null;
        assertEquals(outcome.getResult().getReservation().getChannelName(), "News");
        assert occupancy.count("p1", "C") == 1;
        assert occupancy.count("p1", "A") == 0;
        assert occupancy.count("p1", "B") == 0;

        assertEquals(macOrder(), Arrays.asList("C", "A", "B"));
        assertEquals(store.getMoves(), Arrays.asList("p1/A", "p1/B"));
    }

    @Test(groups = { "probe", "sequential" })
    public void stopsAfterFirstFailureWhenNotTryingAll() throws InterruptedException {
        settings.setTryAllMacs(false);
        client.reject("A");

        ProbeOutcome outcome = prober.probe(request(true));

        assert !outcome.isFound();
        assertEquals(outcome.getFailures().keySet(), Collections.singleton("A"));
        assertEquals(client.getTokenRequests(), Collections.singletonList("A"));
        assertEquals(outcome.getExhaustionReason(), FailureReason.NO_WORKING_STREAM);
    }

    @Test(groups = { "probe", "exhaustion" })
    public void everyMacBusyIsCredentialUnavailable() throws InterruptedException {
        occupancy.reserve("p1", "Portal", "A", 1, "200", null, "10.0.0.9");
        occupancy.reserve("p1", "Portal", "B", 1, "200", null, "10.0.0.9");
        occupancy.reserve("p1", "Portal", "C", 1, "200", null, "10.0.0.9");

        ProbeOutcome outcome = prober.probe(request(true));

        assert !outcome.isFound();
        assert !outcome.isAnyMacFree();
        assertEquals(outcome.getExhaustionReason(), FailureReason.CREDENTIAL_UNAVAILABLE);
        assert client.getTokenRequests().isEmpty();
        for (FailureReason reason : outcome.getFailures().values()) {
            assertEquals(reason, FailureReason.CREDENTIAL_UNAVAILABLE);
        }
        assert occupancy.snapshot("p1").size() == 3;
    }

    @Test(groups = { "probe", "exhaustion" })
    public void everyMacBrokenIsNoWorkingStream() throws InterruptedException {
        client.reject("A");
        client.unreachable("B");
        client.setChannels("C");

        ProbeOutcome outcome = prober.probe(request(true));

        assert !outcome.isFound();
        assert outcome.isAnyMacFree();
        assertEquals(outcome.getExhaustionReason(), FailureReason.NO_WORKING_STREAM);
        assertEquals(outcome.getFailures().get("A"), FailureReason.AUTH_FAILURE);
        assertEquals(outcome.getFailures().get("B"), FailureReason.AUTH_FAILURE);
        assertEquals(outcome.getFailures().get("C"), FailureReason.CHANNEL_RESOLUTION_FAILURE);
        assert occupancy.snapshot("p1").isEmpty();
        assertEquals(store.getMoves().size(), 3);
    }

    @Test(groups = { "probe", "sequential" })
    public void probingWithoutReservation() throws InterruptedException {
        occupancy.reserve("p1", "Portal", "A", 1, "200", null, "10.0.0.9");

        ProbeOutcome outcome = prober.probe(request(false));

        assert outcome.isFound();
        assertEquals(outcome.getResult().getMac(), "B");
        assert outcome.getResult().getReservation() == null;
        assert occupancy.snapshot("p1").size() == 1;
    }

    @Test(groups = { "probe", "channels" })
    public void alternateChannelIsUsedWhenPrimaryIsMissing() throws InterruptedException {
        settings.setTestStreams(false);
        client.setDefaultChannels(new PortalChannel("200", "News HD", "ffmpeg http://direct/200.ts", "1"));

        CachedChannel cached = new CachedChannel("p1", "100", "News", "1", null,
                Collections.singletonList("B"), Collections.singletonList("200"));
        ProbeRequest request = new ProbeRequest(store.getPortal("p1"), "100", cached, true, "10.0.0.1");

        ProbeOutcome outcome = prober.probe(request);

        assert outcome.isFound();
        // B lists the channel so it is tried first.
        assertEquals(outcome.getResult().getMac(), "B");
        assertEquals(outcome.getResult().getLink(), "http://direct/200.ts");
        assertEquals(outcome.getResult().getChannelName(), "News");
        assert launcher.getLaunched().isEmpty();
    }

    @Test(groups = { "probe", "parallel" })
    public void parallelProbingHasOneWinner() throws InterruptedException {
        settings.setParallelProbing(true);
        settings.setParallelWorkers(3);
        launcher.setProbeDelay(FakePortalClient.LINK_PREFIX + "A/100", 3000);

        long start = System.currentTimeMillis();
        ProbeOutcome outcome = prober.probe(request(true));

        assert outcome.isFound();
        assert !outcome.getResult().getMac().equals("A");
        assert System.currentTimeMillis() - start < 3000;

        // Losing and interrupted probes give their slots back.
        waitForOccupancy(1);
        assert occupancy.count("p1", outcome.getResult().getMac()) == 1;
    }

    @Test(groups = { "probe", "parallel" })
    public void parallelProbingRecordsEveryFailure() throws InterruptedException {
        settings.setParallelProbing(true);
        client.reject("A");
        client.reject("B");
        launcher.markDead(FakePortalClient.LINK_PREFIX + "C/100");

        ProbeOutcome outcome = prober.probe(request(true));

        assert !outcome.isFound();
        assertEquals(outcome.getFailures().size(), 3);
        assertEquals(outcome.getFailures().get("C"), FailureReason.STREAM_LIVENESS_FAILURE);
        assertEquals(outcome.getExhaustionReason(), FailureReason.NO_WORKING_STREAM);
        waitForOccupancy(0);
        assertEquals(new HashSet<>(store.getMoves()), new HashSet<>(Arrays.asList("p1/A", "p1/B", "p1/C")));
    }

    @Test(groups = { "probe", "parallel" })
    public void parallelRoundDeadline() throws InterruptedException {
        settings.setParallelProbing(true);
        settings.setProbeRoundTimeout(1);
        launcher.setProbeDelay(FakePortalClient.LINK_PREFIX + "A/100", 8000);
        launcher.setProbeDelay(FakePortalClient.LINK_PREFIX + "B/100", 8000);
        launcher.setProbeDelay(FakePortalClient.LINK_PREFIX + "C/100", 8000);

        long start = System.currentTimeMillis();
        ProbeOutcome outcome = prober.probe(request(true));

        assert !outcome.isFound();
        assert System.currentTimeMillis() - start < 5000;
        waitForOccupancy(0);
    }

    @Test(groups = { "probe", "parallel" })
    public void interruptedRoundReleasesSlotsAndRotatesFailures() throws InterruptedException {
        settings.setParallelProbing(true);
        settings.setParallelWorkers(3);
        settings.setTestStreams(false);
        client.reject("A");
        client.reject("C");

        final Thread caller = Thread.currentThread();
        client.onGetLink("B", new Runnable() {
            @Override
            public void run() {
                try {
                    // Gives the caller time to collect the other failures first.
                    Thread.sleep(300);
                    caller.interrupt();
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        boolean interrupted = false;
        try {
            prober.probe(request(true));
        } catch (InterruptedException e) {
            interrupted = true;
        }

        assert interrupted : "The round was not interrupted.";
        waitForOccupancy(0);
        assertEquals(new HashSet<>(store.getMoves()), new HashSet<>(Arrays.asList("p1/A", "p1/C")));
    }

    @Test(groups = { "probe", "channels" })
    public void linkFromCmd() {
        assertEquals(MacProber.linkFromCmd("ffmpeg http://host/stream.ts"), "http://host/stream.ts");
        assertEquals(MacProber.linkFromCmd("  ffrt   http://host/a  extra"), "http://host/a");
        assertEquals(MacProber.linkFromCmd("http://host/only"), "http://host/only");
    }

    @Test(groups = { "probe", "channels" })
    public void findChannelPrefersPrimaryId() {
        List<PortalChannel> channels = Arrays.asList(
                new PortalChannel("1", "One", "cmd1", null),
                new PortalChannel("2", "Two", null, null),
                new PortalChannel("3", "Three", "cmd3", null));

        assertEquals(MacProber.findChannel(channels, "1", Arrays.asList("3")).getId(), "1");
        // A channel without a command is skipped.
        assertEquals(MacProber.findChannel(channels, "2", Arrays.asList("3")).getId(), "3");
        assert MacProber.findChannel(channels, "9", Collections.<String>emptyList()) == null;
        assert MacProber.findChannel(null, "1", Collections.<String>emptyList()) == null;
    }
}
