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

import macgate.util.Util;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.testng.Assert.assertEquals;

public class JsonPortalStoreTest {
    private static final String PORTALS = "[\n" +
            "  {\n" +
            "    \"id\": \"p1\",\n" +
            "    \"name\": \"First\",\n" +
            "    \"url\": \"http://first/c/\",\n" +
            "    \"proxy\": \"\",\n" +
            "    \"streamsPerMac\": 2,\n" +
            "    \"macs\": [\n" +
            "      { \"mac\": \"00:1A:79:00:00:01\", \"watchdogTimeout\": 2000 },\n" +
            "      { \"mac\": \"00:1A:79:00:00:02\", \"watchdogTimeout\": 0 },\n" +
            "      { \"mac\": \"00:1A:79:00:00:03\" }\n" +
            "    ]\n" +
            "  },\n" +
            "  {\n" +
            "    \"id\": \"p2\",\n" +
            "    \"name\": \"Second\",\n" +
            "    \"url\": \"http://second/c/\",\n" +
            "    \"proxy\": \"http://proxy:8080\",\n" +
            "    \"enabled\": false\n" +
            "  },\n" +
            "  { \"name\": \"No id\" }\n" +
            "]";

    private File directory;
    private File file;

    @BeforeMethod(groups = { "portal" })
    public void setUp() throws IOException {
        directory = Files.createTempDirectory("macgate_portals").toFile();
        file = new File(directory, "portals.json");
        Files.write(file.toPath(), PORTALS.getBytes(StandardCharsets.UTF_8));
    }

    @AfterMethod(groups = { "portal" })
    public void tearDown() {
        Util.deleteRecursively(directory);
    }

    private static List<String> macs(Portal portal) {
        List<String> returnValue = new ArrayList<>();
        for (MacRecord mac : portal.getMacs()) {
            returnValue.add(mac.getMac());
        }
        return returnValue;
    }

    @Test(groups = { "portal", "json" })
    public void loadsPortals() throws IOException {
        JsonPortalStore store = new JsonPortalStore(file);
        store.load();

        List<Portal> portals = store.getPortals();
        assertEquals(portals.size(), 2);

        Portal first = store.getPortal("p1");
        assertEquals(first.getName(), "First");
        assert first.getProxy() == null;
        assert first.getStreamsPerMac() == 2;
        assert first.isEnabled();
        assert first.getMac("00:1a:79:00:00:01").getWatchdogTimeout() == 2000;
        assertEquals(macs(first).size(), 3);

        Portal second = store.getPortal("p2");
        assertEquals(second.getProxy(), "http://proxy:8080");
        assert !second.isEnabled();
        assert second.getStreamsPerMac() == 1;
        assert second.getMacs().isEmpty();

        assert store.getPortal("missing") == null;
    }

    @Test(groups = { "portal", "json" })
    public void returnedPortalsAreCopies() throws IOException {
        JsonPortalStore store = new JsonPortalStore(file);
        store.load();

        Portal copy = store.getPortal("p1");
        copy.getMacs().clear();
        copy.setName("Changed");

        assertEquals(store.getPortal("p1").getName(), "First");
        assertEquals(macs(store.getPortal("p1")).size(), 3);
    }

    @Test(groups = { "portal", "json" })
    public void moveMacIsPersisted() throws IOException {
        JsonPortalStore store = new JsonPortalStore(file);
        store.load();

        assert store.moveMac("p1", "00:1A:79:00:00:01");
        assert !store.moveMac("p1", "00:1A:79:00:00:99");
        assert !store.moveMac("missing", "00:1A:79:00:00:01");

        List<String> expected = Arrays.asList("00:1A:79:00:00:02", "00:1A:79:00:00:03", "00:1A:79:00:00:01");
        assertEquals(macs(store.getPortal("p1")), expected);

        JsonPortalStore reloaded = new JsonPortalStore(file);
        reloaded.load();
        assertEquals(macs(reloaded.getPortal("p1")), expected);
        assert !new File(directory, "portals.json.tmp").exists();
    }

    @Test(groups = { "portal", "json" })
    public void expiryIsPersisted() throws IOException {
        JsonPortalStore store = new JsonPortalStore(file);
        store.load();

        store.updateMacExpiry("p1", "00:1A:79:00:00:02", "March 3, 2031");

        JsonPortalStore reloaded = new JsonPortalStore(file);
        reloaded.load();
        assertEquals(reloaded.getPortal("p1").getMac("00:1A:79:00:00:02").getExpiry(), "March 3, 2031");
    }

    @Test(groups = { "portal", "json" })
    public void missingFileIsEmpty() throws IOException {
        JsonPortalStore store = new JsonPortalStore(new File(directory, "none.json"));
        store.load();

        assert store.getPortals().isEmpty();
    }

    @Test(groups = { "portal", "json" }, expectedExceptions = IOException.class)
    public void brokenFileFails() throws IOException {
        Files.write(file.toPath(), "[ { \"id\": ".getBytes(StandardCharsets.UTF_8));

        new JsonPortalStore(file).load();
    }
}
