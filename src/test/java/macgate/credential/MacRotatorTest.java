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
import macgate.portal.MemoryPortalStore;
import macgate.portal.Portal;
import macgate.portal.PortalLocks;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.testng.Assert.assertEquals;

public class MacRotatorTest {

    public static final Executor DIRECT = new Executor() {
        @Override
        public void execute(Runnable command) {
            command.run();
        }
    };

    private static MemoryPortalStore store(String... macs) {
        MemoryPortalStore store = new MemoryPortalStore();
        Portal portal = new Portal("p1", "Portal", "http://portal/");
        List<MacRecord> records = new ArrayList<>();
        for (String mac : macs) {
            records.add(new MacRecord(mac, 0));
        }
        portal.setMacs(records);
        store.addPortal(portal);
        return store;
    }

    private static List<String> order(MemoryPortalStore store) {
        List<String> returnValue = new ArrayList<>();
        for (MacRecord mac : store.getPortal("p1").getMacs()) {
            returnValue.add(mac.getMac());
        }
        return returnValue;
    }

    @Test(groups = { "credential", "rotation" })
    public void failedMacsMoveToTheEndOnce() {
        MemoryPortalStore store = store("A", "B", "C", "D");
        MacRotator rotator = new MacRotator(store, new PortalLocks(), DIRECT);

        rotator.rotate("p1", Arrays.asList("B", "A", "B"));

        assertEquals(order(store), Arrays.asList("C", "D", "B", "A"));
        assertEquals(store.getMoves(), Arrays.asList("p1/B", "p1/A"));
    }

    @Test(groups = { "credential", "rotation" })
    public void unknownMacsAndWriteFailuresAreTolerated() {
        MemoryPortalStore store = store("A", "B");
        MacRotator rotator = new MacRotator(store, new PortalLocks(), DIRECT);

        rotator.rotate("p1", Arrays.asList("Z"));
        rotator.rotate("missing", Arrays.asList("A"));
        assertEquals(order(store), Arrays.asList("A", "B"));

        store.setFailWrites(true);
        rotator.rotate("p1", Arrays.asList("A"));
        assertEquals(order(store), Arrays.asList("A", "B"));
    }

    @Test(groups = { "credential", "rotation" })
    public void rejectedExecutionIsLogged() {
        MemoryPortalStore store = store("A", "B");
        MacRotator rotator = new MacRotator(store, new PortalLocks(), new Executor() {
            @Override
            public void execute(Runnable command) {
                throw new RejectedExecutionException("shut down");
            }
        });

        rotator.rotate("p1", Arrays.asList("A"));
        assert store.getMoves().isEmpty();
    }
}
