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
import java.util.List;

public interface PortalStore {

    /**
     * @return Copies of all portals in the order they are stored.
     */
    List<Portal> getPortals();

    /**
     * @return A copy of the portal or <i>null</i> if it doesn't exist.
     */
    Portal getPortal(String portalId);

    /**
     * Moves a MAC to the end of the portal's ordered MAC list and persists the change.
     *
     * @return <i>false</i> if the portal or MAC doesn't exist.
     * @throws IOException If the change could not be persisted.
     */
    boolean moveMac(String portalId, String mac) throws IOException;

    /**
     * Records the expiry date reported by the portal for a MAC and persists the change.
     *
     * @throws IOException If the change could not be persisted.
     */
    void updateMacExpiry(String portalId, String mac, String expiry) throws IOException;
}
