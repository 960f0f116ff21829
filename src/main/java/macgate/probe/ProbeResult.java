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

import macgate.credential.OccupiedSession;

/**
 * A MAC that produced a playable link.
 */
public class ProbeResult {
    private final String mac;
    private final String token;
    private final String link;
    private final String channelName;
    private final OccupiedSession reservation;

    public ProbeResult(String mac, String token, String link, String channelName, OccupiedSession reservation) {
        this.mac = mac;
        this.token = token;
        this.link = link;
        this.channelName = channelName;
        this.reservation = reservation;
    }

    public String getMac() {
        return mac;
    }

    public String getToken() {
        return token;
    }

    public String getLink() {
        return link;
    }

    public String getChannelName() {
        return channelName;
    }

    /**
     * @return The slot held for the winning MAC or <i>null</i> if no reservation was requested.
     *         The receiver is responsible for releasing it.
     */
    public OccupiedSession getReservation() {
        return reservation;
    }
}
