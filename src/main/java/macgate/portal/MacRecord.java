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

/**
 * One device identity on a portal.
 */
public class MacRecord {
    private String mac;
    private String expiry;
    private int watchdogTimeout;
    private int playbackLimit;

    public MacRecord() {
    }

    public MacRecord(String mac, int watchdogTimeout) {
        this.mac = mac;
        this.watchdogTimeout = watchdogTimeout;
    }

    public String getMac() {
        return mac;
    }

    public void setMac(String mac) {
        this.mac = mac;
    }

    public String getExpiry() {
        return expiry;
    }

    public void setExpiry(String expiry) {
        this.expiry = expiry;
    }

    /**
     * @return Seconds since the portal last saw activity on this MAC. Higher means more idle.
     */
    public int getWatchdogTimeout() {
        return watchdogTimeout;
    }

    public void setWatchdogTimeout(int watchdogTimeout) {
        this.watchdogTimeout = watchdogTimeout;
    }

    // Advisory only. Nothing enforces this value.
    public int getPlaybackLimit() {
        return playbackLimit;
    }

    public void setPlaybackLimit(int playbackLimit) {
        this.playbackLimit = playbackLimit;
    }

    public MacRecord copy() {
        MacRecord returnValue = new MacRecord(mac, watchdogTimeout);
        returnValue.expiry = expiry;
        returnValue.playbackLimit = playbackLimit;
        return returnValue;
    }

    @Override
    public String toString() {
        return mac;
    }
}
