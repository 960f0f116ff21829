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

import java.util.ArrayList;
import java.util.List;

/**
 * An upstream portal account and its ordered pool of MACs.
 * <p/>
 * The order of {@link #getMacs()} is significant. Rotation moves failing MACs to the end so they
 * are tried last.
 */
public class Portal {
    private String id;
    private String name;
    private String url;
    private String proxy;
    private int streamsPerMac = 1;
    private boolean enabled = true;
    private boolean autoMatch;
    private List<MacRecord> macs = new ArrayList<>();

    public Portal() {
    }

    public Portal(String id, String name, String url) {
        this.id = id;
        this.name = name;
        this.url = url;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    /**
     * @return The proxy URL or <i>null</i> if the portal is accessed directly.
     */
    public String getProxy() {
        if (proxy == null || proxy.trim().length() == 0) {
            return null;
        }

        return proxy;
    }

    public void setProxy(String proxy) {
        this.proxy = proxy;
    }

    /**
     * @return The number of concurrent streams each MAC allows. 0 means unlimited.
     */
    public int getStreamsPerMac() {
        return streamsPerMac;
    }

    public void setStreamsPerMac(int streamsPerMac) {
        this.streamsPerMac = streamsPerMac;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoMatch() {
        return autoMatch;
    }

    public void setAutoMatch(boolean autoMatch) {
        this.autoMatch = autoMatch;
    }

    public List<MacRecord> getMacs() {
        return macs;
    }

    public void setMacs(List<MacRecord> macs) {
        this.macs = macs == null ? new ArrayList<MacRecord>() : macs;
    }

    public MacRecord getMac(String mac) {
        for (MacRecord record : macs) {
            if (record.getMac().equalsIgnoreCase(mac)) {
                return record;
            }
        }

        return null;
    }

    /**
     * Creates a copy that can be read without holding the store lock.
     */
    public Portal copy() {
        Portal returnValue = new Portal(id, name, url);
        returnValue.proxy = proxy;
        returnValue.streamsPerMac = streamsPerMac;
        returnValue.enabled = enabled;
        returnValue.autoMatch = autoMatch;

        List<MacRecord> newMacs = new ArrayList<>(macs.size());
        for (MacRecord mac : macs) {
            newMacs.add(mac.copy());
        }
        returnValue.macs = newMacs;

        return returnValue;
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
