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

package macgate.jobs;

public class PortalStats {
    private final int totalChannels;
    private final int totalGenres;
    private final int totalMacs;
    private final int workingMacs;

    public PortalStats(int totalChannels, int totalGenres, int totalMacs, int workingMacs) {
        this.totalChannels = totalChannels;
        this.totalGenres = totalGenres;
        this.totalMacs = totalMacs;
        this.workingMacs = workingMacs;
    }

    public int getTotalChannels() {
        return totalChannels;
    }

    public int getTotalGenres() {
        return totalGenres;
    }

    public int getTotalMacs() {
        return totalMacs;
    }

    // MACs that listed at least one channel during the last refresh.
    public int getWorkingMacs() {
        return workingMacs;
    }
}
