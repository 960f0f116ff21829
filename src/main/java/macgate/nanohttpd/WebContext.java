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

package macgate.nanohttpd;

import macgate.credential.OccupancyRegistry;
import macgate.hls.HlsFileWaiter;
import macgate.hls.HlsStreamManager;
import macgate.jobs.JobManager;
import macgate.portal.PortalStore;
import macgate.stream.DirectStreamService;

/**
 * Everything the request handlers need. Passed to every route as its init parameter.
 */
public class WebContext {
    private final PortalStore portalStore;
    private final DirectStreamService directStreams;
    private final HlsStreamManager hlsStreams;
    private final HlsFileWaiter hlsFileWaiter;
    private final JobManager jobManager;
    private final OccupancyRegistry occupancy;

    public WebContext(PortalStore portalStore, DirectStreamService directStreams, HlsStreamManager hlsStreams,
                      HlsFileWaiter hlsFileWaiter, JobManager jobManager, OccupancyRegistry occupancy) {

        this.portalStore = portalStore;
        this.directStreams = directStreams;
        this.hlsStreams = hlsStreams;
        this.hlsFileWaiter = hlsFileWaiter;
        this.jobManager = jobManager;
        this.occupancy = occupancy;
    }

    public PortalStore getPortalStore() {
        return portalStore;
    }

    public DirectStreamService getDirectStreams() {
        return directStreams;
    }

    public HlsStreamManager getHlsStreams() {
        return hlsStreams;
    }

    public HlsFileWaiter getHlsFileWaiter() {
        return hlsFileWaiter;
    }

    public JobManager getJobManager() {
        return jobManager;
    }

    public OccupancyRegistry getOccupancy() {
        return occupancy;
    }
}
