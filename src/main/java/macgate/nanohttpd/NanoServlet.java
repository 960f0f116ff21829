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

import fi.iki.elonen.router.RouterNanoHTTPD;
import macgate.nanohttpd.servlets.*;

public class NanoServlet extends RouterNanoHTTPD {
    private final WebContext context;

    public NanoServlet(int port, WebContext context) {
        super(port);
        this.context = context;
        addMappings();
    }

    @Override
    public void addMappings() {
        super.addMappings();

        // GET: Get program version and path information.
        addRoute("/version", VersionJsonServlet.List.class);

        // GET: Continuous stream for a portal channel. ?web=true requests browser friendly output.
        addRoute("/play/:portal/:channel", PlayServlet.Get.class, context);

        // GET: HLS master playlist, variant playlist or segment for a portal channel.
        addRoute("/hls/:portal/:channel/:file", HlsServlet.Get.class, context);

        // GET: Queue a channel refresh for one portal. ?reason= is recorded with the job.
        addRoute("/api/refresh/:portal", RefreshJsonServlet.PortalRefresh.class, context);
        // GET: Queue a channel refresh for every enabled portal.
        addRoute("/api/refresh", RefreshJsonServlet.All.class, context);
        // GET: Queue a guide refresh.
        addRoute("/api/epg/refresh", RefreshJsonServlet.Epg.class, context);

        // GET: Refresh and match status for one portal.
        addRoute("/api/status/:portal", StatusJsonServlet.PortalStatus.class, context);
        // GET: Guide refresh status.
        addRoute("/api/epg/status", StatusJsonServlet.EpgStatus.class, context);

        // GET: Occupied playback slots and active HLS streams.
        addRoute("/api/streams", StreamsJsonServlet.List.class, context);
    }
}
