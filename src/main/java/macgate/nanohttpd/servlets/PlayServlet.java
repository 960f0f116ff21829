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

package macgate.nanohttpd.servlets;

import fi.iki.elonen.NanoHTTPD;
import fi.iki.elonen.router.RouterNanoHTTPD;
import macgate.config.StreamingSettings;
import macgate.nanohttpd.HttpUtil;
import macgate.nanohttpd.WebContext;
import macgate.stream.DirectStreamService;
import macgate.stream.StreamException;
import macgate.stream.StreamSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

public class PlayServlet {
    private static final Logger logger = LogManager.getLogger(PlayServlet.class);

    public static class Get extends RouterNanoHTTPD.DefaultHandler {
        @Override
        public String getText() {
            return "error";
        }

        @Override
        public String getMimeType() {
            return NanoHTTPD.MIME_PLAINTEXT;
        }

        @Override
        public NanoHTTPD.Response.IStatus getStatus() {
            return NanoHTTPD.Response.Status.OK;
        }

        @Override
        public NanoHTTPD.Response get(RouterNanoHTTPD.UriResource uriResource, Map<String, String> urlParams, NanoHTTPD.IHTTPSession session) {
            WebContext context = uriResource.initParameter(WebContext.class);
            DirectStreamService streams = context.getDirectStreams();
            StreamingSettings settings = streams.getSettings();

            String portalId = urlParams.get("portal");
            String channelId = urlParams.get("channel");
            String client = session.getRemoteIpAddress();
            boolean web = "true".equalsIgnoreCase(HttpUtil.getParameter(session, "web"));

            logger.info("Stream request from {} for portal {} channel {}{}.",
                    client, portalId, channelId, web ? " (web)" : "");

            if (!web && settings.isHlsOutput()) {
                return HttpUtil.redirect("/hls/" + portalId + "/" + channelId + "/master.m3u8");
            }

            try {
                if (!web && settings.isRedirect()) {
                    return HttpUtil.redirect(streams.resolveLink(portalId, channelId, client));
                }

                StreamSession streamSession = streams.open(portalId, channelId, client, web);

                return NanoHTTPD.newChunkedResponse(NanoHTTPD.Response.Status.OK,
                        web ? "video/mp4" : "video/mp2t", streamSession.getInputStream());
            } catch (StreamException e) {
                logger.warn("Unable to stream portal {} channel {} to {}: {} ({})",
                        portalId, channelId, client, e.getMessage(), e.getReason());

                return HttpUtil.plainText(HttpUtil.statusFor(e.getReason()), e.getMessage());
            }
        }
    }
}
