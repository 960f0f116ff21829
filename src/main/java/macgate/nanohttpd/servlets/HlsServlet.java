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
import macgate.hls.HlsFileWaiter;
import macgate.hls.HlsStream;
import macgate.hls.HlsStreamManager;
import macgate.nanohttpd.HttpUtil;
import macgate.nanohttpd.WebContext;
import macgate.portal.Portal;
import macgate.stream.FailureReason;
import macgate.stream.StreamException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.util.Map;

public class HlsServlet {
    private static final Logger logger = LogManager.getLogger(HlsServlet.class);

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
            HlsStreamManager manager = context.getHlsStreams();
            HlsFileWaiter waiter = context.getHlsFileWaiter();

            String portalId = urlParams.get("portal");
            String channelId = urlParams.get("channel");
            String filename = urlParams.get("file");

            Portal portal = context.getPortalStore().getPortal(portalId);
            if (portal == null || !portal.isEnabled()) {
                logger.error("Portal {} not found for HLS request.", portalId);
                return HttpUtil.plainText(NanoHTTPD.Response.Status.NOT_FOUND, "Portal not found");
            }

            logger.debug("HLS request from {} for portal {} channel {} file {}.",
                    session.getRemoteIpAddress(), portalId, channelId, filename);

            try {
                File file = null;
                HlsStream stream = manager.getStream(portalId, channelId);

                if (stream != null) {
                    file = filename.endsWith(".m3u8") ?
                            waiter.waitForFile(portalId, channelId, filename) :
                            manager.getFile(portalId, channelId, filename);
                }

                if (file == null && isStreamFile(filename)) {
                    try {
                        manager.openStream(portal, channelId);
                    } catch (StreamException e) {
                        logger.error("Could not start HLS stream for portal {} channel {}: {} ({})",
                                portalId, channelId, e.getMessage(), e.getReason());
                        return HttpUtil.plainText(HttpUtil.statusFor(e.getReason()), e.getMessage());
                    }

                    file = waiter.waitForFile(portalId, channelId, filename);
                }

                if (file == null) {
                    return HttpUtil.plainText(HttpUtil.statusFor(FailureReason.FILE_NOT_READY), "File not ready");
                }

                NanoHTTPD.Response response = NanoHTTPD.newFixedLengthResponse(NanoHTTPD.Response.Status.OK,
                        HlsFileWaiter.contentType(filename), new FileInputStream(file), file.length());

                if (filename.endsWith(".m3u8")) {
                    response.addHeader("Cache-Control", "no-cache");
                }

                return response;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return HttpUtil.plainText(HttpUtil.SERVICE_UNAVAILABLE, "Interrupted");
            } catch (FileNotFoundException e) {
                // The reaper removed the stream between the lookup and the read.
                return HttpUtil.plainText(HttpUtil.statusFor(FailureReason.FILE_NOT_READY), "File not ready");
            }
        }

        private static boolean isStreamFile(String filename) {
            return filename.endsWith(".m3u8") || filename.endsWith(".ts") || filename.endsWith(".m4s");
        }
    }
}
