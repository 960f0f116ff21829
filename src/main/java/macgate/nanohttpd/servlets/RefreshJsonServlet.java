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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import fi.iki.elonen.NanoHTTPD;
import fi.iki.elonen.router.RouterNanoHTTPD;
import macgate.jobs.JobManager;
import macgate.nanohttpd.HttpUtil;
import macgate.nanohttpd.WebContext;
import macgate.portal.Portal;

import java.util.Map;

/**
 * Triggers background refreshes.
 */
public class RefreshJsonServlet {
    private static final Gson gson;

    static {
        GsonBuilder gsonBuilder = new GsonBuilder();
        gsonBuilder.setPrettyPrinting();
        gson = gsonBuilder.create();
    }

    private static NanoHTTPD.Response json(JsonObject object) {
        return NanoHTTPD.newFixedLengthResponse(NanoHTTPD.Response.Status.OK, "application/json", gson.toJson(object));
    }

    private static String reason(NanoHTTPD.IHTTPSession session) {
        String reason = HttpUtil.getParameter(session, "reason");
        return reason == null ? "manual" : reason;
    }

    public static class PortalRefresh extends RouterNanoHTTPD.DefaultHandler {
        @Override
        public String getText() {
            return "error";
        }

        @Override
        public String getMimeType() {
            return "application/json";
        }

        @Override
        public NanoHTTPD.Response.IStatus getStatus() {
            return NanoHTTPD.Response.Status.OK;
        }

        @Override
        public NanoHTTPD.Response get(RouterNanoHTTPD.UriResource uriResource, Map<String, String> urlParams, NanoHTTPD.IHTTPSession session) {
            WebContext context = uriResource.initParameter(WebContext.class);
            String portalId = urlParams.get("portal");

            Portal portal = context.getPortalStore().getPortal(portalId);
            if (portal == null) {
                return HttpUtil.returnException(portalId, "The portal '" + portalId + "' does not exist.");
            }

            String status = context.getJobManager().enqueueRefreshPortal(portalId, reason(session));

            JsonObject newObject = new JsonObject();
            newObject.addProperty("portal", portalId);
            newObject.addProperty("status", status);
            return json(newObject);
        }
    }

    public static class All extends RouterNanoHTTPD.DefaultHandler {
        @Override
        public String getText() {
            return "error";
        }

        @Override
        public String getMimeType() {
            return "application/json";
        }

        @Override
        public NanoHTTPD.Response.IStatus getStatus() {
            return NanoHTTPD.Response.Status.OK;
        }

        @Override
        public NanoHTTPD.Response get(RouterNanoHTTPD.UriResource uriResource, Map<String, String> urlParams, NanoHTTPD.IHTTPSession session) {
            WebContext context = uriResource.initParameter(WebContext.class);
            int queued = context.getJobManager().enqueueRefreshAll(reason(session));

            JsonObject newObject = new JsonObject();
            newObject.addProperty("queued", queued);
            return json(newObject);
        }
    }

    public static class Epg extends RouterNanoHTTPD.DefaultHandler {
        @Override
        public String getText() {
            return "error";
        }

        @Override
        public String getMimeType() {
            return "application/json";
        }

        @Override
        public NanoHTTPD.Response.IStatus getStatus() {
            return NanoHTTPD.Response.Status.OK;
        }

        @Override
        public NanoHTTPD.Response get(RouterNanoHTTPD.UriResource uriResource, Map<String, String> urlParams, NanoHTTPD.IHTTPSession session) {
            WebContext context = uriResource.initParameter(WebContext.class);
            JobManager jobManager = context.getJobManager();

            JsonObject newObject = new JsonObject();
            newObject.addProperty("status", jobManager.enqueueEpgRefresh(reason(session)));
            return json(newObject);
        }
    }
}
