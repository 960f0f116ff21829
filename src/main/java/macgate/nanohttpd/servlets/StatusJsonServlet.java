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
import macgate.jobs.RefreshStatus;
import macgate.nanohttpd.HttpUtil;
import macgate.nanohttpd.WebContext;

import java.util.Map;

/**
 * Reports the state of background refreshes.
 */
public class StatusJsonServlet {
    private static final Gson gson;

    static {
        GsonBuilder gsonBuilder = new GsonBuilder();
        gsonBuilder.setPrettyPrinting();
        gsonBuilder.serializeNulls();
        gson = gsonBuilder.create();
    }

    public static class PortalStatus extends RouterNanoHTTPD.DefaultHandler {
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
            String portalId = urlParams.get("portal");

            if (context.getPortalStore().getPortal(portalId) == null) {
                return HttpUtil.returnException(portalId, "The portal '" + portalId + "' does not exist.");
            }

            JsonObject newObject = new JsonObject();
            newObject.addProperty("portal", portalId);
            newObject.add("refresh", gson.toJsonTree(jobManager.getPortalRefreshStatus(portalId), RefreshStatus.class));
            newObject.add("match", gson.toJsonTree(jobManager.getMatchStatus(portalId), RefreshStatus.class));

            return NanoHTTPD.newFixedLengthResponse(NanoHTTPD.Response.Status.OK, "application/json", gson.toJson(newObject));
        }
    }

    public static class EpgStatus extends RouterNanoHTTPD.DefaultHandler {
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

            return NanoHTTPD.newFixedLengthResponse(NanoHTTPD.Response.Status.OK, "application/json",
                    gson.toJson(context.getJobManager().getEpgStatus(), RefreshStatus.class));
        }
    }
}
