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
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import fi.iki.elonen.NanoHTTPD;
import fi.iki.elonen.router.RouterNanoHTTPD;
import macgate.credential.OccupiedSession;
import macgate.hls.HlsStream;
import macgate.nanohttpd.WebContext;

import java.util.Map;

/**
 * Lists occupied playback slots and active HLS streams.
 */
public class StreamsJsonServlet {
    private static final Gson gson;

    static {
        GsonBuilder gsonBuilder = new GsonBuilder();
        gsonBuilder.setPrettyPrinting();
        gson = gsonBuilder.create();
    }

    public static class List extends RouterNanoHTTPD.DefaultHandler {
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
            long now = System.currentTimeMillis();

            JsonArray occupied = new JsonArray();
            for (OccupiedSession occupiedSession : context.getOccupancy().snapshot()) {
                JsonObject newObject = new JsonObject();
                newObject.addProperty("portalId", occupiedSession.getPortalId());
                newObject.addProperty("portalName", occupiedSession.getPortalName());
                newObject.addProperty("mac", occupiedSession.getMac());
                newObject.addProperty("channelId", occupiedSession.getChannelId());
                newObject.addProperty("channelName", occupiedSession.getChannelName());
                newObject.addProperty("client", occupiedSession.getClientAddr());
                newObject.addProperty("startTime", occupiedSession.getStartTime());
                occupied.add(newObject);
            }

            JsonArray hls = new JsonArray();
            for (HlsStream stream : context.getHlsStreams().getStreams()) {
                JsonObject newObject = new JsonObject();
                newObject.addProperty("key", stream.getKey());
                newObject.addProperty("portalId", stream.getPortalId());
                newObject.addProperty("channelId", stream.getChannelId());
                newObject.addProperty("passthrough", stream.isPassthrough());
                newObject.addProperty("crashed", stream.isCrashed());
                newObject.addProperty("ageSeconds", (now - stream.getCreatedAt()) / 1000);
                newObject.addProperty("idleSeconds", (now - stream.getLastAccessed()) / 1000);
                hls.add(newObject);
            }

            JsonObject returnValue = new JsonObject();
            returnValue.add("occupied", occupied);
            returnValue.add("hls", hls);

            return NanoHTTPD.newFixedLengthResponse(NanoHTTPD.Response.Status.OK, "application/json", gson.toJson(returnValue));
        }
    }
}
