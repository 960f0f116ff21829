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
import macgate.config.Config;
import macgate.config.StaticConfig;

public class VersionJsonServlet {
    /**
     * Increment this value whenever any breaking changes are made. Do not increment if a feature
     * was added, but all previous functionality has not changed.
     */
    public final static int JSON_VERSION = 1;

    private static final Gson gson;

    static {
        GsonBuilder gsonBuilder = new GsonBuilder();
        gsonBuilder.setPrettyPrinting();
        gson = gsonBuilder.create();
    }

    public static class List extends RouterNanoHTTPD.DefaultHandler {
        @Override
        public String getText() {
            JsonObject newObject = new JsonObject();

            newObject.addProperty("versionProgram", StaticConfig.VERSION_PROGRAM);
            newObject.addProperty("versionConfig", StaticConfig.VERSION_CONFIG);
            newObject.addProperty("configDir", Config.CONFIG_DIR);
            newObject.addProperty("logDir", Config.LOG_DIR);
            newObject.addProperty("versionJson", JSON_VERSION);

            return gson.toJson(newObject);
        }

        @Override
        public String getMimeType() {
            return "application/json";
        }

        @Override
        public NanoHTTPD.Response.IStatus getStatus() {
            return NanoHTTPD.Response.Status.OK;
        }
    }
}
