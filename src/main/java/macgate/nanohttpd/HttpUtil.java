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

import com.google.gson.Gson;
import fi.iki.elonen.NanoHTTPD;
import macgate.nanohttpd.pojo.JsonException;
import macgate.stream.FailureReason;

import java.util.List;
import java.util.Map;

public class HttpUtil {
    private static final Gson gson = new Gson();

    public static final NanoHTTPD.Response.IStatus FOUND = new NanoHTTPD.Response.IStatus() {
        @Override
        public String getDescription() {
            return "302 Found";
        }

        @Override
        public int getRequestStatus() {
            return 302;
        }
    };

    public static final NanoHTTPD.Response.IStatus SERVICE_UNAVAILABLE = new NanoHTTPD.Response.IStatus() {
        @Override
        public String getDescription() {
            return "503 Service Unavailable";
        }

        @Override
        public int getRequestStatus() {
            return 503;
        }
    };

    public static NanoHTTPD.Response.IStatus statusFor(FailureReason reason) {
        if (reason.HTTP_STATUS == 404) {
            return NanoHTTPD.Response.Status.NOT_FOUND;
        }

        return SERVICE_UNAVAILABLE;
    }

    public static NanoHTTPD.Response redirect(String location) {
        NanoHTTPD.Response response = NanoHTTPD.newFixedLengthResponse(FOUND, NanoHTTPD.MIME_PLAINTEXT, "");
        response.addHeader("Location", location);
        return response;
    }

    public static NanoHTTPD.Response plainText(NanoHTTPD.Response.IStatus status, String message) {
        return NanoHTTPD.newFixedLengthResponse(status, NanoHTTPD.MIME_PLAINTEXT, message);
    }

    public static NanoHTTPD.Response returnException(String object, String message) {
        return NanoHTTPD.newFixedLengthResponse(
                NanoHTTPD.Response.Status.NOT_FOUND, "application/json",
                gson.toJson(new JsonException(object, message)));
    }

    /**
     * @return The first value of a query parameter or <i>null</i>.
     */
    public static String getParameter(NanoHTTPD.IHTTPSession session, String name) {
        Map<String, List<String>> parameters = session.getParameters();
        List<String> values = parameters.get(name);

        if (values == null || values.isEmpty()) {
            return null;
        }

        return values.get(0);
    }
}
