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

import fi.iki.elonen.NanoHTTPD;
import macgate.stream.FailureReason;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class HttpUtilTest {

    @Test(groups = { "nanohttpd", "status" })
    public void failuresMapToStatusCodes() {
        for (FailureReason reason : FailureReason.values()) {
            assertEquals(HttpUtil.statusFor(reason).getRequestStatus(), reason.HTTP_STATUS, reason.name());
        }

        assertEquals(HttpUtil.statusFor(FailureReason.PORTAL_NOT_FOUND), NanoHTTPD.Response.Status.NOT_FOUND);
        assertEquals(HttpUtil.statusFor(FailureReason.CREDENTIAL_UNAVAILABLE).getRequestStatus(), 503);
        assertEquals(HttpUtil.statusFor(FailureReason.NO_WORKING_STREAM).getRequestStatus(), 503);
    }

    @Test(groups = { "nanohttpd", "status" })
    public void redirectSetsLocation() {
        NanoHTTPD.Response response = HttpUtil.redirect("http://upstream/live.ts");

        assertEquals(response.getStatus().getRequestStatus(), 302);
        assertEquals(response.getHeader("Location"), "http://upstream/live.ts");
    }

    @Test(groups = { "nanohttpd", "status" })
    public void exceptionsAreJson() {
        NanoHTTPD.Response response = HttpUtil.returnException("p9", "The portal 'p9' does not exist.");

        assertEquals(response.getStatus(), NanoHTTPD.Response.Status.NOT_FOUND);
        assertEquals(response.getMimeType(), "application/json");
    }
}
