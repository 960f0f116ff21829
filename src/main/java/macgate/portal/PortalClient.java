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

package macgate.portal;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * The upstream portal protocol.
 * <p/>
 * Every method may return <i>null</i> when the portal gives no usable answer or throw an
 * {@link IOException} when the portal could not be reached. Callers treat both as a failure of
 * the MAC that was used.
 */
public interface PortalClient {

    String getToken(String url, String mac, String proxy) throws IOException;

    /**
     * Keep-alive call that must be made after getting a token. The result is not used for
     * streaming.
     */
    Map<String, String> getProfile(String url, String mac, String token, String proxy) throws IOException;

    List<PortalChannel> getAllChannels(String url, String mac, String token, String proxy) throws IOException;

    Map<String, String> getGenreNames(String url, String mac, String token, String proxy) throws IOException;

    /**
     * Resolves a channel command that points at the portal itself into a playable link.
     */
    String getLink(String url, String mac, String token, String cmd, String proxy) throws IOException;

    /**
     * @return A human readable expiry date for the MAC.
     */
    String getExpires(String url, String mac, String token, String proxy) throws IOException;
}
