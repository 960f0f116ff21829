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

/**
 * A channel as listed by the portal for one MAC.
 */
public class PortalChannel {
    private final String id;
    private final String name;
    private final String cmd;
    private final String genreId;

    public PortalChannel(String id, String name, String cmd, String genreId) {
        this.id = id;
        this.name = name;
        this.cmd = cmd;
        this.genreId = genreId;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCmd() {
        return cmd;
    }

    public String getGenreId() {
        return genreId;
    }
}
