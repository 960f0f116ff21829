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

package macgate.config;

import macgate.jobs.EpgRefresher;
import macgate.jobs.LoggingEpgRefresher;
import macgate.portal.FakePortalClient;
import macgate.portal.PortalClient;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class ConfigTest {

    @Test(groups = { "config", "properties" })
    public void typedValuesFallBackToDefaults() {
        Config.setString("test.boolean", "1");
        Config.setString("test.integer", " 42 ");
        Config.setString("test.double", "abc");

        assert Config.getBoolean("test.boolean", false);
        assert Config.getInteger("test.integer", 0) == 42;
        assert Config.getDouble("test.double", 0.5) == 0.5;
        assert Config.getInteger("test.unset_integer", 7) == 7;

        // Defaults are written back so they show up in the saved file.
        assertEquals(Config.getString("test.unset_integer"), "7");
        assertEquals(Config.getString("test.double"), "0.5");
    }

    @Test(groups = { "config", "instances" })
    public void collaboratorsAreCreatedByName() {
        Config.setString("test.client_class", FakePortalClient.class.getName());

        PortalClient client = Config.getInstance("test.client_class", PortalClient.class, null);
        assert client instanceof FakePortalClient;
    }

    @Test(groups = { "config", "instances" })
    public void unusableClassesUseTheDefault() {
        LoggingEpgRefresher defaultValue = new LoggingEpgRefresher();

        Config.setString("test.missing_class", "macgate.DoesNotExist");
        assert Config.getInstance("test.missing_class", EpgRefresher.class, defaultValue) == defaultValue;

        // The class exists but is the wrong type.
        Config.setString("test.wrong_class", FakePortalClient.class.getName());
        assert Config.getInstance("test.wrong_class", EpgRefresher.class, defaultValue) == defaultValue;

        assert Config.getInstance("test.unset_class", PortalClient.class, null) == null;
        assert Config.getInstance("test.unset_refresher", EpgRefresher.class, defaultValue) == defaultValue;
        assertEquals(Config.getString("test.unset_refresher"), LoggingEpgRefresher.class.getName());
    }

    @Test(groups = { "config", "settings" })
    public void streamingSettingsDefaults() {
        StreamingSettings settings = new StreamingSettings();

        assert settings.isTryAllMacs();
        assert settings.isTestStreams();
        assert !settings.isParallelProbing();
        assert !settings.isRedirect();
        assert !settings.isHlsOutput();
        assert settings.getProbeRoundTimeout() == 20;

        settings.setFfmpegTimeout(10);
        assert settings.getProbeRoundTimeout() == 35;

        settings.setMethod(StreamingSettings.METHOD_REDIRECT);
        settings.setOutputFormat(StreamingSettings.OUTPUT_HLS);
        assert settings.isRedirect();
        assert settings.isHlsOutput();
    }
}
