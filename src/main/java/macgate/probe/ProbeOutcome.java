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

package macgate.probe;

import macgate.stream.FailureReason;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of one probe round.
 */
public class ProbeOutcome {
    private final ProbeResult result;
    private final Map<String, FailureReason> failures;
    private final boolean anyMacFree;

    public ProbeOutcome(ProbeResult result, Map<String, FailureReason> failures, boolean anyMacFree) {
        this.result = result;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.anyMacFree = anyMacFree;
    }

    /**
     * @return The winning MAC or <i>null</i> if every candidate failed.
     */
    public ProbeResult getResult() {
        return result;
    }

    public boolean isFound() {
        return result != null;
    }

    /**
     * @return The MACs that failed in the order they failed and why.
     */
    public Map<String, FailureReason> getFailures() {
        return failures;
    }

    /**
     * @return <i>true</i> if at least one MAC had a free playback slot.
     */
    public boolean isAnyMacFree() {
        return anyMacFree;
    }

    /**
     * @return Why the round didn't produce a stream.
     */
    public FailureReason getExhaustionReason() {
        return anyMacFree ? FailureReason.NO_WORKING_STREAM : FailureReason.CREDENTIAL_UNAVAILABLE;
    }
}
