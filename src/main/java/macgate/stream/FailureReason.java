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

package macgate.stream;

public enum FailureReason {
    // No MAC had a free playback slot.
    CREDENTIAL_UNAVAILABLE(503),
    // At least one MAC had a free slot, but none of them produced a working stream.
    NO_WORKING_STREAM(503),
    AUTH_FAILURE(503),
    CHANNEL_RESOLUTION_FAILURE(503),
    LINK_RESOLUTION_FAILURE(503),
    STREAM_LIVENESS_FAILURE(503),
    PROCESS_CRASH(503),
    ADMISSION_REJECTED(503),
    FILE_NOT_READY(404),
    PORTAL_NOT_FOUND(404);

    public final int HTTP_STATUS;

    FailureReason(int httpStatus) {
        HTTP_STATUS = httpStatus;
    }
}
