/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.cadence.core.exceptions;

import java.util.List;

/**
 * Raised when a stop-on-error stage fails and halts its workflow.
 */
public class StageFailureException extends CadenceException {

    private final String stageName;
    private final List<String> failedTaskIds;

    public StageFailureException(String stageName, List<String> failedTaskIds) {
        super("Stage " + stageName + " failed");
        this.stageName = stageName;
        this.failedTaskIds = failedTaskIds != null ? List.copyOf(failedTaskIds) : List.of();
    }

    public String getStageName() {
        return stageName;
    }

    public List<String> getFailedTaskIds() {
        return failedTaskIds;
    }
}
