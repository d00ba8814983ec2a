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

package dev.mars.cadence.workflow.parser;

/**
 * Exception thrown when a workflow definition cannot be read or turned into a workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowParseException extends Exception {

    private final String fieldPath;

    public WorkflowParseException(String message) {
        super(message);
        this.fieldPath = null;
    }

    public WorkflowParseException(String message, Throwable cause) {
        super(message, cause);
        this.fieldPath = null;
    }

    public WorkflowParseException(String fieldPath, String message) {
        super(message);
        this.fieldPath = fieldPath;
    }

    public WorkflowParseException(String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.fieldPath = fieldPath;
    }

    /**
     * @return dotted path of the offending field, e.g. {@code spec.stages[0].tasks[1].capability}
     */
    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * @return the message without the field prefix
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (fieldPath == null) {
            return super.getMessage();
        }
        return "Field '" + fieldPath + "': " + super.getMessage();
    }
}
