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

import dev.mars.cadence.core.Workflow;
import dev.mars.cadence.core.validation.ValidationResult;

import java.nio.file.Path;

/**
 * Reads workflow definitions into validated, executable workflows.
 */
public interface WorkflowDefinitionParser {

    Workflow parse(Path definitionFile) throws WorkflowParseException;

    Workflow parseFromString(String content) throws WorkflowParseException;

    /**
     * Checks the document's top-level structure without building a workflow.
     *
     * @param content the definition text
     * @return validation result
     */
    ValidationResult validateSchema(String content);
}
