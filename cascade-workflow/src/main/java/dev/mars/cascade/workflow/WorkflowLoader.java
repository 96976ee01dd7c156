package dev.mars.cascade.workflow;

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

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Turns a workflow document into a {@link WorkflowDefinition}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-24
 * @version 1.0
 */
public interface WorkflowLoader {

    WorkflowDefinition load(Path file) throws WorkflowLoadException;

    /**
     * Reads the whole stream; does not close it.
     */
    WorkflowDefinition load(InputStream input, String sourceName) throws WorkflowLoadException;

    WorkflowDefinition loadFromString(String content, String sourceName) throws WorkflowLoadException;

    default WorkflowDefinition loadFromString(String content) throws WorkflowLoadException {
        return loadFromString(content, "<string>");
    }

    /**
     * Loads from a located source, reading {@code stdin} when the source is standard input.
     */
    default WorkflowDefinition load(WorkflowSource source, InputStream stdin) throws WorkflowLoadException {
        if (source.isStdin()) {
            return load(stdin, source.getName());
        }
        return load(source.getPath());
    }
}
