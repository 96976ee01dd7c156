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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowLoadExceptionTest {

    @Test
    void testMessageOnly() {
        WorkflowLoadException e = new WorkflowLoadException("Broken");

        assertEquals("Broken", e.getMessage());
        assertNull(e.getSource());
        assertEquals(-1, e.getLineNumber());
        assertNull(e.getFieldPath());
    }

    @Test
    void testFullContext() {
        RuntimeException cause = new RuntimeException("root");
        WorkflowLoadException e = new WorkflowLoadException("cascade.yml", 7, "actions[2].name", "Bad name", cause);

        assertEquals("Workflow 'cascade.yml': Line 7: Field 'actions[2].name': Bad name", e.getMessage());
        assertEquals("Bad name", e.getProblem());
        assertSame(cause, e.getCause());
    }

    @Test
    void testSourceAndField() {
        WorkflowLoadException e = new WorkflowLoadException("<stdin>", "context", "Not a mapping");

        assertEquals("Workflow '<stdin>': Field 'context': Not a mapping", e.getMessage());
    }
}
