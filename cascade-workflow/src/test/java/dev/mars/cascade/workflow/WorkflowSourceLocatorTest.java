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
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowSourceLocatorTest {

    @TempDir
    Path workDir;

    @Test
    void dashMeansStdin() throws WorkflowSourceException {
        WorkflowSource source = new WorkflowSourceLocator(workDir).locate("-");

        assertThat(source.isStdin()).isTrue();
        assertThat(source.getName()).isEqualTo("<stdin>");
        assertThatThrownBy(source::getPath).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void explicitFileIsResolvedAgainstWorkingDirectory() throws Exception {
        Files.writeString(workDir.resolve("deploy.yaml"), "actions: []");

        WorkflowSource source = new WorkflowSourceLocator(workDir).locate("deploy.yaml");

        assertThat(source.isStdin()).isFalse();
        assertThat(source.getPath()).isEqualTo(workDir.resolve("deploy.yaml"));
    }

    @Test
    void explicitFileMustExist() {
        assertThatThrownBy(() -> new WorkflowSourceLocator(workDir).locate("nope.yml"))
                .isInstanceOf(WorkflowSourceException.class)
                .hasMessageStartingWith("Given workflow file does not exist");
    }

    @Test
    void explicitFileMustHaveYamlSuffix() throws IOException {
        Files.writeString(workDir.resolve("workflow.json"), "{}");

        assertThatThrownBy(() -> new WorkflowSourceLocator(workDir).locate("workflow.json"))
                .isInstanceOf(WorkflowSourceException.class)
                .hasMessageStartingWith("Unrecognized source");
    }

    @Test
    void scanFindsSingleDefaultFile() throws Exception {
        Files.writeString(workDir.resolve("cascade.yaml"), "actions: []");

        assertThat(new WorkflowSourceLocator(workDir).locate(null).getPath())
                .isEqualTo(workDir.resolve("cascade.yaml"));
        assertThat(new WorkflowSourceLocator(workDir).locate("  ").getPath())
                .isEqualTo(workDir.resolve("cascade.yaml"));
    }

    @Test
    void scanRejectsBothDefaultFiles() throws IOException {
        Files.writeString(workDir.resolve("cascade.yml"), "actions: []");
        Files.writeString(workDir.resolve("cascade.yaml"), "actions: []");

        assertThatThrownBy(() -> new WorkflowSourceLocator(workDir).locate(null))
                .isInstanceOf(WorkflowSourceException.class)
                .hasMessageStartingWith("Multiple workflow sources detected");
    }

    @Test
    void scanRejectsEmptyDirectory() {
        assertThatThrownBy(() -> new WorkflowSourceLocator(workDir).locate(null))
                .isInstanceOf(WorkflowSourceException.class)
                .hasMessageStartingWith("No workflow source detected");
    }
}
