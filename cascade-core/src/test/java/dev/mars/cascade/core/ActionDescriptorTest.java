package dev.mars.cascade.core;

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

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionDescriptorTest {

    @Test
    void builderCapturesEveryField() {
        ActionDescriptor descriptor = ActionDescriptor.builder("deploy")
                .kind("shell")
                .parameter("command", "make deploy")
                .dependsOn("build", "test")
                .declaresOutcomes("url")
                .description("Push to staging")
                .build();

        assertThat(descriptor.getId()).isEqualTo("deploy");
        assertThat(descriptor.getKind()).isEqualTo("shell");
        assertThat(descriptor.getParameters()).containsEntry("command", "make deploy");
        assertThat(descriptor.getDependencies()).containsExactly("build", "test");
        assertThat(descriptor.getDeclaredOutcomes()).containsExactly("url");
        assertThat(descriptor.getDescription()).contains("Push to staging");
    }

    @Test
    void collectionsAreImmutable() {
        ActionDescriptor descriptor = ActionDescriptor.builder("a").kind("echo")
                .parameters(Map.of("message", "hi"))
                .dependsOn(List.of("b"))
                .build();

        assertThatThrownBy(() -> descriptor.getParameters().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> descriptor.getDependencies().add("c"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void duplicateDependenciesCollapse() {
        ActionDescriptor descriptor = ActionDescriptor.builder("a").kind("echo")
                .dependsOn("b", "c", "b")
                .build();

        assertThat(descriptor.getDependencies()).containsExactly("b", "c");
    }

    @Test
    void blankIdOrKindIsRejected() {
        assertThatThrownBy(() -> ActionDescriptor.builder(" ").kind("echo").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ActionDescriptor.builder("a").kind("").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void strictDependenciesAreAlsoDependencies() {
        ActionDescriptor descriptor = ActionDescriptor.builder("a").kind("echo")
                .dependsOn("b")
                .dependsOnStrictly("c")
                .build();

        assertThat(descriptor.getDependencies()).containsExactly("b", "c");
        assertThat(descriptor.getStrictDependencies()).containsExactly("c");
    }

    @Test
    void severityDefaultsToNormal() {
        assertThat(ActionDescriptor.builder("a").kind("echo").build().getSeverity()).isEqualTo(ActionSeverity.NORMAL);
        assertThat(ActionSeverity.fromValue("low")).isEqualTo(ActionSeverity.LOW);
        assertThatThrownBy(() -> ActionSeverity.fromValue("high"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid severity: 'high' (expected one of: low, normal)");
    }

    @Test
    void missingDescriptionIsEmpty() {
        assertThat(ActionDescriptor.builder("a").kind("echo").build().getDescription()).isEmpty();
    }
}
