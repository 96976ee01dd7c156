package dev.mars.cascade.outcome;

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

import dev.mars.cascade.core.ActionState;
import dev.mars.cascade.core.exceptions.OutcomeConflictException;
import dev.mars.cascade.core.exceptions.RenderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("OutcomeRenderer")
class OutcomeRendererTest {

    private final OutcomeRenderer renderer = new OutcomeRenderer();
    private OutcomeLedger ledger;

    @BeforeEach
    void setUp() throws OutcomeConflictException {
        ledger = new OutcomeLedger();
        ledger.record("build", Map.of("version", "1.4.2", "image.tag", "v1"));
    }

    private RenderContext context(RenderingMode mode) {
        return RenderContext.builder(ledger)
                .actionIds(Set.of("build", "deploy", "status"))
                .states(id -> id.equals("build") ? ActionState.SUCCESS : ActionState.PENDING)
                .variables(Map.of("region", "eu-west-1"))
                .environment(name -> name.equals("HOME") ? "/home/ci" : null)
                .mode(mode)
                .build();
    }

    @Nested
    @DisplayName("resolution")
    class Resolution {

        @Test
        void shortOutcomeReference() throws RenderException {
            assertThat(renderer.render("v=@{build.version}", context(RenderingMode.STRICT))).isEqualTo("v=1.4.2");
        }

        @ParameterizedTest
        @ValueSource(strings = {"@{outcomes.build.version}", "@{out.build.version}", "@{ build . version }"})
        void outcomeReferenceVariants(String template) throws RenderException {
            assertThat(renderer.render(template, context(RenderingMode.STRICT))).isEqualTo("1.4.2");
        }

        @Test
        void dottedOutcomeKeyIsJoined() throws RenderException {
            assertThat(renderer.render("@{build.image.tag}", context(RenderingMode.STRICT))).isEqualTo("v1");
        }

        @Test
        void statusReferenceRendersStateName() throws RenderException {
            RenderContext ctx = context(RenderingMode.STRICT);
            assertThat(renderer.render("@{status.build}/@{status.deploy}", ctx)).isEqualTo("SUCCESS/PENDING");
        }

        @Test
        void contextAndEnvironment() throws RenderException {
            RenderContext ctx = context(RenderingMode.STRICT);
            assertThat(renderer.render("@{context.region} @{ctx.region}", ctx)).isEqualTo("eu-west-1 eu-west-1");
            assertThat(renderer.render("@{env.HOME}|@{environment.UNSET}", ctx)).isEqualTo("/home/ci|");
        }

        @Test
        void escapedReferenceIsLiteral() throws RenderException {
            assertThat(renderer.render("@@{build.version} @{build.version}", context(RenderingMode.STRICT)))
                    .isEqualTo("@{build.version} 1.4.2");
        }

        @Test
        void replacementWithDollarSignIsNotInterpreted() throws OutcomeConflictException, RenderException {
            ledger.put("deploy", "price", "$1.00");
            assertThat(renderer.render("@{deploy.price}", context(RenderingMode.STRICT))).isEqualTo("$1.00");
        }

        @Test
        void nestedParametersAreRenderedAndNonStringsKept() throws RenderException {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("tag", "@{build.version}");
            params.put("retries", 3);
            params.put("env", Map.of("VERSION", "@{build.version}"));
            params.put("args", List.of("--v", "@{build.version}"));

            Map<String, Object> rendered = renderer.render(params, context(RenderingMode.STRICT));

            assertThat(rendered).containsEntry("tag", "1.4.2").containsEntry("retries", 3);
            assertThat(rendered.get("env")).isEqualTo(Map.of("VERSION", "1.4.2"));
            assertThat(rendered.get("args")).isEqualTo(List.of("--v", "1.4.2"));
        }
    }

    @Nested
    @DisplayName("context")
    class Context {

        private RenderContext withVariables(Map<String, Object> variables) {
            return RenderContext.builder(ledger)
                    .actionIds(Set.of("build"))
                    .variables(variables)
                    .mode(RenderingMode.STRICT)
                    .build();
        }

        @Test
        void contextValuesAreRenderedInTurn() throws RenderException {
            RenderContext ctx = withVariables(Map.of(
                    "tag", "v@{build.version}",
                    "image", "registry/app:@{context.tag}"));

            assertThat(renderer.render("image:@{context.tag}", ctx)).isEqualTo("image:v1.4.2");
            assertThat(renderer.render("@{ctx.image}", ctx)).isEqualTo("registry/app:v1.4.2");
        }

        @Test
        void nestedMappingsAreWalked() throws RenderException {
            RenderContext ctx = withVariables(Map.of(
                    "db", Map.of("host", "localhost", "port", 5432, "url", "@{ctx.db.host}:@{ctx.db.port}")));

            assertThat(renderer.render("@{context.db.host}", ctx)).isEqualTo("localhost");
            assertThat(renderer.render("@{ctx.db.url}", ctx)).isEqualTo("localhost:5432");
        }

        @Test
        void flatDottedKeyWinsOverNestedPath() throws RenderException {
            RenderContext ctx = withVariables(Map.of(
                    "db.host", "flat",
                    "db", Map.of("host", "nested")));

            assertThat(renderer.render("@{ctx.db.host}", ctx)).isEqualTo("flat");
        }

        @Test
        void missingNestedKeyFails() {
            RenderContext ctx = withVariables(Map.of("db", Map.of("host", "localhost")));

            RenderException e = catchThrowableOfType(
                    () -> renderer.render("@{ctx.db.user}", ctx), RenderException.class);
            assertThat(e.getKind()).isEqualTo(RenderException.Kind.MISSING_CONTEXT_KEY);
            assertThat(e.getMessage()).isEqualTo("Context key 'db.user' not found");
        }

        @Test
        void selfReferencingContextHitsDepthLimit() {
            RenderContext ctx = withVariables(Map.of(
                    "ping", "@{ctx.pong}",
                    "pong", "@{ctx.ping}"));

            RenderException e = catchThrowableOfType(
                    () -> renderer.render("@{ctx.ping}", ctx), RenderException.class);
            assertThat(e.getKind()).isEqualTo(RenderException.Kind.RECURSION_LIMIT);
            assertThat(e.getMessage()).startsWith("Recursion depth exceeded: " + OutcomeRenderer.MAX_DEPTH);
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void missingOutcomeInStrictModeFails() {
            RenderException e = catchThrowableOfType(
                    () -> renderer.render("@{build.checksum}", context(RenderingMode.STRICT)), RenderException.class);

            assertThat(e.getKind()).isEqualTo(RenderException.Kind.MISSING_OUTCOME);
            assertThat(e.getMessage()).isEqualTo("Outcome key 'checksum' not found for action 'build'");
        }

        @Test
        void missingOutcomeInLenientModeIsEmpty() throws RenderException {
            assertThat(renderer.render("[@{build.checksum}]", context(RenderingMode.LENIENT))).isEqualTo("[]");
        }

        @Test
        void unknownActionFailsInBothModes() {
            for (RenderingMode mode : RenderingMode.values()) {
                RenderException e = catchThrowableOfType(
                        () -> renderer.render("@{ghost.key}", context(mode)), RenderException.class);
                assertThat(e.getKind()).isEqualTo(RenderException.Kind.UNKNOWN_ACTION);
                assertThat(e.getMessage()).isEqualTo("Action not found: 'ghost'");
            }
        }

        @Test
        void missingContextKeyFails() {
            RenderException e = catchThrowableOfType(
                    () -> renderer.render("@{context.zone}", context(RenderingMode.LENIENT)), RenderException.class);
            assertThat(e.getKind()).isEqualTo(RenderException.Kind.MISSING_CONTEXT_KEY);
        }

        @ParameterizedTest
        @ValueSource(strings = {"@{build.version", "@{}", "@{ }", "@{build}", "@{build..version}", "@{status.build.x}"})
        void malformedReferences(String template) {
            RenderException e = catchThrowableOfType(
                    () -> renderer.render(template, context(RenderingMode.LENIENT)), RenderException.class);
            assertThat(e.getKind()).isEqualTo(RenderException.Kind.MALFORMED_REFERENCE);
        }
    }
}
