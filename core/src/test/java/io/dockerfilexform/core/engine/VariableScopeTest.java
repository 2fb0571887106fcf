package io.dockerfilexform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dockerfilexform.core.error.WordExpansionException;
import io.dockerfilexform.core.instructions.KeyValuePairOptional;
import io.dockerfilexform.core.shell.ShellLexer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link VariableScope}: how external overrides and in-file {@code ARG} defaults
 * combine as declarations are applied in file order.
 */
@DisplayName("VariableScope")
class VariableScopeTest {

    private static VariableScope scope(String... buildArgs) {
        return new VariableScope(new ShellLexer('\\'), BuildArgs.parse(List.of(buildArgs)));
    }

    private static KeyValuePairOptional arg(String key, String value) {
        return new KeyValuePairOptional(key, value);
    }

    @Test
    @DisplayName("a default is bound and later defaults replace it")
    void defaultsAccumulate() {
        VariableScope scope = scope();

        scope.declare(arg("BASE", "alpine"));
        assertThat(scope.expand("${BASE}")).isEqualTo("alpine");

        scope.declare(arg("BASE", "debian"));
        assertThat(scope.expand("${BASE}")).isEqualTo("debian");
    }

    @Test
    @DisplayName("an override with a value wins at every redeclaration")
    void overrideAlwaysWins() {
        VariableScope scope = scope("BASE=ubuntu");
        assertThat(scope.get("BASE")).isEqualTo("ubuntu");

        scope.declare(arg("BASE", null));
        assertThat(scope.get("BASE")).isEqualTo("ubuntu");

        scope.declare(arg("BASE", "alpine"));
        assertThat(scope.get("BASE")).isEqualTo("ubuntu");
    }

    @Test
    @DisplayName("an override without a value defers to the in-file default")
    void valuelessOverride() {
        VariableScope scope = scope("BASE");
        assertThat(scope.get("BASE")).isNull();

        scope.declare(arg("BASE", "alpine"));
        assertThat(scope.get("BASE")).isEqualTo("alpine");
    }

    @Test
    @DisplayName("a declaration without a default keeps an earlier value or binds the empty string")
    void bareDeclaration() {
        VariableScope scope = scope();

        scope.declare(arg("TAG", null));
        assertThat(scope.get("TAG")).isEmpty();

        scope.declare(arg("TAG", "3.18"));
        scope.declare(arg("TAG", null));
        assertThat(scope.get("TAG")).isEqualTo("3.18");
    }

    @Test
    @DisplayName("defaults expand against the variables declared before them")
    void defaultsExpand() {
        VariableScope scope = scope("REGISTRY=gcr.io/acme");

        scope.declare(arg("NAME", "app"));
        scope.declare(arg("IMAGE", "${REGISTRY}/${NAME}"));

        assertThat(scope.get("IMAGE")).isEqualTo("gcr.io/acme/app");
        assertThat(scope.asMap()).containsKeys("REGISTRY", "NAME", "IMAGE");
    }

    @Test
    @DisplayName("a default that fails to expand is kept raw")
    void rawDefault() {
        VariableScope scope = scope();

        scope.declare(arg("IMAGE", "${MISSING:?required}"));

        assertThat(scope.get("IMAGE")).isEqualTo("${MISSING:?required}");
    }

    @Test
    @DisplayName("expand reports failures to the caller")
    void expandFailure() {
        assertThatThrownBy(() -> scope().expand("${UNCLOSED")).isInstanceOf(WordExpansionException.class);
    }
}
