package io.dockerfilexform.core.reference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dockerfilexform.core.error.ReferenceFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link ReferenceParser} and the rendering methods of {@link ImageReference}.
 */
@DisplayName("ReferenceParser")
class ReferenceParserTest {

    private static final String HEX = "0123456789abcdef".repeat(4);
    private static final String DIGEST = "sha256:" + HEX;

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("official image gains docker.io and library/")
        void officialImage() {
            ImageReference ref = ReferenceParser.parseNormalizedNamed("alpine:3.18");

            assertThat(ref.domain()).isEqualTo("docker.io");
            assertThat(ref.path()).isEqualTo("library/alpine");
            assertThat(ref.tag()).isEqualTo("3.18");
            assertThat(ref.digest()).isNull();
            assertThat(ref.name()).isEqualTo("docker.io/library/alpine");
            assertThat(ref.familiarName()).isEqualTo("alpine");
            assertThat(ref.familiarString()).isEqualTo("alpine:3.18");
            assertThat(ref).hasToString("docker.io/library/alpine:3.18");
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "alpine, docker.io/library/alpine",
            "library/alpine, docker.io/library/alpine",
            "bitnami/redis:7.2, docker.io/bitnami/redis:7.2",
            "quay.io/coreos/etcd:v3.5, quay.io/coreos/etcd:v3.5",
            "registry.example.com:5000/team/app, registry.example.com:5000/team/app"
        })
        @DisplayName("familiar forms normalize to fully qualified references")
        void normalizes(String familiar, String qualified) {
            assertThat(ReferenceParser.parseNormalizedNamed(familiar)).hasToString(qualified);
        }

        @Test
        @DisplayName("user repository on Docker Hub")
        void hubUserRepo() {
            ImageReference ref = ReferenceParser.parseNormalizedNamed("myorg/app:1.0");

            assertThat(ref.name()).isEqualTo("docker.io/myorg/app");
            assertThat(ref.familiarString()).isEqualTo("myorg/app:1.0");
        }

        @Test
        @DisplayName("explicit docker.io and index.docker.io are shortened again")
        void explicitHub() {
            assertThat(ReferenceParser.parseNormalizedNamed("docker.io/library/alpine").familiarString())
                    .isEqualTo("alpine");
            assertThat(ReferenceParser.parseNormalizedNamed("index.docker.io/library/nginx").name())
                    .isEqualTo("docker.io/library/nginx");
        }

        @Test
        @DisplayName("registries with dots, ports or localhost keep their domain")
        void registries() {
            ImageReference gcr = ReferenceParser.parseNormalizedNamed("gcr.io/project/app@" + DIGEST);
            assertThat(gcr.domain()).isEqualTo("gcr.io");
            assertThat(gcr.path()).isEqualTo("project/app");
            assertThat(gcr.digest()).isEqualTo(DIGEST);
            assertThat(gcr.familiarString()).isEqualTo("gcr.io/project/app@" + DIGEST);

            ImageReference local = ReferenceParser.parseNormalizedNamed("localhost:5000/app:dev");
            assertThat(local.domain()).isEqualTo("localhost:5000");
            assertThat(local.path()).isEqualTo("app");
            assertThat(local.tag()).isEqualTo("dev");

            assertThat(ReferenceParser.parseNormalizedNamed("localhost/app").domain()).isEqualTo("localhost");
        }

        @Test
        @DisplayName("tag and digest together")
        void tagAndDigest() {
            ImageReference ref = ReferenceParser.parseNormalizedNamed("myapp:latest@" + DIGEST);

            assertThat(ref.isTagged()).isTrue();
            assertThat(ref.isDigested()).isTrue();
            assertThat(ref.familiarString()).isEqualTo("myapp:latest@" + DIGEST);
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("uppercase repository names")
        void uppercase() {
            assertThatThrownBy(() -> ReferenceParser.parseNormalizedNamed("Alpine"))
                    .isInstanceOf(ReferenceFormatException.class)
                    .hasMessage("repository name must be lowercase: Alpine")
                    .satisfies(e -> assertThat(((ReferenceFormatException) e).input()).isEqualTo("Alpine"));
        }

        @Test
        @DisplayName("bare 64-character hex identifiers")
        void identifier() {
            assertThatThrownBy(() -> ReferenceParser.parseNormalizedNamed(HEX))
                    .isInstanceOf(ReferenceFormatException.class)
                    .hasMessageContaining("64-byte hexadecimal");
        }

        @Test
        @DisplayName("malformed text, such as unexpanded variables")
        void malformed() {
            assertThatThrownBy(() -> ReferenceParser.parseNormalizedNamed("${BASE}:latest"))
                    .isInstanceOf(ReferenceFormatException.class);
            assertThatThrownBy(() -> ReferenceParser.parseNormalizedNamed("app:bad tag"))
                    .isInstanceOf(ReferenceFormatException.class)
                    .hasMessageContaining("invalid reference format");
            assertThatThrownBy(() -> ReferenceParser.parseNormalizedNamed(""))
                    .isInstanceOf(ReferenceFormatException.class);
        }

        @Test
        @DisplayName("digests with the wrong length or an unknown algorithm")
        void digests() {
            assertThatThrownBy(() -> ReferenceParser.parseNormalizedNamed("app@sha256:" + HEX.substring(0, 32)))
                    .isInstanceOf(ReferenceFormatException.class)
                    .hasMessageContaining("invalid checksum digest format");
            assertThatThrownBy(() -> ReferenceParser.parseNormalizedNamed("app@md5:" + HEX.substring(0, 32)))
                    .isInstanceOf(ReferenceFormatException.class)
                    .hasMessageContaining("unsupported digest algorithm");
        }

        @Test
        @DisplayName("names longer than 255 characters")
        void tooLong() {
            assertThatThrownBy(() -> ReferenceParser.parseNormalizedNamed("a".repeat(256)))
                    .isInstanceOf(ReferenceFormatException.class)
                    .hasMessageContaining("must not be more than 255 characters");
        }
    }

    @Nested
    @DisplayName("Derived references")
    class Derived {

        @Test
        @DisplayName("withDigest and withTag validate and keep the repository")
        void withers() {
            ImageReference base = ReferenceParser.parseNormalizedNamed("myapp:latest");

            assertThat(base.withoutTagOrDigest().withDigest(DIGEST).familiarString())
                    .isEqualTo("myapp@" + DIGEST);
            assertThat(base.withTag("v2").familiarString()).isEqualTo("myapp:v2");
            assertThatThrownBy(() -> base.withTag("not valid")).isInstanceOf(ReferenceFormatException.class);
            assertThatThrownBy(() -> base.withDigest("sha256:xyz")).isInstanceOf(ReferenceFormatException.class);
        }
    }
}
