package com.warden.attestation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ConfigParser")
class ConfigParserTest {

    @Nested
    @DisplayName("valid documents")
    class ValidDocuments {

        @Test
        @DisplayName("empty object yields defaults and the local strategy")
        void emptyObjectYieldsDefaults() {
            AttestorConfig config = ConfigParser.parse("{}");

            assertThat(config).isEqualTo(AttestorConfig.defaults());
            assertThat(config.strategy()).isEqualTo(AttestorConfig.Strategy.LOCAL);
            assertThat(config.hashingEnabled()).isTrue();
        }

        @Test
        @DisplayName("reads path discovery and size limit")
        void readsLocalOptions() {
            AttestorConfig config = ConfigParser.parse(
                    "{\"discover_workload_path\": true, \"workload_size_limit\": -1}");

            assertThat(config.discoverWorkloadPath()).isTrue();
            assertThat(config.workloadSizeLimit()).isEqualTo(-1);
            assertThat(config.hashingEnabled()).isFalse();
        }

        @Test
        @DisplayName("both external endpoints select the external strategy")
        void readsExternalEndpoints() {
            AttestorConfig config = ConfigParser.parse("""
                    {
                      "external_attestation_socket": "/run/warden/module.sock",
                      "external_auth_service_url": "https://auth.example/validate"
                    }
                    """);

            assertThat(config.strategy()).isEqualTo(AttestorConfig.Strategy.EXTERNAL);
            assertThat(config.attestationSocket()).contains(Path.of("/run/warden/module.sock"));
            assertThat(config.authServiceUrl()).contains(URI.create("https://auth.example/validate"));
        }

        @Test
        @DisplayName("accepts the older external key spellings")
        void acceptsLegacyKeys() {
            AttestorConfig config = ConfigParser.parse("""
                    {
                      "user_attestation_module_path": "/tmp/module.sock",
                      "user_attestation_service_url": "http://localhost:8080/validate"
                    }
                    """);

            assertThat(config.strategy()).isEqualTo(AttestorConfig.Strategy.EXTERNAL);
            assertThat(config.attestationSocket()).contains(Path.of("/tmp/module.sock"));
        }

        @Test
        @DisplayName("ignores unknown keys")
        void ignoresUnknownKeys() {
            AttestorConfig config = ConfigParser.parse("{\"workload_size_limit\": 100, \"colour\": \"blue\"}");

            assertThat(config.workloadSizeLimit()).isEqualTo(100);
        }

        @Test
        @DisplayName("identical documents give equal configurations")
        void isIdempotent() {
            String raw = "{\"discover_workload_path\": true, \"workload_size_limit\": 4096}";

            assertThat(ConfigParser.parse(raw)).isEqualTo(ConfigParser.parse(raw));
        }
    }

    @Nested
    @DisplayName("rejected documents")
    class RejectedDocuments {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\n\t"})
        @DisplayName("blank document is EmptyConfig")
        void blankIsEmpty(String raw) {
            assertThatThrownBy(() -> ConfigParser.parse(raw))
                    .isInstanceOf(EmptyConfigException.class)
                    .satisfies(e -> assertThat(((AttestationException) e).kind()).isEqualTo(ErrorKind.EMPTY_CONFIG));
        }

        @Test
        @DisplayName("null document is EmptyConfig")
        void nullIsEmpty() {
            assertThatThrownBy(() -> ConfigParser.parse(null)).isInstanceOf(EmptyConfigException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{not json",
                "[1, 2]",
                "\"just a string\"",
                "{\"discover_workload_path\": \"yes\"}",
                "{\"workload_size_limit\": 1.5}",
                "{\"workload_size_limit\": \"100\"}",
                "{\"workload_size_limit\": 99999999999999999999}",
                "{\"external_attestation_socket\": 12, \"external_auth_service_url\": \"http://a\"}"
        })
        @DisplayName("malformed or wrongly typed document is InvalidConfig")
        void malformedIsInvalid(String raw) {
            assertThatThrownBy(() -> ConfigParser.parse(raw))
                    .isInstanceOf(InvalidConfigException.class)
                    .isNotInstanceOf(EmptyConfigException.class)
                    .satisfies(e -> assertThat(((AttestationException) e).kind()).isEqualTo(ErrorKind.INVALID_CONFIG));
        }

        @Test
        @DisplayName("only one external endpoint is InvalidConfig")
        void halfExternalIsInvalid() {
            assertThatThrownBy(() -> ConfigParser.parse("{\"external_attestation_socket\": \"/run/m.sock\"}"))
                    .isInstanceOf(InvalidConfigException.class)
                    .hasMessageContaining("together");
        }

        @Test
        @DisplayName("relative socket path is InvalidConfig")
        void relativeSocketIsInvalid() {
            assertThatThrownBy(() -> ConfigParser.parse(
                    "{\"external_attestation_socket\": \"m.sock\", \"external_auth_service_url\": \"http://a/v\"}"))
                    .isInstanceOf(InvalidConfigException.class)
                    .hasMessageContaining("absolute path");
        }

        @ParameterizedTest
        @ValueSource(strings = {"ftp://auth/validate", "/validate", "http://"})
        @DisplayName("non-http auth URL is InvalidConfig")
        void badUrlIsInvalid(String url) {
            assertThatThrownBy(() -> ConfigParser.parse(
                    "{\"external_attestation_socket\": \"/run/m.sock\", \"external_auth_service_url\": \"%s\"}"
                            .formatted(url)))
                    .isInstanceOf(InvalidConfigException.class);
        }
    }
}
