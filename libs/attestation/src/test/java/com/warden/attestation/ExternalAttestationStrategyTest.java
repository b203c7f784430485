package com.warden.attestation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExternalAttestationStrategy")
class ExternalAttestationStrategyTest {

    private static final Path SOCKET = Path.of("/run/warden/module.sock");
    private static final URI AUTH = URI.create("https://auth.example/validate");
    private static final AttestorConfig CONFIG = new AttestorConfig(false, 0, SOCKET, AUTH);

    static ExternalAttestation attestation() {
        return new ExternalAttestation("tok-1", new SubjectIdentity("alice", "s3cr3t",
                new SystemIdentity("1000", "alice", "1000", "alice", List.of(new GroupInfo("27", "sudo")))));
    }

    private AttestationModuleClient moduleClient;
    private AuthValidator authValidator;
    private ExternalAttestationStrategy strategy;

    @BeforeEach
    void setUp() {
        moduleClient = mock(AttestationModuleClient.class);
        authValidator = mock(AuthValidator.class);
        strategy = new ExternalAttestationStrategy(moduleClient, authValidator);
    }

    @Nested
    @DisplayName("validated attestation")
    class Validated {

        @Test
        @DisplayName("builds selectors from the validated identity")
        void buildsSelectors() {
            var fetched = attestation();
            when(moduleClient.fetch(eq(SOCKET), any())).thenReturn(fetched);
            when(authValidator.validate(eq(AUTH), eq(fetched), any())).thenReturn(ValidationResult.accepted("valid"));

            List<String> selectors = strategy.attest(1, CONFIG, null);

            assertThat(selectors).containsExactly(
                    "name:alice", "secret:s3cr3t",
                    "system:user_id:1000", "system:username:alice",
                    "system:group_id:1000", "system:groupName:alice",
                    "system:supplementary_group_id:27", "system:supplementary_group_name:sudo");
        }

        @Test
        @DisplayName("passes the caller deadline to both calls")
        void propagatesDeadline() {
            Instant deadline = Instant.now().plusSeconds(5);
            var fetched = attestation();
            when(moduleClient.fetch(SOCKET, deadline)).thenReturn(fetched);
            when(authValidator.validate(AUTH, fetched, deadline)).thenReturn(ValidationResult.accepted(""));

            strategy.attest(1, CONFIG, deadline);

            verify(moduleClient).fetch(SOCKET, deadline);
            verify(authValidator).validate(AUTH, fetched, deadline);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("rejection aborts with ValidationRejected and no selectors")
        void rejected() {
            when(moduleClient.fetch(any(), any())).thenReturn(attestation());
            when(authValidator.validate(any(), any(), any())).thenReturn(ValidationResult.rejected("token expired"));

            assertThatThrownBy(() -> strategy.attest(1, CONFIG, null))
                    .isInstanceOf(ValidationRejectedException.class)
                    .hasMessageContaining("token expired")
                    .satisfies(e -> assertThat(((AttestationException) e).kind()).isEqualTo(ErrorKind.VALIDATION_REJECTED));
        }

        @Test
        @DisplayName("validator transport failure aborts with ValidationError")
        void validatorUnreachable() {
            when(moduleClient.fetch(any(), any())).thenReturn(attestation());
            when(authValidator.validate(any(), any(), any())).thenThrow(new ValidationException("connection refused"));

            assertThatThrownBy(() -> strategy.attest(1, CONFIG, null))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((AttestationException) e).stage()).isEqualTo(AttestationStage.VALIDATE));
        }

        @Test
        @DisplayName("null validation result aborts with ValidationError")
        void nullResult() {
            when(moduleClient.fetch(any(), any())).thenReturn(attestation());

            assertThatThrownBy(() -> strategy.attest(1, CONFIG, null)).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("unexpected validator exception is wrapped as ValidationError")
        void unexpectedValidatorException() {
            when(moduleClient.fetch(any(), any())).thenReturn(attestation());
            when(authValidator.validate(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

            assertThatThrownBy(() -> strategy.attest(1, CONFIG, null))
                    .isInstanceOf(ValidationException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("fetch failure aborts before the validator is called")
        void fetchFailure() {
            when(moduleClient.fetch(any(), any())).thenThrow(new FetchException("deadline exceeded"));

            assertThatThrownBy(() -> strategy.attest(1, CONFIG, null))
                    .isInstanceOf(FetchException.class)
                    .satisfies(e -> assertThat(((AttestationException) e).kind()).isEqualTo(ErrorKind.FETCH_ERROR));
            verify(authValidator, never()).validate(any(), any(), any());
        }

        @Test
        @DisplayName("incomplete attestation is a FetchError and is never validated")
        void incompleteAttestation() {
            when(moduleClient.fetch(any(), any())).thenReturn(new ExternalAttestation("tok", null));

            assertThatThrownBy(() -> strategy.attest(1, CONFIG, null)).isInstanceOf(FetchException.class);
            verify(authValidator, never()).validate(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("completeness check")
    class Completeness {

        @Test
        @DisplayName("blank token is rejected")
        void blankToken() {
            var a = attestation();
            assertThatThrownBy(() -> ExternalAttestationStrategy.requireComplete(
                    new ExternalAttestation(" ", a.identity()))).isInstanceOf(FetchException.class);
        }

        @Test
        @DisplayName("missing group id is rejected")
        void missingGroupId() {
            var bad = new ExternalAttestation("tok", new SubjectIdentity("alice", "s",
                    new SystemIdentity("1000", "alice", "", "alice", List.of())));
            assertThatThrownBy(() -> ExternalAttestationStrategy.requireComplete(bad)).isInstanceOf(FetchException.class);
        }

        @Test
        @DisplayName("toString never shows token or secret")
        void toStringRedacts() {
            assertThat(attestation().toString()).doesNotContain("tok-1").doesNotContain("s3cr3t");
        }
    }
}
