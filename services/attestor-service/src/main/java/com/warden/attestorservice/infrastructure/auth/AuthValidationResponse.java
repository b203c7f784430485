package com.warden.attestorservice.infrastructure.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body returned by the auth service.
 *
 * @param isValid verdict; null when the field is missing
 * @param message explanation, possibly null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthValidationResponse(
        @JsonProperty("isValid") Boolean isValid,
        @JsonProperty("message") String message) {
}
