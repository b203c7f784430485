package com.warden.attestorservice.api;

import com.warden.attestation.Attestor;
import com.warden.attestation.ConfigSnapshot;
import com.warden.attestation.ConfigStore;
import com.warden.attestation.NotConfiguredException;
import com.warden.attestorservice.config.AttestorServiceProperties;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runtime info: service identity plus the active attestor configuration, if any.
 */
@RestController
@RequestMapping("/api/v1")
public class AttestorInfoController {

    private final AttestorServiceProperties properties;
    private final ConfigStore configStore;

    public AttestorInfoController(AttestorServiceProperties properties, Attestor attestor) {
        this.properties = properties;
        this.configStore = attestor.configStore();
    }

    @GetMapping("/info")
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("status", "running");
        try {
            ConfigSnapshot snapshot = configStore.current();
            info.put("configured", true);
            info.put("configVersion", snapshot.version());
            info.put("strategy", snapshot.config().strategy().name().toLowerCase(Locale.ROOT));
        } catch (NotConfiguredException e) {
            info.put("configured", false);
        }
        info.put("timestamp", Instant.now().toString());
        return info;
    }
}
