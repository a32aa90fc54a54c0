package com.facility.snapshot.config;

import com.facility.common.auth.AuthSecrets;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component("telemetryProperties")
@ConfigurationProperties(prefix = "telemetry")
@Data
public class TelemetryProperties {

    private String serviceName = "facility-telemetry";
    private Snapshot snapshot = new Snapshot();
    private Api api = new Api();
    private Auth auth = new Auth();
    private List<FacilitySeed> facilities = new ArrayList<>();

    @Data
    public static class Snapshot {
        private Duration interval = Duration.ofSeconds(2);
        private int retentionLimit = 50;
        private boolean autoStart = false;
        /** Fixed seed for reproducible runs; random when unset. */
        private Long seed;
    }

    @Data
    public static class Api {
        private int recentExecutionsLimit = 20;
        private int historyLimit = 50;
    }

    @Data
    public static class Auth {
        private String basicUser;
        private String basicPassword;
        private String bearerToken;
        private String apiKey;

        public AuthSecrets toSecrets() {
            return new AuthSecrets(basicUser, basicPassword, bearerToken, apiKey);
        }
    }

    @Data
    public static class FacilitySeed {
        private String id;
        private String name;
        private String city;
        private int capacity;
        private boolean active = true;
    }
}
