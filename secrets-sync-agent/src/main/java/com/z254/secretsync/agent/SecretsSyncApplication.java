package com.z254.secretsync.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * secrets-sync - keeps local files in step with secrets held in Vault or OpenBao.
 *
 * <p>Runs as a sidecar: each configured secret is fetched on its own schedule, rendered
 * through its templates and written atomically to the configured files. Readiness and
 * metrics are exposed through the actuator endpoints.
 */
@SpringBootApplication
public class SecretsSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecretsSyncApplication.class, args);
    }
}
