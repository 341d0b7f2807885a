package com.z254.secretsync.agent.config;

import java.util.List;

/**
 * The agent configuration is invalid. Only raised at startup, where it aborts the
 * application.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("invalid secrets-sync configuration:\n  - " + String.join("\n  - ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
