package org.carball.cflow.config;

public enum OutputFormat {
    JSON,
    JSONL,
    MARKDOWN,
    BOTH
}
