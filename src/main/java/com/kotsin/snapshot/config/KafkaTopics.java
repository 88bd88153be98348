package com.kotsin.snapshot.config;

/**
 * KafkaTopics - Default Kafka topic names
 *
 * Every topic can be overridden through snapshot.sink.* / snapshot.host.topic.
 */
public final class KafkaTopics {

    private KafkaTopics() {} // Prevent instantiation

    // ========== Input ==========
    public static final String HOST_INDICATOR_BARS = "host-indicator-bars";

    // ========== Output ==========
    public static final String INDICATOR_SNAPSHOTS = "indicator-snapshots";
    public static final String INDICATOR_DIAGNOSTICS = "indicator-diagnostics";
    public static final String INDICATOR_BIAS = "indicator-bias";
}
