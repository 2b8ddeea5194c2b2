package com.gentoro.tldr.config;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Listener, worker pool and framing limits.
 *
 * @param hostname bind address, {@code 0.0.0.0} for all interfaces
 * @param port listen port, {@code 0} picks an ephemeral port
 * @param workers number of long-lived connection workers
 * @param queueCapacity bounded dispatch queue size; a full queue answers 503
 * @param maxHeaderBytes header block limit
 * @param maxBodyBytes request body limit
 * @param readTimeout per-connection read timeout
 * @param writeTimeout per-connection write timeout
 */
public record ServerSettings(
    String hostname,
    int port,
    int workers,
    int queueCapacity,
    int maxHeaderBytes,
    int maxBodyBytes,
    Duration readTimeout,
    Duration writeTimeout) {

  public static ServerSettings from(Configuration config) {
    long ioTimeout = Settings.positiveLong(config, "http.io-timeout-seconds", 15);
    return new ServerSettings(
        Settings.nonBlank(config, "http.hostname", "0.0.0.0"),
        Settings.intInRange(config, "http.port", 8001, 0, 65535),
        Settings.positiveInt(config, "http.workers", 4),
        Settings.positiveInt(config, "http.queue-capacity", 100),
        Settings.positiveInt(config, "http.max-header-bytes", 8 * 1024),
        Settings.positiveInt(config, "http.max-body-bytes", 10 * 1024 * 1024),
        Duration.ofSeconds(Settings.positiveLong(config, "http.read-timeout-seconds", ioTimeout)),
        Duration.ofSeconds(Settings.positiveLong(config, "http.write-timeout-seconds", ioTimeout)));
  }
}
