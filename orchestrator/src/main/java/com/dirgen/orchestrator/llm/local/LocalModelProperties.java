package com.dirgen.orchestrator.llm.local;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Binds {@code dirgen.local-models.*}.
 *
 * @param maxConcurrent      managed backends allowed to run at once
 * @param idleTimeout        unused this long, a backend is unloaded by the sweeper
 * @param sweepIntervalMs    sweeper period (read by the @Scheduled expression)
 * @param startupGrace       wait after launching before the first running check
 * @param startChecks        running checks before a start is abandoned
 * @param startCheckInterval pause between running checks
 * @param command            container runtime executable
 * @param commandTimeout     timeout of status queries
 * @param stopTimeout        timeout of unload commands
 */
@ConfigurationProperties(prefix = "dirgen.local-models")
public record LocalModelProperties(
        @DefaultValue("2")      int      maxConcurrent,
        @DefaultValue("5m")     Duration idleTimeout,
        @DefaultValue("30000")  long     sweepIntervalMs,
        @DefaultValue("10s")    Duration startupGrace,
        @DefaultValue("12")     int      startChecks,
        @DefaultValue("5s")     Duration startCheckInterval,
        @DefaultValue("docker") String   command,
        @DefaultValue("10s")    Duration commandTimeout,
        @DefaultValue("15s")    Duration stopTimeout
) {}
