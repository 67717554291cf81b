package com.dirgen.orchestrator.config;

import com.dirgen.orchestrator.fs.FilesystemGateway;
import com.dirgen.orchestrator.worker.ProcessLauncher;
import com.dirgen.orchestrator.worker.WorkerProperties;
import com.dirgen.orchestrator.worker.WorkerSupervisor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Beans of the run pipeline that need configuration to be built.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, WorkerProperties.class})
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FilesystemGateway filesystemGateway(PipelineProperties props) {
        return new FilesystemGateway(Path.of(props.sandboxRoot()));
    }

    @Bean
    public WorkerSupervisor workerSupervisor(WorkerProperties props, Clock clock) {
        return new WorkerSupervisor(props, ProcessLauncher.system(), clock);
    }
}
