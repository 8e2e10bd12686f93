package com.buildrunner.core.config;

import com.buildrunner.core.events.EventBus;
import com.buildrunner.core.metrics.BuildMetrics;
import com.buildrunner.core.output.ConsoleTerminal;
import com.buildrunner.core.output.Terminal;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import picocli.CommandLine.Help.Ansi;

/**
 * Wires the runner's collaborators into a Spring Boot application. Every bean backs off when the
 * application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(BuildRunnerProperties.class)
public class BuildRunnerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EventBus buildRunnerEventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public BuildMetrics buildMetrics(ObjectProvider<MeterRegistry> registry) {
        return new BuildMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public Terminal buildRunnerTerminal() {
        return new ConsoleTerminal(System.out, System.err, Ansi.AUTO);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRunnerFactory taskRunnerFactory(BuildRunnerProperties properties, Terminal terminal,
                                               EventBus eventBus, BuildMetrics metrics) {
        return new TaskRunnerFactory(properties, terminal, eventBus, metrics);
    }
}
