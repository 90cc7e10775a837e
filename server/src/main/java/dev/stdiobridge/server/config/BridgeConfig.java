package dev.stdiobridge.server.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import dev.stdiobridge.server.broker.Broker;
import dev.stdiobridge.server.filter.FilterPipeline;
import dev.stdiobridge.server.process.StdioProcess;
import dev.stdiobridge.server.session.SessionRegistry;

/**
 * Wires the child supervisor, session registry, filter pipeline and broker. The child is started
 * before the broker pump and stopped after it.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeConfig {

	@Bean
	public Clock bridgeClock() {
		return Clock.systemUTC();
	}

	@Bean
	public FilterPipeline filterPipeline(BridgeProperties properties, Clock bridgeClock) {
		return FilterPipeline.withBuiltins(properties.getFilters().toFilterConfig(), bridgeClock);
	}

	@Bean
	public SessionRegistry sessionRegistry(BridgeProperties properties, Clock bridgeClock) {
		return new SessionRegistry(properties.getSession().getQueueCapacity(), bridgeClock);
	}

	@Bean(initMethod = "start", destroyMethod = "terminate")
	public StdioProcess stdioProcess(BridgeProperties properties) {
		return new StdioProcess(properties.getProcess().toSettings());
	}

	@Bean(initMethod = "start", destroyMethod = "close")
	public Broker broker(StdioProcess stdioProcess, SessionRegistry sessionRegistry, FilterPipeline filterPipeline,
			BridgeProperties properties, Clock bridgeClock) {
		return new Broker(stdioProcess, sessionRegistry, filterPipeline, properties.getBroker().toSettings(),
				bridgeClock);
	}

}
