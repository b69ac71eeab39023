package dev.mirror.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import dev.mirror.transport.relay.JdkHttpFetcher;
import dev.mirror.transport.relay.NetworkFetcher;
import dev.mirror.worker.config.RelayProperties;
import dev.mirror.worker.config.SyncProperties;
import dev.mirror.worker.config.WorkerProperties;
import dev.mirror.worker.engine.UnsupportedVersioningEngine;
import dev.mirror.worker.engine.VersioningEngine;
import dev.mirror.worker.relay.RelayingTransport;
import dev.mirror.worker.service.WorkerRequestHandler;
import dev.mirror.worker.store.ContentStore;
import dev.mirror.worker.store.DirectoryContentStore;
import dev.mirror.worker.sync.ConsistencyChecker;
import dev.mirror.worker.sync.DestinationLocks;
import dev.mirror.worker.sync.SyncEngine;
import dev.mirror.worker.transport.WorkerServer;

/**
 * Spring Boot entry point of the worker: owns the content store and the synchronization engine
 * and serves one controller over TCP.
 */
@SpringBootApplication
@EnableConfigurationProperties({ WorkerProperties.class, SyncProperties.class, RelayProperties.class })
public class WorkerApplication {

	private static final Logger logger = LoggerFactory.getLogger(WorkerApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(WorkerApplication.class, args);
	}

	@Bean
	ContentStore contentStore(WorkerProperties properties) {
		return new DirectoryContentStore(properties.determineStoreDir());
	}

	@Bean(destroyMethod = "close")
	SyncEngine syncEngine(SyncProperties properties) {
		logger.info("Sync batch size {}, direct compare below {} bytes", properties.getBatchSize(),
				properties.getDirectCompareThreshold());
		return new SyncEngine(new ConsistencyChecker(properties.getDirectCompareThreshold()),
				properties.getBatchSize(), new DestinationLocks());
	}

	@Bean
	@ConditionalOnMissingBean
	VersioningEngine versioningEngine() {
		logger.warn("No versioning engine bean found, clone and pull will fail");
		return new UnsupportedVersioningEngine();
	}

	@Bean
	@ConditionalOnMissingBean
	NetworkFetcher networkFetcher(RelayProperties properties) {
		return new JdkHttpFetcher(properties.getConnectTimeout(), properties.getTimeout());
	}

	@Bean(initMethod = "start", destroyMethod = "stop")
	WorkerServer workerServer(WorkerProperties workerProperties, RelayProperties relayProperties,
			WorkerRequestHandler handler, NetworkFetcher fetcher) {
		return new WorkerServer(workerProperties.getPort(), handler,
				escalator -> new RelayingTransport(fetcher, escalator, relayProperties.getOrigin(),
						relayProperties.getCorsProxy(), relayProperties.getTimeout()));
	}

}
