package dev.mirror.worker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning of the synchronization engine.
 */
@ConfigurationProperties(prefix = "mirror.sync")
public class SyncProperties {

	/**
	 * Number of files transferred concurrently within one batch.
	 */
	private int batchSize = 10;

	/**
	 * Files smaller than this many bytes are compared byte by byte, larger ones by digest.
	 */
	private int directCompareThreshold = 10 * 1024;

	public int getBatchSize() {
		return this.batchSize;
	}

	public void setBatchSize(int batchSize) {
		this.batchSize = batchSize;
	}

	public int getDirectCompareThreshold() {
		return this.directCompareThreshold;
	}

	public void setDirectCompareThreshold(int directCompareThreshold) {
		this.directCompareThreshold = directCompareThreshold;
	}

}
