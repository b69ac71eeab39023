package dev.mirror.worker.config;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Configuration of the worker process. The content store directory may be overridden via
 * Spring configuration or the {@code MIRROR_STORE_DIR} environment variable.
 */
@ConfigurationProperties(prefix = "mirror.worker")
public class WorkerProperties {

	/**
	 * An optional explicit content store directory.
	 */
	private String storeDir;

	/**
	 * Store path of the repository working tree.
	 */
	private String repoDir = "/repo";

	/**
	 * TCP port the worker accepts controller connections on.
	 */
	private int port = 7071;

	public String getStoreDir() {
		return this.storeDir;
	}

	public void setStoreDir(String storeDir) {
		this.storeDir = storeDir;
	}

	public String getRepoDir() {
		return this.repoDir;
	}

	public void setRepoDir(String repoDir) {
		this.repoDir = repoDir;
	}

	public int getPort() {
		return this.port;
	}

	public void setPort(int port) {
		this.port = port;
	}

	/**
	 * Resolve the directory the content store lives in, preferring the configured property,
	 * then the {@code MIRROR_STORE_DIR} environment variable, and finally a stable directory
	 * under the user home.
	 * @return the normalized store directory
	 */
	public Path determineStoreDir() {
		if (StringUtils.hasText(this.storeDir)) {
			return normalize(Paths.get(this.storeDir));
		}
		String environmentOverride = System.getenv("MIRROR_STORE_DIR");
		if (StringUtils.hasText(environmentOverride)) {
			return normalize(Paths.get(environmentOverride));
		}
		return normalize(Paths.get(System.getProperty("user.home"), ".repo-mirror", "store"));
	}

	private static Path normalize(Path candidate) {
		return candidate.toAbsolutePath().normalize();
	}

}
