package dev.mirror.worker.sync;

/**
 * Outcome of a consistency check.
 * @param consistent {@code true} when the destination already holds the source bytes
 * @param sourceBytes source content, set only when {@code consistent} is {@code false} so the
 * writer does not read the source a second time
 */
public record ConsistencyResult(boolean consistent, byte[] sourceBytes) {

	private static final ConsistencyResult CONSISTENT = new ConsistencyResult(true, null);

	public static ConsistencyResult upToDate() {
		return CONSISTENT;
	}

	public static ConsistencyResult stale(byte[] sourceBytes) {
		return new ConsistencyResult(false, sourceBytes);
	}

}
