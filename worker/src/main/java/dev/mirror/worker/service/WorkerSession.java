package dev.mirror.worker.service;

import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.MirrorException;
import dev.mirror.worker.engine.NetworkTransport;
import dev.mirror.worker.host.HostFileSystem;

/**
 * State of one controller connection: the destination granted by the controller and the network
 * access of the worker. Passed explicitly to every operation that needs it.
 */
public class WorkerSession {

	private final NetworkTransport http;

	private volatile HostFileSystem destination;

	public WorkerSession(NetworkTransport http) {
		this.http = http;
	}

	public NetworkTransport http() {
		return this.http;
	}

	/**
	 * Replace the destination tree of this session.
	 * @param destination adapter over the granted directory
	 */
	public void grantDestination(HostFileSystem destination) {
		this.destination = destination;
	}

	/**
	 * Retrieve the destination tree.
	 * @return the granted destination
	 * @throws MirrorException when no destination was granted yet
	 */
	public HostFileSystem requireDestination() {
		HostFileSystem current = this.destination;
		if (current == null) {
			throw new MirrorException(ErrorKind.INVALID_REQUEST, "Local root not set in worker");
		}
		return current;
	}

	public boolean hasDestination() {
		return this.destination != null;
	}

}
