package dev.mirror.worker.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.Messages;
import dev.mirror.transport.MirrorException;
import dev.mirror.transport.message.ProgressEvent;
import dev.mirror.transport.message.SyncStats;
import dev.mirror.transport.message.WorkerRequest;
import dev.mirror.worker.host.HostFileSystem;
import lombok.RequiredArgsConstructor;

/**
 * Executes one request against the repository on behalf of a session and produces the payload
 * of its success response. Failures propagate to the caller, which turns them into error
 * responses.
 */
@Component
@RequiredArgsConstructor
public class WorkerRequestHandler {

	private static final Logger logger = LoggerFactory.getLogger(WorkerRequestHandler.class);

	private final RepositoryService repositoryService;

	private final ObjectMapper mapper = Messages.mapper();

	/**
	 * Execute a request.
	 * @param request typed request
	 * @param session state of the calling connection
	 * @param progress receives intermediate output, in emission order
	 * @return success payload, {@code null} for none
	 * @throws IOException when the store, the destination or the network fails
	 */
	public JsonNode handle(WorkerRequest request, WorkerSession session, Consumer<ProgressEvent> progress)
			throws IOException {
		logger.debug("Action {} started", request.kind().wireName());
		switch (request.kind()) {
			case INIT -> {
				this.repositoryService.init();
				return null;
			}
			case CLONE -> {
				WorkerRequest.Clone clone = (WorkerRequest.Clone) request;
				this.repositoryService.cloneRepository(clone.url(), clone.ref(), clone.useProxy(), session.http(),
						message -> progress.accept(new ProgressEvent.Message(message)));
				return null;
			}
			case PULL -> {
				WorkerRequest.Pull pull = (WorkerRequest.Pull) request;
				this.repositoryService.pull(pull.url(), pull.ref(), pull.useProxy(), session.http(),
						message -> progress.accept(new ProgressEvent.Message(message)));
				return null;
			}
			case GET_FILE_TREE -> {
				return this.mapper.valueToTree(this.repositoryService.fileTree());
			}
			case READ_FILE -> {
				String path = ((WorkerRequest.ReadFile) request).path();
				return this.mapper.getNodeFactory().textNode(this.repositoryService.readFile(requireText(path, "path")));
			}
			case SET_LOCAL_ROOT -> {
				String root = ((WorkerRequest.SetLocalRoot) request).root();
				HostFileSystem destination = new HostFileSystem(Path.of(requireText(root, "root")));
				session.grantDestination(destination);
				logger.info("Local root set to {}", destination.root());
				return null;
			}
			case SYNC_TO_LOCAL -> {
				String path = ((WorkerRequest.SyncToLocal) request).path();
				SyncStats stats = this.repositoryService.syncToLocal(path, session.requireDestination(),
						progress::accept);
				return this.mapper.valueToTree(stats);
			}
			case WIPE -> {
				this.repositoryService.wipe();
				return null;
			}
			default -> throw new MirrorException(ErrorKind.INVALID_REQUEST,
					"Unsupported request kind " + request.kind());
		}
	}

	private static String requireText(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new MirrorException(ErrorKind.INVALID_REQUEST, name + " is required");
		}
		return value;
	}

}
