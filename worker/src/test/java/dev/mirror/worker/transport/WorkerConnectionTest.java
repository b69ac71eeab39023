package dev.mirror.worker.transport;

import com.fasterxml.jackson.databind.node.TextNode;
import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.LengthPrefixedCodec;
import dev.mirror.transport.Messages;
import dev.mirror.transport.MirrorException;
import dev.mirror.transport.message.ChannelMessage;
import dev.mirror.transport.message.ProgressEvent;
import dev.mirror.transport.message.WorkerRequest;
import dev.mirror.transport.relay.NetworkFetcher;
import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;
import dev.mirror.worker.relay.RelayingTransport;
import dev.mirror.worker.service.WorkerRequestHandler;
import dev.mirror.worker.service.WorkerSession;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkerConnectionTest {

    private WorkerRequestHandler handler;
    private WorkerServer server;
    private Socket socket;
    private InputStream in;
    private OutputStream out;

    @BeforeEach
    void setUp() throws IOException {
        handler = mock(WorkerRequestHandler.class);
        NetworkFetcher fetcher = mock(NetworkFetcher.class);
        server = new WorkerServer(0, handler, escalator -> new RelayingTransport(fetcher, escalator,
            "http://localhost:7071", "https://cors.example.org", Duration.ofSeconds(5)));
        server.start();
        socket = connect();
        in = socket.getInputStream();
        out = socket.getOutputStream();
    }

    @AfterEach
    void tearDown() throws IOException {
        socket.close();
        server.stop();
    }

    @Test
    void readyIsTheFirstFrame() throws IOException {
        assertThat(read()).isInstanceOf(ChannelMessage.Ready.class);
    }

    @Test
    void progressPrecedesSuccess() throws IOException {
        when(handler.handle(any(), any(), any())).thenAnswer(invocation -> {
            Consumer<ProgressEvent> progress = invocation.getArgument(2);
            progress.accept(new ProgressEvent.Message("Counting objects"));
            progress.accept(new ProgressEvent.Message("Receiving objects"));
            return TextNode.valueOf("done");
        });
        read();

        send(new ChannelMessage.Request("rpc-1", new WorkerRequest.ReadFile("/repo/a.txt")));

        ChannelMessage first = read();
        ChannelMessage second = read();
        ChannelMessage last = read();
        assertThat(first).isEqualTo(new ChannelMessage.Progress("rpc-1", 1, new ProgressEvent.Message("Counting objects")));
        assertThat(second).isEqualTo(new ChannelMessage.Progress("rpc-1", 2, new ProgressEvent.Message("Receiving objects")));
        assertThat(last).isInstanceOfSatisfying(ChannelMessage.Success.class, success -> {
            assertThat(success.id()).isEqualTo("rpc-1");
            assertThat(success.payload().asText()).isEqualTo("done");
        });
    }

    @Test
    void missingFileIsReportedAsNotFound() throws IOException {
        when(handler.handle(any(), any(), any())).thenThrow(new NoSuchFileException("/repo/missing.txt"));
        read();

        send(new ChannelMessage.Request("rpc-2", new WorkerRequest.ReadFile("/repo/missing.txt")));

        assertThat(read()).isInstanceOfSatisfying(ChannelMessage.Failure.class, failure -> {
            assertThat(failure.id()).isEqualTo("rpc-2");
            assertThat(failure.kind()).isEqualTo(ErrorKind.NOT_FOUND);
            assertThat(failure.message()).contains("/repo/missing.txt");
        });
    }

    @Test
    void requestsRunInArrivalOrder() throws IOException {
        when(handler.handle(any(), any(), any())).thenAnswer(invocation -> {
            WorkerRequest.ReadFile request = invocation.getArgument(0);
            return TextNode.valueOf(request.path());
        });
        read();

        for (int i = 0; i < 5; i++) {
            send(new ChannelMessage.Request("rpc-" + i, new WorkerRequest.ReadFile("/repo/" + i)));
        }

        for (int i = 0; i < 5; i++) {
            ChannelMessage message = read();
            assertThat(message.id()).isEqualTo("rpc-" + i);
        }
    }

    @Test
    void escalatedRequestResumesWhenRelayAnswers() throws IOException {
        when(handler.handle(any(), any(), any())).thenAnswer(invocation -> {
            WorkerSession session = invocation.getArgument(1);
            RelayResult result = session.http().request("https://github.com/a/b.git/info/refs", "GET", Map.of(), null);
            return TextNode.valueOf(new String(result.bodyBytes(), StandardCharsets.UTF_8));
        });
        read();

        send(new ChannelMessage.Request("rpc-3", new WorkerRequest.Clone("https://github.com/a/b.git", "main", false)));

        ChannelMessage message = read();
        assertThat(message).isInstanceOf(ChannelMessage.FetchProxy.class);
        ChannelMessage.FetchProxy proxy = (ChannelMessage.FetchProxy) message;
        assertThat(proxy.envelope().url()).isEqualTo("https://github.com/a/b.git/info/refs");
        RelayResult answer = new RelayResult(proxy.envelope().url(), "GET", 200, "OK", Map.of(),
            List.of("refs".getBytes(StandardCharsets.UTF_8)));
        send(ChannelMessage.FetchResult.success(proxy.id(), answer));
        send(ChannelMessage.FetchResult.success(proxy.id(), answer));

        assertThat(read()).isInstanceOfSatisfying(ChannelMessage.Success.class,
            success -> assertThat(success.payload().asText()).isEqualTo("refs"));
    }

    @Test
    void relayFailureKindReachesTheCaller() throws IOException {
        when(handler.handle(any(), any(), any())).thenAnswer(invocation -> {
            WorkerSession session = invocation.getArgument(1);
            session.http().request("https://github.com/a/b.git/info/refs", "GET", Map.of(), null);
            return null;
        });
        read();

        send(new ChannelMessage.Request("rpc-4", new WorkerRequest.Pull("https://github.com/a/b.git", "main", false)));
        ChannelMessage.FetchProxy proxy = (ChannelMessage.FetchProxy) read();
        send(ChannelMessage.FetchResult.failure(proxy.id(), ErrorKind.RELAY_TIMEOUT, "Extension response timeout"));

        assertThat(read()).isInstanceOfSatisfying(ChannelMessage.Failure.class, failure -> {
            assertThat(failure.kind()).isEqualTo(ErrorKind.RELAY_TIMEOUT);
            assertThat(failure.message()).isEqualTo("Extension response timeout");
        });
    }

    @Test
    void secondControllerIsRefused() throws IOException {
        read();

        try (Socket second = connect()) {
            assertThat(LengthPrefixedCodec.readFrame(second.getInputStream())).isNull();
        }
    }

    @Test
    void closingFailsPendingRelays() throws Exception {
        WorkerConnection connection = new WorkerConnection("test", new ByteArrayInputStream(new byte[0]),
            new ByteArrayOutputStream(), handler, escalator -> null);
        RelayEnvelope envelope = new RelayEnvelope("relay-x-1", "https://github.com/a/b.git", "GET", null, null);

        CompletableFuture<RelayResult> pending = connection.escalate(envelope, Duration.ofSeconds(30));
        connection.close();

        assertThatThrownBy(() -> pending.get(1, TimeUnit.SECONDS))
            .hasCauseInstanceOf(MirrorException.class)
            .satisfies(ex -> assertThat(MirrorException.kindOf(ex)).isEqualTo(ErrorKind.CHANNEL_CRASHED));
        CompletableFuture<RelayResult> afterClose = connection.escalate(envelope.withId("relay-x-2"), Duration.ofSeconds(30));
        assertThat(MirrorException.kindOf(afterClose.handle((value, error) -> error).join()))
            .isEqualTo(ErrorKind.CHANNEL_CLOSED);
    }

    private Socket connect() throws IOException {
        Socket client = new Socket(InetAddress.getLoopbackAddress(), server.boundPort());
        client.setSoTimeout(5000);
        return client;
    }

    private ChannelMessage read() throws IOException {
        return Messages.decode(LengthPrefixedCodec.readFrame(in));
    }

    private void send(ChannelMessage message) throws IOException {
        LengthPrefixedCodec.writeFrame(out, Messages.encode(message));
    }
}
