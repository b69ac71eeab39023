package dev.mirror.transport.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.Messages;
import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelMessageJsonTest {

    @Test
    void requestIsTaggedByTypeAndKind() throws Exception {
        String json = Messages.encode(new ChannelMessage.Request("rpc-1",
            new WorkerRequest.Clone("https://github.com/u/r.git", "main", true)));

        JsonNode tree = Messages.mapper().readTree(json);
        assertThat(tree.path("type").asText()).isEqualTo("request");
        assertThat(tree.path("id").asText()).isEqualTo("rpc-1");
        assertThat(tree.path("request").path("kind").asText()).isEqualTo("clone");
        assertThat(tree.path("request").path("useProxy").asBoolean()).isTrue();

        ChannelMessage decoded = Messages.decode(json);
        assertThat(decoded).isInstanceOf(ChannelMessage.Request.class);
        assertThat(((ChannelMessage.Request) decoded).request())
            .isEqualTo(new WorkerRequest.Clone("https://github.com/u/r.git", "main", true));
    }

    @Test
    void readyCarriesNoId() throws Exception {
        String json = Messages.encode(new ChannelMessage.Ready());

        assertThat(Messages.mapper().readTree(json).path("type").asText()).isEqualTo("ready");
        assertThat(Messages.decode(json)).isInstanceOf(ChannelMessage.Ready.class);
    }

    @Test
    void relayMessagesUseExtensionTypeNames() throws Exception {
        RelayEnvelope envelope = new RelayEnvelope("relay-1", "https://example.com/info/refs", "get",
            Map.of("accept", "*/*"), new byte[] {0, -1, 7});
        String proxy = Messages.encode(new ChannelMessage.FetchProxy("relay-1", envelope));
        RelayResult result = new RelayResult("https://example.com/info/refs", "GET", 200, "OK",
            Map.of("content-type", "application/x-git"), List.of(new byte[] {1, 2, (byte) 200}));
        String answer = Messages.encode(ChannelMessage.FetchResult.success("relay-1", result));

        assertThat(Messages.mapper().readTree(proxy).path("type").asText()).isEqualTo("EXTENSION_FETCH_PROXY");
        assertThat(Messages.mapper().readTree(answer).path("type").asText()).isEqualTo("EXTENSION_FETCH_RESULT");

        ChannelMessage.FetchProxy decodedProxy = (ChannelMessage.FetchProxy) Messages.decode(proxy);
        assertThat(decodedProxy.envelope().method()).isEqualTo("GET");
        assertThat(decodedProxy.envelope().body()).containsExactly(0, -1, 7);

        ChannelMessage.FetchResult decodedAnswer = (ChannelMessage.FetchResult) Messages.decode(answer);
        assertThat(decodedAnswer.error()).isNull();
        assertThat(decodedAnswer.payload().bodyBytes()).containsExactly(1, 2, 200);
        assertThat(decodedAnswer.payload().ok()).isTrue();
    }

    @Test
    void failureKeepsErrorKind() throws Exception {
        String json = Messages.encode(new ChannelMessage.Failure("rpc-9", ErrorKind.NOT_FOUND, "missing"));

        ChannelMessage.Failure decoded = (ChannelMessage.Failure) Messages.decode(json);

        assertThat(decoded.kind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(decoded.message()).isEqualTo("missing");
        assertThat(Messages.mapper().readTree(json).path("type").asText()).isEqualTo("error");
    }

    @Test
    void relayFailureKeepsErrorKind() throws Exception {
        String json = Messages.encode(ChannelMessage.FetchResult.failure("relay-2", ErrorKind.RELAY_TIMEOUT, "timeout"));

        ChannelMessage.FetchResult decoded = (ChannelMessage.FetchResult) Messages.decode(json);

        assertThat(decoded.payload()).isNull();
        assertThat(decoded.error()).isEqualTo("timeout");
        assertThat(decoded.errorKind()).isEqualTo(ErrorKind.RELAY_TIMEOUT);
        assertThat(ChannelMessage.FetchResult.failure("relay-3", null).errorKind()).isEqualTo(ErrorKind.NETWORK_ERROR);
    }

    @Test
    void syncProgressTravelsInsideProgressMessage() throws Exception {
        String json = Messages.encode(new ChannelMessage.Progress("rpc-2", 3,
            new ProgressEvent.SyncProgress(3, 4, "b/c.txt", 1, 2)));

        ChannelMessage.Progress decoded = (ChannelMessage.Progress) Messages.decode(json);

        assertThat(decoded.seq()).isEqualTo(3);
        assertThat(decoded.event()).isEqualTo(new ProgressEvent.SyncProgress(3, 4, "b/c.txt", 1, 2));
        assertThat(((ProgressEvent.SyncProgress) decoded.event()).percent()).isEqualTo(75);
    }

    @Test
    void treeNodesOmitChildrenOfFiles() throws Exception {
        TreeNode tree = TreeNode.directory("b", "/repo/b", List.of(TreeNode.file("c.txt", "/repo/b/c.txt")));

        JsonNode json = Messages.mapper().valueToTree(tree);

        assertThat(json.path("type").asText()).isEqualTo("dir");
        assertThat(json.path("children").get(0).has("children")).isFalse();
        assertThat(json.has("directory")).isFalse();
    }

    @Test
    void unknownTypeFailsToDecode() {
        assertThatThrownBy(() -> Messages.decode("{\"type\":\"bogus\",\"id\":\"x\"}"))
            .isInstanceOf(JsonProcessingException.class);
    }
}
