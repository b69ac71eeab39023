package dev.mirror.transport.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import dev.mirror.transport.Messages;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ByteArraysTest {

    @Test
    void numericArrayUsesUnsignedValues() {
        ArrayNode array = ByteArrays.toNumericArray(new byte[] {0, 127, -128, -1});

        assertThat(array.toString()).isEqualTo("[0,127,128,255]");
    }

    @Test
    void randomBodySurvivesNumericArrayAndJsonText() throws IOException {
        byte[] body = new byte[4096];
        new Random(42).nextBytes(body);

        String text = Messages.mapper().writeValueAsString(ByteArrays.toNumericArray(body));
        byte[] restored = ByteArrays.fromTransport(Messages.mapper().readTree(text));

        assertThat(restored).isEqualTo(body);
    }

    @Test
    void acceptsIndexKeyedObjectWithLength() throws IOException {
        JsonNode node = Messages.mapper().readTree("{\"0\":104,\"1\":105,\"2\":33,\"length\":3}");

        assertThat(ByteArrays.fromTransport(node)).containsExactly('h', 'i', '!');
    }

    @Test
    void acceptsIndexKeyedObjectWithoutLengthInKeyOrder() throws IOException {
        JsonNode node = Messages.mapper().readTree("{\"0\":1,\"1\":2,\"2\":255}");

        assertThat(ByteArrays.fromTransport(node)).containsExactly(1, 2, -1);
    }

    @Test
    void indexKeyedObjectIsOrderedNumericallyWhateverTheFieldOrder() throws IOException {
        JsonNode node = Messages.mapper().readTree("{\"10\":11,\"2\":3,\"0\":1,\"1\":2,\"9\":10}");

        assertThat(ByteArrays.fromTransport(node)).containsExactly(1, 2, 3, 10, 11);
    }

    @Test
    void acceptsBase64TextAndNothing() throws IOException {
        assertThat(ByteArrays.fromTransport(Messages.mapper().readTree("\"AQID\""))).containsExactly(1, 2, 3);
        assertThat(ByteArrays.fromTransport(null)).isEmpty();
        assertThat(ByteArrays.fromTransport(Messages.mapper().readTree("null"))).isEmpty();
    }

    @Test
    void rejectsNonNumericElements() throws IOException {
        JsonNode node = Messages.mapper().readTree("[1,\"two\",3]");

        assertThatThrownBy(() -> ByteArrays.fromTransport(node))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("element 1");
    }

    @Test
    void originComparisonNormalizesDefaultPorts() {
        assertThat(RelayEnvelope.originOf("https://github.com/u/r.git/info/refs"))
            .isEqualTo(RelayEnvelope.originOf("https://GitHub.com:443/other"));
        assertThat(RelayEnvelope.originOf("http://localhost:7071/x"))
            .isNotEqualTo(RelayEnvelope.originOf("http://localhost:8080/x"));
    }
}
