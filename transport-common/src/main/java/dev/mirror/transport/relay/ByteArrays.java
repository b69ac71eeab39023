package dev.mirror.transport.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts binary bodies to and from the forms they take on boundaries that cannot carry a byte
 * buffer. The outgoing form is an ordered array of unsigned byte values; the incoming side also
 * accepts the shapes such arrays degrade into on the way: an index-keyed object with or without
 * a {@code length}, and base64 text.
 */
public final class ByteArrays {

    private ByteArrays() {
    }

    public static ArrayNode toNumericArray(byte[] bytes) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode(bytes == null ? 0 : bytes.length);
        if (bytes != null) {
            for (byte b : bytes) {
                array.add(b & 0xFF);
            }
        }
        return array;
    }

    /**
     * Rebuilds a byte buffer from any supported transport form.
     * @param node transported body, may be {@code null} or JSON null
     * @return the bytes, empty when there is no body
     * @throws IOException when the node holds something that is not a byte sequence
     */
    public static byte[] fromTransport(JsonNode node) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new byte[0];
        }
        if (node.isBinary()) {
            return node.binaryValue();
        }
        if (node.isTextual()) {
            try {
                return Base64.getDecoder().decode(node.asText());
            } catch (IllegalArgumentException e) {
                throw new IOException("Body text is not base64", e);
            }
        }
        if (node.isArray()) {
            byte[] bytes = new byte[node.size()];
            for (int i = 0; i < bytes.length; i++) {
                bytes[i] = toByte(node.get(i), i);
            }
            return bytes;
        }
        if (node.isObject()) {
            JsonNode length = node.get("length");
            if (length != null && length.canConvertToInt()) {
                byte[] bytes = new byte[length.asInt()];
                for (int i = 0; i < bytes.length; i++) {
                    JsonNode value = node.get(Integer.toString(i));
                    bytes[i] = value == null ? 0 : toByte(value, i);
                }
                return bytes;
            }
            // integer keys come first in ascending order, any other keys after them as given
            TreeMap<Long, JsonNode> indexed = new TreeMap<>();
            List<JsonNode> named = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Long key = indexKey(field.getKey());
                if (key != null) {
                    indexed.put(key, field.getValue());
                } else {
                    named.add(field.getValue());
                }
            }
            List<Byte> values = new ArrayList<>();
            int index = 0;
            for (JsonNode value : indexed.values()) {
                values.add(toByte(value, index++));
            }
            for (JsonNode value : named) {
                values.add(toByte(value, index++));
            }
            byte[] bytes = new byte[values.size()];
            for (int i = 0; i < bytes.length; i++) {
                bytes[i] = values.get(i);
            }
            return bytes;
        }
        throw new IOException("Unsupported body representation: " + node.getNodeType());
    }

    private static Long indexKey(String key) {
        if (key.isEmpty() || key.length() > 10 || (key.length() > 1 && key.charAt(0) == '0')) {
            return null;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return null;
            }
        }
        return Long.parseLong(key);
    }

    private static byte toByte(JsonNode value, int index) throws IOException {
        if (value == null || !value.isNumber()) {
            throw new IOException("Body element " + index + " is not a number");
        }
        int v = value.asInt();
        if (v < -128 || v > 255) {
            throw new IOException("Body element " + index + " out of byte range: " + v);
        }
        return (byte) v;
    }
}
