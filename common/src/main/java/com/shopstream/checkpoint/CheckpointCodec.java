package com.shopstream.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopstream.state.DimensionDescriptor;
import com.shopstream.state.FactBufferDescriptor;
import com.shopstream.state.StateSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing of a {@link Checkpoint}:
 *
 * <pre>
 * SHOPSTREAM-CHECKPOINT 1 &lt;crc32 of body, hex&gt; &lt;body length&gt;\n
 * &lt;JSON body&gt;
 * </pre>
 *
 * <p>Records in the body are plain JSON without type information.  They are read back
 * into their classes using the table descriptors of the state store and the output type,
 * so the body format is the same as the wire format of every record.</p>
 */
@Slf4j
public class CheckpointCodec {

    static final String MAGIC = "SHOPSTREAM-CHECKPOINT";
    static final int FORMAT_VERSION = 1;

    private static final TypeReference<Map<String, Map<Integer, Long>>> OFFSETS = new TypeReference<>() { };
    private static final TypeReference<Map<String, Long>> WATERMARKS = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    private final Map<String, Class<?>> dimensionTypes = new HashMap<>();
    private final Map<String, Class<?>> factTypes = new HashMap<>();
    private final Class<?> outputType;

    public CheckpointCodec(ObjectMapper objectMapper,
                           Collection<DimensionDescriptor<?>> dimensions,
                           Collection<FactBufferDescriptor<?>> facts,
                           Class<?> outputType) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        dimensions.forEach(d -> dimensionTypes.put(d.getName(), d.getType()));
        facts.forEach(f -> factTypes.put(f.getName(), f.getType()));
        this.outputType = outputType;
    }

    public byte[] encode(Checkpoint checkpoint) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(checkpoint);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise checkpoint version=" + checkpoint.getVersion(), e);
        }
        String header = String.format(Locale.ROOT, "%s %d %08x %d\n",
                MAGIC, FORMAT_VERSION, crc32(body), body.length);
        byte[] headerBytes = header.getBytes(StandardCharsets.US_ASCII);
        byte[] payload = Arrays.copyOf(headerBytes, headerBytes.length + body.length);
        System.arraycopy(body, 0, payload, headerBytes.length, body.length);
        return payload;
    }

    /**
     * @throws CheckpointCorruptException if the payload does not pass its integrity checks
     */
    public Checkpoint decode(byte[] payload) {
        int newline = indexOf(payload, (byte) '\n');
        if (newline < 0) {
            throw new CheckpointCorruptException("Missing checkpoint header");
        }
        String[] header = new String(payload, 0, newline, StandardCharsets.US_ASCII).split(" ");
        if (header.length != 4 || !MAGIC.equals(header[0])) {
            throw new CheckpointCorruptException("Not a checkpoint payload");
        }
        long expectedCrc;
        int expectedLength;
        try {
            if (Integer.parseInt(header[1]) != FORMAT_VERSION) {
                throw new CheckpointCorruptException("Unsupported checkpoint format " + header[1]);
            }
            expectedCrc = Long.parseLong(header[2], 16);
            expectedLength = Integer.parseInt(header[3]);
        } catch (NumberFormatException e) {
            throw new CheckpointCorruptException("Malformed checkpoint header", e);
        }
        byte[] body = Arrays.copyOfRange(payload, newline + 1, payload.length);
        if (body.length != expectedLength) {
            throw new CheckpointCorruptException("Checkpoint body has " + body.length
                    + " bytes, header says " + expectedLength);
        }
        if (crc32(body) != expectedCrc) {
            throw new CheckpointCorruptException("Checkpoint checksum mismatch");
        }
        try {
            return readBody(objectMapper.readTree(body));
        } catch (IOException | IllegalArgumentException e) {
            throw new CheckpointCorruptException("Unreadable checkpoint body", e);
        }
    }

    private Checkpoint readBody(JsonNode root) throws IOException {
        Checkpoint checkpoint = new Checkpoint();
        checkpoint.setVersion(root.path("version").asLong());
        checkpoint.setCreatedAt(root.path("createdAt").asLong());
        checkpoint.setGlobalWatermark(root.path("globalWatermark").asLong(Long.MIN_VALUE));
        if (root.hasNonNull("offsets")) {
            checkpoint.setOffsets(objectMapper.convertValue(root.get("offsets"), OFFSETS));
        }
        if (root.hasNonNull("sourceWatermarks")) {
            checkpoint.setSourceWatermarks(objectMapper.convertValue(root.get("sourceWatermarks"), WATERMARKS));
        }
        checkpoint.setState(readState(root.path("state")));

        List<Object> outputs = new ArrayList<>();
        for (JsonNode node : root.path("pendingOutputs")) {
            outputs.add(objectMapper.treeToValue(node, outputType));
        }
        checkpoint.setPendingOutputs(outputs);
        return checkpoint;
    }

    private StateSnapshot readState(JsonNode state) throws IOException {
        StateSnapshot snapshot = new StateSnapshot();
        Iterator<Map.Entry<String, JsonNode>> tables = state.path("dimensions").fields();
        while (tables.hasNext()) {
            Map.Entry<String, JsonNode> table = tables.next();
            Class<?> type = dimensionTypes.get(table.getKey());
            if (type == null) {
                log.warn("Checkpoint holds unknown dimension table '{}', skipping", table.getKey());
                continue;
            }
            Map<String, Object> records = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> entries = table.getValue().fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                records.put(entry.getKey(), objectMapper.treeToValue(entry.getValue(), type));
            }
            snapshot.getDimensions().put(table.getKey(), records);
        }

        Iterator<Map.Entry<String, JsonNode>> buffers = state.path("facts").fields();
        while (buffers.hasNext()) {
            Map.Entry<String, JsonNode> buffer = buffers.next();
            Class<?> type = factTypes.get(buffer.getKey());
            if (type == null) {
                log.warn("Checkpoint holds unknown fact buffer '{}', skipping", buffer.getKey());
                continue;
            }
            Map<String, List<Object>> keys = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> entries = buffer.getValue().fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                List<Object> list = new ArrayList<>();
                for (JsonNode fact : entry.getValue()) {
                    list.add(objectMapper.treeToValue(fact, type));
                }
                keys.put(entry.getKey(), list);
            }
            snapshot.getFacts().put(buffer.getKey(), keys);
        }
        return snapshot;
    }

    private static long crc32(byte[] body) {
        CRC32 crc = new CRC32();
        crc.update(body, 0, body.length);
        return crc.getValue();
    }

    private static int indexOf(byte[] bytes, byte value) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == value) {
                return i;
            }
        }
        return -1;
    }
}
