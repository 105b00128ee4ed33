// file: storage/src/main/java/io/backlite/storage/WalRecordCodec.java
package io.backlite.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing for datastore WAL records.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xB4C1
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - op:         byte (1 = PUT, 2 = DELETE, 3 = REPLACE_ALL)
 *     - collection: int32 len + UTF-8 bytes (len == -1 => null)
 *     - id:         int32 len + UTF-8 bytes (len == -1 => null)
 *     - body:       int32 len + JSON bytes  (len == -1 => null)
 * <p>
 * PUT carries the record as body, DELETE has no body, REPLACE_ALL carries the
 * whole datastore ({collection: [records]}) as body. Every op is absolute, so
 * replaying a record that a checkpoint already covers yields the same state.
 */
final class WalRecordCodec {
    static final short MAGIC = (short) 0xB4C1;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private static final TypeReference<Map<String, List<Map<String, Object>>>> STATE_TYPE = new TypeReference<>() {};

    enum Op {
        PUT(1), DELETE(2), REPLACE_ALL(3);

        final byte code;

        Op(int code) {
            this.code = (byte) code;
        }

        static Op of(byte code) {
            for (Op op : values()) {
                if (op.code == code) return op;
            }
            throw new IllegalStateException("unknown WAL op code " + code);
        }
    }

    /** Decoded payload. Only the fields relevant to {@code op} are non-null. */
    record Entry(Op op,
                 String collection,
                 String id,
                 Map<String, Object> record,
                 Map<String, List<Map<String, Object>>> state) {
    }

    private WalRecordCodec() {
    }

    static byte[] put(String collection, String id, Map<String, Object> record) {
        return frame(payload(Op.PUT, collection, id, toJson(record)));
    }

    static byte[] delete(String collection, String id) {
        return frame(payload(Op.DELETE, collection, id, null));
    }

    static byte[] replaceAll(Map<String, List<Map<String, Object>>> state) {
        return frame(payload(Op.REPLACE_ALL, null, null, toJson(state)));
    }

    static Entry decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        Op op = Op.of(b.get());
        String collection = readString(b);
        String id = readString(b);
        byte[] body = readBytes(b);
        try {
            return switch (op) {
                case PUT -> new Entry(op, collection, id, Mappers.json().readValue(body, Mappers.RECORD_TYPE), null);
                case DELETE -> new Entry(op, collection, id, null, null);
                case REPLACE_ALL -> new Entry(op, null, null, null, Mappers.json().readValue(body, STATE_TYPE));
            };
        } catch (IOException e) {
            throw new UncheckedIOException("WAL record body is not valid JSON", e);
        }
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    // ----------------- helpers -----------------

    private static byte[] frame(byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    private static byte[] payload(Op op, String collection, String id, byte[] body) {
        byte[] c = collection == null ? null : collection.getBytes(StandardCharsets.UTF_8);
        byte[] k = id == null ? null : id.getBytes(StandardCharsets.UTF_8);
        int size = 1 + lengthOf(c) + lengthOf(k) + lengthOf(body);
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(op.code);
        writeBytes(b, c);
        writeBytes(b, k);
        writeBytes(b, body);
        return b.array();
    }

    private static byte[] toJson(Object value) {
        try {
            return Mappers.json().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not representable as JSON", e);
        }
    }

    private static int lengthOf(byte[] data) {
        return 4 + (data == null ? 0 : data.length);
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) {
            b.putInt(-1);
            return;
        }
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        byte[] s = readBytes(b);
        return s == null ? null : new String(s, StandardCharsets.UTF_8);
    }
}
