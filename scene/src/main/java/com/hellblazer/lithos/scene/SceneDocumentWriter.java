/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Lithos.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.lithos.scene;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Serializes scene documents to JSON for transmission. When compression is enabled, float and int buffers longer than
 * the configured threshold are replaced by a descriptor holding the little endian buffer, zlib deflated and Base64
 * encoded:
 *
 * <pre>
 * {"encoding": "zlib+base64", "dtype": "float32", "count": 300, "data": "eJz..."}
 * </pre>
 *
 * @author hal.hildebrand
 */
public class SceneDocumentWriter {
    public static final  String ENCODING = "zlib+base64";
    private static final Logger log      = LoggerFactory.getLogger(SceneDocumentWriter.class);

    private final SceneExportConfiguration config;
    private final ObjectMapper             objectMapper;

    public SceneDocumentWriter(SceneExportConfiguration config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.objectMapper = new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    static byte[] deflate(byte[] raw) {
        var deflater = new Deflater(Deflater.BEST_SPEED);
        try {
            deflater.setInput(raw);
            deflater.finish();
            var out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
            var chunk = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(chunk);
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    /**
     * Decode a compressed float buffer descriptor produced by this writer.
     *
     * @throws IllegalArgumentException if the descriptor is not a compressed float32 buffer or is corrupt
     */
    public static float[] decodeFloats(Map<String, ?> descriptor) {
        var buffer = decode(descriptor, "float32");
        var result = new float[buffer.remaining() / Float.BYTES];
        buffer.asFloatBuffer().get(result);
        return result;
    }

    /**
     * Decode a compressed int buffer descriptor produced by this writer.
     *
     * @throws IllegalArgumentException if the descriptor is not a compressed int32 buffer or is corrupt
     */
    public static int[] decodeInts(Map<String, ?> descriptor) {
        var buffer = decode(descriptor, "int32");
        var result = new int[buffer.remaining() / Integer.BYTES];
        buffer.asIntBuffer().get(result);
        return result;
    }

    private static ByteBuffer decode(Map<String, ?> descriptor, String dtype) {
        if (!ENCODING.equals(descriptor.get("encoding")) || !dtype.equals(descriptor.get("dtype"))) {
            throw new IllegalArgumentException("Not a compressed " + dtype + " buffer: " + descriptor.keySet());
        }
        int count = ((Number) descriptor.get("count")).intValue();
        var compressed = Base64.getDecoder().decode((String) descriptor.get("data"));
        var raw = new byte[count * 4];
        var inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            int read = 0;
            while (read < raw.length && !inflater.finished()) {
                int n = inflater.inflate(raw, read, raw.length - read);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                read += n;
            }
            if (read != raw.length) {
                throw new IllegalArgumentException("Truncated buffer: expected " + raw.length + " bytes, got " + read);
            }
        } catch (DataFormatException e) {
            throw new IllegalArgumentException("Corrupt compressed buffer: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
        return ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
    }

    public SceneExportConfiguration config() {
        return config;
    }

    /**
     * Prepare the scene document for transmission, compressing large buffers when enabled
     */
    public Map<String, Object> encode(SceneMesh scene) {
        @SuppressWarnings("unchecked")
        var encoded = (Map<String, Object>) encodeValue(scene.toDocument());
        return encoded;
    }

    /**
     * @return the UTF-8 JSON form of the encoded scene document
     */
    public byte[] write(SceneMesh scene) {
        try {
            var bytes = objectMapper.writeValueAsBytes(encode(scene));
            log.debug("Serialized scene of {} entities to {} bytes (compression {})", scene.entities().size(),
                      bytes.length, config.compressBuffers() ? "on" : "off");
            return bytes;
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to serialize scene document", e);
        }
    }

    /**
     * Parse a document previously produced by {@link #write(SceneMesh)}
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> read(byte[] json) {
        try {
            return objectMapper.readValue(json, Map.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to parse scene document", e);
        }
    }

    private Map<String, Object> compress(ByteBuffer buffer, String dtype, int count) {
        var raw = new byte[buffer.capacity()];
        buffer.rewind();
        buffer.get(raw);
        var descriptor = new LinkedHashMap<String, Object>();
        descriptor.put("encoding", ENCODING);
        descriptor.put("dtype", dtype);
        descriptor.put("count", count);
        descriptor.put("data", Base64.getEncoder().encodeToString(deflate(raw)));
        return descriptor;
    }

    private Object encodeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), encodeValue(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(this::encodeValue).toList();
        }
        if (!config.compressBuffers()) {
            return value;
        }
        if (value instanceof float[] floats && floats.length > config.compressionThreshold()) {
            var buffer = ByteBuffer.allocate(floats.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
            buffer.asFloatBuffer().put(floats);
            return compress(buffer, "float32", floats.length);
        }
        if (value instanceof int[] ints && ints.length > config.compressionThreshold()) {
            var buffer = ByteBuffer.allocate(ints.length * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
            buffer.asIntBuffer().put(ints);
            return compress(buffer, "int32", ints.length);
        }
        return value;
    }
}
