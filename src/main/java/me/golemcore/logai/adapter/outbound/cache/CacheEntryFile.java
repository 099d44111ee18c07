/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.logai.adapter.outbound.cache;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * On-disk layout of one cache entry: a fixed binary header followed by the
 * payload bytes.
 *
 * <pre>
 * offset  size  field
 *      0     4  magic "LGAI"
 *      4     2  format version
 *      6     8  createdAt (epoch millis)
 *     14     8  lastAccessedAt (epoch millis)
 *     22     8  windowEnd (epoch millis, Long.MIN_VALUE if none)
 *     30     8  payload size in bytes
 *     38     -  payload
 * </pre>
 */
final class CacheEntryFile {

    static final String SUFFIX = ".entry";
    static final long NO_WINDOW = Long.MIN_VALUE;

    private static final int MAGIC = 0x4C474149;
    private static final short VERSION = 1;
    private static final int LAST_ACCESSED_OFFSET = 14;
    static final int HEADER_SIZE = 38;

    private CacheEntryFile() {
    }

    record Header(long createdAt, long lastAccessedAt, long windowEnd, long payloadSize) {
    }

    /**
     * Header or payload does not match the expected layout.
     */
    static class CorruptEntryException extends IOException {

        private static final long serialVersionUID = 1L;

        CorruptEntryException(String message) {
            super(message);
        }
    }

    /**
     * Writes the entry to a temporary sibling and moves it into place.
     */
    static void write(Path target, Header header, byte[] payload) throws IOException {
        Path tempPath = target.resolveSibling(target.getFileName() + ".tmp");
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + payload.length);
        buffer.putInt(MAGIC)
                .putShort(VERSION)
                .putLong(header.createdAt())
                .putLong(header.lastAccessedAt())
                .putLong(header.windowEnd())
                .putLong(payload.length)
                .put(payload)
                .flip();
        try {
            try (FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }
            try {
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempPath);
            throw e;
        }
    }

    static Header readHeader(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long fileSize = channel.size();
            if (fileSize < HEADER_SIZE) {
                throw new CorruptEntryException("file shorter than header (" + fileSize + " bytes)");
            }
            ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE);
            readFully(channel, buffer, 0);
            buffer.flip();
            if (buffer.getInt() != MAGIC) {
                throw new CorruptEntryException("bad magic");
            }
            short version = buffer.getShort();
            if (version != VERSION) {
                throw new CorruptEntryException("unsupported version " + version);
            }
            Header header = new Header(buffer.getLong(), buffer.getLong(), buffer.getLong(), buffer.getLong());
            if (header.payloadSize() < 0 || header.payloadSize() != fileSize - HEADER_SIZE) {
                throw new CorruptEntryException("payload size " + header.payloadSize() + " does not match file size "
                        + fileSize);
            }
            return header;
        }
    }

    static byte[] readPayload(Path file, long payloadSize) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            if (channel.size() != HEADER_SIZE + payloadSize) {
                throw new CorruptEntryException("payload size changed on disk");
            }
            ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(payloadSize));
            readFully(channel, buffer, HEADER_SIZE);
            return buffer.array();
        }
    }

    /**
     * Rewrites only the lastAccessedAt field in place.
     */
    static void touch(Path file, long lastAccessedAt) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES).putLong(lastAccessedAt).flip();
            long position = LAST_ACCESSED_OFFSET;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
        }
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
        long current = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, current);
            if (read < 0) {
                throw new CorruptEntryException("unexpected end of file");
            }
            current += read;
        }
    }
}
