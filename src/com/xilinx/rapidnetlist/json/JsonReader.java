/*
 * Original work: Copyright (c) 2022, Xilinx, Inc.
 *                Copyright (c) 2022, Advanced Micro Devices, Inc.
 * Modified work: Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * Author: Jakob Wenzel, Xilinx Research Labs.
 *
 * This file is part of RapidNetlist.
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
 */

package com.xilinx.rapidnetlist.json;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Byte cursor over an InputStream containing JSON text, with a single byte of
 * lookahead. This class buffers its input internally. To minimize copying data,
 * combining it with a {@link java.io.BufferedInputStream} should be avoided.
 */
public class JsonReader implements AutoCloseable {

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    private static final Charset charset = StandardCharsets.UTF_8;

    private final Path fileName;

    private final InputStream in;

    private final byte[] buffer;

    private int offset = 0;
    private int available = 0;
    private boolean sawEOF = false;

    /** Mark the stream before every refill so unconsumed bytes can be handed back */
    private final boolean markRefills;

    /** Number of bytes handed out by {@link #read()} so far */
    private long byteOffset = 0;

    /** Collects the bytes of the string currently being read */
    private byte[] stringBuffer = new byte[256];
    private int stringLength = 0;

    /**
     * @param fileName Name of the file being read, used in error messages. May be null.
     * @param in Stream holding the JSON text
     * @param bufferSize Number of bytes read from the stream at a time
     * @param markRefills If the stream supports mark/reset, mark it before each
     * refill so that {@link #releaseUnconsumed()} can hand back buffered bytes
     */
    public JsonReader(Path fileName, InputStream in, int bufferSize, boolean markRefills) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("buffer size must be positive but is " + bufferSize);
        }
        this.fileName = fileName;
        this.in = in;
        this.buffer = new byte[bufferSize];
        this.markRefills = markRefills && in.markSupported();
    }

    public JsonReader(Path fileName, InputStream in, int bufferSize) {
        this(fileName, in, bufferSize, false);
    }

    public JsonReader(Path fileName, InputStream in) {
        this(fileName, in, DEFAULT_BUFFER_SIZE);
    }

    public JsonReader(InputStream in) {
        this(null, in, DEFAULT_BUFFER_SIZE);
    }

    /**
     * Load more data from stream, once all buffered bytes have been consumed.
     * @return True if at least one byte is available, false at end of stream.
     */
    private boolean fill() {
        if (offset < available) {
            return true;
        }
        if (sawEOF) {
            return false;
        }
        try {
            int actuallyRead;
            if (markRefills) {
                in.mark(buffer.length);
            }
            do {
                actuallyRead = in.read(buffer, 0, buffer.length);
            } while (actuallyRead == 0);
            if (actuallyRead == -1) {
                sawEOF = true;
                offset = 0;
                available = 0;
                return false;
            }
            offset = 0;
            available = actuallyRead;
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: IOException while reading JSON file: "
                    + fileName, e);
        }
    }

    /**
     * Consume the next byte.
     * @return The byte as a value from 0 to 255, or -1 at end of stream.
     */
    public int read() {
        if (!fill()) {
            return -1;
        }
        byteOffset++;
        return buffer[offset++] & 0xff;
    }

    /**
     * Look at the next byte without consuming it.
     * @return The byte as a value from 0 to 255, or -1 at end of stream.
     */
    public int peek() {
        if (!fill()) {
            return -1;
        }
        return buffer[offset] & 0xff;
    }

    /**
     * Starts collecting bytes for a new string, see {@link #appendStringByte(int)}.
     */
    void beginString() {
        stringLength = 0;
    }

    void appendStringByte(int b) {
        if (stringLength == stringBuffer.length) {
            stringBuffer = Arrays.copyOf(stringBuffer, stringBuffer.length * 2);
        }
        stringBuffer[stringLength++] = (byte) b;
    }

    /**
     * Decodes the bytes collected since the last {@link #beginString()}.
     * Multi-byte characters are decoded as a whole, so they may span buffer refills.
     * @return The decoded string
     */
    String endString() {
        return new String(stringBuffer, 0, stringLength, charset);
    }

    /**
     * Returns the buffered but not yet consumed bytes to the underlying stream,
     * leaving it positioned right after the last byte handed out by
     * {@link #read()}. Only possible when the reader was created with
     * markRefills and the stream supports mark/reset.
     * @return True if the stream is now positioned after the last consumed byte.
     */
    public boolean releaseUnconsumed() {
        if (offset >= available) {
            return true;
        }
        if (!markRefills) {
            return false;
        }
        try {
            in.reset();
            long toSkip = offset;
            while (toSkip > 0) {
                long skipped = in.skip(toSkip);
                if (skipped <= 0) {
                    throw new IOException("Could not skip consumed bytes after reset");
                }
                toSkip -= skipped;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: IOException while reading JSON file: "
                    + fileName, e);
        }
        offset = 0;
        available = 0;
        return true;
    }

    public boolean isAtEOF() {
        return peek() == -1;
    }

    public Path getFileName() {
        return fileName;
    }

    public long getByteOffset() {
        return byteOffset;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
