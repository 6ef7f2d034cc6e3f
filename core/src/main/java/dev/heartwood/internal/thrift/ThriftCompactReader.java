/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.heartwood.internal.thrift;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import dev.heartwood.MalformedMetadataException;

/**
 * Reader for the Thrift Compact Protocol over a read-only view of a {@link ByteBuffer}.
 * <p>
 * The reader never copies the underlying bytes: binary fields are returned as slices of
 * the view, and only {@link #readString()} materializes data. A reader is a cursor and
 * must not be shared between threads; it must also not outlive the buffer it was created
 * from. Independent readers over the same buffer are fine, each works on its own slice.
 * </p>
 * Reference: https://github.com/apache/thrift/blob/master/doc/specs/thrift-compact-protocol.md
 */
public final class ThriftCompactReader {

    public static final byte TYPE_STOP = 0x00;
    public static final byte TYPE_BOOLEAN_TRUE = 0x01;
    public static final byte TYPE_BOOLEAN_FALSE = 0x02;
    public static final byte TYPE_BYTE = 0x03;
    public static final byte TYPE_I16 = 0x04;
    public static final byte TYPE_I32 = 0x05;
    public static final byte TYPE_I64 = 0x06;
    public static final byte TYPE_DOUBLE = 0x07;
    public static final byte TYPE_BINARY = 0x08;
    public static final byte TYPE_LIST = 0x09;
    public static final byte TYPE_SET = 0x0A;
    public static final byte TYPE_MAP = 0x0B;
    public static final byte TYPE_STRUCT = 0x0C;

    /**
     * Maximum depth of nested structs. Parquet metadata rarely goes beyond a handful of levels.
     */
    public static final int MAX_NESTING = 8;

    /**
     * Maximum depth of nested lists, sets and maps when skipping values.
     */
    static final int MAX_CONTAINER_DEPTH = 64;

    private static final int MAX_VARINT_BYTES = 10;

    private final ByteBuffer buffer;
    private short lastFieldId = 0;

    // Saved field ids of the enclosing structs; allocated once per reader
    private final short[] fieldIdStack = new short[MAX_NESTING];
    private int stackDepth = 0;

    // Booleans are encoded in the type nibble of the field header
    private boolean hasPendingBoolean = false;
    private boolean pendingBoolean = false;

    /**
     * Creates a reader over the remaining bytes of the given buffer. The buffer's
     * position and limit are not modified.
     *
     * @param buffer the buffer to read from (position should be at start of data)
     */
    public ThriftCompactReader(ByteBuffer buffer) {
        this.buffer = buffer.asReadOnlyBuffer().slice().order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Creates a reader over the buffer's bytes from {@code offset} up to its limit.
     *
     * @param buffer the buffer to read from
     * @param offset the offset within the buffer to start reading
     */
    public ThriftCompactReader(ByteBuffer buffer, int offset) {
        this.buffer = buffer.asReadOnlyBuffer()
                .slice(offset, buffer.limit() - offset)
                .order(ByteOrder.LITTLE_ENDIAN);
    }

    public ThriftCompactReader(byte[] data) {
        this(ByteBuffer.wrap(data));
    }

    /**
     * Returns the number of bytes read so far.
     */
    public int getBytesRead() {
        return buffer.position();
    }

    /**
     * Returns the number of bytes left to read.
     */
    public int remaining() {
        return buffer.remaining();
    }

    /**
     * Returns the number of struct contexts currently pushed.
     */
    public int nestingDepth() {
        return stackDepth;
    }

    /**
     * Read a single byte.
     */
    public byte readByte() throws MalformedMetadataException {
        if (!buffer.hasRemaining()) {
            throw prematureEnd("byte");
        }
        return buffer.get();
    }

    /**
     * Read an unsigned varint (ULEB128) of at most 64 bits.
     */
    public long readVarint() throws MalformedMetadataException {
        long result = 0;
        int shift = 0;
        for (int i = 0; i < MAX_VARINT_BYTES; i++) {
            if (!buffer.hasRemaining()) {
                throw prematureEnd("varint");
            }
            int b = buffer.get() & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new MalformedMetadataException("Varint longer than " + MAX_VARINT_BYTES + " bytes at position " + buffer.position());
    }

    /**
     * Read a zigzag-encoded 32-bit signed integer.
     */
    public int readZigzag32() throws MalformedMetadataException {
        int n = (int) readVarint();
        return (n >>> 1) ^ -(n & 1);
    }

    /**
     * Read a zigzag-encoded 64-bit signed integer.
     */
    public long readZigzag64() throws MalformedMetadataException {
        long n = readVarint();
        return (n >>> 1) ^ -(n & 1);
    }

    public short readI16() throws MalformedMetadataException {
        return (short) readZigzag32();
    }

    public int readI32() throws MalformedMetadataException {
        return readZigzag32();
    }

    public long readI64() throws MalformedMetadataException {
        return readZigzag64();
    }

    /**
     * Read a double value (8 bytes, little-endian).
     */
    public double readDouble() throws MalformedMetadataException {
        if (buffer.remaining() < Double.BYTES) {
            throw prematureEnd("double");
        }
        return buffer.getDouble();
    }

    /**
     * Read a length-prefixed binary value. The returned buffer is a read-only view of
     * the underlying bytes and is valid as long as the source buffer is.
     */
    public ByteBuffer readBinary() throws MalformedMetadataException {
        int length = readBinaryLength();
        ByteBuffer slice = buffer.slice(buffer.position(), length);
        buffer.position(buffer.position() + length);
        return slice;
    }

    /**
     * Read a length-prefixed binary value into a new array.
     */
    public byte[] readBinaryBytes() throws MalformedMetadataException {
        byte[] data = new byte[readBinaryLength()];
        buffer.get(data);
        return data;
    }

    /**
     * Read a UTF-8 string value.
     */
    public String readString() throws MalformedMetadataException {
        return new String(readBinaryBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Read a boolean value. If the value was carried by the field header just read,
     * that value is returned and nothing is consumed.
     */
    public boolean readBoolean() throws MalformedMetadataException {
        if (hasPendingBoolean) {
            hasPendingBoolean = false;
            return pendingBoolean;
        }
        return readByte() == 1;
    }

    /**
     * Read a field header and return field info.
     * Returns null when STOP field is encountered.
     */
    public FieldHeader readFieldHeader() throws MalformedMetadataException {
        byte b = readByte();

        if (b == TYPE_STOP) {
            return null;
        }

        byte type = (byte) (b & 0x0F);
        int fieldIdDelta = (b >> 4) & 0x0F;

        short fieldId;
        if (fieldIdDelta == 0) {
            // Long form, the field id follows as zigzag i16
            fieldId = readI16();
        }
        else {
            fieldId = (short) (lastFieldId + fieldIdDelta);
        }
        lastFieldId = fieldId;

        if (type == TYPE_BOOLEAN_TRUE) {
            hasPendingBoolean = true;
            pendingBoolean = true;
        }
        else if (type == TYPE_BOOLEAN_FALSE) {
            hasPendingBoolean = true;
            pendingBoolean = false;
        }

        return new FieldHeader(fieldId, type);
    }

    /**
     * Read a list or set header.
     */
    public CollectionHeader readListHeader() throws MalformedMetadataException {
        byte sizeAndType = readByte();
        int size = (sizeAndType >> 4) & 0x0F;
        byte elementType = (byte) (sizeAndType & 0x0F);

        if (size == 15) {
            size = readSize("list");
        }

        return new CollectionHeader(elementType, size);
    }

    /**
     * Read a map header. An empty map has no key/value type byte on the wire, in which
     * case both types are reported as {@link #TYPE_STOP}.
     */
    public MapHeader readMapHeader() throws MalformedMetadataException {
        int size = readSize("map");
        if (size == 0) {
            return new MapHeader(TYPE_STOP, TYPE_STOP, 0);
        }

        byte types = readByte();
        return new MapHeader((byte) ((types >> 4) & 0x0F), (byte) (types & 0x0F), size);
    }

    /**
     * Save the current last field id and reset it before reading a nested struct.
     */
    public void pushStruct() throws MalformedMetadataException {
        if (stackDepth >= MAX_NESTING) {
            throw new MalformedMetadataException("Thrift struct nesting too deep (max " + MAX_NESTING + ")");
        }
        fieldIdStack[stackDepth++] = lastFieldId;
        lastFieldId = 0;
    }

    /**
     * Restore the last field id after reading a nested struct.
     */
    public void popStruct() throws MalformedMetadataException {
        if (stackDepth <= 0) {
            throw new MalformedMetadataException("Thrift struct stack underflow");
        }
        lastFieldId = fieldIdStack[--stackDepth];
    }

    /**
     * Skip a value of the given type.
     */
    public void skipField(byte type) throws MalformedMetadataException {
        skip(type, 0);
    }

    /**
     * Skip an entire struct (read until STOP field).
     */
    public void skipStruct() throws MalformedMetadataException {
        skip(TYPE_STRUCT, 0);
    }

    private void skip(byte type, int containerDepth) throws MalformedMetadataException {
        switch (type) {
            case TYPE_BOOLEAN_TRUE:
            case TYPE_BOOLEAN_FALSE:
                // Value was in the field header; container elements go through skipElement
                hasPendingBoolean = false;
                break;
            case TYPE_BYTE:
                advance(1, "byte");
                break;
            case TYPE_I16:
            case TYPE_I32:
            case TYPE_I64:
                readVarint();
                break;
            case TYPE_DOUBLE:
                advance(Double.BYTES, "double");
                break;
            case TYPE_BINARY:
                advance(readBinaryLength(), "binary");
                break;
            case TYPE_LIST:
            case TYPE_SET: {
                checkContainerDepth(containerDepth);
                CollectionHeader listHeader = readListHeader();
                for (int i = 0; i < listHeader.size(); i++) {
                    skipElement(listHeader.elementType(), containerDepth + 1);
                }
                break;
            }
            case TYPE_MAP: {
                checkContainerDepth(containerDepth);
                MapHeader mapHeader = readMapHeader();
                for (int i = 0; i < mapHeader.size(); i++) {
                    skipElement(mapHeader.keyType(), containerDepth + 1);
                    skipElement(mapHeader.valueType(), containerDepth + 1);
                }
                break;
            }
            case TYPE_STRUCT:
                pushStruct();
                while (true) {
                    FieldHeader header = readFieldHeader();
                    if (header == null) {
                        break;
                    }
                    skip(header.type(), containerDepth);
                }
                popStruct();
                break;
            default:
                throw new MalformedMetadataException("Cannot skip unknown Thrift type " + type + " at position " + buffer.position());
        }
    }

    /**
     * Skip one list, set or map element. Booleans in containers are a full byte each.
     */
    private void skipElement(byte type, int containerDepth) throws MalformedMetadataException {
        if (type == TYPE_BOOLEAN_TRUE || type == TYPE_BOOLEAN_FALSE) {
            advance(1, "bool");
        }
        else {
            skip(type, containerDepth);
        }
    }

    private int readBinaryLength() throws MalformedMetadataException {
        long length = readVarint();
        if (length < 0 || length > buffer.remaining()) {
            throw new MalformedMetadataException("Invalid binary length " + length + " at position " + buffer.position()
                    + ", " + buffer.remaining() + " bytes remaining");
        }
        return (int) length;
    }

    private int readSize(String kind) throws MalformedMetadataException {
        long size = readVarint();
        if (size < 0 || size > Integer.MAX_VALUE) {
            throw new MalformedMetadataException("Invalid " + kind + " size " + size + " at position " + buffer.position());
        }
        return (int) size;
    }

    private void advance(int count, String what) throws MalformedMetadataException {
        if (buffer.remaining() < count) {
            throw prematureEnd(what);
        }
        buffer.position(buffer.position() + count);
    }

    private void checkContainerDepth(int containerDepth) throws MalformedMetadataException {
        if (containerDepth >= MAX_CONTAINER_DEPTH) {
            throw new MalformedMetadataException("Thrift container nesting too deep (max " + MAX_CONTAINER_DEPTH + ")");
        }
    }

    private MalformedMetadataException prematureEnd(String what) {
        return new MalformedMetadataException("Unexpected end of Thrift data while reading " + what + " at position " + buffer.position());
    }

    public record FieldHeader(short fieldId, byte type) {
    }

    public record CollectionHeader(byte elementType, int size) {
    }

    public record MapHeader(byte keyType, byte valueType, int size) {
    }
}
