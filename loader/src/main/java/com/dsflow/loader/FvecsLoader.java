package com.dsflow.loader;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Random-access reader for FVECS: little-endian float vectors, each record prefixed by its
 * dimension. Assumes every record has the dimension of the first one.
 */
public class FvecsLoader {

    /** Dimension of the first record. */
    public int dimension(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ByteBuffer hdr = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
            if (ch.read(hdr, 0) < 4) {
                throw new IOException("Empty FVECS file: " + file);
            }
            int dim = hdr.getInt(0);
            if (dim <= 0 || dim > 1_000_000) {
                throw new IOException("Invalid dimension " + dim + " in " + file);
            }
            return dim;
        }
    }

    /** Number of records, validated against the file size. */
    public long countRecords(Path file) throws IOException {
        long size = Files.size(file);
        if (size == 0) return 0;
        long recordBytes = recordBytes(dimension(file));
        if (size % recordBytes != 0) {
            throw new IOException("File size " + size + " is not a multiple of record size " + recordBytes + ": " + file);
        }
        return size / recordBytes;
    }

    /** Reads record {@code index} by offset. */
    public double[] readRecord(Path file, long index) throws IOException {
        if (index < 0) throw new IllegalArgumentException("Negative record index: " + index);
        int dim = dimension(file);
        long recordBytes = recordBytes(dim);
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            long offset = index * recordBytes;
            if (offset + recordBytes > ch.size()) {
                throw new IOException("Record " + index + " out of range in " + file);
            }
            ByteBuffer buf = ByteBuffer.allocate((int) recordBytes).order(ByteOrder.LITTLE_ENDIAN);
            while (buf.hasRemaining()) {
                if (ch.read(buf, offset + buf.position()) < 0) {
                    throw new EOFException("Truncated record " + index + " in " + file);
                }
            }
            buf.flip();
            int recDim = buf.getInt();
            if (recDim != dim) {
                throw new IOException("Record " + index + " has dimension " + recDim + ", expected " + dim);
            }
            double[] v = new double[dim];
            for (int i = 0; i < dim; i++) {
                v[i] = buf.getFloat();
            }
            return v;
        }
    }

    private static long recordBytes(int dim) {
        return 4L + 4L * dim;
    }
}
