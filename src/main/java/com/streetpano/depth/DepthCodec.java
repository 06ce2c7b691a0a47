package com.streetpano.depth;

import com.streetpano.depth.DepthDecodeException.Stage;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Codec for the compressed plane depth map carried in panorama metadata.
 * <p>
 * Wire layout, after URL-safe base64 and zlib:
 * <pre>
 * offset 0      u8   header size (8)
 * offset 1      u16  number of planes
 * offset 3      u16  width
 * offset 5      u16  height
 * offset 7      u8   offset of the label array
 * labelOffset   u8[width*height]  plane label per pixel, row-major
 * ...           f32[4] per plane  nx, ny, nz, d
 * </pre>
 * All multi-byte values are little-endian. Every layout violation is a
 * {@link DepthDecodeException}; nothing is truncated or repaired silently.
 */
public final class DepthCodec {
    public static final int HEADER_SIZE = 8;
    public static final int PLANE_RECORD_SIZE = 4 * Float.BYTES;

    private DepthCodec() {
    }

    public static DepthMap decode(String encoded) throws DepthDecodeException {
        byte[] compressed = decodeBase64(encoded);
        byte[] data = inflate(compressed);
        return parse(data);
    }

    static byte[] decodeBase64(String encoded) throws DepthDecodeException {
        if (encoded == null || encoded.trim().isEmpty()) {
            throw new DepthDecodeException(Stage.BASE64, "empty payload");
        }
        String s = encoded.trim().replace('-', '+').replace('_', '/');
        int rem = s.length() % 4;
        if (rem != 0) {
            s = s + "====".substring(rem);
        }
        try {
            return Base64.getDecoder().decode(s);
        } catch (IllegalArgumentException e) {
            throw new DepthDecodeException(Stage.BASE64, e.getMessage(), e);
        }
    }

    static byte[] inflate(byte[] compressed) throws DepthDecodeException {
        Inflater inflater = new Inflater();
        inflater.setInput(compressed);
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, compressed.length * 4));
        byte[] buf = new byte[8192];
        try {
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DepthDecodeException(Stage.INFLATE, "truncated zlib stream after " + out.size() + " bytes");
                }
                out.write(buf, 0, n);
            }
        } catch (DataFormatException e) {
            throw new DepthDecodeException(Stage.INFLATE, e.getMessage(), e);
        } finally {
            inflater.end();
        }
        return out.toByteArray();
    }

    /**
     * Parses the decompressed buffer.
     */
    public static DepthMap parse(byte[] data) throws DepthDecodeException {
        if (data.length == 0) {
            throw new DepthDecodeException(Stage.HEADER, "truncated: empty buffer");
        }
        int hsize = data[0] & 0xFF;
        if (hsize < HEADER_SIZE) {
            throw new DepthDecodeException(Stage.HEADER, "header size " + hsize + " is smaller than " + HEADER_SIZE);
        }
        if (data.length < hsize) {
            throw new DepthDecodeException(Stage.HEADER, "truncated: header needs " + hsize + " bytes, buffer has " + data.length);
        }

        ByteBuffer bb = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        int numPlanes = bb.getShort(1) & 0xFFFF;
        int width = bb.getShort(3) & 0xFFFF;
        int height = bb.getShort(5) & 0xFFFF;
        int labelOffset = data[7] & 0xFF;
        if (width == 0 || height == 0) {
            throw new DepthDecodeException(Stage.HEADER, "empty size " + width + "x" + height);
        }

        long n = (long) width * height;
        if (labelOffset + n > data.length) {
            throw new DepthDecodeException(Stage.LABELS, "truncated: " + n + " labels at offset " + labelOffset
                    + ", buffer has " + data.length + " bytes");
        }
        int[] labels = new int[(int) n];
        for (int i = 0; i < labels.length; i++) {
            int label = data[labelOffset + i] & 0xFF;
            if (label >= numPlanes) {
                throw new DepthDecodeException(Stage.LABELS, "out-of-range: label " + label + " at pixel " + i
                        + " (byte offset " + (labelOffset + i) + "), only " + numPlanes + " planes");
            }
            labels[i] = label;
        }

        int planeOffset = labelOffset + labels.length;
        long needed = (long) numPlanes * PLANE_RECORD_SIZE;
        if (data.length - planeOffset < needed) {
            throw new DepthDecodeException(Stage.PLANES, "truncated: " + numPlanes + " planes need " + needed
                    + " bytes at offset " + planeOffset + ", " + (data.length - planeOffset) + " left");
        }
        List<Plane> planes = new ArrayList<>(numPlanes);
        for (int i = 0; i < numPlanes; i++) {
            int off = planeOffset + i * PLANE_RECORD_SIZE;
            planes.add(new Plane(bb.getFloat(off), bb.getFloat(off + 4), bb.getFloat(off + 8), bb.getFloat(off + 12)));
        }
        return new DepthMap(width, height, labels, planes);
    }

    /**
     * Encodes a depth map into the same URL-safe, unpadded form the metadata carries.
     */
    public static String encode(DepthMap map) {
        byte[] raw = serialize(map);
        Deflater deflater = new Deflater();
        deflater.setInput(raw);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length);
        byte[] buf = new byte[8192];
        try {
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
        } finally {
            deflater.end();
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(out.toByteArray());
    }

    /**
     * Uncompressed binary layout of a depth map.
     */
    public static byte[] serialize(DepthMap map) {
        int numPlanes = map.getPlanes().size();
        if (numPlanes > 256) {
            throw new IllegalArgumentException("At most 256 planes fit a one-byte label, got " + numPlanes);
        }
        if (map.getWidth() > 0xFFFF || map.getHeight() > 0xFFFF) {
            throw new IllegalArgumentException("Size " + map.getWidth() + "x" + map.getHeight() + " does not fit in 16 bits");
        }
        int[] labels = map.getLabels();
        ByteBuffer bb = ByteBuffer.allocate(HEADER_SIZE + labels.length + numPlanes * PLANE_RECORD_SIZE)
                .order(ByteOrder.LITTLE_ENDIAN);
        bb.put((byte) HEADER_SIZE);
        bb.putShort((short) numPlanes);
        bb.putShort((short) map.getWidth());
        bb.putShort((short) map.getHeight());
        bb.put((byte) HEADER_SIZE);
        for (int label : labels) {
            bb.put((byte) label);
        }
        for (Plane p : map.getPlanes()) {
            bb.putFloat(p.getNx());
            bb.putFloat(p.getNy());
            bb.putFloat(p.getNz());
            bb.putFloat(p.getDistance());
        }
        return bb.array();
    }
}
