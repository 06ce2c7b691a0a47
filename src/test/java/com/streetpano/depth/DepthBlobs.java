package com.streetpano.depth;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;
import java.util.zip.Deflater;

/**
 * Builds raw and encoded depth payloads byte by byte.
 */
final class DepthBlobs {

    private DepthBlobs() {
    }

    static byte[] raw(int numPlanes, int width, int height, int[] labels, float[][] planes) {
        ByteBuffer bb = ByteBuffer.allocate(8 + labels.length + planes.length * 16).order(ByteOrder.LITTLE_ENDIAN);
        bb.put((byte) 8);
        bb.putShort((short) numPlanes);
        bb.putShort((short) width);
        bb.putShort((short) height);
        bb.put((byte) 8);
        for (int label : labels) {
            bb.put((byte) label);
        }
        for (float[] p : planes) {
            for (float v : p) {
                bb.putFloat(v);
            }
        }
        return bb.array();
    }

    static byte[] deflate(byte[] raw) {
        Deflater deflater = new Deflater();
        deflater.setInput(raw);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[1024];
        while (!deflater.finished()) {
            out.write(buf, 0, deflater.deflate(buf));
        }
        deflater.end();
        return out.toByteArray();
    }

    static String encode(byte[] raw) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(deflate(raw));
    }

    static String sample() {
        return encode(raw(2, 2, 2, new int[]{0, 1, 1, 0}, new float[][]{{0, 0, 1, 5.0f}, {1, 0, 0, 3.0f}}));
    }
}
