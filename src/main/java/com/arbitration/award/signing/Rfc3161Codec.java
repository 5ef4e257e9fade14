package com.arbitration.award.signing;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Minimal DER codec for RFC 3161: builds a SHA-256 TimeStampReq and reads the status and token
 * out of a TimeStampResp.
 */
public final class Rfc3161Codec {

    private static final int TAG_INTEGER = 0x02;
    private static final int TAG_OCTET_STRING = 0x04;
    private static final int TAG_NULL = 0x05;
    private static final int TAG_OID = 0x06;
    private static final int TAG_GENERALIZED_TIME = 0x18;
    private static final int TAG_SEQUENCE = 0x30;
    private static final int TAG_BOOLEAN = 0x01;

    // 2.16.840.1.101.3.4.2.1
    private static final byte[] SHA256_OID = {
            0x60, (byte) 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x02, 0x01
    };

    private Rfc3161Codec() {}

    /**
     * TimeStampReq ::= SEQUENCE { version 1, messageImprint, nonce, certReq TRUE }
     */
    public static byte[] encodeRequest(byte[] sha256Digest, BigInteger nonce) {
        byte[] algorithm = tlv(TAG_SEQUENCE, concat(tlv(TAG_OID, SHA256_OID), tlv(TAG_NULL, new byte[0])));
        byte[] imprint = tlv(TAG_SEQUENCE, concat(algorithm, tlv(TAG_OCTET_STRING, sha256Digest)));
        return tlv(TAG_SEQUENCE, concat(
                tlv(TAG_INTEGER, new byte[] {1}),
                imprint,
                tlv(TAG_INTEGER, nonce.toByteArray()),
                tlv(TAG_BOOLEAN, new byte[] {(byte) 0xFF})));
    }

    /**
     * Parsed TimeStampResp. {@code token} is the DER ContentInfo, null when status is not granted.
     */
    public record Response(int status, byte[] token) {

        public boolean granted() {
            // 0 = granted, 1 = grantedWithMods
            return (status == 0 || status == 1) && token != null;
        }
    }

    public static Response decodeResponse(byte[] der) {
        Cursor outer = new Cursor(der, 0);
        Element resp = outer.next(TAG_SEQUENCE);
        Cursor body = new Cursor(der, resp.contentStart, resp.end());

        Element statusInfo = body.next(TAG_SEQUENCE);
        Cursor statusCursor = new Cursor(der, statusInfo.contentStart, statusInfo.end());
        Element statusInt = statusCursor.next(TAG_INTEGER);
        int status = new BigInteger(Arrays.copyOfRange(der, statusInt.contentStart, statusInt.end())).intValue();

        byte[] token = null;
        if (body.hasMore()) {
            Element tokenElement = body.next(TAG_SEQUENCE);
            token = Arrays.copyOfRange(der, tokenElement.start, tokenElement.end());
        }
        return new Response(status, token);
    }

    /**
     * Extract genTime from a timestamp token: the first GeneralizedTime in the signed TSTInfo.
     * Returns null if none can be found.
     */
    public static String findGeneralizedTime(byte[] token) {
        for (int i = 0; i + 2 < token.length; i++) {
            if ((token[i] & 0xFF) != TAG_GENERALIZED_TIME) continue;
            int len = token[i + 1] & 0xFF;
            if (len < 15 || len > 23 || i + 2 + len > token.length) continue;
            String candidate = new String(token, i + 2, len, StandardCharsets.US_ASCII);
            if (candidate.matches("\\d{14}(\\.\\d+)?Z")) {
                return candidate;
            }
        }
        return null;
    }

    static byte[] tlv(int tag, byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(tag);
        writeLength(out, content.length);
        out.writeBytes(content);
        return out.toByteArray();
    }

    private static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 0x80) {
            out.write(length);
            return;
        }
        byte[] bytes = BigInteger.valueOf(length).toByteArray();
        int offset = bytes[0] == 0 ? 1 : 0;
        out.write(0x80 | (bytes.length - offset));
        out.write(bytes, offset, bytes.length - offset);
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    private record Element(int start, int contentStart, int length) {
        int end() {
            return contentStart + length;
        }
    }

    private static final class Cursor {
        private final byte[] data;
        private int pos;
        private final int limit;

        Cursor(byte[] data, int pos) {
            this(data, pos, data.length);
        }

        Cursor(byte[] data, int pos, int limit) {
            this.data = data;
            this.pos = pos;
            this.limit = limit;
        }

        boolean hasMore() {
            return pos < limit;
        }

        Element next(int expectedTag) {
            if (pos + 2 > limit) {
                throw new IllegalArgumentException("Truncated DER at offset " + pos);
            }
            int start = pos;
            int tag = data[pos++] & 0xFF;
            if (tag != expectedTag) {
                throw new IllegalArgumentException(
                        String.format("Expected DER tag 0x%02x at offset %d, found 0x%02x", expectedTag, start, tag));
            }
            int length = data[pos++] & 0xFF;
            if ((length & 0x80) != 0) {
                int count = length & 0x7F;
                if (count == 0 || count > 4 || pos + count > limit) {
                    throw new IllegalArgumentException("Unsupported DER length at offset " + start);
                }
                length = 0;
                for (int i = 0; i < count; i++) {
                    length = (length << 8) | (data[pos++] & 0xFF);
                }
            }
            if (pos + length > limit) {
                throw new IllegalArgumentException("DER element overruns buffer at offset " + start);
            }
            Element element = new Element(start, pos, length);
            pos += length;
            return element;
        }
    }
}
