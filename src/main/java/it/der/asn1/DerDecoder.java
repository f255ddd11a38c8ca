package it.der.asn1;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class DerDecoder {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private DerDecoder() {
    }

    // bytes after the first TLV are ignored
    public static DerNode decode(byte[] payload) {
        return decode(payload, DEFAULT_MAX_DEPTH);
    }

    public static DerNode decode(byte[] payload, int maxDepth) {
        if (payload == null || payload.length == 0) {
            throw new DerDecodeException("Cannot decode empty DER input", 0);
        }
        return decodeAt(payload, 0, payload.length, 1, maxDepth).node();
    }

    public static DerNode decodeExact(byte[] payload, int maxDepth) {
        if (payload == null || payload.length == 0) {
            throw new DerDecodeException("Cannot decode empty DER input", 0);
        }
        DecodeResult decoded = decodeAt(payload, 0, payload.length, 1, maxDepth);
        if (decoded.end() != payload.length) {
            throw new DerDecodeException("Trailing data after DER TLV", decoded.end());
        }
        return decoded.node();
    }

    public static List<DerNode> decodeAll(byte[] payload, int maxDepth) {
        List<DerNode> result = new ArrayList<>();
        int offset = 0;
        while (offset < payload.length) {
            DecodeResult decoded = decodeAt(payload, offset, payload.length, 1, maxDepth);
            result.add(decoded.node());
            offset = decoded.end();
        }
        return result;
    }

    private static DecodeResult decodeAt(byte[] payload, int offset, int limit, int depth, int maxDepth) {
        if (depth > maxDepth) {
            throw new DerDecodeException("DER nesting exceeds maximum depth " + maxDepth, offset);
        }
        if (offset >= limit) {
            throw new DerDecodeException("Missing DER tag", offset);
        }

        int index = offset;
        int identifier = payload[index++] & 0xFF;
        TagClass tagClass = TagClass.fromIdentifier(identifier);
        boolean constructed = (identifier & 0x20) != 0;
        int tag = identifier & 0x1F;
        if (tag == DerTags.HIGH_TAG_NUMBER) {
            long number = 0;
            int octet;
            do {
                if (index >= limit) {
                    throw new DerDecodeException("Truncated high-tag-number form", index);
                }
                octet = payload[index++] & 0xFF;
                number = (number << 7) | (octet & 0x7F);
                if (number > Integer.MAX_VALUE) {
                    throw new DerDecodeException("DER tag number too large", index - 1);
                }
            } while ((octet & 0x80) != 0);
            tag = (int) number;
        }

        if (index >= limit) {
            throw new DerDecodeException("Missing DER length", index);
        }

        int lengthOffset = index;
        int firstLengthOctet = payload[index++] & 0xFF;
        int valueLength;
        if (firstLengthOctet == 0x80) {
            throw new DerDecodeException("Indefinite length is not valid in DER", lengthOffset);
        }
        if (firstLengthOctet < 0x80) {
            valueLength = firstLengthOctet;
        } else {
            int numberOfLengthOctets = firstLengthOctet & 0x7F;
            if (index + numberOfLengthOctets > limit) {
                throw new DerDecodeException("Truncated DER length", index);
            }
            long length = 0;
            for (int i = 0; i < numberOfLengthOctets; i++) {
                length = (length << 8) | (payload[index++] & 0xFF);
                if (length > Integer.MAX_VALUE) {
                    throw new DerDecodeException("DER length too large", lengthOffset);
                }
            }
            valueLength = (int) length;
            if (valueLength < 0x80 || payload[lengthOffset + 1] == 0x00) {
                throw new DerDecodeException("Long-form length is not minimally encoded", lengthOffset);
            }
        }

        if (valueLength > limit - index) {
            throw new DerDecodeException(
                "Truncated value: expected " + valueLength + " bytes but only " + (limit - index) + " available", index);
        }

        int end = index + valueLength;
        if (!constructed) {
            return new DecodeResult(new DerNode.Primitive(tag, tagClass, Arrays.copyOfRange(payload, index, end)), end);
        }

        List<DerNode> children = new ArrayList<>();
        int childOffset = index;
        while (childOffset < end) {
            DecodeResult child = decodeAt(payload, childOffset, end, depth + 1, maxDepth);
            children.add(child.node());
            childOffset = child.end();
        }
        return new DecodeResult(new DerNode.Constructed(tag, tagClass, children), end);
    }

    private record DecodeResult(DerNode node, int end) {
    }
}
