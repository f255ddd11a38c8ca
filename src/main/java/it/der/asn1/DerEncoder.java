package it.der.asn1;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

public final class DerEncoder {

    public static final Comparator<byte[]> CANONICAL_ORDER = Arrays::compareUnsigned;

    private DerEncoder() {
    }

    public static byte[] encode(DerNode node) {
        byte[] value = encodeValue(node);
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length + 6);
        writeTag(out, node.tagClass(), node.constructed(), node.tag());
        writeLength(out, value.length);
        out.writeBytes(value);
        return out.toByteArray();
    }

    private static byte[] encodeValue(DerNode node) {
        if (node instanceof DerNode.Primitive primitive) {
            return primitive.value();
        }

        DerNode.Constructed constructed = (DerNode.Constructed) node;
        List<byte[]> encodedChildren = new ArrayList<>(constructed.children().size());
        for (DerNode child : constructed.children()) {
            encodedChildren.add(encode(child));
        }
        if (constructed.isUniversal(DerTags.SET)) {
            encodedChildren.sort(CANONICAL_ORDER);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] child : encodedChildren) {
            out.writeBytes(child);
        }
        return out.toByteArray();
    }

    private static void writeTag(ByteArrayOutputStream out, TagClass tagClass, boolean constructed, int tag) {
        int firstOctet = tagClass.bits();
        if (constructed) {
            firstOctet |= 0x20;
        }
        if (tag < DerTags.HIGH_TAG_NUMBER) {
            out.write(firstOctet | tag);
            return;
        }

        out.write(firstOctet | DerTags.HIGH_TAG_NUMBER);
        writeBase128(out, tag);
    }

    public static int headerLength(int tag, int valueLength) {
        int identifier = 1;
        if (tag >= DerTags.HIGH_TAG_NUMBER) {
            for (int remaining = tag; remaining > 0; remaining >>>= 7) {
                identifier++;
            }
        }
        int length = 1;
        if (valueLength >= 128) {
            for (int remaining = valueLength; remaining > 0; remaining >>>= 8) {
                length++;
            }
        }
        return identifier + length;
    }

    static void writeBase128(ByteArrayOutputStream out, long number) {
        int[] chunks = new int[10];
        int chunkCount = 0;
        long remaining = number;
        do {
            chunks[chunkCount++] = (int) (remaining & 0x7F);
            remaining >>>= 7;
        } while (remaining > 0);

        for (int i = chunkCount - 1; i >= 0; i--) {
            int octet = chunks[i];
            if (i != 0) {
                octet |= 0x80;
            }
            out.write(octet);
        }
    }

    private static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 128) {
            out.write(length);
            return;
        }

        int temp = length;
        int bytes = 0;
        byte[] lengthBuffer = new byte[4];
        while (temp > 0) {
            lengthBuffer[bytes++] = (byte) (temp & 0xFF);
            temp >>= 8;
        }
        out.write(0x80 | bytes);
        for (int i = bytes - 1; i >= 0; i--) {
            out.write(lengthBuffer[i]);
        }
    }
}
