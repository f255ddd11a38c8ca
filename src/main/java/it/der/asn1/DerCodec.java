package it.der.asn1;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public final class DerCodec {

    private DerCodec() {
    }

    public static DerNode decode(byte[] payload) {
        return DerDecoder.decode(payload);
    }

    public static DerNode decodeExact(byte[] payload) {
        return DerDecoder.decodeExact(payload, DerDecoder.DEFAULT_MAX_DEPTH);
    }

    public static List<DerNode> decodeAll(byte[] payload) {
        return DerDecoder.decodeAll(payload, DerDecoder.DEFAULT_MAX_DEPTH);
    }

    public static byte[] encode(DerNode node) {
        return DerEncoder.encode(node);
    }

    public static byte[] encodeAll(List<DerNode> nodes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (DerNode node : nodes) {
            out.writeBytes(DerEncoder.encode(node));
        }
        return out.toByteArray();
    }

    public static Optional<DerNode> findOptional(List<DerNode> values, TagClass tagClass, int tag) {
        return values.stream()
            .filter(v -> v.tagClass() == tagClass && v.tag() == tag)
            .findFirst();
    }

    public static DerNode choose(List<DerNode> values, TagClass tagClass, int... tags) {
        for (int tag : tags) {
            for (DerNode value : values) {
                if (value.tagClass() == tagClass && value.tag() == tag) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("No CHOICE arm found for " + tagClass + " tags " + Arrays.toString(tags));
    }
}
