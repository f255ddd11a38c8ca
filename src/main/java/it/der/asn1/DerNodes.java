package it.der.asn1;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public final class DerNodes {

    static final DateTimeFormatter UTC_TIME_FORMAT =
        DateTimeFormatter.ofPattern("uuMMddHHmmss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);
    static final DateTimeFormatter GENERALIZED_TIME_FORMAT =
        DateTimeFormatter.ofPattern("uuuuMMddHHmmss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private DerNodes() {
    }

    public static DerNode sequence(DerNode... children) {
        return sequence(Arrays.asList(children));
    }

    public static DerNode sequence(List<DerNode> children) {
        return new DerNode.Constructed(DerTags.SEQUENCE, TagClass.UNIVERSAL, children);
    }

    // children may be given in any order, the encoder sorts them
    public static DerNode set(DerNode... children) {
        return set(Arrays.asList(children));
    }

    public static DerNode set(List<DerNode> children) {
        return new DerNode.Constructed(DerTags.SET, TagClass.UNIVERSAL, children);
    }

    public static DerNode integer(long value) {
        return integer(BigInteger.valueOf(value));
    }

    public static DerNode integer(BigInteger value) {
        return universal(DerTags.INTEGER, value.toByteArray());
    }

    public static DerNode oid(String dotNotation) {
        return universal(DerTags.OBJECT_IDENTIFIER, ObjectIdentifiers.oidToBytes(dotNotation));
    }

    public static DerNode octetString(byte[] data) {
        return universal(DerTags.OCTET_STRING, data);
    }

    public static DerNode bitString(byte[] data) {
        return bitString(data, 0);
    }

    public static DerNode bitString(byte[] data, int unusedBits) {
        if (unusedBits < 0 || unusedBits > 7) {
            throw new IllegalArgumentException("BIT STRING unused bits must be between 0 and 7: " + unusedBits);
        }
        if (data.length == 0 && unusedBits != 0) {
            throw new IllegalArgumentException("Empty BIT STRING cannot declare unused bits");
        }
        byte[] value = new byte[data.length + 1];
        value[0] = (byte) unusedBits;
        System.arraycopy(data, 0, value, 1, data.length);
        return universal(DerTags.BIT_STRING, value);
    }

    public static DerNode utf8String(String value) {
        return universal(DerTags.UTF8_STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    public static DerNode ia5String(String value) {
        return universal(DerTags.IA5_STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    public static DerNode printableString(String value) {
        return universal(DerTags.PRINTABLE_STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    public static DerNode bool(boolean value) {
        return universal(DerTags.BOOLEAN, new byte[] {value ? (byte) 0xFF : 0x00});
    }

    public static DerNode nullValue() {
        return universal(DerTags.NULL, new byte[0]);
    }

    public static DerNode utcTime(Instant instant) {
        // two-digit years read back as 1950-2049
        requireYear(instant, 1950, 2049, "UTCTime");
        return universal(DerTags.UTC_TIME, UTC_TIME_FORMAT.format(instant).getBytes(StandardCharsets.US_ASCII));
    }

    public static DerNode generalizedTime(Instant instant) {
        requireYear(instant, 0, 9999, "GeneralizedTime");
        return universal(DerTags.GENERALIZED_TIME, GENERALIZED_TIME_FORMAT.format(instant).getBytes(StandardCharsets.US_ASCII));
    }

    public static DerNode contextTag(int tag, List<DerNode> children) {
        return contextTag(tag, children, true);
    }

    // implicit tagging keeps the single child's content under the new identifier
    public static DerNode contextTag(int tag, List<DerNode> children, boolean explicit) {
        if (explicit) {
            return new DerNode.Constructed(tag, TagClass.CONTEXT, children);
        }
        if (children.size() != 1) {
            throw new IllegalArgumentException(
                "Implicit context tag requires exactly one child node, got " + children.size());
        }

        DerNode child = children.get(0);
        if (child instanceof DerNode.Constructed constructed) {
            return new DerNode.Constructed(tag, TagClass.CONTEXT, constructed.children());
        }
        return new DerNode.Primitive(tag, TagClass.CONTEXT, ((DerNode.Primitive) child).value());
    }

    private static void requireYear(Instant instant, int min, int max, String type) {
        int year = instant.atZone(ZoneOffset.UTC).getYear();
        if (year < min || year > max) {
            throw new IllegalArgumentException(type + " year must be between " + min + " and " + max + ": " + year);
        }
    }

    private static DerNode universal(int tag, byte[] value) {
        return new DerNode.Primitive(tag, TagClass.UNIVERSAL, value);
    }
}
