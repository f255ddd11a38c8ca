package it.der.asn1;

import java.math.BigInteger;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;

public final class DerValues {

    private static final DateTimeFormatter UTC_TIME_PARSE = DateTimeFormatter.ofPattern("uuMMddHHmmss'Z'", Locale.ROOT);
    private static final DateTimeFormatter GENERALIZED_TIME_PARSE = DateTimeFormatter.ofPattern("uuuuMMddHHmmss'Z'", Locale.ROOT);

    private DerValues() {
    }

    public static BigInteger toBigInteger(DerNode node) {
        byte[] value = primitiveValue(node, DerTags.INTEGER, DerTags.ENUMERATED);
        if (value.length == 0) {
            throw new IllegalArgumentException("DER INTEGER has no content octets");
        }
        if (value.length > 1) {
            boolean redundantZero = value[0] == 0x00 && (value[1] & 0x80) == 0;
            boolean redundantOnes = value[0] == (byte) 0xFF && (value[1] & 0x80) != 0;
            if (redundantZero || redundantOnes) {
                throw new IllegalArgumentException("DER INTEGER is not minimally encoded");
            }
        }
        return new BigInteger(value);
    }

    public static long toLong(DerNode node) {
        BigInteger value = toBigInteger(node);
        if (value.bitLength() > 63) {
            throw new IllegalArgumentException("DER INTEGER does not fit in a long: " + value);
        }
        return value.longValue();
    }

    public static boolean toBoolean(DerNode node) {
        byte[] value = primitiveValue(node, DerTags.BOOLEAN);
        if (value.length != 1) {
            throw new IllegalArgumentException("DER BOOLEAN must have exactly one content octet");
        }
        return switch (value[0]) {
            case 0x00 -> false;
            case (byte) 0xFF -> true;
            default -> throw new IllegalArgumentException(
                "DER BOOLEAN must be 0x00 or 0xFF, got 0x" + Integer.toHexString(value[0] & 0xFF));
        };
    }

    public static String toOid(DerNode node) {
        return ObjectIdentifiers.bytesToOid(primitiveValue(node, DerTags.OBJECT_IDENTIFIER));
    }

    public static String toText(DerNode node) {
        byte[] value = primitiveValue(node,
            DerTags.UTF8_STRING,
            DerTags.PRINTABLE_STRING,
            DerTags.IA5_STRING,
            DerTags.VISIBLE_STRING,
            DerTags.T61_STRING,
            DerTags.BMP_STRING,
            DerTags.UTC_TIME,
            DerTags.GENERALIZED_TIME);
        return new String(value, charsetOf(node.tag()));
    }

    public static Instant toInstant(DerNode node) {
        byte[] value = primitiveValue(node, DerTags.UTC_TIME, DerTags.GENERALIZED_TIME);
        String text = new String(value, StandardCharsets.US_ASCII);
        try {
            if (node.tag() == DerTags.GENERALIZED_TIME) {
                return LocalDateTime.parse(text, GENERALIZED_TIME_PARSE).toInstant(ZoneOffset.UTC);
            }
            LocalDateTime parsed = LocalDateTime.parse(text, UTC_TIME_PARSE);
            // RFC 5280 4.1.2.5.1: YY >= 50 is 19YY
            int twoDigitYear = parsed.getYear() % 100;
            int year = twoDigitYear >= 50 ? 1900 + twoDigitYear : 2000 + twoDigitYear;
            return parsed.withYear(year).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid DER time value: " + text, ex);
        }
    }

    public static BitString toBitString(DerNode node) {
        byte[] value = primitiveValue(node, DerTags.BIT_STRING);
        if (value.length == 0) {
            throw new IllegalArgumentException("DER BIT STRING has no unused-bits octet");
        }
        int unusedBits = value[0] & 0xFF;
        if (unusedBits > 7 || (value.length == 1 && unusedBits != 0)) {
            throw new IllegalArgumentException("Invalid DER BIT STRING unused bits: " + unusedBits);
        }
        return new BitString(unusedBits, Arrays.copyOfRange(value, 1, value.length));
    }

    public static byte[] toOctets(DerNode node) {
        return primitiveValue(node, DerTags.OCTET_STRING);
    }

    private static Charset charsetOf(int tag) {
        return switch (tag) {
            case DerTags.UTF8_STRING -> StandardCharsets.UTF_8;
            case DerTags.BMP_STRING -> StandardCharsets.UTF_16BE;
            case DerTags.T61_STRING -> StandardCharsets.ISO_8859_1;
            default -> StandardCharsets.US_ASCII;
        };
    }

    private static byte[] primitiveValue(DerNode node, int... expectedTags) {
        if (!(node instanceof DerNode.Primitive primitive) || node.tagClass() != TagClass.UNIVERSAL) {
            throw new IllegalArgumentException("Expected a universal primitive value but found " + DerTags.describe(node.tagClass(), node.tag()));
        }
        for (int expected : expectedTags) {
            if (primitive.tag() == expected) {
                return primitive.value();
            }
        }
        throw new IllegalArgumentException("Unexpected DER type " + DerTags.describe(node.tagClass(), node.tag())
            + ", expected " + Arrays.toString(Arrays.stream(expectedTags).mapToObj(t -> DerTags.describe(TagClass.UNIVERSAL, t)).toArray()));
    }

    public record BitString(int unusedBits, byte[] bytes) {

        public BitString {
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof BitString that && unusedBits == that.unusedBits && Arrays.equals(bytes, that.bytes);
        }

        @Override
        public int hashCode() {
            return 31 * unusedBits + Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "BitString[unusedBits=" + unusedBits + ", length=" + bytes.length + "]";
        }
    }
}
