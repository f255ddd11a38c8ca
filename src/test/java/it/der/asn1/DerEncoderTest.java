package it.der.asn1;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class DerEncoderTest {

    @Test
    void shouldEncodeNullAndBooleans() {
        assertArrayEquals(new byte[] {0x05, 0x00}, DerEncoder.encode(DerNodes.nullValue()));
        assertArrayEquals(new byte[] {0x01, 0x01, (byte) 0xFF}, DerEncoder.encode(DerNodes.bool(true)));
        assertArrayEquals(new byte[] {0x01, 0x01, 0x00}, DerEncoder.encode(DerNodes.bool(false)));
    }

    @Test
    void shouldEncodeEmptyAndNestedSequence() {
        assertArrayEquals(new byte[] {0x30, 0x00}, DerEncoder.encode(DerNodes.sequence()));
        assertArrayEquals(
            new byte[] {0x30, 0x06, 0x02, 0x01, 0x01, 0x01, 0x01, (byte) 0xFF},
            DerEncoder.encode(DerNodes.sequence(DerNodes.integer(1), DerNodes.bool(true))));
    }

    @Test
    void shouldEncodeLongFormLength() {
        byte[] encoded = DerEncoder.encode(DerNodes.octetString(new byte[200]));

        assertEquals(203, encoded.length);
        assertEquals(0x04, encoded[0]);
        assertEquals((byte) 0x81, encoded[1]);
        assertEquals((byte) 0xC8, encoded[2]);
    }

    @Test
    void shouldEncodeMultiOctetLengthMinimally() {
        byte[] encoded = DerEncoder.encode(DerNodes.octetString(new byte[0x1234]));

        assertArrayEquals(new byte[] {0x04, (byte) 0x82, 0x12, 0x34}, Arrays.copyOf(encoded, 4));
        assertEquals(4 + 0x1234, encoded.length);
        assertEquals(4, DerEncoder.headerLength(DerTags.OCTET_STRING, 0x1234));
    }

    @Test
    void shouldEncodeHighTagNumbers() {
        DerNode tag31 = new DerNode.Primitive(31, TagClass.CONTEXT, new byte[] {0x01});
        DerNode tag201 = new DerNode.Primitive(201, TagClass.CONTEXT, new byte[] {0x01});
        DerNode application30 = new DerNode.Constructed(30, TagClass.APPLICATION, List.of());

        assertArrayEquals(new byte[] {(byte) 0x9F, 0x1F, 0x01, 0x01}, DerEncoder.encode(tag31));
        assertArrayEquals(new byte[] {(byte) 0x9F, (byte) 0x81, 0x49, 0x01, 0x01}, DerEncoder.encode(tag201));
        assertArrayEquals(new byte[] {0x7E, 0x00}, DerEncoder.encode(application30));
        assertEquals(4, DerEncoder.headerLength(201, 1));
    }

    @Test
    void shouldSortSetChildrenByEncodedBytes() {
        DerNode unsorted = DerNodes.set(DerNodes.integer(2), DerNodes.utf8String("b"), DerNodes.integer(1));
        DerNode sorted = DerNodes.set(DerNodes.integer(1), DerNodes.integer(2), DerNodes.utf8String("b"));

        byte[] expected = {0x31, 0x09, 0x02, 0x01, 0x01, 0x02, 0x01, 0x02, 0x0C, 0x01, 'b'};
        assertArrayEquals(expected, DerEncoder.encode(unsorted));
        assertArrayEquals(DerEncoder.encode(sorted), DerEncoder.encode(unsorted));
    }

    @Test
    void shouldSortPrefixedSetChildrenShorterFirst() {
        DerNode set = DerNodes.set(
            new DerNode.Primitive(4, TagClass.UNIVERSAL, new byte[] {0x01, 0x02}),
            new DerNode.Constructed(4, TagClass.UNIVERSAL, List.of()),
            new DerNode.Primitive(4, TagClass.UNIVERSAL, new byte[] {0x01}));

        byte[] expected = {0x31, 0x09, 0x04, 0x01, 0x01, 0x04, 0x02, 0x01, 0x02, 0x24, 0x00};
        assertArrayEquals(expected, DerEncoder.encode(set));
    }

    @Test
    void shouldLeaveSequenceAndContextChildrenInOrder() {
        DerNode sequence = DerNodes.sequence(DerNodes.integer(2), DerNodes.integer(1));
        DerNode tagged = new DerNode.Constructed(17, TagClass.CONTEXT, List.of(DerNodes.integer(2), DerNodes.integer(1)));

        assertArrayEquals(new byte[] {0x30, 0x06, 0x02, 0x01, 0x02, 0x02, 0x01, 0x01}, DerEncoder.encode(sequence));
        assertArrayEquals(new byte[] {(byte) 0xB1, 0x06, 0x02, 0x01, 0x02, 0x02, 0x01, 0x01}, DerEncoder.encode(tagged));
    }

    @Test
    void shouldReencodeDecodedTreeIdentically() {
        DerNode certificateLike = DerNodes.sequence(
            DerNodes.contextTag(0, List.of(DerNodes.integer(2))),
            DerNodes.integer(new BigInteger("123456789012345678901234567890")),
            DerNodes.sequence(DerNodes.oid("1.2.840.113549.1.1.11"), DerNodes.nullValue()),
            DerNodes.sequence(
                DerNodes.set(DerNodes.sequence(DerNodes.oid("2.5.4.6"), DerNodes.printableString("BR"))),
                DerNodes.set(
                    DerNodes.sequence(DerNodes.oid("2.5.4.3"), DerNodes.utf8String("Test")),
                    DerNodes.sequence(DerNodes.oid("2.5.4.10"), DerNodes.utf8String("Org")))),
            DerNodes.sequence(
                DerNodes.utcTime(Instant.parse("2024-01-01T00:00:00Z")),
                DerNodes.generalizedTime(Instant.parse("2055-01-01T00:00:00Z"))),
            DerNodes.bitString(new byte[] {(byte) 0xAB, (byte) 0xCD}),
            DerNodes.octetString(new byte[300]));

        byte[] encoded = DerEncoder.encode(certificateLike);
        byte[] reencoded = DerEncoder.encode(DerDecoder.decode(encoded));

        assertArrayEquals(encoded, reencoded);
    }
}
