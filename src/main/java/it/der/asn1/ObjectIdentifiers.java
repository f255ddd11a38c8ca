package it.der.asn1;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class ObjectIdentifiers {

    private static final Pattern ARC = Pattern.compile("0|[1-9]\\d*");
    private static final BigInteger FORTY = BigInteger.valueOf(40);
    private static final BigInteger EIGHTY = BigInteger.valueOf(80);
    private static final BigInteger MAX_SECOND_ARC = BigInteger.valueOf(39);
    private static final BigInteger SEVEN_BITS = BigInteger.valueOf(0x7F);

    private ObjectIdentifiers() {
    }

    public static byte[] oidToBytes(String dotNotation) {
        if (dotNotation == null || dotNotation.isEmpty()) {
            throw new IllegalArgumentException("OBJECT IDENTIFIER is empty");
        }
        String[] parts = dotNotation.split("\\.", -1);
        List<BigInteger> arcs = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (!ARC.matcher(part).matches()) {
                throw new IllegalArgumentException("Invalid OID component '" + part + "' in " + dotNotation);
            }
            arcs.add(new BigInteger(part));
        }
        if (arcs.size() < 2) {
            throw new IllegalArgumentException("OID must have at least 2 components: " + dotNotation);
        }

        BigInteger first = arcs.get(0);
        BigInteger second = arcs.get(1);
        if (first.compareTo(BigInteger.TWO) > 0) {
            throw new IllegalArgumentException("Invalid first OID arc: " + first + " (must be 0, 1, or 2)");
        }
        if (first.compareTo(BigInteger.TWO) < 0 && second.compareTo(MAX_SECOND_ARC) > 0) {
            throw new IllegalArgumentException(
                "Invalid second OID arc: " + second + " (must be at most 39 when the first arc is " + first + ")");
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeSubidentifier(out, FORTY.multiply(first).add(second));
        for (int i = 2; i < arcs.size(); i++) {
            writeSubidentifier(out, arcs.get(i));
        }
        return out.toByteArray();
    }

    public static String bytesToOid(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new IllegalArgumentException("Empty OID data");
        }

        StringBuilder oid = new StringBuilder();
        BigInteger value = BigInteger.ZERO;
        boolean first = true;
        for (int i = 0; i < encoded.length; i++) {
            int octet = encoded[i] & 0xFF;
            if (octet == 0x80 && value.signum() == 0) {
                throw new IllegalArgumentException("OID subidentifier has a leading 0x80 octet at index " + i);
            }
            value = value.shiftLeft(7).or(BigInteger.valueOf(octet & 0x7F));
            if ((octet & 0x80) != 0) {
                continue;
            }
            if (first) {
                appendFirstArcs(oid, value);
                first = false;
            } else {
                oid.append('.').append(value);
            }
            value = BigInteger.ZERO;
        }
        if ((encoded[encoded.length - 1] & 0x80) != 0) {
            throw new IllegalArgumentException("Truncated VLQ in OID");
        }
        return oid.toString();
    }

    private static void appendFirstArcs(StringBuilder oid, BigInteger combined) {
        if (combined.compareTo(EIGHTY) < 0) {
            BigInteger[] split = combined.divideAndRemainder(FORTY);
            oid.append(split[0]).append('.').append(split[1]);
        } else {
            oid.append("2.").append(combined.subtract(EIGHTY));
        }
    }

    private static void writeSubidentifier(ByteArrayOutputStream out, BigInteger value) {
        if (value.bitLength() <= 63) {
            DerEncoder.writeBase128(out, value.longValueExact());
            return;
        }

        int groups = (value.bitLength() + 6) / 7;
        for (int i = groups - 1; i >= 0; i--) {
            int octet = value.shiftRight(7 * i).and(SEVEN_BITS).intValue();
            if (i != 0) {
                octet |= 0x80;
            }
            out.write(octet);
        }
    }
}
