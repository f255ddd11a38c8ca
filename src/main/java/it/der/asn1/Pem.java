package it.der.asn1;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

public final class Pem {

    private static final String BEGIN = "-----BEGIN ";
    private static final Pattern ARMOR = Pattern.compile("-----(BEGIN|END) [^-]+-----");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int LINE_LENGTH = 64;

    private Pem() {
    }

    public static String toPem(byte[] der, String label) {
        String base64 = Base64.getEncoder().encodeToString(der);
        StringBuilder pem = new StringBuilder();
        pem.append(BEGIN).append(label).append("-----\n");
        for (int i = 0; i < base64.length(); i += LINE_LENGTH) {
            pem.append(base64, i, Math.min(base64.length(), i + LINE_LENGTH)).append('\n');
        }
        pem.append("-----END ").append(label).append("-----\n");
        return pem.toString();
    }

    // only the first armored block is read
    public static byte[] fromPem(String pem) {
        int begin = pem.indexOf(BEGIN);
        if (begin < 0) {
            throw new IllegalArgumentException("PEM input has no BEGIN line");
        }
        String armored = pem.substring(begin);
        int end = armored.indexOf("-----END ");
        if (end < 0) {
            throw new IllegalArgumentException("PEM input has no END line");
        }
        int endLineClose = armored.indexOf("-----", end + 9);
        if (endLineClose < 0) {
            throw new IllegalArgumentException("PEM END line is not terminated");
        }
        String body = ARMOR.matcher(armored.substring(0, endLineClose + 5)).replaceAll("");
        body = WHITESPACE.matcher(body).replaceAll("");
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("PEM body is not valid base64", ex);
        }
    }

    public static boolean isPem(byte[] data) {
        return new String(data, StandardCharsets.US_ASCII).contains(BEGIN);
    }
}
