package it.der.asn1;

import java.util.Map;

public final class DerTags {

    public static final int BOOLEAN = 1;
    public static final int INTEGER = 2;
    public static final int BIT_STRING = 3;
    public static final int OCTET_STRING = 4;
    public static final int NULL = 5;
    public static final int OBJECT_IDENTIFIER = 6;
    public static final int ENUMERATED = 10;
    public static final int UTF8_STRING = 12;
    public static final int SEQUENCE = 16;
    public static final int SET = 17;
    public static final int PRINTABLE_STRING = 19;
    public static final int T61_STRING = 20;
    public static final int IA5_STRING = 22;
    public static final int UTC_TIME = 23;
    public static final int GENERALIZED_TIME = 24;
    public static final int VISIBLE_STRING = 26;
    public static final int BMP_STRING = 30;

    public static final int HIGH_TAG_NUMBER = 31;

    private static final Map<Integer, String> UNIVERSAL_NAMES = Map.ofEntries(
        Map.entry(BOOLEAN, "BOOLEAN"),
        Map.entry(INTEGER, "INTEGER"),
        Map.entry(BIT_STRING, "BIT STRING"),
        Map.entry(OCTET_STRING, "OCTET STRING"),
        Map.entry(NULL, "NULL"),
        Map.entry(OBJECT_IDENTIFIER, "OBJECT IDENTIFIER"),
        Map.entry(ENUMERATED, "ENUMERATED"),
        Map.entry(UTF8_STRING, "UTF8String"),
        Map.entry(SEQUENCE, "SEQUENCE"),
        Map.entry(SET, "SET"),
        Map.entry(PRINTABLE_STRING, "PrintableString"),
        Map.entry(T61_STRING, "T61String"),
        Map.entry(IA5_STRING, "IA5String"),
        Map.entry(UTC_TIME, "UTCTime"),
        Map.entry(GENERALIZED_TIME, "GeneralizedTime"),
        Map.entry(VISIBLE_STRING, "VisibleString"),
        Map.entry(BMP_STRING, "BMPString")
    );

    private DerTags() {
    }

    public static String describe(TagClass tagClass, int tag) {
        if (tagClass == TagClass.UNIVERSAL) {
            return UNIVERSAL_NAMES.getOrDefault(tag, "UNIVERSAL [" + tag + "]");
        }
        return switch (tagClass) {
            case APPLICATION -> "[APPLICATION " + tag + "]";
            case CONTEXT -> "[" + tag + "]";
            default -> "[PRIVATE " + tag + "]";
        };
    }
}
