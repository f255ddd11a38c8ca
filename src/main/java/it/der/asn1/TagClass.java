package it.der.asn1;

public enum TagClass {
    UNIVERSAL(0x00),
    APPLICATION(0x40),
    CONTEXT(0x80),
    PRIVATE(0xC0);

    private final int bits;

    TagClass(int bits) {
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    public static TagClass fromIdentifier(int identifierOctet) {
        return values()[(identifierOctet >> 6) & 0x03];
    }
}
