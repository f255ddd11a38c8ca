package it.der.asn1;

public class DerDecodeException extends IllegalArgumentException {

    private final int offset;

    public DerDecodeException(String message, int offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
