package it.der.asn1;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * One ASN.1 value: a tag number, a tag class and either raw octets ({@link Primitive})
 * or an ordered list of children ({@link Constructed}).
 */
public sealed interface DerNode permits DerNode.Primitive, DerNode.Constructed {

    int tag();

    TagClass tagClass();

    boolean constructed();

    default boolean isUniversal(int universalTag) {
        return tagClass() == TagClass.UNIVERSAL && tag() == universalTag;
    }

    record Primitive(int tag, TagClass tagClass, byte[] value) implements DerNode {

        public Primitive {
            DerNode.requireTag(tag, tagClass);
            Objects.requireNonNull(value, "value");
            value = value.clone();
        }

        @Override
        public boolean constructed() {
            return false;
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        public int length() {
            return value.length;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            return other instanceof Primitive that
                && tag == that.tag
                && tagClass == that.tagClass
                && Arrays.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hash(tag, tagClass) + Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return DerTags.describe(tagClass, tag) + " " + HexFormat.of().withUpperCase().formatHex(value);
        }
    }

    record Constructed(int tag, TagClass tagClass, List<DerNode> children) implements DerNode {

        public Constructed {
            DerNode.requireTag(tag, tagClass);
            children = List.copyOf(children);
        }

        @Override
        public boolean constructed() {
            return true;
        }

        @Override
        public String toString() {
            return DerTags.describe(tagClass, tag) + " " + children;
        }
    }

    private static void requireTag(int tag, TagClass tagClass) {
        if (tag < 0) {
            throw new IllegalArgumentException("Invalid ASN.1 tag number: " + tag);
        }
        Objects.requireNonNull(tagClass, "tagClass");
    }
}
