package it.der.service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import it.der.asn1.DerEncoder;
import it.der.asn1.DerNode;
import it.der.asn1.DerTags;
import it.der.asn1.DerValues;
import it.der.asn1.TagClass;

/**
 * Renders a decoded tree as one line per node, in the spirit of {@code openssl asn1parse}:
 * offset, depth, header length, value length and a readable value where one exists.
 */
@Component
public class DerDumpFormatter {

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final OidRegistry oidRegistry;
    private final DumpOptions defaults;

    public DerDumpFormatter(
        OidRegistry oidRegistry,
        @Value("${der.dump.indent:2}") int indent,
        @Value("${der.dump.hex-preview-bytes:16}") int hexPreviewBytes,
        @Value("${der.dump.resolve-oid-names:true}") boolean resolveOidNames
    ) {
        this.oidRegistry = oidRegistry;
        this.defaults = new DumpOptions();
        this.defaults.setIndent(indent);
        this.defaults.setHexPreviewBytes(hexPreviewBytes);
        this.defaults.setResolveOidNames(resolveOidNames);
    }

    public DumpOptions defaults() {
        DumpOptions copy = new DumpOptions();
        copy.setIndent(defaults.getIndent());
        copy.setHexPreviewBytes(defaults.getHexPreviewBytes());
        copy.setResolveOidNames(defaults.isResolveOidNames());
        return copy;
    }

    public String format(DerNode root) {
        return format(root, defaults);
    }

    public String format(DerNode root, DumpOptions options) {
        List<String> lines = new ArrayList<>();
        render(root, 0, 0, options, lines);
        return String.join("\n", lines);
    }

    private int render(DerNode node, int offset, int depth, DumpOptions options, List<String> lines) {
        int valueLength = valueLength(node);
        int headerLength = DerEncoder.headerLength(node.tag(), valueLength);
        String name = " ".repeat(depth * options.getIndent()) + DerTags.describe(node.tagClass(), node.tag());
        lines.add(String.format("%5d:d=%-2d hl=%d l=%5d %s: %s%s",
            offset,
            depth,
            headerLength,
            valueLength,
            node.constructed() ? "cons" : "prim",
            name,
            node instanceof DerNode.Primitive primitive ? describeValue(primitive, options) : ""));

        if (node instanceof DerNode.Constructed constructed) {
            int childOffset = offset + headerLength;
            for (DerNode child : writtenOrder(constructed)) {
                childOffset += render(child, childOffset, depth + 1, options, lines);
            }
        }
        return headerLength + valueLength;
    }

    private List<DerNode> writtenOrder(DerNode.Constructed node) {
        if (!node.isUniversal(DerTags.SET)) {
            return node.children();
        }
        List<DerNode> sorted = new ArrayList<>(node.children());
        sorted.sort(Comparator.comparing(DerEncoder::encode, DerEncoder.CANONICAL_ORDER));
        return sorted;
    }

    private int valueLength(DerNode node) {
        if (node instanceof DerNode.Primitive primitive) {
            return primitive.length();
        }
        int total = 0;
        for (DerNode child : ((DerNode.Constructed) node).children()) {
            int childLength = valueLength(child);
            total += DerEncoder.headerLength(child.tag(), childLength) + childLength;
        }
        return total;
    }

    private String describeValue(DerNode.Primitive node, DumpOptions options) {
        if (node.tagClass() != TagClass.UNIVERSAL) {
            return hexPreview(node.value(), options);
        }
        try {
            return switch (node.tag()) {
                case DerTags.BOOLEAN -> " :" + (DerValues.toBoolean(node) ? "TRUE" : "FALSE");
                case DerTags.NULL -> "";
                case DerTags.INTEGER, DerTags.ENUMERATED -> " :" + describeInteger(DerValues.toBigInteger(node));
                case DerTags.OBJECT_IDENTIFIER -> " :" + describeOid(DerValues.toOid(node), options);
                case DerTags.UTF8_STRING, DerTags.PRINTABLE_STRING, DerTags.IA5_STRING, DerTags.VISIBLE_STRING,
                    DerTags.T61_STRING, DerTags.BMP_STRING, DerTags.UTC_TIME, DerTags.GENERALIZED_TIME ->
                    " :" + DerValues.toText(node);
                default -> hexPreview(node.value(), options);
            };
        } catch (IllegalArgumentException ex) {
            return " :<invalid: " + ex.getMessage() + ">" + hexPreview(node.value(), options);
        }
    }

    private String describeInteger(BigInteger value) {
        if (value.bitLength() < 64) {
            return value.toString();
        }
        return "0x" + value.toString(16).toUpperCase(Locale.ROOT);
    }

    private String describeOid(String oid, DumpOptions options) {
        if (!options.isResolveOidNames()) {
            return oid;
        }
        return oidRegistry.nameOf(oid)
            .map(name -> oid + " (" + name + ")")
            .orElse(oid);
    }

    private String hexPreview(byte[] value, DumpOptions options) {
        if (value.length == 0) {
            return "";
        }
        int shown = Math.min(value.length, Math.max(0, options.getHexPreviewBytes()));
        String preview = HEX.formatHex(value, 0, shown);
        return " [HEX]:" + preview + (shown < value.length ? "..." : "");
    }
}
