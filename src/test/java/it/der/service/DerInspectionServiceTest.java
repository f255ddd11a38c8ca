package it.der.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import it.der.asn1.DerCodec;
import it.der.asn1.DerDecodeException;
import it.der.asn1.DerNode;
import it.der.asn1.DerNodes;
import it.der.asn1.Pem;

class DerInspectionServiceTest {

    private final DerDumpFormatter formatter = new DerDumpFormatter(new OidRegistry(""), 2, 16, true);
    private final DerInspectionService service = new DerInspectionService(formatter, 8);

    @TempDir
    Path tempDir;

    private final DerNode algorithm = DerNodes.sequence(DerNodes.oid("1.2.840.113549.1.1.11"), DerNodes.nullValue());

    @Test
    void shouldInspectBinaryDerFile() throws IOException {
        Path file = tempDir.resolve("algorithm.der");
        Files.write(file, DerCodec.encode(algorithm));

        DerInspectionService.InspectionResult result = service.inspect(file);

        assertFalse(result.pem());
        assertEquals(15, result.derLength());
        assertEquals(algorithm, result.values().get(0));
        assertTrue(result.dump().contains("1.2.840.113549.1.1.11 (sha256WithRSAEncryption)"));
    }

    @Test
    void shouldInspectPemArmoredFile() throws IOException {
        Path file = tempDir.resolve("algorithm.pem");
        Files.writeString(file, Pem.toPem(DerCodec.encode(algorithm), "ALGORITHM"), StandardCharsets.US_ASCII);

        DerInspectionService.InspectionResult result = service.inspect(file);

        assertTrue(result.pem());
        assertEquals(algorithm, result.values().get(0));
    }

    @Test
    void shouldDumpEveryTopLevelValue() {
        byte[] stream = DerCodec.encodeAll(java.util.List.of(DerNodes.integer(1), DerNodes.integer(2)));

        DerInspectionService.InspectionResult result = service.inspect("stream", stream);

        assertEquals(2, result.values().size());
        assertEquals(2, result.dump().split("\n").length);
    }

    @Test
    void shouldRethrowDecodeFailures() {
        DerDecodeException ex = assertThrows(DerDecodeException.class,
            () -> service.inspect("truncated", new byte[] {0x02, 0x05, 0x01}));
        assertEquals(2, ex.offset());
    }

    @Test
    void shouldApplyConfiguredDepthLimit() {
        DerNode deep = DerNodes.integer(0);
        for (int i = 0; i < 8; i++) {
            deep = DerNodes.sequence(deep);
        }
        byte[] encoded = DerCodec.encode(deep);

        assertThrows(DerDecodeException.class, () -> service.inspect("deep", encoded));
    }

    @Test
    void shouldRejectEmptyInputAndMissingFiles() {
        assertThrows(IllegalArgumentException.class, () -> service.inspect("empty", new byte[0]));
        assertThrows(UncheckedIOException.class, () -> service.inspect(tempDir.resolve("missing.der")));
        assertThrows(IllegalArgumentException.class, () -> new DerInspectionService(formatter, 0));
    }
}
