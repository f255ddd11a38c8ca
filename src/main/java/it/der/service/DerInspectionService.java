package it.der.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import it.der.asn1.DerDecodeException;
import it.der.asn1.DerDecoder;
import it.der.asn1.DerNode;
import it.der.asn1.Pem;

@Service
public class DerInspectionService {

    private static final Logger logger = LoggerFactory.getLogger(DerInspectionService.class);

    private final DerDumpFormatter formatter;
    private final int maxDepth;

    public DerInspectionService(
        DerDumpFormatter formatter,
        @Value("${der.decoder.max-depth:" + DerDecoder.DEFAULT_MAX_DEPTH + "}") int maxDepth
    ) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("der.decoder.max-depth must be positive: " + maxDepth);
        }
        this.formatter = formatter;
        this.maxDepth = maxDepth;
    }

    public InspectionResult inspect(Path file) {
        byte[] raw;
        try {
            raw = Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + file, ex);
        }
        return inspect(file.toString(), raw);
    }

    public InspectionResult inspect(String source, byte[] raw) {
        boolean pem = Pem.isPem(raw);
        byte[] der = pem ? Pem.fromPem(new String(raw, StandardCharsets.US_ASCII)) : raw;

        List<DerNode> values;
        try {
            values = DerDecoder.decodeAll(der, maxDepth);
        } catch (DerDecodeException ex) {
            logger.warn("Rejected malformed DER from {} [offset={}, reason={}]", source, ex.offset(), ex.getMessage());
            throw ex;
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("No DER content in " + source);
        }

        StringBuilder dump = new StringBuilder();
        for (DerNode value : values) {
            if (dump.length() > 0) {
                dump.append('\n');
            }
            dump.append(formatter.format(value));
        }

        logger.info("Decoded {} [format={}, bytes={}, topLevelValues={}]", source, pem ? "PEM" : "DER", der.length, values.size());
        return new InspectionResult(source, pem, der.length, values, dump.toString());
    }

    public record InspectionResult(String source, boolean pem, int derLength, List<DerNode> values, String dump) {
    }
}
