package it.der.service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import it.der.asn1.ObjectIdentifiers;

@Component
public class OidRegistry {

    private static final Map<String, String> WELL_KNOWN = Map.ofEntries(
        Map.entry("2.5.4.3", "commonName"),
        Map.entry("2.5.4.5", "serialNumber"),
        Map.entry("2.5.4.6", "countryName"),
        Map.entry("2.5.4.7", "localityName"),
        Map.entry("2.5.4.8", "stateOrProvinceName"),
        Map.entry("2.5.4.10", "organizationName"),
        Map.entry("2.5.4.11", "organizationalUnitName"),
        Map.entry("2.5.29.14", "subjectKeyIdentifier"),
        Map.entry("2.5.29.15", "keyUsage"),
        Map.entry("2.5.29.17", "subjectAltName"),
        Map.entry("2.5.29.19", "basicConstraints"),
        Map.entry("2.5.29.31", "cRLDistributionPoints"),
        Map.entry("2.5.29.32", "certificatePolicies"),
        Map.entry("2.5.29.35", "authorityKeyIdentifier"),
        Map.entry("2.5.29.37", "extKeyUsage"),
        Map.entry("1.2.840.113549.1.1.1", "rsaEncryption"),
        Map.entry("1.2.840.113549.1.1.11", "sha256WithRSAEncryption"),
        Map.entry("1.2.840.113549.1.1.12", "sha384WithRSAEncryption"),
        Map.entry("1.2.840.113549.1.1.13", "sha512WithRSAEncryption"),
        Map.entry("1.2.840.10045.2.1", "ecPublicKey"),
        Map.entry("1.2.840.10045.4.3.2", "ecdsa-with-SHA256"),
        Map.entry("1.2.840.113549.1.7.1", "data"),
        Map.entry("1.2.840.113549.1.7.2", "signedData"),
        Map.entry("1.2.840.113549.1.9.1", "emailAddress"),
        Map.entry("1.2.840.113549.1.9.3", "contentType"),
        Map.entry("1.2.840.113549.1.9.4", "messageDigest"),
        Map.entry("1.2.840.113549.1.9.5", "signingTime"),
        Map.entry("1.2.840.113549.1.9.16.2.15", "sigPolicyId"),
        Map.entry("1.2.840.113549.1.9.16.2.47", "signingCertificateV2"),
        Map.entry("1.3.6.1.5.5.7.1.1", "authorityInfoAccess"),
        Map.entry("1.3.6.1.5.5.7.3.1", "serverAuth"),
        Map.entry("1.3.6.1.5.5.7.3.2", "clientAuth"),
        Map.entry("2.16.840.1.101.3.4.2.1", "sha256"),
        Map.entry("2.16.840.1.101.3.4.2.2", "sha384"),
        Map.entry("2.16.840.1.101.3.4.2.3", "sha512"),
        Map.entry("2.16.76.1.3.1", "otherName-CPF"),
        Map.entry("2.16.76.1.3.2", "otherName-ICP-Brasil-Name"),
        Map.entry("2.16.76.1.3.3", "otherName-CNPJ"),
        Map.entry("2.16.76.1.3.4", "otherName-ICP-Brasil-Responsible"),
        Map.entry("2.16.76.1.3.5", "otherName-ICP-Brasil-Voter"),
        Map.entry("2.16.76.1.3.6", "otherName-ICP-Brasil-INSS"),
        Map.entry("2.16.76.1.3.7", "otherName-ICP-Brasil-CEI"),
        Map.entry("2.16.76.1.3.8", "otherName-ICP-Brasil-OAB")
    );

    private final Map<String, String> names;

    public OidRegistry(@Value("${der.oid.names:}") String extraNames) {
        Map<String, String> merged = new HashMap<>(WELL_KNOWN);
        merged.putAll(parse(extraNames));
        this.names = Map.copyOf(merged);
    }

    public Optional<String> nameOf(String oid) {
        return Optional.ofNullable(names.get(oid));
    }

    private Map<String, String> parse(String extraNames) {
        if (!StringUtils.hasText(extraNames)) {
            return Map.of();
        }

        Map<String, String> parsed = new HashMap<>();
        for (String entry : extraNames.split(";")) {
            if (!StringUtils.hasText(entry)) {
                continue;
            }
            String[] parts = entry.split("=", 2);
            if (parts.length != 2 || !StringUtils.hasText(parts[1])) {
                throw new IllegalArgumentException("Invalid OID name mapping '" + entry.trim() + "', expected oid=name");
            }
            String oid = parts[0].trim();
            // throws on malformed OIDs
            ObjectIdentifiers.oidToBytes(oid);
            parsed.put(oid, parts[1].trim());
        }
        return parsed;
    }
}
