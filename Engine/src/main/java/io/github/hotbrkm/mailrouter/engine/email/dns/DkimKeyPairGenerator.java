package io.github.hotbrkm.mailrouter.engine.email.dns;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Base64;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
public class DkimKeyPairGenerator {

    private static final int KEY_SIZE = 2048;
    private static final String PEM_LINE_SEPARATOR = "\n";

    private final DnsRecordGenerator recordGenerator;
    private final Clock clock;
    private final AtomicLong lastSelectorMillis = new AtomicLong();

    public DkimKeyPairGenerator(DnsRecordGenerator recordGenerator, Clock clock) {
        this.recordGenerator = Objects.requireNonNull(recordGenerator, "recordGenerator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DkimKeyPair generate() {
        return generate(null);
    }

    /**
     * @param domain signing domain used to name the DNS record, may be {@code null}
     */
    public DkimKeyPair generate(String domain) {
        KeyPair keyPair = newRsaKeyPair();
        String privateKeyPem = toPem("PRIVATE KEY", keyPair.getPrivate().getEncoded());
        String publicKeyPem = toPem("PUBLIC KEY", keyPair.getPublic().getEncoded());
        String publicKeyValue = recordGenerator.dkimRecord(stripPem(publicKeyPem));

        String selector = nextSelector();
        String name = domain == null || domain.isBlank() ? null : DnsRecordGenerator.dkimRecordName(selector, domain.trim());
        log.info("Generated DKIM key pair. selector={}, domain={}", selector, domain);
        return new DkimKeyPair(privateKeyPem, publicKeyValue, selector, new DkimKeyPair.DnsRecord(name, "TXT", publicKeyValue));
    }

    /**
     * Removes PEM armour and all whitespace, leaving the base64 body.
     */
    public static String stripPem(String pem) {
        return pem.replaceAll("-----(BEGIN|END) [A-Z ]+-----", "").replaceAll("\\s+", "");
    }

    private String nextSelector() {
        long now = clock.millis();
        long millis = lastSelectorMillis.updateAndGet(last -> Math.max(last + 1, now));
        return "sel" + millis;
    }

    private static KeyPair newRsaKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(KEY_SIZE);
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA key generation is not available", e);
        }
    }

    private static String toPem(String label, byte[] der) {
        Base64.Encoder encoder = Base64.getMimeEncoder(64, PEM_LINE_SEPARATOR.getBytes(StandardCharsets.US_ASCII));
        return "-----BEGIN " + label + "-----" + PEM_LINE_SEPARATOR
                + encoder.encodeToString(der) + PEM_LINE_SEPARATOR
                + "-----END " + label + "-----" + PEM_LINE_SEPARATOR;
    }
}
