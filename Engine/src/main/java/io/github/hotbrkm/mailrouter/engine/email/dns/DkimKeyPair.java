package io.github.hotbrkm.mailrouter.engine.email.dns;

/**
 * Generated DKIM signing material.
 *
 * @param privateKey PKCS#8 PEM, to be stored in the SMTP configuration
 * @param publicKey  TXT value to publish ({@code v=DKIM1; k=rsa; p=...})
 * @param selector   unique time-based selector
 * @param dnsRecord  record to publish; its name is {@code null} when no domain was known
 */
public record DkimKeyPair(String privateKey, String publicKey, String selector, DnsRecord dnsRecord) {

    public record DnsRecord(String name, String type, String value) {
    }
}
