package io.github.hotbrkm.mailrouter.engine.email.dns;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Produces the DNS records and setup instructions recommended for a sending domain.
 */
public class DnsRecordGenerator {

    public static final String DKIM_PUBLIC_KEY_PLACEHOLDER = "<YOUR_DKIM_PUBLIC_KEY>";
    public static final String MX_PLACEHOLDER = "10 mail.your-provider.com";
    public static final int RECORD_TTL = 3600;

    private static final String GOOGLE_INCLUDE = "include:_spf.google.com";
    private static final String MICROSOFT_INCLUDE = "include:spf.protection.outlook.com";

    public String spfRecord(String smtpHost) {
        StringBuilder record = new StringBuilder("v=spf1");
        String host = smtpHost == null ? "" : smtpHost.trim().toLowerCase(Locale.ROOT);

        if (host.contains("gmail") || host.contains("google")) {
            record.append(' ').append(GOOGLE_INCLUDE);
        } else if (host.contains("outlook") || host.contains("hotmail")) {
            record.append(' ').append(MICROSOFT_INCLUDE);
        } else if (!host.isEmpty()) {
            record.append(" a:").append(host);
        } else {
            record.append(" a");
        }

        return record.append(" ~all").toString();
    }

    public String dkimRecord() {
        return dkimRecord(DKIM_PUBLIC_KEY_PLACEHOLDER);
    }

    public String dkimRecord(String publicKey) {
        return "v=DKIM1; k=rsa; p=" + publicKey;
    }

    public String dmarcRecord(String domain) {
        String reportAddress = "mailto:dmarc@" + domain;
        return "v=DMARC1; p=quarantine; rua=" + reportAddress + "; ruf=" + reportAddress + "; fo=1";
    }

    public String mxRecord() {
        return MX_PLACEHOLDER;
    }

    public static String dkimRecordName(String selector, String domain) {
        return selector + "._domainkey." + domain;
    }

    public static String dmarcRecordName(String domain) {
        return "_dmarc." + domain;
    }

    /**
     * Human-readable steps for every record that still needs action, followed by general advice.
     */
    public List<String> setupInstructions(String domain, String dkimSelector, DnsRecordValidation spf, DnsRecordValidation dkim,
                                          DnsRecordValidation dmarc, DnsRecordValidation mx) {
        List<String> instructions = new ArrayList<>();
        instructions.add("# DNS Configuration Instructions for Email Deliverability");
        instructions.add("");
        instructions.add("Add the following DNS records to your domain registrar or DNS provider:");
        instructions.add("");

        if (!spf.valid() && spf.recommendedValue() != null) {
            addRecordBlock(instructions, "## SPF Record (Sender Policy Framework)", "TXT", domain, spf.recommendedValue());
            instructions.add("");
        }

        if (!dkim.valid()) {
            String value = dkim.recommendedValue() != null ? dkim.recommendedValue() : dkimRecord();
            addRecordBlock(instructions, "## DKIM Record (DomainKeys Identified Mail)", "TXT", dkimRecordName(dkimSelector, domain), value);
            instructions.add("Note: You need to generate a DKIM key pair. Use the private key in your SMTP configuration.");
            instructions.add("");
        }

        if (!dmarc.valid() && dmarc.recommendedValue() != null) {
            addRecordBlock(instructions, "## DMARC Record (Domain-based Message Authentication)", "TXT", dmarcRecordName(domain),
                    dmarc.recommendedValue());
            instructions.add("");
        }

        if (!mx.valid()) {
            addRecordBlock(instructions, "## MX Record (Mail Exchange)", "MX", domain, mxRecord());
            instructions.add("Note: Replace \"mail.your-provider.com\" with your actual mail server.");
            instructions.add("");
        }

        instructions.add("## Additional Recommendations:");
        instructions.add("1. Use a static IP address for your SMTP server");
        instructions.add("2. Ensure reverse DNS (PTR) record is set for your IP");
        instructions.add("3. Implement proper bounce handling");
        instructions.add("4. Monitor your sender reputation regularly");
        instructions.add("5. Use TLS encryption for all email connections");
        return instructions;
    }

    private void addRecordBlock(List<String> instructions, String title, String type, String name, String value) {
        instructions.add(title);
        instructions.add("Record Type: " + type);
        instructions.add("Name: " + name);
        instructions.add("Value: " + value);
        instructions.add("TTL: " + RECORD_TTL);
    }
}
