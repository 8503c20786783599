package io.github.hotbrkm.mailrouter.engine.email.dns;

public enum DnsRecordType {
    SPF(30),
    DKIM(25),
    DMARC(25),
    MX(20);

    private final int weight;

    DnsRecordType(int weight) {
        this.weight = weight;
    }

    /**
     * Share of the overall domain score, out of 100.
     */
    public int weight() {
        return weight;
    }
}
