package io.github.hotbrkm.mailrouter.engine.email.tracking;

/**
 * @param applied events attached to a known email
 * @param skipped events without a message id or whose message id matched no email
 */
public record IngestSummary(int applied, int skipped) {
}
