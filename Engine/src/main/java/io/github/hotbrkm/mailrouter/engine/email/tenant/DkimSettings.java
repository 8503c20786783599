package io.github.hotbrkm.mailrouter.engine.email.tenant;

import lombok.Builder;

/**
 * DKIM signing material for an SMTP tenant. {@code privateKey} is a PKCS#8 key, with or without PEM framing.
 */
@Builder(toBuilder = true)
public record DkimSettings(boolean enabled, String privateKey, String selector, String domain) {

    public boolean isUsable() {
        return enabled && hasText(privateKey) && hasText(selector) && hasText(domain);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
