package io.github.hotbrkm.mailrouter.engine.email.send.transport.api;

import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import com.sendgrid.helpers.mail.objects.Personalization;
import io.github.hotbrkm.mailrouter.engine.email.send.OutboundMessage;
import io.github.hotbrkm.mailrouter.engine.email.send.result.DeliveryResult;
import io.github.hotbrkm.mailrouter.engine.email.send.result.ProviderUsed;
import io.github.hotbrkm.mailrouter.engine.email.tenant.SendGridConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

/**
 * HTTP API provider. Every failure, including authentication and quota errors, is returned as a failed result.
 */
@Slf4j
public class SendGridApiClient {

    public static final String CUSTOM_ARG_TENANT = "tenantId";
    public static final String CUSTOM_ARG_CORRELATION = "correlationId";

    private final Function<String, SendGrid> sendGridFactory;
    private final Clock clock;

    public SendGridApiClient(Clock clock) {
        this(SendGrid::new, clock);
    }

    public SendGridApiClient(Function<String, SendGrid> sendGridFactory, Clock clock) {
        this.sendGridFactory = Objects.requireNonNull(sendGridFactory, "sendGridFactory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DeliveryResult send(SendGridConfig config, OutboundMessage message) {
        long startMillis = clock.millis();
        try {
            Request request = new Request();
            request.setMethod(Method.POST);
            request.setEndpoint("mail/send");
            request.setBody(buildMail(config, message).build());

            Response response = sendGridFactory.apply(config.apiKey()).api(request);
            long deliveryTime = clock.millis() - startMillis;
            int status = response.getStatusCode();

            if (status >= 200 && status < 300) {
                String messageId = response.getHeaders() == null ? null : response.getHeaders().get("X-Message-Id");
                log.info("Email sent via SendGrid. to={}, messageId={}, deliveryTime={}ms", message.to(), messageId, deliveryTime);
                return DeliveryResult.success(messageId, deliveryTime, ProviderUsed.SENDGRID);
            }
            log.warn("SendGrid API returned {}. to={}, body={}", status, message.to(), response.getBody());
            return DeliveryResult.failure("SendGrid API error " + status + ": " + response.getBody(), deliveryTime, ProviderUsed.SENDGRID);
        } catch (IOException | RuntimeException e) {
            log.warn("SendGrid API call failed. to={}, message={}", message.to(), e.getMessage());
            String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return DeliveryResult.failure(error, clock.millis() - startMillis, ProviderUsed.SENDGRID);
        }
    }

    private Mail buildMail(SendGridConfig config, OutboundMessage message) {
        Personalization personalization = new Personalization();
        personalization.addTo(new Email(message.to()));
        if (message.tenantId() != null) {
            personalization.addCustomArg(CUSTOM_ARG_TENANT, message.tenantId());
        }
        if (message.correlationId() != null) {
            personalization.addCustomArg(CUSTOM_ARG_CORRELATION, message.correlationId());
        }

        Mail mail = new Mail();
        mail.setFrom(config.fromName() == null ? new Email(config.fromEmail()) : new Email(config.fromEmail(), config.fromName()));
        mail.setSubject(message.subject());
        mail.addPersonalization(personalization);
        if (message.replyTo() != null) {
            mail.setReplyTo(new Email(message.replyTo()));
        }
        mail.addContent(new Content("text/html", message.htmlContent()));
        return mail;
    }
}
