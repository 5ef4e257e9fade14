package com.arbitration.award.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Twilio delivery of case notifications to parties and arbitrators.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    public enum Channel { SMS, WHATSAPP }

    private boolean enabled = false;
    private String accountSid;
    private String authToken;
    private String fromNumber;
    private Channel channel = Channel.SMS;
    private int maxBodyLength = 1500;
    // appended as "View: <portalUrl>/cases/<caseId>" when the message metadata names a case
    private String portalUrl;

    public String channelTag() {
        return channel.name().toLowerCase();
    }
}
