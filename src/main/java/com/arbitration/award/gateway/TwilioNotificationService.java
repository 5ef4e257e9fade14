package com.arbitration.award.gateway;

import com.arbitration.award.config.MetricsConfig;
import com.arbitration.award.config.TwilioNotificationConfig;
import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.model.NotificationTemplate;
import com.arbitration.award.model.UserAccount;
import com.arbitration.award.repository.UserRepository;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * SMS / WhatsApp delivery through Twilio. Sends synchronously: callers need to know whether
 * the message was accepted before stamping a delivery time.
 */
@Service
public class TwilioNotificationService implements NotificationGateway {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;
    private final UserRepository userRepository;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig,
                                     UserRepository userRepository) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.userRepository = userRepository;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.channelTag());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    @Override
    @Observed(name = "notification.send", contextualName = "send-notification")
    public void send(String userId, NotificationTemplate template, String subject, String body,
                     Map<String, Object> metadata) {
        if (!config.isEnabled()) {
            metricsConfig.recordNotification(config.channelTag(), "disabled");
            throw new ExternalServiceException("notification", "Notification delivery is disabled", null);
        }

        UserAccount user = userRepository.findById(userId);
        if (user == null || user.getPhoneNumber() == null) {
            metricsConfig.recordNotification(config.channelTag(), "no_recipient");
            throw new ExternalServiceException("notification",
                    "No phone number on file for user " + userId, null);
        }

        try {
            String text = truncate("[" + subject + "]\n" + body + portalLink(metadata));
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(user.getPhoneNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    text
            ).create();

            metricsConfig.recordNotification(config.channelTag(), "success");
            log.info("Twilio notification {} sent to user={}, sid={}", template, userId, message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.channelTag(), "error");
            throw new ExternalServiceException("notification",
                    "Twilio delivery to " + userId + " failed: " + e.getMessage(), e);
        }
    }

    private String truncate(String text) {
        if (text.length() <= config.getMaxBodyLength()) return text;
        return text.substring(0, config.getMaxBodyLength() - 3) + "...";
    }

    private String portalLink(Map<String, Object> metadata) {
        if (config.getPortalUrl() == null || config.getPortalUrl().isBlank()
                || metadata == null || metadata.get("caseId") == null) {
            return "";
        }
        return "\nView: " + config.getPortalUrl() + "/cases/" + metadata.get("caseId");
    }

    private String resolveNumber(String number) {
        if (config.getChannel() == TwilioNotificationConfig.Channel.WHATSAPP) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
