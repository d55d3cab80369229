package com.cx.anomaly.service;

import com.cx.anomaly.config.MetricsConfig;
import com.cx.anomaly.config.TwilioNotificationConfig;
import com.twilio.Twilio;
import com.twilio.exception.TwilioException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TwilioNotificationService implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    @Override
    public void notifyAnomalies(PredictionResult result) {
        String body = String.format(
                "[CX ANOMALY ALERT] Batch scoring flagged interactions\n" +
                "Flagged: %d of %d (%.1f%%)\n" +
                "Snapshot: v%d\n" +
                "Results: %s",
                result.anomaliesDetected(),
                result.totalRecords(),
                result.totalRecords() == 0 ? 0.0 : 100.0 * result.anomaliesDetected() / result.totalRecords(),
                result.snapshotVersion(),
                result.outputPath());
        send(body, "anomaly alert");
    }

    @Override
    public void notifyJobFailure(String job, Exception error) {
        if (!config.isNotifyOnJobFailure()) {
            log.debug("Job failure alerts disabled, not reporting {}", job);
            return;
        }
        String body = String.format(
                "[CX JOB FAILED] %s\n" +
                "Error: %s",
                job, error.getMessage());
        send(body, "failure alert for " + job);
    }

    private void send(String body, String description) {
        if (!config.isEnabled()) {
            log.debug("Twilio disabled, not sending {}", description);
            return;
        }

        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio {} sent, sid={}", description, message.getSid());
        } catch (TwilioException e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio {}: {}", description, e.getMessage(), e);
        }
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
