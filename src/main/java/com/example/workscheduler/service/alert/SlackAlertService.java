package com.example.workscheduler.service.alert;

import com.example.workscheduler.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Sends on-call alerts to Slack when the scheduler stops making progress.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:work-scheduler}")
    private String applicationName = "work-scheduler";

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert that the loop disabled itself and needs a restart.
     * Runs asynchronously so the failing tick is not delayed further.
     */
    @Async
    public void sendSchedulerDisabledAlert(String instanceId, int consecutiveErrors, String lastError) {
        if (!slackProperties.isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Scheduler on {} disabled itself but no alert was sent.", instanceId);
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildDisabledPayload(instanceId, consecutiveErrors, lastError));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for disabled scheduler on {}", instanceId);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for disabled scheduler on {}: {}", instanceId, e.getMessage(), e);
        }
    }

    Payload buildDisabledPayload(String instanceId, int consecutiveErrors, String lastError) {
        var error = lastError != null ? lastError : "Unknown error";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Work Scheduler Disabled - Restart Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title("Scheduler loop stopped after repeated tick failures")
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Instance")
                                                .value(instanceId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Consecutive Errors")
                                                .value(String.valueOf(consecutiveErrors))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(error, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Check the work store and job queue, then POST /api/v1/scheduler/start")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
