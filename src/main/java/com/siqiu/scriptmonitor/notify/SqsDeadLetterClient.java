package com.siqiu.scriptmonitor.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.Map;

/**
 * Publishes notifications that exhausted their delivery attempts. The routing ids are also sent as
 * message attributes so consumers can filter by schedule or channel without parsing the body.
 */
public class SqsDeadLetterClient implements DeadLetterClient {

    static final String EVENT_TYPE = "alert-notification-exhausted";
    // keeps the body well below the SQS message size limit
    private static final int MAX_ERROR_CHARS = 4000;

    private static final Logger log = LoggerFactory.getLogger(SqsDeadLetterClient.class);

    private final SqsClient sqs;
    private final String dlqUrl;
    private final ObjectMapper mapper;

    public SqsDeadLetterClient(SqsClient sqs, String dlqName, ObjectMapper mapper) {
        this.sqs = sqs;
        this.dlqUrl = sqs.getQueueUrl(GetQueueUrlRequest.builder().queueName(dlqName).build()).queueUrl();
        this.mapper = mapper;
    }

    @Override
    public void publishDeadNotification(DeadNotificationEvent event) {
        DeadNotificationEvent bounded = event.error() != null && event.error().length() > MAX_ERROR_CHARS
                ? new DeadNotificationEvent(event.eventId(), event.ruleId(), event.scheduleId(), event.channelId(),
                        event.attempts(), event.error().substring(0, MAX_ERROR_CHARS), event.failedAt())
                : event;

        String body;
        try {
            body = mapper.writeValueAsString(bounded);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize DeadNotificationEvent", e);
        }

        sqs.sendMessage(SendMessageRequest.builder()
                .queueUrl(dlqUrl)
                .messageBody(body)
                .messageAttributes(Map.of(
                        "eventType", text(EVENT_TYPE),
                        "scheduleId", number(event.scheduleId()),
                        "ruleId", number(event.ruleId()),
                        "channelId", number(event.channelId())))
                .build());
        log.debug("dead_notification_published eventId={} channelId={}", event.eventId(), event.channelId());
    }

    private static MessageAttributeValue text(String value) {
        return MessageAttributeValue.builder().dataType("String").stringValue(value).build();
    }

    private static MessageAttributeValue number(long value) {
        return MessageAttributeValue.builder().dataType("Number").stringValue(Long.toString(value)).build();
    }
}
