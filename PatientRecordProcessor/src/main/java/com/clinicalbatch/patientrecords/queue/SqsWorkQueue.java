package com.clinicalbatch.patientrecords.queue;

import com.clinicalbatch.patientrecords.config.WorkerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;

import java.util.List;

/**
 * {@link WorkQueue} backed by an SQS queue looked up by name.
 * The queue URL is resolved on first use and cached.
 */
@Slf4j
@Component
public class SqsWorkQueue implements WorkQueue {

    private final SqsClient sqsClient;
    private final String queueName;

    private volatile String queueUrl;

    public SqsWorkQueue(SqsClient sqsClient, WorkerProperties props) {
        this.sqsClient = sqsClient;
        this.queueName = props.getQueueName();
    }

    @Override
    public List<WorkItem> receive(int maxItems, int visibilitySeconds, int waitSeconds) {
        String url = queueUrl();

        ReceiveMessageRequest request = ReceiveMessageRequest.builder()
            .queueUrl(url)
            .maxNumberOfMessages(maxItems)
            .visibilityTimeout(visibilitySeconds)
            .waitTimeSeconds(waitSeconds)
            .attributeNamesWithStrings(MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT.toString())
            .build();

        List<Message> messages = sqsClient.receiveMessage(request).messages();
        log.debug("Received {} message(s) from {}", messages.size(), queueName);

        return messages.stream()
            .<WorkItem>map(m -> new SqsWorkItem(sqsClient, url, m))
            .toList();
    }

    String queueUrl() {
        String url = queueUrl;
        if (url == null) {
            url = sqsClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(queueName).build()).queueUrl();
            queueUrl = url;
            log.info("Resolved queue {} to {}", queueName, url);
        }
        return url;
    }

}
