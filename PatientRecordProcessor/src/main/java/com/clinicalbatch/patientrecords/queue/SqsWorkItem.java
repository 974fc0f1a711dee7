package com.clinicalbatch.patientrecords.queue;

import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;

/**
 * {@link WorkItem} wrapping a received SQS message and its receipt handle.
 */
class SqsWorkItem implements WorkItem {

    private final SqsClient sqsClient;
    private final String queueUrl;
    private final Message message;

    SqsWorkItem(SqsClient sqsClient, String queueUrl, Message message) {
        this.sqsClient = sqsClient;
        this.queueUrl = queueUrl;
        this.message = message;
    }

    @Override
    public String messageId() {
        return message.messageId();
    }

    @Override
    public String body() {
        return message.body();
    }

    @Override
    public int receiveCount() {
        String count = message.attributes().get(MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT);
        if (count == null) {
            return 0;
        }
        try {
            return Integer.parseInt(count);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public void acknowledge() {
        sqsClient.deleteMessage(DeleteMessageRequest.builder()
            .queueUrl(queueUrl)
            .receiptHandle(message.receiptHandle())
            .build());
    }

    @Override
    public void setVisibility(int seconds) {
        sqsClient.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
            .queueUrl(queueUrl)
            .receiptHandle(message.receiptHandle())
            .visibilityTimeout(seconds)
            .build());
    }

}
