package tech.queuekit.queue;

/**
 * Attribute names shared by every {@link QueueClient} implementation.
 * Values follow the SQS naming.
 */
public final class QueueAttributes {

    /** Requests every attribute. */
    public static final String ALL = "All";

    // Queue attributes
    public static final String APPROXIMATE_NUMBER_OF_MESSAGES = "ApproximateNumberOfMessages";
    public static final String APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE = "ApproximateNumberOfMessagesNotVisible";
    public static final String APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED = "ApproximateNumberOfMessagesDelayed";
    public static final String VISIBILITY_TIMEOUT = "VisibilityTimeout";
    public static final String FIFO_QUEUE = "FifoQueue";
    public static final String REDRIVE_POLICY = "RedrivePolicy";

    // Message system attributes
    public static final String APPROXIMATE_RECEIVE_COUNT = "ApproximateReceiveCount";
    public static final String SENT_TIMESTAMP = "SentTimestamp";
    public static final String MESSAGE_GROUP_ID = "MessageGroupId";
    public static final String MESSAGE_DEDUPLICATION_ID = "MessageDeduplicationId";

    private QueueAttributes() {
    }
}
