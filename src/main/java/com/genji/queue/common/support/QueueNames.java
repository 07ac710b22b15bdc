package com.genji.queue.common.support;

/**
 * 큐 Q 에는 항상 Q.dlq 가 짝으로 붙는다. 이름을 바꾸려면 두 큐를 함께 옮겨야 한다.
 */
public final class QueueNames {

    public static final String DLQ_SUFFIX = ".dlq";

    private QueueNames() {}

    public static String deadLetterQueue(String queueName) {
        return queueName + DLQ_SUFFIX;
    }
}
