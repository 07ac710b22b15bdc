package com.genji.queue.usecase.deadletter;

import java.nio.charset.StandardCharsets;

final class DeadLetterAlertFormatter {

    static final String TRUNCATED_MARK = "\n...(truncated)";

    private DeadLetterAlertFormatter() {}

    static String format(String dlqName, byte[] body, int bodyLimit) {
        String text = new String(body, StandardCharsets.UTF_8);
        if (text.length() > bodyLimit) {
            text = text.substring(0, bodyLimit) + TRUNCATED_MARK;
        }
        return "### " + dlqName + "\n```json\n" + text + "```";
    }
}
