/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.common.exception;

public class TopicNotFoundException extends TransportException {
    private final String topic;

    public TopicNotFoundException(String topic, Throwable cause) {
        super("APL_TOPIC_NOT_FOUND", "Topic does not exist: " + topic, cause);
        this.topic = topic;
    }

    public String getTopic() { return topic; }
}
