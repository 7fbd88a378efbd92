package com.nevis.docsearch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.nevis.docsearch.messaging.Topics;

public enum IndexAction {

    INDEX("index", Topics.DOCUMENT_INDEX, "indexing"),
    DELETE("delete", Topics.DOCUMENT_DELETE, "deletion");

    private final String wireValue;
    private final String topic;
    private final String jobKind;

    IndexAction(String wireValue, String topic, String jobKind) {
        this.wireValue = wireValue;
        this.topic = topic;
        this.jobKind = jobKind;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public String topic() {
        return topic;
    }

    public String jobKind() {
        return jobKind;
    }

    @JsonCreator
    public static IndexAction fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (IndexAction action : values()) {
            if (action.wireValue.equalsIgnoreCase(value)) {
                return action;
            }
        }
        return null;
    }

    public static IndexAction fromTopic(String topic) {
        for (IndexAction action : values()) {
            if (action.topic.equals(topic)) {
                return action;
            }
        }
        return null;
    }
}
