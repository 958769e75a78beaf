package com.team.remediation.model.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Relation {

    INSTANCE_OF("instance_of"),
    CATEGORIZED_AS("categorized_as"),
    DETECTED_BY("detected_by"),
    REMEDIATES("remediates"),
    FOUND_IN("found_in"),
    SIMILAR_TO("similar_to");

    private final String wireName;

    Relation(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Relation fromWireName(String value) {
        for (Relation relation : values()) {
            if (relation.wireName.equalsIgnoreCase(value) || relation.name().equalsIgnoreCase(value)) {
                return relation;
            }
        }
        throw new IllegalArgumentException("Unknown relation: " + value);
    }
}
