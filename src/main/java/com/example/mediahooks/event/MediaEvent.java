package com.example.mediahooks.event;

import java.util.Collections;
import java.util.Map;

/**
 * A named, transient domain event with an arbitrary data tree.
 */
public record MediaEvent(String name, Map<String, Object> data) {

    public MediaEvent {
        data = data == null ? Collections.emptyMap() : data;
    }
}
