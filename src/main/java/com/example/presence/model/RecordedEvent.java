package com.example.presence.model;

import lombok.Value;

@Value
public class RecordedEvent {

    Long eventId;
    // true when an event for the same student and timestamp already existed
    boolean duplicate;
}
