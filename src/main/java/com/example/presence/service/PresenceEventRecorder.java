package com.example.presence.service;

import com.example.presence.model.EventRecord;
import com.example.presence.model.RecordedEvent;

/**
 * Persists the outcome of a presence check immutably.
 * Recording the same student and timestamp twice returns the first event.
 */
public interface PresenceEventRecorder {

    RecordedEvent record(EventRecord record);
}
