package org.eventrouter.destination.log;

import org.eventrouter.api.EventOrigin;
import org.eventrouter.api.EventRecord;
import org.eventrouter.api.ObjectIdentity;
import org.eventrouter.api.SubjectReference;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

class TestEvents {

    static EventRecord eventRecord(String position, String type) {
        OffsetDateTime time = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        return new EventRecord(new ObjectIdentity("test-event", "default", position), type, "Created", "Test event", 1,
                new SubjectReference("Pod", "pod-a", "default", "v1", "uid-1"), new EventOrigin("kubelet", "node-1"), time, time);
    }
}
