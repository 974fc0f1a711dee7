package com.clinicalbatch.patientrecords.queue;

import java.util.List;

/**
 * Source of work items. Implementations may block up to waitSeconds.
 */
public interface WorkQueue {

    List<WorkItem> receive(int maxItems, int visibilitySeconds, int waitSeconds);

}
