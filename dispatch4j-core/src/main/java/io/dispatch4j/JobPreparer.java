package io.dispatch4j;

import io.dispatch4j.core.Job;
import io.dispatch4j.core.RunTemplate;
import io.dispatch4j.core.TriggerSource;

import java.time.Instant;

/**
 * Creates the job record for an occurrence and makes it visible to the execution subsystem.
 * There is no separate submit step after this call.
 */
public interface JobPreparer {

    Job prepareAndEnqueue(RunTemplate runTemplate, Instant fireInstant, String executor, TriggerSource triggerSource);
}
