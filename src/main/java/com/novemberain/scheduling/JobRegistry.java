package com.novemberain.scheduling;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Maps job type identifiers to factories of job instances. Job definitions
 * refer to their implementation by type only, so stored jobs stay readable
 * by any node that registers the same types.
 */
public class JobRegistry {

    private final ConcurrentMap<String, Supplier<? extends Job>> factories =
            new ConcurrentHashMap<String, Supplier<? extends Job>>();

    public JobRegistry register(String jobType, Supplier<? extends Job> factory) {
        if (jobType == null || jobType.trim().isEmpty()) {
            throw new IllegalArgumentException("Job type cannot be empty.");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Job factory cannot be null.");
        }
        factories.put(jobType, factory);
        return this;
    }

    public boolean unregister(String jobType) {
        return factories.remove(jobType) != null;
    }

    public boolean isRegistered(String jobType) {
        return jobType != null && factories.containsKey(jobType);
    }

    public Set<String> getJobTypes() {
        return Collections.unmodifiableSet(new TreeSet<String>(factories.keySet()));
    }

    /**
     * Create a fresh job instance of the given type.
     *
     * @throws ObjectNotFoundException when no factory is registered for the type
     * @throws SchedulerException when the factory fails
     */
    public Job newJob(String jobType) throws SchedulerException {
        Supplier<? extends Job> factory = jobType == null ? null : factories.get(jobType);
        if (factory == null) {
            throw new ObjectNotFoundException("No job type registered as '" + jobType + "'");
        }
        Job job;
        try {
            job = factory.get();
        } catch (RuntimeException e) {
            throw new SchedulerException("Problem instantiating job of type '" + jobType + "'", e);
        }
        if (job == null) {
            throw new SchedulerException("Factory for job type '" + jobType + "' returned null");
        }
        return job;
    }
}
