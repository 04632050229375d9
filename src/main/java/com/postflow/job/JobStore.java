package com.postflow.job;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory job table, in creation order. Engine thread only.
 * Terminal jobs stay until deleted.
 */
public class JobStore {

    private final Map<String, Job> jobs = new LinkedHashMap<>();

    public void add(Job job) {
        jobs.put(job.getId(), job);
    }

    public Optional<Job> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public Optional<Job> remove(String jobId) {
        return Optional.ofNullable(jobs.remove(jobId));
    }

    public List<Job> find(Predicate<Job> predicate) {
        List<Job> result = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (predicate.test(job)) {
                result.add(job);
            }
        }
        return result;
    }

    public Collection<Job> all() {
        return Collections.unmodifiableCollection(jobs.values());
    }

    public int size() {
        return jobs.size();
    }

    public long count(JobState state) {
        return jobs.values().stream().filter(job -> job.getState() == state).count();
    }
}
